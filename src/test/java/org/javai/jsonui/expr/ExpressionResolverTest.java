package org.javai.jsonui.expr;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.jsonui.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExpressionResolverTest {

	private ExpressionResolver resolver;
	private Map<String, Object> state;

	@BeforeEach
	void setup() {
		resolver = new ExpressionResolver();
		state = Map.of(
				"user", Map.of("name", "Ada", "role", "admin"),
				"count", 5,
				"todos", List.of(Map.of("id", "t1", "title", "first", "done", false),
						Map.of("id", "t2", "title", "second", "done", true)),
				"dark", true);
	}

	@Test
	void literalsResolveToThemselves() {
		ResolutionContext ctx = ResolutionContext.of(state);
		assertThat(resolver.resolve("plain", ctx)).isEqualTo("plain");
		assertThat(resolver.resolve(42, ctx)).isEqualTo(42);
		assertThat(resolver.resolve(null, ctx)).isNull();
	}

	@Test
	void stateReferencesReadTheSnapshot() {
		ResolutionContext ctx = ResolutionContext.of(state);
		assertThat(resolver.resolve(Map.of("$state", "/user/name"), ctx)).isEqualTo("Ada");
		assertThat(resolver.resolve(Map.of("$state", "/user/missing"), ctx)).isNull();
	}

	@Test
	void itemAndIndexResolveWithinScope() {
		List<RepeatScope> scopes = RepeatScopes.expand("/todos", "id", state);
		ResolutionContext ctx = ResolutionContext.of(state).withScope(scopes.get(1));

		assertThat(resolver.resolve(Map.of("$item", "title"), ctx)).isEqualTo("second");
		assertThat(resolver.resolve(Map.of("$index", true), ctx)).isEqualTo(1);
		assertThat(scopes.get(1).key()).isEqualTo("t2");
		assertThat(scopes.get(1).basePath()).isEqualTo("/todos/1");
	}

	@Test
	void itemOutsideScopeIsNull() {
		ResolutionContext ctx = ResolutionContext.of(state);
		assertThat(resolver.resolve(Map.of("$item", "title"), ctx)).isNull();
		assertThat(resolver.resolve(Map.of("$index", true), ctx)).isNull();
	}

	@Test
	void conditionalPicksBranch() {
		Map<String, Object> expr = Map.of("$cond", Map.of("$state", "/dark"), "$then", "black", "$else", "white");
		assertThat(resolver.resolve(expr, ResolutionContext.of(state))).isEqualTo("black");
		assertThat(resolver.resolve(expr, ResolutionContext.of(Map.of("dark", false)))).isEqualTo("white");
	}

	@Test
	void computedFunctionReceivesResolvedArgs() {
		ComputedFunction greet = args -> "Hello, " + args.get("name");
		ResolutionContext ctx = ResolutionContext.of(state, Map.of("greet", greet));

		Object value = resolver.resolve(Map.of("$computed", "greet", "args", Map.of("name", Map.of("$state", "/user/name"))), ctx);

		assertThat(value).isEqualTo("Hello, Ada");
	}

	@Test
	void unknownOrFailingComputedFunctionYieldsNull() {
		ComputedFunction broken = args -> {
			throw new IllegalStateException("bad input");
		};
		ResolutionContext ctx = ResolutionContext.of(state, Map.of("broken", broken));

		try (LogCaptorAppender logs = LogCaptorAppender.create(ExpressionResolver.class, Level.WARN)) {
			assertThat(resolver.resolve(Map.of("$computed", "nope"), ctx)).isNull();
			assertThat(resolver.resolve(Map.of("$computed", "broken"), ctx)).isNull();
			assertThat(logs.messagesAt(Level.WARN))
					.anyMatch(m -> m.contains("Unknown computed function 'nope'"))
					.anyMatch(m -> m.contains("bad input"));
		}
	}

	@Test
	void comparisons() {
		ResolutionContext ctx = ResolutionContext.of(state);
		assertThat(resolver.evaluate(Map.of("$state", "/count", "gt", 3), ctx)).isTrue();
		assertThat(resolver.evaluate(Map.of("$state", "/count", "lte", 4), ctx)).isFalse();
		assertThat(resolver.evaluate(Map.of("$state", "/count", "eq", 5.0), ctx)).isTrue();
		assertThat(resolver.evaluate(Map.of("$state", "/user/role", "neq", "guest"), ctx)).isTrue();
		assertThat(resolver.evaluate(Map.of("$state", "/user/role", "gt", 1), ctx)).isFalse();
	}

	@Test
	void comparisonOperandMayReferenceState() {
		Map<String, Object> withLimit = new LinkedHashMap<>(state);
		withLimit.put("limit", 5);
		ResolutionContext ctx = ResolutionContext.of(withLimit);
		assertThat(resolver.evaluate(Map.of("$state", "/count", "gte", Map.of("$state", "/limit")), ctx)).isTrue();
	}

	@Test
	void logicalCombinators() {
		ResolutionContext ctx = ResolutionContext.of(state);
		assertThat(resolver.evaluate(List.of(Map.of("$state", "/dark"), Map.of("$state", "/count")), ctx)).isTrue();
		assertThat(resolver.evaluate(Map.of("$and", List.of(true, Map.of("$state", "/missing"))), ctx)).isFalse();
		assertThat(resolver.evaluate(Map.of("$or", List.of(false, Map.of("$state", "/dark"))), ctx)).isTrue();
		assertThat(resolver.evaluate(Map.of("$state", "/dark", "not", true), ctx)).isFalse();
		assertThat(resolver.evaluate(null, ctx)).isTrue();
	}

	@Test
	void resolvePropsResolvesNestedStructures() {
		Map<String, Object> props = new LinkedHashMap<>();
		props.put("title", Map.of("$state", "/user/name"));
		props.put("items", List.of("static", Map.of("$state", "/count")));
		props.put("style", Map.of("color", Map.of("$cond", true, "$then", "red", "$else", "blue")));

		Map<String, Object> resolved = resolver.resolveProps(props, ResolutionContext.of(state));

		assertThat(resolved)
				.containsEntry("title", "Ada")
				.containsEntry("items", List.of("static", 5))
				.containsEntry("style", Map.of("color", "red"));
	}

	@Test
	void bindingFormsResolveToCurrentValueAndExposeWritePaths() {
		RepeatScope scope = RepeatScopes.expand("/todos", null, state).get(0);
		ResolutionContext ctx = ResolutionContext.of(state).withScope(scope);
		Map<String, Object> props = new LinkedHashMap<>();
		props.put("value", Map.of("$bindState", "user/name"));
		props.put("checked", Map.of("$bindItem", "done"));
		props.put("label", "static");

		assertThat(resolver.resolveProps(props, ctx)).containsEntry("value", "Ada").containsEntry("checked", false);
		assertThat(resolver.resolveBindings(props, ctx))
				.containsExactly(Map.entry("value", "/user/name"), Map.entry("checked", "/todos/0/done"));
	}

	@Test
	void itemBindingOutsideScopeIsSkipped() {
		Map<String, Object> props = Map.of("checked", Map.of("$bindItem", "done"));
		assertThat(resolver.resolveBindings(props, ResolutionContext.of(state))).isEmpty();
	}

	@Test
	void repeatOverNonArrayIsEmpty() {
		assertThat(RepeatScopes.expand("/count", null, state)).isEmpty();
		assertThat(RepeatScopes.expand("/missing", null, state)).isEmpty();
	}

	@Test
	void interpolatesStatePlaceholders() {
		assertThat(StringInterpolator.interpolate("Delete ${/user/name}? ${/nothing}", state)).isEqualTo("Delete Ada? ");
		assertThat(StringInterpolator.interpolate("no placeholders", state)).isEqualTo("no placeholders");
	}
}
