package org.javai.jsonui.form;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.jsonui.expr.ExpressionResolver;
import org.javai.jsonui.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class FieldValidatorTest {

	private final FieldValidator validator = new FieldValidator();
	private final Map<String, Object> state = Map.of("password", "secret1", "agree", false);

	private boolean passes(ValidationCheck check, Object value) {
		return validator.validate(FieldValidation.of(check), value, state).valid();
	}

	@Test
	void required() {
		assertThat(passes(ValidationCheck.required(), "x")).isTrue();
		assertThat(passes(ValidationCheck.required(), "   ")).isFalse();
		assertThat(passes(ValidationCheck.required(), null)).isFalse();
		assertThat(passes(ValidationCheck.required(), List.of())).isFalse();
		assertThat(passes(ValidationCheck.required(), 0)).isTrue();
		assertThat(passes(ValidationCheck.required(), false)).isTrue();
	}

	@Test
	void email() {
		assertThat(passes(ValidationCheck.email(), "ada@example.com")).isTrue();
		assertThat(passes(ValidationCheck.email(), "ada@example")).isFalse();
		assertThat(passes(ValidationCheck.email(), "a da@example.com")).isFalse();
	}

	@Test
	void lengths() {
		assertThat(passes(ValidationCheck.minLength(3), "abc")).isTrue();
		assertThat(passes(ValidationCheck.minLength(3), "ab")).isFalse();
		assertThat(passes(ValidationCheck.maxLength(3), "abcd")).isFalse();
		assertThat(passes(ValidationCheck.maxLength(3), 12)).isFalse();
	}

	@Test
	void patternSearchesAnywhere() {
		assertThat(passes(ValidationCheck.pattern("\\d", "needs a digit"), "abc1")).isTrue();
		assertThat(passes(ValidationCheck.pattern("\\d", "needs a digit"), "abc")).isFalse();
		assertThat(passes(ValidationCheck.pattern("(", "broken"), "abc")).isFalse();
	}

	@Test
	void numericBounds() {
		assertThat(passes(ValidationCheck.min(18), 18)).isTrue();
		assertThat(passes(ValidationCheck.min(18), 17.5)).isFalse();
		assertThat(passes(ValidationCheck.max(10), 10L)).isTrue();
		assertThat(passes(ValidationCheck.max(10), "5")).isFalse();
	}

	@Test
	void numericAcceptsNumbersAndNumericStrings() {
		ValidationCheck numeric = new ValidationCheck("numeric", null, "Must be a number");
		assertThat(passes(numeric, 3)).isTrue();
		assertThat(passes(numeric, "42")).isTrue();
		assertThat(passes(numeric, "-1.5e3")).isTrue();
		assertThat(passes(numeric, "abc")).isFalse();
		assertThat(passes(numeric, Double.NaN)).isFalse();
	}

	@Test
	void url() {
		assertThat(passes(ValidationCheck.url(), "https://example.com/a?b=c")).isTrue();
		assertThat(passes(ValidationCheck.url(), "example.com")).isFalse();
		assertThat(passes(ValidationCheck.url(), "not a url")).isFalse();
	}

	@Test
	void matchesComparesAgainstResolvedStateArgument() {
		assertThat(passes(ValidationCheck.matches("/password"), "secret1")).isTrue();
		assertThat(passes(ValidationCheck.matches("/password"), "secret2")).isFalse();
	}

	@Test
	void collectsMessagesOfFailingChecksInOrder() {
		FieldValidation validation = FieldValidation.of(ValidationCheck.required(), ValidationCheck.email(),
				ValidationCheck.minLength(20));

		FieldValidationResult result = validator.validate(validation, "bad", state);

		assertThat(result.valid()).isFalse();
		assertThat(result.errors()).containsExactly("Invalid email address", "Must be at least 20 characters");
		assertThat(result.checks()).extracting(CheckResult::fn).containsExactly("required", "email", "minLength");
	}

	@Test
	void disabledValidationIsSkipped() {
		FieldValidation validation = new FieldValidation(List.of(ValidationCheck.required()), Map.of("$state", "/agree"));
		FieldValidationResult result = validator.validate(validation, null, state);
		assertThat(result.valid()).isTrue();
		assertThat(result.checks()).isEmpty();
	}

	@Test
	void customFunctionsAreUsedButCannotShadowBuiltIns() {
		FieldValidator custom = new FieldValidator(new ExpressionResolver(), Map.of(
				"even", (value, args) -> value instanceof Number n && n.intValue() % 2 == 0,
				"required", (value, args) -> true));

		assertThat(custom.validate(FieldValidation.of(new ValidationCheck("even", null, "odd")), 4, state).valid()).isTrue();
		assertThat(custom.validate(FieldValidation.of(new ValidationCheck("even", null, "odd")), 3, state).valid()).isFalse();
		assertThat(custom.validate(FieldValidation.of(ValidationCheck.required()), null, state).valid()).isFalse();
	}

	@Test
	void unknownFunctionPassesAndThrowingFunctionFails() {
		FieldValidator custom = new FieldValidator(new ExpressionResolver(), Map.of(
				"explodes", (value, args) -> {
					throw new IllegalStateException("nope");
				}));

		try (LogCaptorAppender logs = LogCaptorAppender.create(FieldValidator.class, Level.WARN)) {
			assertThat(custom.validate(FieldValidation.of(new ValidationCheck("mystery", null, "m")), "x", state).valid()).isTrue();
			assertThat(custom.validate(FieldValidation.of(new ValidationCheck("explodes", null, "e")), "x", state).valid()).isFalse();
			assertThat(logs.messagesAt(Level.WARN)).hasSize(2);
		}
	}

	@Test
	void readsDeclarativeForm() {
		FieldValidation validation = FieldValidation.fromValue(Map.of(
				"checks", List.of(
						Map.of("fn", "required", "message", "Name is required"),
						Map.of("fn", "maxLength", "args", Map.of("max", 5), "message", "Too long"),
						Map.of("noFn", true))));

		assertThat(validation.checks()).hasSize(2);
		assertThat(validator.validate(validation, "Alexander", state).errors()).containsExactly("Too long");
	}
}
