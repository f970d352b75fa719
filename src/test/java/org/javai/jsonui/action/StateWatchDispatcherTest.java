package org.javai.jsonui.action;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.Level;
import org.javai.jsonui.spec.Spec;
import org.javai.jsonui.spec.UiNode;
import org.javai.jsonui.state.InMemoryStateStore;
import org.javai.jsonui.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StateWatchDispatcherTest {

	private InMemoryStateStore store;
	private ActionDispatcher dispatcher;
	private List<Object> lookups;

	@BeforeEach
	void setup() {
		store = new InMemoryStateStore(Map.of("country", "FR", "city", "Paris"));
		lookups = new ArrayList<>();
		dispatcher = ActionDispatcher.builder()
				.withStateStore(store)
				.handler("loadCities", (params, ctx) -> {
					lookups.add(params.get("country"));
					return CompletableFuture.completedFuture(null);
				})
				.build();
	}

	private static Spec specWithWatch(Map<String, Object> watch) {
		UiNode select = UiNode.of("Select", Map.of(), List.of()).withWatch(watch);
		return new Spec("select", Map.of("select", select), null);
	}

	@Test
	void firesBindingsWhenWatchedValueChanges() {
		Spec spec = specWithWatch(Map.of("/country", List.of(
				Map.of("action", "setState", "params", Map.of("statePath", "/city", "value", "")),
				Map.of("action", "loadCities", "params", Map.of("country", Map.of("$state", "/country"))))));

		try (StateWatchDispatcher watcher = new StateWatchDispatcher(spec, dispatcher).start()) {
			store.set("/country", "DE");
		}

		assertThat(store.get("/city")).isEqualTo("");
		assertThat(lookups).containsExactly("DE");
	}

	@Test
	void ignoresUnrelatedAndUnchangedWrites() {
		Spec spec = specWithWatch(Map.of("/country", Map.of("action", "loadCities")));

		try (StateWatchDispatcher watcher = new StateWatchDispatcher(spec, dispatcher).start()) {
			store.set("/city", "Lyon");
			store.set("/country", "FR");
		}

		assertThat(lookups).isEmpty();
	}

	@Test
	void watchesNestedValuesByPath() {
		store.set("/filters", Map.of("region", "north"));
		Spec spec = specWithWatch(Map.of("/filters/region", Map.of("action", "loadCities")));

		try (StateWatchDispatcher watcher = new StateWatchDispatcher(spec, dispatcher).start()) {
			store.set("/filters", Map.of("region", "south"));
		}

		assertThat(lookups).hasSize(1);
	}

	@Test
	void stopsFiringAfterClose() {
		Spec spec = specWithWatch(Map.of("/country", Map.of("action", "loadCities")));
		StateWatchDispatcher watcher = new StateWatchDispatcher(spec, dispatcher).start();
		watcher.close();

		store.set("/country", "IT");

		assertThat(lookups).isEmpty();
	}

	@Test
	void updatedSpecTakesEffect() {
		StateWatchDispatcher watcher = new StateWatchDispatcher(specWithWatch(Map.of()), dispatcher).start();
		try {
			store.set("/country", "ES");
			watcher.updateSpec(specWithWatch(Map.of("/country", Map.of("action", "loadCities"))));
			store.set("/country", "PT");
		}
		finally {
			watcher.close();
		}
		assertThat(lookups).hasSize(1);
	}

	@Test
	void failingWatchActionIsLogged() {
		dispatcher.registerHandler("explode", (params, ctx) -> CompletableFuture.failedFuture(new IllegalStateException("kaboom")));
		Spec spec = specWithWatch(Map.of("/country", Map.of("action", "explode")));

		try (LogCaptorAppender logs = LogCaptorAppender.create(StateWatchDispatcher.class, Level.WARN);
				StateWatchDispatcher watcher = new StateWatchDispatcher(spec, dispatcher).start()) {
			store.set("/country", "NL");
			assertThat(logs.messagesAt(Level.WARN)).anyMatch(m -> m.contains("kaboom"));
		}
	}
}
