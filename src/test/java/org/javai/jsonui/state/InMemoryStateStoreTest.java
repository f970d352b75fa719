package org.javai.jsonui.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.Level;
import org.javai.jsonui.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class InMemoryStateStoreTest {

	@Test
	void readsSeededStateAndMissingPathsAsNull() {
		InMemoryStateStore store = new InMemoryStateStore(Map.of("user", Map.of("name", "Ada")));
		assertThat(store.get("/user/name")).isEqualTo("Ada");
		assertThat(store.get("/user/email")).isNull();
	}

	@Test
	void seedsFromPointerEntries() {
		Map<String, Object> entries = new LinkedHashMap<>();
		entries.put("/user/name", "Ada");
		entries.put("/todos/0", "write tests");
		InMemoryStateStore store = InMemoryStateStore.fromPointers(entries);

		assertThat(store.get("/user/name")).isEqualTo("Ada");
		assertThat(store.get("/todos")).isEqualTo(List.of("write tests"));
	}

	@Test
	void snapshotIsImmutableAndStableAcrossWrites() {
		InMemoryStateStore store = new InMemoryStateStore(Map.of("count", 1));
		Map<String, Object> before = store.getSnapshot();

		store.set("/count", 2);

		assertThat(before).containsEntry("count", 1);
		assertThat(store.getSnapshot()).containsEntry("count", 2);
		assertThatThrownBy(() -> before.put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void valueIsCopiedOnWrite() {
		InMemoryStateStore store = new InMemoryStateStore();
		List<Object> items = new ArrayList<>(List.of("a"));
		store.set("/items", items);
		items.add("b");
		assertThat(store.get("/items")).isEqualTo(List.of("a"));
	}

	@Test
	void updateNotifiesOnceWithAllChanges() {
		InMemoryStateStore store = new InMemoryStateStore();
		List<StateChangeEvent> events = new ArrayList<>();
		store.subscribe(events::add);

		Map<String, Object> changes = new LinkedHashMap<>();
		changes.put("/a", 1);
		changes.put("/b/c", "x");
		store.update(changes);

		assertThat(events).hasSize(1);
		StateChangeEvent event = events.get(0);
		assertThat(event.changes()).extracting(StateChange::path).containsExactly("/a", "/b/c");
		assertThat(event.previous()).isEmpty();
		assertThat(event.current()).containsEntry("a", 1);
		assertThat(event.touches("/b")).isTrue();
		assertThat(event.touches("/z")).isFalse();
	}

	@Test
	void unchangedWritesAreElided() {
		InMemoryStateStore store = new InMemoryStateStore(Map.of("n", 1));
		List<StateChangeEvent> events = new ArrayList<>();
		store.subscribe(events::add);

		store.set("/n", 1L);
		store.set("/missing", null);

		assertThat(events).isEmpty();
	}

	@Test
	void rootWriteIsIgnoredWithWarning() {
		InMemoryStateStore store = new InMemoryStateStore(Map.of("keep", true));
		try (LogCaptorAppender logs = LogCaptorAppender.create(InMemoryStateStore.class, Level.WARN)) {
			store.set("/", Map.of("replaced", true));
			assertThat(logs.messagesAt(Level.WARN)).anyMatch(m -> m.contains("document root"));
		}
		assertThat(store.getSnapshot()).containsOnlyKeys("keep");
	}

	@Test
	void unsubscribedListenerIsNotCalled() {
		InMemoryStateStore store = new InMemoryStateStore();
		List<StateChangeEvent> events = new ArrayList<>();
		Subscription subscription = store.subscribe(events::add);
		store.set("/a", 1);
		subscription.unsubscribe();
		subscription.unsubscribe();
		store.set("/a", 2);
		assertThat(events).hasSize(1);
	}

	@Test
	void failingListenerDoesNotStopOthers() {
		InMemoryStateStore store = new InMemoryStateStore();
		List<StateChangeEvent> events = new ArrayList<>();
		store.subscribe(e -> {
			throw new IllegalStateException("boom");
		});
		store.subscribe(events::add);

		try (LogCaptorAppender logs = LogCaptorAppender.create(InMemoryStateStore.class, Level.WARN)) {
			store.set("/a", 1);
			assertThat(logs.messagesAt(Level.WARN)).anyMatch(m -> m.contains("boom"));
		}
		assertThat(events).hasSize(1);
		assertThat(store.get("/a")).isEqualTo(1);
	}

	@Test
	void concurrentWritersDoNotLoseUpdates() throws Exception {
		InMemoryStateStore store = new InMemoryStateStore();
		int writers = 8;
		ExecutorService pool = Executors.newFixedThreadPool(writers);
		CountDownLatch start = new CountDownLatch(1);
		try {
			for (int i = 0; i < writers; i++) {
				String path = "/slot" + i;
				pool.submit(() -> {
					start.await();
					for (int n = 1; n <= 100; n++) {
						store.set(path, n);
					}
					return null;
				});
			}
			start.countDown();
			pool.shutdown();
			assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
		}
		finally {
			pool.shutdownNow();
		}
		for (int i = 0; i < writers; i++) {
			assertThat(store.get("/slot" + i)).isEqualTo(100);
		}
	}
}
