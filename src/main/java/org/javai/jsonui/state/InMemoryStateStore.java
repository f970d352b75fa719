package org.javai.jsonui.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copy-on-write {@link StateStore}.
 *
 * <p>Writers are serialised; readers see whichever immutable snapshot was current when they
 * asked and never a half-applied {@code update}. Listeners run on the writing thread after
 * the new snapshot is published.</p>
 */
public class InMemoryStateStore implements StateStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryStateStore.class);

	private final Object writeLock = new Object();
	private final List<StateListener> listeners = new CopyOnWriteArrayList<>();
	private volatile Map<String, Object> state;

	public InMemoryStateStore() {
		this(Map.of());
	}

	public InMemoryStateStore(Map<String, ?> initialState) {
		this.state = JsonValues.freezeMap(initialState);
	}

	/**
	 * Seed a store from pointer → value entries, e.g. {@code {"/user/name": "Ada"}}.
	 */
	public static InMemoryStateStore fromPointers(Map<String, ?> entries) {
		Object root = Map.of();
		for (Map.Entry<String, ?> entry : entries.entrySet()) {
			root = JsonValues.setIn(root, JsonPointer.parse(entry.getKey()), entry.getValue(), false);
		}
		@SuppressWarnings("unchecked")
		Map<String, Object> seeded = (Map<String, Object>) root;
		return new InMemoryStateStore(seeded);
	}

	@Override
	public Object get(String path) {
		return JsonValues.get(state, path);
	}

	@Override
	public void set(String path, Object value) {
		Map<String, Object> single = new LinkedHashMap<>();
		single.put(path, value);
		update(single);
	}

	@Override
	public void update(Map<String, ?> changes) {
		Objects.requireNonNull(changes, "changes must not be null");
		Map<String, Object> previous;
		Map<String, Object> current;
		List<StateChange> applied = new ArrayList<>();
		synchronized (writeLock) {
			previous = state;
			Object working = previous;
			for (Map.Entry<String, ?> entry : changes.entrySet()) {
				List<String> segments = JsonPointer.parse(entry.getKey());
				if (segments.isEmpty()) {
					logger.warn("Ignoring state write to the document root: {}", entry.getKey());
					continue;
				}
				Object existing = JsonValues.getIn(working, segments);
				// null and absent are the same value here
				if (JsonValues.jsonEquals(existing, entry.getValue())) {
					continue;
				}
				working = JsonValues.setIn(working, segments, entry.getValue(), false);
				applied.add(new StateChange(JsonPointer.format(segments), JsonValues.freeze(entry.getValue())));
			}
			if (applied.isEmpty()) {
				return;
			}
			@SuppressWarnings("unchecked")
			Map<String, Object> next = (Map<String, Object>) working;
			state = next;
			current = next;
		}
		logger.debug("Applied {} state change(s)", applied.size());
		StateChangeEvent event = new StateChangeEvent(applied, previous, current);
		for (StateListener listener : listeners) {
			try {
				listener.onChange(event);
			}
			catch (RuntimeException ex) {
				logger.warn("State listener {} failed: {}", listener, ex.getMessage(), ex);
			}
		}
	}

	@Override
	public Map<String, Object> getSnapshot() {
		return state;
	}

	@Override
	public Subscription subscribe(StateListener listener) {
		Objects.requireNonNull(listener, "listener must not be null");
		listeners.add(listener);
		return () -> listeners.remove(listener);
	}
}
