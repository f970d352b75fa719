package org.javai.jsonui.state;

import java.util.List;
import java.util.Map;

/**
 * Notification delivered to {@link StateListener}s after a {@code set} or {@code update}.
 *
 * @param changes writes that altered the document, in application order (never empty)
 * @param previous snapshot before the writes
 * @param current snapshot after the writes
 */
public record StateChangeEvent(
		List<StateChange> changes,
		Map<String, Object> previous,
		Map<String, Object> current
) {

	public StateChangeEvent {
		changes = changes != null ? List.copyOf(changes) : List.of();
		previous = previous != null ? previous : Map.of();
		current = current != null ? current : Map.of();
	}

	/**
	 * True when a change was written at {@code path}, above it, or beneath it.
	 */
	public boolean touches(String path) {
		for (StateChange change : changes) {
			if (JsonPointer.isSameOrDescendant(change.path(), path)
					|| JsonPointer.isSameOrDescendant(path, change.path())) {
				return true;
			}
		}
		return false;
	}
}
