package org.javai.jsonui.state;

import java.util.Map;

/**
 * Path-addressed JSON-like document holding application data.
 *
 * <p>Paths are JSON Pointers ({@code /customers/0/name}). Reads of a missing path return
 * {@code null}. Writes create intermediate containers as needed and never throw on a
 * non-container prefix: the prefix is replaced by a fresh container.</p>
 *
 * <p>Every write that changes the document notifies subscribers once with the list of
 * changes actually applied. Writes that leave the value unchanged are elided.</p>
 */
public interface StateStore {

	Object get(String path);

	void set(String path, Object value);

	/**
	 * Apply several writes as one observable change. Entries are applied in iteration order.
	 */
	void update(Map<String, ?> changes);

	/**
	 * Deeply unmodifiable view of the whole document. Never {@code null}.
	 */
	Map<String, Object> getSnapshot();

	Subscription subscribe(StateListener listener);
}
