package org.javai.jsonui.expr;

/**
 * The item currently being rendered by a repeated node.
 *
 * @param item the array element
 * @param index its position in the array
 * @param basePath absolute state pointer of the element, e.g. {@code /todos/2}
 * @param key stable identity: the item's key field when configured, otherwise the index
 */
public record RepeatScope(Object item, int index, String basePath, Object key) {

	public RepeatScope {
		if (index < 0) {
			throw new IllegalArgumentException("index must be >= 0");
		}
		basePath = basePath != null ? basePath : "";
		key = key != null ? key : index;
	}

	public RepeatScope(Object item, int index, String basePath) {
		this(item, index, basePath, null);
	}
}
