package org.javai.jsonui.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.jsonui.state.JsonPointer;
import org.javai.jsonui.state.JsonValues;

/**
 * Expands a repeated node's source array into one {@link RepeatScope} per element.
 */
public final class RepeatScopes {

	private RepeatScopes() {
	}

	/**
	 * @param statePath pointer to the array being repeated
	 * @param keyField optional field of each item used as its key
	 * @param state snapshot to read from
	 * @return scopes in array order; empty when the path does not hold an array
	 */
	public static List<RepeatScope> expand(String statePath, String keyField, Map<String, Object> state) {
		Object source = JsonValues.get(state, statePath);
		if (!(source instanceof List<?> items)) {
			return List.of();
		}
		String base = JsonPointer.format(JsonPointer.parse(statePath));
		List<RepeatScope> scopes = new ArrayList<>(items.size());
		for (int i = 0; i < items.size(); i++) {
			Object item = items.get(i);
			Object key = null;
			if (keyField != null && item instanceof Map<?, ?> fields) {
				key = fields.get(keyField);
			}
			scopes.add(new RepeatScope(item, i, base + "/" + i, key));
		}
		return scopes;
	}
}
