package org.javai.jsonui.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param valid true when no field reported an error
 * @param errors error messages by field state path; fields without errors are absent
 */
public record FormValidationResult(boolean valid, Map<String, List<String>> errors) {

	public FormValidationResult {
		Map<String, List<String>> copy = new LinkedHashMap<>();
		if (errors != null) {
			errors.forEach((path, messages) -> copy.put(path, List.copyOf(messages)));
		}
		errors = Collections.unmodifiableMap(copy);
	}

	public static FormValidationResult ok() {
		return new FormValidationResult(true, Map.of());
	}

	/**
	 * The shape written into state: {@code {"valid": ..., "errors": {...}}}.
	 */
	public Map<String, Object> toStateValue() {
		Map<String, Object> value = new LinkedHashMap<>();
		value.put("valid", valid);
		value.put("errors", new LinkedHashMap<>(errors));
		return value;
	}
}
