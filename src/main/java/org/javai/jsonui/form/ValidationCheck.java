package org.javai.jsonui.form;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One rule applied to a field.
 *
 * @param fn name of a built-in or registered {@link ValidationFunction}
 * @param args argument expressions (e.g. {@code {"other": {"$state": "/form/password"}}})
 * @param message error shown when the check fails
 */
public record ValidationCheck(String fn, Map<String, Object> args, String message) {

	public ValidationCheck {
		if (fn == null || fn.isBlank()) {
			throw new IllegalArgumentException("fn must not be blank");
		}
		args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
		message = message != null ? message : "";
	}

	public static ValidationCheck required() {
		return new ValidationCheck("required", null, "This field is required");
	}

	public static ValidationCheck email() {
		return new ValidationCheck("email", null, "Invalid email address");
	}

	public static ValidationCheck minLength(int min) {
		return new ValidationCheck("minLength", Map.of("min", min), "Must be at least " + min + " characters");
	}

	public static ValidationCheck maxLength(int max) {
		return new ValidationCheck("maxLength", Map.of("max", max), "Must be at most " + max + " characters");
	}

	public static ValidationCheck pattern(String pattern, String message) {
		return new ValidationCheck("pattern", Map.of("pattern", pattern), message);
	}

	public static ValidationCheck min(Number min) {
		return new ValidationCheck("min", Map.of("min", min), "Must be at least " + min);
	}

	public static ValidationCheck max(Number max) {
		return new ValidationCheck("max", Map.of("max", max), "Must be at most " + max);
	}

	public static ValidationCheck url() {
		return new ValidationCheck("url", null, "Invalid URL");
	}

	/**
	 * The field must equal the value at {@code otherPath}.
	 */
	public static ValidationCheck matches(String otherPath) {
		return new ValidationCheck("matches", Map.of("other", Map.of("$state", otherPath)), "Fields must match");
	}

	static ValidationCheck fromValue(Object raw) {
		if (!(raw instanceof Map<?, ?> map) || !(map.get("fn") instanceof String fn) || fn.isBlank()) {
			return null;
		}
		Map<String, Object> args = new LinkedHashMap<>();
		if (map.get("args") instanceof Map<?, ?> rawArgs) {
			rawArgs.forEach((k, v) -> args.put(String.valueOf(k), v));
		}
		Object message = map.get("message");
		return new ValidationCheck(fn, args, message != null ? String.valueOf(message) : null);
	}
}
