package org.javai.jsonui.form;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.javai.jsonui.state.JsonValues;

/**
 * Validation functions available to every form without registration.
 */
public final class BuiltInValidationFunctions {

	private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
	private static final Pattern NUMERIC_PREFIX = Pattern.compile("^\\s*[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?.*", Pattern.DOTALL);

	private static final Map<String, ValidationFunction> FUNCTIONS = Map.of(
			"required", (value, args) -> required(value),
			"email", (value, args) -> value instanceof String s && EMAIL.matcher(s).matches(),
			"minLength", (value, args) -> value instanceof String s && args.get("min") instanceof Number min
					&& s.length() >= min.doubleValue(),
			"maxLength", (value, args) -> value instanceof String s && args.get("max") instanceof Number max
					&& s.length() <= max.doubleValue(),
			"pattern", (value, args) -> value instanceof String s && args.get("pattern") instanceof String p && find(p, s),
			"min", (value, args) -> value instanceof Number n && args.get("min") instanceof Number min
					&& JsonValues.compareNumbers(n, min) >= 0,
			"max", (value, args) -> value instanceof Number n && args.get("max") instanceof Number max
					&& JsonValues.compareNumbers(n, max) <= 0,
			"numeric", (value, args) -> numeric(value),
			"url", (value, args) -> value instanceof String s && url(s),
			"matches", (value, args) -> JsonValues.jsonEquals(value, args.get("other")));

	private BuiltInValidationFunctions() {
	}

	public static Map<String, ValidationFunction> all() {
		return FUNCTIONS;
	}

	public static ValidationFunction get(String name) {
		return FUNCTIONS.get(name);
	}

	private static boolean required(Object value) {
		if (value == null) {
			return false;
		}
		if (value instanceof String s) {
			return !s.trim().isEmpty();
		}
		if (value instanceof Collection<?> c) {
			return !c.isEmpty();
		}
		return true;
	}

	private static boolean find(String pattern, String value) {
		try {
			return Pattern.compile(pattern).matcher(value).find();
		}
		catch (PatternSyntaxException ex) {
			return false;
		}
	}

	private static boolean numeric(Object value) {
		if (value instanceof Number n) {
			return !Double.isNaN(n.doubleValue());
		}
		return value instanceof String s && NUMERIC_PREFIX.matcher(s).matches();
	}

	private static boolean url(String value) {
		try {
			return new URI(value).isAbsolute();
		}
		catch (URISyntaxException ex) {
			return false;
		}
	}
}
