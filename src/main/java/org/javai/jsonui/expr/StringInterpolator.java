package org.javai.jsonui.expr;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.jsonui.state.JsonValues;

/**
 * Expands {@code ${/path}} placeholders against a state snapshot. Missing values become the
 * empty string.
 */
public final class StringInterpolator {

	private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

	private StringInterpolator() {
	}

	public static String interpolate(String template, Map<String, Object> state) {
		if (template == null || template.indexOf("${") < 0) {
			return template;
		}
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder sb = new StringBuilder();
		while (matcher.find()) {
			Object value = JsonValues.get(state, matcher.group(1).trim());
			matcher.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : String.valueOf(value)));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}
}
