package org.javai.jsonui.action;

import java.util.Map;
import org.javai.jsonui.expr.StringInterpolator;

/**
 * Confirmation dialog content attached to a binding.
 *
 * @param title dialog title, may contain {@code ${/path}} placeholders
 * @param message dialog body, may contain {@code ${/path}} placeholders
 * @param confirmLabel label of the accept button, {@code null} for the host default
 * @param cancelLabel label of the reject button, {@code null} for the host default
 * @param variant {@code default} or {@code danger}
 */
public record ActionConfirm(String title, String message, String confirmLabel, String cancelLabel, String variant) {

	public ActionConfirm {
		title = title != null ? title : "";
		message = message != null ? message : "";
		variant = variant != null ? variant : "default";
	}

	public static ActionConfirm of(String title, String message) {
		return new ActionConfirm(title, message, null, null, null);
	}

	static ActionConfirm fromValue(Object raw) {
		if (!(raw instanceof Map<?, ?> map)) {
			return null;
		}
		return new ActionConfirm(text(map.get("title")), text(map.get("message")), text(map.get("confirmLabel")),
				text(map.get("cancelLabel")), text(map.get("variant")));
	}

	public boolean isDanger() {
		return "danger".equals(variant);
	}

	/**
	 * Copy with title and message placeholders expanded against {@code state}.
	 */
	public ActionConfirm interpolate(Map<String, Object> state) {
		return new ActionConfirm(StringInterpolator.interpolate(title, state),
				StringInterpolator.interpolate(message, state), confirmLabel, cancelLabel, variant);
	}

	private static String text(Object value) {
		return value != null ? String.valueOf(value) : null;
	}
}
