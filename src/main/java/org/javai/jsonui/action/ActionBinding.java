package org.javai.jsonui.action;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reference from a node to a named action.
 *
 * <p>Parameters are kept as raw expressions and resolved only when the action runs, against the
 * state at that moment.</p>
 *
 * @param action action name, a built-in or a registered handler
 * @param params parameter expressions by name
 * @param confirm confirmation required before running, or {@code null}
 * @param preventDefault hint for the rendering layer, not interpreted here
 * @param onSuccess follow-up after success, or {@code null}
 * @param onError follow-up after failure, or {@code null}; its presence marks the failure handled
 */
public record ActionBinding(
		String action,
		Map<String, Object> params,
		ActionConfirm confirm,
		boolean preventDefault,
		ActionFollowUp onSuccess,
		ActionFollowUp onError
) {

	public ActionBinding {
		Objects.requireNonNull(action, "action must not be null");
		params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
	}

	public static ActionBinding of(String action) {
		return new ActionBinding(action, null, null, false, null, null);
	}

	public static ActionBinding of(String action, Map<String, ?> params) {
		return new ActionBinding(action, copy(params), null, false, null, null);
	}

	public ActionBinding withConfirm(ActionConfirm confirm) {
		return new ActionBinding(action, params, confirm, preventDefault, onSuccess, onError);
	}

	public ActionBinding withOnSuccess(ActionFollowUp onSuccess) {
		return new ActionBinding(action, params, confirm, preventDefault, onSuccess, onError);
	}

	public ActionBinding withOnError(ActionFollowUp onError) {
		return new ActionBinding(action, params, confirm, preventDefault, onSuccess, onError);
	}

	/**
	 * Read a binding from its JSON object form, or {@code null} when {@code raw} has no string
	 * {@code action}.
	 */
	public static ActionBinding fromValue(Object raw) {
		if (!(raw instanceof Map<?, ?> map) || !(map.get("action") instanceof String action)) {
			return null;
		}
		return new ActionBinding(
				action,
				map.get("params") instanceof Map<?, ?> params ? copy(params) : null,
				ActionConfirm.fromValue(map.get("confirm")),
				Boolean.TRUE.equals(map.get("preventDefault")),
				ActionFollowUp.fromValue(map.get("onSuccess")),
				ActionFollowUp.fromValue(map.get("onError")));
	}

	/**
	 * Read the value of an {@code on}/{@code watch} entry: a single binding or a list of them.
	 * Entries that are not bindings are skipped.
	 */
	public static List<ActionBinding> listFrom(Object raw) {
		List<ActionBinding> bindings = new ArrayList<>();
		if (raw instanceof List<?> list) {
			for (Object element : list) {
				ActionBinding binding = fromValue(element);
				if (binding != null) {
					bindings.add(binding);
				}
			}
		} else {
			ActionBinding binding = fromValue(raw);
			if (binding != null) {
				bindings.add(binding);
			}
		}
		return List.copyOf(bindings);
	}

	private static Map<String, Object> copy(Map<?, ?> source) {
		if (source == null) {
			return null;
		}
		Map<String, Object> copy = new LinkedHashMap<>();
		source.forEach((k, v) -> copy.put(String.valueOf(k), v));
		return copy;
	}
}
