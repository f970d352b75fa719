package org.javai.jsonui.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What to do after a bound action succeeds ({@code onSuccess}) or fails ({@code onError}).
 */
public sealed interface ActionFollowUp {

	/**
	 * Token inside {@code onError.set} values replaced by the failure message.
	 */
	String ERROR_MESSAGE_TOKEN = "$error.message";

	record Navigate(String target) implements ActionFollowUp {
		public Navigate {
			Objects.requireNonNull(target, "target must not be null");
		}
	}

	record SetState(Map<String, Object> values) implements ActionFollowUp {
		public SetState {
			values = values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : Map.of();
		}
	}

	record RunAction(String action) implements ActionFollowUp {
		public RunAction {
			Objects.requireNonNull(action, "action must not be null");
		}
	}

	/**
	 * Read a follow-up from its JSON form. Returns {@code null} for anything unrecognised.
	 */
	static ActionFollowUp fromValue(Object raw) {
		if (!(raw instanceof Map<?, ?> map)) {
			return null;
		}
		if (map.get("navigate") instanceof String target) {
			return new Navigate(target);
		}
		if (map.get("set") instanceof Map<?, ?> set) {
			Map<String, Object> values = new LinkedHashMap<>();
			set.forEach((k, v) -> values.put(String.valueOf(k), v));
			return new SetState(values);
		}
		if (map.get("action") instanceof String action) {
			return new RunAction(action);
		}
		return null;
	}
}
