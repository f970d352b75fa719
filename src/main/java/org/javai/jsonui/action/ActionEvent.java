package org.javai.jsonui.action;

import java.time.Instant;

/**
 * Phase transition of one action execution.
 *
 * @param phase phase entered
 * @param action action name
 * @param executionId identifier shared by all events of the same execution
 * @param timestamp when the phase was entered
 * @param error failure cause for {@link ActionPhase#ERROR}, otherwise {@code null}
 */
public record ActionEvent(ActionPhase phase, String action, String executionId, Instant timestamp, Throwable error) {

	public ActionEvent {
		phase = phase != null ? phase : ActionPhase.IDLE;
		action = action != null ? action : "";
		executionId = executionId != null ? executionId : "";
		timestamp = timestamp != null ? timestamp : Instant.now();
	}
}
