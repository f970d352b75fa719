package org.javai.jsonui.action;

/**
 * Completes an action's future when its confirmation is rejected. Aborts the rest of a chain.
 */
public class ActionCancelledException extends RuntimeException {

	private final String action;

	public ActionCancelledException(String action) {
		super("Action cancelled");
		this.action = action;
	}

	public String action() {
		return action;
	}
}
