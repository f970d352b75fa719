package org.javai.jsonui.action;

/**
 * Lifecycle of one binding execution. Every execution starts {@code IDLE}; the remaining phases
 * are reported to {@link ActionEventListener}s as they are entered.
 */
public enum ActionPhase {
	IDLE,
	CONFIRM_PENDING,
	CONFIRMED,
	CANCELLED,
	EXECUTING,
	DONE,
	ERROR
}
