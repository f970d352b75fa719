package org.javai.jsonui.action;

import java.util.concurrent.CompletableFuture;
import org.javai.jsonui.state.StateStore;

/**
 * Capabilities handed to an {@link ActionHandler}.
 */
public final class ActionContext {

	private final StateStore stateStore;
	private final ActionDispatcher dispatcher;

	ActionContext(StateStore stateStore, ActionDispatcher dispatcher) {
		this.stateStore = stateStore;
		this.dispatcher = dispatcher;
	}

	public StateStore stateStore() {
		return stateStore;
	}

	/**
	 * Run another action by name, without parameters. Confirmation of the chained action, if any,
	 * is handled like any other.
	 */
	public CompletableFuture<Void> executeAction(String action) {
		return dispatcher.execute(ActionBinding.of(action));
	}

	public CompletableFuture<Void> executeAction(ActionBinding binding) {
		return dispatcher.execute(binding);
	}
}
