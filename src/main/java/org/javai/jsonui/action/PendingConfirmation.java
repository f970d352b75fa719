package org.javai.jsonui.action;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * An action suspended until the user accepts or rejects its confirmation.
 *
 * <p>Exactly one of {@link #confirm()} and {@link #cancel()} takes effect; later calls are
 * ignored.</p>
 */
public final class PendingConfirmation {

	private final String action;
	private final Map<String, Object> params;
	private final ActionConfirm confirm;
	private final CompletableFuture<Void> decision = new CompletableFuture<>();
	private final AtomicBoolean settled = new AtomicBoolean();
	private final Consumer<PendingConfirmation> onSettled;

	PendingConfirmation(String action, Map<String, Object> params, ActionConfirm confirm,
			Consumer<PendingConfirmation> onSettled) {
		this.action = action;
		this.params = params;
		this.confirm = confirm;
		this.onSettled = onSettled;
	}

	public String action() {
		return action;
	}

	public Map<String, Object> params() {
		return params;
	}

	/**
	 * Dialog content with placeholders already expanded.
	 */
	public ActionConfirm confirmation() {
		return confirm;
	}

	public boolean isSettled() {
		return settled.get();
	}

	public void confirm() {
		if (settled.compareAndSet(false, true)) {
			onSettled.accept(this);
			decision.complete(null);
		}
	}

	public void cancel() {
		if (settled.compareAndSet(false, true)) {
			onSettled.accept(this);
			decision.completeExceptionally(new ActionCancelledException(action));
		}
	}

	CompletableFuture<Void> decision() {
		return decision;
	}
}
