package org.javai.jsonui.action;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.javai.jsonui.spec.Spec;
import org.javai.jsonui.spec.UiNode;
import org.javai.jsonui.state.JsonValues;
import org.javai.jsonui.state.StateChangeEvent;
import org.javai.jsonui.state.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fires the {@code watch} bindings of a document's nodes when the watched state paths change.
 *
 * <p>For each node, watched paths are visited in declaration order and their bindings run as one
 * sequential chain. A value is considered changed when it differs, by JSON value equality,
 * between the snapshots before and after a store write.</p>
 */
public class StateWatchDispatcher implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(StateWatchDispatcher.class);

	private final ActionDispatcher dispatcher;
	private volatile Spec spec;
	private Subscription subscription;

	public StateWatchDispatcher(Spec spec, ActionDispatcher dispatcher) {
		this.spec = Objects.requireNonNull(spec, "spec must not be null");
		this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
	}

	/**
	 * Begin listening to the dispatcher's state store. Calling twice has no further effect.
	 */
	public synchronized StateWatchDispatcher start() {
		if (subscription == null) {
			subscription = dispatcher.stateStore().subscribe(this::onChange);
		}
		return this;
	}

	/**
	 * Swap in a newer revision of the document, e.g. after a further generation round.
	 */
	public void updateSpec(Spec spec) {
		this.spec = Objects.requireNonNull(spec, "spec must not be null");
	}

	@Override
	public synchronized void close() {
		if (subscription != null) {
			subscription.unsubscribe();
			subscription = null;
		}
	}

	void onChange(StateChangeEvent event) {
		for (Map.Entry<String, UiNode> entry : spec.nodes().entrySet()) {
			Map<String, Object> watch = entry.getValue().watch();
			if (watch == null || watch.isEmpty()) {
				continue;
			}
			CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
			boolean fired = false;
			for (Map.Entry<String, Object> watched : watch.entrySet()) {
				String path = watched.getKey();
				Object before = JsonValues.get(event.previous(), path);
				Object after = JsonValues.get(event.current(), path);
				if (JsonValues.jsonEquals(before, after)) {
					continue;
				}
				List<ActionBinding> bindings = ActionBinding.listFrom(watched.getValue());
				if (bindings.isEmpty()) {
					continue;
				}
				logger.debug("Node '{}' watch on {} fired {} action(s)", entry.getKey(), path, bindings.size());
				chain = chain.thenCompose(ignored -> dispatcher.executeAll(bindings));
				fired = true;
			}
			if (fired) {
				String nodeId = entry.getKey();
				chain.whenComplete((ignored, error) -> {
					if (error != null) {
						Throwable cause = error instanceof CompletionException && error.getCause() != null
								? error.getCause() : error;
						logger.warn("Watch actions of node '{}' failed: {}", nodeId, cause.getMessage());
					}
				});
			}
		}
	}
}
