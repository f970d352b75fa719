package org.javai.jsonui;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.javai.jsonui.action.ActionBinding;
import org.javai.jsonui.action.ActionDispatcher;
import org.javai.jsonui.action.ActionEventListener;
import org.javai.jsonui.action.ActionHandler;
import org.javai.jsonui.action.IdGenerator;
import org.javai.jsonui.action.StateWatchDispatcher;
import org.javai.jsonui.expr.ComputedFunction;
import org.javai.jsonui.expr.ExpressionResolver;
import org.javai.jsonui.expr.RepeatScope;
import org.javai.jsonui.expr.RepeatScopes;
import org.javai.jsonui.expr.ResolutionContext;
import org.javai.jsonui.form.FieldValidator;
import org.javai.jsonui.form.RegisteredFormValidator;
import org.javai.jsonui.form.ValidationFunction;
import org.javai.jsonui.spec.RepeatConfig;
import org.javai.jsonui.spec.Spec;
import org.javai.jsonui.spec.UiNode;
import org.javai.jsonui.state.InMemoryStateStore;
import org.javai.jsonui.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything a host needs to drive one rendered document: a state store seeded from the
 * document's {@code state}, expression resolution against it, action dispatch for node events
 * and the watchers declared on the nodes.
 *
 * <p>Each session owns its own store and dispatcher; nothing is shared between sessions.</p>
 */
public class UiSession implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(UiSession.class);

	private volatile Spec spec;
	private final StateStore stateStore;
	private final ExpressionResolver resolver;
	private final Map<String, ComputedFunction> functions;
	private final RegisteredFormValidator formValidator;
	private final ActionDispatcher dispatcher;
	private final StateWatchDispatcher watcher;

	private UiSession(Builder builder) {
		this.spec = builder.spec;
		this.stateStore = new InMemoryStateStore(spec.state());
		this.resolver = new ExpressionResolver();
		this.functions = Map.copyOf(builder.functions);
		this.formValidator = new RegisteredFormValidator(stateStore,
				new FieldValidator(resolver, builder.validationFunctions));
		ActionDispatcher.Builder dispatch = ActionDispatcher.builder()
				.withStateStore(stateStore)
				.withResolver(resolver)
				.withFunctions(functions)
				.handlers(builder.handlers)
				.withFormValidator(formValidator)
				.withIdGenerator(builder.idGenerator)
				.onNavigate(builder.navigator);
		builder.listeners.forEach(dispatch::onEvent);
		this.dispatcher = dispatch.build();
		this.watcher = new StateWatchDispatcher(spec, dispatcher).start();
		logger.debug("Session opened on root '{}' with {} node(s)", spec.root(), spec.nodes().size());
	}

	public static Builder builder(Spec spec) {
		return new Builder(spec);
	}

	public Spec spec() {
		return spec;
	}

	public StateStore stateStore() {
		return stateStore;
	}

	public ActionDispatcher dispatcher() {
		return dispatcher;
	}

	public RegisteredFormValidator formValidator() {
		return formValidator;
	}

	/**
	 * Swap in a newer revision of the document. State is not reseeded.
	 */
	public void updateSpec(Spec spec) {
		this.spec = Objects.requireNonNull(spec, "spec must not be null");
		watcher.updateSpec(spec);
	}

	public Map<String, Object> resolveProps(String nodeId, RepeatScope scope) {
		UiNode node = requireNode(nodeId);
		return resolver.resolveProps(node.props(), context(scope));
	}

	/**
	 * Prop name → state path for every two-way bound prop of the node.
	 */
	public Map<String, String> resolveBindings(String nodeId, RepeatScope scope) {
		UiNode node = requireNode(nodeId);
		return resolver.resolveBindings(node.props(), context(scope));
	}

	public boolean isVisible(String nodeId, RepeatScope scope) {
		UiNode node = requireNode(nodeId);
		return node.visible() == null || resolver.evaluate(node.visible(), context(scope));
	}

	/**
	 * One scope per element of a repeated node's source array; empty for a node without
	 * {@code repeat}.
	 */
	public List<RepeatScope> repeatScopes(String nodeId) {
		RepeatConfig repeat = requireNode(nodeId).repeat();
		if (repeat == null) {
			return List.of();
		}
		return RepeatScopes.expand(repeat.statePath(), repeat.key(), stateStore.getSnapshot());
	}

	/**
	 * Run the bindings a node declares for {@code event}, in order. Completes immediately when
	 * the node has none.
	 */
	public CompletableFuture<Void> dispatch(String nodeId, String event, RepeatScope scope) {
		UiNode node = requireNode(nodeId);
		Object raw = node.on() != null ? node.on().get(event) : null;
		List<ActionBinding> bindings = ActionBinding.listFrom(raw);
		if (bindings.isEmpty()) {
			logger.debug("Node '{}' has no bindings for '{}'", nodeId, event);
			return CompletableFuture.completedFuture(null);
		}
		return dispatcher.executeAll(bindings, scope);
	}

	@Override
	public void close() {
		watcher.close();
	}

	private ResolutionContext context(RepeatScope scope) {
		return ResolutionContext.of(stateStore.getSnapshot(), functions).withScope(scope);
	}

	private UiNode requireNode(String nodeId) {
		UiNode node = spec.node(nodeId);
		if (node == null) {
			throw new IllegalArgumentException("Unknown node: " + nodeId);
		}
		return node;
	}

	public static final class Builder {
		private final Spec spec;
		private final Map<String, ComputedFunction> functions = new LinkedHashMap<>();
		private final Map<String, ValidationFunction> validationFunctions = new LinkedHashMap<>();
		private final Map<String, ActionHandler> handlers = new LinkedHashMap<>();
		private final List<ActionEventListener> listeners = new ArrayList<>();
		private IdGenerator idGenerator;
		private Consumer<String> navigator;

		private Builder(Spec spec) {
			this.spec = Objects.requireNonNull(spec, "spec must not be null");
		}

		public Builder withFunction(String name, ComputedFunction function) {
			functions.put(name, function);
			return this;
		}

		public Builder withValidationFunction(String name, ValidationFunction function) {
			validationFunctions.put(name, function);
			return this;
		}

		public Builder handler(String action, ActionHandler handler) {
			handlers.put(action, handler);
			return this;
		}

		public Builder withIdGenerator(IdGenerator idGenerator) {
			this.idGenerator = idGenerator;
			return this;
		}

		public Builder onNavigate(Consumer<String> navigator) {
			this.navigator = navigator;
			return this;
		}

		public Builder onEvent(ActionEventListener listener) {
			listeners.add(listener);
			return this;
		}

		public UiSession build() {
			return new UiSession(this);
		}
	}
}
