package org.javai.jsonui.action;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.javai.jsonui.expr.ComputedFunction;
import org.javai.jsonui.expr.ExpressionResolver;
import org.javai.jsonui.expr.RepeatScope;
import org.javai.jsonui.expr.ResolutionContext;
import org.javai.jsonui.state.JsonValues;
import org.javai.jsonui.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link ActionBinding}s against a {@link StateStore}.
 *
 * <p>Parameters are resolved when an execution starts, against the live snapshot, so that an
 * earlier step of a chain is visible to the next. The built-in actions {@code setState},
 * {@code pushState}, {@code removeState}, {@code push}, {@code pop} and {@code validateForm} are
 * handled here; any other name is routed to a registered {@link ActionHandler}, and a name with
 * no handler is logged and treated as done.</p>
 *
 * <p>A binding with a {@code confirm} block is suspended as a {@link PendingConfirmation} until
 * {@link #confirm()} or {@link #cancel()} is called; a cancelled execution fails with
 * {@link ActionCancelledException}. While a handler runs, its action name is reported by
 * {@link #loadingActions()}.</p>
 *
 * <pre>{@code
 * ActionDispatcher dispatcher = ActionDispatcher.builder()
 *     .withStateStore(store)
 *     .handler("submitOrder", (params, ctx) -> orders.submit(params))
 *     .withFormValidator(form)
 *     .build();
 * dispatcher.execute(ActionBinding.of("submitOrder", Map.of("id", Map.of("$state", "/order/id"))));
 * }</pre>
 */
public class ActionDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(ActionDispatcher.class);

	public static final String SET_STATE = "setState";
	public static final String PUSH_STATE = "pushState";
	public static final String REMOVE_STATE = "removeState";
	public static final String PUSH = "push";
	public static final String POP = "pop";
	public static final String VALIDATE_FORM = "validateForm";

	static final String NAV_STACK = "/navStack";
	static final String CURRENT_SCREEN = "/currentScreen";
	static final String DEFAULT_FORM_VALIDATION_PATH = "/formValidation";
	static final String ID_TOKEN = "$id";

	private static final Set<String> BUILT_INS = Set.of(SET_STATE, PUSH_STATE, REMOVE_STATE, PUSH, POP, VALIDATE_FORM);

	private final StateStore stateStore;
	private final ExpressionResolver resolver;
	private final Map<String, ComputedFunction> functions;
	private final Map<String, ActionHandler> handlers;
	private final FormValidator formValidator;
	private final IdGenerator idGenerator;
	private final Consumer<String> navigator;
	private final List<ActionEventListener> listeners;
	private final ActionContext context;

	private final ConcurrentLinkedDeque<PendingConfirmation> pending = new ConcurrentLinkedDeque<>();
	private final Map<String, Integer> loading = new ConcurrentHashMap<>();
	private final AtomicLong executionCounter = new AtomicLong();

	private ActionDispatcher(Builder builder) {
		this.stateStore = Objects.requireNonNull(builder.stateStore, "stateStore must not be null");
		this.resolver = builder.resolver != null ? builder.resolver : new ExpressionResolver();
		this.functions = Map.copyOf(builder.functions);
		this.handlers = new ConcurrentHashMap<>(builder.handlers);
		this.formValidator = builder.formValidator;
		this.idGenerator = builder.idGenerator != null ? builder.idGenerator : IdGenerator.timestamped();
		this.navigator = builder.navigator;
		this.listeners = new CopyOnWriteArrayList<>(builder.listeners);
		this.context = new ActionContext(stateStore, this);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static boolean isBuiltIn(String action) {
		return BUILT_INS.contains(action);
	}

	public StateStore stateStore() {
		return stateStore;
	}

	/**
	 * Register or replace a handler after construction.
	 */
	public void registerHandler(String action, ActionHandler handler) {
		Objects.requireNonNull(action, "action must not be null");
		Objects.requireNonNull(handler, "handler must not be null");
		handlers.put(action, handler);
	}

	public void addListener(ActionEventListener listener) {
		listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
	}

	public CompletableFuture<Void> execute(ActionBinding binding) {
		return execute(binding, null);
	}

	/**
	 * Execute one binding.
	 *
	 * @param binding what to run
	 * @param scope repeat scope for {@code $item}/{@code $index} parameters, may be {@code null}
	 * @return completes when the action and its follow-ups are done; fails with the handler's
	 * error (when no {@code onError} is present) or {@link ActionCancelledException}
	 */
	public CompletableFuture<Void> execute(ActionBinding binding, RepeatScope scope) {
		Objects.requireNonNull(binding, "binding must not be null");
		String action = binding.action();
		String executionId = action + "-" + executionCounter.incrementAndGet();
		Map<String, Object> snapshot = stateStore.getSnapshot();
		ResolutionContext ctx = new ResolutionContext(snapshot, scope, functions);
		Map<String, Object> params = resolver.resolveProps(binding.params(), ctx);

		boolean builtIn = isBuiltIn(action);
		ActionHandler handler = builtIn ? null : handlers.get(action);
		if (!builtIn && handler == null) {
			logger.warn("No handler registered for action: {}", action);
			return CompletableFuture.completedFuture(null);
		}

		CompletableFuture<Void> gate;
		if (binding.confirm() != null) {
			gate = awaitConfirmation(action, executionId, params, binding.confirm().interpolate(snapshot));
		} else {
			gate = CompletableFuture.completedFuture(null);
		}
		return gate.thenCompose(ignored -> builtIn
				? runBuiltIn(binding, executionId, params)
				: runHandler(binding, executionId, handler, params));
	}

	/**
	 * Execute bindings strictly one after another. Each step resolves its parameters when it
	 * starts; the first failure or cancellation skips the remaining steps.
	 */
	public CompletableFuture<Void> executeAll(List<ActionBinding> bindings, RepeatScope scope) {
		CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
		for (ActionBinding binding : bindings) {
			chain = chain.thenCompose(ignored -> execute(binding, scope));
		}
		return chain;
	}

	public CompletableFuture<Void> executeAll(List<ActionBinding> bindings) {
		return executeAll(bindings, null);
	}

	/**
	 * Accept the oldest pending confirmation. No-op when nothing is pending.
	 */
	public void confirm() {
		PendingConfirmation head = pending.peekFirst();
		if (head != null) {
			head.confirm();
		}
	}

	/**
	 * Reject the oldest pending confirmation. No-op when nothing is pending.
	 */
	public void cancel() {
		PendingConfirmation head = pending.peekFirst();
		if (head != null) {
			head.cancel();
		}
	}

	public Optional<PendingConfirmation> pendingConfirmation() {
		return Optional.ofNullable(pending.peekFirst());
	}

	public List<PendingConfirmation> pendingConfirmations() {
		return List.copyOf(pending);
	}

	/**
	 * Names of handler-backed actions currently executing.
	 */
	public Set<String> loadingActions() {
		return Set.copyOf(loading.keySet());
	}

	public boolean isLoading(String action) {
		return loading.containsKey(action);
	}

	private CompletableFuture<Void> awaitConfirmation(String action, String executionId,
			Map<String, Object> params, ActionConfirm confirm) {
		PendingConfirmation record = new PendingConfirmation(action, Map.copyOf(withoutNulls(params)), confirm,
				pending::remove);
		pending.addLast(record);
		emit(ActionPhase.CONFIRM_PENDING, action, executionId, null);
		return record.decision().whenComplete((ignored, error) -> emit(
				error == null ? ActionPhase.CONFIRMED : ActionPhase.CANCELLED, action, executionId, null));
	}

	private CompletableFuture<Void> runHandler(ActionBinding binding, String executionId, ActionHandler handler,
			Map<String, Object> params) {
		String action = binding.action();
		loading.merge(action, 1, Integer::sum);
		emit(ActionPhase.EXECUTING, action, executionId, null);
		CompletableFuture<Void> run;
		try {
			run = handler.handle(params, context).toCompletableFuture();
		}
		catch (RuntimeException ex) {
			run = CompletableFuture.failedFuture(ex);
		}
		return finish(binding, executionId, run).whenComplete((ignored, error) -> {
			loading.computeIfPresent(action, (name, count) -> count > 1 ? count - 1 : null);
		});
	}

	private CompletableFuture<Void> runBuiltIn(ActionBinding binding, String executionId, Map<String, Object> params) {
		emit(ActionPhase.EXECUTING, binding.action(), executionId, null);
		CompletableFuture<Void> run;
		try {
			switch (binding.action()) {
				case SET_STATE -> setState(params);
				case PUSH_STATE -> pushState(params);
				case REMOVE_STATE -> removeState(params);
				case PUSH -> push(params);
				case POP -> pop();
				case VALIDATE_FORM -> validateForm(params);
				default -> throw new IllegalStateException("Not a built-in action: " + binding.action());
			}
			run = CompletableFuture.completedFuture(null);
		}
		catch (RuntimeException ex) {
			run = CompletableFuture.failedFuture(ex);
		}
		return finish(binding, executionId, run);
	}

	/**
	 * Apply the binding's follow-ups and report the terminal phase.
	 */
	private CompletableFuture<Void> finish(ActionBinding binding, String executionId, CompletableFuture<Void> run) {
		String action = binding.action();
		return run
				.handle((ignored, error) -> error)
				.thenCompose(error -> error == null ? onSuccess(binding) : onError(binding, unwrap(error)))
				.whenComplete((ignored, error) -> {
					if (error == null) {
						emit(ActionPhase.DONE, action, executionId, null);
					} else {
						Throwable cause = unwrap(error);
						logger.debug("Action {} failed: {}", action, cause.getMessage());
						emit(ActionPhase.ERROR, action, executionId, cause);
					}
				});
	}

	private CompletableFuture<Void> onSuccess(ActionBinding binding) {
		ActionFollowUp followUp = binding.onSuccess();
		if (followUp instanceof ActionFollowUp.Navigate navigate) {
			if (navigator != null) {
				navigator.accept(navigate.target());
			} else {
				logger.warn("onSuccess navigate to '{}' ignored: no navigator configured", navigate.target());
			}
		} else if (followUp instanceof ActionFollowUp.SetState set) {
			stateStore.update(set.values());
		} else if (followUp instanceof ActionFollowUp.RunAction run) {
			return context.executeAction(run.action());
		}
		return CompletableFuture.completedFuture(null);
	}

	private CompletableFuture<Void> onError(ActionBinding binding, Throwable error) {
		ActionFollowUp followUp = binding.onError();
		if (followUp == null || error instanceof ActionCancelledException) {
			return CompletableFuture.failedFuture(error);
		}
		logger.debug("Action {} failed, applying onError: {}", binding.action(), error.getMessage());
		if (followUp instanceof ActionFollowUp.SetState set) {
			Map<String, Object> values = new LinkedHashMap<>();
			set.values().forEach((path, value) -> values.put(path,
					ActionFollowUp.ERROR_MESSAGE_TOKEN.equals(value) ? error.getMessage() : value));
			stateStore.update(values);
		} else if (followUp instanceof ActionFollowUp.RunAction run) {
			return context.executeAction(run.action());
		} else {
			logger.warn("Unsupported onError follow-up for action {}: {}", binding.action(), followUp);
		}
		return CompletableFuture.completedFuture(null);
	}

	private void setState(Map<String, Object> params) {
		String path = pathParam(params, "statePath", "path");
		if (path == null) {
			logger.warn("setState without statePath ignored");
			return;
		}
		stateStore.set(path, params.get("value"));
	}

	private void pushState(Map<String, Object> params) {
		String path = pathParam(params, "statePath", "path");
		if (path == null) {
			logger.warn("pushState without statePath ignored");
			return;
		}
		Object value = substituteIds(params.get("value"));
		List<Object> items = new ArrayList<>(asList(stateStore.get(path)));
		items.add(value);
		Map<String, Object> writes = new LinkedHashMap<>();
		writes.put(path, items);
		String clearPath = pathParam(params, "clearStatePath", "clearPath");
		if (clearPath != null) {
			writes.put(clearPath, "");
		}
		stateStore.update(writes);
	}

	private void removeState(Map<String, Object> params) {
		String path = pathParam(params, "statePath", "path");
		if (path == null || !(params.get("index") instanceof Number index)) {
			logger.warn("removeState requires statePath and a numeric index");
			return;
		}
		List<Object> items = new ArrayList<>(asList(stateStore.get(path)));
		int position = index.intValue();
		if (position >= 0 && position < items.size()) {
			items.remove(position);
		}
		stateStore.set(path, items);
	}

	private void push(Map<String, Object> params) {
		if (!(params.get("screen") instanceof String screen) || screen.isEmpty()) {
			logger.warn("push without screen ignored");
			return;
		}
		Object current = stateStore.get(CURRENT_SCREEN);
		List<Object> stack = new ArrayList<>(asList(stateStore.get(NAV_STACK)));
		// empty string marks "no screen yet" so pop can return to the default
		stack.add(current instanceof String s && !s.isEmpty() ? s : "");
		Map<String, Object> writes = new LinkedHashMap<>();
		writes.put(NAV_STACK, stack);
		writes.put(CURRENT_SCREEN, screen);
		stateStore.update(writes);
	}

	private void pop() {
		List<Object> stack = new ArrayList<>(asList(stateStore.get(NAV_STACK)));
		if (stack.isEmpty()) {
			return;
		}
		Object previous = stack.remove(stack.size() - 1);
		Map<String, Object> writes = new LinkedHashMap<>();
		writes.put(NAV_STACK, stack);
		writes.put(CURRENT_SCREEN, previous instanceof String s && !s.isEmpty() ? s : null);
		stateStore.update(writes);
	}

	private void validateForm(Map<String, Object> params) {
		if (formValidator == null) {
			logger.warn("validateForm was dispatched but no form validator is configured");
			return;
		}
		FormValidationResult result = formValidator.validateAll();
		String path = pathParam(params, "statePath", null);
		stateStore.set(path != null ? path : DEFAULT_FORM_VALIDATION_PATH, result.toStateValue());
	}

	/**
	 * Replace every {@code "$id"} string and {@code {"$id": true}} object with a fresh id.
	 */
	private Object substituteIds(Object value) {
		if (ID_TOKEN.equals(value)) {
			return idGenerator.nextId();
		}
		if (value instanceof Map<?, ?> map) {
			if (map.size() == 1 && map.containsKey(ID_TOKEN)) {
				return idGenerator.nextId();
			}
			Map<String, Object> resolved = new LinkedHashMap<>();
			map.forEach((k, v) -> resolved.put(String.valueOf(k), substituteIds(v)));
			return resolved;
		}
		if (value instanceof List<?> list) {
			List<Object> resolved = new ArrayList<>(list.size());
			for (Object item : list) {
				resolved.add(substituteIds(item));
			}
			return resolved;
		}
		return value;
	}

	private static String pathParam(Map<String, Object> params, String name, String legacyName) {
		Object value = params.get(name);
		if (value == null && legacyName != null) {
			value = params.get(legacyName);
		}
		return value instanceof String s && !s.isEmpty() ? s : null;
	}

	private static List<?> asList(Object value) {
		return value instanceof List<?> list ? list : List.of();
	}

	private static Map<String, Object> withoutNulls(Map<String, Object> params) {
		Map<String, Object> copy = new LinkedHashMap<>();
		params.forEach((k, v) -> {
			if (v != null) {
				copy.put(k, JsonValues.freeze(v));
			}
		});
		return copy;
	}

	private static Throwable unwrap(Throwable error) {
		Throwable current = error;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	private void emit(ActionPhase phase, String action, String executionId, Throwable error) {
		if (listeners.isEmpty()) {
			return;
		}
		ActionEvent event = new ActionEvent(phase, action, executionId, null, error);
		for (ActionEventListener listener : listeners) {
			try {
				listener.onEvent(event);
			}
			catch (RuntimeException ex) {
				logger.warn("Action event listener failed: {}", ex.getMessage(), ex);
			}
		}
	}

	/**
	 * Builder for {@link ActionDispatcher}.
	 */
	public static final class Builder {
		private StateStore stateStore;
		private ExpressionResolver resolver;
		private final Map<String, ComputedFunction> functions = new LinkedHashMap<>();
		private final Map<String, ActionHandler> handlers = new LinkedHashMap<>();
		private FormValidator formValidator;
		private IdGenerator idGenerator;
		private Consumer<String> navigator;
		private final List<ActionEventListener> listeners = new ArrayList<>();

		private Builder() {
		}

		public Builder withStateStore(StateStore stateStore) {
			this.stateStore = stateStore;
			return this;
		}

		public Builder withResolver(ExpressionResolver resolver) {
			this.resolver = resolver;
			return this;
		}

		/**
		 * Functions available to {@code $computed} expressions in parameters.
		 */
		public Builder withFunctions(Map<String, ComputedFunction> functions) {
			this.functions.putAll(functions);
			return this;
		}

		public Builder handler(String action, ActionHandler handler) {
			Objects.requireNonNull(action, "action must not be null");
			Objects.requireNonNull(handler, "handler must not be null");
			if (isBuiltIn(action)) {
				throw new IllegalArgumentException("Cannot override built-in action: " + action);
			}
			this.handlers.put(action, handler);
			return this;
		}

		public Builder handlers(Map<String, ActionHandler> handlers) {
			handlers.forEach(this::handler);
			return this;
		}

		public Builder withFormValidator(FormValidator formValidator) {
			this.formValidator = formValidator;
			return this;
		}

		public Builder withIdGenerator(IdGenerator idGenerator) {
			this.idGenerator = idGenerator;
			return this;
		}

		/**
		 * Target of {@code onSuccess: {navigate: ...}} follow-ups.
		 */
		public Builder onNavigate(Consumer<String> navigator) {
			this.navigator = navigator;
			return this;
		}

		public Builder onEvent(ActionEventListener listener) {
			this.listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
			return this;
		}

		public ActionDispatcher build() {
			return new ActionDispatcher(this);
		}
	}
}
