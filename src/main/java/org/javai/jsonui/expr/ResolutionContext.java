package org.javai.jsonui.expr;

import java.util.Map;

/**
 * Everything an expression may read: a state snapshot, the optional repeat scope and the
 * registry of computed functions.
 */
public record ResolutionContext(
		Map<String, Object> state,
		RepeatScope scope,
		Map<String, ComputedFunction> functions
) {

	public ResolutionContext {
		state = state != null ? state : Map.of();
		functions = functions != null ? Map.copyOf(functions) : Map.of();
	}

	public static ResolutionContext of(Map<String, Object> state) {
		return new ResolutionContext(state, null, Map.of());
	}

	public static ResolutionContext of(Map<String, Object> state, Map<String, ComputedFunction> functions) {
		return new ResolutionContext(state, null, functions);
	}

	public ResolutionContext withScope(RepeatScope scope) {
		return new ResolutionContext(state, scope, functions);
	}

	public ResolutionContext withState(Map<String, Object> state) {
		return new ResolutionContext(state, scope, functions);
	}

	public boolean inRepeatScope() {
		return scope != null;
	}
}
