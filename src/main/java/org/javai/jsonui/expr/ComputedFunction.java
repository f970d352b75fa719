package org.javai.jsonui.expr;

import java.util.Map;

/**
 * Host-supplied pure function callable from documents as {@code {"$computed": name, "args": {...}}}.
 * Arguments arrive already resolved.
 */
@FunctionalInterface
public interface ComputedFunction {

	Object apply(Map<String, Object> args);
}
