package org.javai.jsonui.form;

import java.util.Map;

/**
 * Named predicate usable from a {@link ValidationCheck}.
 */
@FunctionalInterface
public interface ValidationFunction {

	/**
	 * @param value the field's current value
	 * @param args the check's arguments, already resolved against state
	 */
	boolean test(Object value, Map<String, Object> args);
}
