package org.javai.jsonui.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural operations over JSON-like trees ({@link Map}, {@link List}, strings, numbers,
 * booleans and {@code null}).
 *
 * <p>All writing operations are copy-on-write: the containers along the addressed path are
 * shallow-copied, untouched branches are shared, and every container produced here is
 * unmodifiable. A tree built only through these operations can therefore be handed out as a
 * snapshot without further copying.</p>
 */
public final class JsonValues {

	private static final Logger logger = LoggerFactory.getLogger(JsonValues.class);

	private JsonValues() {
	}

	/**
	 * Deep, unmodifiable copy of a JSON-like value.
	 */
	public static Object freeze(Object value) {
		if (value instanceof Map<?, ?> map) {
			Map<String, Object> copy = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
			}
			return Collections.unmodifiableMap(copy);
		}
		if (value instanceof List<?> list) {
			List<Object> copy = new ArrayList<>(list.size());
			for (Object item : list) {
				copy.add(freeze(item));
			}
			return Collections.unmodifiableList(copy);
		}
		return value;
	}

	@SuppressWarnings("unchecked")
	public static Map<String, Object> freezeMap(Map<String, ?> value) {
		if (value == null) {
			return Collections.unmodifiableMap(new LinkedHashMap<>());
		}
		return (Map<String, Object>) freeze(value);
	}

	/**
	 * Mutable deep copy, for callers that want to edit a snapshot locally.
	 */
	public static Object thaw(Object value) {
		if (value instanceof Map<?, ?> map) {
			Map<String, Object> copy = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				copy.put(String.valueOf(entry.getKey()), thaw(entry.getValue()));
			}
			return copy;
		}
		if (value instanceof List<?> list) {
			List<Object> copy = new ArrayList<>(list.size());
			for (Object item : list) {
				copy.add(thaw(item));
			}
			return copy;
		}
		return value;
	}

	public static Object get(Object root, String path) {
		return getIn(root, JsonPointer.parse(path));
	}

	public static Object getIn(Object root, List<String> segments) {
		Object current = root;
		for (String segment : segments) {
			if (current instanceof Map<?, ?> map) {
				current = map.get(segment);
			} else if (current instanceof List<?> list) {
				if (!JsonPointer.isArrayIndex(segment)) {
					return null;
				}
				int index = Integer.parseInt(segment);
				if (index >= list.size()) {
					return null;
				}
				current = list.get(index);
			} else {
				return null;
			}
			if (current == null) {
				return null;
			}
		}
		return current;
	}

	public static boolean containsIn(Object root, List<String> segments) {
		if (segments.isEmpty()) {
			return root != null;
		}
		Object parent = getIn(root, segments.subList(0, segments.size() - 1));
		String last = segments.get(segments.size() - 1);
		if (parent instanceof Map<?, ?> map) {
			return map.containsKey(last);
		}
		if (parent instanceof List<?> list) {
			return JsonPointer.isArrayIndex(last) && Integer.parseInt(last) < list.size();
		}
		return false;
	}

	/**
	 * Write {@code value} at {@code segments}, returning the new root.
	 *
	 * <p>Intermediate containers are created as needed: an array when the following segment is
	 * numeric (or {@code -}), an object otherwise. A non-container value sitting on the path is
	 * overwritten by such a container.</p>
	 *
	 * @param insert when true, a numeric final segment inserts into an array (RFC 6902 add);
	 *               when false it overwrites the element (replace)
	 */
	public static Object setIn(Object root, List<String> segments, Object value, boolean insert) {
		if (segments.isEmpty()) {
			return freeze(value);
		}
		if (indexOutOfRange(root, segments)) {
			logger.warn("Ignoring write past the end of an array: {}", JsonPointer.format(segments));
			return root;
		}
		return setAt(root, segments, 0, freeze(value), insert);
	}

	/**
	 * True when a numeric segment addresses an array position beyond its current length. An
	 * array that would be created on the way counts as empty.
	 */
	private static boolean indexOutOfRange(Object root, List<String> segments) {
		Object node = root;
		for (String segment : segments) {
			if (node instanceof Map<?, ?> map) {
				node = map.get(segment);
				continue;
			}
			if (!JsonPointer.isArrayIndex(segment)) {
				node = null;
				continue;
			}
			int index = Integer.parseInt(segment);
			int size = node instanceof List<?> list ? list.size() : 0;
			if (index > size) {
				return true;
			}
			node = index < size ? ((List<?>) node).get(index) : null;
		}
		return false;
	}

	private static Object setAt(Object node, List<String> segments, int depth, Object value, boolean insert) {
		String segment = segments.get(depth);
		boolean last = depth == segments.size() - 1;

		if (node instanceof List<?> list && (JsonPointer.isArrayIndex(segment) || JsonPointer.APPEND.equals(segment))) {
			List<Object> copy = new ArrayList<>(list);
			if (JsonPointer.APPEND.equals(segment)) {
				copy.add(last ? value : setAt(null, segments, depth + 1, value, insert));
				return Collections.unmodifiableList(copy);
			}
			int index = Integer.parseInt(segment);
			if (last) {
				if (insert || index == copy.size()) {
					copy.add(index, value);
				} else {
					copy.set(index, value);
				}
			} else {
				Object child = index < copy.size() ? copy.get(index) : null;
				Object updated = setAt(child, segments, depth + 1, value, insert);
				if (index < copy.size()) {
					copy.set(index, updated);
				} else {
					copy.add(updated);
				}
			}
			return Collections.unmodifiableList(copy);
		}

		Map<String, Object> copy = new LinkedHashMap<>();
		if (node instanceof Map<?, ?> map) {
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				copy.put(String.valueOf(entry.getKey()), entry.getValue());
			}
		} else if (!(node instanceof List<?>)
				&& (JsonPointer.isArrayIndex(segment) || JsonPointer.APPEND.equals(segment))) {
			// missing or scalar prefix addressed by index: grow an array here
			return setAt(List.of(), segments, depth, value, insert);
		}
		copy.put(segment, last ? value : setAt(copy.get(segment), segments, depth + 1, value, insert));
		return Collections.unmodifiableMap(copy);
	}

	/**
	 * Remove the value at {@code segments}. Returns the same root instance when nothing was there.
	 */
	public static Object removeIn(Object root, List<String> segments) {
		if (segments.isEmpty()) {
			return null;
		}
		return removeAt(root, segments, 0);
	}

	private static Object removeAt(Object node, List<String> segments, int depth) {
		String segment = segments.get(depth);
		boolean last = depth == segments.size() - 1;
		if (node instanceof Map<?, ?> map) {
			if (!map.containsKey(segment)) {
				return node;
			}
			Map<String, Object> copy = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				copy.put(String.valueOf(entry.getKey()), entry.getValue());
			}
			if (last) {
				copy.remove(segment);
			} else {
				Object child = copy.get(segment);
				Object updated = removeAt(child, segments, depth + 1);
				if (updated == child) {
					return node;
				}
				copy.put(segment, updated);
			}
			return Collections.unmodifiableMap(copy);
		}
		if (node instanceof List<?> list) {
			if (!JsonPointer.isArrayIndex(segment)) {
				return node;
			}
			int index = Integer.parseInt(segment);
			if (index >= list.size()) {
				return node;
			}
			List<Object> copy = new ArrayList<>(list);
			if (last) {
				copy.remove(index);
			} else {
				Object child = copy.get(index);
				Object updated = removeAt(child, segments, depth + 1);
				if (updated == child) {
					return node;
				}
				copy.set(index, updated);
			}
			return Collections.unmodifiableList(copy);
		}
		return node;
	}

	/**
	 * JSON value equality: numbers compare by numeric value regardless of their boxed type.
	 */
	public static boolean jsonEquals(Object a, Object b) {
		if (a == b) {
			return true;
		}
		if (a == null || b == null) {
			return false;
		}
		if (a instanceof Number na && b instanceof Number nb) {
			return compareNumbers(na, nb) == 0;
		}
		if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
			if (ma.size() != mb.size()) {
				return false;
			}
			for (Map.Entry<?, ?> entry : ma.entrySet()) {
				if (!mb.containsKey(entry.getKey()) || !jsonEquals(entry.getValue(), mb.get(entry.getKey()))) {
					return false;
				}
			}
			return true;
		}
		if (a instanceof List<?> la && b instanceof List<?> lb) {
			if (la.size() != lb.size()) {
				return false;
			}
			for (int i = 0; i < la.size(); i++) {
				if (!jsonEquals(la.get(i), lb.get(i))) {
					return false;
				}
			}
			return true;
		}
		return a.equals(b);
	}

	public static int compareNumbers(Number a, Number b) {
		if (isIntegral(a) && isIntegral(b)) {
			return Long.compare(a.longValue(), b.longValue());
		}
		return Double.compare(a.doubleValue(), b.doubleValue());
	}

	private static boolean isIntegral(Number n) {
		return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
	}

	/**
	 * Truthiness as generated documents expect it: {@code null}, {@code false}, zero, NaN and the
	 * empty string are false; everything else, including empty containers, is true.
	 */
	public static boolean isTruthy(Object value) {
		if (value == null) {
			return false;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		if (value instanceof Number n) {
			double d = n.doubleValue();
			return d != 0 && !Double.isNaN(d);
		}
		if (value instanceof String s) {
			return !s.isEmpty();
		}
		return true;
	}

	/**
	 * Flatten a nested object into pointer → leaf entries. Arrays are leaves.
	 */
	public static Map<String, Object> flatten(Map<String, ?> value) {
		Map<String, Object> result = new LinkedHashMap<>();
		flattenInto(result, "", value);
		return result;
	}

	private static void flattenInto(Map<String, Object> result, String prefix, Map<String, ?> value) {
		for (Map.Entry<String, ?> entry : value.entrySet()) {
			String pointer = prefix + "/" + entry.getKey().replace("~", "~0").replace("/", "~1");
			if (entry.getValue() instanceof Map<?, ?> nested) {
				@SuppressWarnings("unchecked")
				Map<String, ?> casted = (Map<String, ?>) nested;
				flattenInto(result, pointer, casted);
			} else {
				result.put(pointer, entry.getValue());
			}
		}
	}
}
