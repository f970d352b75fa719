package org.javai.jsonui.state;

import java.util.ArrayList;
import java.util.List;

/**
 * Slash-delimited pointer paths (RFC 6901) as used for state and document addressing.
 *
 * <p>{@code null}, {@code ""} and {@code "/"} all address the document root. A path without a
 * leading slash is accepted and treated as if it had one, since generated input is not always
 * precise about it.</p>
 */
public final class JsonPointer {

	/**
	 * Array segment meaning "one past the last element".
	 */
	public static final String APPEND = "-";

	private JsonPointer() {
	}

	public static List<String> parse(String path) {
		if (path == null || path.isEmpty() || "/".equals(path)) {
			return List.of();
		}
		String body = path.startsWith("/") ? path.substring(1) : path;
		List<String> segments = new ArrayList<>();
		for (String raw : body.split("/", -1)) {
			segments.add(unescape(raw));
		}
		return List.copyOf(segments);
	}

	public static String format(List<String> segments) {
		if (segments == null || segments.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder();
		for (String segment : segments) {
			sb.append('/').append(escape(segment));
		}
		return sb.toString();
	}

	/**
	 * Join a relative pointer (or a bare field name) onto a base pointer.
	 */
	public static String join(String base, String relative) {
		String left = base == null ? "" : base;
		if (left.endsWith("/")) {
			left = left.substring(0, left.length() - 1);
		}
		if (relative == null || relative.isEmpty() || "/".equals(relative)) {
			return left;
		}
		return relative.startsWith("/") ? left + relative : left + "/" + relative;
	}

	/**
	 * True when {@code candidate} equals {@code path} or lies beneath it.
	 */
	public static boolean isSameOrDescendant(String candidate, String path) {
		List<String> c = parse(candidate);
		List<String> p = parse(path);
		return c.size() >= p.size() && c.subList(0, p.size()).equals(p);
	}

	public static boolean isArrayIndex(String segment) {
		if (segment == null || segment.isEmpty() || segment.length() > 9) {
			return false;
		}
		for (int i = 0; i < segment.length(); i++) {
			if (!Character.isDigit(segment.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	private static String unescape(String segment) {
		return segment.replace("~1", "/").replace("~0", "~");
	}

	private static String escape(String segment) {
		return segment.replace("~", "~0").replace("/", "~1");
	}
}
