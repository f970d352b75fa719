package org.javai.jsonui.stream;

import java.util.ArrayList;
import java.util.List;

/**
 * Reassembles newline-delimited lines from arbitrarily split chunks.
 *
 * <p>Not thread-safe; one instance per stream.</p>
 */
public class LineAssembler {

	private final StringBuilder buffer = new StringBuilder();

	/**
	 * Append a chunk and return every line it completes, without the terminator.
	 */
	public List<String> accept(String chunk) {
		if (chunk == null || chunk.isEmpty()) {
			return List.of();
		}
		buffer.append(chunk);
		List<String> lines = new ArrayList<>();
		int start = 0;
		int newline;
		while ((newline = buffer.indexOf("\n", start)) >= 0) {
			lines.add(buffer.substring(start, newline));
			start = newline + 1;
		}
		buffer.delete(0, start);
		return lines;
	}

	/**
	 * The trailing partial line, or {@code null} when nothing but whitespace remains.
	 * Clears the buffer.
	 */
	public String finish() {
		String rest = buffer.toString();
		buffer.setLength(0);
		return rest.isBlank() ? null : rest;
	}

	public boolean hasPending() {
		return buffer.length() > 0;
	}
}
