package org.javai.jsonui.stream;

/**
 * Token accounting reported by the backend on a {@code {"__meta": "usage"}} line.
 */
public record TokenUsage(long promptTokens, long completionTokens, long totalTokens) {

	public TokenUsage {
		if (promptTokens < 0 || completionTokens < 0 || totalTokens < 0) {
			throw new IllegalArgumentException("token counts must be >= 0");
		}
	}
}
