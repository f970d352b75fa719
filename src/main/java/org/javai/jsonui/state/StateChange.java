package org.javai.jsonui.state;

/**
 * One write that actually altered the state document.
 *
 * @param path pointer that was written
 * @param value value now stored at {@code path} ({@code null} when removed or cleared)
 */
public record StateChange(String path, Object value) {

	public StateChange {
		if (path == null) {
			throw new IllegalArgumentException("path must not be null");
		}
	}
}
