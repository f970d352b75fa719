package org.javai.jsonui.stream;

import java.io.IOException;

/**
 * An open response body delivering text in chunks of arbitrary size.
 *
 * <p>{@link #close()} may be called from another thread to abort a blocked {@link #nextChunk()};
 * the blocked call then fails with an {@link IOException}.</p>
 */
public interface GenerationStream extends AutoCloseable {

	/**
	 * @return the next chunk, or {@code null} at end of stream
	 */
	String nextChunk() throws IOException;

	@Override
	void close();
}
