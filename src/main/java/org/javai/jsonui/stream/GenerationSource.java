package org.javai.jsonui.stream;

import java.io.IOException;

/**
 * Backend that turns a prompt into a stream of patch lines.
 */
@FunctionalInterface
public interface GenerationSource {

	/**
	 * @throws GenerationTransportException when the backend answers with an error status
	 * @throws IOException when the connection fails
	 */
	GenerationStream open(GenerationRequest request) throws IOException;
}
