package org.javai.jsonui.stream;

/**
 * The generation backend could not be reached or answered with an error status.
 */
public class GenerationTransportException extends RuntimeException {

	private final int status;

	public GenerationTransportException(String message, int status) {
		super(message);
		this.status = status;
	}

	public GenerationTransportException(String message, Throwable cause) {
		super(message, cause);
		this.status = -1;
	}

	/**
	 * HTTP status, or -1 when the failure happened below HTTP.
	 */
	public int status() {
		return status;
	}
}
