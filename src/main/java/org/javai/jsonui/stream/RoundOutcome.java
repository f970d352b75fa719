package org.javai.jsonui.stream;

/**
 * How a single generation round ended.
 */
public enum RoundOutcome {
	/** Stream ended and the document was accepted. */
	COMPLETED,
	/** Stream aborted on a malformed line. */
	MALFORMED_ABORT,
	/** Stream ended but validation errors remained after auto-fix. */
	VALIDATION_FAILED,
	TRANSPORT_FAILED,
	CANCELLED
}
