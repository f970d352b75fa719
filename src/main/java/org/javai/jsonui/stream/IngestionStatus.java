package org.javai.jsonui.stream;

public enum IngestionStatus {
	/** The document was accepted (valid, or validation is off). */
	COMPLETED,
	/** Repair rounds ran out with malformed lines or validation errors outstanding. */
	RETRIES_EXHAUSTED,
	CANCELLED,
	/** Transport failure; the result carries the error and the partial document. */
	FAILED
}
