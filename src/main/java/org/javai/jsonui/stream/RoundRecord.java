package org.javai.jsonui.stream;

/**
 * Record of a single generation round for observability.
 *
 * @param round 1-based round number; round 1 answers the user prompt, later rounds are repairs
 * @param outcome how the round ended
 * @param patchesApplied patches applied during the round
 * @param malformedLines lines that could not be parsed
 * @param durationMillis time taken for the round in milliseconds
 * @param errorDetails failure description, null when the round completed
 */
public record RoundRecord(
		int round,
		RoundOutcome outcome,
		int patchesApplied,
		int malformedLines,
		long durationMillis,
		String errorDetails
) {
	public RoundRecord {
		if (round < 1) {
			throw new IllegalArgumentException("round must be >= 1");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (patchesApplied < 0 || malformedLines < 0) {
			throw new IllegalArgumentException("counts must be >= 0");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public boolean isSuccess() {
		return outcome == RoundOutcome.COMPLETED;
	}

	public boolean isRepair() {
		return round > 1;
	}
}
