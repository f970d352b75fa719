package org.javai.jsonui.stream;

import java.util.List;

/**
 * Per-round telemetry for one ingestion.
 *
 * @param retriesUsed repair rounds consumed from the shared budget
 * @param rounds one record per round, in order
 */
public record IngestionMetrics(int retriesUsed, List<RoundRecord> rounds) {

	public IngestionMetrics {
		rounds = rounds != null ? List.copyOf(rounds) : List.of();
		if (retriesUsed < 0) {
			throw new IllegalArgumentException("retriesUsed must be >= 0");
		}
	}

	public static IngestionMetrics empty() {
		return new IngestionMetrics(0, List.of());
	}

	public int totalRounds() {
		return rounds.size();
	}

	public boolean succeeded() {
		return rounds.stream().anyMatch(RoundRecord::isSuccess);
	}

	public int totalPatchesApplied() {
		return rounds.stream().mapToInt(RoundRecord::patchesApplied).sum();
	}

	/**
	 * @return the last round, or null if no round ran
	 */
	public RoundRecord finalRound() {
		return rounds.isEmpty() ? null : rounds.get(rounds.size() - 1);
	}
}
