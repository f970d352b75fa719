package org.javai.jsonui.stream;

import java.util.List;
import org.javai.jsonui.spec.Spec;
import org.javai.jsonui.spec.SpecIssue;
import org.javai.jsonui.spec.SpecValidator;

/**
 * Outcome of {@link StreamIngester#send}. The spec is always the best document known at the end,
 * whatever the status.
 *
 * @param spec final document
 * @param status how the ingestion ended
 * @param issues issues outstanding after the last validation (empty when validation is off)
 * @param fixes descriptions of auto-fixes applied across all rounds
 * @param malformedLines every line that could not be parsed, across all rounds
 * @param rawLines every non-blank line received, across all rounds
 * @param usage last token usage reported, or null
 * @param error transport failure when status is FAILED, otherwise null
 * @param metrics per-round telemetry
 */
public record IngestionResult(
		Spec spec,
		IngestionStatus status,
		List<SpecIssue> issues,
		List<String> fixes,
		List<String> malformedLines,
		List<String> rawLines,
		TokenUsage usage,
		Throwable error,
		IngestionMetrics metrics
) {
	public IngestionResult {
		if (spec == null) {
			throw new IllegalArgumentException("spec must not be null");
		}
		if (status == null) {
			throw new IllegalArgumentException("status must not be null");
		}
		issues = issues != null ? List.copyOf(issues) : List.of();
		fixes = fixes != null ? List.copyOf(fixes) : List.of();
		malformedLines = malformedLines != null ? List.copyOf(malformedLines) : List.of();
		rawLines = rawLines != null ? List.copyOf(rawLines) : List.of();
		metrics = metrics != null ? metrics : IngestionMetrics.empty();
	}

	public boolean isSuccess() {
		return status == IngestionStatus.COMPLETED;
	}

	/**
	 * Human-readable reason the ingestion did not complete, or null when it did.
	 */
	public String failureMessage() {
		return switch (status) {
			case COMPLETED -> null;
			case CANCELLED -> "Generation cancelled";
			case FAILED -> error != null ? error.getMessage() : "Generation failed";
			case RETRIES_EXHAUSTED -> issues.stream().anyMatch(SpecIssue::isError)
					? SpecValidator.formatIssues(issues)
					: "Generation produced malformed output after " + metrics.retriesUsed() + " repair attempt(s)";
		};
	}
}
