package org.javai.jsonui.stream;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.javai.jsonui.spec.AutoFixResult;
import org.javai.jsonui.spec.Spec;
import org.javai.jsonui.spec.SpecIssue;
import org.javai.jsonui.spec.SpecJson;
import org.javai.jsonui.spec.SpecPatch;
import org.javai.jsonui.spec.SpecPatcher;
import org.javai.jsonui.spec.SpecValidationResult;
import org.javai.jsonui.spec.SpecValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a prompt into a document by streaming patch lines from a {@link GenerationSource},
 * applying them as they arrive and, when validation is enabled, running repair rounds until the
 * document is valid or the retry budget is spent.
 *
 * <p>{@link #send} blocks the calling thread. {@link #cancel()} may be called from any other
 * thread; it closes the open stream and the blocked {@code send} returns a
 * {@link IngestionStatus#CANCELLED} result without firing listener callbacks. Starting a new
 * {@code send} cancels one still in flight.</p>
 */
public class StreamIngester {

	private static final Logger logger = LoggerFactory.getLogger(StreamIngester.class);

	private final GenerationSource source;
	private final IngestionConfig config;
	private final IngestionListener listener;
	private final PatchLineParser parser;
	private final AtomicReference<Run> active = new AtomicReference<>();

	private StreamIngester(Builder builder) {
		this.source = builder.source;
		this.config = builder.config;
		this.listener = builder.listener;
		this.parser = builder.parser != null ? builder.parser : new PatchLineParser();
	}

	public static Builder builder() {
		return new Builder();
	}

	public IngestionConfig config() {
		return config;
	}

	public IngestionResult send(String prompt, Map<String, Object> context) {
		return send(prompt, context, null);
	}

	/**
	 * Generate a document.
	 *
	 * @param prompt the user prompt
	 * @param context passed to the backend unchanged on the first round
	 * @param previousSpec document to continue from; ignored unless it has a root
	 */
	public IngestionResult send(String prompt, Map<String, Object> context, Spec previousSpec) {
		if (prompt == null) {
			throw new IllegalArgumentException("prompt must not be null");
		}
		Map<String, Object> baseContext = context != null ? context : Map.of();
		Run run = new Run();
		Run previous = active.getAndSet(run);
		if (previous != null) {
			logger.debug("Cancelling in-flight ingestion for a new request");
			previous.cancel();
		}

		Spec spec = previousSpec != null && previousSpec.root() != null ? previousSpec : Spec.empty();
		List<SpecIssue> outstanding = List.of();
		List<String> fixes = new ArrayList<>();
		List<String> malformed = new ArrayList<>();
		List<String> raw = new ArrayList<>();
		List<RoundRecord> rounds = new ArrayList<>();
		TokenUsage usage = null;
		IngestionStatus status = IngestionStatus.COMPLETED;

		String roundPrompt = prompt;
		Map<String, Object> roundContext = baseContext;
		int retriesUsed = 0;

		try {
			while (retriesUsed <= config.maxRetries()) {
				int roundNumber = rounds.size() + 1;
				long started = System.nanoTime();
				Round round = new Round(spec);
				try {
					streamRound(run, round, new GenerationRequest(roundPrompt, roundContext, spec));
				}
				catch (IOException | RuntimeException ex) {
					spec = round.spec;
					malformed.addAll(round.malformed);
					raw.addAll(round.raw);
					if (run.isCancelled()) {
						rounds.add(record(roundNumber, RoundOutcome.CANCELLED, round, started, null));
						status = IngestionStatus.CANCELLED;
						return result(spec, status, outstanding, fixes, malformed, raw, usage, null, retriesUsed, rounds);
					}
					GenerationTransportException error = ex instanceof GenerationTransportException gte
							? gte
							: new GenerationTransportException("Generation stream failed: " + ex.getMessage(), ex);
					logger.warn("Generation round {} failed: {}", roundNumber, error.getMessage());
					rounds.add(record(roundNumber, RoundOutcome.TRANSPORT_FAILED, round, started, error.getMessage()));
					listener.onError(error, spec);
					return result(spec, IngestionStatus.FAILED, outstanding, fixes, malformed, raw, usage, error,
							retriesUsed, rounds);
				}

				spec = round.spec;
				malformed.addAll(round.malformed);
				raw.addAll(round.raw);
				if (round.usage != null) {
					usage = round.usage;
				}
				if (run.isCancelled()) {
					rounds.add(record(roundNumber, RoundOutcome.CANCELLED, round, started, null));
					return result(spec, IngestionStatus.CANCELLED, outstanding, fixes, malformed, raw, usage, null,
							retriesUsed, rounds);
				}

				if (round.aborted) {
					String offending = round.malformed.get(round.malformed.size() - 1);
					rounds.add(record(roundNumber, RoundOutcome.MALFORMED_ABORT, round, started,
							"Malformed line: " + offending));
					if (retriesUsed >= config.maxRetries()) {
						logger.warn("Retry budget exhausted after malformed output");
						status = IngestionStatus.RETRIES_EXHAUSTED;
						break;
					}
					retriesUsed++;
					logger.info("Repair round {} of {}: malformed line", retriesUsed, config.maxRetries());
					roundPrompt = RepairPrompts.malformedLine(offending);
					roundContext = withPreviousSpec(baseContext, spec);
					continue;
				}

				if (!config.validate() || spec.root() == null) {
					rounds.add(record(roundNumber, RoundOutcome.COMPLETED, round, started, null));
					break;
				}

				AutoFixResult fixed = SpecValidator.autoFix(spec);
				if (fixed.changed()) {
					spec = fixed.spec();
					fixes.addAll(fixed.fixes());
					listener.onSpecUpdate(spec);
				}
				SpecValidationResult validation = SpecValidator.validate(spec, config.validationOptions());
				outstanding = validation.issues();
				if (validation.valid()) {
					rounds.add(record(roundNumber, RoundOutcome.COMPLETED, round, started, null));
					break;
				}
				String formatted = SpecValidator.formatIssues(validation.issues());
				rounds.add(record(roundNumber, RoundOutcome.VALIDATION_FAILED, round, started, formatted));
				if (retriesUsed >= config.maxRetries()) {
					logger.warn("Retry budget exhausted with {} validation error(s)", validation.errors().size());
					status = IngestionStatus.RETRIES_EXHAUSTED;
					break;
				}
				retriesUsed++;
				logger.info("Repair round {} of {}: {} validation error(s)", retriesUsed, config.maxRetries(),
						validation.errors().size());
				roundPrompt = RepairPrompts.validationErrors(validation.issues());
				roundContext = withPreviousSpec(baseContext, spec);
			}

			listener.onComplete(spec);
			return result(spec, status, outstanding, fixes, malformed, raw, usage, null, retriesUsed, rounds);
		}
		finally {
			active.compareAndSet(run, null);
		}
	}

	/**
	 * Abort the in-flight ingestion, if any.
	 */
	public void cancel() {
		Run run = active.get();
		if (run != null) {
			run.cancel();
		}
	}

	private void streamRound(Run run, Round round, GenerationRequest request) throws IOException {
		try (GenerationStream stream = source.open(request)) {
			run.attach(stream);
			LineAssembler assembler = new LineAssembler();
			String chunk;
			while (!run.isCancelled() && (chunk = stream.nextChunk()) != null) {
				for (String line : assembler.accept(chunk)) {
					if (!processLine(round, line, true)) {
						round.aborted = true;
						return;
					}
				}
			}
			if (run.isCancelled()) {
				return;
			}
			String rest = assembler.finish();
			if (rest != null) {
				processLine(round, rest, false);
			}
		}
		finally {
			run.detach();
		}
	}

	/**
	 * @return false when the line is malformed and the round must abort
	 */
	private boolean processLine(Round round, String line, boolean mayAbort) {
		String trimmed = line.trim();
		if (!trimmed.isEmpty()) {
			round.raw.add(trimmed);
		}
		ParsedLine parsed = parser.parse(trimmed);
		if (parsed instanceof ParsedLine.Patches patches) {
			for (SpecPatch patch : patches.patches()) {
				round.spec = SpecPatcher.apply(round.spec, patch);
				round.patchesApplied++;
			}
			listener.onSpecUpdate(round.spec);
		} else if (parsed instanceof ParsedLine.Usage usage) {
			round.usage = usage.usage();
			listener.onUsage(usage.usage());
		} else if (parsed instanceof ParsedLine.Commentary commentary) {
			logger.debug("Commentary: {}", commentary.text());
		} else if (parsed instanceof ParsedLine.Ignored ignored) {
			logger.warn("Ignoring non-patch line ({}): {}", ignored.reason(), ignored.line());
		} else if (parsed instanceof ParsedLine.Malformed bad) {
			logger.warn("Malformed line: {}", bad.line());
			round.malformed.add(bad.line());
			return !(mayAbort && config.abortOnMalformed());
		}
		return true;
	}

	private static Map<String, Object> withPreviousSpec(Map<String, Object> context, Spec spec) {
		Map<String, Object> repair = new LinkedHashMap<>(context);
		repair.put(GenerationRequest.PREVIOUS_SPEC, SpecJson.toMap(spec));
		return repair;
	}

	private static RoundRecord record(int number, RoundOutcome outcome, Round round, long startedNanos, String error) {
		long millis = Math.max(0, (System.nanoTime() - startedNanos) / 1_000_000);
		return new RoundRecord(number, outcome, round.patchesApplied, round.malformed.size(), millis, error);
	}

	private static IngestionResult result(Spec spec, IngestionStatus status, List<SpecIssue> issues, List<String> fixes,
			List<String> malformed, List<String> raw, TokenUsage usage, Throwable error, int retriesUsed,
			List<RoundRecord> rounds) {
		return new IngestionResult(spec, status, issues, fixes, malformed, raw, usage, error,
				new IngestionMetrics(retriesUsed, rounds));
	}

	/**
	 * Mutable working state of one round.
	 */
	private static final class Round {
		Spec spec;
		final List<String> malformed = new ArrayList<>();
		final List<String> raw = new ArrayList<>();
		int patchesApplied;
		TokenUsage usage;
		boolean aborted;

		Round(Spec spec) {
			this.spec = spec;
		}
	}

	/**
	 * Cancellation handle for one {@code send}.
	 */
	private static final class Run {
		private final AtomicBoolean cancelled = new AtomicBoolean();
		private final AtomicReference<GenerationStream> stream = new AtomicReference<>();

		boolean isCancelled() {
			return cancelled.get();
		}

		void attach(GenerationStream open) {
			stream.set(open);
			if (cancelled.get()) {
				open.close();
			}
		}

		void detach() {
			stream.set(null);
		}

		void cancel() {
			if (cancelled.compareAndSet(false, true)) {
				GenerationStream open = stream.get();
				if (open != null) {
					open.close();
				}
			}
		}
	}

	public static final class Builder {
		private GenerationSource source;
		private IngestionConfig config = IngestionConfig.defaults();
		private IngestionListener listener = IngestionListener.NONE;
		private PatchLineParser parser;

		private Builder() {
		}

		public Builder withSource(GenerationSource source) {
			this.source = source;
			return this;
		}

		public Builder withConfig(IngestionConfig config) {
			this.config = config;
			return this;
		}

		public Builder withListener(IngestionListener listener) {
			this.listener = listener;
			return this;
		}

		public Builder withParser(PatchLineParser parser) {
			this.parser = parser;
			return this;
		}

		public StreamIngester build() {
			if (source == null) {
				throw new IllegalStateException("source must be set");
			}
			if (config == null) {
				throw new IllegalStateException("config must not be null");
			}
			if (listener == null) {
				listener = IngestionListener.NONE;
			}
			return new StreamIngester(this);
		}
	}
}
