package org.javai.jsonui.stream;

import org.javai.jsonui.spec.Spec;

/**
 * Progress callbacks from a {@link StreamIngester}. All run on the ingesting thread.
 * A cancelled ingestion fires none of them.
 */
public interface IngestionListener {

	IngestionListener NONE = new IngestionListener() {
	};

	/**
	 * A patch (or auto-fix) produced a new document.
	 */
	default void onSpecUpdate(Spec spec) {
	}

	default void onUsage(TokenUsage usage) {
	}

	default void onComplete(Spec spec) {
	}

	default void onError(Throwable error, Spec partialSpec) {
	}
}
