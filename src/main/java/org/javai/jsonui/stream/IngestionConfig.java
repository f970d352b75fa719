package org.javai.jsonui.stream;

import org.javai.jsonui.spec.ValidationOptions;

/**
 * Settings for one {@link StreamIngester}.
 *
 * @param validate run auto-fix, validation and repair rounds; also enables mid-stream abort on
 *                 malformed lines
 * @param maxRetries repair rounds allowed after the first, shared between malformed-line and
 *                   validation repairs
 * @param checkOrphans report unreachable nodes as warnings during validation
 */
public record IngestionConfig(boolean validate, int maxRetries, boolean checkOrphans) {

	public static final int DEFAULT_MAX_RETRIES = 5;

	public IngestionConfig {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be >= 0");
		}
	}

	public static IngestionConfig defaults() {
		return new IngestionConfig(false, DEFAULT_MAX_RETRIES, false);
	}

	public boolean abortOnMalformed() {
		return validate;
	}

	public ValidationOptions validationOptions() {
		return new ValidationOptions(checkOrphans);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private boolean validate = false;
		private int maxRetries = DEFAULT_MAX_RETRIES;
		private boolean checkOrphans = false;

		private Builder() {
		}

		public Builder validate(boolean validate) {
			this.validate = validate;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder checkOrphans(boolean checkOrphans) {
			this.checkOrphans = checkOrphans;
			return this;
		}

		public IngestionConfig build() {
			return new IngestionConfig(validate, maxRetries, checkOrphans);
		}
	}
}
