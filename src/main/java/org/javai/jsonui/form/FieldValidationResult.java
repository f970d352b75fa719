package org.javai.jsonui.form;

import java.util.List;

/**
 * @param valid true when every check passed (or the field was disabled)
 * @param errors messages of the failing checks, in check order
 * @param checks outcome of every check that ran
 */
public record FieldValidationResult(boolean valid, List<String> errors, List<CheckResult> checks) {

	public FieldValidationResult {
		errors = errors != null ? List.copyOf(errors) : List.of();
		checks = checks != null ? List.copyOf(checks) : List.of();
	}

	static FieldValidationResult skipped() {
		return new FieldValidationResult(true, List.of(), List.of());
	}
}
