package org.javai.jsonui.spec;

import java.util.List;

/**
 * @param valid true when no issue has error severity
 * @param issues every finding, errors and warnings, in discovery order
 */
public record SpecValidationResult(boolean valid, List<SpecIssue> issues) {

	public SpecValidationResult {
		issues = issues != null ? List.copyOf(issues) : List.of();
	}

	public static SpecValidationResult of(List<SpecIssue> issues) {
		return new SpecValidationResult(issues.stream().noneMatch(SpecIssue::isError), issues);
	}

	public List<SpecIssue> errors() {
		return issues.stream().filter(SpecIssue::isError).toList();
	}

	/**
	 * Errors that local auto-fix cannot repair and that therefore need a repair round.
	 */
	public List<SpecIssue> terminalErrors() {
		return issues.stream().filter(i -> i.isError() && !i.autoFixable()).toList();
	}
}
