package org.javai.jsonui.stream;

import java.util.List;
import org.javai.jsonui.spec.SpecIssue;
import org.javai.jsonui.spec.SpecValidator;

/**
 * Prompts sent on repair rounds.
 */
public final class RepairPrompts {

	static final int MAX_LINE_LENGTH = 500;

	private RepairPrompts() {
	}

	public static String malformedLine(String line) {
		String shown = line.length() > MAX_LINE_LENGTH ? line.substring(0, MAX_LINE_LENGTH) : line;
		return "The previous generation contained malformed JSON that could not be parsed. The line was:\n"
				+ shown
				+ "\n\nThe current spec state is provided. Continue generating from where you left off. "
				+ "Output ONLY the remaining patches needed to complete the UI.";
	}

	public static String validationErrors(List<SpecIssue> issues) {
		return "FIX THE FOLLOWING ERRORS in the current UI spec. Output ONLY the patches needed to fix "
				+ "these issues, do not recreate the entire UI.\n\n"
				+ SpecValidator.formatIssues(issues);
	}
}
