package org.javai.jsonui.stream;

import java.util.List;
import org.javai.jsonui.spec.SpecPatch;

/**
 * Classification of one line of a generation stream.
 */
public sealed interface ParsedLine {

	/**
	 * Blank line or {@code //} comment.
	 */
	record Skip() implements ParsedLine {
	}

	/**
	 * Narration from the model: the line does not start with {@code {} or {@code [}.
	 */
	record Commentary(String text) implements ParsedLine {
	}

	/**
	 * One or more patches, to be applied in order.
	 *
	 * @param patches the patches
	 * @param strippedCharacters trailing brackets removed to make the line parse (0 when clean)
	 */
	record Patches(List<SpecPatch> patches, int strippedCharacters) implements ParsedLine {
		public Patches {
			patches = patches != null ? List.copyOf(patches) : List.of();
		}

		public boolean recovered() {
			return strippedCharacters > 0;
		}
	}

	record Usage(TokenUsage usage) implements ParsedLine {
	}

	/**
	 * Looked like JSON but did not parse, even after bracket recovery.
	 */
	record Malformed(String line) implements ParsedLine {
	}

	/**
	 * Valid JSON that is neither a patch nor usage metadata.
	 */
	record Ignored(String line, String reason) implements ParsedLine {
	}
}
