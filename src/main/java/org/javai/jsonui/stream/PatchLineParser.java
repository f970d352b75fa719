package org.javai.jsonui.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.jsonui.spec.SpecPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies and parses the lines of a generation stream.
 *
 * <p>Models routinely close one nesting level too many, so a line that fails to parse is retried
 * with up to {@value #MAX_STRIPPED} trailing {@code }} or {@code ]} characters removed, one at a
 * time. A line that needs more than that is malformed.</p>
 */
public class PatchLineParser {

	private static final Logger logger = LoggerFactory.getLogger(PatchLineParser.class);

	public static final int MAX_STRIPPED = 3;
	static final String META_KEY = "__meta";
	static final String USAGE = "usage";

	private final ObjectMapper mapper;

	public PatchLineParser() {
		this(new ObjectMapper());
	}

	public PatchLineParser(ObjectMapper mapper) {
		// trailing garbage must fail, otherwise "{...}}" would parse and recovery never runs
		this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
	}

	public ParsedLine parse(String line) {
		String trimmed = line == null ? "" : line.trim();
		if (trimmed.isEmpty() || trimmed.startsWith("//")) {
			return new ParsedLine.Skip();
		}
		char first = trimmed.charAt(0);
		if (first != '{' && first != '[') {
			return new ParsedLine.Commentary(trimmed);
		}

		Object parsed = tryParse(trimmed);
		int stripped = 0;
		String attempt = trimmed;
		while (parsed == null && stripped < MAX_STRIPPED) {
			char last = attempt.charAt(attempt.length() - 1);
			if (last != '}' && last != ']') {
				break;
			}
			attempt = attempt.substring(0, attempt.length() - 1);
			stripped++;
			if (!attempt.isEmpty()) {
				parsed = tryParse(attempt);
			}
			if (parsed != null) {
				logger.warn("Recovered malformed line by removing {} trailing '{}'", stripped, last);
			}
		}
		if (parsed == null) {
			return new ParsedLine.Malformed(trimmed);
		}
		return classify(trimmed, parsed, stripped);
	}

	private ParsedLine classify(String line, Object parsed, int stripped) {
		if (parsed instanceof Map<?, ?> map) {
			if (USAGE.equals(map.get(META_KEY))) {
				return new ParsedLine.Usage(new TokenUsage(count(map.get("promptTokens")),
						count(map.get("completionTokens")), count(map.get("totalTokens"))));
			}
			try {
				return new ParsedLine.Patches(List.of(SpecPatch.fromMap(map)), stripped);
			}
			catch (IllegalArgumentException ex) {
				return new ParsedLine.Ignored(line, ex.getMessage());
			}
		}
		if (parsed instanceof List<?> list) {
			List<SpecPatch> patches = new ArrayList<>();
			for (Object element : list) {
				if (!(element instanceof Map<?, ?> map)) {
					logger.warn("Skipping non-object element in patch array: {}", element);
					continue;
				}
				try {
					patches.add(SpecPatch.fromMap(map));
				}
				catch (IllegalArgumentException ex) {
					logger.warn("Skipping invalid patch in array: {}", ex.getMessage());
				}
			}
			if (patches.isEmpty()) {
				return new ParsedLine.Ignored(line, "array contains no patches");
			}
			return new ParsedLine.Patches(patches, stripped);
		}
		return new ParsedLine.Ignored(line, "not an object or array");
	}

	private Object tryParse(String text) {
		try {
			return mapper.readValue(text, Object.class);
		}
		catch (JsonProcessingException ex) {
			return null;
		}
	}

	private static long count(Object value) {
		return value instanceof Number n && n.longValue() > 0 ? n.longValue() : 0L;
	}
}
