package org.javai.jsonui.stream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.jsonui.spec.Spec;
import org.javai.jsonui.spec.SpecJson;

/**
 * One round's request to the generation backend.
 *
 * @param prompt the user prompt, or a repair prompt on retry rounds
 * @param context caller-supplied context; on repair rounds it also carries {@code previousSpec}
 * @param currentSpec the document the round continues from
 */
public record GenerationRequest(String prompt, Map<String, Object> context, Spec currentSpec) {

	public static final String PREVIOUS_SPEC = "previousSpec";

	public GenerationRequest {
		if (prompt == null) {
			throw new IllegalArgumentException("prompt must not be null");
		}
		context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
		currentSpec = currentSpec != null ? currentSpec : Spec.empty();
	}

	/**
	 * Wire body: {@code {"prompt", "context", "currentSpec"}}.
	 */
	public Map<String, Object> toBody() {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("prompt", prompt);
		body.put("context", context);
		body.put("currentSpec", SpecJson.toMap(currentSpec));
		return body;
	}
}
