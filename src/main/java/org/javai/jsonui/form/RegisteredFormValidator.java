package org.javai.jsonui.form;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.javai.jsonui.action.FormValidationResult;
import org.javai.jsonui.action.FormValidator;
import org.javai.jsonui.state.JsonPointer;
import org.javai.jsonui.state.JsonValues;
import org.javai.jsonui.state.StateStore;

/**
 * Form made of fields registered by state path, checked against a {@link StateStore}.
 *
 * <p>This is the collaborator behind the {@code validateForm} built-in action. Results of the
 * latest run are kept per field for the rendering layer.</p>
 */
public class RegisteredFormValidator implements FormValidator {

	private final StateStore stateStore;
	private final FieldValidator fieldValidator;
	private final Map<String, FieldValidation> fields = new ConcurrentHashMap<>();
	private final Map<String, FieldValidationResult> lastResults = new ConcurrentHashMap<>();
	private final List<String> order = new CopyOnWriteArrayList<>();

	public RegisteredFormValidator(StateStore stateStore) {
		this(stateStore, new FieldValidator());
	}

	public RegisteredFormValidator(StateStore stateStore, FieldValidator fieldValidator) {
		this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
		this.fieldValidator = Objects.requireNonNull(fieldValidator, "fieldValidator must not be null");
	}

	public void register(String path, FieldValidation validation) {
		String key = normalise(path);
		if (fields.put(key, Objects.requireNonNull(validation, "validation must not be null")) == null) {
			order.add(key);
		}
	}

	public void unregister(String path) {
		String key = normalise(path);
		fields.remove(key);
		lastResults.remove(key);
		order.remove(key);
	}

	public FieldValidationResult validateField(String path) {
		String key = normalise(path);
		FieldValidation validation = fields.get(key);
		if (validation == null) {
			return FieldValidationResult.skipped();
		}
		Map<String, Object> snapshot = stateStore.getSnapshot();
		FieldValidationResult result = fieldValidator.validate(validation, JsonValues.get(snapshot, key), snapshot);
		lastResults.put(key, result);
		return result;
	}

	@Override
	public FormValidationResult validateAll() {
		Map<String, List<String>> errors = new LinkedHashMap<>();
		for (String path : order) {
			FieldValidationResult result = validateField(path);
			if (!result.valid()) {
				errors.put(path, result.errors());
			}
		}
		return new FormValidationResult(errors.isEmpty(), errors);
	}

	public FieldValidationResult lastResult(String path) {
		return lastResults.get(normalise(path));
	}

	private static String normalise(String path) {
		return JsonPointer.format(JsonPointer.parse(path));
	}
}
