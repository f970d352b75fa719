package org.javai.jsonui.form;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validation rules of one form field.
 *
 * @param checks rules, evaluated in order; every failing rule contributes its message
 * @param enabled condition gating the whole field, {@code null} for always
 */
public record FieldValidation(List<ValidationCheck> checks, Object enabled) {

	public FieldValidation {
		checks = checks != null ? List.copyOf(checks) : List.of();
	}

	public static FieldValidation of(ValidationCheck... checks) {
		return new FieldValidation(List.of(checks), null);
	}

	/**
	 * Read the {@code {checks: [...], enabled: ...}} form found in generated documents. Entries of
	 * {@code checks} that are not checks are skipped.
	 */
	public static FieldValidation fromValue(Object raw) {
		if (!(raw instanceof Map<?, ?> map)) {
			return new FieldValidation(List.of(), null);
		}
		List<ValidationCheck> checks = new ArrayList<>();
		if (map.get("checks") instanceof List<?> list) {
			for (Object element : list) {
				ValidationCheck check = ValidationCheck.fromValue(element);
				if (check != null) {
					checks.add(check);
				}
			}
		}
		return new FieldValidation(checks, map.get("enabled"));
	}
}
