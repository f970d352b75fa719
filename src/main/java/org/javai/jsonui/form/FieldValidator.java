package org.javai.jsonui.form;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.jsonui.expr.ExpressionResolver;
import org.javai.jsonui.expr.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link FieldValidation} rules against a value.
 *
 * <p>Built-in functions take precedence over custom ones of the same name. A check naming a
 * function that exists nowhere passes, with a warning, so that a generated form is never
 * blocked by a rule the host does not know.</p>
 */
public class FieldValidator {

	private static final Logger logger = LoggerFactory.getLogger(FieldValidator.class);

	private final ExpressionResolver resolver;
	private final Map<String, ValidationFunction> customFunctions;

	public FieldValidator() {
		this(new ExpressionResolver(), Map.of());
	}

	public FieldValidator(ExpressionResolver resolver, Map<String, ValidationFunction> customFunctions) {
		this.resolver = resolver;
		this.customFunctions = Map.copyOf(customFunctions);
	}

	public FieldValidationResult validate(FieldValidation validation, Object value, Map<String, Object> state) {
		ResolutionContext ctx = ResolutionContext.of(state);
		if (validation.enabled() != null && !resolver.evaluate(validation.enabled(), ctx)) {
			return FieldValidationResult.skipped();
		}
		List<CheckResult> results = new ArrayList<>();
		List<String> errors = new ArrayList<>();
		for (ValidationCheck check : validation.checks()) {
			CheckResult result = run(check, value, ctx);
			results.add(result);
			if (!result.valid()) {
				errors.add(result.message());
			}
		}
		return new FieldValidationResult(errors.isEmpty(), errors, results);
	}

	private CheckResult run(ValidationCheck check, Object value, ResolutionContext ctx) {
		ValidationFunction function = BuiltInValidationFunctions.get(check.fn());
		if (function == null) {
			function = customFunctions.get(check.fn());
		}
		if (function == null) {
			logger.warn("Unknown validation function: {}", check.fn());
			return new CheckResult(check.fn(), true, check.message());
		}
		Map<String, Object> args = new LinkedHashMap<>();
		check.args().forEach((name, arg) -> args.put(name, resolver.resolve(arg, ctx)));
		boolean valid;
		try {
			valid = function.test(value, args);
		}
		catch (RuntimeException ex) {
			logger.warn("Validation function {} failed: {}", check.fn(), ex.getMessage());
			valid = false;
		}
		return new CheckResult(check.fn(), valid, check.message());
	}
}
