package org.javai.jsonui.action;

/**
 * Aggregate form check consulted by the {@code validateForm} built-in.
 */
@FunctionalInterface
public interface FormValidator {

	FormValidationResult validateAll();
}
