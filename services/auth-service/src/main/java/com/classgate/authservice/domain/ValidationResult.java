package com.classgate.authservice.domain;

import java.util.List;

/**
 * Result of validating registration input.
 *
 * @param valid  true if validation passed with no errors
 * @param errors human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /**
     * @throws ValidationException if this result is not valid
     */
    public void orThrow() {
        if (!valid) {
            throw new ValidationException(errors);
        }
    }
}
