package com.classgate.authservice.domain;

import java.util.List;

/**
 * Thrown when request input breaks the registration or role rules. Carries every broken rule, not
 * just the first.
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
