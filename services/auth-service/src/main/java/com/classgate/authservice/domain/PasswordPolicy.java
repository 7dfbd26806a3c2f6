package com.classgate.authservice.domain;

import com.classgate.security.PasswordHasher;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Complexity rules a new password must meet.
 *
 * @param minLength     minimum number of characters (at least 1)
 * @param requireLetter whether at least one letter is required
 * @param requireDigit  whether at least one digit is required
 */
public record PasswordPolicy(int minLength, boolean requireLetter, boolean requireDigit) {

    public static final int DEFAULT_MIN_LENGTH = 8;

    public PasswordPolicy {
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be >= 1, was " + minLength);
        }
        if (minLength > PasswordHasher.MAX_PASSWORD_BYTES) {
            throw new IllegalArgumentException(
                    "minLength must be <= %d, was %d".formatted(PasswordHasher.MAX_PASSWORD_BYTES, minLength));
        }
    }

    /** At least 8 characters with a letter and a digit. */
    public static PasswordPolicy defaults() {
        return new PasswordPolicy(DEFAULT_MIN_LENGTH, true, true);
    }

    /**
     * Lists every rule the password breaks; empty when it is acceptable.
     */
    public List<String> violations(String password) {
        var errors = new ArrayList<String>();
        if (password == null || password.isEmpty()) {
            errors.add("password must not be empty");
            return errors;
        }
        if (password.length() < minLength) {
            errors.add("password must be at least %d characters".formatted(minLength));
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > PasswordHasher.MAX_PASSWORD_BYTES) {
            errors.add("password must be at most %d bytes".formatted(PasswordHasher.MAX_PASSWORD_BYTES));
        }
        if (requireLetter && password.chars().noneMatch(Character::isLetter)) {
            errors.add("password must contain at least one letter");
        }
        if (requireDigit && password.chars().noneMatch(Character::isDigit)) {
            errors.add("password must contain at least one digit");
        }
        return errors;
    }
}
