package com.classgate.authservice.domain;

import com.classgate.security.Role;
import java.util.ArrayList;
import java.util.regex.Pattern;

/**
 * Checks registration input against format rules and the configured {@link PasswordPolicy}.
 *
 * <p>Inputs are expected already normalized (username trimmed, email trimmed and lower-cased).
 * All broken rules are reported together.
 */
public final class RegistrationValidator {

    static final int USERNAME_MIN = 3;
    static final int USERNAME_MAX = 32;
    static final int EMAIL_MAX = 254;

    private static final Pattern USERNAME = Pattern.compile("[A-Za-z0-9._-]+");
    private static final Pattern EMAIL =
            Pattern.compile("[^@\\s]+@[^@\\s.]+(\\.[^@\\s.]+)+");

    private final PasswordPolicy passwordPolicy;

    public RegistrationValidator(PasswordPolicy passwordPolicy) {
        this.passwordPolicy = passwordPolicy;
    }

    /**
     * Validates one registration request.
     *
     * @param requestedRole role name supplied by the registrant, or null for the default
     */
    public ValidationResult validate(String username, String email, String password, String requestedRole) {
        var errors = new ArrayList<String>();

        if (isBlank(username)) {
            errors.add("username must not be blank");
        } else {
            if (username.length() < USERNAME_MIN || username.length() > USERNAME_MAX) {
                errors.add("username must be between %d and %d characters"
                        .formatted(USERNAME_MIN, USERNAME_MAX));
            }
            if (!USERNAME.matcher(username).matches()) {
                errors.add("username may only contain letters, digits, '.', '_' and '-'");
            }
        }

        if (isBlank(email)) {
            errors.add("email must not be blank");
        } else if (email.length() > EMAIL_MAX || !EMAIL.matcher(email).matches()) {
            errors.add("email must be a valid address");
        }

        errors.addAll(passwordPolicy.violations(password));

        if (requestedRole != null) {
            Role.fromString(requestedRole).ifPresentOrElse(
                    role -> {
                        if (role == Role.ADMIN) {
                            errors.add("role ADMIN cannot be assigned at registration");
                        }
                    },
                    () -> errors.add("role must be one of STUDENT, INSTRUCTOR"));
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
