package com.classgate.authservice.domain;

/**
 * Thrown when a login fails.
 * <p>
 * An unknown email and a wrong password produce the same message so a caller cannot tell which
 * accounts exist.
 */
public class InvalidCredentialsException extends RuntimeException {

    public static final String MESSAGE = "Invalid email or password";

    public InvalidCredentialsException() {
        super(MESSAGE);
    }
}
