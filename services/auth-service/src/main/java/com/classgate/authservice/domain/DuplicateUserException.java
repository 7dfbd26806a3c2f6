package com.classgate.authservice.domain;

/**
 * Thrown when registration collides with an existing username or email, whether caught by the
 * pre-check or reported by the repository on insert.
 */
public class DuplicateUserException extends RuntimeException {

    public DuplicateUserException() {
        super("A user with this username or email already exists");
    }

    public DuplicateUserException(Throwable cause) {
        super("A user with this username or email already exists", cause);
    }
}
