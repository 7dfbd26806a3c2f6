package com.classgate.authservice.domain;

/**
 * Thrown when an operation targets a user id that does not exist.
 */
public class UserNotFoundException extends RuntimeException {

    public UserNotFoundException(String userId) {
        super("User not found: " + userId);
    }
}
