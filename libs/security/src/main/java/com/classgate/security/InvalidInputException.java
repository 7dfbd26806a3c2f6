package com.classgate.security;

/**
 * Thrown when a plaintext handed to {@link PasswordHasher#hash(String)} is empty or longer than
 * the hasher accepts.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
