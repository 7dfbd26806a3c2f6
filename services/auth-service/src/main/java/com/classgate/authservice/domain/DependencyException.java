package com.classgate.authservice.domain;

/**
 * Thrown when user storage is unavailable. The only auth failure a caller may retry.
 */
public class DependencyException extends RuntimeException {

    public DependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
