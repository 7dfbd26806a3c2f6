package com.classgate.authservice.domain;

/**
 * Thrown by a {@link UserRepository} adapter when the backing store cannot serve a request.
 */
public class RepositoryUnavailableException extends RuntimeException {

    public RepositoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
