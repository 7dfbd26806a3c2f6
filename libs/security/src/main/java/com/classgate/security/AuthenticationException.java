package com.classgate.security;

/**
 * Base type for every reason a request fails to authenticate.
 * <p>
 * Subtypes stay distinct for logging and tests, but an HTTP boundary should map all of them to
 * the same generic "unauthorized" response.
 */
public abstract class AuthenticationException extends RuntimeException {

    protected AuthenticationException(String message) {
        super(message);
    }

    protected AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
