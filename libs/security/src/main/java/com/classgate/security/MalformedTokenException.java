package com.classgate.security;

/**
 * Thrown when a token cannot be parsed into header, payload and signature, or its payload lacks
 * the claims every issued token carries.
 */
public class MalformedTokenException extends AuthenticationException {

    public MalformedTokenException(String message) {
        super(message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
