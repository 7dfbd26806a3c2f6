package com.classgate.security;

/**
 * Thrown when a token's signature does not match the one recomputed over its payload.
 */
public class InvalidSignatureException extends AuthenticationException {

    public InvalidSignatureException(String message) {
        super(message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
