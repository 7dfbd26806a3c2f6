package com.classgate.security;

/**
 * Thrown when a request carries no usable bearer token.
 */
public class MissingTokenException extends AuthenticationException {

    public MissingTokenException() {
        super("No bearer token present in the Authorization header");
    }
}
