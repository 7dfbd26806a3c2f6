package com.classgate.security;

/**
 * Thrown when a stored password digest is not a well-formed bcrypt string.
 * <p>
 * The digest itself is never part of the message.
 */
public class CorruptDigestException extends RuntimeException {

    public CorruptDigestException(String message) {
        super(message);
    }
}
