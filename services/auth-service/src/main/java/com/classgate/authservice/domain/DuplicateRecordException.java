package com.classgate.authservice.domain;

/**
 * Thrown by a {@link UserRepository} when an insert collides with a unique key.
 */
public class DuplicateRecordException extends RuntimeException {

    private final String key;

    public DuplicateRecordException(String key) {
        super("Duplicate value for unique key '%s'".formatted(key));
        this.key = key;
    }

    /** Name of the unique key that collided ("username" or "email"). */
    public String key() {
        return key;
    }
}
