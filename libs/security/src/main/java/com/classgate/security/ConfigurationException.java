package com.classgate.security;

/**
 * Thrown when security components are constructed or called with unusable configuration
 * (blank signing secret, missing token lifetime, out-of-range work factor).
 * <p>
 * Raised at startup; the process should not come up with it.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
