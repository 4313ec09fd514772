package com.fuzzysentinel.core.model;

/**
 * Thrown when a rule references a (variable, set) pair that is not defined,
 * or when a degree is looked up for a pair that was never fuzzified.
 *
 * <p>
 * This signals a broken configuration, not a data anomaly. It is raised
 * when the inference configuration is built, so a running engine only sees
 * it if a caller bypasses that validation.
 * </p>
 *
 * @since 1.0.0
 */
public class UnknownTermException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public UnknownTermException(String message) {
        super(message);
    }
}
