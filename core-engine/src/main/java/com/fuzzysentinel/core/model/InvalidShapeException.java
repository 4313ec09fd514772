package com.fuzzysentinel.core.model;

/**
 * Thrown when a membership function is constructed with malformed
 * parameters: a non-finite breakpoint, or breakpoints that are not
 * non-decreasing.
 *
 * <p>
 * This is a configuration-time failure. It is never recovered silently.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidShapeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidShapeException(String message) {
        super(message);
    }
}
