package com.cyphergen.exception;

/**
 * Exception thrown when a variable-length quantifier is malformed.
 *
 * <p>Raised when the pattern is configured, never deferred to rendering: a
 * minimum greater than the maximum, or a negative bound.
 */
public class InvalidQuantifierException extends CypherBuildException {

    private final Integer min;
    private final Integer max;

    /**
     * Creates an invalid quantifier exception.
     *
     * @param message the error message
     * @param min the requested minimum (may be null)
     * @param max the requested maximum (may be null)
     */
    public InvalidQuantifierException(String message, Integer min, Integer max) {
        super(message + " (min: " + min + ", max: " + max + ")");
        this.min = min;
        this.max = max;
    }

    public Integer getMin() {
        return min;
    }

    public Integer getMax() {
        return max;
    }

    @Override
    public String getUserMessage() {
        return "Invalid relationship length: bounds must be non-negative and the minimum " +
               "must not exceed the maximum.";
    }
}
