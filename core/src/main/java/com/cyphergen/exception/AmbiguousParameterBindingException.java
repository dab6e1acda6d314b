package com.cyphergen.exception;

/**
 * Exception thrown when the same parameter identity is recorded twice within one
 * build with two different values.
 *
 * <p>The output parameter map holds exactly one value per placeholder; silently
 * keeping either value would produce a query that does not mean what the caller
 * built.
 */
public class AmbiguousParameterBindingException extends CypherBuildException {

    private final String parameterName;
    private final Object firstValue;
    private final Object secondValue;

    /**
     * Creates an ambiguous binding exception.
     *
     * @param parameterName the placeholder name assigned to the parameter
     * @param firstValue the value recorded first
     * @param secondValue the conflicting value
     */
    public AmbiguousParameterBindingException(String parameterName, Object firstValue, Object secondValue) {
        super(String.format("Parameter $%s bound to conflicting values: %s and %s",
            parameterName, firstValue, secondValue));
        this.parameterName = parameterName;
        this.firstValue = firstValue;
        this.secondValue = secondValue;
    }

    public String getParameterName() {
        return parameterName;
    }

    public Object getFirstValue() {
        return firstValue;
    }

    public Object getSecondValue() {
        return secondValue;
    }

    @Override
    public String getUserMessage() {
        return "Parameter $" + parameterName + " was given two different values in the same query. " +
               "Use a separate parameter for each value.";
    }
}
