package com.cyphergen.exception;

/**
 * Base class for all errors raised while configuring or building a Cypher query.
 *
 * <p>Every failure detected by the compilation engine is reported synchronously
 * to the immediate caller through a subclass of this exception. A build either
 * returns a complete query with its parameters or throws; partially rendered
 * text is never returned.
 *
 * <p>Subclasses:
 * <ul>
 *   <li>{@link NameCollisionException} - two identities competing for one name</li>
 *   <li>{@link AmbiguousParameterBindingException} - one parameter bound to two values</li>
 *   <li>{@link IncompletePatternException} - a pattern ending on a dangling relationship</li>
 *   <li>{@link InvalidQuantifierException} - a malformed variable-length quantifier</li>
 *   <li>{@link CypherGenerationException} - an unexpected failure during a build</li>
 * </ul>
 */
public abstract class CypherBuildException extends RuntimeException {

    protected CypherBuildException(String message) {
        super(message);
    }

    protected CypherBuildException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns a short, user-facing description of what went wrong and how to fix it.
     *
     * @return user-friendly error message
     */
    public abstract String getUserMessage();
}
