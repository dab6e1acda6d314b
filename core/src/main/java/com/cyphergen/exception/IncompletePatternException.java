package com.cyphergen.exception;

/**
 * Exception thrown when a pattern ending on a dangling relationship is rendered.
 *
 * <p>A chain such as {@code (a)-[r]->} is a builder state, not valid Cypher. It
 * becomes renderable once the relationship is closed with {@code to(node)}.
 */
public class IncompletePatternException extends CypherBuildException {

    /**
     * Creates an incomplete pattern exception.
     *
     * @param message the error message
     */
    public IncompletePatternException(String message) {
        super(message);
    }

    @Override
    public String getUserMessage() {
        return "A pattern ends with a relationship that has no target node. " +
               "Call to(node) after related(relationship) before building the query.";
    }
}
