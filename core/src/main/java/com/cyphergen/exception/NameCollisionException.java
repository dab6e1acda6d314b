package com.cyphergen.exception;

/**
 * Exception thrown when two different identities compete for the same name
 * within one build.
 *
 * <p>Raised when an explicitly named variable or parameter reuses a name that is
 * already bound to another identity, or when an extra parameter passed to the
 * build collides with a parameter of the query or with another extra parameter.
 *
 * <p>Example:
 * <pre>
 *   Variable a = Cypher.variable("n");
 *   Variable b = Cypher.variable("n");
 *   // rendering both a and b in the same query throws NameCollisionException
 * </pre>
 */
public class NameCollisionException extends CypherBuildException {

    private final String name;

    /**
     * Creates a name collision exception.
     *
     * @param name the contested name
     * @param message the error message
     */
    public NameCollisionException(String name, String message) {
        super(message + " (name: " + name + ")");
        this.name = name;
    }

    /**
     * Returns the name two identities competed for.
     *
     * @return the contested name
     */
    public String getName() {
        return name;
    }

    @Override
    public String getUserMessage() {
        return "The name '" + name + "' is used by two different variables or parameters. " +
               "Reuse the same object for both references or pick distinct names.";
    }
}
