package com.cyphergen.exception;

import com.cyphergen.ast.CypherNode;

/**
 * Exception thrown when Cypher generation fails for an unexpected reason.
 *
 * <p>Wraps the underlying cause together with the root node that was being
 * built, so that the failure can be traced back to the part of the tree the
 * caller assembled.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       BuildResult result = CypherGenerator.build(match);
 *   } catch (CypherGenerationException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed node: " + e.getFailedNode());
 *   }
 * </pre>
 *
 * @see com.cyphergen.generator.CypherGenerator
 */
public class CypherGenerationException extends CypherBuildException {

    private final CypherNode failedNode;

    /**
     * Creates a Cypher generation exception.
     *
     * @param message the error message
     * @param node the node that failed to generate Cypher
     */
    public CypherGenerationException(String message, CypherNode node) {
        super(message + " (node type: " + nodeType(node) + ")");
        this.failedNode = node;
    }

    /**
     * Creates a Cypher generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param node the node that failed to generate Cypher
     */
    public CypherGenerationException(String message, Throwable cause, CypherNode node) {
        super(message + " (node type: " + nodeType(node) + ")", cause);
        this.failedNode = node;
    }

    /**
     * Returns the node that failed to generate Cypher.
     *
     * @return the failed node, or null if not available
     */
    public CypherNode getFailedNode() {
        return failedNode;
    }

    @Override
    public String getUserMessage() {
        String type = failedNode != null ? failedNode.getClass().getSimpleName() : "unknown";

        switch (type) {
            case "Match":
            case "Merge":
            case "Create":
                return "Failed to generate Cypher for a " + type.toUpperCase() + " clause. " +
                       "Check the patterns and property values passed to it.";

            case "Return":
            case "With":
                return "Failed to generate Cypher for a projection. " +
                       "Check the columns and aliases passed to " + type.toUpperCase() + ".";

            default:
                return "Failed to generate Cypher for query. " +
                       "Unexpected error while rendering " + type + ".";
        }
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Cypher Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedNode != null) {
            sb.append("Failed Node Type: ").append(failedNode.getClass().getName()).append("\n");
            sb.append("Node String: ").append(failedNode).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }

    private static String nodeType(CypherNode node) {
        return node != null ? node.getClass().getSimpleName() : "null";
    }
}
