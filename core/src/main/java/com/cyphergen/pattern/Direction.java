package com.cyphergen.pattern;

/**
 * Represents the direction of a relationship in a graph pattern.
 */
public enum Direction {
    /** Incoming relationship: (a)&lt;-[r]-(b) */
    LEFT("<-", "-"),

    /** Outgoing relationship: (a)-[r]-&gt;(b) */
    RIGHT("-", "->"),

    /** Relationship in either direction: (a)-[r]-(b) */
    UNDIRECTED("-", "-");

    private final String leftArrow;
    private final String rightArrow;

    Direction(String leftArrow, String rightArrow) {
        this.leftArrow = leftArrow;
        this.rightArrow = rightArrow;
    }

    /**
     * Returns the text placed between the left node and the relationship bracket.
     */
    public String leftArrow() {
        return leftArrow;
    }

    /**
     * Returns the text placed between the relationship bracket and the right node.
     */
    public String rightArrow() {
        return rightArrow;
    }
}
