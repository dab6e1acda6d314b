package com.cyphergen.pattern;

import com.cyphergen.ast.CypherNode;

/**
 * Any state of the pattern builder: a complete {@link Pattern} or a
 * {@link PartialPattern} waiting for its target node.
 *
 * <p>Clauses accept a {@code PatternChain} so that a chain left dangling is
 * reported when the query is built, with an
 * {@link com.cyphergen.exception.IncompletePatternException}, instead of
 * producing text that is not valid Cypher.
 */
public abstract sealed class PatternChain implements CypherNode permits Pattern, PartialPattern {

    PatternChain() {}

    /**
     * Returns whether this chain ends on a node and can be rendered.
     *
     * @return true for a complete pattern
     */
    public abstract boolean isComplete();
}
