package com.cyphergen.pattern;

import com.cyphergen.exception.IncompletePatternException;
import com.cyphergen.expression.Expression;
import com.cyphergen.expression.MapExpression;
import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.reference.NodeRef;
import java.util.Map;
import java.util.Objects;

/**
 * A pattern ending on a relationship that has no target node yet:
 * {@code (a)-[r]->}.
 *
 * <p>The relationship-level methods configure the pending relationship and
 * return new handles; {@link #to(NodeRef)} closes the relationship and yields a
 * complete {@link Pattern}. Rendering a partial pattern fails with
 * {@link IncompletePatternException}.
 */
public final class PartialPattern extends PatternChain {

    private final Pattern head;
    private final RelationshipElement pending;

    PartialPattern(Pattern head, RelationshipElement pending) {
        this.head = Objects.requireNonNull(head, "head must not be null");
        this.pending = Objects.requireNonNull(pending, "pending must not be null");
    }

    /**
     * Sets the direction of the pending relationship. Defaults to {@link Direction#RIGHT}.
     *
     * @param direction the direction
     * @return the new partial pattern
     */
    public PartialPattern withDirection(Direction direction) {
        return new PartialPattern(head, pending.withDirection(
            Objects.requireNonNull(direction, "direction must not be null")));
    }

    /**
     * Makes the pending relationship variable-length with an exact number of hops.
     *
     * @param hops the number of hops
     * @return the new partial pattern
     * @throws com.cyphergen.exception.InvalidQuantifierException if hops is negative
     */
    public PartialPattern withLength(int hops) {
        return withLength(PathLength.exactly(hops));
    }

    /**
     * Makes the pending relationship variable-length.
     *
     * @param length the length quantifier
     * @return the new partial pattern
     */
    public PartialPattern withLength(PathLength length) {
        return new PartialPattern(head, pending.withLength(
            Objects.requireNonNull(length, "length must not be null")));
    }

    /**
     * Sets the property block of the pending relationship.
     *
     * @param properties property keys mapped to parameters, literals or other expressions
     * @return the new partial pattern
     */
    public PartialPattern withProperties(Map<String, ? extends Expression> properties) {
        return withProperties(MapExpression.of(properties));
    }

    public PartialPattern withProperties(MapExpression properties) {
        return new PartialPattern(head, pending.withProperties(
            Objects.requireNonNull(properties, "properties must not be null")));
    }

    /**
     * Omits the variable name of the pending relationship.
     *
     * @return the new partial pattern
     */
    public PartialPattern withoutVariable() {
        return new PartialPattern(head, pending.withoutVariable());
    }

    /**
     * Omits the type of the pending relationship.
     *
     * @return the new partial pattern
     */
    public PartialPattern withoutType() {
        return new PartialPattern(head, pending.withoutType());
    }

    /**
     * Closes the pending relationship at a node.
     *
     * @param node the target node
     * @return the complete pattern
     */
    public Pattern to(NodeRef node) {
        Objects.requireNonNull(node, "node must not be null");
        return head.append(pending, new NodeElement(node));
    }

    public RelationshipElement pending() {
        return pending;
    }

    @Override
    public boolean isComplete() {
        return false;
    }

    /**
     * Always fails: a dangling relationship is not valid Cypher.
     *
     * @throws IncompletePatternException always
     */
    @Override
    public String toCypher(CypherEnvironment env) {
        throw new IncompletePatternException(
            "Pattern ends with relationship " + pending.relationship() + " that has no target node");
    }

    @Override
    public String toString() {
        return String.format("PartialPattern[%s, pending=%s]", head, pending);
    }
}
