package com.cyphergen.pattern;

import com.cyphergen.expression.MapExpression;
import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.generator.CypherQuoting;
import com.cyphergen.reference.RelationshipRef;
import java.util.Objects;

/**
 * A relationship position in a pattern, including its arrows:
 * {@code -[name:TYPE*1..3 {key: value}]->}.
 *
 * <p>Immutable; the {@code with...} methods return modified copies.
 */
public final class RelationshipElement {

    private final RelationshipRef relationship;
    private final Direction direction;
    private final PathLength length; // null when not variable-length
    private final MapExpression properties;
    private final boolean withoutVariable;
    private final boolean withoutType;

    RelationshipElement(RelationshipRef relationship) {
        this(relationship, Direction.RIGHT, null, MapExpression.empty(), false, false);
    }

    private RelationshipElement(RelationshipRef relationship, Direction direction, PathLength length,
                                MapExpression properties, boolean withoutVariable, boolean withoutType) {
        this.relationship = Objects.requireNonNull(relationship, "relationship must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.length = length;
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.withoutVariable = withoutVariable;
        this.withoutType = withoutType;
    }

    public RelationshipRef relationship() {
        return relationship;
    }

    public Direction direction() {
        return direction;
    }

    /**
     * Returns the length quantifier.
     *
     * @return the quantifier, or null for a single-hop relationship
     */
    public PathLength length() {
        return length;
    }

    public MapExpression properties() {
        return properties;
    }

    public boolean isWithoutVariable() {
        return withoutVariable;
    }

    public boolean isWithoutType() {
        return withoutType;
    }

    RelationshipElement withDirection(Direction direction) {
        return new RelationshipElement(relationship, direction, length, properties, withoutVariable, withoutType);
    }

    RelationshipElement withLength(PathLength length) {
        return new RelationshipElement(relationship, direction, length, properties, withoutVariable, withoutType);
    }

    RelationshipElement withProperties(MapExpression properties) {
        return new RelationshipElement(relationship, direction, length, properties, withoutVariable, withoutType);
    }

    RelationshipElement withoutVariable() {
        return new RelationshipElement(relationship, direction, length, properties, true, withoutType);
    }

    RelationshipElement withoutType() {
        return new RelationshipElement(relationship, direction, length, properties, withoutVariable, true);
    }

    /**
     * Renders this relationship element with its arrows.
     *
     * <p>The quantifier describes this position of the pattern rather than the
     * relationship itself, so it is rendered even for a repeated occurrence.
     *
     * @param env the environment
     * @param annotate whether type and properties are rendered; false for a
     *        repeated occurrence of the same relationship in one pattern
     * @return the Cypher text
     */
    String toCypher(CypherEnvironment env, boolean annotate) {
        StringBuilder sb = new StringBuilder();
        sb.append(direction.leftArrow()).append('[');
        if (!withoutVariable) {
            sb.append(relationship.toCypher(env));
        }
        if (annotate && !withoutType && relationship.hasType()) {
            sb.append(':').append(CypherQuoting.escapeIfNeeded(relationship.type()));
        }
        if (length != null) {
            sb.append(length.toCypher());
        }
        if (annotate && !properties.isEmpty()) {
            if (sb.length() > direction.leftArrow().length() + 1) {
                sb.append(' ');
            }
            sb.append(properties.toCypher(env));
        }
        sb.append(']').append(direction.rightArrow());
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("RelationshipElement[%s, %s, length=%s]", relationship, direction, length);
    }
}
