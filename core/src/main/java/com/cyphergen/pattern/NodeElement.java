package com.cyphergen.pattern;

import com.cyphergen.expression.MapExpression;
import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.generator.CypherQuoting;
import com.cyphergen.reference.NodeRef;
import java.util.Objects;

/**
 * A node position in a pattern: {@code (name:Label1:Label2 {key: value})}.
 *
 * <p>Immutable; the {@code with...} methods return modified copies.
 */
public final class NodeElement {

    private final NodeRef node;
    private final MapExpression properties;
    private final boolean withoutVariable;
    private final boolean withoutLabels;

    NodeElement(NodeRef node) {
        this(node, MapExpression.empty(), false, false);
    }

    private NodeElement(NodeRef node, MapExpression properties, boolean withoutVariable, boolean withoutLabels) {
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.withoutVariable = withoutVariable;
        this.withoutLabels = withoutLabels;
    }

    public NodeRef node() {
        return node;
    }

    public MapExpression properties() {
        return properties;
    }

    public boolean isWithoutVariable() {
        return withoutVariable;
    }

    public boolean isWithoutLabels() {
        return withoutLabels;
    }

    NodeElement withProperties(MapExpression properties) {
        return new NodeElement(node, properties, withoutVariable, withoutLabels);
    }

    NodeElement withoutVariable() {
        return new NodeElement(node, properties, true, withoutLabels);
    }

    NodeElement withoutLabels() {
        return new NodeElement(node, properties, withoutVariable, true);
    }

    /**
     * Renders this node element.
     *
     * @param env the environment
     * @param annotate whether labels and properties are rendered; false for a
     *        repeated occurrence of the same node in one pattern
     * @return the Cypher text, including parentheses
     */
    String toCypher(CypherEnvironment env, boolean annotate) {
        StringBuilder sb = new StringBuilder("(");
        if (!withoutVariable) {
            sb.append(node.toCypher(env));
        }
        if (annotate) {
            if (!withoutLabels) {
                for (String label : node.labels()) {
                    sb.append(':').append(CypherQuoting.escapeIfNeeded(label));
                }
            }
            if (!properties.isEmpty()) {
                if (sb.length() > 1) {
                    sb.append(' ');
                }
                sb.append(properties.toCypher(env));
            }
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return String.format("NodeElement[%s, properties=%s]", node, properties);
    }
}
