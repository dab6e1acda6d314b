package com.cyphergen.pattern;

import com.cyphergen.expression.Expression;
import com.cyphergen.expression.MapExpression;
import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.reference.NodeRef;
import com.cyphergen.reference.RelationshipRef;
import com.cyphergen.reference.Variable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A complete graph pattern: alternating node and relationship elements, starting
 * and ending with a node.
 *
 * <p>Patterns are immutable. Every builder step returns a new handle, so a
 * pattern can be extended in two different ways without either affecting the
 * other:
 * <pre>
 *   NodeRef person = new NodeRef("Person");
 *   NodeRef movie = new NodeRef("Movie");
 *   Pattern pattern = Pattern.node(person)
 *       .related(new RelationshipRef("ACTED_IN"))
 *       .withDirection(Direction.LEFT)
 *       .to(movie);
 *   // (this0:Person)&lt;-[this1:ACTED_IN]-(this2:Movie)
 * </pre>
 *
 * <p>The node-level methods ({@link #withProperties}, {@link #withoutVariable},
 * {@link #withoutLabels}) apply to the last node of the chain.
 *
 * <p>A variable may appear more than once, closing a cycle. Every occurrence
 * renders the same name; labels, types and properties are rendered only at the
 * first occurrence, later ones are bare:
 * <pre>
 *   (this0:Person)-[this1:KNOWS]-&gt;(this2:Person)-[this3:KNOWS]-&gt;(this0)
 * </pre>
 * An occurrence rendered without its variable is always annotated and does not
 * count as the first occurrence. Quantifiers are rendered at every occurrence.
 */
public final class Pattern extends PatternChain {

    private final List<NodeElement> nodes;
    private final List<RelationshipElement> relationships;

    /**
     * Creates a single-node pattern.
     *
     * @param node the start node
     */
    public Pattern(NodeRef node) {
        this(List.of(new NodeElement(node)), List.of());
    }

    Pattern(List<NodeElement> nodes, List<RelationshipElement> relationships) {
        if (nodes.size() != relationships.size() + 1) {
            throw new IllegalStateException(String.format(
                "Pattern must alternate nodes and relationships: %d nodes, %d relationships",
                nodes.size(), relationships.size()));
        }
        this.nodes = new ArrayList<>(nodes);
        this.relationships = new ArrayList<>(relationships);
    }

    /**
     * Starts a pattern at a node.
     *
     * @param node the start node
     * @return the single-node pattern
     */
    public static Pattern node(NodeRef node) {
        return new Pattern(Objects.requireNonNull(node, "node must not be null"));
    }

    /**
     * Appends a relationship leaving the last node. The result must be closed
     * with {@link PartialPattern#to(NodeRef)} before it can be rendered.
     *
     * @param relationship the relationship
     * @return the partial pattern
     */
    public PartialPattern related(RelationshipRef relationship) {
        return new PartialPattern(this, new RelationshipElement(
            Objects.requireNonNull(relationship, "relationship must not be null")));
    }

    /**
     * Appends an anonymous, untyped relationship.
     *
     * @return the partial pattern
     */
    public PartialPattern related() {
        return related(new RelationshipRef());
    }

    /**
     * Sets the property block of the last node.
     *
     * @param properties property keys mapped to parameters, literals or other expressions
     * @return the new pattern
     */
    public Pattern withProperties(Map<String, ? extends Expression> properties) {
        return withProperties(MapExpression.of(properties));
    }

    public Pattern withProperties(MapExpression properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        return replaceLast(last().withProperties(properties));
    }

    /**
     * Omits the variable name of the last node.
     *
     * @return the new pattern
     */
    public Pattern withoutVariable() {
        return replaceLast(last().withoutVariable());
    }

    /**
     * Omits the labels of the last node.
     *
     * @return the new pattern
     */
    public Pattern withoutLabels() {
        return replaceLast(last().withoutLabels());
    }

    public List<NodeElement> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<RelationshipElement> relationships() {
        return Collections.unmodifiableList(relationships);
    }

    @Override
    public boolean isComplete() {
        return true;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        Set<Variable> annotated = Collections.newSetFromMap(new IdentityHashMap<>());
        StringBuilder sb = new StringBuilder();

        NodeElement first = nodes.get(0);
        sb.append(first.toCypher(env, annotate(annotated, first.node(), first.isWithoutVariable())));
        for (int i = 0; i < relationships.size(); i++) {
            RelationshipElement rel = relationships.get(i);
            sb.append(rel.toCypher(env,
                annotate(annotated, rel.relationship(), rel.isWithoutVariable())));
            NodeElement node = nodes.get(i + 1);
            sb.append(node.toCypher(env, annotate(annotated, node.node(), node.isWithoutVariable())));
        }
        return sb.toString();
    }

    // An occurrence without a name never declares the variable, so it keeps its
    // annotations and leaves the first named occurrence to carry them.
    private static boolean annotate(Set<Variable> annotated, Variable variable, boolean withoutVariable) {
        return withoutVariable || annotated.add(variable);
    }

    NodeElement last() {
        return nodes.get(nodes.size() - 1);
    }

    Pattern replaceLast(NodeElement node) {
        List<NodeElement> copy = new ArrayList<>(nodes);
        copy.set(copy.size() - 1, node);
        return new Pattern(copy, relationships);
    }

    Pattern append(RelationshipElement relationship, NodeElement node) {
        List<NodeElement> nodeCopy = new ArrayList<>(nodes);
        List<RelationshipElement> relCopy = new ArrayList<>(relationships);
        relCopy.add(relationship);
        nodeCopy.add(node);
        return new Pattern(nodeCopy, relCopy);
    }

    @Override
    public String toString() {
        return String.format("Pattern[%d nodes, %d relationships]", nodes.size(), relationships.size());
    }
}
