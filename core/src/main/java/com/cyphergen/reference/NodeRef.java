package com.cyphergen.reference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Variable standing for a graph node, carrying the node's labels.
 *
 * <p>Labels are rendered by the pattern the node appears in:
 * <pre>
 *   new NodeRef("Person", "Actor")   -- (this0:Person:Actor)
 *   NodeRef.named("p", "Person")     -- (p:Person)
 * </pre>
 */
public class NodeRef extends Variable {

    private final List<String> labels;

    /**
     * Creates an anonymous node with the given labels.
     *
     * @param labels the node labels (may be empty)
     */
    public NodeRef(String... labels) {
        this(null, Arrays.asList(labels));
    }

    /**
     * Creates an anonymous node with the given labels.
     *
     * @param labels the node labels (may be empty)
     */
    public NodeRef(List<String> labels) {
        this(null, labels);
    }

    /**
     * Creates a node with an explicit name and labels.
     *
     * @param explicitName the variable name (null for anonymous)
     * @param labels the node labels
     */
    protected NodeRef(String explicitName, List<String> labels) {
        super(explicitName);
        Objects.requireNonNull(labels, "labels must not be null");
        for (String label : labels) {
            Objects.requireNonNull(label, "label must not be null");
            if (label.isEmpty()) {
                throw new IllegalArgumentException("label must not be empty");
            }
        }
        this.labels = new ArrayList<>(labels);
    }

    /**
     * Creates a node with an explicit variable name.
     *
     * @param name the variable name
     * @param labels the node labels
     * @return the named node
     */
    public static NodeRef named(String name, String... labels) {
        return new NodeRef(Objects.requireNonNull(name, "name must not be null"), Arrays.asList(labels));
    }

    /**
     * Returns the node labels.
     *
     * @return an unmodifiable list of labels
     */
    public List<String> labels() {
        return Collections.unmodifiableList(labels);
    }
}
