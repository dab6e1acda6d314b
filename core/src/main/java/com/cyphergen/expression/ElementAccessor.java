package com.cyphergen.expression;

import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.reference.Variable;
import java.util.Objects;

/**
 * Reads a built-in attribute of a graph element through its accessor function.
 *
 * <p>A node's identity and labels are not properties: {@code this0.id} reads a
 * user property called {@code id}, while {@code id(this0)} reads the internal
 * identity. This node makes the choice explicit in the tree:
 * <pre>
 *   ElementAccessor.id(node)        -- id(this0)
 *   ElementAccessor.labels(node)    -- labels(this0)
 *   Cypher.map().with("id", Cypher.id(node))   -- {id: id(this0)}
 * </pre>
 */
public final class ElementAccessor implements Expression {

    /**
     * Accessor kinds.
     */
    public enum Kind {
        ID("id"),
        ELEMENT_ID("elementId"),
        LABELS("labels"),
        TYPE("type");

        private final String function;

        Kind(String function) {
            this.function = function;
        }

        public String function() {
            return function;
        }
    }

    private final Kind kind;
    private final Variable element;

    public ElementAccessor(Kind kind, Variable element) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.element = Objects.requireNonNull(element, "element must not be null");
    }

    public static ElementAccessor id(Variable element) {
        return new ElementAccessor(Kind.ID, element);
    }

    public static ElementAccessor elementId(Variable element) {
        return new ElementAccessor(Kind.ELEMENT_ID, element);
    }

    public static ElementAccessor labels(Variable element) {
        return new ElementAccessor(Kind.LABELS, element);
    }

    public static ElementAccessor type(Variable element) {
        return new ElementAccessor(Kind.TYPE, element);
    }

    public Kind kind() {
        return kind;
    }

    public Variable element() {
        return element;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return kind.function() + "(" + element.toCypher(env) + ")";
    }

    @Override
    public String toString() {
        return String.format("ElementAccessor[%s(%s)]", kind.function(), element);
    }
}
