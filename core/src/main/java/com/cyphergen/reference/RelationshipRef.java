package com.cyphergen.reference;

import java.util.Objects;

/**
 * Variable standing for a graph relationship, carrying the relationship type.
 *
 * <p>The type is rendered by the pattern the relationship appears in:
 * <pre>
 *   new RelationshipRef("ACTED_IN")        -- [this1:ACTED_IN]
 *   new RelationshipRef()                  -- [this1]
 *   RelationshipRef.named("r", "KNOWS")    -- [r:KNOWS]
 * </pre>
 */
public class RelationshipRef extends Variable {

    private final String type; // Optional relationship type

    /**
     * Creates an anonymous relationship without a type.
     */
    public RelationshipRef() {
        this(null, null);
    }

    /**
     * Creates an anonymous relationship with a type.
     *
     * @param type the relationship type
     */
    public RelationshipRef(String type) {
        this(null, Objects.requireNonNull(type, "type must not be null"));
    }

    /**
     * Creates a relationship with an explicit name and an optional type.
     *
     * @param explicitName the variable name (null for anonymous)
     * @param type the relationship type (may be null)
     */
    protected RelationshipRef(String explicitName, String type) {
        super(explicitName);
        if (type != null && type.isEmpty()) {
            throw new IllegalArgumentException("relationship type must not be empty");
        }
        this.type = type;
    }

    /**
     * Creates a relationship with an explicit variable name.
     *
     * @param name the variable name
     * @param type the relationship type (may be null)
     * @return the named relationship
     */
    public static RelationshipRef named(String name, String type) {
        return new RelationshipRef(Objects.requireNonNull(name, "name must not be null"), type);
    }

    /**
     * Returns the relationship type.
     *
     * @return the type, or null if untyped
     */
    public String type() {
        return type;
    }

    /**
     * Returns whether this relationship has a type.
     *
     * @return true if typed
     */
    public boolean hasType() {
        return type != null;
    }
}
