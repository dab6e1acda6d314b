package com.cyphergen.types;

import java.util.Objects;

/**
 * List type over an element type.
 *
 * <p>Example: {@code LIST<STRING>}
 * <p>Supports nesting: {@code LIST<LIST<INTEGER>>}
 */
public final class ListType implements CypherType {

    private final CypherType elementType;

    /**
     * Creates a list type with the given element type.
     *
     * @param elementType the type of elements in the list
     */
    public ListType(CypherType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
    }

    public static ListType of(CypherType elementType) {
        return new ListType(elementType);
    }

    /**
     * Returns the element type.
     *
     * @return the element type
     */
    public CypherType elementType() {
        return elementType;
    }

    @Override
    public String typeName() {
        return "LIST<" + elementType.typeName() + ">";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ListType)) return false;
        ListType that = (ListType) obj;
        return Objects.equals(elementType, that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("LIST", elementType);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
