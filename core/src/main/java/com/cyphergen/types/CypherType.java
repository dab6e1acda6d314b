package com.cyphergen.types;

/**
 * Sealed interface for the value types usable in Cypher type predicates.
 *
 * <p>Types are either one of the fixed {@link BaseType}s or a constructed
 * {@link ListType} over another type:
 * <pre>
 *   INTEGER
 *   LOCAL DATETIME
 *   LIST&lt;STRING&gt;
 *   LIST&lt;LIST&lt;FLOAT&gt;&gt;
 * </pre>
 */
public sealed interface CypherType permits BaseType, ListType {

    /**
     * Returns the Cypher spelling of this type.
     *
     * @return the type name
     */
    String typeName();
}
