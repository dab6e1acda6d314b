package com.cyphergen.expression;

import com.cyphergen.ast.CypherNode;

/**
 * Base interface for all Cypher expressions.
 *
 * <p>Expressions are nodes that produce a value, such as:
 * <ul>
 *   <li>Variables and parameters: {@code this0}, {@code $param0}</li>
 *   <li>Literals: {@code 42}, {@code 'Keanu'}, {@code true}</li>
 *   <li>Property access: {@code this0.name}</li>
 *   <li>Comparisons and boolean connectives: {@code this0.age > 30 AND ...}</li>
 *   <li>Function calls: {@code count(this0)}, {@code labels(this0)}</li>
 * </ul>
 *
 * <p>Expressions are used in {@code WHERE} predicates, projections, property
 * blocks of patterns and as function arguments.
 */
public interface Expression extends CypherNode {

    /**
     * Returns an accessor for a property of this expression.
     *
     * @param key the property key
     * @return the property reference
     */
    default PropertyRef property(String key) {
        return new PropertyRef(this, key);
    }
}
