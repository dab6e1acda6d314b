package com.cyphergen.clause;

import com.cyphergen.expression.Expression;
import com.cyphergen.generator.CypherEnvironment;
import java.util.Objects;

/**
 * One {@code ORDER BY} item: {@code this0.name DESC}.
 *
 * @param expression the sort key
 * @param order the sort order
 */
public record SortItem(Expression expression, Order order) {

    /**
     * Sort orders.
     */
    public enum Order {
        ASC, DESC
    }

    public SortItem {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(order, "order must not be null");
    }

    String toCypher(CypherEnvironment env) {
        return expression.toCypher(env) + " " + order.name();
    }
}
