package com.cyphergen.expression;

import com.cyphergen.generator.CypherEnvironment;
import java.util.Objects;

/**
 * Expression comparing two operands.
 *
 * <p>Comparison expressions include:
 * <ul>
 *   <li>Equality: a = b, a &lt;&gt; b</li>
 *   <li>Ordering: a &lt; b, a &lt;= b, a &gt; b, a &gt;= b</li>
 *   <li>String matching: a CONTAINS b, a STARTS WITH b, a ENDS WITH b</li>
 *   <li>Membership: a IN b</li>
 * </ul>
 *
 * <p>Examples:
 * <pre>
 *   this0.name = $param0
 *   this0.title STARTS WITH 'The'
 *   this0.year IN [1999, 2003]
 * </pre>
 */
public final class ComparisonExpression implements Expression {

    /**
     * Comparison operators.
     */
    public enum Operator {
        EQUAL("=", "equal"),
        NOT_EQUAL("<>", "not equal"),
        LESS_THAN("<", "less than"),
        LESS_THAN_OR_EQUAL("<=", "less than or equal"),
        GREATER_THAN(">", "greater than"),
        GREATER_THAN_OR_EQUAL(">=", "greater than or equal"),

        CONTAINS("CONTAINS", "contains"),
        STARTS_WITH("STARTS WITH", "starts with"),
        ENDS_WITH("ENDS WITH", "ends with"),

        IN("IN", "membership");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }

        public boolean isStringMatch() {
            return this == CONTAINS || this == STARTS_WITH || this == ENDS_WITH;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a comparison expression.
     *
     * @param left the left operand
     * @param operator the comparison operator
     * @param right the right operand
     */
    public ComparisonExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        String leftCypher = left.toCypher(env);
        String rightCypher = right.toCypher(env);
        return leftCypher + " " + operator.symbol() + " " + rightCypher;
    }

    @Override
    public String toString() {
        return String.format("ComparisonExpression[%s %s %s]", left, operator.symbol(), right);
    }
}
