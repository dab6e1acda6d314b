package com.cyphergen.expression;

import com.cyphergen.generator.CypherEnvironment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Boolean connective over one or more predicates.
 *
 * <p>{@code AND}, {@code OR} and {@code XOR} join their operands and are wrapped
 * in parentheses when there is more than one, so that nesting never depends on
 * operator precedence. {@code NOT} takes exactly one operand.
 *
 * <p>Examples:
 * <pre>
 *   (this0.age &gt; 30 AND this0.name = $param0)
 *   NOT (this0.active = true)
 * </pre>
 */
public final class BooleanExpression implements Expression {

    /**
     * Boolean operators.
     */
    public enum Operator {
        AND("AND"),
        OR("OR"),
        XOR("XOR"),
        NOT("NOT");

        private final String keyword;

        Operator(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    private final Operator operator;
    private final List<Expression> operands;

    /**
     * Creates a boolean expression.
     *
     * @param operator the connective
     * @param operands the operands (exactly one for NOT, at least one otherwise)
     */
    public BooleanExpression(Operator operator, List<? extends Expression> operands) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operands, "operands must not be null");
        if (operands.isEmpty()) {
            throw new IllegalArgumentException(operator.keyword() + " requires at least one operand");
        }
        if (operator == Operator.NOT && operands.size() != 1) {
            throw new IllegalArgumentException("NOT requires exactly one operand, got " + operands.size());
        }
        this.operands = new ArrayList<>(operands);
        this.operands.forEach(o -> Objects.requireNonNull(o, "operand must not be null"));
    }

    public static BooleanExpression and(Expression... operands) {
        return new BooleanExpression(Operator.AND, List.of(operands));
    }

    public static BooleanExpression or(Expression... operands) {
        return new BooleanExpression(Operator.OR, List.of(operands));
    }

    public static BooleanExpression xor(Expression... operands) {
        return new BooleanExpression(Operator.XOR, List.of(operands));
    }

    public static BooleanExpression not(Expression operand) {
        return new BooleanExpression(Operator.NOT, List.of(operand));
    }

    public Operator operator() {
        return operator;
    }

    public List<Expression> operands() {
        return Collections.unmodifiableList(operands);
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        if (operator == Operator.NOT) {
            return "NOT (" + operands.get(0).toCypher(env) + ")";
        }
        if (operands.size() == 1) {
            return operands.get(0).toCypher(env);
        }
        return operands.stream()
            .map(o -> o.toCypher(env))
            .collect(Collectors.joining(" " + operator.keyword() + " ", "(", ")"));
    }

    @Override
    public String toString() {
        return String.format("BooleanExpression[%s %s]", operator, operands);
    }
}
