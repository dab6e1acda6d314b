package com.cyphergen.expression;

import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.types.CypherType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Type predicate expression.
 *
 * <p>Examples:
 * <pre>
 *   this0.age IS :: INTEGER
 *   this0.age IS NOT :: INTEGER | FLOAT
 *   this0.tags IS :: LIST&lt;STRING&gt; NOT NULL
 * </pre>
 *
 * <p>{@code NOT NULL} applies to every listed type: a type union is either
 * entirely nullable or entirely non-nullable.
 */
public final class IsType implements Expression {

    private final Expression expression;
    private final List<CypherType> types;
    private final boolean negated;
    private final boolean notNull;

    /**
     * Creates a type predicate.
     *
     * @param expression the expression whose type is checked
     * @param types the accepted types (at least one)
     * @param negated whether the check is {@code IS NOT ::}
     * @param notNull whether {@code NOT NULL} is appended to each type
     */
    public IsType(Expression expression, List<? extends CypherType> types, boolean negated, boolean notNull) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(types, "types must not be null");
        if (types.isEmpty()) {
            throw new IllegalArgumentException("type predicate requires at least one type");
        }
        this.types = new ArrayList<>(types);
        this.negated = negated;
        this.notNull = notNull;
    }

    public IsType(Expression expression, List<? extends CypherType> types, boolean negated) {
        this(expression, types, negated, false);
    }

    /**
     * Returns a copy of this predicate requiring non-null values.
     *
     * @return the non-nullable predicate
     */
    public IsType notNull() {
        return new IsType(expression, types, negated, true);
    }

    public Expression expression() {
        return expression;
    }

    public List<CypherType> types() {
        return Collections.unmodifiableList(types);
    }

    public boolean negated() {
        return negated;
    }

    public boolean isNotNull() {
        return notNull;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        String exprCypher = expression.toCypher(env);
        String suffix = notNull ? " NOT NULL" : "";
        String typesCypher = types.stream()
            .map(type -> type.typeName() + suffix)
            .collect(Collectors.joining(" | "));
        return exprCypher + (negated ? " IS NOT :: " : " IS :: ") + typesCypher;
    }

    @Override
    public String toString() {
        return String.format("IsType[%s, %s, negated=%s, notNull=%s]", expression, types, negated, notNull);
    }
}
