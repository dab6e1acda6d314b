package com.cyphergen.clause;

import com.cyphergen.expression.BooleanExpression;
import com.cyphergen.expression.Expression;
import com.cyphergen.generator.CypherEnvironment;
import java.util.Objects;

/**
 * {@code WITH} clause, piping a projection into the next part of the query,
 * with optional {@code DISTINCT} and {@code WHERE}.
 *
 * <p>Example:
 * <pre>
 *   WITH this0, count(this1) AS this2
 *   WHERE this2 &gt; $param0
 * </pre>
 */
public final class With implements Clause {

    private final Projection projection;
    private final boolean distinct;
    private final Expression where; // Optional predicate

    public With(Projection projection) {
        this(projection, false, null);
    }

    public With(Column... columns) {
        this(Projection.of(columns));
    }

    private With(Projection projection, boolean distinct, Expression where) {
        this.projection = Objects.requireNonNull(projection, "projection must not be null");
        this.distinct = distinct;
        this.where = where;
    }

    public With distinct() {
        return new With(projection, true, where);
    }

    public With where(Expression predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Expression combined = where == null ? predicate : BooleanExpression.and(where, predicate);
        return new With(projection, distinct, combined);
    }

    public Projection projection() {
        return projection;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        StringBuilder sb = new StringBuilder("WITH ");
        if (distinct) {
            sb.append("DISTINCT ");
        }
        sb.append(projection.toCypher(env));
        if (where != null) {
            sb.append("\nWHERE ").append(where.toCypher(env));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("With[%s, distinct=%s]", projection, distinct);
    }
}
