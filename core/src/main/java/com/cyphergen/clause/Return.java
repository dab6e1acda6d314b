package com.cyphergen.clause;

import com.cyphergen.expression.Expression;
import com.cyphergen.generator.CypherEnvironment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code RETURN} clause with optional {@code DISTINCT}, {@code ORDER BY},
 * {@code SKIP} and {@code LIMIT}.
 *
 * <p>Example:
 * <pre>
 *   RETURN DISTINCT this0.title AS title, count(this1) AS actors
 *   ORDER BY title ASC
 *   SKIP 10
 *   LIMIT 5
 * </pre>
 *
 * <p>Immutable; the modifiers return copies.
 */
public final class Return implements Clause {

    private final Projection projection;
    private final boolean distinct;
    private final List<SortItem> orderBy;
    private final Integer skip;
    private final Integer limit;

    public Return(Projection projection) {
        this(projection, false, List.of(), null, null);
    }

    public Return(Column... columns) {
        this(Projection.of(columns));
    }

    private Return(Projection projection, boolean distinct, List<SortItem> orderBy, Integer skip, Integer limit) {
        this.projection = Objects.requireNonNull(projection, "projection must not be null");
        this.distinct = distinct;
        this.orderBy = new ArrayList<>(orderBy);
        this.skip = skip;
        this.limit = limit;
    }

    public Return distinct() {
        return new Return(projection, true, orderBy, skip, limit);
    }

    /**
     * Returns a copy with one more sort key appended.
     *
     * @param expression the sort key
     * @param order the sort order
     * @return the new clause
     */
    public Return orderBy(Expression expression, SortItem.Order order) {
        List<SortItem> copy = new ArrayList<>(orderBy);
        copy.add(new SortItem(expression, order));
        return new Return(projection, distinct, copy, skip, limit);
    }

    public Return skip(int skip) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be non-negative: " + skip);
        }
        return new Return(projection, distinct, orderBy, skip, limit);
    }

    public Return limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative: " + limit);
        }
        return new Return(projection, distinct, orderBy, skip, limit);
    }

    public Projection projection() {
        return projection;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public List<SortItem> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        StringBuilder sb = new StringBuilder("RETURN ");
        if (distinct) {
            sb.append("DISTINCT ");
        }
        sb.append(projection.toCypher(env));
        if (!orderBy.isEmpty()) {
            sb.append("\nORDER BY ").append(orderBy.stream()
                .map(item -> item.toCypher(env))
                .collect(Collectors.joining(", ")));
        }
        if (skip != null) {
            sb.append("\nSKIP ").append(skip);
        }
        if (limit != null) {
            sb.append("\nLIMIT ").append(limit);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("Return[%s, distinct=%s]", projection, distinct);
    }
}
