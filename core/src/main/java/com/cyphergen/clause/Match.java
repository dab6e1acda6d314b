package com.cyphergen.clause;

import com.cyphergen.expression.BooleanExpression;
import com.cyphergen.expression.Expression;
import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.pattern.PatternChain;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code MATCH} or {@code OPTIONAL MATCH} clause with an optional {@code WHERE}.
 *
 * <p>Examples:
 * <pre>
 *   MATCH (this0:Person)
 *   OPTIONAL MATCH (this0)-[this1:ACTED_IN]-&gt;(this2:Movie)
 *   MATCH (this0:Person), (this1:Movie)
 *   WHERE this0.name = $param0
 * </pre>
 *
 * <p>Immutable; {@link #optional()} and {@link #where(Expression)} return copies.
 */
public final class Match implements Clause {

    private final List<PatternChain> patterns;
    private final boolean optional;
    private final Expression where; // Optional predicate

    /**
     * Creates a MATCH clause over one or more comma-separated patterns.
     *
     * @param patterns the patterns to match
     */
    public Match(PatternChain... patterns) {
        this(List.of(patterns), false, null);
    }

    private Match(List<PatternChain> patterns, boolean optional, Expression where) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("MATCH requires at least one pattern");
        }
        this.patterns = new ArrayList<>(patterns);
        this.optional = optional;
        this.where = where;
    }

    /**
     * Returns an {@code OPTIONAL MATCH} copy of this clause.
     *
     * @return the optional match
     */
    public Match optional() {
        return new Match(patterns, true, where);
    }

    /**
     * Returns a copy of this clause filtered by a predicate. A second call
     * combines the predicates with {@code AND}.
     *
     * @param predicate the WHERE predicate
     * @return the filtered match
     */
    public Match where(Expression predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Expression combined = where == null
            ? predicate
            : BooleanExpression.and(where, predicate);
        return new Match(patterns, optional, combined);
    }

    public List<PatternChain> patterns() {
        return Collections.unmodifiableList(patterns);
    }

    public boolean isOptional() {
        return optional;
    }

    /**
     * Returns the WHERE predicate.
     *
     * @return the predicate, or null if unfiltered
     */
    public Expression where() {
        return where;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        String patternsCypher = patterns.stream()
            .map(p -> p.toCypher(env))
            .collect(Collectors.joining(", "));
        StringBuilder sb = new StringBuilder();
        sb.append(optional ? "OPTIONAL MATCH " : "MATCH ").append(patternsCypher);
        if (where != null) {
            sb.append("\nWHERE ").append(where.toCypher(env));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("Match[%d patterns, optional=%s, where=%s]", patterns.size(), optional, where);
    }
}
