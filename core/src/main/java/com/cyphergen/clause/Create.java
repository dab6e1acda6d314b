package com.cyphergen.clause;

import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.pattern.PatternChain;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code CREATE} clause.
 *
 * <p>Example:
 * <pre>
 *   CREATE (this0:Person {name: $param0})-[this1:ACTED_IN]-&gt;(this2:Movie)
 * </pre>
 */
public final class Create implements Clause {

    private final List<PatternChain> patterns;

    /**
     * Creates a CREATE clause over one or more comma-separated patterns.
     *
     * @param patterns the patterns to create
     */
    public Create(PatternChain... patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        if (patterns.length == 0) {
            throw new IllegalArgumentException("CREATE requires at least one pattern");
        }
        this.patterns = new ArrayList<>(List.of(patterns));
    }

    public List<PatternChain> patterns() {
        return Collections.unmodifiableList(patterns);
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return patterns.stream()
            .map(p -> p.toCypher(env))
            .collect(Collectors.joining(", ", "CREATE ", ""));
    }

    @Override
    public String toString() {
        return String.format("Create[%d patterns]", patterns.size());
    }
}
