package com.cyphergen.clause;

import com.cyphergen.generator.CypherEnvironment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Sequence of clauses rendered one per line, sharing one environment.
 *
 * <p>Because the clauses are rendered with the same environment, a variable used
 * in two of them gets the same name in both:
 * <pre>
 *   MATCH (this0:Person)
 *   RETURN this0
 * </pre>
 */
public final class Concat implements Clause {

    private final List<Clause> clauses;

    public Concat(Clause... clauses) {
        this(List.of(clauses));
    }

    public Concat(List<? extends Clause> clauses) {
        Objects.requireNonNull(clauses, "clauses must not be null");
        this.clauses = new ArrayList<>(clauses);
    }

    /**
     * Returns a copy with more clauses appended.
     *
     * @param more the clauses to append
     * @return the extended sequence
     */
    public Concat concat(Clause... more) {
        List<Clause> copy = new ArrayList<>(clauses);
        copy.addAll(List.of(more));
        return new Concat(copy);
    }

    public List<Clause> clauses() {
        return Collections.unmodifiableList(clauses);
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return clauses.stream()
            .map(c -> c.toCypher(env))
            .filter(s -> !s.isEmpty())
            .collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return String.format("Concat[%d clauses]", clauses.size());
    }
}
