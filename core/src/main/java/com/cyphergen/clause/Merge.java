package com.cyphergen.clause;

import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.pattern.PatternChain;
import java.util.Objects;

/**
 * {@code MERGE} clause over a single pattern.
 *
 * <p>Example:
 * <pre>
 *   MERGE (this0:Person {name: $param0})
 * </pre>
 */
public final class Merge implements Clause {

    private final PatternChain pattern;

    public Merge(PatternChain pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
    }

    public PatternChain pattern() {
        return pattern;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return "MERGE " + pattern.toCypher(env);
    }

    @Override
    public String toString() {
        return String.format("Merge[%s]", pattern);
    }
}
