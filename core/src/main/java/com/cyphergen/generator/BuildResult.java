package com.cyphergen.generator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of building a Cypher tree: the query text and its parameters.
 *
 * @param cypher the generated Cypher query
 * @param parameters the parameter values keyed by placeholder name (without {@code $}),
 *        in the order they were first met
 */
public record BuildResult(String cypher, Map<String, Object> parameters) {

    public BuildResult {
        Objects.requireNonNull(cypher, "cypher must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    @Override
    public String toString() {
        return cypher + " " + parameters;
    }
}
