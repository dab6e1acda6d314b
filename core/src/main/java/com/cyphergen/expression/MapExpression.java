package com.cyphergen.expression;

import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.generator.CypherQuoting;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Map literal whose values are expressions: {@code {name: $param0, year: 1999}}.
 *
 * <p>Entries keep their insertion order, which is also the render order. The
 * same syntax is used for the property blocks of pattern elements.
 *
 * <p>Instances are immutable; {@link #with(String, Expression)} returns a copy.
 */
public final class MapExpression implements Expression {

    private static final MapExpression EMPTY = new MapExpression(Collections.emptyMap());

    private final Map<String, Expression> entries;

    private MapExpression(Map<String, ? extends Expression> entries) {
        this.entries = new LinkedHashMap<>(entries);
    }

    public static MapExpression empty() {
        return EMPTY;
    }

    /**
     * Creates a map expression from key/expression pairs.
     *
     * @param entries the entries, rendered in the map's iteration order
     * @return the map expression
     */
    public static MapExpression of(Map<String, ? extends Expression> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        entries.forEach((key, value) -> {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value for key '" + key + "' must not be null");
        });
        return new MapExpression(entries);
    }

    /**
     * Returns a copy of this map with one entry added or replaced.
     *
     * @param key the key
     * @param value the value expression
     * @return the new map expression
     */
    public MapExpression with(String key, Expression value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<String, Expression> copy = new LinkedHashMap<>(entries);
        copy.put(key, value);
        return new MapExpression(copy);
    }

    /**
     * Returns the entries.
     *
     * @return an unmodifiable view of the entries
     */
    public Map<String, Expression> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return entries.entrySet().stream()
            .map(e -> CypherQuoting.escapeIfNeeded(e.getKey()) + ": " + e.getValue().toCypher(env))
            .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String toString() {
        return "MapExpression" + entries.keySet();
    }
}
