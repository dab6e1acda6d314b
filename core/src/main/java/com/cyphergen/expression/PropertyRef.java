package com.cyphergen.expression;

import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.generator.CypherQuoting;
import java.util.Objects;

/**
 * Expression representing access to a property of a node, relationship or map.
 *
 * <p>Examples:
 * <pre>
 *   this0.name
 *   this0.`release year`
 *   this0.address.city      -- nested access
 * </pre>
 */
public final class PropertyRef implements Expression {

    private final Expression target;
    private final String key;

    /**
     * Creates a property reference.
     *
     * @param target the expression whose property is read
     * @param key the property key
     */
    public PropertyRef(Expression target, String key) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
    }

    public Expression target() {
        return target;
    }

    public String key() {
        return key;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return target.toCypher(env) + "." + CypherQuoting.escapeIfNeeded(key);
    }

    @Override
    public String toString() {
        return String.format("PropertyRef[%s.%s]", target, key);
    }
}
