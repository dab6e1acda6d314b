package com.cyphergen.reference;

import com.cyphergen.expression.Expression;
import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.generator.CypherQuoting;
import java.util.Objects;

/**
 * Placeholder for a value passed to the database alongside the query.
 *
 * <p>A parameter renders as {@code $name} and contributes one entry to the
 * parameter map of the build. Like {@link Variable}, a parameter is an identity:
 * all references to the same object share one placeholder and one map entry.
 * Anonymous parameters get generated names ({@code param0}, ...), named ones
 * keep their name regardless of the build prefix.
 *
 * <p>Examples:
 * <pre>
 *   new Param("Keanu")               -- $param0, {param0=Keanu}
 *   Param.named("title", "Matrix")   -- $title,  {title=Matrix}
 * </pre>
 */
public final class Param implements Expression {

    private final String explicitName;
    private final Object value;

    /**
     * Creates an anonymous parameter.
     *
     * @param value the parameter value (may be null)
     */
    public Param(Object value) {
        this(null, value);
    }

    private Param(String explicitName, Object value) {
        if (explicitName != null && explicitName.trim().isEmpty()) {
            throw new IllegalArgumentException("parameter name must not be empty");
        }
        this.explicitName = explicitName;
        this.value = value;
    }

    /**
     * Creates a parameter with an explicit name.
     *
     * @param name the parameter name, without {@code $}
     * @param value the parameter value (may be null)
     * @return the named parameter
     */
    public static Param named(String name, Object value) {
        return new Param(Objects.requireNonNull(name, "name must not be null"), value);
    }

    /**
     * Returns the caller-supplied name.
     *
     * @return the explicit name, or null if the parameter is anonymous
     */
    public String explicitName() {
        return explicitName;
    }

    public boolean isNamed() {
        return explicitName != null;
    }

    /**
     * Returns the parameter value.
     *
     * @return the value, possibly null
     */
    public Object value() {
        return value;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return "$" + CypherQuoting.escapeIfNeeded(env.recordParameter(this, value));
    }

    @Override
    public String toString() {
        return String.format("Param[%s=%s]", explicitName != null ? explicitName : "anonymous", value);
    }
}
