package com.cyphergen.reference;

import com.cyphergen.expression.Expression;
import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.generator.CypherQuoting;
import java.util.Objects;

/**
 * A named slot in the generated query: a node alias, a relationship alias or a
 * plain value.
 *
 * <p>A variable is an identity. Every reference to the same object renders the
 * same identifier within one build, and two distinct objects never share one.
 * Equality is therefore object identity; this class does not override
 * {@code equals}.
 *
 * <p>Variables are either anonymous, getting a generated name such as
 * {@code this0}, or explicitly named. Explicit names are used verbatim (escaped
 * with backticks if needed) and are not affected by a build prefix, which makes
 * them the way to share a variable between independently built fragments.
 */
public class Variable implements Expression {

    private final String explicitName;

    /**
     * Creates an anonymous variable.
     */
    public Variable() {
        this.explicitName = null;
    }

    /**
     * Creates a variable with an explicit name.
     *
     * @param explicitName the name (null for an anonymous variable)
     * @throws IllegalArgumentException if the name is empty
     */
    protected Variable(String explicitName) {
        if (explicitName != null && explicitName.trim().isEmpty()) {
            throw new IllegalArgumentException("variable name must not be empty");
        }
        this.explicitName = explicitName;
    }

    /**
     * Creates a variable with an explicit name.
     *
     * @param name the variable name
     * @return the named variable
     */
    public static Variable named(String name) {
        return new Variable(Objects.requireNonNull(name, "name must not be null"));
    }

    /**
     * Returns the caller-supplied name.
     *
     * @return the explicit name, or null if the variable is anonymous
     */
    public String explicitName() {
        return explicitName;
    }

    /**
     * Returns whether this variable was explicitly named.
     *
     * @return true if named, false if the name is generated
     */
    public boolean isNamed() {
        return explicitName != null;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return CypherQuoting.escapeIfNeeded(env.nameOf(this));
    }

    @Override
    public String toString() {
        return String.format("%s[%s]", getClass().getSimpleName(),
            explicitName != null ? explicitName : "anonymous");
    }
}
