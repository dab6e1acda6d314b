package com.cyphergen.clause;

import com.cyphergen.expression.Expression;
import com.cyphergen.generator.CypherEnvironment;
import java.util.Objects;

/**
 * Projection column without an alias.
 *
 * @param expression the projected expression
 */
public record PlainColumn(Expression expression) implements Column {

    public PlainColumn {
        Objects.requireNonNull(expression, "expression must not be null");
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return expression.toCypher(env);
    }
}
