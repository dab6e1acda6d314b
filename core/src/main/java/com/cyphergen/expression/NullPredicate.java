package com.cyphergen.expression;

import com.cyphergen.generator.CypherEnvironment;
import java.util.Objects;

/**
 * Null check: {@code x IS NULL} or {@code x IS NOT NULL}.
 */
public final class NullPredicate implements Expression {

    private final Expression operand;
    private final boolean negated;

    public NullPredicate(Expression operand, boolean negated) {
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
        this.negated = negated;
    }

    public Expression operand() {
        return operand;
    }

    public boolean negated() {
        return negated;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return operand.toCypher(env) + (negated ? " IS NOT NULL" : " IS NULL");
    }

    @Override
    public String toString() {
        return String.format("NullPredicate[%s, negated=%s]", operand, negated);
    }
}
