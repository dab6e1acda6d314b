package com.cyphergen.clause;

import com.cyphergen.expression.Expression;
import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.generator.CypherQuoting;
import com.cyphergen.reference.Variable;
import java.util.Objects;

/**
 * Projection column with an alias: {@code expression AS alias}.
 *
 * <p>The alias is either a fixed name or a {@link Variable}. A variable alias
 * takes part in naming like any other variable, so later clauses can refer to
 * the projected value through the same object.
 */
public final class AliasedColumn implements Column {

    private final Expression expression;
    private final String aliasName;       // Set for a fixed name
    private final Variable aliasVariable; // Set for a variable alias

    private AliasedColumn(Expression expression, String aliasName, Variable aliasVariable) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.aliasName = aliasName;
        this.aliasVariable = aliasVariable;
    }

    /**
     * Creates a column aliased with a fixed name.
     *
     * @param expression the projected expression
     * @param alias the alias name
     * @return the column
     */
    public static AliasedColumn named(Expression expression, String alias) {
        Objects.requireNonNull(alias, "alias must not be null");
        if (alias.isEmpty()) {
            throw new IllegalArgumentException("alias must not be empty");
        }
        return new AliasedColumn(expression, alias, null);
    }

    /**
     * Creates a column aliased with a variable.
     *
     * @param expression the projected expression
     * @param alias the alias variable
     * @return the column
     */
    public static AliasedColumn bound(Expression expression, Variable alias) {
        return new AliasedColumn(expression, null, Objects.requireNonNull(alias, "alias must not be null"));
    }

    @Override
    public Expression expression() {
        return expression;
    }

    /**
     * Returns the fixed alias name.
     *
     * @return the alias, or null if the alias is a variable
     */
    public String aliasName() {
        return aliasName;
    }

    /**
     * Returns the alias variable.
     *
     * @return the variable, or null if the alias is a fixed name
     */
    public Variable aliasVariable() {
        return aliasVariable;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        String exprCypher = expression.toCypher(env);
        String alias = aliasVariable != null
            ? aliasVariable.toCypher(env)
            : CypherQuoting.escapeIfNeeded(aliasName);
        return exprCypher + " AS " + alias;
    }

    @Override
    public String toString() {
        return String.format("AliasedColumn[%s AS %s]", expression,
            aliasVariable != null ? aliasVariable : aliasName);
    }
}
