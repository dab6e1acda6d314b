package com.cyphergen.clause;

import com.cyphergen.ast.CypherNode;
import com.cyphergen.expression.Expression;
import com.cyphergen.reference.Variable;

/**
 * One column of a projection: either a plain expression or an expression with
 * an alias.
 *
 * <pre>
 *   Column.of(movie.property("title"))                -- this0.title
 *   Column.as(movie.property("title"), "title")       -- this0.title AS title
 *   Column.as(Cypher.count(movie), countVariable)     -- count(this0) AS this1
 * </pre>
 */
public sealed interface Column extends CypherNode permits PlainColumn, AliasedColumn {

    /**
     * Returns the projected expression.
     *
     * @return the expression
     */
    Expression expression();

    static Column of(Expression expression) {
        return new PlainColumn(expression);
    }

    static Column as(Expression expression, String alias) {
        return AliasedColumn.named(expression, alias);
    }

    static Column as(Expression expression, Variable alias) {
        return AliasedColumn.bound(expression, alias);
    }
}
