package com.cyphergen;

import com.cyphergen.clause.Clause;
import com.cyphergen.clause.Concat;
import com.cyphergen.clause.Create;
import com.cyphergen.clause.Match;
import com.cyphergen.clause.Merge;
import com.cyphergen.expression.BooleanExpression;
import com.cyphergen.expression.ComparisonExpression;
import com.cyphergen.expression.ComparisonExpression.Operator;
import com.cyphergen.expression.ElementAccessor;
import com.cyphergen.expression.Expression;
import com.cyphergen.expression.FunctionCall;
import com.cyphergen.expression.IsType;
import com.cyphergen.expression.MapExpression;
import com.cyphergen.expression.NullPredicate;
import com.cyphergen.pattern.Pattern;
import com.cyphergen.pattern.PatternChain;
import com.cyphergen.reference.Literal;
import com.cyphergen.reference.NodeRef;
import com.cyphergen.reference.Param;
import com.cyphergen.reference.RelationshipRef;
import com.cyphergen.reference.Variable;
import com.cyphergen.types.CypherType;
import com.cyphergen.types.ListType;
import java.util.List;

/**
 * Static factories for building Cypher trees.
 *
 * <p>Example:
 * <pre>
 *   NodeRef movie = Cypher.node("Movie");
 *   Param title = Cypher.param("The Matrix");
 *   BuildResult result = Cypher.concat(
 *           Cypher.match(Cypher.pattern(movie)).where(Cypher.eq(movie.property("title"), title)),
 *           new Return(Column.of(movie)))
 *       .build();
 *   // MATCH (this0:Movie)
 *   // WHERE this0.title = $param0
 *   // RETURN this0
 * </pre>
 */
public final class Cypher {

    private Cypher() {}

    // ==================== References ====================

    public static NodeRef node(String... labels) {
        return new NodeRef(labels);
    }

    public static NodeRef namedNode(String name, String... labels) {
        return NodeRef.named(name, labels);
    }

    public static RelationshipRef relationship(String type) {
        return new RelationshipRef(type);
    }

    public static RelationshipRef relationship() {
        return new RelationshipRef();
    }

    public static RelationshipRef namedRelationship(String name, String type) {
        return RelationshipRef.named(name, type);
    }

    public static Variable variable() {
        return new Variable();
    }

    public static Variable variable(String name) {
        return Variable.named(name);
    }

    public static Param param(Object value) {
        return new Param(value);
    }

    public static Param namedParam(String name, Object value) {
        return Param.named(name, value);
    }

    public static Literal literal(Object value) {
        return new Literal(value);
    }

    public static Literal nullLiteral() {
        return new Literal(null);
    }

    // ==================== Patterns and clauses ====================

    public static Pattern pattern(NodeRef node) {
        return Pattern.node(node);
    }

    public static Match match(PatternChain... patterns) {
        return new Match(patterns);
    }

    public static Match optionalMatch(PatternChain... patterns) {
        return new Match(patterns).optional();
    }

    public static Create create(PatternChain... patterns) {
        return new Create(patterns);
    }

    public static Merge merge(PatternChain pattern) {
        return new Merge(pattern);
    }

    public static Concat concat(Clause... clauses) {
        return new Concat(clauses);
    }

    // ==================== Comparisons ====================

    public static ComparisonExpression eq(Expression left, Expression right) {
        return new ComparisonExpression(left, Operator.EQUAL, right);
    }

    public static ComparisonExpression neq(Expression left, Expression right) {
        return new ComparisonExpression(left, Operator.NOT_EQUAL, right);
    }

    public static ComparisonExpression lt(Expression left, Expression right) {
        return new ComparisonExpression(left, Operator.LESS_THAN, right);
    }

    public static ComparisonExpression lte(Expression left, Expression right) {
        return new ComparisonExpression(left, Operator.LESS_THAN_OR_EQUAL, right);
    }

    public static ComparisonExpression gt(Expression left, Expression right) {
        return new ComparisonExpression(left, Operator.GREATER_THAN, right);
    }

    public static ComparisonExpression gte(Expression left, Expression right) {
        return new ComparisonExpression(left, Operator.GREATER_THAN_OR_EQUAL, right);
    }

    public static ComparisonExpression contains(Expression left, Expression right) {
        return new ComparisonExpression(left, Operator.CONTAINS, right);
    }

    public static ComparisonExpression startsWith(Expression left, Expression right) {
        return new ComparisonExpression(left, Operator.STARTS_WITH, right);
    }

    public static ComparisonExpression endsWith(Expression left, Expression right) {
        return new ComparisonExpression(left, Operator.ENDS_WITH, right);
    }

    public static ComparisonExpression in(Expression left, Expression right) {
        return new ComparisonExpression(left, Operator.IN, right);
    }

    // ==================== Predicates ====================

    public static BooleanExpression and(Expression... operands) {
        return BooleanExpression.and(operands);
    }

    public static BooleanExpression or(Expression... operands) {
        return BooleanExpression.or(operands);
    }

    public static BooleanExpression xor(Expression... operands) {
        return BooleanExpression.xor(operands);
    }

    public static BooleanExpression not(Expression operand) {
        return BooleanExpression.not(operand);
    }

    public static NullPredicate isNull(Expression operand) {
        return new NullPredicate(operand, false);
    }

    public static NullPredicate isNotNull(Expression operand) {
        return new NullPredicate(operand, true);
    }

    public static IsType isType(Expression expression, CypherType... types) {
        return new IsType(expression, List.of(types), false);
    }

    public static IsType isNotType(Expression expression, CypherType... types) {
        return new IsType(expression, List.of(types), true);
    }

    public static ListType list(CypherType elementType) {
        return ListType.of(elementType);
    }

    // ==================== Functions ====================

    public static FunctionCall function(String name, Expression... arguments) {
        return new FunctionCall(name, List.of(arguments));
    }

    public static FunctionCall count(Expression argument) {
        return new FunctionCall("count", List.of(argument));
    }

    public static FunctionCall countDistinct(Expression argument) {
        return new FunctionCall("count", List.of(argument), true);
    }

    public static FunctionCall collect(Expression argument) {
        return new FunctionCall("collect", List.of(argument));
    }

    public static ElementAccessor id(Variable element) {
        return ElementAccessor.id(element);
    }

    public static ElementAccessor elementId(Variable element) {
        return ElementAccessor.elementId(element);
    }

    public static ElementAccessor labels(Variable element) {
        return ElementAccessor.labels(element);
    }

    public static ElementAccessor type(Variable element) {
        return ElementAccessor.type(element);
    }

    public static MapExpression map() {
        return MapExpression.empty();
    }
}
