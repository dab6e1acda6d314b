package com.cyphergen.clause;

import com.cyphergen.expression.ComparisonExpression;
import com.cyphergen.expression.FunctionCall;
import com.cyphergen.expression.NullPredicate;
import com.cyphergen.generator.BuildOptions;
import com.cyphergen.generator.BuildResult;
import com.cyphergen.pattern.Pattern;
import com.cyphergen.reference.Literal;
import com.cyphergen.reference.NodeRef;
import com.cyphergen.reference.Param;
import com.cyphergen.reference.RelationshipRef;
import com.cyphergen.reference.Variable;
import com.cyphergen.test.TestBase;
import com.cyphergen.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Map;

/**
 * Unit tests for clause nodes: MATCH, CREATE, MERGE, WITH, RETURN and their
 * concatenation.
 *
 * @see Match
 * @see Return
 * @see Concat
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Clause Unit Tests")
public class ClauseTest extends TestBase {

    private NodeRef person;
    private NodeRef movie;

    @Override
    protected void doSetUp() {
        person = new NodeRef("Person");
        movie = new NodeRef("Movie");
    }

    @Nested
    @DisplayName("MATCH")
    class MatchTests {

        @Test
        @DisplayName("Comma-separated patterns")
        void testMultiplePatterns() {
            Match match = new Match(Pattern.node(person), Pattern.node(movie));

            assertThat(match.build().cypher()).isEqualTo("MATCH (this0:Person), (this1:Movie)");
        }

        @Test
        @DisplayName("OPTIONAL MATCH")
        void testOptional() {
            Match match = new Match(Pattern.node(person)).optional();

            assertThat(match.build().cypher()).isEqualTo("OPTIONAL MATCH (this0:Person)");
            assertThat(match.isOptional()).isTrue();
        }

        @Test
        @DisplayName("Two WHERE calls are combined with AND")
        void testWhereCombined() {
            Match match = new Match(Pattern.node(person))
                .where(new NullPredicate(person.property("name"), true))
                .where(new ComparisonExpression(person.property("born"),
                    ComparisonExpression.Operator.LESS_THAN, new Param(1970)));

            BuildResult result = match.build();

            assertThat(result.cypher()).isEqualTo(
                "MATCH (this0:Person)\nWHERE (this0.name IS NOT NULL AND this0.born < $param0)");
            assertThat(result.parameters()).containsExactly(entry("param0", 1970));
        }

        @Test
        @DisplayName("where returns a copy")
        void testWhereIsPersistent() {
            Match base = new Match(Pattern.node(person));
            base.where(new NullPredicate(person, false));

            assertThat(base.build().cypher()).isEqualTo("MATCH (this0:Person)");
        }

        @Test
        @DisplayName("At least one pattern is required")
        void testNoPatterns() {
            assertThatThrownBy(() -> new Match())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one pattern");
        }
    }

    @Nested
    @DisplayName("CREATE and MERGE")
    class WriteClauseTests {

        @Test
        @DisplayName("CREATE with properties")
        void testCreate() {
            Create create = new Create(Pattern.node(movie)
                .withProperties(Map.of("title", new Param("Heat"))));

            BuildResult result = create.build();

            assertThat(result.cypher()).isEqualTo("CREATE (this0:Movie {title: $param0})");
            assertThat(result.parameters()).containsExactly(entry("param0", "Heat"));
        }

        @Test
        @DisplayName("MERGE relationship between matched nodes")
        void testMerge() {
            Concat query = new Concat(
                new Match(Pattern.node(person), Pattern.node(movie)),
                new Merge(Pattern.node(person).withoutLabels()
                    .related(new RelationshipRef("ACTED_IN"))
                    .to(movie).withoutLabels()));

            assertThat(query.build().cypher()).isEqualTo(
                "MATCH (this0:Person), (this1:Movie)\nMERGE (this0)-[this2:ACTED_IN]->(this1)");
        }
    }

    @Nested
    @DisplayName("RETURN")
    class ReturnTests {

        @Test
        @DisplayName("Plain and aliased columns")
        void testColumns() {
            Return ret = new Return(
                Column.of(person.property("name")),
                Column.as(person.property("born"), "birthYear"));

            assertThat(ret.build().cypher()).isEqualTo("RETURN this0.name, this0.born AS birthYear");
        }

        @Test
        @DisplayName("Variable alias is named by the environment")
        void testVariableAlias() {
            Variable total = new Variable();
            Return ret = new Return(Column.as(new FunctionCall("count", List.of(person)), total))
                .orderBy(total, SortItem.Order.DESC);

            assertThat(ret.build().cypher()).isEqualTo("RETURN count(this0) AS this1\nORDER BY this1 DESC");
        }

        @Test
        @DisplayName("Alias needing escaping is backticked")
        void testEscapedAlias() {
            Return ret = new Return(Column.as(person.property("name"), "full name"));

            assertThat(ret.build().cypher()).isEqualTo("RETURN this0.name AS `full name`");
        }

        @Test
        @DisplayName("DISTINCT, ORDER BY, SKIP and LIMIT")
        void testModifiers() {
            Return ret = new Return(Column.of(person.property("name")))
                .distinct()
                .orderBy(person.property("name"), SortItem.Order.ASC)
                .orderBy(person.property("born"), SortItem.Order.DESC)
                .skip(10)
                .limit(5);

            assertThat(ret.build().cypher()).isEqualTo(
                "RETURN DISTINCT this0.name\nORDER BY this0.name ASC, this0.born DESC\nSKIP 10\nLIMIT 5");
        }

        @Test
        @DisplayName("Star projection comes first")
        void testStar() {
            Return ret = new Return(Projection.star(Column.of(person)));

            assertThat(ret.build().cypher()).isEqualTo("RETURN *, this0");
            assertThat(new Return(Projection.star()).build().cypher()).isEqualTo("RETURN *");
        }

        @Test
        @DisplayName("Empty projection is rejected")
        void testEmptyProjection() {
            assertThatThrownBy(() -> new Return())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one column");
        }

        @Test
        @DisplayName("Negative SKIP or LIMIT is rejected")
        void testNegativeLimit() {
            Return ret = new Return(Column.of(person));

            assertThatThrownBy(() -> ret.skip(-1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ret.limit(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("limit must be non-negative");
        }

        @Test
        @DisplayName("Columns are sealed into plain and aliased variants")
        void testColumnVariants() {
            Column plain = Column.of(person);
            Column aliased = Column.as(person, "p");

            assertThat(plain).isInstanceOf(PlainColumn.class);
            assertThat(aliased).isInstanceOf(AliasedColumn.class);
            assertThat(((AliasedColumn) aliased).aliasName()).isEqualTo("p");
            assertThat(((AliasedColumn) aliased).aliasVariable()).isNull();
        }
    }

    @Nested
    @DisplayName("WITH")
    class WithTests {

        @Test
        @DisplayName("WITH DISTINCT and WHERE")
        void testWith() {
            Variable count = new Variable();
            With with = new With(Column.of(person), Column.as(new FunctionCall("count", List.of(movie)), count))
                .distinct()
                .where(new ComparisonExpression(count, ComparisonExpression.Operator.GREATER_THAN, new Literal(3)));

            assertThat(with.build().cypher())
                .isEqualTo("WITH DISTINCT this0, count(this1) AS this2\nWHERE this2 > 3");
        }

        @Test
        @DisplayName("Projection columns can be added")
        void testAddColumns() {
            Projection projection = Projection.of(Column.of(person))
                .addColumns(List.of(Column.of(movie)));

            assertThat(new With(projection).build().cypher()).isEqualTo("WITH this0, this1");
        }
    }

    @Nested
    @DisplayName("Concatenation")
    class ConcatTests {

        @Test
        @DisplayName("Clauses are joined by newlines and share names")
        void testConcat() {
            Concat query = new Concat(new Match(Pattern.node(person)))
                .concat(new Return(Column.of(person)));

            assertThat(query.build().cypher()).isEqualTo("MATCH (this0:Person)\nRETURN this0");
            assertThat(query.clauses()).hasSize(2);
        }

        @Test
        @DisplayName("Empty clauses are skipped")
        void testEmptyClausesSkipped() {
            Clause empty = env -> "";
            Concat query = new Concat(empty, new Match(Pattern.node(person)), empty);

            assertThat(query.build().cypher()).isEqualTo("MATCH (this0:Person)");
        }

        @Test
        @DisplayName("Named fragments built separately can be glued with a prefix")
        void testPrefixedFragments() {
            NodeRef shared = NodeRef.named("p", "Person");
            BuildResult first = new Match(Pattern.node(shared).related(new RelationshipRef("KNOWS")).to(new NodeRef("Person")))
                .build(BuildOptions.builder().prefix("a_").build());
            BuildResult second = new Match(Pattern.node(shared).withoutLabels().related(new RelationshipRef("LIKES")).to(movie))
                .build("b_");

            assertThat(first.cypher()).isEqualTo("MATCH (p:Person)-[a_this0:KNOWS]->(a_this1:Person)");
            assertThat(second.cypher()).isEqualTo("MATCH (p)-[b_this0:LIKES]->(b_this1:Movie)");
        }
    }
}
