package com.cyphergen.exception;

import com.cyphergen.ast.CypherNode;
import com.cyphergen.clause.Column;
import com.cyphergen.clause.Match;
import com.cyphergen.clause.Return;
import com.cyphergen.generator.CypherGenerator;
import com.cyphergen.pattern.Pattern;
import com.cyphergen.pattern.PathLength;
import com.cyphergen.reference.NodeRef;
import com.cyphergen.reference.RelationshipRef;
import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for error handling and user-friendly error messages.
 *
 * <p>These tests verify that:
 * <ul>
 *   <li>Every build error shares the CypherBuildException base</li>
 *   <li>Exceptions carry the offending name, values or node</li>
 *   <li>User messages are short and actionable</li>
 *   <li>Technical details are available for debugging</li>
 * </ul>
 */
@DisplayName("Error Handling Tests")
public class ErrorHandlingTest {

    @Nested
    @DisplayName("Cypher Generation Exception Tests")
    class CypherGenerationExceptionTests {

        @Test
        @DisplayName("Message includes node type")
        void testMessageIncludesNodeType() {
            Match match = new Match(Pattern.node(new NodeRef("Person")));
            CypherGenerationException ex = new CypherGenerationException("Test error", match);

            assertThat(ex.getMessage()).contains("Match");
            assertThat(ex.getFailedNode()).isSameAs(match);
        }

        @Test
        @DisplayName("User message names the failing clause")
        void testUserMessageForClause() {
            Match match = new Match(Pattern.node(new NodeRef("Person")));
            CypherGenerationException ex = new CypherGenerationException("boom", match);

            assertThat(ex.getUserMessage())
                .contains("MATCH clause")
                .contains("Check");
        }

        @Test
        @DisplayName("User message for projections")
        void testUserMessageForProjection() {
            Return ret = new Return(Column.of(new NodeRef()));
            CypherGenerationException ex = new CypherGenerationException("boom", ret);

            assertThat(ex.getUserMessage()).contains("projection").contains("RETURN");
        }

        @Test
        @DisplayName("User message without a node")
        void testUserMessageWithoutNode() {
            CypherGenerationException ex = new CypherGenerationException("boom", (CypherNode) null);

            assertThat(ex.getMessage()).contains("node type: null");
            assertThat(ex.getUserMessage()).contains("unknown");
        }

        @Test
        @DisplayName("Technical message includes cause and node details")
        void testTechnicalMessage() {
            Match match = new Match(Pattern.node(new NodeRef("Person")));
            CypherGenerationException ex = new CypherGenerationException(
                "Render failed", new IllegalStateException("inner problem"), match);

            String technical = ex.getTechnicalMessage();

            assertThat(technical)
                .contains("Cypher Generation Failed")
                .contains("Render failed")
                .contains(Match.class.getName())
                .contains("inner problem");
        }
    }

    @Nested
    @DisplayName("Build Error Tests")
    class BuildErrorTests {

        @Test
        @DisplayName("All build errors share one base type")
        void testCommonBase() {
            assertThat(new NameCollisionException("n", "collision")).isInstanceOf(CypherBuildException.class);
            assertThat(new AmbiguousParameterBindingException("p", 1, 2)).isInstanceOf(CypherBuildException.class);
            assertThat(new IncompletePatternException("dangling")).isInstanceOf(CypherBuildException.class);
            assertThat(new InvalidQuantifierException("bad", 3, 1)).isInstanceOf(RuntimeException.class);
        }

        @Test
        @DisplayName("Name collision carries the name")
        void testNameCollision() {
            NameCollisionException ex = new NameCollisionException("movie", "Explicit variable name already bound");

            assertThat(ex.getName()).isEqualTo("movie");
            assertThat(ex.getMessage()).contains("movie");
            assertThat(ex.getUserMessage()).contains("'movie'").contains("distinct names");
        }

        @Test
        @DisplayName("Ambiguous binding carries both values")
        void testAmbiguousBinding() {
            AmbiguousParameterBindingException ex = new AmbiguousParameterBindingException("param0", "a", "b");

            assertThat(ex.getParameterName()).isEqualTo("param0");
            assertThat(ex.getFirstValue()).isEqualTo("a");
            assertThat(ex.getSecondValue()).isEqualTo("b");
            assertThat(ex.getMessage()).contains("$param0").contains("a and b");
        }

        @Test
        @DisplayName("Incomplete pattern explains how to fix it")
        void testIncompletePattern() {
            Match match = new Match(Pattern.node(new NodeRef("Person")).related(new RelationshipRef("KNOWS")));

            assertThatThrownBy(() -> CypherGenerator.build(match))
                .isInstanceOfSatisfying(IncompletePatternException.class,
                    e -> assertThat(e.getUserMessage()).contains("to(node)"));
        }

        @Test
        @DisplayName("Invalid quantifier reports its bounds")
        void testInvalidQuantifier() {
            assertThatThrownBy(() -> PathLength.between(5, 2))
                .isInstanceOfSatisfying(InvalidQuantifierException.class, e -> {
                    assertThat(e.getMessage()).contains("min: 5").contains("max: 2");
                    assertThat(e.getUserMessage()).contains("minimum");
                });
        }
    }
}
