package com.cyphergen.generator;

import com.cyphergen.exception.AmbiguousParameterBindingException;
import com.cyphergen.exception.NameCollisionException;
import com.cyphergen.reference.NodeRef;
import com.cyphergen.reference.Param;
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
 * Unit tests for CypherEnvironment name memoization and parameter collection.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("CypherEnvironment Unit Tests")
public class CypherEnvironmentTest extends TestBase {

    private CypherEnvironment env;

    @Override
    protected void doSetUp() {
        env = new CypherEnvironment();
    }

    @Nested
    @DisplayName("Variable Names")
    class VariableNameTests {

        @Test
        @DisplayName("Same variable always gets the same name")
        void testMemoized() {
            Variable v = new Variable();

            assertThat(env.nameOf(v)).isEqualTo("this0");
            assertThat(env.nameOf(v)).isEqualTo("this0");
        }

        @Test
        @DisplayName("Distinct variables get distinct names")
        void testDistinctIdentities() {
            NodeRef a = new NodeRef("Person");
            NodeRef b = new NodeRef("Person");

            assertThat(env.nameOf(a)).isNotEqualTo(env.nameOf(b));
        }

        @Test
        @DisplayName("Two named variables with the same name collide")
        void testExplicitCollision() {
            env.nameOf(Variable.named("n"));

            assertThatThrownBy(() -> env.nameOf(Variable.named("n")))
                .isInstanceOfSatisfying(NameCollisionException.class,
                    e -> assertThat(e.getName()).isEqualTo("n"));
        }

        @Test
        @DisplayName("Prefix is visible for diagnostics")
        void testPrefix() {
            CypherEnvironment prefixed = new CypherEnvironment("q1_");

            assertThat(prefixed.prefix()).isEqualTo("q1_");
            assertThat(prefixed.nameOf(new Variable())).isEqualTo("q1_this0");
            assertThat(env.prefix()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Parameter Recording")
    class ParameterTests {

        @Test
        @DisplayName("Recording a parameter adds one entry")
        void testRecord() {
            Param p = new Param("Keanu");

            String name = env.recordParameter(p, p.value());

            assertThat(name).isEqualTo("param0");
            assertThat(env.finalizeParameters()).containsExactly(entry("param0", "Keanu"));
        }

        @Test
        @DisplayName("Recording the same parameter twice keeps one entry")
        void testRecordTwice() {
            Param p = new Param(42);

            env.recordParameter(p, 42);
            env.recordParameter(p, 42);

            assertThat(env.finalizeParameters()).hasSize(1);
        }

        @Test
        @DisplayName("Null values are recorded")
        void testNullValue() {
            Param p = new Param(null);

            env.recordParameter(p, null);
            env.recordParameter(p, null);

            assertThat(env.finalizeParameters()).containsEntry("param0", null);
        }

        @Test
        @DisplayName("Same parameter with a different value is ambiguous")
        void testAmbiguousBinding() {
            Param p = new Param(1);
            env.recordParameter(p, 1);

            assertThatThrownBy(() -> env.recordParameter(p, 2))
                .isInstanceOf(AmbiguousParameterBindingException.class)
                .hasMessageContaining("$param0");
        }

        @Test
        @DisplayName("Anonymous parameter skips a name claimed explicitly")
        void testSkipsNamedParameter() {
            Param named = Param.named("param0", "x");
            Param anonymous = new Param("y");

            env.recordParameter(named, "x");
            String name = env.recordParameter(anonymous, "y");

            assertThat(name).isEqualTo("param1");
            assertThat(env.finalizeParameters()).containsExactly(entry("param0", "x"), entry("param1", "y"));
        }
    }

    @Nested
    @DisplayName("Finalizing Parameters")
    class FinalizeTests {

        @Test
        @DisplayName("Extras are appended after recorded parameters")
        void testExtrasAppended() {
            env.recordParameter(new Param("Keanu"), "Keanu");

            Map<String, Object> params = env.finalizeParameters(List.of(Map.entry("tenant", (Object) "acme")));

            assertThat(params).containsExactly(entry("param0", "Keanu"), entry("tenant", "acme"));
        }

        @Test
        @DisplayName("Extra colliding with a recorded parameter is rejected")
        void testExtraCollidesWithRecorded() {
            env.recordParameter(new Param("Keanu"), "Keanu");

            assertThatThrownBy(() -> env.finalizeParameters(List.of(Map.entry("param0", (Object) "other"))))
                .isInstanceOf(NameCollisionException.class)
                .hasMessageContaining("param0");
        }

        @Test
        @DisplayName("Extra supplied twice is rejected")
        void testDuplicateExtras() {
            List<Map.Entry<String, Object>> extras = List.of(
                Map.entry("tenant", "acme"),
                Map.entry("tenant", "globex"));

            assertThatThrownBy(() -> env.finalizeParameters(extras))
                .isInstanceOf(NameCollisionException.class)
                .hasMessageContaining("supplied twice");
        }
    }
}
