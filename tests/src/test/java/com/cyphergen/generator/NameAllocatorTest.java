package com.cyphergen.generator;

import com.cyphergen.exception.NameCollisionException;
import com.cyphergen.generator.NameAllocator.IdentifierClass;
import com.cyphergen.test.TestBase;
import com.cyphergen.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NameAllocator, the per-build source of variable and
 * parameter names.
 *
 * Tests cover:
 * - Generated name scheme and counter progression
 * - Explicit names and collisions between identities
 * - Prefix handling
 * - Independence of the variable and parameter namespaces
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("NameAllocator Unit Tests")
public class NameAllocatorTest extends TestBase {

    private NameAllocator allocator;

    @Override
    protected void doSetUp() {
        allocator = new NameAllocator(NamingConfig.DEFAULT_PREFIX);
    }

    @Nested
    @DisplayName("Generated Names")
    class GeneratedNameTests {

        @Test
        @DisplayName("Variables are numbered from zero in allocation order")
        void testVariableCounter() {
            assertThat(allocator.allocate(IdentifierClass.VARIABLE, new Object(), null)).isEqualTo("this0");
            assertThat(allocator.allocate(IdentifierClass.VARIABLE, new Object(), null)).isEqualTo("this1");
            assertThat(allocator.allocate(IdentifierClass.VARIABLE, new Object(), null)).isEqualTo("this2");
        }

        @Test
        @DisplayName("Parameters use their own tag and counter")
        void testParameterCounter() {
            allocator.allocate(IdentifierClass.VARIABLE, new Object(), null);
            allocator.allocate(IdentifierClass.VARIABLE, new Object(), null);

            assertThat(allocator.allocate(IdentifierClass.PARAMETER, new Object(), null)).isEqualTo("param0");
            assertThat(allocator.allocate(IdentifierClass.PARAMETER, new Object(), null)).isEqualTo("param1");
        }

        @Test
        @DisplayName("Generated candidate owned by an explicit name is skipped")
        void testSkipsExplicitlyTakenCandidate() {
            Object named = new Object();
            allocator.allocate(IdentifierClass.VARIABLE, named, "this1");

            String first = allocator.allocate(IdentifierClass.VARIABLE, new Object(), null);
            String second = allocator.allocate(IdentifierClass.VARIABLE, new Object(), null);

            logData("Generated", first + ", " + second);
            assertThat(first).isEqualTo("this0");
            assertThat(second).isEqualTo("this2");
        }

        @Test
        @DisplayName("A variable named like a parameter does not shift parameter names")
        void testSeparateNamespaces() {
            allocator.allocate(IdentifierClass.VARIABLE, new Object(), "param0");

            assertThat(allocator.allocate(IdentifierClass.PARAMETER, new Object(), null)).isEqualTo("param0");
            assertThat(allocator.isTaken(IdentifierClass.VARIABLE, "param0")).isTrue();
            assertThat(allocator.isTaken(IdentifierClass.PARAMETER, "param0")).isTrue();
            assertThat(allocator.isTaken(IdentifierClass.PARAMETER, "param1")).isFalse();
        }
    }

    @Nested
    @DisplayName("Explicit Names")
    class ExplicitNameTests {

        @Test
        @DisplayName("Explicit name is returned verbatim")
        void testExplicitNameVerbatim() {
            assertThat(allocator.allocate(IdentifierClass.VARIABLE, new Object(), "movie")).isEqualTo("movie");
        }

        @Test
        @DisplayName("Same identity may claim its explicit name again")
        void testSameIdentityReclaims() {
            Object identity = new Object();
            allocator.allocate(IdentifierClass.VARIABLE, identity, "movie");

            assertThat(allocator.allocate(IdentifierClass.VARIABLE, identity, "movie")).isEqualTo("movie");
        }

        @Test
        @DisplayName("Explicit name owned by another identity is a collision")
        void testCollision() {
            allocator.allocate(IdentifierClass.VARIABLE, new Object(), "movie");

            assertThatThrownBy(() -> allocator.allocate(IdentifierClass.VARIABLE, new Object(), "movie"))
                .isInstanceOf(NameCollisionException.class)
                .hasMessageContaining("movie");
        }

        @Test
        @DisplayName("Explicit name equal to an earlier generated name is a collision")
        void testCollisionWithGeneratedName() {
            allocator.allocate(IdentifierClass.VARIABLE, new Object(), null);

            assertThatThrownBy(() -> allocator.allocate(IdentifierClass.VARIABLE, new Object(), "this0"))
                .isInstanceOf(NameCollisionException.class);
        }

        @Test
        @DisplayName("Null identity is rejected")
        void testNullIdentity() {
            assertThatThrownBy(() -> allocator.allocate(IdentifierClass.VARIABLE, null, null))
                .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("Prefix Handling")
    class PrefixTests {

        @Test
        @DisplayName("Prefix is prepended to generated names only")
        void testPrefixAppliesToGeneratedNames() {
            NameAllocator prefixed = new NameAllocator("sub_");

            assertThat(prefixed.allocate(IdentifierClass.VARIABLE, new Object(), null)).isEqualTo("sub_this0");
            assertThat(prefixed.allocate(IdentifierClass.PARAMETER, new Object(), null)).isEqualTo("sub_param0");
            assertThat(prefixed.allocate(IdentifierClass.VARIABLE, new Object(), "movie")).isEqualTo("movie");
        }

        @Test
        @DisplayName("Null prefix behaves as no prefix")
        void testNullPrefix() {
            NameAllocator unprefixed = new NameAllocator(null);

            assertThat(unprefixed.prefix()).isEmpty();
            assertThat(unprefixed.allocate(IdentifierClass.VARIABLE, new Object(), null)).isEqualTo("this0");
        }

        @Test
        @DisplayName("Prefix that is not an identifier start is rejected")
        void testInvalidPrefix() {
            assertThatThrownBy(() -> new NameAllocator("1x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid name prefix");
            assertThatThrownBy(() -> new NameAllocator("a-b"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
