package com.cyphergen.generator;

import com.cyphergen.ast.CypherNode;
import com.cyphergen.exception.CypherBuildException;
import com.cyphergen.exception.CypherGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Cypher generator that compiles a tree of {@link CypherNode}s to a query string
 * and its parameter map.
 *
 * <p>This is the single entry point for turning a tree into output. Every call
 * creates a fresh {@link CypherEnvironment}, renders the root with it, merges the
 * caller's extra parameters and returns both. No state survives between calls,
 * so concurrent builds of unrelated trees need no locking.
 *
 * <p>Example usage:
 * <pre>
 *   NodeRef person = Cypher.node("Person");
 *   Match match = new Match(Pattern.node(person));
 *   BuildResult result = CypherGenerator.build(match);
 *   // result.cypher(): MATCH (this0:Person)
 * </pre>
 *
 * @see CypherNode
 */
public final class CypherGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CypherGenerator.class);

    private CypherGenerator() {}

    /**
     * Builds a tree with no prefix and no extra parameters.
     *
     * @param root the root node
     * @return the query text and parameters
     * @throws NullPointerException if root is null
     * @throws CypherBuildException if the tree cannot be compiled
     */
    public static BuildResult build(CypherNode root) {
        return build(root, BuildOptions.defaults());
    }

    /**
     * Builds a tree applying a prefix to every generated name.
     *
     * @param root the root node
     * @param prefix the prefix for generated names (may be null or empty)
     * @return the query text and parameters
     * @throws CypherBuildException if the tree cannot be compiled
     */
    public static BuildResult build(CypherNode root, String prefix) {
        return build(root, BuildOptions.builder().prefix(prefix).build());
    }

    /**
     * Builds a tree with the given options.
     *
     * <p>If rendering fails, the environment is discarded and the error reaches
     * the caller; no partial text is returned. Errors of the compilation engine
     * and argument errors are rethrown unchanged, anything else is wrapped in a
     * {@link CypherGenerationException} naming the root node.
     *
     * @param root the root node
     * @param options the prefix and extra parameters
     * @return the query text and parameters
     * @throws NullPointerException if root or options is null
     * @throws CypherBuildException if the tree cannot be compiled
     */
    public static BuildResult build(CypherNode root, BuildOptions options) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(options, "options must not be null");

        CypherEnvironment env = new CypherEnvironment(options.prefix());
        try {
            String cypher = root.toCypher(env);
            Map<String, Object> parameters = env.finalizeParameters(options.extraParameters());

            logger.debug("Built Cypher ({} parameters): {}", parameters.size(), cypher);
            return new BuildResult(cypher, parameters);

        } catch (CypherBuildException e) {
            throw e;

        } catch (IllegalArgumentException | UnsupportedOperationException e) {
            // Validation errors from quoting and node construction
            throw e;

        } catch (RuntimeException e) {
            throw new CypherGenerationException(
                "Unexpected error during Cypher generation", e, root);
        }
    }
}
