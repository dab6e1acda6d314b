package com.cyphergen.ast;

import com.cyphergen.generator.CypherEnvironment;

/**
 * Base interface for everything that can be compiled to Cypher text.
 *
 * <p>Clauses, expressions, references and pattern chains all implement this
 * single method. Composite nodes render their children by calling
 * {@code toCypher} on them with the same environment and join the results with
 * their own syntax; leaf nodes (variables, parameters) ask the environment for
 * their name.
 *
 * <p>Rendering must not mutate the tree. The only side effect allowed is
 * registering names and parameter values in the environment, so that rendering
 * the same tree with two environments yields two independent, valid outputs.
 *
 * <p>Children are rendered left to right, outer to inner: names are generated in
 * the order a reader meets them in the output.
 *
 * @see CypherEnvironment
 */
public interface CypherNode {

    /**
     * Converts this node to its Cypher string representation.
     *
     * @param env the environment assigning names and collecting parameters
     * @return the Cypher text for this node
     */
    String toCypher(CypherEnvironment env);
}
