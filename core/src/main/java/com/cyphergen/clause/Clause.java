package com.cyphergen.clause;

import com.cyphergen.ast.CypherNode;
import com.cyphergen.generator.BuildOptions;
import com.cyphergen.generator.BuildResult;
import com.cyphergen.generator.CypherGenerator;

/**
 * A top-level Cypher clause, the usual root of a build.
 *
 * <p>The {@code build} methods are shortcuts for {@link CypherGenerator}.
 */
public interface Clause extends CypherNode {

    default BuildResult build() {
        return CypherGenerator.build(this);
    }

    default BuildResult build(String prefix) {
        return CypherGenerator.build(this, prefix);
    }

    default BuildResult build(BuildOptions options) {
        return CypherGenerator.build(this, options);
    }
}
