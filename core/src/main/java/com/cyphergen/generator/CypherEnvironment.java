package com.cyphergen.generator;

import com.cyphergen.exception.AmbiguousParameterBindingException;
import com.cyphergen.exception.NameCollisionException;
import com.cyphergen.reference.Param;
import com.cyphergen.reference.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compilation context threaded through every {@code toCypher} call of one build.
 *
 * <p>The environment memoizes the name assigned to each variable and parameter
 * identity, so that every reference to the same object renders the same
 * identifier, and collects the parameter values met during rendering.
 *
 * <p>Nodes only see {@link #nameOf(Variable)} and
 * {@link #recordParameter(Param, Object)}. An environment is created by
 * {@link CypherGenerator} for a single build and is never shared between builds
 * or threads.
 */
public final class CypherEnvironment {

    private static final Logger logger = LoggerFactory.getLogger(CypherEnvironment.class);

    private final NameAllocator allocator;
    private final Map<Variable, String> variableNames = new IdentityHashMap<>();
    private final Map<Param, String> parameterNames = new IdentityHashMap<>();
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    /**
     * Creates an environment without a prefix.
     */
    CypherEnvironment() {
        this(NamingConfig.DEFAULT_PREFIX);
    }

    /**
     * Creates an environment applying a prefix to generated names.
     *
     * @param prefix the prefix (may be null or empty)
     */
    CypherEnvironment(String prefix) {
        this.allocator = new NameAllocator(prefix);
    }

    /**
     * Returns the name of a variable, allocating one on first sight.
     *
     * @param variable the variable identity
     * @return the (unescaped) variable name
     * @throws NameCollisionException if the variable's explicit name is owned by another variable
     */
    public String nameOf(Variable variable) {
        Objects.requireNonNull(variable, "variable must not be null");
        String name = variableNames.get(variable);
        if (name == null) {
            name = allocator.allocate(NameAllocator.IdentifierClass.VARIABLE, variable, variable.explicitName());
            variableNames.put(variable, name);
            logger.trace("Assigned variable name {} to {}", name, variable);
        }
        return name;
    }

    /**
     * Returns the placeholder name of a parameter and records its value.
     *
     * <p>Recording the same parameter again with an equal value is a no-op.
     *
     * @param param the parameter identity
     * @param value the value bound to the parameter
     * @return the (unescaped) parameter name, without the {@code $} sigil
     * @throws AmbiguousParameterBindingException if the parameter was recorded with a different value
     * @throws NameCollisionException if the parameter's explicit name is owned by another parameter
     */
    public String recordParameter(Param param, Object value) {
        Objects.requireNonNull(param, "param must not be null");
        String name = parameterNames.get(param);
        if (name != null) {
            Object recorded = parameters.get(name);
            if (!Objects.equals(recorded, value)) {
                throw new AmbiguousParameterBindingException(name, recorded, value);
            }
            return name;
        }

        name = allocator.allocate(NameAllocator.IdentifierClass.PARAMETER, param, param.explicitName());
        parameterNames.put(param, name);
        parameters.put(name, value);
        logger.trace("Assigned parameter name {} to {}", name, param);
        return name;
    }

    /**
     * Returns the prefix applied to generated names in this environment.
     *
     * @return the prefix, empty if none
     */
    public String prefix() {
        return allocator.prefix();
    }

    /**
     * Returns the collected parameters merged with caller-supplied extras.
     *
     * <p>Extras are added even when the tree never references them.
     *
     * @param extraParameters extra named parameters, in insertion order
     * @return the merged parameter map, in insertion order
     * @throws NameCollisionException if an extra name collides with a recorded
     *         parameter or with another extra
     */
    Map<String, Object> finalizeParameters(List<? extends Map.Entry<String, Object>> extraParameters) {
        Map<String, Object> result = new LinkedHashMap<>(parameters);
        for (Map.Entry<String, Object> extra : extraParameters) {
            String name = extra.getKey();
            if (allocator.isTaken(NameAllocator.IdentifierClass.PARAMETER, name)) {
                throw new NameCollisionException(name,
                    "Extra parameter collides with a parameter of the query");
            }
            if (result.containsKey(name)) {
                throw new NameCollisionException(name, "Extra parameter supplied twice");
            }
            result.put(name, extra.getValue());
        }
        return result;
    }

    /**
     * Returns the collected parameters without extras.
     */
    Map<String, Object> finalizeParameters() {
        return finalizeParameters(List.of());
    }
}
