package com.cyphergen.expression;

import com.cyphergen.generator.CypherEnvironment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Expression representing a function call.
 *
 * <p>Function calls invoke built-in or user-defined functions with zero or more arguments.
 *
 * <p>Examples:
 * <pre>
 *   count(this0)                  -- aggregate function
 *   count(DISTINCT this0)         -- aggregate over distinct values
 *   collect(this1.title)          -- list aggregation
 *   toLower(this0.name)           -- string function
 *   apoc.text.join($param0, ',')  -- namespaced procedure function
 * </pre>
 *
 * <p>The function name is emitted verbatim, so it must be a plain, optionally
 * dotted, identifier.
 */
public final class FunctionCall implements Expression {

    private static final Pattern FUNCTION_NAME =
        Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private final String functionName;
    private final List<Expression> arguments;
    private final boolean distinct;

    /**
     * Creates a function call expression.
     *
     * @param functionName the function name
     * @param arguments the function arguments
     * @param distinct whether DISTINCT is applied to arguments
     */
    public FunctionCall(String functionName, List<? extends Expression> arguments, boolean distinct) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (!FUNCTION_NAME.matcher(functionName).matches()) {
            throw new IllegalArgumentException("Invalid function name: '" + functionName + "'");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.distinct = distinct;
    }

    /**
     * Creates a function call expression (non-distinct).
     *
     * @param functionName the function name
     * @param arguments the function arguments
     */
    public FunctionCall(String functionName, List<? extends Expression> arguments) {
        this(functionName, arguments, false);
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Returns the function arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public boolean distinct() {
        return distinct;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        String args = arguments.stream()
            .map(arg -> arg.toCypher(env))
            .collect(Collectors.joining(", "));
        return functionName + "(" + (distinct ? "DISTINCT " : "") + args + ")";
    }

    @Override
    public String toString() {
        return String.format("FunctionCall[%s%s, %d args]", functionName,
            distinct ? " DISTINCT" : "", arguments.size());
    }
}
