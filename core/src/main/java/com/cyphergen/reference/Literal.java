package com.cyphergen.reference;

import com.cyphergen.expression.Expression;
import com.cyphergen.generator.CypherEnvironment;
import com.cyphergen.generator.CypherQuoting;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a literal constant inlined in the query text.
 *
 * <p>Supported values:
 * <ul>
 *   <li>Strings: {@code 'Keanu'}, with quotes and backslashes escaped</li>
 *   <li>Numbers: {@code 42}, {@code 3.14}</li>
 *   <li>Booleans: {@code true}, {@code false}</li>
 *   <li>Null: {@code NULL}</li>
 *   <li>Lists of the above: {@code [1, 'a', NULL]}</li>
 * </ul>
 *
 * <p>Values that change between executions belong in a {@link Param} instead.
 */
public final class Literal implements Expression {

    private final Object value;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @throws IllegalArgumentException if the value has no Cypher literal form
     */
    public Literal(Object value) {
        checkSupported(value);
        this.value = value instanceof Collection
            ? Collections.unmodifiableList(new ArrayList<>((Collection<?>) value))
            : value;
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        return format(value);
    }

    private static String format(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String) {
            return CypherQuoting.quoteString((String) value);
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                .map(Literal::format)
                .collect(Collectors.joining(", ", "[", "]"));
        }
        // Numbers and booleans
        return value.toString();
    }

    private static void checkSupported(Object value) {
        if ((value instanceof Double && !Double.isFinite((Double) value))
                || (value instanceof Float && !Float.isFinite((Float) value))) {
            throw new IllegalArgumentException(
                "Non-finite number has no Cypher literal form: " + value + " (use a Param instead)");
        }
        if (value == null || value instanceof String || value instanceof Number
                || value instanceof Boolean) {
            return;
        }
        if (value instanceof Collection) {
            for (Object element : (Collection<?>) value) {
                checkSupported(element);
            }
            return;
        }
        throw new IllegalArgumentException(
            "Unsupported literal type: " + value.getClass().getName() + " (use a Param instead)");
    }

    @Override
    public String toString() {
        return "Literal[" + format(value) + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }
}
