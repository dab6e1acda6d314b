package com.cyphergen.generator;

import java.util.Locale;
import java.util.Set;

/**
 * Utilities for safely escaping Cypher identifiers and string literals.
 *
 * <p>Labels, relationship types, property keys and explicit variable names are
 * caller-supplied text that ends up verbatim in the query. Anything that is not
 * a plain identifier is wrapped in backticks so that it cannot change the
 * structure of the generated query.
 *
 * <p>Example usage:
 * <pre>
 *   CypherQuoting.escapeIfNeeded("Person");        // Person
 *   CypherQuoting.escapeIfNeeded("Movie Star");    // `Movie Star`
 *   CypherQuoting.escapeIfNeeded("MATCH");         // `MATCH`
 *   CypherQuoting.quoteString("O'Reilly");         // 'O\'Reilly'
 * </pre>
 *
 * @see CypherGenerator
 */
public final class CypherQuoting {

    private static final Set<String> RESERVED_WORDS = Set.of(
        "ALL", "AND", "AS", "ASC", "ASCENDING", "BY", "CALL", "CASE", "CONTAINS",
        "CREATE", "DELETE", "DESC", "DESCENDING", "DETACH", "DISTINCT", "ELSE",
        "END", "ENDS", "EXISTS", "FALSE", "FOREACH", "IN", "IS", "LIMIT", "MATCH",
        "MERGE", "NOT", "NULL", "ON", "OPTIONAL", "OR", "ORDER", "REMOVE", "RETURN",
        "SET", "SKIP", "STARTS", "THEN", "TRUE", "UNION", "UNWIND", "WHEN", "WHERE",
        "WITH", "XOR", "YIELD");

    private CypherQuoting() {}

    /**
     * Escapes an identifier with backticks.
     *
     * <p>Backticks inside the identifier are doubled.
     *
     * @param identifier the identifier to escape
     * @return escaped identifier safe for Cypher
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String escape(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "`" + identifier.replace("`", "``") + "`";
    }

    /**
     * Escapes an identifier only if needed.
     *
     * <p>Plain identifiers are left unescaped to keep the generated query readable.
     *
     * @param identifier the identifier to conditionally escape
     * @return the identifier, escaped if necessary
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String escapeIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        if (needsEscaping(identifier)) {
            return escape(identifier);
        }
        return identifier;
    }

    /**
     * Quotes a string literal value.
     *
     * <p>Uses single quotes; backslashes and single quotes inside the value are
     * backslash-escaped. Returns NULL (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for Cypher, or NULL if value is null
     */
    public static String quoteString(String value) {
        if (value == null) {
            return "NULL";
        }
        String escaped = value.replace("\\", "\\\\").replace("'", "\\'");
        return "'" + escaped + "'";
    }

    /**
     * Checks if an identifier needs escaping.
     *
     * @param identifier the identifier to check
     * @return true if escaping is needed
     */
    static boolean needsEscaping(String identifier) {
        char first = identifier.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return true;
        }

        for (int i = 1; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return true;
            }
        }

        return RESERVED_WORDS.contains(identifier.toUpperCase(Locale.ROOT));
    }
}
