package com.cyphergen.generator;

import java.util.regex.Pattern;

/**
 * Configuration constants for generated identifiers.
 */
public final class NamingConfig {

    private NamingConfig() {} // Utility class

    /** Class tag of generated variable names: this0, this1, ... */
    public static final String VARIABLE_TAG = "this";

    /** Class tag of generated parameter names: param0, param1, ... */
    public static final String PARAMETER_TAG = "param";

    /** Prefix applied to generated names when the caller supplies none */
    public static final String DEFAULT_PREFIX = "";

    private static final Pattern VALID_PREFIX = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Validate and normalize a prefix for generated names.
     *
     * <p>A prefix is glued in front of generated names, so it must itself be the
     * start of a plain identifier.
     *
     * @param prefix the requested prefix (may be null)
     * @return the prefix, or {@link #DEFAULT_PREFIX} for null
     * @throws IllegalArgumentException if the prefix is not a valid identifier start
     */
    public static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return DEFAULT_PREFIX;
        }
        if (!VALID_PREFIX.matcher(prefix).matches()) {
            throw new IllegalArgumentException(
                "Invalid name prefix (must start with letter/underscore, " +
                "contain only alphanumeric/underscore): " + prefix);
        }
        return prefix;
    }
}
