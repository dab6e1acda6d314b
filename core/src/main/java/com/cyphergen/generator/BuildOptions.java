package com.cyphergen.generator;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-build options: the prefix applied to generated names and the extra
 * parameters forced into the output.
 *
 * <p>Extra parameters are kept as an ordered list rather than a map, so that a
 * name supplied twice is reported at build time instead of silently overwritten.
 *
 * <p>Example:
 * <pre>
 *   BuildOptions options = BuildOptions.builder()
 *       .prefix("sub_")
 *       .extraParameter("tenant", "acme")
 *       .build();
 *   BuildResult result = CypherGenerator.build(match, options);
 * </pre>
 */
public final class BuildOptions {

    private static final BuildOptions DEFAULTS = builder().build();

    private final String prefix;
    private final List<Map.Entry<String, Object>> extraParameters;

    private BuildOptions(Builder builder) {
        this.prefix = NamingConfig.normalizePrefix(builder.prefix);
        this.extraParameters = Collections.unmodifiableList(new ArrayList<>(builder.extraParameters));
    }

    /**
     * Returns options with no prefix and no extra parameters.
     *
     * @return the default options
     */
    public static BuildOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the prefix for generated names.
     *
     * @return the prefix, empty if none
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Returns the extra parameters in the order they were supplied.
     *
     * @return an unmodifiable list of name/value pairs
     */
    public List<Map.Entry<String, Object>> extraParameters() {
        return extraParameters;
    }

    @Override
    public String toString() {
        return String.format("BuildOptions[prefix=%s, extraParameters=%d]", prefix, extraParameters.size());
    }

    /**
     * Builder for {@link BuildOptions}.
     */
    public static final class Builder {

        private String prefix = NamingConfig.DEFAULT_PREFIX;
        private final List<Map.Entry<String, Object>> extraParameters = new ArrayList<>();

        private Builder() {}

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        /**
         * Adds an extra named parameter. The value may be null.
         */
        public Builder extraParameter(String name, Object value) {
            Objects.requireNonNull(name, "name must not be null");
            if (name.trim().isEmpty()) {
                throw new IllegalArgumentException("extra parameter name must not be empty");
            }
            extraParameters.add(new AbstractMap.SimpleImmutableEntry<>(name, value));
            return this;
        }

        public Builder extraParameters(Map<String, ?> parameters) {
            Objects.requireNonNull(parameters, "parameters must not be null");
            parameters.forEach(this::extraParameter);
            return this;
        }

        public BuildOptions build() {
            return new BuildOptions(this);
        }
    }
}
