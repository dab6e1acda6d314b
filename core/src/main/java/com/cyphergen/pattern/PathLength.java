package com.cyphergen.pattern;

import com.cyphergen.exception.InvalidQuantifierException;
import java.util.Objects;

/**
 * Length quantifier of a variable-length relationship.
 *
 * <p>Quantifiers render as:
 * <pre>
 *   PathLength.exactly(3)        -- *3
 *   PathLength.between(2, 10)    -- *2..10
 *   PathLength.atLeast(2)        -- *2..
 *   PathLength.atMost(5)         -- *..5
 *   PathLength.any()             -- *
 * </pre>
 *
 * <p>Bounds are validated when the quantifier is created, so a malformed length
 * never reaches rendering.
 */
public final class PathLength {

    private static final PathLength ANY = new PathLength(null, null, false);

    private final Integer min;
    private final Integer max;
    private final boolean exact;

    private PathLength(Integer min, Integer max, boolean exact) {
        this.min = min;
        this.max = max;
        this.exact = exact;
    }

    /**
     * Creates an exact length quantifier.
     *
     * @param hops the number of hops
     * @return the quantifier
     * @throws InvalidQuantifierException if hops is negative
     */
    public static PathLength exactly(int hops) {
        if (hops < 0) {
            throw new InvalidQuantifierException("Relationship length must be non-negative", hops, hops);
        }
        return new PathLength(hops, hops, true);
    }

    /**
     * Creates a bounded quantifier. Either bound may be null.
     *
     * @param min the minimum number of hops (null for no lower bound)
     * @param max the maximum number of hops (null for no upper bound)
     * @return the quantifier
     * @throws InvalidQuantifierException if a bound is negative or min exceeds max
     */
    public static PathLength between(Integer min, Integer max) {
        if ((min != null && min < 0) || (max != null && max < 0)) {
            throw new InvalidQuantifierException("Relationship length bounds must be non-negative", min, max);
        }
        if (min != null && max != null && min > max) {
            throw new InvalidQuantifierException("Relationship length minimum exceeds maximum", min, max);
        }
        if (min == null && max == null) {
            return ANY;
        }
        return new PathLength(min, max, false);
    }

    public static PathLength atLeast(int min) {
        return between(min, null);
    }

    public static PathLength atMost(int max) {
        return between(null, max);
    }

    /**
     * Returns the unbounded quantifier.
     *
     * @return the quantifier matching any number of hops
     */
    public static PathLength any() {
        return ANY;
    }

    public Integer min() {
        return min;
    }

    public Integer max() {
        return max;
    }

    public boolean isExact() {
        return exact;
    }

    public boolean isAny() {
        return min == null && max == null;
    }

    /**
     * Converts this quantifier to its Cypher form, including the leading {@code *}.
     *
     * @return the quantifier text
     */
    public String toCypher() {
        if (exact) {
            return "*" + min;
        }
        if (isAny()) {
            return "*";
        }
        return "*" + (min != null ? min : "") + ".." + (max != null ? max : "");
    }

    @Override
    public String toString() {
        return "PathLength[" + toCypher() + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PathLength)) return false;
        PathLength that = (PathLength) obj;
        return exact == that.exact &&
               Objects.equals(min, that.min) &&
               Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max, exact);
    }
}
