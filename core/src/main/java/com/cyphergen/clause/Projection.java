package com.cyphergen.clause;

import com.cyphergen.ast.CypherNode;
import com.cyphergen.generator.CypherEnvironment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Column list shared by {@code RETURN} and {@code WITH}.
 *
 * <p>A star, if present, always comes first: {@code *, this0.name AS name}.
 * Columns are rendered as given; no rewriting of the rendered text takes place.
 */
public final class Projection implements CypherNode {

    private final boolean star;
    private final List<Column> columns;

    /**
     * Creates a projection.
     *
     * @param star whether {@code *} is projected
     * @param columns the explicit columns
     * @throws IllegalArgumentException if there is neither a star nor a column
     */
    public Projection(boolean star, List<? extends Column> columns) {
        Objects.requireNonNull(columns, "columns must not be null");
        if (!star && columns.isEmpty()) {
            throw new IllegalArgumentException("projection requires at least one column or *");
        }
        this.star = star;
        this.columns = new ArrayList<>(columns);
    }

    public static Projection of(Column... columns) {
        return new Projection(false, List.of(columns));
    }

    public static Projection star(Column... columns) {
        return new Projection(true, List.of(columns));
    }

    public boolean isStar() {
        return star;
    }

    public List<Column> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Returns a copy with more columns appended.
     *
     * @param more the columns to add
     * @return the extended projection
     */
    public Projection addColumns(List<? extends Column> more) {
        List<Column> copy = new ArrayList<>(columns);
        copy.addAll(Objects.requireNonNull(more, "columns must not be null"));
        return new Projection(star, copy);
    }

    @Override
    public String toCypher(CypherEnvironment env) {
        List<String> parts = new ArrayList<>();
        if (star) {
            parts.add("*");
        }
        parts.addAll(columns.stream().map(c -> c.toCypher(env)).collect(Collectors.toList()));
        return String.join(", ", parts);
    }

    @Override
    public String toString() {
        return String.format("Projection[star=%s, %d columns]", star, columns.size());
    }
}
