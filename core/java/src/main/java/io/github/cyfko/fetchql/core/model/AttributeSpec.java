package io.github.cyfko.fetchql.core.model;

import java.util.Objects;

/**
 * A selected column.
 *
 * @param name      the column name
 * @param alias     output alias, or {@code null}
 * @param aggregate aggregate function, or {@code null}
 * @param groupBy   whether the query groups by this column
 * @param distinct  whether the aggregate only considers distinct values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AttributeSpec(String name, String alias, AggregateFunction aggregate, boolean groupBy, boolean distinct) {

    public AttributeSpec {
        Objects.requireNonNull(name, "Attribute name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Attribute name cannot be blank");
        }
        if (aggregate != null && groupBy) {
            throw new IllegalArgumentException("Attribute '" + name + "' cannot be both aggregated and grouped");
        }
        if (distinct && aggregate == null) {
            throw new IllegalArgumentException("distinct on attribute '" + name + "' requires an aggregate");
        }
    }

    public static AttributeSpec of(String name) {
        return new AttributeSpec(name, null, null, false, false);
    }

    public static AttributeSpec aliased(String name, String alias) {
        return new AttributeSpec(name, alias, null, false, false);
    }

    public boolean isAggregated() {
        return aggregate != null;
    }
}
