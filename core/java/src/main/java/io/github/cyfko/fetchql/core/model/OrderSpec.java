package io.github.cyfko.fetchql.core.model;

import java.util.Objects;

/**
 * A sort key.
 * <p>
 * With {@link Target#ATTRIBUTE} the field is a column, possibly qualified as
 * {@code alias.column}; with {@link Target#ALIAS} it names the alias of a selected
 * (usually aggregated) column.
 * </p>
 *
 * @param field      the column or alias name
 * @param descending sort direction
 * @param target     what {@code field} refers to
 * @param entityName link-entity alias qualifying the column, or {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OrderSpec(String field, boolean descending, Target target, String entityName) {

    public enum Target {
        ATTRIBUTE,
        ALIAS
    }

    public OrderSpec {
        Objects.requireNonNull(field, "Order field is required");
        Objects.requireNonNull(target, "Order target is required");
        if (field.isBlank()) {
            throw new IllegalArgumentException("field cannot be blank");
        }
    }

    public static OrderSpec asc(String field) {
        return new OrderSpec(field, false, Target.ATTRIBUTE, null);
    }

    public static OrderSpec desc(String field) {
        return new OrderSpec(field, true, Target.ATTRIBUTE, null);
    }
}
