package io.github.cyfko.fetchql.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A joined collection, declared by a {@code <link-entity>} element.
 * <p>
 * {@code from} is the join column on the linked collection and {@code to} the join column
 * on its parent (the root entity or the enclosing link). A link carries its own columns,
 * filter, sort keys and further nested links.
 * </p>
 *
 * @param name          the joined collection
 * @param from          join column on the joined collection
 * @param to            join column on the parent
 * @param joinType      inner or outer join
 * @param alias         alias of the joined collection, or {@code null}
 * @param allAttributes whether every column of the link is selected
 * @param attributes    selected columns
 * @param filter        join filter, or {@code null}
 * @param links         nested links
 * @param orders        sort keys declared inside the link
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LinkedEntity(
        String name,
        String from,
        String to,
        JoinType joinType,
        String alias,
        boolean allAttributes,
        List<AttributeSpec> attributes,
        FilterGroup filter,
        List<LinkedEntity> links,
        List<OrderSpec> orders
) {

    public LinkedEntity {
        Objects.requireNonNull(name, "Link-entity name is required");
        Objects.requireNonNull(from, "Link-entity 'from' is required");
        Objects.requireNonNull(to, "Link-entity 'to' is required");
        Objects.requireNonNull(joinType, "Join type is required");
        if (name.isBlank() || from.isBlank() || to.isBlank()) {
            throw new IllegalArgumentException("Link-entity name, from and to cannot be blank");
        }
        attributes = List.copyOf(attributes == null ? List.of() : attributes);
        links = List.copyOf(links == null ? List.of() : links);
        orders = List.copyOf(orders == null ? List.of() : orders);
    }

    /**
     * Returns the name the link is referenced by: its alias if declared, its collection name otherwise.
     *
     * @return the effective alias
     */
    public String effectiveAlias() {
        return alias != null ? alias : name;
    }

    public static Builder builder(String name, String from, String to) {
        return new Builder(name, from, to);
    }

    public static final class Builder {
        private final String name;
        private final String from;
        private final String to;
        private JoinType joinType = JoinType.INNER;
        private String alias;
        private boolean allAttributes;
        private final List<AttributeSpec> attributes = new ArrayList<>();
        private FilterGroup filter;
        private final List<LinkedEntity> links = new ArrayList<>();
        private final List<OrderSpec> orders = new ArrayList<>();

        private Builder(String name, String from, String to) {
            this.name = name;
            this.from = from;
            this.to = to;
        }

        public Builder joinType(JoinType joinType) { this.joinType = joinType; return this; }
        public Builder alias(String alias) { this.alias = alias; return this; }
        public Builder allAttributes(boolean allAttributes) { this.allAttributes = allAttributes; return this; }
        public Builder attribute(AttributeSpec attribute) { this.attributes.add(attribute); return this; }
        public Builder filter(FilterGroup filter) { this.filter = filter; return this; }
        public Builder link(LinkedEntity link) { this.links.add(link); return this; }
        public Builder order(OrderSpec order) { this.orders.add(order); return this; }

        public LinkedEntity build() {
            return new LinkedEntity(name, from, to, joinType, alias, allAttributes, attributes, filter, links, orders);
        }
    }
}
