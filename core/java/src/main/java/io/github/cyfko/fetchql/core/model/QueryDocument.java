package io.github.cyfko.fetchql.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed FetchXML query.
 * <p>
 * Immutable and tree-shaped: every node below it is owned by exactly one parent
 * and none is shared with another document. Two documents parsed from
 * semantically identical FetchXML are {@code equals}.
 * </p>
 *
 * <pre>{@code
 * QueryDocument document = QueryDocument.builder("contact")
 *     .top(50)
 *     .attribute(AttributeSpec.of("fullname"))
 *     .filter(FilterGroup.and(Condition.of("statecode", ConditionOperator.EQ, "0")))
 *     .order(OrderSpec.asc("fullname"))
 *     .build();
 * }</pre>
 *
 * @param entityName    the queried collection, never blank
 * @param top           result cap, or {@code null}
 * @param capFromCount  whether the cap was declared with {@code count} rather than {@code top}
 * @param distinct      whether duplicate rows are removed
 * @param aggregate     whether the source declared {@code aggregate="true"}
 * @param page          requested page number, or {@code null}
 * @param pagingCookie  opaque paging cookie as written in the source, or {@code null}
 * @param allAttributes whether every column of the root entity is selected
 * @param attributes    selected root columns
 * @param filter        root filter, or {@code null}
 * @param links         joined collections
 * @param orders        sort keys
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record QueryDocument(
        String entityName,
        Integer top,
        boolean capFromCount,
        boolean distinct,
        boolean aggregate,
        Integer page,
        String pagingCookie,
        boolean allAttributes,
        List<AttributeSpec> attributes,
        FilterGroup filter,
        List<LinkedEntity> links,
        List<OrderSpec> orders
) {

    public QueryDocument {
        Objects.requireNonNull(entityName, "Entity name is required");
        if (entityName.isBlank()) {
            throw new IllegalArgumentException("Entity name cannot be blank");
        }
        if (top != null && top <= 0) {
            throw new IllegalArgumentException("top must be positive, got: " + top);
        }
        if (capFromCount && top == null) {
            throw new IllegalArgumentException("capFromCount requires a cap");
        }
        if (page != null && page <= 0) {
            throw new IllegalArgumentException("page must be positive, got: " + page);
        }
        attributes = List.copyOf(attributes == null ? List.of() : attributes);
        links = List.copyOf(links == null ? List.of() : links);
        orders = List.copyOf(orders == null ? List.of() : orders);
    }

    public boolean hasFilter() {
        return filter != null;
    }

    public boolean hasPaging() {
        return page != null || pagingCookie != null;
    }

    public static Builder builder(String entityName) {
        return new Builder(entityName);
    }

    public static final class Builder {
        private final String entityName;
        private Integer top;
        private boolean capFromCount;
        private boolean distinct;
        private boolean aggregate;
        private Integer page;
        private String pagingCookie;
        private boolean allAttributes;
        private final List<AttributeSpec> attributes = new ArrayList<>();
        private FilterGroup filter;
        private final List<LinkedEntity> links = new ArrayList<>();
        private final List<OrderSpec> orders = new ArrayList<>();

        private Builder(String entityName) {
            this.entityName = entityName;
        }

        public Builder top(Integer top) { this.top = top; this.capFromCount = false; return this; }
        public Builder count(Integer count) { this.top = count; this.capFromCount = count != null; return this; }
        public Builder distinct(boolean distinct) { this.distinct = distinct; return this; }
        public Builder aggregate(boolean aggregate) { this.aggregate = aggregate; return this; }
        public Builder page(Integer page) { this.page = page; return this; }
        public Builder pagingCookie(String pagingCookie) { this.pagingCookie = pagingCookie; return this; }
        public Builder allAttributes(boolean allAttributes) { this.allAttributes = allAttributes; return this; }
        public Builder attribute(AttributeSpec attribute) { this.attributes.add(attribute); return this; }
        public Builder filter(FilterGroup filter) { this.filter = filter; return this; }
        public Builder link(LinkedEntity link) { this.links.add(link); return this; }
        public Builder order(OrderSpec order) { this.orders.add(order); return this; }

        public QueryDocument build() {
            return new QueryDocument(entityName, top, capFromCount, distinct, aggregate, page, pagingCookie, allAttributes,
                    attributes, filter, links, orders);
        }
    }
}
