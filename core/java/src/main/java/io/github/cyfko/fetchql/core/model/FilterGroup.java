package io.github.cyfko.fetchql.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Logical AND/OR group of conditions and nested groups.
 * <p>
 * Groups nest to any depth; the group tree built by the parser mirrors the
 * {@code <filter>} nesting of the source exactly.
 * </p>
 *
 * @param type     the combinator
 * @param children the conditions and nested groups, never empty
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterGroup(FilterType type, List<FilterNode> children) implements FilterNode {

    public FilterGroup {
        Objects.requireNonNull(type, "Filter type is required");
        children = List.copyOf(Objects.requireNonNull(children, "Filter children are required"));
        if (children.isEmpty()) {
            throw new IllegalArgumentException("A filter group needs at least one child");
        }
    }

    public static FilterGroup and(FilterNode... children) {
        return new FilterGroup(FilterType.AND, List.of(children));
    }

    public static FilterGroup or(FilterNode... children) {
        return new FilterGroup(FilterType.OR, List.of(children));
    }

    /**
     * Returns the number of group levels from this group down to its deepest nested group.
     *
     * @return 1 for a group holding only conditions
     */
    public int depth() {
        int deepest = 0;
        for (FilterNode child : children) {
            if (child.kind() == Kind.GROUP) {
                deepest = Math.max(deepest, ((FilterGroup) child).depth());
            }
        }
        return deepest + 1;
    }

    @Override
    public Kind kind() {
        return Kind.GROUP;
    }
}
