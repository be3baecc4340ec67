package io.github.cyfko.fetchql.core.model;

/**
 * Child of a {@link FilterGroup}: either a {@link Condition} or a nested {@link FilterGroup}.
 * <p>
 * Consumers dispatch on {@link #kind()} rather than on the runtime type.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FilterNode {

    enum Kind {
        CONDITION,
        GROUP
    }

    Kind kind();
}
