package io.github.cyfko.fetchql.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Logical combinator of a {@link FilterGroup}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum FilterType {
    AND("and", "AND"),
    OR("or", "OR");

    private final String code;
    private final String keyword;

    FilterType(String code, String keyword) {
        this.code = code;
        this.keyword = keyword;
    }

    /** FetchXML spelling, the value of the {@code type} attribute. */
    public String code() {
        return code;
    }

    /** SQL keyword joining the children of the group. */
    public String keyword() {
        return keyword;
    }

    public static Optional<FilterType> fromCode(String code) {
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (FilterType type : values()) {
            if (type.code.equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
