package io.github.cyfko.fetchql.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of join a {@link LinkedEntity} declares through its {@code link-type} attribute.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum JoinType {
    INNER("inner", "INNER JOIN"),
    OUTER("outer", "LEFT JOIN");

    private final String code;
    private final String keyword;

    JoinType(String code, String keyword) {
        this.code = code;
        this.keyword = keyword;
    }

    public String code() {
        return code;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<JoinType> fromCode(String code) {
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (JoinType type : values()) {
            if (type.code.equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
