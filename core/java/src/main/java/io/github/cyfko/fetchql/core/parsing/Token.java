package io.github.cyfko.fetchql.core.parsing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A lexical unit of FetchXML markup.
 *
 * @param type       the token kind
 * @param name       tag name, {@code null} for text
 * @param attributes attributes in source order, empty for close tags and text
 * @param text       decoded text content, {@code null} for tags
 * @param position   where the token starts in the source
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(Type type, String name, Map<String, String> attributes, String text, SourcePosition position) {

    public enum Type {
        OPEN_TAG,
        CLOSE_TAG,
        SELF_CLOSING_TAG,
        TEXT
    }

    public Token {
        Objects.requireNonNull(type, "Token type is required");
        Objects.requireNonNull(position, "Token position is required");
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Token open(String name, Map<String, String> attributes, SourcePosition position) {
        return new Token(Type.OPEN_TAG, name, attributes, null, position);
    }

    public static Token selfClosing(String name, Map<String, String> attributes, SourcePosition position) {
        return new Token(Type.SELF_CLOSING_TAG, name, attributes, null, position);
    }

    public static Token close(String name, SourcePosition position) {
        return new Token(Type.CLOSE_TAG, name, Map.of(), null, position);
    }

    public static Token text(String content, SourcePosition position) {
        return new Token(Type.TEXT, null, Map.of(), content, position);
    }

    @Override
    public String toString() {
        return switch (type) {
            case OPEN_TAG -> "<" + name + ">";
            case CLOSE_TAG -> "</" + name + ">";
            case SELF_CLOSING_TAG -> "<" + name + "/>";
            case TEXT -> "text[" + text + "]";
        };
    }
}
