package io.github.cyfko.fetchql.core.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generic element of the markup tree produced by {@link TagTreeBuilder}.
 * <p>
 * Knows nothing about FetchXML: it only records the element name, its attributes in source
 * order, its child elements and its text content. Turning it into a query is the job of
 * {@link DocumentBuilder}.
 * </p>
 *
 * @param name       the element name
 * @param attributes attributes in source order, keys unique
 * @param children   child elements in source order
 * @param text       concatenated text content, or {@code null} when the element has none
 * @param position   position of the opening tag
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TagNode(
        String name,
        Map<String, String> attributes,
        List<TagNode> children,
        String text,
        SourcePosition position
) {

    public TagNode {
        Objects.requireNonNull(name, "Tag name is required");
        Objects.requireNonNull(position, "Tag position is required");
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children == null ? List.of() : children);
    }

    /**
     * Returns the value of an attribute.
     *
     * @param attributeName the attribute to read
     * @return the decoded value, or {@code null} when absent
     */
    public String attribute(String attributeName) {
        return attributes.get(attributeName);
    }

    public boolean hasAttribute(String attributeName) {
        return attributes.containsKey(attributeName);
    }

    public boolean hasText() {
        return text != null;
    }

    /**
     * Mutable accumulator used while the element is still open on the parser stack.
     */
    static final class Builder {
        private final String name;
        private final Map<String, String> attributes;
        private final SourcePosition position;
        private final List<TagNode> children = new ArrayList<>();
        private StringBuilder text;

        Builder(String name, Map<String, String> attributes, SourcePosition position) {
            this.name = name;
            this.attributes = attributes;
            this.position = position;
        }

        String name() {
            return name;
        }

        SourcePosition position() {
            return position;
        }

        void addChild(TagNode child) {
            children.add(child);
        }

        void appendText(String content) {
            if (text == null) {
                text = new StringBuilder();
            }
            text.append(content);
        }

        TagNode build() {
            return new TagNode(name, attributes, children, text == null ? null : text.toString(), position);
        }
    }
}
