package io.github.cyfko.fetchql.core.impl;

import io.github.cyfko.fetchql.core.api.Arity;
import io.github.cyfko.fetchql.core.model.AttributeSpec;
import io.github.cyfko.fetchql.core.model.Condition;
import io.github.cyfko.fetchql.core.model.FilterGroup;
import io.github.cyfko.fetchql.core.model.FilterNode;
import io.github.cyfko.fetchql.core.model.LinkedEntity;
import io.github.cyfko.fetchql.core.model.OrderSpec;
import io.github.cyfko.fetchql.core.model.QueryDocument;
import io.github.cyfko.fetchql.core.parsing.CharacterReferences;

import java.util.List;
import java.util.Objects;

/**
 * Writes a {@link QueryDocument} back as FetchXML, indented by two spaces per level.
 * <p>
 * The output parses back into an equal document: {@code parser.parse(writer.write(doc)).equals(doc)}
 * for every document produced by {@link BasicFetchXmlParser}. Single values are written as the
 * {@code value} attribute, multiple values as {@code <value>} elements. Filter types are always
 * spelled out so the text is also accepted under a strict parser policy.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FetchXmlWriter {

    private static final String INDENT = "  ";

    /**
     * Serializes the document.
     *
     * @param document the query document
     * @return FetchXML text
     */
    public String write(QueryDocument document) {
        Objects.requireNonNull(document, "Query document cannot be null");
        StringBuilder out = new StringBuilder();

        out.append("<fetch");
        if (document.top() != null) {
            attribute(out, document.capFromCount() ? "count" : "top", document.top().toString());
        }
        if (document.page() != null) attribute(out, "page", document.page().toString());
        if (document.pagingCookie() != null) attribute(out, "paging-cookie", document.pagingCookie());
        if (document.distinct()) attribute(out, "distinct", "true");
        if (document.aggregate()) attribute(out, "aggregate", "true");
        out.append(">\n");

        indent(out, 1).append("<entity");
        attribute(out, "name", document.entityName());
        out.append(">\n");
        writeBody(out, 2, document.allAttributes(), document.attributes(), document.filter(),
                document.orders(), document.links());
        indent(out, 1).append("</entity>\n");

        return out.append("</fetch>").toString();
    }

    private void writeBody(StringBuilder out, int depth, boolean allAttributes, List<AttributeSpec> attributes,
                           FilterGroup filter, List<OrderSpec> orders, List<LinkedEntity> links) {
        if (allAttributes) {
            indent(out, depth).append("<all-attributes/>\n");
        }
        for (AttributeSpec spec : attributes) {
            indent(out, depth).append("<attribute");
            attribute(out, "name", spec.name());
            if (spec.alias() != null) attribute(out, "alias", spec.alias());
            if (spec.aggregate() != null) attribute(out, "aggregate", spec.aggregate().code());
            if (spec.groupBy()) attribute(out, "groupby", "true");
            if (spec.distinct()) attribute(out, "distinct", "true");
            out.append("/>\n");
        }
        if (filter != null) {
            writeFilter(out, depth, filter);
        }
        for (OrderSpec order : orders) {
            indent(out, depth).append("<order");
            attribute(out, order.target() == OrderSpec.Target.ALIAS ? "alias" : "attribute", order.field());
            if (order.descending()) attribute(out, "descending", "true");
            out.append("/>\n");
        }
        for (LinkedEntity link : links) {
            indent(out, depth).append("<link-entity");
            attribute(out, "name", link.name());
            attribute(out, "from", link.from());
            attribute(out, "to", link.to());
            attribute(out, "link-type", link.joinType().code());
            if (link.alias() != null) attribute(out, "alias", link.alias());
            out.append(">\n");
            writeBody(out, depth + 1, link.allAttributes(), link.attributes(), link.filter(),
                    link.orders(), link.links());
            indent(out, depth).append("</link-entity>\n");
        }
    }

    private void writeFilter(StringBuilder out, int depth, FilterGroup group) {
        indent(out, depth).append("<filter");
        attribute(out, "type", group.type().code());
        out.append(">\n");
        for (FilterNode child : group.children()) {
            if (child.kind() == FilterNode.Kind.GROUP) {
                writeFilter(out, depth + 1, (FilterGroup) child);
            } else {
                writeCondition(out, depth + 1, (Condition) child);
            }
        }
        indent(out, depth).append("</filter>\n");
    }

    private void writeCondition(StringBuilder out, int depth, Condition condition) {
        indent(out, depth).append("<condition");
        attribute(out, "attribute", condition.attribute());
        if (condition.entityName() != null) attribute(out, "entityname", condition.entityName());
        attribute(out, "operator", condition.operator().code());

        Arity arity = condition.operator().arity();
        if (arity == Arity.NONE) {
            out.append("/>\n");
        } else if (arity == Arity.ONE) {
            attribute(out, "value", condition.values().get(0));
            out.append("/>\n");
        } else {
            out.append(">\n");
            for (String value : condition.values()) {
                indent(out, depth + 1).append("<value>").append(valueText(value)).append("</value>\n");
            }
            indent(out, depth).append("</condition>\n");
        }
    }

    // whitespace-only text between tags is dropped on parse, CDATA keeps it
    private static String valueText(String value) {
        return !value.isEmpty() && value.isBlank()
                ? "<![CDATA[" + value + "]]>"
                : CharacterReferences.encode(value);
    }

    private static void attribute(StringBuilder out, String name, String value) {
        out.append(' ').append(name).append("=\"").append(CharacterReferences.encode(value)).append('"');
    }

    private static StringBuilder indent(StringBuilder out, int depth) {
        return out.append(INDENT.repeat(depth));
    }
}
