package io.github.cyfko.fetchql.core.parsing;

import io.github.cyfko.fetchql.core.api.ConditionOperator;
import io.github.cyfko.fetchql.core.config.ParserPolicy;
import io.github.cyfko.fetchql.core.exception.SemanticException;
import io.github.cyfko.fetchql.core.exception.SemanticException.Reason;
import io.github.cyfko.fetchql.core.model.AggregateFunction;
import io.github.cyfko.fetchql.core.model.AttributeSpec;
import io.github.cyfko.fetchql.core.model.Condition;
import io.github.cyfko.fetchql.core.model.FilterGroup;
import io.github.cyfko.fetchql.core.model.FilterNode;
import io.github.cyfko.fetchql.core.model.FilterType;
import io.github.cyfko.fetchql.core.model.JoinType;
import io.github.cyfko.fetchql.core.model.LinkedEntity;
import io.github.cyfko.fetchql.core.model.OrderSpec;
import io.github.cyfko.fetchql.core.model.QueryDocument;
import io.github.cyfko.fetchql.core.utils.OperatorArityUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive-descent walk turning a {@link TagNode} tree into a {@link QueryDocument}.
 * <p>
 * Each element kind has its own method; children are dispatched on their tag name. Nested
 * {@code <filter>} and {@code <link-entity>} elements recurse, so the resulting model mirrors
 * the source nesting exactly. The first violation aborts the walk with a
 * {@link SemanticException} positioned at the offending element.
 * </p>
 *
 * <p>Attributes the SQL preview has no use for ({@code version}, {@code mapping},
 * {@code no-lock}, ...) are ignored.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DocumentBuilder {

    private final ParserPolicy policy;

    public DocumentBuilder() {
        this(ParserPolicy.defaults());
    }

    public DocumentBuilder(ParserPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Parser policy is required");
    }

    /**
     * Builds the query model of a {@code <fetch>} tree.
     *
     * @param root the root element produced by {@link TagTreeBuilder}
     * @return the query document
     * @throws SemanticException if the tree is not a valid query
     */
    public QueryDocument buildDocument(TagNode root) {
        Objects.requireNonNull(root, "Root element cannot be null");
        if (!"fetch".equals(root.name())) {
            throw new SemanticException(Reason.UNKNOWN_ELEMENT,
                    "Root element must be <fetch>, found <" + root.name() + ">", root.position());
        }
        rejectText(root);

        Integer top = positiveInt(root, "top");
        Integer count = positiveInt(root, "count");
        if (top != null && count != null) {
            throw new SemanticException(Reason.CONFLICTING_ATTRIBUTES,
                    "<fetch> cannot declare both 'top' and 'count'", root.position());
        }

        TagNode entity = null;
        for (TagNode child : root.children()) {
            if (!"entity".equals(child.name())) {
                throw unknownElement(child, root);
            }
            if (entity != null) {
                throw new SemanticException(Reason.UNKNOWN_ELEMENT,
                        "<fetch> can only contain one <entity>", child.position());
            }
            entity = child;
        }
        if (entity == null) {
            throw new SemanticException(Reason.MISSING_ELEMENT, "<fetch> requires an <entity> child", root.position());
        }

        List<AliasSite> aliases = new ArrayList<>();
        String entityName = required(entity, "name");
        QueryDocument.Builder document = QueryDocument.builder(entityName)
                .page(positiveInt(root, "page"))
                .pagingCookie(root.attribute("paging-cookie"))
                .distinct(bool(root, "distinct"))
                .aggregate(bool(root, "aggregate"));
        if (count != null) {
            document.count(count);
        } else {
            document.top(top);
        }

        rejectText(entity);
        List<FilterGroup> filters = new ArrayList<>();
        for (TagNode child : entity.children()) {
            switch (child.name()) {
                case "all-attributes" -> {
                    expectLeaf(child);
                    document.allAttributes(true);
                }
                case "attribute" -> document.attribute(buildAttribute(child));
                case "filter" -> filters.add(buildFilter(child));
                case "link-entity" -> document.link(buildLink(child, aliases));
                case "order" -> document.order(buildOrder(child, null));
                default -> throw unknownElement(child, entity);
            }
        }
        document.filter(combine(filters));

        checkAliasesUnique(entityName, aliases);
        return document.build();
    }

    private LinkedEntity buildLink(TagNode node, List<AliasSite> aliases) {
        rejectText(node);
        String name = required(node, "name");
        LinkedEntity.Builder link = LinkedEntity.builder(name, required(node, "from"), required(node, "to"));

        String linkType = node.attribute("link-type");
        if (linkType != null) {
            link.joinType(JoinType.fromCode(linkType).orElseThrow(() -> invalidValue(node, "link-type", linkType,
                    "expected 'inner' or 'outer'")));
        }
        String alias = null;
        if (node.hasAttribute("alias")) {
            alias = required(node, "alias");
            link.alias(alias);
        }
        String effectiveAlias = alias != null ? alias : name;
        aliases.add(new AliasSite(effectiveAlias, node.position()));

        List<FilterGroup> filters = new ArrayList<>();
        for (TagNode child : node.children()) {
            switch (child.name()) {
                case "all-attributes" -> {
                    expectLeaf(child);
                    link.allAttributes(true);
                }
                case "attribute" -> link.attribute(buildAttribute(child));
                case "filter" -> filters.add(buildFilter(child));
                case "link-entity" -> link.link(buildLink(child, aliases));
                case "order" -> link.order(buildOrder(child, effectiveAlias));
                default -> throw unknownElement(child, node);
            }
        }
        link.filter(combine(filters));
        return link.build();
    }

    private AttributeSpec buildAttribute(TagNode node) {
        expectLeaf(node);
        String name = required(node, "name");
        String alias = node.hasAttribute("alias") ? required(node, "alias") : null;

        AggregateFunction aggregate = null;
        String aggregateCode = node.attribute("aggregate");
        if (aggregateCode != null) {
            aggregate = AggregateFunction.fromCode(aggregateCode).orElseThrow(() -> invalidValue(node, "aggregate",
                    aggregateCode, "expected count, countcolumn, sum, avg, min or max"));
        }
        boolean groupBy = bool(node, "groupby");
        boolean distinct = bool(node, "distinct");

        if (aggregate != null && groupBy) {
            throw new SemanticException(Reason.CONFLICTING_ATTRIBUTES,
                    "Attribute '" + name + "' cannot be both aggregated and grouped", node.position());
        }
        if (distinct && aggregate == null) {
            throw new SemanticException(Reason.CONFLICTING_ATTRIBUTES,
                    "distinct on attribute '" + name + "' requires an aggregate", node.position());
        }
        return new AttributeSpec(name, alias, aggregate, groupBy, distinct);
    }

    private FilterGroup buildFilter(TagNode node) {
        rejectText(node);
        FilterType type = FilterType.AND;
        String typeCode = node.attribute("type");
        if (typeCode != null) {
            type = FilterType.fromCode(typeCode).orElseThrow(() -> invalidValue(node, "type", typeCode,
                    "expected 'and' or 'or'"));
        } else if (policy.requireFilterType()) {
            throw new SemanticException(Reason.MISSING_ATTRIBUTE, String.format(
                    "<filter> requires attribute 'type'. Policy applied: %s", policy.policyName()), node.position());
        }

        List<FilterNode> children = new ArrayList<>();
        for (TagNode child : node.children()) {
            switch (child.name()) {
                case "condition" -> children.add(buildCondition(child));
                case "filter" -> children.add(buildFilter(child));
                default -> throw unknownElement(child, node);
            }
        }
        if (children.isEmpty()) {
            throw new SemanticException(Reason.EMPTY_FILTER,
                    "<filter> must contain at least one condition or filter", node.position());
        }
        return new FilterGroup(type, children);
    }

    private Condition buildCondition(TagNode node) {
        rejectText(node);
        String attribute = required(node, "attribute");
        String operatorCode = required(node, "operator");
        ConditionOperator operator = ConditionOperator.fromCode(operatorCode).orElseThrow(() ->
                new SemanticException(Reason.UNKNOWN_OPERATOR,
                        "Unknown condition operator '" + operatorCode + "'", node.position()));
        String entityName = node.hasAttribute("entityname") ? required(node, "entityname") : null;

        List<String> values = new ArrayList<>();
        for (TagNode child : node.children()) {
            if (!"value".equals(child.name())) {
                throw unknownElement(child, node);
            }
            if (!child.children().isEmpty()) {
                throw unknownElement(child.children().get(0), child);
            }
            values.add(child.hasText() ? child.text() : "");
        }
        if (node.hasAttribute("value")) {
            if (!values.isEmpty()) {
                throw new SemanticException(Reason.CONFLICTING_ATTRIBUTES,
                        "Condition on '" + attribute + "' has both a 'value' attribute and <value> elements",
                        node.position());
            }
            values.add(node.attribute("value"));
        }

        OperatorArityUtils.Verdict count = OperatorArityUtils.validateValueCount(operator, values.size());
        if (!count.isValid()) {
            throw new SemanticException(Reason.ARITY_MISMATCH, count.problem(), node.position());
        }
        OperatorArityUtils.Verdict literals = OperatorArityUtils.validateLiterals(operator, values);
        if (!literals.isValid()) {
            throw new SemanticException(Reason.INVALID_LITERAL, literals.problem(), node.position());
        }
        return new Condition(attribute, entityName, operator, values);
    }

    private OrderSpec buildOrder(TagNode node, String entityName) {
        expectLeaf(node);
        boolean hasAttribute = node.hasAttribute("attribute");
        boolean hasAlias = node.hasAttribute("alias");
        if (hasAttribute && hasAlias) {
            throw new SemanticException(Reason.CONFLICTING_ATTRIBUTES,
                    "<order> cannot declare both 'attribute' and 'alias'", node.position());
        }
        if (!hasAttribute && !hasAlias) {
            throw new SemanticException(Reason.MISSING_ATTRIBUTE,
                    "<order> requires attribute 'attribute' or 'alias'", node.position());
        }
        boolean descending = bool(node, "descending");
        return hasAttribute
                ? new OrderSpec(required(node, "attribute"), descending, OrderSpec.Target.ATTRIBUTE, entityName)
                : new OrderSpec(required(node, "alias"), descending, OrderSpec.Target.ALIAS, entityName);
    }

    private static FilterGroup combine(List<FilterGroup> filters) {
        if (filters.isEmpty()) return null;
        if (filters.size() == 1) return filters.get(0);
        return new FilterGroup(FilterType.AND, new ArrayList<>(filters));
    }

    private static void checkAliasesUnique(String entityName, List<AliasSite> aliases) {
        Set<String> seen = new HashSet<>();
        seen.add(entityName);
        for (AliasSite site : aliases) {
            if (!seen.add(site.alias())) {
                throw new SemanticException(Reason.DUPLICATE_ALIAS,
                        "Alias '" + site.alias() + "' is declared more than once", site.position());
            }
        }
    }

    private static String required(TagNode node, String attribute) {
        String value = node.attribute(attribute);
        if (value == null) {
            throw new SemanticException(Reason.MISSING_ATTRIBUTE,
                    "<" + node.name() + "> requires attribute '" + attribute + "'", node.position());
        }
        if (value.isBlank()) {
            throw invalidValue(node, attribute, value, "value cannot be empty");
        }
        return value.trim();
    }

    private static Integer positiveInt(TagNode node, String attribute) {
        String value = node.attribute(attribute);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (!OperatorArityUtils.isPositiveInteger(trimmed)) {
            throw invalidValue(node, attribute, value, "expected a positive whole number");
        }
        return Integer.valueOf(trimmed);
    }

    private static boolean bool(TagNode node, String attribute) {
        String value = node.attribute(attribute);
        if (value == null) {
            return false;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1" -> true;
            case "false", "0" -> false;
            default -> throw invalidValue(node, attribute, value, "expected true, false, 1 or 0");
        };
    }

    private static void expectLeaf(TagNode node) {
        rejectText(node);
        if (!node.children().isEmpty()) {
            throw unknownElement(node.children().get(0), node);
        }
    }

    private static void rejectText(TagNode node) {
        if (node.hasText()) {
            throw new SemanticException(Reason.UNEXPECTED_TEXT,
                    "Text is not allowed inside <" + node.name() + ">", node.position());
        }
    }

    private static SemanticException unknownElement(TagNode child, TagNode parent) {
        return new SemanticException(Reason.UNKNOWN_ELEMENT,
                "Unknown element <" + child.name() + "> in <" + parent.name() + ">", child.position());
    }

    private static SemanticException invalidValue(TagNode node, String attribute, String value, String expectation) {
        return new SemanticException(Reason.INVALID_ATTRIBUTE_VALUE, String.format(
                "Invalid value '%s' for attribute '%s' of <%s>: %s", value, attribute, node.name(), expectation),
                node.position());
    }

    private record AliasSite(String alias, SourcePosition position) {
    }
}
