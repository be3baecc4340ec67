package io.github.cyfko.fetchql.core.impl;

import io.github.cyfko.fetchql.core.api.QueryGenerator;
import io.github.cyfko.fetchql.core.config.GeneratorConfig;
import io.github.cyfko.fetchql.core.config.LimitStyle;
import io.github.cyfko.fetchql.core.exception.GenerationException;
import io.github.cyfko.fetchql.core.exception.GenerationException.Reason;
import io.github.cyfko.fetchql.core.mapping.OperatorMapper;
import io.github.cyfko.fetchql.core.mapping.SqlTemplate;
import io.github.cyfko.fetchql.core.model.AggregateFunction;
import io.github.cyfko.fetchql.core.model.AttributeSpec;
import io.github.cyfko.fetchql.core.model.Condition;
import io.github.cyfko.fetchql.core.model.FilterGroup;
import io.github.cyfko.fetchql.core.model.FilterNode;
import io.github.cyfko.fetchql.core.model.LinkedEntity;
import io.github.cyfko.fetchql.core.model.OrderSpec;
import io.github.cyfko.fetchql.core.model.QueryDocument;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Default {@link QueryGenerator}, rendering a query document as a SQL {@code SELECT}.
 *
 * <h2>Output layout</h2>
 * <pre>
 * SELECT [DISTINCT] [TOP n] columns
 * FROM root
 * [INNER JOIN | LEFT JOIN] link [alias] ON alias.from = parent.to [AND (link filter)] ...
 * [WHERE root filter]
 * [GROUP BY grouped columns]
 * [ORDER BY sort keys]
 * [LIMIT n]
 * </pre>
 * Clauses are separated by a single space. Links are joined depth-first in declaration order.
 *
 * <h2>Parenthesization</h2>
 * <p>
 * Every nested filter group is wrapped in parentheses, whatever its number of children.
 * The root group is wrapped when it has several children; a single-child root renders that
 * child alone. Each level of {@code <filter>} nesting therefore maps to exactly one level of
 * parentheses:
 * </p>
 * <pre>{@code
 * <filter type="and"> a=1, <filter type="or"> b=2, c=3 </filter> </filter>
 * → WHERE (a = 1 AND (b = 2 OR c = 3))
 * <filter> <filter> a=1 </filter> </filter>
 * → WHERE (a = 1)
 * }</pre>
 *
 * <h2>Column qualification</h2>
 * <ul>
 *   <li>root columns are written as is, link columns as {@code alias.column}</li>
 *   <li>a condition {@code entityname} or a dotted {@code prefix.column} must name a link alias
 *       or the root entity</li>
 *   <li>{@code <order alias="x"/>} must name the alias of a selected column</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe; all per-call state lives in a private render pass.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SqlGenerator implements QueryGenerator {

    private static final Logger log = Logger.getLogger(SqlGenerator.class.getName());

    private final GeneratorConfig config;
    private final OperatorMapper operatorMapper;

    public SqlGenerator() {
        this(GeneratorConfig.defaults());
    }

    public SqlGenerator(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "Generator config is required");
        this.operatorMapper = new OperatorMapper(config);
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    @Override
    public String generate(QueryDocument document) throws GenerationException {
        Objects.requireNonNull(document, "Query document cannot be null");
        log.fine(() -> String.format("Generating SQL for entity '%s' (%d link(s))",
                document.entityName(), document.links().size()));
        return new RenderPass(document).render();
    }

    /**
     * State of one {@link #generate(QueryDocument)} call.
     */
    private final class RenderPass {
        private final QueryDocument document;
        private final String rootContext;
        private final Set<String> linkAliases = new HashSet<>();
        private final Set<String> columnAliases = new HashSet<>();

        RenderPass(QueryDocument document) {
            this.document = document;
            this.rootContext = "entity[" + document.entityName() + "]";
            collectAliases(document.attributes(), document.links());
        }

        String render() {
            checkCombinations();

            StringJoiner sql = new StringJoiner(" ");
            sql.add(selectClause());
            sql.add("FROM " + document.entityName());
            for (LinkedEntity link : document.links()) {
                appendJoins(sql, link, document.entityName());
            }
            if (document.hasFilter()) {
                sql.add("WHERE " + renderGroup(document.filter(), null, rootContext + "/filter"));
            }

            List<String> grouped = new ArrayList<>();
            collectGrouped(grouped, document.attributes(), null);
            forEachLink(document.links(), link -> collectGrouped(grouped, link.attributes(), link.effectiveAlias()));
            if (!grouped.isEmpty()) {
                sql.add("GROUP BY " + String.join(", ", grouped));
            }

            List<String> orders = new ArrayList<>();
            for (OrderSpec order : document.orders()) {
                orders.add(renderOrder(order, rootContext + "/order"));
            }
            forEachLink(document.links(), link -> {
                for (OrderSpec order : link.orders()) {
                    orders.add(renderOrder(order, linkContext(link) + "/order"));
                }
            });
            if (!orders.isEmpty()) {
                sql.add("ORDER BY " + String.join(", ", orders));
            }

            if (document.top() != null && config.getLimitStyle() == LimitStyle.LIMIT) {
                sql.add("LIMIT " + document.top());
            }
            return sql.toString();
        }

        private void collectAliases(List<AttributeSpec> attributes, List<LinkedEntity> links) {
            for (AttributeSpec attribute : attributes) {
                if (attribute.alias() != null) columnAliases.add(attribute.alias());
            }
            for (LinkedEntity link : links) {
                linkAliases.add(link.effectiveAlias());
                collectAliases(link.attributes(), link.links());
            }
        }

        private void checkCombinations() {
            if (document.page() != null && document.top() != null) {
                throw new GenerationException(Reason.UNSUPPORTED_COMBINATION,
                        "Paging cannot be combined with top", "fetch");
            }

            List<Selected> selected = new ArrayList<>();
            for (AttributeSpec attribute : document.attributes()) {
                selected.add(new Selected(attribute, rootContext));
            }
            forEachLink(document.links(), link -> {
                for (AttributeSpec attribute : link.attributes()) {
                    selected.add(new Selected(attribute, linkContext(link)));
                }
            });
            if (selected.stream().noneMatch(s -> s.attribute().isAggregated())) {
                return;
            }

            if (document.allAttributes()) {
                throw new GenerationException(Reason.UNSUPPORTED_COMBINATION,
                        "Aggregate columns cannot be combined with all-attributes", rootContext);
            }
            forEachLink(document.links(), link -> {
                if (link.allAttributes()) {
                    throw new GenerationException(Reason.UNSUPPORTED_COMBINATION,
                            "Aggregate columns cannot be combined with all-attributes", linkContext(link));
                }
            });
            for (Selected s : selected) {
                if (!s.attribute().isAggregated() && !s.attribute().groupBy()) {
                    throw new GenerationException(Reason.UNSUPPORTED_COMBINATION,
                            "Column '" + s.attribute().name() + "' must be aggregated or grouped in an aggregate query",
                            s.context());
                }
            }
        }

        private String selectClause() {
            StringBuilder select = new StringBuilder("SELECT");
            if (document.distinct()) select.append(" DISTINCT");
            if (document.top() != null && config.getLimitStyle() == LimitStyle.TOP) {
                select.append(" TOP ").append(document.top());
            }

            List<String> columns = new ArrayList<>();
            if (document.allAttributes()) {
                columns.add(document.links().isEmpty() ? "*" : document.entityName() + ".*");
            }
            for (AttributeSpec attribute : document.attributes()) {
                columns.add(renderColumn(attribute, null));
            }
            forEachLink(document.links(), link -> {
                if (link.allAttributes()) {
                    columns.add(link.effectiveAlias() + ".*");
                }
                for (AttributeSpec attribute : link.attributes()) {
                    columns.add(renderColumn(attribute, link.effectiveAlias()));
                }
            });
            if (columns.isEmpty()) {
                columns.add("*");
            }
            return select.append(' ').append(String.join(", ", columns)).toString();
        }

        private String renderColumn(AttributeSpec attribute, String qualifier) {
            String column = qualify(qualifier, attribute.name());
            String expression;
            if (attribute.aggregate() == null) {
                expression = column;
            } else if (attribute.aggregate() == AggregateFunction.COUNT && !attribute.distinct()) {
                expression = "COUNT(*)";
            } else {
                expression = attribute.aggregate().sqlFunction() + "("
                        + (attribute.distinct() ? "DISTINCT " : "") + column + ")";
            }
            return attribute.alias() != null ? expression + " AS " + attribute.alias() : expression;
        }

        private void appendJoins(StringJoiner sql, LinkedEntity link, String parentAlias) {
            String alias = link.effectiveAlias();
            StringBuilder join = new StringBuilder(link.joinType().keyword()).append(' ').append(link.name());
            if (link.alias() != null) {
                join.append(' ').append(link.alias());
            }
            join.append(" ON ").append(alias).append('.').append(link.from())
                    .append(" = ").append(parentAlias).append('.').append(link.to());
            if (link.filter() != null) {
                String filter = renderGroup(link.filter(), alias, linkContext(link) + "/filter");
                join.append(" AND ").append(isParenthesized(link.filter()) ? filter : "(" + filter + ")");
            }
            sql.add(join);
            for (LinkedEntity child : link.links()) {
                appendJoins(sql, child, alias);
            }
        }

        private String renderGroup(FilterGroup group, String defaultQualifier, String context) {
            if (group.children().size() == 1) {
                return renderNode(group.children().get(0), defaultQualifier, context);
            }
            return renderNestedGroup(group, defaultQualifier, context);
        }

        private String renderNestedGroup(FilterGroup group, String defaultQualifier, String context) {
            StringJoiner joined = new StringJoiner(" " + group.type().keyword() + " ", "(", ")");
            for (FilterNode child : group.children()) {
                joined.add(renderNode(child, defaultQualifier, context));
            }
            return joined.toString();
        }

        private String renderNode(FilterNode node, String defaultQualifier, String context) {
            return switch (node.kind()) {
                case GROUP -> renderNestedGroup((FilterGroup) node, defaultQualifier, context);
                case CONDITION -> {
                    Condition condition = (Condition) node;
                    String column = resolveColumn(condition.attribute(), condition.entityName(), defaultQualifier, context);
                    yield renderCondition(column, condition, context);
                }
            };
        }

        private String renderCondition(String column, Condition condition, String context) {
            try {
                return operatorMapper.render(column, condition);
            } catch (DateTimeException | ArithmeticException e) {
                throw new GenerationException(Reason.VALUE_OUT_OF_RANGE, String.format(
                        "Condition '%s' on '%s' yields a date outside the supported range",
                        condition.operator().code(), condition.attribute()), context, e);
            }
        }

        private String resolveColumn(String attribute, String entityName, String defaultQualifier, String context) {
            if (entityName != null) {
                if (!isKnownEntity(entityName)) {
                    throw new GenerationException(Reason.UNRESOLVED_REFERENCE,
                            "Entity alias '" + entityName + "' does not match any link-entity", context);
                }
                return qualify(entityName, attribute);
            }
            int dot = attribute.indexOf('.');
            if (dot > 0) {
                String prefix = attribute.substring(0, dot);
                if (!isKnownEntity(prefix)) {
                    throw new GenerationException(Reason.UNRESOLVED_REFERENCE,
                            "Prefix '" + prefix + "' of column '" + attribute + "' does not match any link-entity",
                            context);
                }
                return attribute;
            }
            return qualify(defaultQualifier, attribute);
        }

        private String renderOrder(OrderSpec order, String context) {
            String direction = order.descending() ? " DESC" : " ASC";
            if (order.target() == OrderSpec.Target.ALIAS) {
                if (!columnAliases.contains(order.field())) {
                    throw new GenerationException(Reason.UNRESOLVED_REFERENCE,
                            "Order alias '" + order.field() + "' does not match any attribute alias", context);
                }
                return order.field() + direction;
            }
            return resolveColumn(order.field(), order.entityName(), null, context) + direction;
        }

        private void collectGrouped(List<String> grouped, List<AttributeSpec> attributes, String qualifier) {
            for (AttributeSpec attribute : attributes) {
                if (attribute.groupBy()) grouped.add(qualify(qualifier, attribute.name()));
            }
        }

        private boolean isKnownEntity(String name) {
            return linkAliases.contains(name) || document.entityName().equals(name);
        }

        private boolean isParenthesized(FilterGroup group) {
            if (group.children().size() > 1) {
                return true;
            }
            FilterNode only = group.children().get(0);
            if (only.kind() == FilterNode.Kind.GROUP) {
                return true;
            }
            SqlTemplate.Shape shape = OperatorMapper.map(((Condition) only).operator()).shape();
            return shape == SqlTemplate.Shape.WHOLE_DAY || shape == SqlTemplate.Shape.RELATIVE_RANGE;
        }
    }

    private static String qualify(String qualifier, String column) {
        return qualifier == null ? column : qualifier + "." + column;
    }

    private static String linkContext(LinkedEntity link) {
        return "link-entity[" + link.effectiveAlias() + "]";
    }

    private static void forEachLink(List<LinkedEntity> links, Consumer<LinkedEntity> action) {
        for (LinkedEntity link : links) {
            action.accept(link);
            forEachLink(link.links(), action);
        }
    }

    private record Selected(AttributeSpec attribute, String context) {
    }
}
