package io.github.cyfko.fetchql.core.mapping;

import io.github.cyfko.fetchql.core.api.ConditionOperator;
import io.github.cyfko.fetchql.core.config.GeneratorConfig;
import io.github.cyfko.fetchql.core.mapping.SqlTemplate.Shape;
import io.github.cyfko.fetchql.core.model.Condition;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps FetchXML condition operators to SQL fragments.
 *
 * <table>
 *   <caption>Operator table</caption>
 *   <tr><th>FetchXML</th><th>SQL</th></tr>
 *   <tr><td>eq, ne, lt, le, gt, ge</td><td>{@code = <> < <= > >=}</td></tr>
 *   <tr><td>like, not-like</td><td>{@code LIKE 'v'}, {@code NOT LIKE 'v'}</td></tr>
 *   <tr><td>begins-with, not-begin-with</td><td>{@code LIKE 'v%'}, {@code NOT LIKE 'v%'}</td></tr>
 *   <tr><td>ends-with, not-end-with</td><td>{@code LIKE '%v'}, {@code NOT LIKE '%v'}</td></tr>
 *   <tr><td>null, not-null</td><td>{@code IS NULL}, {@code IS NOT NULL}</td></tr>
 *   <tr><td>in, not-in</td><td>{@code IN (a, b)}, {@code NOT IN (a, b)}</td></tr>
 *   <tr><td>between, not-between</td><td>{@code BETWEEN a AND b}, {@code NOT BETWEEN a AND b}</td></tr>
 *   <tr><td>on, on-or-before, on-or-after</td><td>day bounds in the output zone</td></tr>
 *   <tr><td>today, last-x-days, ...</td><td>{@code (c >= 'from' AND c < 'to')}</td></tr>
 * </table>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperatorMapper {

    private static final Map<ConditionOperator, SqlTemplate> TEMPLATES;

    static {
        Map<ConditionOperator, SqlTemplate> templates = new EnumMap<>(ConditionOperator.class);
        put(templates, ConditionOperator.EQ, Shape.BINARY, "=");
        put(templates, ConditionOperator.NE, Shape.BINARY, "<>");
        put(templates, ConditionOperator.LT, Shape.BINARY, "<");
        put(templates, ConditionOperator.LE, Shape.BINARY, "<=");
        put(templates, ConditionOperator.GT, Shape.BINARY, ">");
        put(templates, ConditionOperator.GE, Shape.BINARY, ">=");
        put(templates, ConditionOperator.LIKE, Shape.PATTERN, "LIKE");
        put(templates, ConditionOperator.NOT_LIKE, Shape.PATTERN, "NOT LIKE");
        put(templates, ConditionOperator.BEGINS_WITH, Shape.PREFIX_PATTERN, "LIKE");
        put(templates, ConditionOperator.NOT_BEGIN_WITH, Shape.PREFIX_PATTERN, "NOT LIKE");
        put(templates, ConditionOperator.ENDS_WITH, Shape.SUFFIX_PATTERN, "LIKE");
        put(templates, ConditionOperator.NOT_END_WITH, Shape.SUFFIX_PATTERN, "NOT LIKE");
        put(templates, ConditionOperator.NULL, Shape.POSTFIX, "IS NULL");
        put(templates, ConditionOperator.NOT_NULL, Shape.POSTFIX, "IS NOT NULL");
        put(templates, ConditionOperator.IN, Shape.LIST, "IN");
        put(templates, ConditionOperator.NOT_IN, Shape.LIST, "NOT IN");
        put(templates, ConditionOperator.BETWEEN, Shape.RANGE, "BETWEEN");
        put(templates, ConditionOperator.NOT_BETWEEN, Shape.RANGE, "NOT BETWEEN");
        put(templates, ConditionOperator.ON, Shape.WHOLE_DAY, "");
        put(templates, ConditionOperator.ON_OR_BEFORE, Shape.UNTIL_DAY_END, "");
        put(templates, ConditionOperator.ON_OR_AFTER, Shape.FROM_DAY_START, "");
        for (ConditionOperator operator : ConditionOperator.values()) {
            if (operator.category() == ConditionOperator.Category.RELATIVE_DATE) {
                put(templates, operator, Shape.RELATIVE_RANGE, "");
            }
        }
        if (templates.size() != ConditionOperator.values().length) {
            throw new IllegalStateException("Every condition operator needs an SQL template");
        }
        TEMPLATES = Collections.unmodifiableMap(templates);
    }

    private final ValueMapper valueMapper;
    private final RelativeDateResolver relativeDates;
    private final ZoneId outputZone;
    private final ZoneId sourceZone;

    public OperatorMapper(GeneratorConfig config) {
        Objects.requireNonNull(config, "Generator config is required");
        this.valueMapper = new ValueMapper(config);
        this.relativeDates = new RelativeDateResolver(config.getClock(), config.getOutputZone());
        this.outputZone = config.getOutputZone();
        this.sourceZone = config.getSourceZone();
    }

    /**
     * Returns the rendering rule of an operator.
     *
     * @param operator the operator
     * @return its template, never {@code null}
     */
    public static SqlTemplate map(ConditionOperator operator) {
        return TEMPLATES.get(Objects.requireNonNull(operator, "Operator cannot be null"));
    }

    /**
     * Renders a condition against an already qualified column.
     *
     * @param column    the column as it must appear in SQL, e.g. {@code "acc.name"}
     * @param condition the condition
     * @return the SQL predicate
     * @throws java.time.DateTimeException if a relative range ends outside the supported calendar
     */
    public String render(String column, Condition condition) {
        SqlTemplate template = map(condition.operator());
        List<String> values = condition.values();

        return switch (template.shape()) {
            case BINARY -> column + " " + template.keyword() + " " + valueMapper.mapValue(values.get(0));
            case PATTERN -> column + " " + template.keyword() + " "
                    + valueMapper.mapValue(values.get(0), LiteralKind.STRING);
            case PREFIX_PATTERN -> column + " " + template.keyword() + " "
                    + valueMapper.mapPattern(values.get(0), false, true);
            case SUFFIX_PATTERN -> column + " " + template.keyword() + " "
                    + valueMapper.mapPattern(values.get(0), true, false);
            case POSTFIX -> column + " " + template.keyword();
            case LIST -> column + " " + template.keyword() + " ("
                    + values.stream().map(valueMapper::mapValue).collect(Collectors.joining(", ")) + ")";
            case RANGE -> column + " " + template.keyword() + " "
                    + valueMapper.mapValue(values.get(0)) + " AND " + valueMapper.mapValue(values.get(1));
            case WHOLE_DAY -> {
                LocalDate day = dayOf(values.get(0));
                yield halfOpen(column, startOf(day), startOf(day.plusDays(1)));
            }
            case UNTIL_DAY_END -> column + " < " + valueMapper.mapInstant(startOf(dayOf(values.get(0)).plusDays(1)));
            case FROM_DAY_START -> column + " >= " + valueMapper.mapInstant(startOf(dayOf(values.get(0))));
            case RELATIVE_RANGE -> {
                int count = condition.operator().takesUnitCount() ? Integer.parseInt(values.get(0).trim()) : 0;
                DateRange range = relativeDates.resolve(condition.operator(), count);
                yield halfOpen(column, range.from(), range.to());
            }
        };
    }

    private String halfOpen(String column, Instant from, Instant to) {
        return "(" + column + " >= " + valueMapper.mapInstant(from)
                + " AND " + column + " < " + valueMapper.mapInstant(to) + ")";
    }

    private LocalDate dayOf(String raw) {
        return CanonicalTime.normalize(raw, sourceZone).atZone(outputZone).toLocalDate();
    }

    private Instant startOf(LocalDate day) {
        return day.atStartOfDay(outputZone).toInstant();
    }

    private static void put(Map<ConditionOperator, SqlTemplate> templates, ConditionOperator operator,
                            Shape shape, String keyword) {
        templates.put(operator, new SqlTemplate(operator, shape, keyword));
    }
}
