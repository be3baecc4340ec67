package io.github.cyfko.fetchql.core.api;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Enumeration of the FetchXML condition operators understood by the transpiler.
 * <p>
 * Each operator carries its FetchXML code (the value of the {@code operator} attribute),
 * the {@link Arity} it requires and a {@link Category} used by the SQL mapping.
 * </p>
 *
 * <p><strong>Operator categories:</strong></p>
 * <pre>{@code
 * statecode eq 0                  -> COMPARISON      statecode = 0
 * fullname like '%Smith%'         -> PATTERN         fullname LIKE '%Smith%'
 * emailaddress1 null              -> NULL_CHECK      emailaddress1 IS NULL
 * statecode in (0, 1)             -> SET             statecode IN (0, 1)
 * revenue between 10 and 20       -> RANGE           revenue BETWEEN 10 AND 20
 * createdon on 2024-01-15         -> DATE            (createdon >= '...' AND createdon < '...')
 * createdon last-x-days 3         -> RELATIVE_DATE   (createdon >= '...' AND createdon < '...')
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ConditionOperator {

    EQ("eq", Arity.ONE, Category.COMPARISON),
    NE("ne", Arity.ONE, Category.COMPARISON),
    LT("lt", Arity.ONE, Category.COMPARISON),
    LE("le", Arity.ONE, Category.COMPARISON),
    GT("gt", Arity.ONE, Category.COMPARISON),
    GE("ge", Arity.ONE, Category.COMPARISON),

    LIKE("like", Arity.ONE, Category.PATTERN),
    NOT_LIKE("not-like", Arity.ONE, Category.PATTERN),
    BEGINS_WITH("begins-with", Arity.ONE, Category.PATTERN),
    NOT_BEGIN_WITH("not-begin-with", Arity.ONE, Category.PATTERN),
    ENDS_WITH("ends-with", Arity.ONE, Category.PATTERN),
    NOT_END_WITH("not-end-with", Arity.ONE, Category.PATTERN),

    NULL("null", Arity.NONE, Category.NULL_CHECK),
    NOT_NULL("not-null", Arity.NONE, Category.NULL_CHECK),

    IN("in", Arity.ONE_OR_MORE, Category.SET),
    NOT_IN("not-in", Arity.ONE_OR_MORE, Category.SET),

    BETWEEN("between", Arity.TWO, Category.RANGE),
    NOT_BETWEEN("not-between", Arity.TWO, Category.RANGE),

    ON("on", Arity.ONE, Category.DATE),
    ON_OR_BEFORE("on-or-before", Arity.ONE, Category.DATE),
    ON_OR_AFTER("on-or-after", Arity.ONE, Category.DATE),

    TODAY("today", Arity.NONE, Category.RELATIVE_DATE),
    YESTERDAY("yesterday", Arity.NONE, Category.RELATIVE_DATE),
    TOMORROW("tomorrow", Arity.NONE, Category.RELATIVE_DATE),
    LAST_SEVEN_DAYS("last-seven-days", Arity.NONE, Category.RELATIVE_DATE),
    NEXT_SEVEN_DAYS("next-seven-days", Arity.NONE, Category.RELATIVE_DATE),
    THIS_WEEK("this-week", Arity.NONE, Category.RELATIVE_DATE),
    LAST_WEEK("last-week", Arity.NONE, Category.RELATIVE_DATE),
    THIS_MONTH("this-month", Arity.NONE, Category.RELATIVE_DATE),
    LAST_MONTH("last-month", Arity.NONE, Category.RELATIVE_DATE),
    THIS_YEAR("this-year", Arity.NONE, Category.RELATIVE_DATE),
    LAST_YEAR("last-year", Arity.NONE, Category.RELATIVE_DATE),

    LAST_X_HOURS("last-x-hours", Arity.ONE, Category.RELATIVE_DATE),
    NEXT_X_HOURS("next-x-hours", Arity.ONE, Category.RELATIVE_DATE),
    LAST_X_DAYS("last-x-days", Arity.ONE, Category.RELATIVE_DATE),
    NEXT_X_DAYS("next-x-days", Arity.ONE, Category.RELATIVE_DATE),
    LAST_X_WEEKS("last-x-weeks", Arity.ONE, Category.RELATIVE_DATE),
    NEXT_X_WEEKS("next-x-weeks", Arity.ONE, Category.RELATIVE_DATE),
    LAST_X_MONTHS("last-x-months", Arity.ONE, Category.RELATIVE_DATE),
    NEXT_X_MONTHS("next-x-months", Arity.ONE, Category.RELATIVE_DATE),
    LAST_X_YEARS("last-x-years", Arity.ONE, Category.RELATIVE_DATE),
    NEXT_X_YEARS("next-x-years", Arity.ONE, Category.RELATIVE_DATE);

    /**
     * Grouping used by the SQL mapping to pick a rendering template.
     */
    public enum Category {
        COMPARISON,
        PATTERN,
        NULL_CHECK,
        SET,
        RANGE,
        DATE,
        RELATIVE_DATE
    }

    private static final Map<String, ConditionOperator> BY_CODE = new HashMap<>();

    static {
        for (ConditionOperator op : values()) {
            BY_CODE.put(op.code, op);
        }
        // Accepted by the data service as a synonym of "ne"
        BY_CODE.put("neq", NE);
    }

    private final String code;
    private final Arity arity;
    private final Category category;

    ConditionOperator(String code, Arity arity, Category category) {
        this.code = code;
        this.arity = arity;
        this.category = category;
    }

    /**
     * Returns the FetchXML spelling of the operator, e.g. {@code "not-begin-with"}.
     *
     * @return the operator code
     */
    public String code() {
        return code;
    }

    public Arity arity() {
        return arity;
    }

    public Category category() {
        return category;
    }

    /**
     * Indicates whether the operator takes a count of units (hours, days, ...) as its value.
     *
     * @return {@code true} for the {@code last-x-*} and {@code next-x-*} operators
     */
    public boolean takesUnitCount() {
        return category == Category.RELATIVE_DATE && arity == Arity.ONE;
    }

    /**
     * Finds an operator by its FetchXML code, ignoring case and surrounding blanks.
     *
     * @param code the operator code as written in the source
     * @return the matching operator, or empty if the code is unknown
     * @throws NullPointerException if {@code code} is {@code null}
     */
    public static Optional<ConditionOperator> fromCode(String code) {
        return Optional.ofNullable(BY_CODE.get(code.trim().toLowerCase(Locale.ROOT)));
    }
}
