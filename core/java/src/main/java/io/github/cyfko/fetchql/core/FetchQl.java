package io.github.cyfko.fetchql.core;

import io.github.cyfko.fetchql.core.api.QueryGenerator;
import io.github.cyfko.fetchql.core.api.QueryParser;
import io.github.cyfko.fetchql.core.config.GeneratorConfig;
import io.github.cyfko.fetchql.core.config.ParserPolicy;
import io.github.cyfko.fetchql.core.impl.BasicFetchXmlParser;
import io.github.cyfko.fetchql.core.impl.FetchXmlWriter;
import io.github.cyfko.fetchql.core.impl.SqlGenerator;

/**
 * Entry point creating the default FetchQL components.
 *
 * <pre>{@code
 * // Defaults: T-SQL TOP, UTC dates, optional filter types
 * Transpiler transpiler = FetchQl.transpiler();
 *
 * // Strict parsing, LIMIT instead of TOP, Paris time
 * Transpiler custom = FetchQl.transpiler(
 *     ParserPolicy.strict(),
 *     GeneratorConfig.builder()
 *         .limitStyle(LimitStyle.LIMIT)
 *         .outputZone(ZoneId.of("Europe/Paris"))
 *         .build());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FetchQl {

    private FetchQl() {}

    /**
     * Creates a transpiler with {@link ParserPolicy#defaults()} and {@link GeneratorConfig#defaults()}.
     *
     * @return a new transpiler
     */
    public static Transpiler transpiler() {
        return new Transpiler(new BasicFetchXmlParser(), new SqlGenerator());
    }

    public static Transpiler transpiler(ParserPolicy policy, GeneratorConfig config) {
        return new Transpiler(new BasicFetchXmlParser(policy), new SqlGenerator(config));
    }

    /**
     * Creates a transpiler around custom components.
     *
     * @param parser    the parser to use
     * @param generator the generator to use
     * @return a new transpiler
     * @throws NullPointerException if any argument is null
     */
    public static Transpiler transpiler(QueryParser parser, QueryGenerator generator) {
        return new Transpiler(parser, generator);
    }

    public static QueryParser parser() {
        return new BasicFetchXmlParser();
    }

    public static QueryParser parser(ParserPolicy policy) {
        return new BasicFetchXmlParser(policy);
    }

    public static QueryGenerator generator() {
        return new SqlGenerator();
    }

    public static QueryGenerator generator(GeneratorConfig config) {
        return new SqlGenerator(config);
    }

    public static FetchXmlWriter writer() {
        return new FetchXmlWriter();
    }
}
