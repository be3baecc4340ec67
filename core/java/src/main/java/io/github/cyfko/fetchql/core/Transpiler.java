package io.github.cyfko.fetchql.core;

import io.github.cyfko.fetchql.core.api.QueryGenerator;
import io.github.cyfko.fetchql.core.api.QueryParser;
import io.github.cyfko.fetchql.core.exception.FetchQlException;
import io.github.cyfko.fetchql.core.model.AttributeSpec;
import io.github.cyfko.fetchql.core.model.LinkedEntity;
import io.github.cyfko.fetchql.core.model.QueryDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * FetchXML to SQL pipeline for host applications: parse, then generate.
 * <p>
 * Unlike {@link QueryParser} and {@link QueryGenerator}, {@link #transpile(String)} never throws
 * for bad input: every {@link FetchQlException} is turned into a failed
 * {@link TranspilationResult}, so an editor panel can display the message and position
 * directly. The generator is not called when parsing fails.
 * </p>
 *
 * <pre>{@code
 * Transpiler transpiler = FetchQl.transpiler();
 * TranspilationResult result = transpiler.transpile(editorText);
 * if (result.success()) {
 *     preview.setText(result.sql());
 * } else {
 *     status.setText(result.errorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class Transpiler {

    private static final Logger log = Logger.getLogger(Transpiler.class.getName());

    private final QueryParser parser;
    private final QueryGenerator generator;

    public Transpiler(QueryParser parser, QueryGenerator generator) {
        this.parser = Objects.requireNonNull(parser, "Query parser cannot be null");
        this.generator = Objects.requireNonNull(generator, "Query generator cannot be null");
    }

    /**
     * Converts FetchXML text into SQL.
     *
     * @param fetchXml the FetchXML source; {@code null} is treated as empty input
     * @return the SQL with its warnings, or the first error
     */
    public TranspilationResult transpile(String fetchXml) {
        String source = fetchXml == null ? "" : fetchXml;
        try {
            QueryDocument document = parser.parse(source);
            String sql = generator.generate(document);
            List<TranspilationWarning> warnings = warningsFor(document);
            log.info(() -> String.format("Transpiled query on '%s' with %d warning(s)",
                    document.entityName(), warnings.size()));
            return TranspilationResult.succeeded(sql, warnings);
        } catch (FetchQlException e) {
            log.info(() -> String.format("Transpilation failed (%s): %s", e.reasonCode(), e.getMessage()));
            return TranspilationResult.failed(e);
        }
    }

    /**
     * Parses FetchXML without generating SQL.
     *
     * @param fetchXml the FetchXML source
     * @return the query document
     * @throws io.github.cyfko.fetchql.core.exception.FetchXmlParseException if the text is invalid
     */
    public QueryDocument parse(String fetchXml) {
        return parser.parse(fetchXml);
    }

    private static List<TranspilationWarning> warningsFor(QueryDocument document) {
        List<TranspilationWarning> warnings = new ArrayList<>();
        if (document.hasPaging()) {
            String declared = document.page() != null ? "Page " + document.page() : "The paging cookie";
            warnings.add(new TranspilationWarning(TranspilationWarning.Code.PAGING,
                    declared + " is ignored: the SQL preview has no paging"));
        }
        if (document.capFromCount()) {
            warnings.add(new TranspilationWarning(TranspilationWarning.Code.COUNT_AS_TOP,
                    "count=\"" + document.top() + "\" is applied as a result cap of " + document.top() + " row(s)"));
        }
        if (!document.aggregate() && usesAggregates(document.attributes(), document.links())) {
            warnings.add(new TranspilationWarning(TranspilationWarning.Code.AGGREGATE_NOT_DECLARED,
                    "Aggregate columns are used but <fetch> does not declare aggregate=\"true\""));
        }
        return warnings;
    }

    private static boolean usesAggregates(List<AttributeSpec> attributes, List<LinkedEntity> links) {
        for (AttributeSpec attribute : attributes) {
            if (attribute.isAggregated()) return true;
        }
        for (LinkedEntity link : links) {
            if (usesAggregates(link.attributes(), link.links())) return true;
        }
        return false;
    }
}
