package io.github.cyfko.fetchql.core.api;

import io.github.cyfko.fetchql.core.exception.GenerationException;
import io.github.cyfko.fetchql.core.model.QueryDocument;

/**
 * Renders a {@link QueryDocument} as target-language text.
 * <p>
 * Generation is a pure function of the document and the generator settings: the same
 * document always produces the same text (relative-date operators depend on the configured clock).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see QueryParser
 */
@FunctionalInterface
public interface QueryGenerator {

    /**
     * Renders the document.
     *
     * @param document the query document
     * @return the generated query text
     * @throws GenerationException if the document references undeclared names or combines
     *                             constructs the target language cannot express
     */
    String generate(QueryDocument document) throws GenerationException;
}
