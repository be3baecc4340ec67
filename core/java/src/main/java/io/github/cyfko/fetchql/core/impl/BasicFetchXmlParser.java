package io.github.cyfko.fetchql.core.impl;

import io.github.cyfko.fetchql.core.api.QueryParser;
import io.github.cyfko.fetchql.core.config.ParserPolicy;
import io.github.cyfko.fetchql.core.exception.FetchXmlParseException;
import io.github.cyfko.fetchql.core.model.QueryDocument;
import io.github.cyfko.fetchql.core.parsing.DocumentBuilder;
import io.github.cyfko.fetchql.core.parsing.FetchXmlTokenizer;
import io.github.cyfko.fetchql.core.parsing.TagNode;
import io.github.cyfko.fetchql.core.parsing.TagTreeBuilder;
import io.github.cyfko.fetchql.core.parsing.Token;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link QueryParser}: a three-phase pipeline with no backtracking.
 * <ol>
 *   <li><strong>Phase 1</strong>: {@link FetchXmlTokenizer#tokenize(String)}, character scan into tokens</li>
 *   <li><strong>Phase 2</strong>: {@link TagTreeBuilder#buildTree(List)}, explicit-stack nesting check</li>
 *   <li><strong>Phase 3</strong>: {@link DocumentBuilder#buildDocument(TagNode)}, recursive descent into the model</li>
 * </ol>
 *
 * <h2>DoS Protection</h2>
 * <p>
 * The {@link ParserPolicy} bounds the input length and the element nesting depth, so even
 * hostile input fails with a typed error instead of exhausting memory or the call stack.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * QueryParser parser = new BasicFetchXmlParser();
 * QueryDocument document = parser.parse("""
 *     <fetch top="10">
 *       <entity name="contact">
 *         <attribute name="fullname"/>
 *       </entity>
 *     </fetch>""");
 *
 * // Every filter must state and/or
 * QueryParser strictParser = new BasicFetchXmlParser(ParserPolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFetchXmlParser implements QueryParser {

    private static final Logger log = Logger.getLogger(BasicFetchXmlParser.class.getName());

    private final ParserPolicy policy;
    private final FetchXmlTokenizer tokenizer;
    private final TagTreeBuilder treeBuilder;
    private final DocumentBuilder documentBuilder;

    /**
     * Creates a parser using {@link ParserPolicy#defaults()}.
     */
    public BasicFetchXmlParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * Creates a parser with custom limits.
     *
     * @param policy the parser policy
     * @throws IllegalArgumentException if policy is null
     */
    public BasicFetchXmlParser(ParserPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.policy = policy;
        this.tokenizer = new FetchXmlTokenizer(policy);
        this.treeBuilder = new TagTreeBuilder(policy);
        this.documentBuilder = new DocumentBuilder(policy);
    }

    public ParserPolicy getPolicy() {
        return policy;
    }

    @Override
    public QueryDocument parse(String fetchXml) throws FetchXmlParseException {
        Objects.requireNonNull(fetchXml, "FetchXML text cannot be null");

        List<Token> tokens = tokenizer.tokenize(fetchXml);
        log.fine(() -> String.format("Tokenized %d characters into %d tokens", fetchXml.length(), tokens.size()));

        TagNode root = treeBuilder.buildTree(tokens);
        QueryDocument document = documentBuilder.buildDocument(root);
        log.fine(() -> String.format("Parsed query on entity '%s' (%d link(s), filter: %s)",
                document.entityName(), document.links().size(), document.hasFilter()));
        return document;
    }
}
