package io.github.cyfko.fetchql.core.api;

import io.github.cyfko.fetchql.core.exception.FetchXmlParseException;
import io.github.cyfko.fetchql.core.exception.SemanticException;
import io.github.cyfko.fetchql.core.exception.StructuralException;
import io.github.cyfko.fetchql.core.exception.TokenizeException;
import io.github.cyfko.fetchql.core.model.QueryDocument;

/**
 * Parser turning FetchXML text into a {@link QueryDocument}.
 *
 * <h2>Accepted grammar</h2>
 * <pre>
 * fetch        := &lt;fetch [top] [count] [page] [distinct] [aggregate]&gt; entity &lt;/fetch&gt;
 * entity       := &lt;entity name&gt; (all-attributes | attribute | filter | link-entity | order)* &lt;/entity&gt;
 * filter       := &lt;filter [type=and|or]&gt; (condition | filter)+ &lt;/filter&gt;
 * condition    := &lt;condition attribute operator [value] [entityname]/&gt;
 *               | &lt;condition attribute operator [entityname]&gt; &lt;value&gt;TEXT&lt;/value&gt;+ &lt;/condition&gt;
 * link-entity  := &lt;link-entity name from to [link-type] [alias]&gt; (same children as entity)* &lt;/link-entity&gt;
 * order        := &lt;order attribute|alias [descending]/&gt;
 * </pre>
 *
 * <h2>Error Detection</h2>
 * <p>
 * Parsing stops at the first problem. The exception type tells the stage that rejected the input:
 * </p>
 * <ul>
 *   <li>{@link TokenizeException}: unterminated tag or quote, bad character reference, ...</li>
 *   <li>{@link StructuralException}: mismatched or unterminated tags, several root elements</li>
 *   <li>{@link SemanticException}: unknown element or operator, wrong value count, duplicate alias</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see QueryGenerator
 */
public interface QueryParser {

    /**
     * Parses FetchXML text.
     *
     * @param fetchXml the source text
     * @return the query document
     * @throws FetchXmlParseException if the text is not a valid FetchXML query
     * @throws NullPointerException   if {@code fetchXml} is {@code null}
     */
    QueryDocument parse(String fetchXml) throws FetchXmlParseException;
}
