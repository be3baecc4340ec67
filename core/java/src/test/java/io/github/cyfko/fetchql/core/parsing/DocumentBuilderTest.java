package io.github.cyfko.fetchql.core.parsing;

import io.github.cyfko.fetchql.core.api.ConditionOperator;
import io.github.cyfko.fetchql.core.config.ParserPolicy;
import io.github.cyfko.fetchql.core.exception.SemanticException;
import io.github.cyfko.fetchql.core.exception.SemanticException.Reason;
import io.github.cyfko.fetchql.core.model.AggregateFunction;
import io.github.cyfko.fetchql.core.model.AttributeSpec;
import io.github.cyfko.fetchql.core.model.Condition;
import io.github.cyfko.fetchql.core.model.FilterGroup;
import io.github.cyfko.fetchql.core.model.FilterType;
import io.github.cyfko.fetchql.core.model.JoinType;
import io.github.cyfko.fetchql.core.model.LinkedEntity;
import io.github.cyfko.fetchql.core.model.OrderSpec;
import io.github.cyfko.fetchql.core.model.QueryDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DocumentBuilder}: tag tree to query model, and semantic errors.
 */
@DisplayName("DocumentBuilder Tests")
class DocumentBuilderTest {

    private static QueryDocument parse(String fetchXml) {
        return parse(fetchXml, ParserPolicy.defaults());
    }

    private static QueryDocument parse(String fetchXml, ParserPolicy policy) {
        List<Token> tokens = new FetchXmlTokenizer(policy).tokenize(fetchXml);
        TagNode root = new TagTreeBuilder(policy).buildTree(tokens);
        return new DocumentBuilder(policy).buildDocument(root);
    }

    private static String entity(String body) {
        return "<fetch><entity name=\"contact\">" + body + "</entity></fetch>";
    }

    private static SemanticException failure(String fetchXml) {
        return assertThrows(SemanticException.class, () -> parse(fetchXml));
    }

    @Nested
    @DisplayName("Model construction")
    class ModelConstruction {

        @Test
        @DisplayName("Should build a complete document")
        void shouldBuildCompleteDocument() {
            QueryDocument document = parse("""
                    <fetch version="1.0" top="50" distinct="true" mapping="logical">
                      <entity name="contact">
                        <attribute name="fullname"/>
                        <attribute name="emailaddress1" alias="email"/>
                        <filter type="and">
                          <condition attribute="statecode" operator="eq" value="0"/>
                          <filter type="or">
                            <condition attribute="city" operator="eq" value="Paris"/>
                            <condition attribute="city" operator="in">
                              <value>Lyon</value>
                              <value>Lille</value>
                            </condition>
                          </filter>
                        </filter>
                        <link-entity name="account" from="accountid" to="parentcustomerid" alias="acc" link-type="outer">
                          <attribute name="name"/>
                          <order attribute="name" descending="true"/>
                        </link-entity>
                        <order attribute="fullname"/>
                      </entity>
                    </fetch>""");

            QueryDocument expected = QueryDocument.builder("contact")
                    .top(50)
                    .distinct(true)
                    .attribute(AttributeSpec.of("fullname"))
                    .attribute(AttributeSpec.aliased("emailaddress1", "email"))
                    .filter(FilterGroup.and(
                            Condition.of("statecode", ConditionOperator.EQ, "0"),
                            FilterGroup.or(
                                    Condition.of("city", ConditionOperator.EQ, "Paris"),
                                    Condition.of("city", ConditionOperator.IN, "Lyon", "Lille"))))
                    .link(LinkedEntity.builder("account", "accountid", "parentcustomerid")
                            .joinType(JoinType.OUTER)
                            .alias("acc")
                            .attribute(AttributeSpec.of("name"))
                            .order(new OrderSpec("name", true, OrderSpec.Target.ATTRIBUTE, "acc"))
                            .build())
                    .order(OrderSpec.asc("fullname"))
                    .build();

            assertEquals(expected, document);
        }

        @Test
        @DisplayName("Should use count as the row cap when top is absent")
        void shouldUseCountAsTop() {
            QueryDocument counted = parse("<fetch count=\"25\"><entity name=\"a\"/></fetch>");
            QueryDocument capped = parse("<fetch top=\"25\"><entity name=\"a\"/></fetch>");

            assertEquals(25, counted.top());
            assertTrue(counted.capFromCount());
            assertFalse(capped.capFromCount());
            assertNotEquals(capped, counted);
        }

        @Test
        @DisplayName("Should keep the paging cookie verbatim")
        void shouldPreservePagingCookie() {
            QueryDocument document = parse(
                    "<fetch paging-cookie=\"&lt;cookie page=&quot;1&quot;/&gt;\"><entity name=\"a\"/></fetch>");

            assertEquals("<cookie page=\"1\"/>", document.pagingCookie());
            assertTrue(document.hasPaging());
            assertNull(document.page());
        }

        @Test
        @DisplayName("Should preserve the page number")
        void shouldPreservePage() {
            QueryDocument document = parse("<fetch count=\"10\" page=\"3\"><entity name=\"a\"/></fetch>");

            assertEquals(3, document.page());
            assertEquals(10, document.top());
        }

        @ParameterizedTest
        @CsvSource({"true,true", "TRUE,true", "1,true", "false,false", "0,false"})
        @DisplayName("Should read boolean attributes")
        void shouldReadBooleans(String raw, boolean expected) {
            assertEquals(expected, parse("<fetch distinct=\"" + raw + "\"><entity name=\"a\"/></fetch>").distinct());
        }

        @Test
        @DisplayName("Should default the filter type to and")
        void shouldDefaultFilterType() {
            QueryDocument document = parse(entity("<filter><condition attribute=\"a\" operator=\"null\"/></filter>"));

            assertEquals(FilterType.AND, document.filter().type());
        }

        @Test
        @DisplayName("Should combine several entity filters under and")
        void shouldCombineFilters() {
            QueryDocument document = parse(entity(
                    "<filter><condition attribute=\"a\" operator=\"null\"/></filter>"
                            + "<filter type=\"or\"><condition attribute=\"b\" operator=\"null\"/>"
                            + "<condition attribute=\"c\" operator=\"null\"/></filter>"));

            assertEquals(FilterType.AND, document.filter().type());
            assertEquals(2, document.filter().children().size());
            assertEquals(2, document.filter().depth());
        }

        @Test
        @DisplayName("Should read all-attributes, aggregates and group-by")
        void shouldReadAttributes() {
            QueryDocument document = parse("""
                    <fetch aggregate="true">
                      <entity name="opportunity">
                        <attribute name="opportunityid" alias="n" aggregate="countcolumn" distinct="true"/>
                        <attribute name="ownerid" alias="owner" groupby="true"/>
                        <order alias="n" descending="true"/>
                      </entity>
                    </fetch>""");

            assertTrue(document.aggregate());
            assertEquals(new AttributeSpec("opportunityid", "n", AggregateFunction.COUNT_COLUMN, false, true),
                    document.attributes().get(0));
            assertTrue(document.attributes().get(1).groupBy());
            assertEquals(new OrderSpec("n", true, OrderSpec.Target.ALIAS, null), document.orders().get(0));

            assertTrue(parse(entity("<all-attributes/>")).allAttributes());
        }

        @Test
        @DisplayName("Should read the entityname of a condition")
        void shouldReadConditionEntityName() {
            Condition condition = (Condition) parse(entity(
                    "<filter><condition entityname=\"acc\" attribute=\"name\" operator=\"eq\" value=\"x\"/></filter>"))
                    .filter().children().get(0);

            assertEquals("acc", condition.entityName());
        }

        @Test
        @DisplayName("Should read an empty value element as an empty string")
        void shouldReadEmptyValue() {
            Condition condition = (Condition) parse(entity(
                    "<filter><condition attribute=\"a\" operator=\"in\"><value></value><value>x</value></condition></filter>"))
                    .filter().children().get(0);

            assertEquals(List.of("", "x"), condition.values());
        }

        @Test
        @DisplayName("Should nest link-entities and default the join type to inner")
        void shouldNestLinks() {
            QueryDocument document = parse(entity("""
                    <link-entity name="account" from="accountid" to="parentcustomerid">
                      <link-entity name="systemuser" from="systemuserid" to="ownerid" alias="owner">
                        <all-attributes/>
                      </link-entity>
                    </link-entity>"""));

            LinkedEntity account = document.links().get(0);
            assertEquals(JoinType.INNER, account.joinType());
            assertEquals("account", account.effectiveAlias());
            assertTrue(account.links().get(0).allAttributes());
            assertEquals("owner", account.links().get(0).effectiveAlias());
        }
    }

    @Nested
    @DisplayName("Semantic errors")
    class SemanticErrors {

        @Test
        @DisplayName("Should require fetch as root")
        void shouldRequireFetchRoot() {
            SemanticException e = failure("<entity name=\"a\"/>");

            assertEquals(Reason.UNKNOWN_ELEMENT, e.reason());
            assertEquals(0, e.position().offset());
        }

        @Test
        @DisplayName("Should require exactly one entity")
        void shouldRequireOneEntity() {
            assertEquals(Reason.MISSING_ELEMENT, failure("<fetch/>").reason());
            assertEquals(Reason.UNKNOWN_ELEMENT,
                    failure("<fetch><entity name=\"a\"/><entity name=\"b\"/></fetch>").reason());
        }

        @Test
        @DisplayName("Should name the unknown element and its parent")
        void shouldRejectUnknownElement() {
            SemanticException e = failure(entity("<foo/>"));

            assertEquals(Reason.UNKNOWN_ELEMENT, e.reason());
            assertTrue(e.getMessage().startsWith("Unknown element <foo> in <entity>"));
            assertEquals(30, e.position().offset());
        }

        @Test
        @DisplayName("Should reject text inside structural elements")
        void shouldRejectUnexpectedText() {
            assertEquals(Reason.UNEXPECTED_TEXT, failure(entity("hello")).reason());
            assertEquals(Reason.UNEXPECTED_TEXT,
                    failure(entity("<filter><condition attribute=\"a\" operator=\"null\">x</condition></filter>")).reason());
        }

        @ParameterizedTest
        @ValueSource(strings = {"abc", "0", "-1", "1.5", "99999999999"})
        @DisplayName("Should reject invalid top values")
        void shouldRejectInvalidTop(String top) {
            assertEquals(Reason.INVALID_ATTRIBUTE_VALUE,
                    failure("<fetch top=\"" + top + "\"><entity name=\"a\"/></fetch>").reason());
        }

        @Test
        @DisplayName("Should reject top together with count")
        void shouldRejectTopAndCount() {
            assertEquals(Reason.CONFLICTING_ATTRIBUTES,
                    failure("<fetch top=\"5\" count=\"5\"><entity name=\"a\"/></fetch>").reason());
        }

        @Test
        @DisplayName("Should reject invalid booleans")
        void shouldRejectInvalidBoolean() {
            assertEquals(Reason.INVALID_ATTRIBUTE_VALUE,
                    failure("<fetch distinct=\"yes\"><entity name=\"a\"/></fetch>").reason());
        }

        @Test
        @DisplayName("Should report missing and blank required attributes")
        void shouldReportMissingAttributes() {
            assertEquals(Reason.MISSING_ATTRIBUTE, failure("<fetch><entity/></fetch>").reason());
            assertEquals(Reason.INVALID_ATTRIBUTE_VALUE, failure("<fetch><entity name=\" \"/></fetch>").reason());
            assertEquals(Reason.MISSING_ATTRIBUTE,
                    failure(entity("<link-entity name=\"account\" to=\"x\"/>")).reason());
        }

        @Test
        @DisplayName("Should reject an unknown link type")
        void shouldRejectUnknownLinkType() {
            assertEquals(Reason.INVALID_ATTRIBUTE_VALUE, failure(entity(
                    "<link-entity name=\"account\" from=\"a\" to=\"b\" link-type=\"cross\"/>")).reason());
        }

        @Test
        @DisplayName("Should require the filter type under the strict policy")
        void shouldRequireFilterTypeWhenStrict() {
            SemanticException e = assertThrows(SemanticException.class, () -> parse(
                    entity("<filter><condition attribute=\"a\" operator=\"null\"/></filter>"), ParserPolicy.strict()));

            assertEquals(Reason.MISSING_ATTRIBUTE, e.reason());
            assertTrue(e.getMessage().contains("STRICT_POLICY"));
        }

        @Test
        @DisplayName("Should reject an unknown filter type")
        void shouldRejectUnknownFilterType() {
            assertEquals(Reason.INVALID_ATTRIBUTE_VALUE,
                    failure(entity("<filter type=\"xor\"><condition attribute=\"a\" operator=\"null\"/></filter>")).reason());
        }

        @Test
        @DisplayName("Should reject an empty filter")
        void shouldRejectEmptyFilter() {
            assertEquals(Reason.EMPTY_FILTER, failure(entity("<filter type=\"and\"/>")).reason());
            assertEquals(Reason.EMPTY_FILTER, failure(entity("<filter><filter></filter></filter>")).reason());
        }

        @Test
        @DisplayName("Should reject an unknown operator")
        void shouldRejectUnknownOperator() {
            SemanticException e = failure(entity(
                    "<filter><condition attribute=\"a\" operator=\"sounds-like\" value=\"x\"/></filter>"));

            assertEquals(Reason.UNKNOWN_OPERATOR, e.reason());
            assertTrue(e.getMessage().contains("sounds-like"));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "<condition attribute=\"email\" operator=\"null\" value=\"x\"/>",
                "<condition attribute=\"a\" operator=\"in\"/>",
                "<condition attribute=\"a\" operator=\"eq\"/>",
                "<condition attribute=\"a\" operator=\"between\"><value>1</value></condition>",
                "<condition attribute=\"a\" operator=\"between\"><value>1</value><value>2</value><value>3</value></condition>",
                "<condition attribute=\"a\" operator=\"today\" value=\"x\"/>"
        })
        @DisplayName("Should reject value counts the operator does not accept")
        void shouldRejectArityMismatch(String condition) {
            assertEquals(Reason.ARITY_MISMATCH, failure(entity("<filter>" + condition + "</filter>")).reason());
        }

        @Test
        @DisplayName("Should explain arity mismatches")
        void shouldExplainArityMismatch() {
            SemanticException e = failure(entity(
                    "<filter><condition attribute=\"email\" operator=\"null\" value=\"x\"/></filter>"));

            assertTrue(e.getMessage().startsWith("Operator 'null' takes no value, got 1"));
        }

        @Test
        @DisplayName("Should reject a value attribute combined with value elements")
        void shouldRejectBothValueForms() {
            assertEquals(Reason.CONFLICTING_ATTRIBUTES, failure(entity(
                    "<filter><condition attribute=\"a\" operator=\"in\" value=\"1\"><value>2</value></condition></filter>"))
                    .reason());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "<condition attribute=\"a\" operator=\"last-x-days\" value=\"abc\"/>",
                "<condition attribute=\"a\" operator=\"next-x-hours\" value=\"0\"/>",
                "<condition attribute=\"a\" operator=\"on\" value=\"yesterday-ish\"/>",
                "<condition attribute=\"a\" operator=\"on-or-after\" value=\"2024-02-30\"/>"
        })
        @DisplayName("Should reject literals the operator cannot use")
        void shouldRejectInvalidLiteral(String condition) {
            assertEquals(Reason.INVALID_LITERAL, failure(entity("<filter>" + condition + "</filter>")).reason());
        }

        @Test
        @DisplayName("Should reject non-value children of a condition")
        void shouldRejectConditionChildren() {
            assertEquals(Reason.UNKNOWN_ELEMENT, failure(entity(
                    "<filter><condition attribute=\"a\" operator=\"in\"><item>1</item></condition></filter>")).reason());
        }

        @Test
        @DisplayName("Should reject conflicting attribute declarations")
        void shouldRejectConflictingAttributeSpec() {
            assertEquals(Reason.CONFLICTING_ATTRIBUTES,
                    failure(entity("<attribute name=\"a\" aggregate=\"sum\" groupby=\"true\"/>")).reason());
            assertEquals(Reason.CONFLICTING_ATTRIBUTES,
                    failure(entity("<attribute name=\"a\" distinct=\"true\"/>")).reason());
            assertEquals(Reason.INVALID_ATTRIBUTE_VALUE,
                    failure(entity("<attribute name=\"a\" aggregate=\"median\"/>")).reason());
        }

        @Test
        @DisplayName("Should require exactly one of attribute and alias on order")
        void shouldValidateOrder() {
            assertEquals(Reason.CONFLICTING_ATTRIBUTES,
                    failure(entity("<order attribute=\"a\" alias=\"b\"/>")).reason());
            assertEquals(Reason.MISSING_ATTRIBUTE, failure(entity("<order descending=\"true\"/>")).reason());
        }
    }

    @Nested
    @DisplayName("Alias uniqueness")
    class AliasUniqueness {

        @Test
        @DisplayName("Should reject two links with the same alias")
        void shouldRejectDuplicateAlias() {
            SemanticException e = failure(entity(
                    "<link-entity name=\"account\" from=\"a\" to=\"b\" alias=\"acc\"/>"
                            + "<link-entity name=\"contact\" from=\"c\" to=\"d\" alias=\"acc\"/>"));

            assertEquals(Reason.DUPLICATE_ALIAS, e.reason());
            assertTrue(e.getMessage().startsWith("Alias 'acc' is declared more than once"));
            assertEquals(87, e.position().offset());
        }

        @Test
        @DisplayName("Should reject two unaliased links to the same collection")
        void shouldRejectDuplicateLinkNames() {
            assertEquals(Reason.DUPLICATE_ALIAS, failure(entity(
                    "<link-entity name=\"account\" from=\"a\" to=\"b\"/>"
                            + "<link-entity name=\"account\" from=\"c\" to=\"d\"/>")).reason());
        }

        @Test
        @DisplayName("Should reject an alias equal to the root entity")
        void shouldRejectAliasOfRootEntity() {
            assertEquals(Reason.DUPLICATE_ALIAS, failure(entity(
                    "<link-entity name=\"account\" from=\"a\" to=\"b\" alias=\"contact\"/>")).reason());
        }

        @Test
        @DisplayName("Should check aliases of nested links")
        void shouldCheckNestedAliases() {
            assertEquals(Reason.DUPLICATE_ALIAS, failure(entity(
                    "<link-entity name=\"account\" from=\"a\" to=\"b\" alias=\"x\">"
                            + "<link-entity name=\"systemuser\" from=\"c\" to=\"d\" alias=\"x\"/>"
                            + "</link-entity>")).reason());
        }

        @Test
        @DisplayName("Should accept distinct aliases for the same collection")
        void shouldAcceptDistinctAliases() {
            assertDoesNotThrow(() -> parse(entity(
                    "<link-entity name=\"account\" from=\"a\" to=\"b\" alias=\"a1\"/>"
                            + "<link-entity name=\"account\" from=\"c\" to=\"d\" alias=\"a2\"/>")));
        }
    }
}
