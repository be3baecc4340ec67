package io.github.cyfko.fetchql.core.impl;

import io.github.cyfko.fetchql.core.api.ConditionOperator;
import io.github.cyfko.fetchql.core.config.GeneratorConfig;
import io.github.cyfko.fetchql.core.config.LimitStyle;
import io.github.cyfko.fetchql.core.exception.GenerationException;
import io.github.cyfko.fetchql.core.exception.GenerationException.Reason;
import io.github.cyfko.fetchql.core.model.AggregateFunction;
import io.github.cyfko.fetchql.core.model.AttributeSpec;
import io.github.cyfko.fetchql.core.model.Condition;
import io.github.cyfko.fetchql.core.model.FilterGroup;
import io.github.cyfko.fetchql.core.model.LinkedEntity;
import io.github.cyfko.fetchql.core.model.OrderSpec;
import io.github.cyfko.fetchql.core.model.QueryDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SqlGenerator}, mostly end to end from FetchXML text.
 */
@DisplayName("SqlGenerator Tests")
class SqlGeneratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-13T15:30:00Z"), ZoneOffset.UTC);

    private BasicFetchXmlParser parser;
    private SqlGenerator generator;

    @BeforeEach
    void setUp() {
        parser = new BasicFetchXmlParser();
        generator = new SqlGenerator(GeneratorConfig.builder().clock(CLOCK).build());
    }

    private String sql(String fetchXml) {
        return generator.generate(parser.parse(fetchXml));
    }

    private GenerationException failure(String fetchXml) {
        QueryDocument document = parser.parse(fetchXml);
        return assertThrows(GenerationException.class, () -> generator.generate(document));
    }

    @Nested
    @DisplayName("Select and where")
    class SelectAndWhere {

        @Test
        @DisplayName("Should render a simple filtered and ordered query")
        void shouldRenderSimpleQuery() {
            String sql = sql("""
                    <fetch>
                      <entity name="contact">
                        <all-attributes/>
                        <filter type="and">
                          <condition attribute="status" operator="eq" value="1"/>
                        </filter>
                        <order attribute="name"/>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT * FROM contact WHERE status = 1 ORDER BY name ASC", sql);
        }

        @Test
        @DisplayName("Should select everything when no column is declared")
        void shouldDefaultToStar() {
            assertEquals("SELECT * FROM account", sql("<fetch><entity name=\"account\"/></fetch>"));
        }

        @Test
        @DisplayName("Should map each filter level to one level of parentheses")
        void shouldParenthesizeNestedGroups() {
            String sql = sql("""
                    <fetch>
                      <entity name="t">
                        <filter type="and">
                          <condition attribute="a" operator="eq" value="1"/>
                          <filter type="or">
                            <condition attribute="b" operator="eq" value="2"/>
                            <condition attribute="c" operator="eq" value="3"/>
                          </filter>
                        </filter>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT * FROM t WHERE (a = 1 AND (b = 2 OR c = 3))", sql);
        }

        @Test
        @DisplayName("Should render a single-child root group as its child")
        void shouldUnwrapSingleChildRoot() {
            String sql = sql("""
                    <fetch>
                      <entity name="t">
                        <filter>
                          <filter type="or">
                            <condition attribute="a" operator="null"/>
                            <condition attribute="b" operator="not-null"/>
                          </filter>
                        </filter>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT * FROM t WHERE (a IS NULL OR b IS NOT NULL)", sql);
        }

        @Test
        @DisplayName("Should keep the parentheses of nested single-child groups")
        void shouldWrapNestedSingleChildGroups() {
            String sql = sql("""
                    <fetch>
                      <entity name="t">
                        <filter>
                          <filter>
                            <filter>
                              <condition attribute="a" operator="eq" value="1"/>
                            </filter>
                          </filter>
                        </filter>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT * FROM t WHERE ((a = 1))", sql);
        }

        @Test
        @DisplayName("Should wrap a nested single-child group among siblings")
        void shouldWrapNestedSingleChildAmongSiblings() {
            QueryDocument document = QueryDocument.builder("t")
                    .filter(FilterGroup.and(
                            Condition.of("a", ConditionOperator.EQ, "1"),
                            FilterGroup.or(Condition.of("b", ConditionOperator.NULL))))
                    .build();

            assertEquals("SELECT * FROM t WHERE (a = 1 AND (b IS NULL))", generator.generate(document));
        }

        @Test
        @DisplayName("Should render distinct, top and aliases")
        void shouldRenderDistinctTopAndAliases() {
            String sql = sql("""
                    <fetch top="10" distinct="true">
                      <entity name="contact">
                        <attribute name="fullname"/>
                        <attribute name="emailaddress1" alias="email"/>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT DISTINCT TOP 10 fullname, emailaddress1 AS email FROM contact", sql);
        }

        @Test
        @DisplayName("Should use a trailing LIMIT when configured")
        void shouldRenderLimit() {
            SqlGenerator limit = new SqlGenerator(GeneratorConfig.builder().limitStyle(LimitStyle.LIMIT).build());

            String sql = limit.generate(parser.parse("""
                    <fetch count="5">
                      <entity name="contact">
                        <attribute name="fullname"/>
                        <order attribute="fullname" descending="true"/>
                      </entity>
                    </fetch>"""));

            assertEquals("SELECT fullname FROM contact ORDER BY fullname DESC LIMIT 5", sql);
        }

        @Test
        @DisplayName("Should render relative dates against the configured clock")
        void shouldRenderRelativeDates() {
            String sql = sql("""
                    <fetch>
                      <entity name="task">
                        <filter type="or">
                          <condition attribute="createdon" operator="today"/>
                          <condition attribute="duedate" operator="last-x-days" value="3"/>
                        </filter>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT * FROM task WHERE ("
                    + "(createdon >= '2024-03-13T00:00:00Z' AND createdon < '2024-03-14T00:00:00Z')"
                    + " OR (duedate >= '2024-03-10T00:00:00Z' AND duedate < '2024-03-13T15:30:00Z'))", sql);
        }

        @Test
        @DisplayName("Should render a hand-built document")
        void shouldRenderModelDirectly() {
            QueryDocument document = QueryDocument.builder("account")
                    .attribute(AttributeSpec.of("name"))
                    .filter(FilterGroup.or(
                            Condition.of("revenue", ConditionOperator.BETWEEN, "1000", "5000"),
                            Condition.of("name", ConditionOperator.BEGINS_WITH, "Contoso")))
                    .order(OrderSpec.desc("revenue"))
                    .build();

            assertEquals("SELECT name FROM account WHERE (revenue BETWEEN 1000 AND 5000 OR name LIKE 'Contoso%')"
                    + " ORDER BY revenue DESC", generator.generate(document));
        }

        @Test
        @DisplayName("Should ignore the page when no top is given")
        void shouldIgnorePage() {
            assertEquals("SELECT * FROM contact", sql("<fetch page=\"2\"><entity name=\"contact\"/></fetch>"));
        }
    }

    @Nested
    @DisplayName("Joins")
    class Joins {

        @Test
        @DisplayName("Should render an outer join with its filter")
        void shouldRenderOuterJoin() {
            String sql = sql("""
                    <fetch>
                      <entity name="contact">
                        <attribute name="fullname"/>
                        <link-entity name="account" from="accountid" to="parentcustomerid" alias="acc" link-type="outer">
                          <attribute name="name"/>
                          <filter type="and">
                            <condition attribute="statecode" operator="eq" value="0"/>
                          </filter>
                        </link-entity>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT fullname, acc.name FROM contact LEFT JOIN account acc"
                    + " ON acc.accountid = contact.parentcustomerid AND (acc.statecode = 0)", sql);
        }

        @Test
        @DisplayName("Should not wrap an already parenthesized join filter twice")
        void shouldNotDoubleWrapJoinFilter() {
            String sql = sql("""
                    <fetch>
                      <entity name="contact">
                        <link-entity name="account" from="accountid" to="parentcustomerid" alias="acc">
                          <filter type="or">
                            <condition attribute="a" operator="eq" value="1"/>
                            <condition attribute="b" operator="eq" value="2"/>
                          </filter>
                        </link-entity>
                        <link-entity name="task" from="regardingobjectid" to="contactid" alias="t">
                          <filter>
                            <condition attribute="createdon" operator="yesterday"/>
                          </filter>
                        </link-entity>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT * FROM contact"
                    + " INNER JOIN account acc ON acc.accountid = contact.parentcustomerid AND (acc.a = 1 OR acc.b = 2)"
                    + " INNER JOIN task t ON t.regardingobjectid = contact.contactid"
                    + " AND (t.createdon >= '2024-03-12T00:00:00Z' AND t.createdon < '2024-03-13T00:00:00Z')", sql);
        }

        @Test
        @DisplayName("Should join nested links depth-first")
        void shouldJoinNestedLinks() {
            String sql = sql("""
                    <fetch>
                      <entity name="contact">
                        <all-attributes/>
                        <link-entity name="account" from="accountid" to="parentcustomerid" alias="a">
                          <link-entity name="systemuser" from="systemuserid" to="ownerid" alias="u">
                            <all-attributes/>
                          </link-entity>
                        </link-entity>
                        <link-entity name="lead" from="leadid" to="originatingleadid"/>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT contact.*, u.* FROM contact"
                    + " INNER JOIN account a ON a.accountid = contact.parentcustomerid"
                    + " INNER JOIN systemuser u ON u.systemuserid = a.ownerid"
                    + " INNER JOIN lead ON lead.leadid = contact.originatingleadid", sql);
        }

        @Test
        @DisplayName("Should qualify columns through entityname and prefixes")
        void shouldQualifyColumns() {
            String sql = sql("""
                    <fetch>
                      <entity name="contact">
                        <attribute name="fullname"/>
                        <filter type="and">
                          <condition entityname="acc" attribute="name" operator="like" value="%Ltd"/>
                          <condition attribute="acc.revenue" operator="gt" value="100"/>
                          <condition entityname="contact" attribute="statecode" operator="eq" value="0"/>
                        </filter>
                        <link-entity name="account" from="accountid" to="parentcustomerid" alias="acc">
                          <order attribute="name" descending="true"/>
                        </link-entity>
                        <order attribute="fullname"/>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT fullname FROM contact"
                    + " INNER JOIN account acc ON acc.accountid = contact.parentcustomerid"
                    + " WHERE (acc.name LIKE '%Ltd' AND acc.revenue > 100 AND contact.statecode = 0)"
                    + " ORDER BY fullname ASC, acc.name DESC", sql);
        }
    }

    @Nested
    @DisplayName("Aggregates")
    class Aggregates {

        @Test
        @DisplayName("Should render aggregate columns with grouping and alias ordering")
        void shouldRenderAggregates() {
            String sql = sql("""
                    <fetch aggregate="true">
                      <entity name="opportunity">
                        <attribute name="opportunityid" alias="total" aggregate="count"/>
                        <attribute name="estimatedvalue" alias="revenue" aggregate="sum"/>
                        <attribute name="ownerid" alias="owner" groupby="true"/>
                        <order alias="revenue" descending="true"/>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT COUNT(*) AS total, SUM(estimatedvalue) AS revenue, ownerid AS owner"
                    + " FROM opportunity GROUP BY ownerid ORDER BY revenue DESC", sql);
        }

        @Test
        @DisplayName("Should render distinct counts and grouped link columns")
        void shouldRenderDistinctCountAndLinkGrouping() {
            String sql = sql("""
                    <fetch aggregate="true">
                      <entity name="contact">
                        <attribute name="contactid" alias="n" aggregate="countcolumn" distinct="true"/>
                        <attribute name="birthdate" alias="oldest" aggregate="min"/>
                        <link-entity name="account" from="accountid" to="parentcustomerid" alias="acc">
                          <attribute name="name" alias="account" groupby="true"/>
                        </link-entity>
                      </entity>
                    </fetch>""");

            assertEquals("SELECT COUNT(DISTINCT contactid) AS n, MIN(birthdate) AS oldest, acc.name AS account"
                    + " FROM contact INNER JOIN account acc ON acc.accountid = contact.parentcustomerid"
                    + " GROUP BY acc.name", sql);
        }

        @Test
        @DisplayName("Should render a hand-built aggregate without alias")
        void shouldRenderUnaliasedAggregate() {
            QueryDocument document = QueryDocument.builder("invoice")
                    .attribute(new AttributeSpec("totalamount", null, AggregateFunction.AVG, false, false))
                    .build();

            assertEquals("SELECT AVG(totalamount) FROM invoice", generator.generate(document));
        }
    }

    @Nested
    @DisplayName("Generation errors")
    class GenerationErrors {

        @Test
        @DisplayName("Should reject an unknown entityname")
        void shouldRejectUnknownEntityName() {
            GenerationException e = failure("""
                    <fetch><entity name="contact"><filter>
                      <condition entityname="missing" attribute="name" operator="eq" value="x"/>
                    </filter></entity></fetch>""");

            assertEquals(Reason.UNRESOLVED_REFERENCE, e.reason());
            assertEquals("entity[contact]/filter", e.context());
            assertEquals("Entity alias 'missing' does not match any link-entity (entity[contact]/filter)",
                    e.getMessage());
        }

        @Test
        @DisplayName("Should reject a relative range beyond the supported calendar")
        void shouldRejectRelativeRangeOutOfRange() {
            GenerationException root = failure("""
                    <fetch><entity name="t"><filter>
                      <condition attribute="d" operator="last-x-years" value="2000000000"/>
                    </filter></entity></fetch>""");
            GenerationException link = failure("""
                    <fetch><entity name="t">
                      <link-entity name="u" from="id" to="uid" alias="x">
                        <filter><condition attribute="d" operator="next-x-years" value="2147483647"/></filter>
                      </link-entity>
                    </entity></fetch>""");

            assertEquals(Reason.VALUE_OUT_OF_RANGE, root.reason());
            assertEquals("Condition 'last-x-years' on 'd' yields a date outside the supported range (entity[t]/filter)",
                    root.getMessage());
            assertInstanceOf(DateTimeException.class, root.getCause());
            assertEquals(Reason.VALUE_OUT_OF_RANGE, link.reason());
            assertEquals("link-entity[x]/filter", link.context());
        }

        @Test
        @DisplayName("Should reject an unknown column prefix")
        void shouldRejectUnknownPrefix() {
            GenerationException e = failure("""
                    <fetch><entity name="contact">
                      <link-entity name="account" from="accountid" to="parentcustomerid" alias="acc">
                        <filter><condition attribute="zz.name" operator="null"/></filter>
                      </link-entity>
                    </entity></fetch>""");

            assertEquals(Reason.UNRESOLVED_REFERENCE, e.reason());
            assertEquals("link-entity[acc]/filter", e.context());
        }

        @Test
        @DisplayName("Should reject an order on an undeclared alias")
        void shouldRejectUnknownOrderAlias() {
            GenerationException e = failure("""
                    <fetch><entity name="contact">
                      <attribute name="fullname" alias="name"/>
                      <order alias="fullname"/>
                    </entity></fetch>""");

            assertEquals(Reason.UNRESOLVED_REFERENCE, e.reason());
            assertEquals("entity[contact]/order", e.context());
        }

        @Test
        @DisplayName("Should reject paging combined with top")
        void shouldRejectPagingWithTop() {
            GenerationException e = failure("<fetch count=\"10\" page=\"2\"><entity name=\"contact\"/></fetch>");

            assertEquals(Reason.UNSUPPORTED_COMBINATION, e.reason());
            assertEquals("fetch", e.context());
        }

        @Test
        @DisplayName("Should reject aggregates combined with all-attributes")
        void shouldRejectAggregateWithAllAttributes() {
            GenerationException root = failure("""
                    <fetch aggregate="true"><entity name="opportunity">
                      <all-attributes/>
                      <attribute name="opportunityid" alias="n" aggregate="count"/>
                    </entity></fetch>""");
            GenerationException link = failure("""
                    <fetch aggregate="true"><entity name="opportunity">
                      <attribute name="opportunityid" alias="n" aggregate="count"/>
                      <link-entity name="account" from="accountid" to="customerid" alias="acc">
                        <all-attributes/>
                      </link-entity>
                    </entity></fetch>""");

            assertEquals(Reason.UNSUPPORTED_COMBINATION, root.reason());
            assertEquals("entity[opportunity]", root.context());
            assertEquals("link-entity[acc]", link.context());
        }

        @Test
        @DisplayName("Should reject plain columns in an aggregate query")
        void shouldRejectUngroupedColumn() {
            GenerationException e = failure("""
                    <fetch aggregate="true"><entity name="opportunity">
                      <attribute name="estimatedvalue" alias="revenue" aggregate="sum"/>
                      <attribute name="name"/>
                    </entity></fetch>""");

            assertEquals(Reason.UNSUPPORTED_COMBINATION, e.reason());
            assertTrue(e.getMessage().startsWith("Column 'name' must be aggregated or grouped"));
        }
    }
}
