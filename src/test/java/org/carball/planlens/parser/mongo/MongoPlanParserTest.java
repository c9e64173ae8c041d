package org.carball.planlens.parser.mongo;

import org.carball.planlens.model.mongo.MongoPlan;
import org.carball.planlens.model.mongo.MongoStageDetails;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class MongoPlanParserTest {

    private static final String EXPLAIN = """
            {
              "queryPlanner": {
                "namespace": "shop.orders",
                "winningPlan": {
                  "stage": "FETCH",
                  "filter": {"status": {"$eq": "open"}},
                  "inputStage": {
                    "stage": "IXSCAN",
                    "indexName": "customerId_1",
                    "keyPattern": {"customerId": 1},
                    "direction": "forward",
                    "isMultiKey": false
                  }
                },
                "rejectedPlans": [
                  {"stage": "COLLSCAN", "direction": "forward"}
                ]
              },
              "executionStats": {
                "executionSuccess": true,
                "nReturned": 12,
                "executionTimeMillis": 3,
                "totalKeysExamined": 40,
                "totalDocsExamined": 40,
                "executionStages": {
                  "stage": "FETCH",
                  "nReturned": 12,
                  "executionTimeMillisEstimate": 1,
                  "works": 41,
                  "advanced": 12,
                  "docsExamined": 40,
                  "inputStage": {
                    "stage": "IXSCAN",
                    "indexName": "customerId_1",
                    "nReturned": 40,
                    "works": 41,
                    "advanced": 40,
                    "keysExamined": 40
                  }
                }
              },
              "serverInfo": {"host": "db-1", "port": 27017, "version": "6.0.5"}
            }
            """;

    private MongoPlanParser parser;

    @BeforeEach
    void setUp() {
        parser = new MongoPlanParser();
    }

    @Test
    public void shouldBuildStageTreeFromInputStages() {
        // When
        MongoPlan plan = parser.parse(EXPLAIN);

        // Then
        assertThat(plan.getOutcome()).isEqualTo(ParseOutcome.PARSED);
        assertThat(plan.getNamespace()).isEqualTo("shop.orders");
        assertThat(plan.getNodes()).extracting(PlanNode::getPhysicalOp).containsExactly("FETCH", "IXSCAN");

        PlanNode fetch = plan.getNodes().get(0);
        PlanNode ixscan = plan.getNodes().get(1);
        assertThat(fetch.isRoot()).isTrue();
        assertThat(fetch.getChildren()).containsExactly(1);
        assertThat(ixscan.getParentId()).isEqualTo(0);
        assertThat(ixscan.getIndexName()).isEqualTo("customerId_1");
        assertThat(fetch.getPredicate()).isEqualTo("{\"status\":{\"$eq\":\"open\"}}");

        MongoStageDetails details = (MongoStageDetails) ixscan.getDetails();
        assertThat(details.getKeyPattern()).isEqualTo("{\"customerId\":1}");
        assertThat(details.getDirection()).isEqualTo("forward");
        assertThat(details.getMultiKey()).isFalse();
    }

    @Test
    public void shouldMatchExecutionCountersToStages() {
        // When
        MongoPlan plan = parser.parse(EXPLAIN);

        // Then
        MongoStageDetails fetch = (MongoStageDetails) plan.getNodes().get(0).getDetails();
        MongoStageDetails ixscan = (MongoStageDetails) plan.getNodes().get(1).getDetails();
        assertThat(fetch.getExecution().docsExamined()).isEqualTo(40);
        assertThat(fetch.getExecution().nReturned()).isEqualTo(12);
        assertThat(ixscan.getExecution().keysExamined()).isEqualTo(40);
        assertThat(plan.getNodes().get(0).getActualRows()).isEqualTo(12.0);
    }

    @Test
    public void shouldReadSummaryServerInfoAndRejectedPlans() {
        // When
        MongoPlan plan = parser.parse(EXPLAIN);

        // Then
        assertThat(plan.getExecutionSummary().executionSuccess()).isTrue();
        assertThat(plan.getExecutionSummary().totalDocsExamined()).isEqualTo(40);
        assertThat(plan.getServerInfo().host()).isEqualTo("db-1");
        assertThat(plan.getServerInfo().port()).isEqualTo(27017);
        assertThat(plan.getRejectedPlans()).hasSize(1);
        assertThat(plan.getRejectedPlans().get(0).nodes().get(0).getPhysicalOp()).isEqualTo("COLLSCAN");
        assertThat(plan.getRejectedPlans().get(0).nodes().get(0).getId()).isZero();
    }

    @Test
    public void shouldReadMarkdownSections() {
        // Given
        String markdown = """
                ## Query Planner
                ```json
                {"namespace": "shop.users", "winningPlan": {"stage": "COLLSCAN", "direction": "forward"}}
                ```

                ## Execution Stats
                ```json
                {"nReturned": 1, "totalDocsExamined": 5000, "executionStages": {"stage": "COLLSCAN", "nReturned": 1, "docsExamined": 5000}}
                ```

                ## Server Info
                {"host": "localhost", "port": 27017, "version": "7.0.2"}
                """;

        // When
        MongoPlan plan = parser.parse(markdown);

        // Then
        assertThat(plan.getOutcome()).isEqualTo(ParseOutcome.PARSED);
        assertThat(plan.getNamespace()).isEqualTo("shop.users");
        assertThat(plan.getNodes()).hasSize(1);
        assertThat(plan.getNodes().get(0).getActualRows()).isEqualTo(1.0);
        assertThat(plan.getServerInfo().version()).isEqualTo("7.0.2");
    }

    @Test
    public void shouldAcceptBareWinningPlanStage() {
        // When
        MongoPlan plan = parser.parse("{\"stage\": \"SORT\", \"inputStage\": {\"stage\": \"COLLSCAN\"}}");

        // Then
        assertThat(plan.getNodes()).extracting(PlanNode::getPhysicalOp).containsExactly("SORT", "COLLSCAN");
    }

    @Test
    public void shouldUnwrapSlotBasedQueryPlan() {
        // When
        MongoPlan plan = parser.parse(
                "{\"queryPlanner\": {\"winningPlan\": {\"queryPlan\": {\"stage\": \"IXSCAN\", \"indexName\": \"a_1\"}}}}");

        // Then
        assertThat(plan.getNodes()).hasSize(1);
        assertThat(plan.getNodes().get(0).getIndexName()).isEqualTo("a_1");
    }

    @Test
    public void shouldReportEmptyWithUnknownRootWhenPlannerHasNoWinningPlan() {
        // When
        MongoPlan plan = parser.parse("{\"queryPlanner\": {\"namespace\": \"a.b\"}}");

        // Then
        assertThat(plan.getOutcome()).isEqualTo(ParseOutcome.EMPTY);
        assertThat(plan.getNamespace()).isEqualTo("a.b");
        assertThat(plan.getNodes()).singleElement().satisfies(node -> {
            assertThat(node.getPhysicalOp()).isEqualTo("UNKNOWN");
            assertThat(node.getParentId()).isEqualTo(PlanNode.NO_PARENT);
            assertThat(node.getChildren()).isEmpty();
        });
    }

    @Test
    public void shouldReportUnrecognizedForInvalidInput() {
        assertThat(parser.parse("{not json").getOutcome()).isEqualTo(ParseOutcome.UNRECOGNIZED);
        assertThat(parser.parse("{\"hello\": 1}").getOutcome()).isEqualTo(ParseOutcome.UNRECOGNIZED);
        assertThat(parser.parse(null).getOutcome()).isEqualTo(ParseOutcome.UNRECOGNIZED);
    }
}
