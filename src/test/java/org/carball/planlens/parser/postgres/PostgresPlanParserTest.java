package org.carball.planlens.parser.postgres;

import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanNode;
import org.carball.planlens.model.plan.PostgresCost;
import org.carball.planlens.model.postgres.BufferStats;
import org.carball.planlens.model.postgres.PostgresNodeDetails;
import org.carball.planlens.model.postgres.PostgresPlan;
import org.carball.planlens.model.postgres.QueryTiming;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PostgresPlanParserTest {

    private static final String HASH_JOIN_PLAN = """
            Hash Join  (cost=1.09..2.19 rows=4 width=16) (actual time=0.030..0.040 rows=4 loops=1)
              Hash Cond: (o.customer_id = c.id)
              Buffers: shared hit=2
              ->  Seq Scan on orders o  (cost=0.00..1.04 rows=4 width=12) (actual time=0.005..0.007 rows=4 loops=1)
                    Buffers: shared hit=1
              ->  Hash  (cost=1.04..1.04 rows=4 width=8) (actual time=0.010..0.011 rows=4 loops=1)
                    Buckets: 1024  Batches: 1  Memory Usage: 9kB
                    ->  Seq Scan on customers c  (cost=0.00..1.04 rows=4 width=8) (actual time=0.003..0.004 rows=4 loops=1)
            Planning Time: 0.150 ms
            Execution Time: 0.050 ms
            """;

    private PostgresPlanParser parser;

    @BeforeEach
    void setUp() {
        parser = new PostgresPlanParser();
    }

    @Test
    public void shouldAttachSiblingsToTheSameParent() {
        // When
        PostgresPlan plan = parser.parse(HASH_JOIN_PLAN);

        // Then
        assertThat(plan.getOutcome()).isEqualTo(ParseOutcome.PARSED);
        assertThat(plan.getNodes()).hasSize(4);
        assertThat(plan.getRoots()).hasSize(1);

        PlanNode root = plan.getRoots().get(0);
        assertThat(root.getPhysicalOp()).isEqualTo("Hash Join");
        assertThat(root.getChildren()).containsExactly(1, 2);
        assertThat(plan.getNodes().get(1).getParentId()).isEqualTo(root.getId());
        assertThat(plan.getNodes().get(2).getParentId()).isEqualTo(root.getId());
        assertThat(plan.getNodes().get(3).getParentId()).isEqualTo(2);
    }

    @Test
    public void shouldReadCostsRowsAndRelation() {
        // When
        PostgresPlan plan = parser.parse(HASH_JOIN_PLAN);

        // Then
        PlanNode scan = plan.getNodes().get(1);
        assertThat(scan.getPhysicalOp()).isEqualTo("Seq Scan");
        assertThat(scan.getLogicalOp()).isEqualTo("Seq Scan on orders o");
        assertThat(scan.getObjectName()).isEqualTo("orders");
        assertThat(scan.getCost()).isEqualTo(new PostgresCost(0.00, 1.04));
        assertThat(scan.getEstimatedRows()).isEqualTo(4.0);
        assertThat(scan.getActualRows()).isEqualTo(4.0);

        PostgresNodeDetails details = (PostgresNodeDetails) scan.getDetails();
        assertThat(details.getWidth()).isEqualTo(12);
        assertThat(details.getLoops()).isEqualTo(1);
        assertThat(details.getActualTime().end()).isEqualTo(0.007);
    }

    @Test
    public void shouldAttachDetailLinesToTheirOperator() {
        // When
        PostgresPlan plan = parser.parse(HASH_JOIN_PLAN);

        // Then
        PlanNode root = plan.getNodes().get(0);
        assertThat(root.getPredicate()).isEqualTo("(o.customer_id = c.id)");

        PostgresNodeDetails details = (PostgresNodeDetails) root.getDetails();
        assertThat(details.getDetailLines()).containsExactly(
                "Hash Cond: (o.customer_id = c.id)", "Buffers: shared hit=2");
        assertThat(details.getBuffers().sharedHit()).isEqualTo(2);

        PostgresNodeDetails hash = (PostgresNodeDetails) plan.getNodes().get(2).getDetails();
        assertThat(hash.hasDetailStartingWith("Buckets:")).isTrue();
    }

    @Test
    public void shouldComputeTimingPercentagesSortedDescending() {
        // When
        PostgresPlan plan = parser.parse(HASH_JOIN_PLAN);

        // Then
        assertThat(plan.getPlanningTimeMs()).isEqualTo(0.150);
        assertThat(plan.getExecutionTimeMs()).isEqualTo(0.050);
        assertThat(plan.getTimings()).extracting(QueryTiming::name).containsExactly("Planning", "Execution");
        assertThat(plan.getTimings().get(0).percentage()).isCloseTo(75.0, within(0.001));
        assertThat(plan.getTimings().get(1).percentage()).isCloseTo(25.0, within(0.001));
    }

    @Test
    public void shouldCollectTriggerTimings() {
        // Given
        String text = """
                Insert on orders  (cost=0.00..0.01 rows=0 width=0) (actual time=0.050..0.050 rows=0 loops=1)
                  ->  Result  (cost=0.00..0.01 rows=1 width=16) (actual time=0.001..0.001 rows=1 loops=1)
                Planning Time: 0.020 ms
                Trigger for constraint orders_customer_fk: time=0.300 calls=1
                Execution Time: 0.080 ms
                """;

        // When
        PostgresPlan plan = parser.parse(text);

        // Then
        assertThat(plan.getNodes()).hasSize(2);
        assertThat(plan.getTimings().get(0).name()).isEqualTo("Trigger for constraint orders_customer_fk");
        assertThat(plan.getTimings().get(0).calls()).isEqualTo(1);
    }

    @Test
    public void shouldReadIndexScanWithoutTiming() {
        // Given
        String text = "Index Scan using orders_pkey on orders  (cost=0.29..8.30 rows=1 width=12) (actual rows=1 loops=3)";

        // When
        PostgresPlan plan = parser.parse(text);

        // Then
        PlanNode node = plan.getNodes().get(0);
        assertThat(node.getPhysicalOp()).isEqualTo("Index Scan");
        assertThat(node.getIndexName()).isEqualTo("orders_pkey");
        assertThat(node.getObjectName()).isEqualTo("orders");
        assertThat(node.getActualRows()).isEqualTo(1.0);
        assertThat(((PostgresNodeDetails) node.getDetails()).getLoops()).isEqualTo(3);
    }

    @Test
    public void shouldLeaveActualRowsEmptyForNeverExecutedNodes() {
        // Given
        String text = """
                Nested Loop  (cost=0.00..2.00 rows=1 width=8) (actual time=0.010..0.010 rows=0 loops=1)
                  ->  Seq Scan on a  (cost=0.00..1.00 rows=1 width=4) (actual time=0.005..0.005 rows=0 loops=1)
                  ->  Seq Scan on b  (cost=0.00..1.00 rows=1 width=4) (never executed)
                """;

        // When
        PostgresPlan plan = parser.parse(text);

        // Then
        PlanNode skipped = plan.getNodes().get(2);
        assertThat(skipped.getActualRows()).isNull();
        assertThat(((PostgresNodeDetails) skipped.getDetails()).isNeverExecuted()).isTrue();
        assertThat(plan.getRoots().get(0).getChildren()).containsExactly(1, 2);
    }

    @Test
    public void shouldParseBufferCounters() {
        // When
        BufferStats stats = PostgresPlanParser.parseBuffers(
                "Buffers: shared hit=10 read=5 dirtied=1 written=2, temp read=3 written=4");

        // Then
        assertThat(stats).isEqualTo(new BufferStats(10, 5, 1, 2, 3, 4));
        assertThat(stats.usesTemp()).isTrue();
    }

    @Test
    public void shouldNotMistakeDetailLinesForOperators() {
        assertThat(PostgresPlanParser.isOperationLine("Sort Key: o.created_at DESC")).isFalse();
        assertThat(PostgresPlanParser.isOperationLine("Hash Cond: (a.id = b.id)")).isFalse();
        assertThat(PostgresPlanParser.isOperationLine("->  Sort  (cost=1.00..1.10 rows=4 width=8)")).isTrue();
        assertThat(PostgresPlanParser.isOperationLine("Parallel Seq Scan on big")).isTrue();
    }

    @Test
    public void shouldReportEmptyWhenOnlyTimingsArePresent() {
        // When
        PostgresPlan plan = parser.parse("Planning Time: 0.010 ms\nExecution Time: 0.020 ms");

        // Then
        assertThat(plan.getOutcome()).isEqualTo(ParseOutcome.EMPTY);
        assertThat(plan.getNodes()).isEmpty();
    }

    @Test
    public void shouldReportUnrecognizedForUnrelatedText() {
        assertThat(parser.parse("hello world").getOutcome()).isEqualTo(ParseOutcome.UNRECOGNIZED);
        assertThat(parser.parse("").getOutcome()).isEqualTo(ParseOutcome.UNRECOGNIZED);
    }

    @Test
    public void shouldProduceEqualResultsForRepeatedParses() {
        assertThat(parser.parse(HASH_JOIN_PLAN)).isEqualTo(parser.parse(HASH_JOIN_PLAN));
    }
}
