package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.mssql.SqlServerNodeDetails;
import org.carball.planlens.model.plan.PlanNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class RelOpExtractionStrategyTest {

    private static final String PARTIAL_PLAN = """
            <StmtSimple StatementEstRows="7">
              <RelOp PhysicalOp="Hash Match" LogicalOp="Inner Join" EstimateRows="7" EstimateCPU="0.1"
                     EstimateIO="0" EstimatedTotalSubtreeCost="1.2">
                <RelOp PhysicalOp="Compute Scalar" LogicalOp="Compute Scalar">
                  <RelOp PhysicalOp="Table Scan" LogicalOp="Table Scan" EstimateRows="7" EstimateCPU="0.01"
                         EstimateIO="0.2" EstimatedTotalSubtreeCost="0.21">
                    <TableScan><Object Table="[Customers]"/></TableScan>
                  </RelOp>
                </RelOp>
              </RelOp>
            </StmtSimple>
            """;

    @Test
    public void shouldSkipIncompleteRelOpsAndAttachToNearestKeptAncestor() {
        // When
        ExtractionOutcome outcome = new FullAttributeStrategy().extract(ShowPlanContext.of(PARTIAL_PLAN));

        // Then
        assertThat(outcome.isMatched()).isTrue();
        List<PlanNode> nodes = outcome.getNodes();
        assertThat(nodes).extracting(PlanNode::getPhysicalOp).containsExactly("Hash Match", "Table Scan");
        assertThat(nodes.get(1).getParentId()).isEqualTo(0);
        assertThat(nodes.get(0).getChildren()).containsExactly(1);
        assertThat(nodes.get(1).getObjectName()).isEqualTo("Customers");
    }

    @Test
    public void shouldKeepEveryNamedRelOpInReducedTier() {
        // When
        ExtractionOutcome outcome = new ReducedAttributeStrategy().extract(ShowPlanContext.of(PARTIAL_PLAN));

        // Then
        List<PlanNode> nodes = outcome.getNodes();
        assertThat(nodes).hasSize(3);
        assertThat(nodes.get(1).getEstimatedRows()).isEqualTo(7.0);
        assertThat(nodes.get(1).getParentId()).isEqualTo(0);
        assertThat(nodes.get(2).getParentId()).isEqualTo(1);
        assertThat(((SqlServerNodeDetails) nodes.get(1).getDetails()).getExtractionTier())
                .isEqualTo(ReducedAttributeStrategy.NAME);
    }

    @Test
    public void shouldReportNoMatchWithoutRelOps() {
        // Given
        ShowPlanContext context = ShowPlanContext.of("<StmtSimple StatementType=\"SELECT\"/>");

        // When/Then
        assertThat(new FullAttributeStrategy().extract(context).isMatched()).isFalse();
        assertThat(new ReducedAttributeStrategy().extract(context).isMatched()).isFalse();
        assertThat(new OperatorNameSweepStrategy().extract(context).isMatched()).isFalse();
        assertThat(new ClusteredIndexScanStrategy().extract(context)).isSameAs(ExtractionOutcome.noMatch());
    }

    @Test
    public void shouldReadObjectForClusteredScanFallback() {
        // Given
        ShowPlanContext context = ShowPlanContext.of(
                "Clustered Index Scan <Object Table=\"[Orders]\" Index=\"[PK_Orders]\"/> EstimatedTotalSubtreeCost=\"3.5\"");

        // When
        ExtractionOutcome outcome = new ClusteredIndexScanStrategy().extract(context);

        // Then
        PlanNode node = outcome.getNodes().get(0);
        assertThat(node.getObjectName()).isEqualTo("Orders");
        assertThat(node.getIndexName()).isEqualTo("PK_Orders");
        assertThat(node.getSubtreeCost()).isEqualTo(3.5);
        assertThat(((SqlServerNodeDetails) node.getDetails()).getIndexKind()).isEqualTo("Clustered");
    }

    @Test
    public void shouldTrackNestingAcrossSelfClosingTags() {
        // Given
        String xml = "<RelOp PhysicalOp=\"A\"><RelOp PhysicalOp=\"B\"/><RelOp PhysicalOp=\"C\"></RelOp></RelOp>"
                + "<RelOp PhysicalOp=\"D\"></RelOp>";

        // When
        List<RelOpSegment> segments = RelOpScanner.scan(xml);

        // Then
        assertThat(segments).extracting(RelOpSegment::parentIndex).containsExactly(-1, 0, 0, -1);
    }

    @Test
    public void shouldKeepFilterPredicateWrittenAfterItsChild() {
        // Given
        String xml = """
                <RelOp NodeId="0" PhysicalOp="Filter" LogicalOp="Filter" EstimateRows="5" EstimateIO="0"
                       EstimateCPU="0.001" EstimatedTotalSubtreeCost="0.4">
                  <Filter StartupExpression="0">
                    <RelOp NodeId="1" PhysicalOp="Table Scan" LogicalOp="Table Scan" EstimateRows="50" EstimateIO="0.3"
                           EstimateCPU="0.1" EstimatedTotalSubtreeCost="0.399">
                      <TableScan><Object Table="[Orders]"/></TableScan>
                    </RelOp>
                    <Predicate>
                      <ScalarOperator ScalarString="[Shop].[dbo].[Orders].[Total]&gt;(100)"/>
                    </Predicate>
                  </Filter>
                </RelOp>
                """;

        // When
        List<RelOpSegment> segments = RelOpScanner.scan(xml);
        ExtractionOutcome outcome = new FullAttributeStrategy().extract(ShowPlanContext.of(xml));

        // Then
        assertThat(segments.get(0).body()).contains("<Predicate>").contains("<Filter StartupExpression=\"0\">");
        assertThat(segments.get(1).body()).doesNotContain("<Predicate>");
        PlanNode filter = outcome.getNodes().stream()
                .filter(node -> "Filter".equals(node.getPhysicalOp()))
                .findFirst()
                .orElseThrow();
        assertThat(filter.getPredicate()).isEqualTo("[Shop].[dbo].[Orders].[Total]>(100)");
        assertThat(filter.getObjectName()).isNull();
    }
}
