package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.mssql.UsedIndex;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class UsedIndexExtractorTest {

    @Test
    public void shouldReadIndexKindFromObjectTags() {
        assertThat(UsedIndexExtractor.extract(ShowPlanFixtures.ORDERS_BY_CUSTOMER)).containsExactly(
                new UsedIndex("IX_Orders_Status", "NonClustered"),
                new UsedIndex("PK_Orders", "Clustered"));
    }

    @Test
    public void shouldInferKindFromIndexScanBlock() {
        // Given
        String xml = "<IndexScan Lookup=\"1\"><Object Table=\"[Orders]\" Index=\"[PK_Orders]\"/></IndexScan>"
                + "<IndexScan Ordered=\"1\"><Object Table=\"[Orders]\" Index=\"[IX_Orders_Date]\"/></IndexScan>";

        // When/Then
        assertThat(UsedIndexExtractor.extract(xml)).containsExactly(
                new UsedIndex("PK_Orders", "Lookup"),
                new UsedIndex("IX_Orders_Date", "NonClustered"));
    }

    @Test
    public void shouldDeduplicateByName() {
        // Given
        String xml = "<Object Index=\"[PK_Orders]\" IndexKind=\"Clustered\"/>"
                + "<IndexScan><Object Index=\"[PK_Orders]\"/></IndexScan>";

        // When/Then
        assertThat(UsedIndexExtractor.extract(xml)).containsExactly(new UsedIndex("PK_Orders", "Clustered"));
    }

    @Test
    public void shouldFallBackToSeekPredicateTable() {
        // Given
        String xml = """
                <SeekPredicates>
                  <SeekPredicateNew><SeekKeys><Prefix ScanType="EQ"><RangeColumns>
                    <ColumnReference Database="[Shop]" Schema="[dbo]" Table="[Customers]" Column="[Id]"/>
                  </RangeColumns></Prefix></SeekKeys></SeekPredicateNew>
                </SeekPredicates>
                """;

        // When/Then
        assertThat(UsedIndexExtractor.extract(xml)).containsExactly(new UsedIndex("Customers (Implicit)", "Unknown"));
    }

    @Test
    public void shouldNameClusteredScanAfterTableWhenIndexIsMissing() {
        // Given
        String xml = "<RelOp PhysicalOp=\"Clustered Index Scan\" LogicalOp=\"Clustered Index Scan\">"
                + "<Object Table=\"[Orders]\"/></RelOp>";

        // When/Then
        assertThat(UsedIndexExtractor.extract(xml)).containsExactly(new UsedIndex("PK_Orders", "Clustered"));
    }

    @Test
    public void shouldNotRunFallbacksWhenIndexesWereFound() {
        // Given
        String xml = "<Object Table=\"[Orders]\" Index=\"[IX_A]\" IndexKind=\"NonClustered\"/>"
                + "<SeekPredicates><ColumnReference Table=\"[Customers]\"/></SeekPredicates>";

        // When/Then
        assertThat(UsedIndexExtractor.extract(xml)).containsExactly(new UsedIndex("IX_A", "NonClustered"));
    }

    @Test
    public void shouldReturnNothingWithoutIndexes() {
        assertThat(UsedIndexExtractor.extract("<RelOp PhysicalOp=\"Constant Scan\"/>")).isEmpty();
    }
}
