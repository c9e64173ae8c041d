package org.carball.planlens.ddl;

import org.carball.planlens.model.mssql.MissingIndexRecommendation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class IndexScriptGeneratorTest {

    private IndexScriptGenerator generator;
    private MissingIndexRecommendation ordersByCustomer;

    @BeforeEach
    void setUp() {
        generator = new IndexScriptGenerator();
        ordersByCustomer = MissingIndexRecommendation.builder()
                .database("Shop")
                .schema("dbo")
                .table("Orders")
                .impact(87.5)
                .equalityColumns(List.of("CustomerID"))
                .includedColumns(List.of("OrderDate"))
                .build();
    }

    @Test
    public void shouldGenerateCreateIndexWithIncludeClause() {
        // When
        String script = generator.generate(ordersByCustomer);

        // Then
        assertThat(script).startsWith("-- Missing Index Script (Impact: 87.5%)\n");
        assertThat(script).contains("USE [Shop];\nGO\n");
        assertThat(script).contains("CREATE NONCLUSTERED INDEX [IX_Orders_CustomerID]\nON [dbo].[Orders] (\n"
                + "    [CustomerID] ASC\n)");
        assertThat(script).contains("INCLUDE (\n    [OrderDate]\n)");
        assertThat(script).contains("ONLINE = OFF");
        assertThat(script).contains("WHERE s.name = 'dbo' AND o.name = 'Orders' AND i.name = 'IX_Orders_CustomerID';");
    }

    @Test
    public void shouldOrderEqualityBeforeInequalityColumns() {
        // Given
        MissingIndexRecommendation rec = ordersByCustomer.toBuilder()
                .inequalityColumns(List.of("OrderDate"))
                .includedColumns(List.of())
                .build();

        // When
        String script = generator.generate(rec);

        // Then
        assertThat(script).contains("[IX_Orders_CustomerID_OrderDate]");
        assertThat(script).contains("    [CustomerID] ASC,\n    [OrderDate] ASC\n)");
        assertThat(script).doesNotContain("INCLUDE");
    }

    @Test
    public void shouldDefaultSchemaAndSkipUseWithoutDatabase() {
        // Given
        MissingIndexRecommendation rec = MissingIndexRecommendation.builder()
                .table("[Invoices]")
                .impact(40.0)
                .equalityColumns(List.of("[DueDate]"))
                .build();

        // When
        String script = generator.generate(rec);

        // Then
        assertThat(script).doesNotContain("USE [");
        assertThat(script).contains("ON [dbo].[Invoices] (");
        assertThat(script).contains("[IX_Invoices_DueDate]");
    }

    @Test
    public void shouldReturnCommentForRecommendationWithoutKeyColumns() {
        // Given
        MissingIndexRecommendation rec = ordersByCustomer.toBuilder()
                .equalityColumns(List.of())
                .build();

        // When/Then
        assertThat(generator.generate(rec)).isEqualTo(IndexScriptTemplate.NO_KEY_COLUMNS);
    }

    @Test
    public void shouldReturnCommentForRecommendationWithoutTable() {
        // Given
        MissingIndexRecommendation rec = ordersByCustomer.toBuilder()
                .table(null)
                .build();

        // When/Then
        assertThat(generator.generate(rec)).isEqualTo(IndexScriptTemplate.NO_TABLE);
        assertThat(generator.withScript(rec).getDdlScript()).isEqualTo(IndexScriptTemplate.NO_TABLE);
        assertThat(rec.getQualifiedTable()).isEqualTo("dbo.(unknown table)");
    }

    @Test
    public void shouldTruncateLongIndexNames() {
        // Given
        IndexScriptGenerator shortNames = new IndexScriptGenerator(16);

        // When/Then
        assertThat(shortNames.indexName("Orders", List.of("CustomerID"))).isEqualTo("IX_Orders_Custom");
        assertThat(generator.indexName("Orders(Archive)", List.of("A", "B"))).isEqualTo("IX_OrdersArchive_A_B");
    }

    @Test
    public void shouldEscapeQuotesInVerificationQuery() {
        // Given
        MissingIndexRecommendation rec = ordersByCustomer.toBuilder().table("O'Brien").build();

        // When/Then
        assertThat(generator.generate(rec)).contains("o.name = 'O''Brien'");
    }

    @Test
    public void shouldAttachScriptsWithoutTouchingInput() {
        // When
        List<MissingIndexRecommendation> scripted = generator.withScripts(List.of(ordersByCustomer));

        // Then
        assertThat(scripted).hasSize(1);
        assertThat(scripted.get(0).getDdlScript()).isEqualTo(generator.generate(ordersByCustomer));
        assertThat(scripted.get(0).getTable()).isEqualTo("Orders");
        assertThat(ordersByCustomer.getDdlScript()).isNull();
    }
}
