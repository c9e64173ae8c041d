package org.carball.planlens.model.mssql;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Statement-level facts pulled from a ShowPlan document independently of the operator tree.
 */
@Value
@Builder(toBuilder = true)
public class StatementSummary {
    String statementType;
    String statementText;
    int degreeOfParallelism;
    String queryHash;
    String planHash;
    double estimatedRows;
    boolean retrievedFromCache;
    Integer cachedPlanSize;

    @Builder.Default
    ExecutionStats executionStats = ExecutionStats.empty();

    @Builder.Default
    List<PlanWarning> warnings = List.of();

    @Builder.Default
    List<MissingIndexRecommendation> missingIndexes = List.of();

    @Builder.Default
    List<UsedIndex> usedIndexes = List.of();

    public static StatementSummary empty() {
        return StatementSummary.builder().build();
    }

    public boolean hasWarning(WarningType type) {
        return warnings.stream().anyMatch(w -> w.type() == type);
    }
}
