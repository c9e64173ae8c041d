package org.carball.planlens.model;

import lombok.Builder;
import lombok.Value;
import org.carball.planlens.model.deadlock.DeadlockGraph;
import org.carball.planlens.model.diagnostic.Diagnostic;
import org.carball.planlens.model.diagnostic.Severity;
import org.carball.planlens.model.mssql.MissingIndexRecommendation;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanParseResult;

import java.util.List;

/**
 * Everything one payload yields: either a plan or a deadlock graph, the
 * diagnostics list and the missing index recommendations with their scripts.
 */
@Value
@Builder
public class InspectionResult {

    PayloadKind payloadKind;
    ParseOutcome outcome;
    PlanParseResult plan;
    DeadlockGraph deadlock;

    @Builder.Default
    List<Diagnostic> diagnostics = List.of();

    @Builder.Default
    List<MissingIndexRecommendation> missingIndexes = List.of();

    public long countBySeverity(Severity severity) {
        return diagnostics.stream()
                .filter(d -> d.severity() == severity)
                .count();
    }
}
