package org.carball.planlens.model.mssql;

import lombok.Builder;
import lombok.Value;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanEngine;
import org.carball.planlens.model.plan.PlanNode;
import org.carball.planlens.model.plan.PlanParseResult;

import java.util.List;

@Value
@Builder
public class SqlServerPlan implements PlanParseResult {

    ParseOutcome outcome;

    @Builder.Default
    List<PlanNode> nodes = List.of();

    /** Name of the RelOp extraction tier that produced the nodes, or null when none matched. */
    String extractionTier;

    double statementEstRows;

    @Builder.Default
    StatementSummary summary = StatementSummary.empty();

    /** Set when the plan looks like a placeholder or a plan for a different statement. */
    String genericPlanReason;

    @Override
    public PlanEngine getEngine() {
        return PlanEngine.SQL_SERVER;
    }

    public static SqlServerPlan unrecognized() {
        return SqlServerPlan.builder()
                .outcome(ParseOutcome.UNRECOGNIZED)
                .build();
    }
}
