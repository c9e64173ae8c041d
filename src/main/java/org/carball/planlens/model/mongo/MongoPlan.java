package org.carball.planlens.model.mongo;

import lombok.Builder;
import lombok.Value;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanEngine;
import org.carball.planlens.model.plan.PlanNode;
import org.carball.planlens.model.plan.PlanParseResult;

import java.util.List;

@Value
@Builder
public class MongoPlan implements PlanParseResult {

    ParseOutcome outcome;

    @Builder.Default
    String namespace = "";

    /** Winning plan stages. */
    @Builder.Default
    List<PlanNode> nodes = List.of();

    @Builder.Default
    List<RejectedPlan> rejectedPlans = List.of();

    @Builder.Default
    MongoExecutionSummary executionSummary = MongoExecutionSummary.empty();

    @Builder.Default
    MongoServerInfo serverInfo = MongoServerInfo.empty();

    @Override
    public PlanEngine getEngine() {
        return PlanEngine.MONGODB;
    }

    public static MongoPlan unrecognized() {
        return MongoPlan.builder()
                .outcome(ParseOutcome.UNRECOGNIZED)
                .build();
    }
}
