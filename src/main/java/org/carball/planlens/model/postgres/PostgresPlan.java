package org.carball.planlens.model.postgres;

import lombok.Builder;
import lombok.Value;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanEngine;
import org.carball.planlens.model.plan.PlanNode;
import org.carball.planlens.model.plan.PlanParseResult;

import java.util.List;

@Value
@Builder
public class PostgresPlan implements PlanParseResult {

    ParseOutcome outcome;

    @Builder.Default
    List<PlanNode> nodes = List.of();

    /** Sorted by descending time. */
    @Builder.Default
    List<QueryTiming> timings = List.of();

    Double planningTimeMs;
    Double executionTimeMs;

    @Override
    public PlanEngine getEngine() {
        return PlanEngine.POSTGRES;
    }

    public static PostgresPlan unrecognized() {
        return PostgresPlan.builder()
                .outcome(ParseOutcome.UNRECOGNIZED)
                .build();
    }
}
