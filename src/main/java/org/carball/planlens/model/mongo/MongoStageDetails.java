package org.carball.planlens.model.mongo;

import lombok.Builder;
import lombok.Value;
import org.carball.planlens.model.plan.NodeDetails;
import org.carball.planlens.model.plan.PlanEngine;

@Value
@Builder
public class MongoStageDetails implements NodeDetails {
    String direction;
    String keyPattern;
    Boolean multiKey;
    Long limitAmount;
    MongoStageExecution execution;

    @Override
    public PlanEngine engine() {
        return PlanEngine.MONGODB;
    }
}
