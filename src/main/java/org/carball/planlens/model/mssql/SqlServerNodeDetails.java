package org.carball.planlens.model.mssql;

import lombok.Builder;
import lombok.Value;
import org.carball.planlens.model.plan.NodeDetails;
import org.carball.planlens.model.plan.PlanEngine;

/**
 * RelOp attributes that only ShowPlan XML carries.
 */
@Value
@Builder
public class SqlServerNodeDetails implements NodeDetails {
    String indexKind;
    Integer avgRowSize;
    Boolean ordered;
    Boolean parallel;
    String scanDirection;
    String extractionTier;

    @Override
    public PlanEngine engine() {
        return PlanEngine.SQL_SERVER;
    }
}
