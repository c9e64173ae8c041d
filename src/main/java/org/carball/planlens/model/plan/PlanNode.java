package org.carball.planlens.model.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Engine-agnostic execution plan operator. Ids are unique within one parse
 * result and assigned in extraction order; {@code children} holds ids of nodes
 * owned exclusively by this node.
 */
@Value
@Builder(toBuilder = true)
public class PlanNode {

    public static final int NO_PARENT = -1;

    int id;

    @Builder.Default
    int parentId = NO_PARENT;

    String physicalOp;
    String logicalOp;
    Double estimatedRows;
    Double actualRows;
    PlanCost cost;
    String objectName;
    String indexName;
    String predicate;

    @Singular
    List<Integer> children;

    NodeDetails details;

    @JsonIgnore
    public boolean isRoot() {
        return parentId == NO_PARENT;
    }

    /**
     * Actual over estimated rows, or {@code null} when either side is missing
     * or the estimate is not positive.
     */
    public Double getRowMismatchRatio() {
        if (actualRows == null || estimatedRows == null || estimatedRows <= 0) {
            return null;
        }
        return actualRows / estimatedRows;
    }

    @JsonIgnore
    public double getSubtreeCost() {
        return cost != null ? cost.subtreeTotal() : 0.0;
    }

    /**
     * Operator name to show: physical op, falling back to the logical op.
     */
    @JsonIgnore
    public String getDisplayName() {
        if (physicalOp != null && !physicalOp.isEmpty()) {
            return physicalOp;
        }
        return logicalOp != null ? logicalOp : "UNKNOWN";
    }
}
