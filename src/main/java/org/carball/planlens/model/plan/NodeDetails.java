package org.carball.planlens.model.plan;

/**
 * Marker for engine-specific data hanging off a {@link PlanNode}.
 */
public interface NodeDetails {

    PlanEngine engine();
}
