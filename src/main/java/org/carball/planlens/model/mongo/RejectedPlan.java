package org.carball.planlens.model.mongo;

import org.carball.planlens.model.plan.PlanNode;

import java.util.List;

/**
 * A candidate plan the query planner discarded, parsed independently of the winning plan.
 */
public record RejectedPlan(int index, List<PlanNode> nodes) {}
