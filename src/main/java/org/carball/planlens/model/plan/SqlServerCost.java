package org.carball.planlens.model.plan;

/**
 * ShowPlan estimates. {@code subtreeTotal} is taken from EstimatedTotalSubtreeCost
 * as-is. {@code nodeCost} is CPU plus IO when both were read from the operator,
 * otherwise the subtree total.
 */
public record SqlServerCost(double cpu, double io, double subtreeTotal, double nodeCost) implements PlanCost {

    public static final double PLACEHOLDER_COST = 0.01;

    public static SqlServerCost fromEstimates(double cpu, double io, double subtreeTotal) {
        return new SqlServerCost(cpu, io, subtreeTotal, cpu + io);
    }

    public static SqlServerCost subtreeOnly(double subtreeTotal) {
        return new SqlServerCost(0, 0, subtreeTotal, subtreeTotal);
    }

    public static SqlServerCost placeholder() {
        return subtreeOnly(PLACEHOLDER_COST);
    }
}
