package org.carball.planlens.model.plan;

/**
 * Startup and total cost from {@code cost=start..end}.
 */
public record PostgresCost(double start, double end) implements PlanCost {

    @Override
    public double subtreeTotal() {
        return end;
    }
}
