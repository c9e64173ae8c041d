package org.carball.planlens.model.plan;

/**
 * Engine-specific cost of a plan node. Every engine exposes a cumulative
 * figure covering the node and everything beneath it.
 */
public interface PlanCost {

    double subtreeTotal();
}
