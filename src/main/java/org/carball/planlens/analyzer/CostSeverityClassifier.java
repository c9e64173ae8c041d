package org.carball.planlens.analyzer;

import org.carball.planlens.config.AnalyzerThresholds;
import org.carball.planlens.model.diagnostic.CostSeverity;

/**
 * Buckets an operator's cost relative to the most expensive subtree of its
 * plan. Cheap plans and cheap operators are capped at MEDIUM so a trivially
 * fast operation is not reported as critical just because it dominates.
 */
public class CostSeverityClassifier {

    private final AnalyzerThresholds thresholds;

    public CostSeverityClassifier(AnalyzerThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public CostSeverity classify(double cost, double maxCost) {
        if (maxCost <= 0 || cost <= 0) {
            return CostSeverity.LOW;
        }
        double ratio = cost / maxCost;

        if (maxCost < thresholds.getLowAbsoluteCost() || cost < thresholds.getLowAbsoluteCost()) {
            return ratio > thresholds.getHighCostRatio() ? CostSeverity.MEDIUM : CostSeverity.LOW;
        }
        if (ratio > thresholds.getHighCostRatio()) {
            return CostSeverity.HIGH;
        }
        if (ratio > thresholds.getMediumCostRatio()) {
            return CostSeverity.MEDIUM;
        }
        return CostSeverity.LOW;
    }
}
