package org.carball.planlens.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

@Data
@Builder(toBuilder = true)
@Slf4j
public class AnalyzerThresholds {

    // Cost severity, as fractions of the most expensive subtree
    @Builder.Default
    private double highCostRatio = 0.3;

    @Builder.Default
    private double mediumCostRatio = 0.1;

    // Costs below this are never HIGH
    @Builder.Default
    private double lowAbsoluteCost = 0.1;

    // Row estimation bands (actual/estimated, applied symmetrically)
    @Builder.Default
    private double severeRowRatio = 100.0;

    @Builder.Default
    private double significantRowRatio = 10.0;

    // PostgreSQL
    @Builder.Default
    private long seqScanRowThreshold = 1000;

    // MongoDB
    @Builder.Default
    private double docsExaminedRatioThreshold = 10.0;

    // DDL
    @Builder.Default
    private int indexNameMaxLength = 128;

    public static AnalyzerThresholds defaults() {
        return AnalyzerThresholds.builder().build();
    }

    /**
     * Logs warnings for inconsistent values. Never rejects a configuration.
     */
    public void validate() {
        if (highCostRatio <= mediumCostRatio) {
            log.warn("High cost ratio ({}) should be greater than medium cost ratio ({})",
                    highCostRatio, mediumCostRatio);
        }

        if (highCostRatio > 1.0 || mediumCostRatio <= 0) {
            log.warn("Cost ratios should lie in (0, 1]: high={}, medium={}", highCostRatio, mediumCostRatio);
        }

        if (severeRowRatio <= significantRowRatio) {
            log.warn("Severe row ratio ({}) should be greater than significant row ratio ({})",
                    severeRowRatio, significantRowRatio);
        }

        if (significantRowRatio <= 1.0) {
            log.warn("Significant row ratio ({}) should be greater than 1.0", significantRowRatio);
        }

        if (lowAbsoluteCost < 0) {
            log.warn("Low absolute cost ({}) should not be negative", lowAbsoluteCost);
        }

        if (indexNameMaxLength < 16) {
            log.warn("Index name max length ({}) is too short for generated names", indexNameMaxLength);
        }

        log.debug("Using thresholds - {}", getConfigurationSummary());
    }

    public String getConfigurationSummary() {
        return String.format(Locale.ROOT,
                "Cost high/medium: %.2f/%.2f | Low absolute cost: %.2f | Rows severe/significant: %.0fx/%.0fx"
                        + " | Seq scan rows: %d | Docs examined ratio: %.1f",
                highCostRatio, mediumCostRatio, lowAbsoluteCost, severeRowRatio, significantRowRatio,
                seqScanRowThreshold, docsExaminedRatioThreshold);
    }
}
