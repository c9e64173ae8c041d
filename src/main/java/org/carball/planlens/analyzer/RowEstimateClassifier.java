package org.carball.planlens.analyzer;

import org.carball.planlens.config.AnalyzerThresholds;
import org.carball.planlens.model.diagnostic.RowEstimateSeverity;

import java.util.Locale;

/**
 * Bands actual/estimated row ratios. Bands are symmetric: a ratio above
 * {@code severeRatio} or below its reciprocal is severe, and likewise for
 * significant. Ratios exactly on a boundary fall into the milder band.
 */
public class RowEstimateClassifier {

    private final double severeRatio;
    private final double significantRatio;

    public RowEstimateClassifier() {
        this(100.0, 10.0);
    }

    public RowEstimateClassifier(double severeRatio, double significantRatio) {
        this.severeRatio = severeRatio;
        this.significantRatio = significantRatio;
    }

    public static RowEstimateClassifier from(AnalyzerThresholds thresholds) {
        return new RowEstimateClassifier(thresholds.getSevereRowRatio(), thresholds.getSignificantRowRatio());
    }

    public RowEstimateSeverity classify(double ratio) {
        if (ratio > severeRatio || ratio < 1.0 / severeRatio) {
            return RowEstimateSeverity.SEVERE;
        }
        if (ratio > significantRatio || ratio < 1.0 / significantRatio) {
            return RowEstimateSeverity.SIGNIFICANT;
        }
        return RowEstimateSeverity.NONE;
    }

    /**
     * NONE when either count is missing or not positive. Operators that returned
     * no rows (often branches that never ran) are not banded.
     */
    public RowEstimateSeverity classify(Double actualRows, Double estimatedRows) {
        if (actualRows == null || estimatedRows == null || actualRows <= 0 || estimatedRows <= 0) {
            return RowEstimateSeverity.NONE;
        }
        return classify(actualRows / estimatedRows);
    }

    public static String describe(RowEstimateSeverity severity, double actualRows, double estimatedRows) {
        String band = severity == RowEstimateSeverity.SEVERE ? "Severe" : "Significant";
        String direction = actualRows > estimatedRows ? "underestimation" : "overestimation";
        return String.format(Locale.ROOT, "%s row %s: estimated %.0f rows, actual %.0f",
                band, direction, estimatedRows, actualRows);
    }
}
