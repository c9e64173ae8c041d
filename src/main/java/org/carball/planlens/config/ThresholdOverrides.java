package org.carball.planlens.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Threshold file contents. Every field is optional; absent values leave the
 * defaults untouched.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdOverrides {

    @JsonProperty("high_cost_ratio")
    private Double highCostRatio;

    @JsonProperty("medium_cost_ratio")
    private Double mediumCostRatio;

    @JsonProperty("low_absolute_cost")
    private Double lowAbsoluteCost;

    @JsonProperty("severe_row_ratio")
    private Double severeRowRatio;

    @JsonProperty("significant_row_ratio")
    private Double significantRowRatio;

    @JsonProperty("seq_scan_row_threshold")
    private Long seqScanRowThreshold;

    @JsonProperty("docs_examined_ratio_threshold")
    private Double docsExaminedRatioThreshold;

    @JsonProperty("index_name_max_length")
    private Integer indexNameMaxLength;

    public void applyTo(AnalyzerThresholds.AnalyzerThresholdsBuilder builder) {
        if (highCostRatio != null) {
            builder.highCostRatio(highCostRatio);
        }
        if (mediumCostRatio != null) {
            builder.mediumCostRatio(mediumCostRatio);
        }
        if (lowAbsoluteCost != null) {
            builder.lowAbsoluteCost(lowAbsoluteCost);
        }
        if (severeRowRatio != null) {
            builder.severeRowRatio(severeRowRatio);
        }
        if (significantRowRatio != null) {
            builder.significantRowRatio(significantRowRatio);
        }
        if (seqScanRowThreshold != null) {
            builder.seqScanRowThreshold(seqScanRowThreshold);
        }
        if (docsExaminedRatioThreshold != null) {
            builder.docsExaminedRatioThreshold(docsExaminedRatioThreshold);
        }
        if (indexNameMaxLength != null) {
            builder.indexNameMaxLength(indexNameMaxLength);
        }
    }
}
