package org.carball.planlens.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class PlanLensConfig {
    private Path payloadFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private Path configFile;
    private String expectedQuery;
    private boolean verbose;
    private AnalyzerThresholds thresholds;
}
