package org.carball.planlens.model.diagnostic;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiagnosticCategory {
    COST("cost"),
    CARDINALITY("cardinality"),
    TEMPDB_SPILL("tempdb-spill"),
    JOIN("join"),
    INDEX("index"),
    PARALLELISM("parallelism"),
    OTHER("other");

    private final String label;

    DiagnosticCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
