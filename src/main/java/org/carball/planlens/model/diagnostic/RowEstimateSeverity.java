package org.carball.planlens.model.diagnostic;

public enum RowEstimateSeverity {
    NONE,
    SIGNIFICANT,
    SEVERE
}
