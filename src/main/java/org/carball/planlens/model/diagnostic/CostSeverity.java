package org.carball.planlens.model.diagnostic;

public enum CostSeverity {
    LOW,
    MEDIUM,
    HIGH
}
