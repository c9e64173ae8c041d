package org.carball.planlens.model.plan;

public enum PlanEngine {
    SQL_SERVER("SQL Server"),
    POSTGRES("PostgreSQL"),
    MONGODB("MongoDB");

    private final String displayName;

    PlanEngine(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
