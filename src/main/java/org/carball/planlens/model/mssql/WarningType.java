package org.carball.planlens.model.mssql;

public enum WarningType {
    MISSING_INDEX,
    TEMPDB_SPILL,
    PLAN_WARNINGS,
    STATISTICS_MISSING,
    UNMATCHED_INDEXES,
    JOIN_ISSUE,
    CARTESIAN_JOIN,
    PLAN_GUIDE,
    NON_PARALLEL_PLAN,
    PARAMETERIZATION,
    MEMORY_GRANT,
    ROW_ESTIMATE
}
