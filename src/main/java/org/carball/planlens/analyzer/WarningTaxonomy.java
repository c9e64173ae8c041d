package org.carball.planlens.analyzer;

import org.carball.planlens.model.diagnostic.Diagnostic;
import org.carball.planlens.model.diagnostic.DiagnosticCategory;
import org.carball.planlens.model.diagnostic.Severity;
import org.carball.planlens.model.mssql.PlanWarning;

/**
 * Fixed mapping from SQL Server plan warnings to diagnostic category and severity.
 */
public final class WarningTaxonomy {

    private WarningTaxonomy() {
        // Utility class - prevent instantiation
    }

    public static Diagnostic toDiagnostic(PlanWarning warning) {
        return Diagnostic.of(category(warning), severity(warning), warning.message());
    }

    static DiagnosticCategory category(PlanWarning warning) {
        switch (warning.type()) {
            case MISSING_INDEX:
                return DiagnosticCategory.INDEX;
            case TEMPDB_SPILL:
                return DiagnosticCategory.TEMPDB_SPILL;
            case JOIN_ISSUE:
            case CARTESIAN_JOIN:
                return DiagnosticCategory.JOIN;
            case STATISTICS_MISSING:
            case ROW_ESTIMATE:
                return DiagnosticCategory.CARDINALITY;
            case NON_PARALLEL_PLAN:
                return DiagnosticCategory.PARALLELISM;
            default:
                return DiagnosticCategory.OTHER;
        }
    }

    static Severity severity(PlanWarning warning) {
        switch (warning.type()) {
            case TEMPDB_SPILL:
            case CARTESIAN_JOIN:
                return Severity.CRITICAL;
            case MISSING_INDEX:
            case JOIN_ISSUE:
            case STATISTICS_MISSING:
            case PARAMETERIZATION:
            case MEMORY_GRANT:
            case ROW_ESTIMATE:
                return Severity.WARNING;
            default:
                return Severity.INFO;
        }
    }
}
