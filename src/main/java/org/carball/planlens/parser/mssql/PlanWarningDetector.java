package org.carball.planlens.parser.mssql;

import org.carball.planlens.analyzer.RowEstimateClassifier;
import org.carball.planlens.model.diagnostic.RowEstimateSeverity;
import org.carball.planlens.model.mssql.MissingIndexRecommendation;
import org.carball.planlens.model.mssql.PlanWarning;
import org.carball.planlens.model.mssql.StatementSummary;
import org.carball.planlens.model.mssql.WarningType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.carball.planlens.parser.mssql.ShowPlanAttributes.attribute;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.flag;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.stripBrackets;

/**
 * Marker-based warning detection over the whole ShowPlan text. Each detector
 * contributes a headline warning and, where the plan carries them, per-item details.
 */
public final class PlanWarningDetector {

    private static final Pattern MISSING_INDEX = Pattern.compile("<MissingIndex(?:es|Group)?\\b");
    private static final Pattern SPILL = Pattern.compile(
            "SpillToTempDb|TempDbSpills|SortSpillDetails|HashSpillDetails|ExchangeSpillDetails");
    private static final Pattern SPILL_LEVEL = Pattern.compile("\\bSpillLevel=\"(\\d+)\"");
    private static final Pattern WARNINGS_FLAG = Pattern.compile("\\bWarnings=\"(?:true|1)\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern WARNINGS_BLOCK = Pattern.compile(
            "<Warnings\\b([^>]*?)(?:/>|>(.*?)</Warnings>)", Pattern.DOTALL);
    private static final Pattern WARNING_ATTRIBUTE = Pattern.compile("\\b(\\w+)=\"");
    private static final Pattern WARNING_CHILD = Pattern.compile("<(\\w+)\\b");
    private static final Pattern NO_STATS_BLOCK = Pattern.compile(
            "<ColumnsWithNoStatistics>(.*?)</ColumnsWithNoStatistics>", Pattern.DOTALL);
    private static final Pattern COLUMN_REFERENCE = Pattern.compile("<ColumnReference\\b[^>]*>");
    private static final Pattern NO_JOIN_PREDICATE = Pattern.compile("NoJoinPredicate");
    private static final Pattern UNMATCHED_INDEXES = Pattern.compile("UnmatchedIndexes");
    private static final Pattern PARAMETERIZATION = Pattern.compile("ParameterizationProblems|PlanAffectingConvert");
    private static final Pattern MEMORY_GRANT = Pattern.compile("<MemoryGrantWarning\\b[^>]*>");

    private static final RowEstimateClassifier ROW_ESTIMATES = new RowEstimateClassifier();

    private PlanWarningDetector() {
        // Utility class - prevent instantiation
    }

    public static List<PlanWarning> detect(String xml, StatementSummary summary) {
        List<PlanWarning> warnings = new ArrayList<>();
        List<MissingIndexRecommendation> missingIndexes = summary.getMissingIndexes();

        detectMissingIndexes(xml, missingIndexes, warnings);
        detectSpills(xml, warnings);
        detectPlanWarnings(xml, warnings);
        detectJoinIssues(xml, warnings);
        detectPlanGuide(xml, warnings);
        detectNonParallelPlan(xml, warnings);

        if (PARAMETERIZATION.matcher(xml).find()) {
            warnings.add(new PlanWarning(WarningType.PARAMETERIZATION, "Parameterization problems detected"));
        }

        Matcher grant = MEMORY_GRANT.matcher(xml);
        if (grant.find()) {
            String kind = attribute(grant.group(), "GrantWarningKind");
            warnings.add(new PlanWarning(WarningType.MEMORY_GRANT,
                    kind != null ? "Memory grant warning: " + kind : "Memory grant warning"));
        }

        detectRowEstimate(summary, warnings);

        return warnings;
    }

    static String describe(MissingIndexRecommendation index) {
        StringBuilder message = new StringBuilder("Consider adding index on ")
                .append(index.getQualifiedTable())
                .append(" (").append(String.join(", ", index.getKeyColumns())).append(')');
        if (!index.getIncludedColumns().isEmpty()) {
            message.append(" INCLUDE (").append(String.join(", ", index.getIncludedColumns())).append(')');
        }
        message.append(String.format(Locale.ROOT, " - Impact: %.1f%%", index.getImpact()));
        return message.toString();
    }

    /**
     * Statement-level misestimate, only available in actual plans.
     */
    private static void detectRowEstimate(StatementSummary summary, List<PlanWarning> warnings) {
        Long actual = summary.getExecutionStats().getActualRows();
        if (actual == null) {
            return;
        }
        RowEstimateSeverity severity = ROW_ESTIMATES.classify((double) actual, summary.getEstimatedRows());
        if (severity != RowEstimateSeverity.NONE) {
            warnings.add(new PlanWarning(WarningType.ROW_ESTIMATE,
                    RowEstimateClassifier.describe(severity, actual, summary.getEstimatedRows())));
        }
    }

    private static void detectMissingIndexes(String xml, List<MissingIndexRecommendation> missingIndexes,
                                             List<PlanWarning> warnings) {
        if (!MISSING_INDEX.matcher(xml).find() && missingIndexes.isEmpty()) {
            return;
        }
        warnings.add(new PlanWarning(WarningType.MISSING_INDEX, "Missing indexes detected"));
        for (MissingIndexRecommendation index : missingIndexes) {
            if (!index.isNoKeyColumns()) {
                warnings.add(new PlanWarning(WarningType.MISSING_INDEX, describe(index)));
            }
        }
    }

    private static void detectSpills(String xml, List<PlanWarning> warnings) {
        if (!SPILL.matcher(xml).find()) {
            return;
        }
        Matcher level = SPILL_LEVEL.matcher(xml);
        warnings.add(new PlanWarning(WarningType.TEMPDB_SPILL, level.find()
                ? "Spill to TempDB detected (spill level " + level.group(1) + ")"
                : "Spill to TempDB detected"));
    }

    private static void detectPlanWarnings(String xml, List<PlanWarning> warnings) {
        Matcher block = WARNINGS_BLOCK.matcher(xml);
        boolean hasBlock = block.find();
        if (!hasBlock && !WARNINGS_FLAG.matcher(xml).find()) {
            return;
        }

        warnings.add(new PlanWarning(WarningType.PLAN_WARNINGS, "Plan contains warnings"));

        if (hasBlock) {
            Set<String> kinds = new LinkedHashSet<>();
            Matcher attributes = WARNING_ATTRIBUTE.matcher(block.group(1));
            while (attributes.find()) {
                kinds.add(attributes.group(1));
            }
            if (block.group(2) != null) {
                Matcher child = WARNING_CHILD.matcher(block.group(2));
                while (child.find()) {
                    kinds.add(child.group(1));
                }
            }
            kinds.remove("ColumnReference");
            if (!kinds.isEmpty()) {
                warnings.add(new PlanWarning(WarningType.PLAN_WARNINGS,
                        "Warning detail: " + String.join(", ", kinds)));
            }
        }

        Matcher noStats = NO_STATS_BLOCK.matcher(xml);
        while (noStats.find()) {
            Matcher reference = COLUMN_REFERENCE.matcher(noStats.group(1));
            while (reference.find()) {
                String table = stripBrackets(attribute(reference.group(), "Table"));
                String column = stripBrackets(attribute(reference.group(), "Column"));
                warnings.add(new PlanWarning(WarningType.STATISTICS_MISSING,
                        "No statistics for column: " + (table != null ? table + "." : "") + column));
            }
        }

        if (UNMATCHED_INDEXES.matcher(xml).find()) {
            warnings.add(new PlanWarning(WarningType.UNMATCHED_INDEXES,
                    "Filtered indexes could not be matched due to parameterization"));
        }
    }

    private static void detectJoinIssues(String xml, List<PlanWarning> warnings) {
        if (!NO_JOIN_PREDICATE.matcher(xml).find()) {
            return;
        }
        warnings.add(new PlanWarning(WarningType.JOIN_ISSUE, "Join issues detected"));
        if (Boolean.TRUE.equals(flag(xml, "NoJoinPredicate")) || xml.contains("<NoJoinPredicate")) {
            warnings.add(new PlanWarning(WarningType.CARTESIAN_JOIN, "Cartesian join (no join predicate) detected"));
        }
    }

    private static void detectPlanGuide(String xml, List<PlanWarning> warnings) {
        String name = attribute(xml, "PlanGuideName");
        if (name == null) {
            return;
        }
        String database = attribute(xml, "PlanGuideDB");
        warnings.add(new PlanWarning(WarningType.PLAN_GUIDE,
                "Plan guide used: " + (database != null ? stripBrackets(database) + "." : "") + stripBrackets(name)));
    }

    private static void detectNonParallelPlan(String xml, List<PlanWarning> warnings) {
        String reason = attribute(xml, "NonParallelPlanReason");
        if (reason != null) {
            warnings.add(new PlanWarning(WarningType.NON_PARALLEL_PLAN, "Parallel plan prevented: " + reason));
        }
    }
}
