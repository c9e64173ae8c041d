package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.mssql.ExecutionStats;
import org.carball.planlens.model.mssql.StatementSummary;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.carball.planlens.parser.mssql.ShowPlanAttributes.attribute;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.flag;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.integer;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.number;

/**
 * Statement-level attributes. Each field has a preferred attribute and a
 * fallback, since older ShowPlan schemas and hand-edited plans vary.
 */
public final class StatementSummaryExtractor {

    private static final Pattern ESTIMATE_ROWS = Pattern.compile("\\bEstimateRows=\"([^\"]*)\"");
    private static final Pattern FIRST_WORD = Pattern.compile("^\\s*(\\w+)");

    private StatementSummaryExtractor() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds the summary without warnings, missing or used indexes; the parser adds those.
     */
    public static StatementSummary.StatementSummaryBuilder extract(String xml) {
        String statementText = attribute(xml, "StatementText");

        return StatementSummary.builder()
                .statementType(statementType(xml, statementText))
                .statementText(statementText)
                .degreeOfParallelism(firstInteger(xml, 1, "DegreeOfParallelism", "MaxDOP"))
                .queryHash(firstAttribute(xml, "QueryHash", "PlanGuid"))
                .planHash(firstAttribute(xml, "QueryPlanHash", "PlanHash"))
                .estimatedRows(estimatedRows(xml))
                .retrievedFromCache(Boolean.TRUE.equals(flag(xml, "RetrievedFromCache"))
                        || Boolean.TRUE.equals(flag(xml, "FromCache")))
                .cachedPlanSize(integer(xml, "CachedPlanSize"))
                .executionStats(executionStats(xml));
    }

    static double estimatedRows(String xml) {
        Double statementRows = number(xml, "StatementEstRows");
        if (statementRows != null) {
            return statementRows;
        }

        double max = 0.0;
        Matcher matcher = ESTIMATE_ROWS.matcher(xml);
        while (matcher.find()) {
            Double rows = ShowPlanAttributes.parseDouble(matcher.group(1));
            if (rows != null && rows > max) {
                max = rows;
            }
        }
        return max;
    }

    private static String statementType(String xml, String statementText) {
        String type = attribute(xml, "StatementType");
        if (type != null && !type.isBlank()) {
            return type.trim().toUpperCase(Locale.ROOT);
        }
        if (statementText != null) {
            Matcher word = FIRST_WORD.matcher(statementText);
            if (word.find()) {
                return word.group(1).toUpperCase(Locale.ROOT);
            }
        }
        return null;
    }

    private static ExecutionStats executionStats(String xml) {
        Double actualRows = number(xml, "ActualRows");
        Double logicalReads = ShowPlanAttributes.sum(xml, "ActualLogicalReads");
        Double physicalReads = ShowPlanAttributes.sum(xml, "ActualPhysicalReads");
        Double elapsed = number(xml, "ElapsedTime");
        Double executionTime = number(xml, "ExecutionTime");

        return ExecutionStats.builder()
                .actualRows(actualRows != null ? actualRows.longValue() : null)
                .rowSize(integer(xml, "AvgRowSize"))
                .logicalReads(logicalReads != null ? logicalReads.longValue() : null)
                .physicalReads(physicalReads != null ? physicalReads.longValue() : null)
                .executionTimeMs(executionTime != null ? executionTime : elapsed)
                .cpuTimeMs(number(xml, "CpuTime"))
                .elapsedTimeMs(elapsed)
                .build();
    }

    private static String firstAttribute(String xml, String... names) {
        for (String name : names) {
            String value = attribute(xml, name);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static int firstInteger(String xml, int defaultValue, String... names) {
        for (String name : names) {
            Integer value = integer(xml, name);
            if (value != null) {
                return value;
            }
        }
        return defaultValue;
    }
}
