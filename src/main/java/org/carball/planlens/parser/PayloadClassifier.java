package org.carball.planlens.parser;

import org.carball.planlens.model.PayloadKind;
import org.carball.planlens.parser.postgres.PostgresPlanParser;

import java.util.regex.Pattern;

/**
 * Sniffs unwrapped payload text and names the parser that should handle it.
 * Checks run in a fixed order; the first marker found decides.
 */
public final class PayloadClassifier {

    private static final Pattern SHOWPLAN_MARKERS = Pattern.compile(
            "<ShowPlanXML|<RelOp\\b|<StmtSimple\\b|\\bPhysicalOp=\"");

    private static final Pattern DEADLOCK_MARKERS = Pattern.compile(
            "<deadlock\\b|xml_deadlock_report|<victim-list\\b");

    private static final Pattern MONGO_JSON_MARKERS = Pattern.compile(
            "\"(?:queryPlanner|winningPlan|executionStages)\"\\s*:");

    private static final Pattern MONGO_MARKDOWN_HEADER = Pattern.compile(
            "(?mi)^\\s*##\\s*(?:Query Planner|Execution Stats)\\b");

    private static final Pattern POSTGRES_MARKERS = Pattern.compile(
            "\\(cost=\\d|\\(actual time=|\\(actual rows=|Planning Time:|Execution Time:");

    private PayloadClassifier() {
        // Utility class - prevent instantiation
    }

    public static PayloadKind classify(String text) {
        if (text == null || text.isBlank()) {
            return PayloadKind.UNKNOWN;
        }

        if (CompressedPayloadDecoder.isCompressed(text)) {
            return PayloadKind.COMPRESSED_DEADLOCK;
        }
        if (DEADLOCK_MARKERS.matcher(text).find()) {
            return PayloadKind.DEADLOCK_XML;
        }
        if (SHOWPLAN_MARKERS.matcher(text).find()) {
            return PayloadKind.SQL_SERVER_PLAN;
        }
        if (MONGO_MARKDOWN_HEADER.matcher(text).find() || MONGO_JSON_MARKERS.matcher(text).find()) {
            return PayloadKind.MONGO_EXPLAIN;
        }
        if (POSTGRES_MARKERS.matcher(text).find() || PostgresPlanParser.startsWithOperator(text)) {
            return PayloadKind.POSTGRES_EXPLAIN;
        }
        return PayloadKind.UNKNOWN;
    }
}
