package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.mssql.SqlServerNodeDetails;
import org.carball.planlens.model.plan.PlanNode;
import org.carball.planlens.model.plan.SqlServerCost;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.carball.planlens.parser.mssql.ShowPlanAttributes.attribute;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.flag;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.integer;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.stripBrackets;

/**
 * Fills the parts of a plan node that do not depend on the extraction tier:
 * object, index, predicate, runtime rows and ShowPlan-only details.
 */
final class RelOpNodes {

    private static final Pattern OBJECT_TAG = Pattern.compile("<Object\\b[^>]*>");
    private static final Pattern PREDICATE = Pattern.compile(
            "<Predicate\\b[^>]*>\\s*<ScalarOperator\\b[^>]*?\\bScalarString=\"([^\"]*)\"");

    private RelOpNodes() {
    }

    static PlanNode.PlanNodeBuilder fromSegment(RelOpSegment segment, SqlServerCost cost,
                                                Double estimatedRows, String tier) {
        String body = segment.body();
        String objectTag = firstMatch(OBJECT_TAG, body);

        return PlanNode.builder()
                .physicalOp(attribute(segment.openTag(), "PhysicalOp"))
                .logicalOp(attribute(segment.openTag(), "LogicalOp"))
                .estimatedRows(estimatedRows)
                .actualRows(ShowPlanAttributes.sum(body, "ActualRows"))
                .cost(cost)
                .objectName(stripBrackets(attribute(objectTag, "Table")))
                .indexName(stripBrackets(attribute(objectTag, "Index")))
                .predicate(predicate(body))
                .details(SqlServerNodeDetails.builder()
                        .indexKind(attribute(objectTag, "IndexKind"))
                        .avgRowSize(integer(segment.openTag(), "AvgRowSize"))
                        .ordered(flag(body, "Ordered"))
                        .parallel(flag(segment.openTag(), "Parallel"))
                        .scanDirection(attribute(body, "ScanDirection"))
                        .extractionTier(tier)
                        .build());
    }

    private static String predicate(String body) {
        Matcher matcher = PREDICATE.matcher(body);
        return matcher.find() ? ShowPlanAttributes.unescape(matcher.group(1)) : null;
    }

    private static String firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }
}
