package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.mssql.SqlServerNodeDetails;
import org.carball.planlens.model.plan.PlanNode;
import org.carball.planlens.model.plan.SqlServerCost;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.carball.planlens.parser.mssql.ShowPlanAttributes.attribute;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.integer;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.number;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.stripBrackets;

/**
 * Tier 4: last resort for text that mentions a clustered index scan without any
 * usable operator attributes, e.g. a message quoting the plan.
 */
public class ClusteredIndexScanStrategy implements RelOpExtractionStrategy {

    public static final String NAME = "clustered-index-scan";

    private static final String OPERATOR = "Clustered Index Scan";
    private static final Pattern MARKER = Pattern.compile(Pattern.quote(OPERATOR), Pattern.CASE_INSENSITIVE);
    private static final Pattern OBJECT_TAG = Pattern.compile("<Object\\b[^>]*>");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExtractionOutcome extract(ShowPlanContext context) {
        String xml = context.xml();
        if (!MARKER.matcher(xml).find()) {
            return ExtractionOutcome.noMatch();
        }

        Matcher objectTag = OBJECT_TAG.matcher(xml);
        String object = objectTag.find() ? objectTag.group() : null;
        Double total = number(xml, "EstimatedTotalSubtreeCost");

        PlanNode node = PlanNode.builder()
                .id(0)
                .physicalOp(OPERATOR)
                .logicalOp(OPERATOR)
                .estimatedRows(context.statementEstRows())
                .actualRows(number(xml, "ActualRows"))
                .cost(total != null ? SqlServerCost.subtreeOnly(total) : SqlServerCost.placeholder())
                .objectName(stripBrackets(attribute(object, "Table")))
                .indexName(stripBrackets(attribute(object, "Index")))
                .details(SqlServerNodeDetails.builder()
                        .indexKind("Clustered")
                        .avgRowSize(integer(xml, "AvgRowSize"))
                        .extractionTier(NAME)
                        .build())
                .build();

        return ExtractionOutcome.matched(List.of(node));
    }
}
