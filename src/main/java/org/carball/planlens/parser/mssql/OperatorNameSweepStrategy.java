package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.mssql.SqlServerNodeDetails;
import org.carball.planlens.model.plan.PlanNode;
import org.carball.planlens.model.plan.SqlServerCost;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tier 3: one flat node per distinct operator name found anywhere in the text.
 * Used for fragments where RelOp tags are broken or missing.
 */
public class OperatorNameSweepStrategy implements RelOpExtractionStrategy {

    public static final String NAME = "operator-name-sweep";

    private static final Pattern OPERATOR_NAME = Pattern.compile("\\b(?:PhysicalOp|LogicalOp)=\"([^\"]+)\"");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExtractionOutcome extract(ShowPlanContext context) {
        Set<String> operators = new LinkedHashSet<>();
        Matcher matcher = OPERATOR_NAME.matcher(context.xml());
        while (matcher.find()) {
            operators.add(matcher.group(1));
        }

        List<PlanNode> nodes = new ArrayList<>();
        for (String operator : operators) {
            nodes.add(PlanNode.builder()
                    .id(nodes.size())
                    .physicalOp(operator)
                    .logicalOp(operator)
                    .estimatedRows(context.statementEstRows())
                    .cost(SqlServerCost.placeholder())
                    .details(SqlServerNodeDetails.builder().extractionTier(NAME).build())
                    .build());
        }
        return ExtractionOutcome.matched(nodes);
    }
}
