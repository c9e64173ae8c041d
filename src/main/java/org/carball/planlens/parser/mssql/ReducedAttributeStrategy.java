package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.plan.SqlServerCost;

import static org.carball.planlens.parser.mssql.ShowPlanAttributes.attribute;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.number;

/**
 * Tier 2: RelOps with at least PhysicalOp and LogicalOp. Missing estimates fall
 * back to the placeholder cost and the statement-level row estimate. Node cost
 * is the subtree total since CPU and IO may be partial.
 */
public class ReducedAttributeStrategy implements RelOpExtractionStrategy {

    public static final String NAME = "reduced-attribute";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExtractionOutcome extract(ShowPlanContext context) {
        RelOpTreeBuilder tree = new RelOpTreeBuilder(context.relOps());

        for (RelOpSegment segment : context.relOps()) {
            String tag = segment.openTag();
            if (attribute(tag, "PhysicalOp") == null || attribute(tag, "LogicalOp") == null) {
                continue;
            }

            Double rows = number(tag, "EstimateRows");
            Double cpu = number(tag, "EstimateCPU");
            Double io = number(tag, "EstimateIO");
            Double total = number(tag, "EstimatedTotalSubtreeCost");

            double subtree = total != null ? total : SqlServerCost.PLACEHOLDER_COST;
            SqlServerCost cost = new SqlServerCost(
                    cpu != null ? cpu : 0.0, io != null ? io : 0.0, subtree, subtree);

            tree.add(segment, RelOpNodes.fromSegment(segment, cost,
                    rows != null ? rows : context.statementEstRows(), NAME));
        }

        return ExtractionOutcome.matched(tree.build());
    }
}
