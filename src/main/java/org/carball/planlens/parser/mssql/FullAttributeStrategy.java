package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.plan.SqlServerCost;

import static org.carball.planlens.parser.mssql.ShowPlanAttributes.attribute;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.number;

/**
 * Tier 1: RelOps whose opening tag carries all six estimate attributes. Every
 * such RelOp yields exactly one node.
 */
public class FullAttributeStrategy implements RelOpExtractionStrategy {

    public static final String NAME = "full-attribute";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExtractionOutcome extract(ShowPlanContext context) {
        RelOpTreeBuilder tree = new RelOpTreeBuilder(context.relOps());

        for (RelOpSegment segment : context.relOps()) {
            String tag = segment.openTag();
            Double rows = number(tag, "EstimateRows");
            Double cpu = number(tag, "EstimateCPU");
            Double io = number(tag, "EstimateIO");
            Double total = number(tag, "EstimatedTotalSubtreeCost");

            if (attribute(tag, "PhysicalOp") == null || attribute(tag, "LogicalOp") == null
                    || rows == null || cpu == null || io == null || total == null) {
                continue;
            }

            tree.add(segment, RelOpNodes.fromSegment(segment, SqlServerCost.fromEstimates(cpu, io, total), rows, NAME));
        }

        return ExtractionOutcome.matched(tree.build());
    }
}
