package org.carball.planlens.parser.mssql;

import java.util.List;

/**
 * Input shared by all RelOp extraction strategies: the decoded text, the
 * statement-level row estimate used as a fallback, and the scanned segments.
 */
public record ShowPlanContext(String xml, double statementEstRows, List<RelOpSegment> relOps) {

    public static ShowPlanContext of(String xml) {
        Double statementRows = ShowPlanAttributes.number(xml, "StatementEstRows");
        return new ShowPlanContext(xml, statementRows != null ? statementRows : 0.0, RelOpScanner.scan(xml));
    }
}
