package org.carball.planlens.parser.mssql;

/**
 * One tier of RelOp extraction. Tiers are tried in order and the first one
 * that matches supplies the plan nodes.
 */
public interface RelOpExtractionStrategy {

    String name();

    ExtractionOutcome extract(ShowPlanContext context);
}
