package org.carball.planlens.parser.mssql;

import lombok.extern.slf4j.Slf4j;
import org.carball.planlens.model.mssql.MissingIndexRecommendation;
import org.carball.planlens.model.mssql.SqlServerPlan;
import org.carball.planlens.model.mssql.StatementSummary;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanNode;

import java.util.List;

/**
 * Parses SQL Server ShowPlan XML, or fragments of it, into plan nodes plus a
 * statement summary. Extraction tiers are tried in order and the first match
 * wins. Never throws; unusable input yields an unrecognized plan.
 */
@Slf4j
public class MssqlPlanParser {

    private final List<RelOpExtractionStrategy> strategies;
    private final GenericPlanDetector genericPlanDetector;

    public MssqlPlanParser() {
        this(defaultStrategies());
    }

    public MssqlPlanParser(List<RelOpExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
        this.genericPlanDetector = new GenericPlanDetector();
    }

    public static List<RelOpExtractionStrategy> defaultStrategies() {
        return List.of(
                new FullAttributeStrategy(),
                new ReducedAttributeStrategy(),
                new OperatorNameSweepStrategy(),
                new ClusteredIndexScanStrategy());
    }

    public SqlServerPlan parse(String xml) {
        return parse(xml, null);
    }

    public SqlServerPlan parse(String xml, String expectedQuery) {
        if (xml == null || xml.isBlank()) {
            return SqlServerPlan.unrecognized();
        }

        try {
            return doParse(xml, expectedQuery);
        } catch (RuntimeException e) {
            log.warn("Failed to parse SQL Server plan: {}", e.getMessage());
            log.debug("Parse failure details", e);
            return SqlServerPlan.unrecognized();
        }
    }

    private SqlServerPlan doParse(String xml, String expectedQuery) {
        ShowPlanContext context = ShowPlanContext.of(xml);

        List<PlanNode> nodes = List.of();
        String tier = null;
        for (RelOpExtractionStrategy strategy : strategies) {
            ExtractionOutcome outcome = strategy.extract(context);
            if (outcome.isMatched()) {
                nodes = outcome.getNodes();
                tier = strategy.name();
                break;
            }
            log.debug("Extraction tier {} found no operators", strategy.name());
        }

        List<MissingIndexRecommendation> missingIndexes = MissingIndexExtractor.extract(xml);
        StatementSummary base = StatementSummaryExtractor.extract(xml)
                .missingIndexes(missingIndexes)
                .usedIndexes(UsedIndexExtractor.extract(xml))
                .build();
        StatementSummary summary = base.toBuilder()
                .warnings(PlanWarningDetector.detect(xml, base))
                .build();

        if (tier == null && summary.getStatementType() == null && missingIndexes.isEmpty()) {
            log.debug("No ShowPlan content recognized");
            return SqlServerPlan.unrecognized();
        }

        if (tier != null) {
            log.info("Extracted {} operators from SQL Server plan using {} tier", nodes.size(), tier);
        }

        return SqlServerPlan.builder()
                .outcome(nodes.isEmpty() ? ParseOutcome.EMPTY : ParseOutcome.PARSED)
                .nodes(nodes)
                .extractionTier(tier)
                .statementEstRows(context.statementEstRows())
                .summary(summary)
                .genericPlanReason(genericPlanDetector.detect(xml, summary, expectedQuery).orElse(null))
                .build();
    }
}
