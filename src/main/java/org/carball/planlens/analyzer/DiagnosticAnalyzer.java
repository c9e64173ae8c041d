package org.carball.planlens.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.planlens.config.AnalyzerThresholds;
import org.carball.planlens.model.deadlock.DeadlockGraph;
import org.carball.planlens.model.deadlock.DeadlockParticipant;
import org.carball.planlens.model.diagnostic.CostSeverity;
import org.carball.planlens.model.diagnostic.Diagnostic;
import org.carball.planlens.model.diagnostic.DiagnosticCategory;
import org.carball.planlens.model.diagnostic.RowEstimateSeverity;
import org.carball.planlens.model.diagnostic.Severity;
import org.carball.planlens.model.mongo.MongoExecutionSummary;
import org.carball.planlens.model.mongo.MongoPlan;
import org.carball.planlens.model.mssql.PlanWarning;
import org.carball.planlens.model.mssql.SqlServerPlan;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanNode;
import org.carball.planlens.model.plan.PlanParseResult;
import org.carball.planlens.model.postgres.PostgresNodeDetails;
import org.carball.planlens.model.postgres.PostgresPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns any parse result into a flat list of diagnostics. Cost and row
 * estimate rules apply to every engine; each engine then adds its own rules.
 * Inputs are never modified.
 */
@Slf4j
public class DiagnosticAnalyzer {

    private final AnalyzerThresholds thresholds;
    private final CostSeverityClassifier costClassifier;
    private final RowEstimateClassifier rowClassifier;

    public DiagnosticAnalyzer() {
        this(AnalyzerThresholds.defaults());
    }

    public DiagnosticAnalyzer(AnalyzerThresholds thresholds) {
        this.thresholds = thresholds;
        this.costClassifier = new CostSeverityClassifier(thresholds);
        this.rowClassifier = RowEstimateClassifier.from(thresholds);
    }

    public List<Diagnostic> analyze(PlanParseResult plan) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (plan == null || plan.getOutcome() == ParseOutcome.UNRECOGNIZED) {
            return diagnostics;
        }

        if (plan.getOutcome() == ParseOutcome.EMPTY) {
            diagnostics.add(Diagnostic.of(DiagnosticCategory.OTHER, Severity.INFO,
                    plan.getEngine().getDisplayName() + " plan recognized but contains no operators"));
        }

        analyzeCost(plan, diagnostics);
        analyzeRowEstimates(plan, diagnostics);

        if (plan instanceof SqlServerPlan sqlServerPlan) {
            analyzeSqlServer(sqlServerPlan, diagnostics);
        } else if (plan instanceof PostgresPlan postgresPlan) {
            analyzePostgres(postgresPlan, diagnostics);
        } else if (plan instanceof MongoPlan mongoPlan) {
            analyzeMongo(mongoPlan, diagnostics);
        }

        log.debug("Produced {} diagnostics for {} plan", diagnostics.size(), plan.getEngine());
        return diagnostics;
    }

    public List<Diagnostic> analyze(DeadlockGraph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (graph == null) {
            return diagnostics;
        }

        if (graph.isFailed()) {
            diagnostics.add(Diagnostic.of(DiagnosticCategory.OTHER, Severity.WARNING,
                    "Failed to parse deadlock graph: " + graph.getParseError()));
            return diagnostics;
        }

        if (graph.getVictim().isPresent()) {
            DeadlockParticipant victim = graph.getVictim().get();
            diagnostics.add(Diagnostic.of(DiagnosticCategory.OTHER, Severity.CRITICAL, String.format(Locale.ROOT,
                    "Deadlock between %d sessions over %d resources; victim %s (session %s)",
                    graph.getParticipants().size(), graph.getResources().size(),
                    victim.getProcessId(), victim.getSessionId())));
        } else if (!graph.getParticipants().isEmpty()) {
            diagnostics.add(Diagnostic.of(DiagnosticCategory.OTHER, Severity.WARNING, String.format(Locale.ROOT,
                    "Deadlock between %d sessions; no victim could be identified",
                    graph.getParticipants().size())));
        }

        for (DeadlockParticipant participant : graph.getParticipants()) {
            String isolation = participant.getIsolationLevel();
            if (isolation != null) {
                String normalized = isolation.toLowerCase(Locale.ROOT);
                if (normalized.contains("serializable") || normalized.contains("repeatable read")) {
                    diagnostics.add(Diagnostic.of(DiagnosticCategory.OTHER, Severity.WARNING,
                            "Process " + participant.getProcessId() + " runs at " + isolation
                                    + " isolation, which holds range or read locks until commit"));
                }
            }
        }

        for (String warning : graph.getParseWarnings()) {
            diagnostics.add(Diagnostic.of(DiagnosticCategory.OTHER, Severity.INFO, warning));
        }
        return diagnostics;
    }

    private void analyzeCost(PlanParseResult plan, List<Diagnostic> diagnostics) {
        double maxCost = plan.getMaxSubtreeCost();
        if (maxCost <= 0) {
            return;
        }
        for (PlanNode node : plan.getNodes()) {
            if (node.getCost() == null) {
                continue;
            }
            double cost = node.getSubtreeCost();
            CostSeverity severity = costClassifier.classify(cost, maxCost);
            if (severity == CostSeverity.LOW) {
                continue;
            }
            diagnostics.add(Diagnostic.forNode(DiagnosticCategory.COST,
                    severity == CostSeverity.HIGH ? Severity.CRITICAL : Severity.WARNING,
                    String.format(Locale.ROOT, "%s cost operator %s: %.1f%% of total plan cost",
                            severity == CostSeverity.HIGH ? "High" : "Medium",
                            describe(node), cost / maxCost * 100.0),
                    node.getId()));
        }
    }

    private void analyzeRowEstimates(PlanParseResult plan, List<Diagnostic> diagnostics) {
        for (PlanNode node : plan.getNodes()) {
            RowEstimateSeverity severity = rowClassifier.classify(node.getActualRows(), node.getEstimatedRows());
            if (severity == RowEstimateSeverity.NONE) {
                continue;
            }
            diagnostics.add(Diagnostic.forNode(DiagnosticCategory.CARDINALITY,
                    severity == RowEstimateSeverity.SEVERE ? Severity.CRITICAL : Severity.WARNING,
                    RowEstimateClassifier.describe(severity, node.getActualRows(), node.getEstimatedRows())
                            + " on " + describe(node),
                    node.getId()));
        }
    }

    private void analyzeSqlServer(SqlServerPlan plan, List<Diagnostic> diagnostics) {
        for (PlanWarning warning : plan.getSummary().getWarnings()) {
            diagnostics.add(WarningTaxonomy.toDiagnostic(warning));
        }
        if (plan.getGenericPlanReason() != null) {
            diagnostics.add(Diagnostic.of(DiagnosticCategory.OTHER, Severity.INFO, plan.getGenericPlanReason()));
        }
    }

    private void analyzePostgres(PostgresPlan plan, List<Diagnostic> diagnostics) {
        for (PlanNode node : plan.getNodes()) {
            String type = node.getPhysicalOp() != null ? node.getPhysicalOp() : "";

            if (type.endsWith("Seq Scan")) {
                Double rows = node.getActualRows() != null ? node.getActualRows() : node.getEstimatedRows();
                if (rows != null && rows > thresholds.getSeqScanRowThreshold()) {
                    diagnostics.add(Diagnostic.forNode(DiagnosticCategory.INDEX, Severity.WARNING,
                            String.format(Locale.ROOT, "Sequential scan on %s reads %.0f rows; consider an index",
                                    node.getObjectName() != null ? node.getObjectName() : "table", rows),
                            node.getId()));
                }
            }

            if (node.getDetails() instanceof PostgresNodeDetails details
                    && details.hasDetailStartingWith("Sort Method: external")) {
                diagnostics.add(Diagnostic.forNode(DiagnosticCategory.TEMPDB_SPILL, Severity.WARNING,
                        "Sort spilled to disk (external sort); consider raising work_mem", node.getId()));
            }
        }
    }

    private void analyzeMongo(MongoPlan plan, List<Diagnostic> diagnostics) {
        for (PlanNode node : plan.getNodes()) {
            if ("COLLSCAN".equals(node.getPhysicalOp())) {
                diagnostics.add(Diagnostic.forNode(DiagnosticCategory.INDEX, Severity.WARNING,
                        "Collection scan on " + (plan.getNamespace().isEmpty() ? "collection" : plan.getNamespace())
                                + "; no index supports this query", node.getId()));
            } else if ("SORT".equals(node.getPhysicalOp())) {
                diagnostics.add(Diagnostic.forNode(DiagnosticCategory.OTHER, Severity.INFO,
                        "In-memory SORT stage; an index matching the sort order would avoid it", node.getId()));
            }
        }

        MongoExecutionSummary summary = plan.getExecutionSummary();
        if (summary.totalDocsExamined() > 0) {
            double ratio = summary.nReturned() > 0
                    ? (double) summary.totalDocsExamined() / summary.nReturned()
                    : summary.totalDocsExamined();
            if (ratio > thresholds.getDocsExaminedRatioThreshold()) {
                diagnostics.add(Diagnostic.of(DiagnosticCategory.INDEX, Severity.WARNING, String.format(Locale.ROOT,
                        "Examined %d documents to return %d (%.1f per result); the query is not selective on its index",
                        summary.totalDocsExamined(), summary.nReturned(), ratio)));
            }
        }
    }

    private static String describe(PlanNode node) {
        String name = node.getDisplayName();
        return node.getObjectName() != null ? name + " on " + node.getObjectName() : name;
    }
}
