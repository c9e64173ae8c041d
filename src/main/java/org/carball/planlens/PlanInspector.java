package org.carball.planlens;

import lombok.extern.slf4j.Slf4j;
import org.carball.planlens.analyzer.DiagnosticAnalyzer;
import org.carball.planlens.config.AnalyzerThresholds;
import org.carball.planlens.ddl.IndexScriptGenerator;
import org.carball.planlens.model.InspectionResult;
import org.carball.planlens.model.PayloadKind;
import org.carball.planlens.model.deadlock.DeadlockGraph;
import org.carball.planlens.model.mssql.MissingIndexRecommendation;
import org.carball.planlens.model.mssql.SqlServerPlan;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanParseResult;
import org.carball.planlens.parser.PayloadClassifier;
import org.carball.planlens.parser.PayloadUnwrapper;
import org.carball.planlens.parser.deadlock.DeadlockGraphParser;
import org.carball.planlens.parser.mongo.MongoPlanParser;
import org.carball.planlens.parser.mssql.MssqlPlanParser;
import org.carball.planlens.parser.postgres.PostgresPlanParser;

import java.util.List;

/**
 * Entry point for one diagnostic payload: unwraps it, picks the parser for its
 * format, runs the analyzer and attaches index scripts. Holds no per-call state,
 * so one instance can serve concurrent callers.
 */
@Slf4j
public class PlanInspector {

    private final AnalyzerThresholds thresholds;
    private final MssqlPlanParser mssqlParser;
    private final PostgresPlanParser postgresParser;
    private final MongoPlanParser mongoParser;
    private final DeadlockGraphParser deadlockParser;
    private final DiagnosticAnalyzer analyzer;
    private final IndexScriptGenerator scriptGenerator;

    public PlanInspector() {
        this(AnalyzerThresholds.defaults());
    }

    public PlanInspector(AnalyzerThresholds thresholds) {
        this.thresholds = thresholds;
        this.mssqlParser = new MssqlPlanParser();
        this.postgresParser = new PostgresPlanParser();
        this.mongoParser = new MongoPlanParser();
        this.deadlockParser = new DeadlockGraphParser();
        this.analyzer = new DiagnosticAnalyzer(thresholds);
        this.scriptGenerator = new IndexScriptGenerator(thresholds.getIndexNameMaxLength());
    }

    public AnalyzerThresholds getThresholds() {
        return thresholds;
    }

    public InspectionResult inspect(String payload) {
        return inspect(payload, null);
    }

    /**
     * Inspects a payload. {@code expectedQuery} is the statement the caller asked a
     * SQL Server plan for; when given, plans for a different statement type are flagged.
     */
    public InspectionResult inspect(String payload, String expectedQuery) {
        try {
            return doInspect(payload, expectedQuery);
        } catch (RuntimeException e) {
            log.warn("Failed to inspect payload: {}", e.getMessage());
            log.debug("Inspection failure details", e);
            return unrecognized();
        }
    }

    private InspectionResult doInspect(String payload, String expectedQuery) {
        String text = PayloadUnwrapper.unwrap(payload);
        PayloadKind kind = PayloadClassifier.classify(text);
        log.debug("Payload classified as {}", kind);

        switch (kind) {
            case SQL_SERVER_PLAN:
                SqlServerPlan sqlServerPlan = mssqlParser.parse(text, expectedQuery);
                return planResult(kind, sqlServerPlan,
                        scriptGenerator.withScripts(sqlServerPlan.getSummary().getMissingIndexes()));
            case POSTGRES_EXPLAIN:
                return planResult(kind, postgresParser.parse(text), List.of());
            case MONGO_EXPLAIN:
                return planResult(kind, mongoParser.parse(text), List.of());
            case DEADLOCK_XML:
            case COMPRESSED_DEADLOCK:
                return deadlockResult(kind, deadlockParser.parse(text));
            default:
                log.debug("No known plan or deadlock markers in payload of {} chars", text.length());
                return unrecognized();
        }
    }

    private static InspectionResult unrecognized() {
        return InspectionResult.builder()
                .payloadKind(PayloadKind.UNKNOWN)
                .outcome(ParseOutcome.UNRECOGNIZED)
                .build();
    }

    private InspectionResult planResult(PayloadKind kind, PlanParseResult plan,
                                        List<MissingIndexRecommendation> missingIndexes) {
        log.info("Parsed {} plan: {} nodes, outcome {}",
                plan.getEngine().getDisplayName(), plan.getNodes().size(), plan.getOutcome());

        return InspectionResult.builder()
                .payloadKind(kind)
                .outcome(plan.getOutcome())
                .plan(plan)
                .diagnostics(analyzer.analyze(plan))
                .missingIndexes(missingIndexes)
                .build();
    }

    private InspectionResult deadlockResult(PayloadKind kind, DeadlockGraph graph) {
        log.info("Parsed deadlock graph: {} participants, {} edges",
                graph.getParticipants().size(), graph.getEdges().size());

        return InspectionResult.builder()
                .payloadKind(kind)
                .outcome(graph.getOutcome())
                .deadlock(graph)
                .diagnostics(analyzer.analyze(graph))
                .build();
    }
}
