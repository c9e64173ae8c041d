package org.carball.planlens.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.planlens.model.InspectionResult;
import org.carball.planlens.model.deadlock.DeadlockGraph;
import org.carball.planlens.model.deadlock.DeadlockParticipant;
import org.carball.planlens.model.deadlock.LockResource;
import org.carball.planlens.model.deadlock.WaitForEdge;
import org.carball.planlens.model.diagnostic.Diagnostic;
import org.carball.planlens.model.diagnostic.Severity;
import org.carball.planlens.model.mssql.MissingIndexRecommendation;
import org.carball.planlens.model.plan.PlanNode;
import org.carball.planlens.model.plan.PlanParseResult;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Slf4j
public class InspectionReport {

    static final int TOP_OPERATIONS = 10;

    private final InspectionResult result;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public InspectionReport(InspectionResult result) {
        this(result, LocalDateTime.now());
    }

    public InspectionReport(InspectionResult result, LocalDateTime timestamp) {
        this.result = result;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new ReportWriteException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Execution Plan Inspection Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Payload:** ").append(result.getPayloadKind()).append("  \n\n");

        appendSummary(md);
        appendDiagnostics(md);

        if (result.getPlan() != null) {
            appendTopOperations(md, result.getPlan());
        }
        if (!result.getMissingIndexes().isEmpty()) {
            appendMissingIndexes(md);
        }
        if (result.getDeadlock() != null) {
            appendDeadlock(md, result.getDeadlock());
        }
        return md.toString();
    }

    private void appendSummary(StringBuilder md) {
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        if (result.getPlan() != null) {
            md.append("| Engine | ").append(result.getPlan().getEngine().getDisplayName()).append(" |\n");
        }
        md.append("| Outcome | ").append(result.getOutcome()).append(" |\n");
        if (result.getPlan() != null) {
            md.append("| Plan Nodes | ").append(result.getPlan().getNodes().size()).append(" |\n");
        }
        if (result.getDeadlock() != null) {
            md.append("| Deadlock Participants | ").append(result.getDeadlock().getParticipants().size()).append(" |\n");
        }
        md.append("| Critical | ").append(result.countBySeverity(Severity.CRITICAL)).append(" |\n");
        md.append("| Warnings | ").append(result.countBySeverity(Severity.WARNING)).append(" |\n");
        md.append("| Info | ").append(result.countBySeverity(Severity.INFO)).append(" |\n");
        md.append("| Missing Indexes | ").append(result.getMissingIndexes().size()).append(" |\n\n");
    }

    private void appendDiagnostics(StringBuilder md) {
        md.append("## Diagnostics\n\n");
        if (result.getDiagnostics().isEmpty()) {
            md.append("**No issues found.**\n\n");
            return;
        }

        md.append("| Severity | Category | Finding |\n");
        md.append("|----------|----------|---------|\n");
        result.getDiagnostics().stream()
                .sorted(Comparator.comparing(Diagnostic::severity).reversed())
                .forEach(d -> md.append("| ").append(severityBadge(d.severity()))
                        .append(" | ").append(d.category().getLabel())
                        .append(" | ").append(escapeCell(d.message()))
                        .append(" |\n"));
        md.append("\n");
    }

    private void appendTopOperations(StringBuilder md, PlanParseResult plan) {
        if (plan.isEmpty()) {
            return;
        }
        md.append("## Most Expensive Operations\n\n");
        md.append("| # | Operator | Object | Est. Rows | Actual Rows | Cost |\n");
        md.append("|---|----------|--------|-----------|-------------|------|\n");

        int rank = 1;
        for (PlanNode node : plan.getOperationsByCost().subList(0, Math.min(TOP_OPERATIONS, plan.getNodes().size()))) {
            md.append("| ").append(rank++)
                    .append(" | ").append(escapeCell(node.getDisplayName()))
                    .append(" | ").append(node.getObjectName() != null ? escapeCell(node.getObjectName()) : "-")
                    .append(" | ").append(formatRows(node.getEstimatedRows()))
                    .append(" | ").append(formatRows(node.getActualRows()))
                    .append(" | ").append(String.format(Locale.ROOT, "%.4f", node.getSubtreeCost()))
                    .append(" |\n");
        }
        md.append("\n");
    }

    private void appendMissingIndexes(StringBuilder md) {
        md.append("## Missing Indexes\n\n");
        int number = 1;
        for (MissingIndexRecommendation rec : result.getMissingIndexes()) {
            md.append("### ").append(number++).append(". ")
                    .append(rec.getQualifiedTable())
                    .append(String.format(Locale.ROOT, " (impact %.1f%%)", rec.getImpact()))
                    .append("\n\n");
            md.append("- **Key Columns:** ").append(String.join(", ", rec.getKeyColumns())).append("\n");
            if (!rec.getIncludedColumns().isEmpty()) {
                md.append("- **Included Columns:** ").append(String.join(", ", rec.getIncludedColumns())).append("\n");
            }
            md.append("\n");

            if (rec.getDdlScript() != null) {
                md.append("```sql\n").append(rec.getDdlScript()).append("\n```\n\n");
            }
        }
    }

    private void appendDeadlock(StringBuilder md, DeadlockGraph graph) {
        md.append("## Deadlock\n\n");
        if (graph.isFailed()) {
            md.append("**Deadlock graph could not be parsed:** ").append(graph.getParseError()).append("\n\n");
            md.append("```xml\n").append(graph.getRawXml()).append("\n```\n\n");
            return;
        }

        md.append("### Participants\n\n");
        md.append("| Process | Session | Victim | Isolation | Wait Resource | Wait (ms) | Query |\n");
        md.append("|---------|---------|--------|-----------|---------------|-----------|-------|\n");
        for (DeadlockParticipant p : graph.getParticipants()) {
            md.append("| ").append(p.getProcessId())
                    .append(" | ").append(valueOrDash(p.getSessionId()))
                    .append(" | ").append(p.isVictim() ? "**yes**" : "no")
                    .append(" | ").append(valueOrDash(p.getIsolationLevel()))
                    .append(" | ").append(valueOrDash(p.getWaitResource()))
                    .append(" | ").append(p.getWaitTimeMs())
                    .append(" | ").append(escapeCell(valueOrDash(p.getInputQuery())))
                    .append(" |\n");
        }
        md.append("\n");

        if (!graph.getEdges().isEmpty()) {
            md.append("### Wait-For Edges\n\n");
            md.append("| Owner | Waiter | Resource | Owner Mode | Waiter Mode |\n");
            md.append("|-------|--------|----------|------------|-------------|\n");
            for (WaitForEdge edge : graph.getEdges()) {
                LockResource resource = graph.getResources().get(edge.resourceIndex());
                md.append("| ").append(edge.ownerId())
                        .append(" | ").append(edge.waiterId())
                        .append(" | ").append(resource.getResourceType())
                        .append(resource.getObjectName() != null ? " on " + resource.getObjectName() : "")
                        .append(" | ").append(valueOrDash(edge.ownerMode()))
                        .append(" | ").append(valueOrDash(edge.waiterMode()))
                        .append(" |\n");
            }
            md.append("\n");
        }
    }

    private static String severityBadge(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return "🔴 critical";
            case WARNING:
                return "🟡 warning";
            default:
                return "⚪ info";
        }
    }

    private static String formatRows(Double rows) {
        return rows != null ? String.format(Locale.ROOT, "%,.0f", rows) : "-";
    }

    private static String valueOrDash(String value) {
        return value != null && !value.isEmpty() ? value : "-";
    }

    private static String escapeCell(String text) {
        return text.replace("|", "\\|").replaceAll("\\s*\\R\\s*", " ");
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();
        data.setMetadata(new ReportMetadata(
                timestamp,
                result.getPayloadKind().name(),
                result.getPlan() != null ? result.getPlan().getEngine().getDisplayName() : null,
                result.getOutcome().name(),
                result.getDiagnostics().size()));
        data.setDiagnostics(result.getDiagnostics());
        data.setPlan(result.getPlan());
        data.setMissingIndexes(result.getMissingIndexes().isEmpty() ? null : result.getMissingIndexes());
        data.setDeadlock(result.getDeadlock());
        return data;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private List<Diagnostic> diagnostics;
        private PlanParseResult plan;
        private List<MissingIndexRecommendation> missingIndexes;
        private DeadlockGraph deadlock;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime timestamp;
        private String payloadKind;
        private String engine;
        private String outcome;
        private int diagnosticCount;
    }
}
