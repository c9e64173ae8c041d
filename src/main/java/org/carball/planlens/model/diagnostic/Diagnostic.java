package org.carball.planlens.model.diagnostic;

/**
 * A finding produced by the analyzer. {@code nodeId} names the plan node that
 * triggered it, or is null for statement-level and deadlock findings.
 */
public record Diagnostic(DiagnosticCategory category, Severity severity, String message, Integer nodeId) {

    public static Diagnostic of(DiagnosticCategory category, Severity severity, String message) {
        return new Diagnostic(category, severity, message, null);
    }

    public static Diagnostic forNode(DiagnosticCategory category, Severity severity, String message, int nodeId) {
        return new Diagnostic(category, severity, message, nodeId);
    }
}
