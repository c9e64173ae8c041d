package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.plan.PlanNode;

import java.util.List;

/**
 * Result of one extraction tier: either matched with at least one node, or no match.
 */
public final class ExtractionOutcome {

    private static final ExtractionOutcome NO_MATCH = new ExtractionOutcome(List.of());

    private final List<PlanNode> nodes;

    private ExtractionOutcome(List<PlanNode> nodes) {
        this.nodes = nodes;
    }

    public static ExtractionOutcome matched(List<PlanNode> nodes) {
        return nodes.isEmpty() ? NO_MATCH : new ExtractionOutcome(List.copyOf(nodes));
    }

    public static ExtractionOutcome noMatch() {
        return NO_MATCH;
    }

    public boolean isMatched() {
        return !nodes.isEmpty();
    }

    public List<PlanNode> getNodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return isMatched() ? "Matched(" + nodes.size() + " nodes)" : "NoMatch";
    }
}
