package org.carball.planlens.model.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Output of any of the three plan parsers. Nodes are kept in id order so
 * parent/child ids stay meaningful; cost-ordered views are derived.
 */
public interface PlanParseResult {

    PlanEngine getEngine();

    ParseOutcome getOutcome();

    List<PlanNode> getNodes();

    @JsonIgnore
    default boolean isEmpty() {
        return getNodes().isEmpty();
    }

    default Optional<PlanNode> findNode(int id) {
        return getNodes().stream()
                .filter(node -> node.getId() == id)
                .findFirst();
    }

    @JsonIgnore
    default List<PlanNode> getRoots() {
        return getNodes().stream()
                .filter(PlanNode::isRoot)
                .collect(Collectors.toList());
    }

    default List<PlanNode> getChildren(PlanNode parent) {
        return parent.getChildren().stream()
                .map(this::findNode)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    /**
     * Nodes ordered by descending subtree cost, for "most expensive operations" reporting.
     */
    @JsonIgnore
    default List<PlanNode> getOperationsByCost() {
        return getNodes().stream()
                .sorted(Comparator.comparingDouble(PlanNode::getSubtreeCost).reversed())
                .collect(Collectors.toList());
    }

    @JsonIgnore
    default double getMaxSubtreeCost() {
        return getNodes().stream()
                .mapToDouble(PlanNode::getSubtreeCost)
                .max()
                .orElse(0.0);
    }
}
