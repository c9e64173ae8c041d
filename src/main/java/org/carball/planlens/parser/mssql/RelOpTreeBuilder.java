package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.plan.PlanNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects nodes for a subset of RelOp segments and wires ids, parent ids and
 * children. A node whose enclosing segment was skipped attaches to the nearest
 * kept ancestor.
 */
final class RelOpTreeBuilder {

    private final List<RelOpSegment> segments;
    private final Map<Integer, PlanNode.PlanNodeBuilder> kept = new LinkedHashMap<>();

    RelOpTreeBuilder(List<RelOpSegment> segments) {
        this.segments = segments;
    }

    void add(RelOpSegment segment, PlanNode.PlanNodeBuilder node) {
        kept.put(segment.index(), node);
    }

    List<PlanNode> build() {
        Map<Integer, Integer> idBySegment = new LinkedHashMap<>();
        int nextId = 0;
        for (Integer segmentIndex : kept.keySet()) {
            idBySegment.put(segmentIndex, nextId++);
        }

        for (Map.Entry<Integer, PlanNode.PlanNodeBuilder> entry : kept.entrySet()) {
            int id = idBySegment.get(entry.getKey());
            int ancestor = segments.get(entry.getKey()).parentIndex();
            while (ancestor >= 0 && !idBySegment.containsKey(ancestor)) {
                ancestor = segments.get(ancestor).parentIndex();
            }

            entry.getValue().id(id);
            if (ancestor >= 0) {
                entry.getValue().parentId(idBySegment.get(ancestor));
                kept.get(ancestor).child(id);
            }
        }

        List<PlanNode> nodes = new ArrayList<>();
        for (PlanNode.PlanNodeBuilder builder : kept.values()) {
            nodes.add(builder.build());
        }
        return nodes;
    }
}
