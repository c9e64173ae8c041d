package org.carball.planlens.parser.postgres;

import lombok.extern.slf4j.Slf4j;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanNode;
import org.carball.planlens.model.plan.PostgresCost;
import org.carball.planlens.model.postgres.BufferStats;
import org.carball.planlens.model.postgres.PostgresNodeDetails;
import org.carball.planlens.model.postgres.PostgresPlan;
import org.carball.planlens.model.postgres.QueryTiming;
import org.carball.planlens.model.postgres.TimeRange;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses {@code EXPLAIN (ANALYZE, BUFFERS)} text output. Nesting comes from
 * indentation: a stack of (depth, node id) pairs is popped until the top is
 * shallower than the current operator, and that top becomes the parent.
 */
@Slf4j
public class PostgresPlanParser {

    private static final List<String> OPERATORS = List.of(
            "Seq Scan", "Index Scan", "Index Only Scan", "Bitmap Heap Scan", "Bitmap Index Scan",
            "Tid Scan", "Tid Range Scan", "Subquery Scan", "Function Scan", "Table Function Scan",
            "Values Scan", "CTE Scan", "Named Tuplestore Scan", "WorkTable Scan", "Foreign Scan",
            "Custom Scan", "Sample Scan", "Nested Loop", "Hash Join", "Merge Join", "Hash",
            "Sort", "Incremental Sort", "Aggregate", "GroupAggregate", "HashAggregate",
            "MixedAggregate", "Group", "WindowAgg", "Limit", "Result", "ProjectSet", "Unique",
            "SetOp", "HashSetOp", "LockRows", "Gather Merge", "Gather", "BitmapAnd", "BitmapOr",
            "Recursive Union", "Merge Append", "Append", "Materialize", "Memoize", "Result Cache",
            "ModifyTable", "Insert", "Update", "Delete", "Merge");

    private static final Pattern OPERATOR_START = Pattern.compile(
            "^(?:->\\s*)?((?:(?:Parallel|Partial|Finalize)\\s+)?(?:"
                    + OPERATORS.stream()
                    .sorted(Comparator.comparingInt(String::length).reversed())
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|"))
                    + "))\\b(?![\\w ]*:)");

    private static final Pattern COST = Pattern.compile(
            "cost=([\\d.]+)\\.\\.([\\d.]+)(?:\\s+rows=(\\d+))?(?:\\s+width=(\\d+))?");
    private static final Pattern ACTUAL_TIME = Pattern.compile(
            "actual time=([\\d.]+)\\.\\.([\\d.]+)(?:\\s+rows=([\\d.]+))?(?:\\s+loops=(\\d+))?");
    private static final Pattern ACTUAL_ROWS_ONLY = Pattern.compile(
            "actual rows=([\\d.]+)(?:\\s+loops=(\\d+))?");
    private static final Pattern PLANNED_ROWS = Pattern.compile("cost=[^)]*?\\brows=(\\d+)");
    private static final Pattern ACTUAL_ROWS_ANYWHERE = Pattern.compile("actual[^)]*?\\brows=([\\d.]+)");
    private static final Pattern RELATION = Pattern.compile("\\bon\\s+([\\w.\"$]+)");
    private static final Pattern INDEX = Pattern.compile("\\busing\\s+([\\w.\"$]+)");

    private static final Pattern PLANNING_TIME = Pattern.compile("^Planning(?: Time)?:\\s*([\\d.]+)\\s*ms");
    private static final Pattern EXECUTION_TIME = Pattern.compile("^Execution(?: Time)?:\\s*([\\d.]+)\\s*ms");
    private static final Pattern TRIGGER = Pattern.compile("^Trigger\\s+(.+?):\\s+time=([\\d.]+)\\s+calls=(\\d+)");
    private static final Pattern SECTION_HEADER = Pattern.compile("^(?:Planning|JIT):\\s*$");

    private static final Pattern SHARED_BUFFERS = Pattern.compile("\\bshared((?:\\s+\\w+=\\d+)+)");
    private static final Pattern TEMP_BUFFERS = Pattern.compile("\\btemp((?:\\s+\\w+=\\d+)+)");
    private static final Pattern COUNTER = Pattern.compile("(\\w+)=(\\d+)");

    private static final Pattern NOISE = Pattern.compile("^(?:QUERY PLAN|-+|\\(\\d+ rows?\\))$");

    private static final List<String> PREDICATE_PREFIXES = List.of(
            "Index Cond:", "Recheck Cond:", "Hash Cond:", "Merge Cond:", "Join Filter:", "Filter:");

    /**
     * True when the first meaningful line of {@code text} is a plan operator, so
     * plans without cost or timing annotations are still recognized.
     */
    public static boolean startsWithOperator(String text) {
        if (text == null) {
            return false;
        }
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || NOISE.matcher(trimmed).matches()) {
                continue;
            }
            return OPERATOR_START.matcher(trimmed).find();
        }
        return false;
    }

    public PostgresPlan parse(String text) {
        if (text == null || text.isBlank()) {
            return PostgresPlan.unrecognized();
        }
        try {
            return doParse(text);
        } catch (RuntimeException e) {
            log.warn("Failed to parse PostgreSQL plan: {}", e.getMessage());
            log.debug("Parse failure details", e);
            return PostgresPlan.unrecognized();
        }
    }

    private PostgresPlan doParse(String text) {
        List<NodeDraft> drafts = new ArrayList<>();
        Deque<int[]> open = new ArrayDeque<>();
        List<RawTiming> timings = new ArrayList<>();
        Double planningTime = null;
        Double executionTime = null;
        boolean inSection = false;

        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || NOISE.matcher(trimmed).matches()) {
                continue;
            }

            Matcher planning = PLANNING_TIME.matcher(trimmed);
            if (planning.find()) {
                planningTime = Double.parseDouble(planning.group(1));
                timings.add(new RawTiming("Planning", planningTime, null));
                inSection = false;
                continue;
            }
            Matcher execution = EXECUTION_TIME.matcher(trimmed);
            if (execution.find()) {
                executionTime = Double.parseDouble(execution.group(1));
                timings.add(new RawTiming("Execution", executionTime, null));
                inSection = false;
                continue;
            }
            Matcher trigger = TRIGGER.matcher(trimmed);
            if (trigger.find()) {
                timings.add(new RawTiming("Trigger " + trigger.group(1),
                        Double.parseDouble(trigger.group(2)), Integer.parseInt(trigger.group(3))));
                continue;
            }
            if (SECTION_HEADER.matcher(trimmed).matches()) {
                inSection = true;
                continue;
            }

            if (isOperationLine(trimmed)) {
                inSection = false;
                int depth = indentation(line);
                while (!open.isEmpty() && open.peek()[0] >= depth) {
                    open.pop();
                }
                int parentId = open.isEmpty() ? PlanNode.NO_PARENT : open.peek()[1];

                NodeDraft draft = new NodeDraft(drafts.size(), parentId, depth, line);
                readOperation(draft, trimmed);
                drafts.add(draft);
                if (parentId != PlanNode.NO_PARENT) {
                    drafts.get(parentId).children.add(draft.id);
                }
                open.push(new int[]{depth, draft.id});
                continue;
            }

            if (!inSection && !drafts.isEmpty()) {
                NodeDraft last = drafts.get(drafts.size() - 1);
                last.detailLines.add(trimmed);
                if (trimmed.startsWith("Buffers:")) {
                    last.buffers = parseBuffers(trimmed);
                }
            }
        }

        repairRows(drafts);

        List<PlanNode> nodes = drafts.stream().map(NodeDraft::toNode).collect(Collectors.toList());
        ParseOutcome outcome;
        if (!nodes.isEmpty()) {
            outcome = ParseOutcome.PARSED;
        } else {
            outcome = timings.isEmpty() ? ParseOutcome.UNRECOGNIZED : ParseOutcome.EMPTY;
        }
        log.debug("Parsed {} PostgreSQL plan nodes", nodes.size());

        return PostgresPlan.builder()
                .outcome(outcome)
                .nodes(nodes)
                .timings(toTimings(timings))
                .planningTimeMs(planningTime)
                .executionTimeMs(executionTime)
                .build();
    }

    static boolean isOperationLine(String trimmed) {
        return trimmed.contains("cost=") || OPERATOR_START.matcher(trimmed).find();
    }

    static BufferStats parseBuffers(String line) {
        Map<String, Long> shared = counters(SHARED_BUFFERS, line);
        Map<String, Long> temp = counters(TEMP_BUFFERS, line);
        return new BufferStats(
                shared.getOrDefault("hit", 0L),
                shared.getOrDefault("read", 0L),
                shared.getOrDefault("dirtied", 0L),
                shared.getOrDefault("written", 0L),
                temp.getOrDefault("read", 0L),
                temp.getOrDefault("written", 0L));
    }

    private static Map<String, Long> counters(Pattern segment, String line) {
        Map<String, Long> values = new HashMap<>();
        Matcher matcher = segment.matcher(line);
        if (matcher.find()) {
            Matcher counter = COUNTER.matcher(matcher.group(1));
            while (counter.find()) {
                values.put(counter.group(1), Long.parseLong(counter.group(2)));
            }
        }
        return values;
    }

    private static int indentation(String line) {
        int depth = 0;
        while (depth < line.length() && Character.isWhitespace(line.charAt(depth))) {
            depth++;
        }
        return depth;
    }

    private static void readOperation(NodeDraft draft, String trimmed) {
        String operation = trimmed.startsWith("->") ? trimmed.substring(2).trim() : trimmed;
        int annotations = operation.indexOf('(');
        String head = (annotations >= 0 ? operation.substring(0, annotations) : operation).trim();
        draft.operation = head;

        Matcher operator = OPERATOR_START.matcher(operation);
        if (operator.find()) {
            draft.nodeType = operator.group(1);
        } else {
            draft.nodeType = head.split("\\s+(?:on|using)\\s+")[0].trim();
        }

        Matcher relation = RELATION.matcher(head);
        if (relation.find()) {
            draft.relationName = relation.group(1);
        }
        Matcher index = INDEX.matcher(head);
        if (index.find()) {
            draft.indexName = index.group(1);
        }

        Matcher cost = COST.matcher(operation);
        if (cost.find()) {
            draft.cost = new PostgresCost(Double.parseDouble(cost.group(1)), Double.parseDouble(cost.group(2)));
            draft.estimatedRows = cost.group(3) != null ? Double.parseDouble(cost.group(3)) : null;
            draft.width = cost.group(4) != null ? Integer.parseInt(cost.group(4)) : null;
        }

        Matcher actual = ACTUAL_TIME.matcher(operation);
        if (actual.find()) {
            draft.actualTime = new TimeRange(Double.parseDouble(actual.group(1)), Double.parseDouble(actual.group(2)));
            draft.actualRows = actual.group(3) != null ? Double.parseDouble(actual.group(3)) : null;
            draft.loops = actual.group(4) != null ? Integer.parseInt(actual.group(4)) : null;
        } else {
            Matcher rowsOnly = ACTUAL_ROWS_ONLY.matcher(operation);
            if (rowsOnly.find()) {
                draft.actualRows = Double.parseDouble(rowsOnly.group(1));
                draft.loops = rowsOnly.group(2) != null ? Integer.parseInt(rowsOnly.group(2)) : null;
            }
        }
        draft.neverExecuted = operation.contains("(never executed)");
    }

    /**
     * Re-reads rows from each node's own raw line for nodes the first pass left without them.
     */
    private static void repairRows(List<NodeDraft> drafts) {
        for (NodeDraft draft : drafts) {
            if (draft.estimatedRows == null) {
                Matcher planned = PLANNED_ROWS.matcher(draft.rawText);
                if (planned.find()) {
                    draft.estimatedRows = Double.parseDouble(planned.group(1));
                }
            }
            if (draft.actualRows == null && !draft.neverExecuted) {
                Matcher actual = ACTUAL_ROWS_ANYWHERE.matcher(draft.rawText);
                if (actual.find()) {
                    draft.actualRows = Double.parseDouble(actual.group(1));
                }
            }
        }
    }

    private static List<QueryTiming> toTimings(List<RawTiming> raw) {
        double total = raw.stream().mapToDouble(RawTiming::timeMs).sum();
        return raw.stream()
                .map(t -> new QueryTiming(t.name(), t.timeMs(), total > 0 ? t.timeMs() / total * 100.0 : 0.0, t.calls()))
                .sorted(Comparator.comparingDouble(QueryTiming::timeMs).reversed())
                .collect(Collectors.toList());
    }

    private record RawTiming(String name, double timeMs, Integer calls) {
    }

    private static final class NodeDraft {
        final int id;
        final int parentId;
        final int indentation;
        final String rawText;
        final List<Integer> children = new ArrayList<>();
        final List<String> detailLines = new ArrayList<>();

        String operation;
        String nodeType;
        String relationName;
        String indexName;
        PostgresCost cost;
        Double estimatedRows;
        Integer width;
        TimeRange actualTime;
        Double actualRows;
        Integer loops;
        boolean neverExecuted;
        BufferStats buffers;

        NodeDraft(int id, int parentId, int indentation, String rawText) {
            this.id = id;
            this.parentId = parentId;
            this.indentation = indentation;
            this.rawText = rawText;
        }

        PlanNode toNode() {
            return PlanNode.builder()
                    .id(id)
                    .parentId(parentId)
                    .physicalOp(nodeType)
                    .logicalOp(operation)
                    .estimatedRows(estimatedRows)
                    .actualRows(actualRows)
                    .cost(cost)
                    .objectName(relationName)
                    .indexName(indexName)
                    .predicate(predicate())
                    .children(children)
                    .details(PostgresNodeDetails.builder()
                            .nodeType(nodeType)
                            .rawText(rawText)
                            .indentation(indentation)
                            .width(width)
                            .actualTime(actualTime)
                            .loops(loops)
                            .neverExecuted(neverExecuted)
                            .buffers(buffers)
                            .detailLines(detailLines)
                            .build())
                    .build();
        }

        private String predicate() {
            for (String prefix : PREDICATE_PREFIXES) {
                for (String line : detailLines) {
                    if (line.startsWith(prefix)) {
                        return line.substring(prefix.length()).trim();
                    }
                }
            }
            return null;
        }
    }
}
