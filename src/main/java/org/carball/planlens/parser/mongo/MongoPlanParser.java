package org.carball.planlens.parser.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.planlens.model.mongo.MongoExecutionSummary;
import org.carball.planlens.model.mongo.MongoPlan;
import org.carball.planlens.model.mongo.MongoServerInfo;
import org.carball.planlens.model.mongo.MongoStageDetails;
import org.carball.planlens.model.mongo.MongoStageExecution;
import org.carball.planlens.model.mongo.RejectedPlan;
import org.carball.planlens.model.plan.ParseOutcome;
import org.carball.planlens.model.plan.PlanNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses MongoDB explain output, either as JSON or as Markdown with one JSON
 * object per {@code ## Section}. Stage trees are built from
 * {@code inputStage}/{@code inputStages} and enriched with per-stage execution
 * counters when a matching execution stage exists.
 */
@Slf4j
public class MongoPlanParser {

    static final String UNKNOWN_STAGE = "UNKNOWN";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern SECTION_HEADER = Pattern.compile("(?m)^\\s*##\\s*(.+?)\\s*$");
    private static final int MAX_DEPTH = 256;
    private static final Map<String, String> SECTION_KEYS = Map.of(
            "query planner", "queryPlanner",
            "execution stats", "executionStats",
            "server info", "serverInfo");

    public MongoPlan parse(String text) {
        if (text == null || text.isBlank()) {
            return MongoPlan.unrecognized();
        }
        try {
            JsonNode root = SECTION_HEADER.matcher(text).find() ? readSections(text) : readDocument(text);
            if (root == null || !root.isObject()) {
                log.debug("MongoDB explain payload is not a JSON object");
                return MongoPlan.unrecognized();
            }
            return toPlan(normalize(root));
        } catch (RuntimeException e) {
            log.warn("Failed to parse MongoDB explain output: {}", e.getMessage());
            log.debug("Parse failure details", e);
            return MongoPlan.unrecognized();
        }
    }

    private MongoPlan toPlan(JsonNode root) {
        JsonNode queryPlanner = root.path("queryPlanner");
        JsonNode executionStats = root.path("executionStats");

        List<JsonNode> executionStages = new ArrayList<>();
        flatten(executionStats.path("executionStages"), executionStages, 0);
        for (JsonNode planExecution : executionStats.path("allPlansExecution")) {
            flatten(planExecution.path("executionStages"), executionStages, 0);
        }

        List<PlanNode> nodes = buildTree(planRoot(queryPlanner.path("winningPlan")), executionStages);

        List<RejectedPlan> rejected = new ArrayList<>();
        int index = 0;
        for (JsonNode plan : queryPlanner.path("rejectedPlans")) {
            rejected.add(new RejectedPlan(index++, buildTree(planRoot(plan), executionStages)));
        }

        ParseOutcome outcome;
        if (nodes.isEmpty() && queryPlanner.isObject()) {
            // planner section without a winning plan still gets a typed root
            nodes = List.of(unknownStage());
            outcome = ParseOutcome.EMPTY;
        } else if (!nodes.isEmpty()) {
            outcome = ParseOutcome.PARSED;
        } else {
            outcome = queryPlanner.isMissingNode() && executionStats.isMissingNode()
                    ? ParseOutcome.UNRECOGNIZED : ParseOutcome.EMPTY;
        }
        log.debug("Parsed {} MongoDB winning plan stages and {} rejected plans", nodes.size(), rejected.size());

        return MongoPlan.builder()
                .outcome(outcome)
                .namespace(queryPlanner.path("namespace").asText(""))
                .nodes(nodes)
                .rejectedPlans(rejected)
                .executionSummary(executionSummary(executionStats))
                .serverInfo(serverInfo(root.path("serverInfo")))
                .build();
    }

    /**
     * Accepts the shapes seen in the wild: a full explain document, a bare
     * queryPlanner, or a bare winning plan stage.
     */
    private static JsonNode normalize(JsonNode root) {
        if (root.has("queryPlanner") || root.has("executionStats")) {
            return root;
        }
        ObjectNode wrapped = MAPPER.createObjectNode();
        if (root.has("winningPlan")) {
            wrapped.set("queryPlanner", root);
        } else if (root.has("stage")) {
            wrapped.putObject("queryPlanner").set("winningPlan", root);
        } else {
            return root;
        }
        return wrapped;
    }

    /**
     * Slot-based execution engine plans nest the stage tree under {@code queryPlan}.
     */
    private static JsonNode planRoot(JsonNode plan) {
        return plan.has("queryPlan") ? plan.path("queryPlan") : plan;
    }

    private static List<PlanNode> buildTree(JsonNode root, List<JsonNode> executionStages) {
        if (root.isMissingNode() || !root.isObject()) {
            return List.of();
        }
        List<PlanNode.PlanNodeBuilder> builders = new ArrayList<>();
        Set<JsonNode> matched = Collections.newSetFromMap(new IdentityHashMap<>());
        addStage(root, PlanNode.NO_PARENT, builders, executionStages, matched, 0);

        List<PlanNode> nodes = new ArrayList<>();
        for (PlanNode.PlanNodeBuilder builder : builders) {
            nodes.add(builder.build());
        }
        return nodes;
    }

    private static int addStage(JsonNode stage, int parentId, List<PlanNode.PlanNodeBuilder> builders,
                                List<JsonNode> executionStages, Set<JsonNode> matched, int depth) {
        int id = builders.size();
        String stageName = stage.path("stage").asText(UNKNOWN_STAGE);
        String indexName = textOrNull(stage, "indexName");
        MongoStageExecution execution = findExecution(stageName, indexName, executionStages, matched);

        PlanNode.PlanNodeBuilder builder = PlanNode.builder()
                .id(id)
                .parentId(parentId)
                .physicalOp(stageName)
                .logicalOp(stageName)
                .actualRows(execution != null ? (double) execution.nReturned() : null)
                .indexName(indexName)
                .predicate(jsonOrNull(stage.get("filter")))
                .details(MongoStageDetails.builder()
                        .direction(textOrNull(stage, "direction"))
                        .keyPattern(jsonOrNull(stage.get("keyPattern")))
                        .multiKey(stage.has("isMultiKey") ? stage.get("isMultiKey").asBoolean() : null)
                        .limitAmount(stage.has("limitAmount") ? stage.get("limitAmount").asLong() : null)
                        .execution(execution)
                        .build());
        builders.add(builder);

        if (depth >= MAX_DEPTH) {
            log.warn("MongoDB stage tree deeper than {} levels, truncating", MAX_DEPTH);
            return id;
        }
        for (JsonNode child : children(stage)) {
            builder.child(addStage(child, id, builders, executionStages, matched, depth + 1));
        }
        return id;
    }

    private static PlanNode unknownStage() {
        return PlanNode.builder()
                .id(0)
                .parentId(PlanNode.NO_PARENT)
                .physicalOp(UNKNOWN_STAGE)
                .logicalOp(UNKNOWN_STAGE)
                .details(MongoStageDetails.builder().build())
                .build();
    }

    private static List<JsonNode> children(JsonNode stage) {
        List<JsonNode> children = new ArrayList<>();
        if (stage.path("inputStage").isObject()) {
            children.add(stage.get("inputStage"));
        }
        for (JsonNode child : stage.path("inputStages")) {
            if (child.isObject()) {
                children.add(child);
            }
        }
        return children;
    }

    private static void flatten(JsonNode stage, List<JsonNode> into, int depth) {
        if (!stage.isObject() || depth > MAX_DEPTH) {
            return;
        }
        into.add(stage);
        for (JsonNode child : children(stage)) {
            flatten(child, into, depth + 1);
        }
    }

    /**
     * First execution stage with the same stage name and index name that no
     * earlier plan stage has claimed.
     */
    private static MongoStageExecution findExecution(String stageName, String indexName,
                                                     List<JsonNode> executionStages, Set<JsonNode> matched) {
        for (JsonNode candidate : executionStages) {
            if (matched.contains(candidate)) {
                continue;
            }
            if (stageName.equals(candidate.path("stage").asText(UNKNOWN_STAGE))
                    && Objects.equals(indexName, textOrNull(candidate, "indexName"))) {
                matched.add(candidate);
                return new MongoStageExecution(
                        candidate.path("nReturned").asLong(0),
                        candidate.path("executionTimeMillisEstimate").asLong(0),
                        candidate.path("works").asLong(0),
                        candidate.path("advanced").asLong(0),
                        candidate.path("docsExamined").asLong(0),
                        candidate.path("keysExamined").asLong(0));
            }
        }
        return null;
    }

    private static MongoExecutionSummary executionSummary(JsonNode stats) {
        if (stats.isMissingNode()) {
            return MongoExecutionSummary.empty();
        }
        return new MongoExecutionSummary(
                stats.path("executionSuccess").asBoolean(false),
                stats.path("nReturned").asLong(0),
                stats.path("executionTimeMillis").asLong(0),
                stats.path("totalKeysExamined").asLong(0),
                stats.path("totalDocsExamined").asLong(0));
    }

    private static MongoServerInfo serverInfo(JsonNode info) {
        if (info.isMissingNode()) {
            return MongoServerInfo.empty();
        }
        return new MongoServerInfo(
                info.path("host").asText(""),
                info.path("port").asInt(0),
                info.path("version").asText(""));
    }

    private static JsonNode readDocument(String text) {
        JsonNode root = readJson(text.trim());
        if (root != null && root.isTextual()) {
            root = readJson(root.asText().trim());
        }
        if (root != null && root.isArray()) {
            root = root.size() > 0 ? root.get(0) : null;
        }
        return root;
    }

    /**
     * Splits Markdown explain output on {@code ##} headers and reads the JSON
     * object in each known section.
     */
    private static JsonNode readSections(String text) {
        ObjectNode root = MAPPER.createObjectNode();
        Matcher header = SECTION_HEADER.matcher(text);

        List<SectionHeader> sections = new ArrayList<>();
        while (header.find()) {
            sections.add(new SectionHeader(header.group(1), header.start(), header.end()));
        }
        for (int i = 0; i < sections.size(); i++) {
            SectionHeader current = sections.get(i);
            String key = sectionKey(current.title());
            if (key == null) {
                continue;
            }
            int bodyEnd = i + 1 < sections.size() ? sections.get(i + 1).start() : text.length();
            JsonNode section = readJson(braced(text.substring(current.end(), bodyEnd)));
            if (section == null || !section.isObject()) {
                log.debug("Section '{}' holds no readable JSON object", current.title());
                continue;
            }
            root.set(key, section.has(key) ? section.get(key) : section);
        }
        return root.isEmpty() ? readDocument(text) : root;
    }

    private record SectionHeader(String title, int start, int end) {
    }

    private static String sectionKey(String title) {
        String normalized = title.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : SECTION_KEYS.entrySet()) {
            if (normalized.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String braced(String body) {
        int start = body.indexOf('{');
        int end = body.lastIndexOf('}');
        return start >= 0 && end > start ? body.substring(start, end + 1) : "";
    }

    private static JsonNode readJson(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String jsonOrNull(JsonNode value) {
        return value != null && !value.isNull() ? value.toString() : null;
    }
}
