package org.carball.planlens.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Strips transport wrapping from diagnostic payloads and returns engine-native text.
 * Every step is best-effort: a step that fails falls through to the next one, and
 * the worst case is the input returned unchanged.
 */
@Slf4j
public final class PayloadUnwrapper {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String PLAN_FIELD = "plan";
    private static final String QUERY_PLAN_COLUMN = "QUERY PLAN";
    private static final String ESCAPED_LT = "\\u003c";
    private static final String ESCAPED_GT = "\\u003e";
    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)\\D*$");

    // envelopes nested deeper than this are left alone
    private static final int MAX_DEPTH = 4;

    private PayloadUnwrapper() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the innermost engine-native text of the payload. Never throws; a
     * null payload yields an empty string.
     */
    public static String unwrap(String payload) {
        return unwrap(payload, 0);
    }

    /**
     * Tells which envelope wraps the payload at its outermost level.
     */
    public static Envelope classifyEnvelope(String payload) {
        if (payload == null || payload.isBlank()) {
            return Envelope.NONE;
        }
        return classify(readJson(payload), payload);
    }

    private static String unwrap(String payload, int depth) {
        if (payload == null) {
            return "";
        }

        JsonNode json = readJson(payload);
        Envelope envelope = classify(json, payload);
        log.debug("Payload envelope at depth {}: {}", depth, envelope);

        switch (envelope) {
            case PLAN_FIELD:
                if (depth < MAX_DEPTH) {
                    return unwrapPlanField(json.get(PLAN_FIELD), depth);
                }
                break;
            case BASE64_RESULT_VALUE:
                if (depth < MAX_DEPTH) {
                    String decoded = decodeResultValue(json.path("result").path("value").asText());
                    if (decoded != null) {
                        return unwrap(decoded, depth + 1);
                    }
                }
                break;
            case QUERY_PLAN_ROWS:
                return joinQueryPlanRows(json);
            default:
                break;
        }

        return decodeEscapes(payload);
    }

    private static Envelope classify(JsonNode json, String payload) {
        if (json != null && json.isObject()) {
            if (json.hasNonNull(PLAN_FIELD)) {
                return Envelope.PLAN_FIELD;
            }
            if (json.path("result").path("value").isTextual()) {
                return Envelope.BASE64_RESULT_VALUE;
            }
        }
        if (json != null && hasQueryPlanRows(json)) {
            return Envelope.QUERY_PLAN_ROWS;
        }
        if (payload.contains(ESCAPED_LT) || payload.contains(ESCAPED_GT)) {
            return Envelope.UNICODE_ESCAPED;
        }
        if (isHtmlEscaped(payload)) {
            return Envelope.HTML_ESCAPED;
        }
        return Envelope.NONE;
    }

    private static String unwrapPlanField(JsonNode plan, int depth) {
        if (plan.isTextual()) {
            return unwrap(plan.asText(), depth + 1);
        }
        if (hasQueryPlanRows(plan)) {
            return joinQueryPlanRows(plan);
        }
        return plan.toString();
    }

    /**
     * Decodes {@code result.value} and returns its text when it is JSON carrying a plan.
     */
    private static String decodeResultValue(String value) {
        try {
            String decoded = new String(Base64.getMimeDecoder().decode(value), StandardCharsets.UTF_8);
            JsonNode inner = readJson(decoded);
            if (inner != null && inner.hasNonNull(PLAN_FIELD)) {
                return decoded;
            }
            log.debug("Decoded result.value does not carry a plan field");
        } catch (IllegalArgumentException e) {
            log.debug("result.value is not valid base64: {}", e.getMessage());
        }
        return null;
    }

    /**
     * Joins EXPLAIN rows back into plain text. Accepts an object whose keys start
     * with {@code QUERY PLAN} (ordered by their trailing number) or an array of
     * {@code {"QUERY PLAN": "..."}} rows.
     */
    static String joinQueryPlanRows(JsonNode json) {
        List<String> lines = new ArrayList<>();
        if (json.isArray()) {
            for (JsonNode row : json) {
                lines.add(row.path(QUERY_PLAN_COLUMN).asText());
            }
        } else {
            List<Map.Entry<String, JsonNode>> rows = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().startsWith(QUERY_PLAN_COLUMN)) {
                    rows.add(field);
                }
            }
            rows.sort(Comparator.comparingLong(entry -> rowNumber(entry.getKey())));
            lines = rows.stream()
                    .map(entry -> entry.getValue().asText())
                    .collect(Collectors.toList());
        }
        return String.join("\n", lines);
    }

    private static boolean hasQueryPlanRows(JsonNode json) {
        if (json.isArray()) {
            if (json.isEmpty()) {
                return false;
            }
            for (JsonNode row : json) {
                if (!row.path(QUERY_PLAN_COLUMN).isTextual()) {
                    return false;
                }
            }
            return true;
        }
        if (json.isObject()) {
            Iterator<String> names = json.fieldNames();
            while (names.hasNext()) {
                if (names.next().startsWith(QUERY_PLAN_COLUMN)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static long rowNumber(String key) {
        Matcher matcher = TRAILING_NUMBER.matcher(key);
        return matcher.find() ? Long.parseLong(matcher.group(1)) : Long.MAX_VALUE;
    }

    private static String decodeEscapes(String text) {
        if (text.contains(ESCAPED_LT) || text.contains(ESCAPED_GT)) {
            return text.replace(ESCAPED_LT, "<").replace(ESCAPED_GT, ">");
        }
        if (isHtmlEscaped(text)) {
            return text.replace("&lt;", "<")
                    .replace("&gt;", ">")
                    .replace("&quot;", "\"")
                    .replace("&apos;", "'")
                    .replace("&amp;", "&");
        }
        return text;
    }

    // Entities inside real markup (e.g. a predicate "a &lt; 5") must survive.
    private static boolean isHtmlEscaped(String text) {
        return text.indexOf('<') < 0 && (text.contains("&lt;") || text.contains("&gt;"));
    }

    private static JsonNode readJson(String text) {
        String trimmed = text.strip();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return null;
        }
        try {
            return MAPPER.readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.debug("Payload looks like JSON but does not parse: {}", e.getOriginalMessage());
            return null;
        }
    }
}
