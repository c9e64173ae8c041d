package org.carball.planlens.parser;

/**
 * Known wrappings around an engine-native payload. Exactly one applies to a given string.
 */
public enum Envelope {
    /** JSON object with a {@code plan} field (string or object). */
    PLAN_FIELD,
    /** JSON object with {@code result.value} holding base64-encoded JSON. */
    BASE64_RESULT_VALUE,
    /** EXPLAIN output split into rows keyed {@code QUERY PLAN...}. */
    QUERY_PLAN_ROWS,
    /** Literal backslash-u escapes standing in for angle brackets. */
    UNICODE_ESCAPED,
    /** HTML entities standing in for angle brackets. */
    HTML_ESCAPED,
    NONE
}
