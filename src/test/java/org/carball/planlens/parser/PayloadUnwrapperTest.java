package org.carball.planlens.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

public class PayloadUnwrapperTest {

    @Test
    public void shouldDecodeUnicodeEscapesInsidePlanField() {
        // Given
        String payload = "{\"plan\": \"\\u003cRelOp PhysicalOp=\\\"X\\\"\\u003e\"}";

        // When
        String unwrapped = PayloadUnwrapper.unwrap(payload);

        // Then
        assertThat(unwrapped).isEqualTo("<RelOp PhysicalOp=\"X\">");
    }

    @Test
    public void shouldReplaceLiteralUnicodeEscapesOutsideJson() {
        // Given
        String payload = "\\u003cShowPlanXML\\u003e\\u003c/ShowPlanXML\\u003e";

        // When
        String unwrapped = PayloadUnwrapper.unwrap(payload);

        // Then
        assertThat(unwrapped).isEqualTo("<ShowPlanXML></ShowPlanXML>");
        assertThat(PayloadUnwrapper.classifyEnvelope(payload)).isEqualTo(Envelope.UNICODE_ESCAPED);
    }

    @Test
    public void shouldRecurseIntoNestedPlanString() {
        // Given
        String inner = "{\"plan\": \"<RelOp NodeId=\\\"0\\\"/>\"}";
        String payload = new ObjectMapper().createObjectNode().put("plan", inner).toString();

        // When
        String unwrapped = PayloadUnwrapper.unwrap(payload);

        // Then
        assertThat(unwrapped).isEqualTo("<RelOp NodeId=\"0\"/>");
    }

    @Test
    public void shouldDecodeBase64ResultValue() {
        // Given
        String innerJson = "{\"plan\": \"Seq Scan on orders  (cost=0.00..10.00 rows=100 width=8)\"}";
        String encoded = Base64.getEncoder().encodeToString(innerJson.getBytes(StandardCharsets.UTF_8));
        String payload = "{\"result\": {\"value\": \"" + encoded + "\"}}";

        // When
        String unwrapped = PayloadUnwrapper.unwrap(payload);

        // Then
        assertThat(PayloadUnwrapper.classifyEnvelope(payload)).isEqualTo(Envelope.BASE64_RESULT_VALUE);
        assertThat(unwrapped).isEqualTo("Seq Scan on orders  (cost=0.00..10.00 rows=100 width=8)");
    }

    @Test
    public void shouldFallThroughWhenResultValueIsNotBase64() {
        // Given
        String payload = "{\"result\": {\"value\": \"%%% not base64 %%%\"}}";

        // When
        String unwrapped = PayloadUnwrapper.unwrap(payload);

        // Then
        assertThat(unwrapped).isEqualTo(payload);
    }

    @Test
    public void shouldDecodeHtmlEntitiesWhenNoMarkupPresent() {
        // Given
        String payload = "&lt;RelOp PhysicalOp=&quot;Sort&quot;&gt;";

        // When
        String unwrapped = PayloadUnwrapper.unwrap(payload);

        // Then
        assertThat(unwrapped).isEqualTo("<RelOp PhysicalOp=\"Sort\">");
    }

    @Test
    public void shouldKeepEntitiesInsideRealMarkup() {
        // Given
        String payload = "<ScalarOperator ScalarString=\"[a] &lt; (5)\"/>";

        // When
        String unwrapped = PayloadUnwrapper.unwrap(payload);

        // Then
        assertThat(unwrapped).isEqualTo(payload);
    }

    @Test
    public void shouldJoinQueryPlanRowsInNumericOrder() {
        // Given
        String payload = """
            {
              "QUERY PLAN_10": "Execution Time: 0.100 ms",
              "QUERY PLAN_2": "  ->  Seq Scan on orders  (cost=0.00..1.00 rows=1 width=4)",
              "QUERY PLAN_1": "Limit  (cost=0.00..1.00 rows=1 width=4)"
            }
            """;

        // When
        String unwrapped = PayloadUnwrapper.unwrap(payload);

        // Then
        assertThat(PayloadUnwrapper.classifyEnvelope(payload)).isEqualTo(Envelope.QUERY_PLAN_ROWS);
        assertThat(unwrapped).isEqualTo("""
            Limit  (cost=0.00..1.00 rows=1 width=4)
              ->  Seq Scan on orders  (cost=0.00..1.00 rows=1 width=4)
            Execution Time: 0.100 ms""");
    }

    @Test
    public void shouldJoinQueryPlanRowArray() {
        // Given
        String payload = "[{\"QUERY PLAN\": \"Result  (cost=0.00..0.01 rows=1 width=4)\"},"
                + " {\"QUERY PLAN\": \"Planning Time: 0.020 ms\"}]";

        // When
        String unwrapped = PayloadUnwrapper.unwrap(payload);

        // Then
        assertThat(unwrapped).isEqualTo("Result  (cost=0.00..0.01 rows=1 width=4)\nPlanning Time: 0.020 ms");
    }

    @Test
    public void shouldReturnInvalidJsonUnchanged() {
        // Given
        String payload = "{\"plan\": \"unterminated";

        // When
        String unwrapped = PayloadUnwrapper.unwrap(payload);

        // Then
        assertThat(unwrapped).isEqualTo(payload);
        assertThat(PayloadUnwrapper.classifyEnvelope(payload)).isEqualTo(Envelope.NONE);
    }

    @Test
    public void shouldTreatNullAsEmpty() {
        assertThat(PayloadUnwrapper.unwrap(null)).isEmpty();
        assertThat(PayloadUnwrapper.classifyEnvelope(null)).isEqualTo(Envelope.NONE);
    }
}
