package com.analyticshub.common.model;

import com.analyticshub.common.json.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalValueJsonTest {

    private final ObjectMapper mapper = JsonSupport.mapper();

    @Test
    @DisplayName("JSON number decodes to a numeric value")
    void numericDecode() throws Exception {
        Signal signal = mapper.readValue("""
            {"signalId":"s1","sourceLayer":"observatory","timestamp":"2026-03-01T00:00:00Z",
             "metricType":"latency","value":12.5,"confidence":0.9}
            """, Signal.class);

        assertTrue(signal.value().isNumeric());
        assertEquals(12.5, signal.value().asNumber());
        assertEquals(Instant.parse("2026-03-01T00:00:00Z"), signal.timestamp());
    }

    @Test
    @DisplayName("JSON object decodes to a structured value preserving key order; 'layer' is accepted")
    void structuredDecode() throws Exception {
        Signal signal = mapper.readValue("""
            {"signalId":"s2","layer":"governance","timestamp":"2026-03-01T00:00:00Z",
             "value":{"z":1,"a":{"nested":true}},"confidence":0.4}
            """, Signal.class);

        assertEquals("governance", signal.sourceLayer());
        SignalValue.Structured value = assertInstanceOf(SignalValue.Structured.class, signal.value());
        assertEquals(List.of("z", "a"), List.copyOf(value.fields().keySet()));
    }

    @Test
    @DisplayName("string value is rejected")
    void stringRejected() {
        assertThrows(MismatchedInputException.class, () -> mapper.readValue("""
            {"signalId":"s3","sourceLayer":"observatory","timestamp":"2026-03-01T00:00:00Z",
             "value":"high","confidence":0.4}
            """, Signal.class));
    }

    @Test
    @DisplayName("values serialize back to their plain JSON shape")
    void encode() {
        JsonNode numeric = mapper.valueToTree(SignalValue.numeric(3.0));
        JsonNode structured = mapper.valueToTree(SignalValue.structured(Map.of("status", "ok")));

        assertTrue(numeric.isNumber());
        assertEquals(3.0, numeric.asDouble());
        assertEquals("ok", structured.get("status").asText());
    }

    @Test
    @DisplayName("structured value has no numeric reading")
    void structuredAsNumber() {
        assertThrows(IllegalStateException.class, () -> SignalValue.structured(Map.of()).asNumber());
    }
}
