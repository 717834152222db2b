package com.analyticshub.common.decision;

import com.analyticshub.common.consensus.AggregationMethod;
import com.analyticshub.common.consensus.ConfidenceWeighting;
import com.analyticshub.common.consensus.ConsensusOptions;
import com.analyticshub.common.json.JsonSupport;
import com.analyticshub.common.model.TimeWindow;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionRecordBuilderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final TimeWindow WINDOW =
        new TimeWindow(Instant.parse("2026-03-01T00:00:00Z"), Instant.parse("2026-03-01T06:00:00Z"));

    private final DecisionRecordBuilder builder = new DecisionRecordBuilder(Clock.fixed(NOW, ZoneOffset.UTC));

    @Nested
    @DisplayName("inputs hash")
    class HashTests {

        @Test
        @DisplayName("16 lowercase hex characters")
        void format() {
            assertTrue(InputsHasher.hash(Map.of("a", 1)).matches("[0-9a-f]{16}"));
        }

        @Test
        @DisplayName("map key order does not change the hash")
        void keyOrderIndependent() {
            Map<String, Object> ab = new LinkedHashMap<>();
            ab.put("a", 1);
            ab.put("b", List.of(1, 2));
            Map<String, Object> ba = new LinkedHashMap<>();
            ba.put("b", List.of(1, 2));
            ba.put("a", 1);
            assertEquals(InputsHasher.hash(ab), InputsHasher.hash(ba));
        }

        @Test
        @DisplayName("different payloads hash differently")
        void contentSensitive() {
            assertNotEquals(InputsHasher.hash(Map.of("a", 1)), InputsHasher.hash(Map.of("a", 2)));
        }

        @Test
        @DisplayName("unserializable payload → IllegalArgumentException, no agent-specific code")
        void unserializablePayload() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputsHasher.hash(Map.of("opaque", new Object())));
            assertTrue(ex.getMessage().startsWith("Input payload is not serializable"));
        }
    }

    @Test
    @DisplayName("record copies identity, hashes inputs and stamps the clock")
    void buildsRecord() {
        DecisionRecord<Map<String, Object>> record = builder.build(
            AgentIdentity.consensus("1.0.0"),
            Map.of("signals", List.of()),
            Map.of("consensusValue", 12.0),
            0.55,
            List.of(ConstraintApplied.forConsensus(WINDOW, ConsensusOptions.defaults())),
            "exec-1");

        assertEquals("consensus-agent", record.agentId());
        assertEquals("1.0.0", record.agentVersion());
        assertEquals("analytics_consensus_summary", record.decisionType());
        assertEquals(InputsHasher.hash(Map.of("signals", List.of())), record.inputsHash());
        assertEquals(0.55, record.confidence());
        assertEquals("exec-1", record.executionRef());
        assertEquals(NOW, record.timestamp());
    }

    @Test
    @DisplayName("serializes with snake_case keys and an ISO-8601 timestamp")
    void snakeCaseJson() throws Exception {
        DecisionRecord<String> record = builder.build(
            AgentIdentity.strategicRecommendation("1.0.0"), "in", "out", 0.4,
            List.of(ConstraintApplied.forStrategicAnalysis(WINDOW, List.of("observatory"), 0.5)), "exec-2");

        JsonNode json = JsonSupport.mapper().valueToTree(record);

        assertEquals("strategic-recommendation-agent", json.get("agent_id").asText());
        assertEquals("strategic_recommendation_summary", json.get("decision_type").asText());
        assertEquals("exec-2", json.get("execution_ref").asText());
        assertEquals("2026-03-01T12:00:00Z", json.get("timestamp").asText());
        assertTrue(json.has("inputs_hash"));
        assertTrue(json.get("constraints_applied").isArray());
    }

    @Nested
    @DisplayName("constraints")
    class ConstraintTests {

        @Test
        @DisplayName("consensus without scope filter → scope 'all', no layers, band [threshold, 1]")
        void consensusAllScope() {
            ConstraintApplied c = ConstraintApplied.forConsensus(WINDOW, ConsensusOptions.defaults());

            assertEquals("all", c.scope());
            assertNull(c.dataBoundaries().layers());
            assertEquals(WINDOW.startTime(), c.dataBoundaries().startTime());
            assertEquals(0.6, c.confidenceBands().lower());
            assertEquals(1.0, c.confidenceBands().upper());
            assertEquals(0.6, c.minAgreementThreshold());
        }

        @Test
        @DisplayName("consensus with scope filter → comma-joined scope and layers")
        void consensusScoped() {
            ConsensusOptions opts = new ConsensusOptions(AggregationMethod.MEAN, ConfidenceWeighting.UNIFORM,
                                                         0.75, List.of("observatory", "cost-ops"), true);
            ConstraintApplied c = ConstraintApplied.forConsensus(WINDOW, opts);

            assertEquals("observatory,cost-ops", c.scope());
            assertEquals(List.of("observatory", "cost-ops"), c.dataBoundaries().layers());
            assertEquals(0.75, c.confidenceBands().lower());
        }

        @Test
        @DisplayName("strategic → 'strategic-analysis' scope, source layers, minConfidence band")
        void strategic() {
            ConstraintApplied c = ConstraintApplied.forStrategicAnalysis(WINDOW, List.of("governance"), 0.3);

            assertEquals("strategic-analysis", c.scope());
            assertEquals(List.of("governance"), c.dataBoundaries().layers());
            assertEquals(0.3, c.confidenceBands().lower());
            assertNull(c.minAgreementThreshold());
        }
    }
}
