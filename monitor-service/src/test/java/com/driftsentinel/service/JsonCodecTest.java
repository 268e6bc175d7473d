package com.driftsentinel.service;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertKind;
import com.driftsentinel.core.model.RetrainDecision;
import com.driftsentinel.core.model.RetrainReason;
import com.driftsentinel.core.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonCodec}.
 */
class JsonCodecTest {

    private final JsonCodec codec = new JsonCodec();

    @Test
    @DisplayName("Should decode a prediction request and ignore unknown fields")
    void shouldReadPredictionRequest() throws IOException {
        String json = "{\"text\":\"great\",\"requestId\":42,\"result\":{\"sentiment\":\"Positive\","
                + "\"confidence\":0.9,\"scores\":{\"Negative\":0.05,\"Neutral\":0.05,\"Positive\":0.9},"
                + "\"model\":\"roberta\"}}";

        PredictionRequest request = codec.readPredictionRequest(stream(json));

        assertThat(request.getText()).isEqualTo("great");
        assertThat(request.getResult().getSentiment()).isEqualTo("Positive");
        assertThat(request.getResult().getConfidence()).isEqualTo(0.9);
        assertThat(request.getResult().getScores()).containsEntry("Neutral", 0.05);
    }

    @Test
    @DisplayName("Should fail on malformed JSON")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> codec.readPredictionRequest(stream("{\"text\": ")))
                .isInstanceOf(JsonProcessingException.class);
    }

    @Test
    @DisplayName("Should report unserializable values as an I/O failure")
    void shouldWrapSerializationFailure() {
        assertThatThrownBy(() -> codec.toJson(new Object()))
                .isInstanceOf(UncheckedIOException.class)
                .isNotInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(JsonProcessingException.class)
                .hasMessageContaining("Object");
    }

    @Test
    @DisplayName("Should write instants as ISO-8601 strings")
    void shouldWriteIsoInstants() throws IOException {
        Alert alert = Alert.builder()
                .kind(AlertKind.CONFIDENCE_DROP)
                .severity(Severity.WARNING)
                .timestamp(Instant.parse("2024-03-01T12:00:00Z"))
                .metricValue(0.25)
                .threshold(0.2)
                .message("drop")
                .build();

        JsonNode node = codec.mapper().readTree(codec.toJson(alert));

        assertThat(node.get("timestamp").asText()).isEqualTo("2024-03-01T12:00:00Z");
        assertThat(node.get("kind").asText()).isEqualTo("CONFIDENCE_DROP");
        assertThat(node.get("metricValue").asDouble()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Should write retrain reasons by their code")
    void shouldWriteRetrainReasonCode() throws IOException {
        RetrainDecision decision = new RetrainDecision(true, RetrainReason.STALENESS, "stale",
                Instant.parse("2024-03-01T12:00:00Z"), 0);

        JsonNode node = codec.mapper().readTree(codec.toJson(decision));

        assertThat(node.get("shouldRetrain").asBoolean()).isTrue();
        assertThat(node.get("reason").asText()).isEqualTo("staleness");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
