package com.driftsentinel.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single observed prediction: the atomic unit held by the observation
 * window.
 *
 * <p>
 * Immutable. The score vector is copied into an {@link EnumMap} on
 * construction and exposed read-only. Range checks (confidence in [0, 1],
 * scores summing to 1) are <em>not</em> performed here; they run when the
 * record is appended to a window.
 * </p>
 *
 * @since 1.0.0
 */
public final class PredictionRecord {

    /** Longest text prefix retained on a record. */
    public static final int MAX_TEXT_LENGTH = 200;

    private final Instant timestamp;
    private final String text;
    private final String fingerprint;
    private final SentimentLabel label;
    private final double confidence;
    private final Map<SentimentLabel, Double> scores;

    private PredictionRecord(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        String fullText = builder.text != null ? builder.text : "";
        this.text = fullText.length() > MAX_TEXT_LENGTH ? fullText.substring(0, MAX_TEXT_LENGTH) : fullText;
        this.fingerprint = fingerprintOf(fullText);
        this.label = builder.label;
        this.confidence = builder.confidence;
        EnumMap<SentimentLabel, Double> copy = new EnumMap<>(SentimentLabel.class);
        copy.putAll(builder.scores);
        this.scores = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Convert a raw classifier result into a record.
     *
     * <p>
     * Fails on structural problems only: a missing or unknown label, a missing
     * confidence, a missing score vector, or score keys that are not one of
     * the three sentiment labels.
     * </p>
     *
     * @param timestamp observation time; must not be {@code null}
     * @param text      the classified text
     * @param result    the classifier output
     * @return a new record
     * @throws ValidationException if {@code result} is structurally malformed
     */
    public static PredictionRecord fromResult(Instant timestamp, String text, PredictionResult result) {
        if (result == null) {
            throw new ValidationException("Prediction result must not be null");
        }
        List<String> errors = new ArrayList<>();

        SentimentLabel label = null;
        if (result.getSentiment() == null) {
            errors.add("'sentiment' is required");
        } else {
            label = SentimentLabel.fromName(result.getSentiment()).orElse(null);
            if (label == null) {
                errors.add("Unknown sentiment label '" + result.getSentiment() + "'");
            }
        }
        if (result.getConfidence() == null) {
            errors.add("'confidence' is required");
        }

        Map<SentimentLabel, Double> scores = new EnumMap<>(SentimentLabel.class);
        if (result.getScores() == null) {
            errors.add("'scores' is required");
        } else {
            for (Map.Entry<String, Double> entry : result.getScores().entrySet()) {
                SentimentLabel scoreLabel = SentimentLabel.fromName(entry.getKey()).orElse(null);
                if (scoreLabel == null) {
                    errors.add("Unknown score label '" + entry.getKey() + "'");
                } else if (entry.getValue() == null) {
                    errors.add("Score for " + scoreLabel + " must not be null");
                } else if (scores.put(scoreLabel, entry.getValue()) != null) {
                    errors.add("Duplicate score label " + scoreLabel + " ('" + entry.getKey() + "')");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Malformed prediction result", errors);
        }

        return builder()
                .timestamp(timestamp)
                .text(text)
                .label(label)
                .confidence(result.getConfidence())
                .scores(scores)
                .build();
    }

    /**
     * Fluent builder for {@link PredictionRecord}. Only {@code timestamp} is
     * required at build time.
     */
    public static class Builder {
        private Instant timestamp;
        private String text;
        private SentimentLabel label;
        private double confidence;
        private final Map<SentimentLabel, Double> scores = new EnumMap<>(SentimentLabel.class);

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder label(SentimentLabel label) {
            this.label = label;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder score(SentimentLabel label, double score) {
            this.scores.put(Objects.requireNonNull(label, "label must not be null"), score);
            return this;
        }

        public Builder scores(Map<SentimentLabel, Double> scores) {
            this.scores.clear();
            if (scores != null) {
                this.scores.putAll(scores);
            }
            return this;
        }

        /**
         * @return a new {@link PredictionRecord}
         * @throws NullPointerException if {@code timestamp} is {@code null}
         */
        public PredictionRecord build() {
            return new PredictionRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the classified text, truncated to {@value #MAX_TEXT_LENGTH}
     *         characters
     */
    public String getText() {
        return text;
    }

    /**
     * @return lowercase hex SHA-256 of the full, untruncated text
     */
    public String getFingerprint() {
        return fingerprint;
    }

    /**
     * @return the predicted label, or {@code null} if the record was built
     *         without one (rejected on append)
     */
    public SentimentLabel getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * @return unmodifiable score vector keyed by label
     */
    public Map<SentimentLabel, Double> getScores() {
        return scores;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String fingerprintOf(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PredictionRecord that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(fingerprint, that.fingerprint)
                && label == that.label
                && Objects.equals(scores, that.scores);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, fingerprint, label, confidence, scores);
    }

    @Override
    public String toString() {
        return "PredictionRecord{" +
                "timestamp=" + timestamp +
                ", label=" + label +
                ", confidence=" + confidence +
                ", scores=" + scores +
                '}';
    }
}
