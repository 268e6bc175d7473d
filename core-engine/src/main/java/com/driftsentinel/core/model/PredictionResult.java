package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw output of the external sentiment classifier.
 *
 * <p>
 * Mirrors the classifier contract
 * {@code {sentiment, confidence, scores: {Negative, Neutral, Positive}}}.
 * Instances are <strong>not</strong> validated: the monitor checks the shape
 * on ingestion and rejects malformed results with a
 * {@link ValidationException}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictionResult {

    private String sentiment;

    /** Boxed so that a missing value can be told apart from 0. */
    private Double confidence;

    private Map<String, Double> scores;

    /** No-arg constructor required by Jackson. */
    public PredictionResult() {
    }

    public PredictionResult(String sentiment, Double confidence, Map<String, Double> scores) {
        this.sentiment = sentiment;
        this.confidence = confidence;
        setScores(scores);
    }

    /**
     * Convenience factory for well-formed results built in code.
     *
     * @param label      predicted label
     * @param confidence confidence of the predicted label
     * @param negative   probability of {@link SentimentLabel#NEGATIVE}
     * @param neutral    probability of {@link SentimentLabel#NEUTRAL}
     * @param positive   probability of {@link SentimentLabel#POSITIVE}
     * @return a new result
     */
    public static PredictionResult of(SentimentLabel label, double confidence,
            double negative, double neutral, double positive) {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put(SentimentLabel.NEGATIVE.getDisplayName(), negative);
        scores.put(SentimentLabel.NEUTRAL.getDisplayName(), neutral);
        scores.put(SentimentLabel.POSITIVE.getDisplayName(), positive);
        return new PredictionResult(label.getDisplayName(), confidence, scores);
    }

    public String getSentiment() {
        return sentiment;
    }

    public void setSentiment(String sentiment) {
        this.sentiment = sentiment;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    /**
     * @return unmodifiable view of the score vector, or {@code null} if absent
     */
    public Map<String, Double> getScores() {
        return scores != null ? Collections.unmodifiableMap(scores) : null;
    }

    public void setScores(Map<String, Double> scores) {
        this.scores = scores != null ? new LinkedHashMap<>(scores) : null;
    }

    @Override
    public String toString() {
        return "PredictionResult{" +
                "sentiment='" + sentiment + '\'' +
                ", confidence=" + confidence +
                ", scores=" + scores +
                '}';
    }
}
