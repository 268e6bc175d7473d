package com.driftsentinel.core.window;

import com.driftsentinel.core.model.PredictionRecord;
import com.driftsentinel.core.model.SentimentLabel;
import com.driftsentinel.core.model.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Range checks applied to every record before it enters a window.
 *
 * <p>
 * Malformed records are rejected, never corrected.
 * </p>
 *
 * @since 1.0.0
 */
public final class PredictionValidator {

    /** Allowed deviation of the score sum from 1. */
    public static final double SCORE_SUM_TOLERANCE = 1e-3;

    private PredictionValidator() {
        // utility class
    }

    /**
     * @param record the record to check; must not be {@code null}
     * @throws ValidationException listing every failed check
     */
    public static void validate(PredictionRecord record) {
        Objects.requireNonNull(record, "PredictionRecord must not be null");
        List<String> errors = new ArrayList<>();

        if (record.getLabel() == null) {
            errors.add("Predicted label is required");
        }

        double confidence = record.getConfidence();
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            errors.add("Confidence must be in [0, 1], got: " + confidence);
        }

        double sum = 0;
        boolean complete = true;
        for (SentimentLabel label : SentimentLabel.values()) {
            Double score = record.getScores().get(label);
            if (score == null) {
                errors.add("Score for " + label + " is required");
                complete = false;
            } else if (!(score >= 0.0 && score <= 1.0)) {
                errors.add("Score for " + label + " must be in [0, 1], got: " + score);
                complete = false;
            } else {
                sum += score;
            }
        }
        if (complete && Math.abs(sum - 1.0) > SCORE_SUM_TOLERANCE) {
            errors.add(String.format("Scores must sum to 1 (tolerance %.0e), got: %.4f",
                    SCORE_SUM_TOLERANCE, sum));
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid prediction", errors);
        }
    }
}
