package com.driftsentinel.core.window;

import com.driftsentinel.core.model.PredictionRecord;
import com.driftsentinel.core.model.SentimentLabel;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, point-in-time copy of an {@link ObservationWindow}.
 *
 * <p>
 * Detectors and reporters compute over a snapshot so they never hold the
 * window lock while doing statistics. Records are in arrival order, oldest
 * first.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowSnapshot {

    private final List<PredictionRecord> records;
    private final Instant takenAt;

    public WindowSnapshot(List<PredictionRecord> records, Instant takenAt) {
        this.records = List.copyOf(Objects.requireNonNull(records, "records must not be null"));
        this.takenAt = Objects.requireNonNull(takenAt, "takenAt must not be null");
    }

    /**
     * @return unmodifiable records, oldest first
     */
    public List<PredictionRecord> getRecords() {
        return records;
    }

    public Instant getTakenAt() {
        return takenAt;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * @return count of records per label; every label present, possibly 0
     */
    public Map<SentimentLabel, Integer> labelCounts() {
        Map<SentimentLabel, Integer> counts = new EnumMap<>(SentimentLabel.class);
        for (SentimentLabel label : SentimentLabel.values()) {
            counts.put(label, 0);
        }
        for (PredictionRecord record : records) {
            counts.merge(record.getLabel(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * @return proportion of records per label (sums to 1), or all zeros when
     *         the snapshot is empty
     */
    public Map<SentimentLabel, Double> labelDistribution() {
        Map<SentimentLabel, Double> distribution = new EnumMap<>(SentimentLabel.class);
        int total = records.size();
        labelCounts().forEach((label, count) ->
                distribution.put(label, total == 0 ? 0.0 : (double) count / total));
        return distribution;
    }

    /**
     * @return confidences in chronological order
     */
    public double[] confidences() {
        double[] values = new double[records.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = records.get(i).getConfidence();
        }
        return values;
    }

    /**
     * @return mean confidence, or {@link Double#NaN} when empty
     */
    public double meanConfidence() {
        if (records.isEmpty()) {
            return Double.NaN;
        }
        double sum = 0;
        for (PredictionRecord record : records) {
            sum += record.getConfidence();
        }
        return sum / records.size();
    }
}
