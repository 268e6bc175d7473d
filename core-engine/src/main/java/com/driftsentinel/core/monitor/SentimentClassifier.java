package com.driftsentinel.core.monitor;

import com.driftsentinel.core.model.PredictionResult;

import java.util.ArrayList;
import java.util.List;

/**
 * The external sentiment classification capability.
 *
 * <p>
 * Implementations wrap whatever model serves predictions. The monitor
 * receives one at construction and never creates or caches one itself.
 * </p>
 */
@FunctionalInterface
public interface SentimentClassifier {

    /**
     * @param text the text to classify
     * @return label, confidence and per-label scores
     */
    PredictionResult predict(String text);

    /**
     * Classify several texts, in order.
     *
     * @param texts texts to classify
     * @return one result per text
     */
    default List<PredictionResult> predictBatch(List<String> texts) {
        List<PredictionResult> results = new ArrayList<>(texts.size());
        for (String text : texts) {
            results.add(predict(text));
        }
        return results;
    }
}
