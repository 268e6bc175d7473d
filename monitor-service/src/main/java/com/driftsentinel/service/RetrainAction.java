package com.driftsentinel.service;

import com.driftsentinel.core.model.RetrainDecision;

/**
 * The work performed when a retrain is warranted: collecting fresh labelled
 * data, fine-tuning, validating and deploying a new model.
 */
@FunctionalInterface
public interface RetrainAction {

    /**
     * Run one retrain.
     *
     * @param decision the positive decision that triggered this run
     * @return identifier of the model version produced
     * @throws RuntimeException if the retrain fails; the run is recorded as
     *                          failed and the last-retrain time is not moved
     */
    String retrain(RetrainDecision decision);
}
