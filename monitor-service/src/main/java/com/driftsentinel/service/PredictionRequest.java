package com.driftsentinel.service;

import com.driftsentinel.core.model.PredictionResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code POST /predictions}: the classified text and the classifier
 * output for it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictionRequest {

    private String text;
    private PredictionResult result;

    public PredictionRequest() {
    }

    public PredictionRequest(String text, PredictionResult result) {
        this.text = text;
        this.result = result;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public PredictionResult getResult() {
        return result;
    }

    public void setResult(PredictionResult result) {
        this.result = result;
    }
}
