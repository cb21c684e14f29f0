package com.trainrelay.pipeline;

import java.util.Map;

import com.trainrelay.pipeline.ProgressEvent.Stage;

public class RunFailedException extends IllegalStateException {
    private final Stage stage;
    private final Map<String, String> unitErrors;
    private final RunSummary summary;

    public RunFailedException(Stage stage, String message, Map<String, String> unitErrors, RunSummary summary, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.unitErrors = unitErrors == null ? Map.of() : Map.copyOf(unitErrors);
        this.summary = summary;
    }

    public Stage stage() {
        return stage;
    }

    public Map<String, String> unitErrors() {
        return unitErrors;
    }

    public RunSummary summary() {
        return summary;
    }
}
