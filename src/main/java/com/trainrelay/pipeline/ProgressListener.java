package com.trainrelay.pipeline;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = event -> {
    };

    void onEvent(ProgressEvent event);
}
