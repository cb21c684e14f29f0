package com.trainrelay.execution;

import java.io.IOException;
import java.util.List;
import java.util.Map;

public class SubmissionAbortedException extends IOException {
    private final Map<String, String> failedUnits;
    private final List<String> cancelledHandles;

    public SubmissionAbortedException(Map<String, String> failedUnits, List<String> cancelledHandles) {
        super("Batch submission aborted: failedUnits=" + failedUnits.keySet() + " cancelledHandles=" + cancelledHandles.size());
        this.failedUnits = Map.copyOf(failedUnits);
        this.cancelledHandles = List.copyOf(cancelledHandles);
    }

    public Map<String, String> failedUnits() {
        return failedUnits;
    }

    public List<String> cancelledHandles() {
        return cancelledHandles;
    }
}
