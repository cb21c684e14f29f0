package com.trainrelay.execution;

import java.io.IOException;
import java.util.Map;

public interface ExecutionService {
    String submit(String jobName, Map<String, Object> parameters, Map<String, String> tags) throws IOException;

    JobStatus status(String handle) throws IOException;

    void cancel(String handle) throws IOException;
}
