package com.trainrelay.support;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.trainrelay.execution.ExecutionService;
import com.trainrelay.execution.JobStatus;

/**
 * Scripted execution service. Status scripts are keyed by unit id and attempt; the last
 * scripted status repeats. Unscripted jobs complete on their first poll.
 */
public class FakeExecutionService implements ExecutionService {
    private final Map<String, Integer> submitFailures = new HashMap<>();
    private final Map<String, List<JobStatus>> statusScripts = new HashMap<>();
    private final Map<String, String> keysByHandle = new LinkedHashMap<>();
    private final Map<String, Integer> pollsByHandle = new HashMap<>();
    private final List<String> submittedNames = new ArrayList<>();
    private final List<String> cancelled = new ArrayList<>();
    private final List<String> statusFailures = new ArrayList<>();
    private int submitCalls;
    private int counter;

    public synchronized FakeExecutionService failSubmissions(String unitId, int times) {
        submitFailures.put(unitId, times);
        return this;
    }

    public synchronized FakeExecutionService script(String unitId, int attempt, JobStatus... statuses) {
        statusScripts.put(key(unitId, attempt), List.of(statuses));
        return this;
    }

    public synchronized FakeExecutionService failNextStatus(String unitId) {
        statusFailures.add(unitId);
        return this;
    }

    @Override
    public synchronized String submit(String jobName, Map<String, Object> parameters, Map<String, String> tags) throws IOException {
        submitCalls++;
        String unitId = tags.get("unit_id");
        int remainingFailures = submitFailures.getOrDefault(unitId, 0);
        if (remainingFailures > 0) {
            submitFailures.put(unitId, remainingFailures - 1);
            throw new IOException("execution service unavailable for " + unitId);
        }
        String handle = "job-" + (++counter);
        keysByHandle.put(handle, key(unitId, Integer.parseInt(tags.get("attempt"))));
        submittedNames.add(jobName);
        return handle;
    }

    @Override
    public synchronized JobStatus status(String handle) throws IOException {
        String key = keysByHandle.get(handle);
        if (key == null) {
            throw new IOException("unknown handle " + handle);
        }
        String unitId = key.substring(0, key.lastIndexOf('#'));
        if (statusFailures.remove(unitId)) {
            throw new IOException("status lookup failed for " + handle);
        }
        List<JobStatus> script = statusScripts.getOrDefault(key, List.of(JobStatus.COMPLETED));
        int poll = pollsByHandle.merge(handle, 1, Integer::sum) - 1;
        return script.get(Math.min(poll, script.size() - 1));
    }

    @Override
    public synchronized void cancel(String handle) {
        cancelled.add(handle);
    }

    public synchronized int submitCalls() {
        return submitCalls;
    }

    public synchronized List<String> submittedNames() {
        return List.copyOf(submittedNames);
    }

    public synchronized List<String> cancelled() {
        return List.copyOf(cancelled);
    }

    public synchronized int polls(String handle) {
        return pollsByHandle.getOrDefault(handle, 0);
    }

    private static String key(String unitId, int attempt) {
        return unitId + "#" + attempt;
    }
}
