package com.trainrelay.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.trainrelay.pipeline.ProgressEvent.Stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressEventLogTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendOneJsonLinePerEvent() throws IOException {
        Path path = tempDir.resolve("events/progress.jsonl");
        ProgressEventLog log = new ProgressEventLog(path);

        log.onEvent(new ProgressEvent("run-1", "U1", Stage.SUBMISSION, "job-1", Instant.parse("2026-01-01T00:00:00Z")));
        log.onEvent(new ProgressEvent("run-1", ProgressEvent.RUN_SCOPE, Stage.RUN, "succeeded", Instant.parse("2026-01-01T01:00:00Z")));

        List<String> lines = Files.readAllLines(path);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"stage\":\"SUBMISSION\""), lines.get(0));

        List<ProgressEvent> events = log.readAll();
        assertEquals("U1", events.get(0).unitId());
        assertEquals(Instant.parse("2026-01-01T01:00:00Z"), events.get(1).timestamp());
    }

    @Test
    void shouldNotInterruptTheRunWhenTheLogCannotBeWritten() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        ProgressEventLog log = new ProgressEventLog(blocker.resolve("progress.jsonl"));

        log.onEvent(new ProgressEvent("run-1", "U1", Stage.SELECTION, "selected", Instant.EPOCH));

        assertTrue(log.readAll().isEmpty());
    }
}
