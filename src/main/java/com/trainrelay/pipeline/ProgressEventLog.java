package com.trainrelay.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class ProgressEventLog implements ProgressListener {
    private static final Logger log = LoggerFactory.getLogger(ProgressEventLog.class);

    private final Path eventLogPath;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public ProgressEventLog(Path eventLogPath) {
        this.eventLogPath = eventLogPath;
    }

    @Override
    public synchronized void onEvent(ProgressEvent event) {
        try {
            append(event);
        } catch (IOException e) {
            log.warn("progress.append.failed path={} run={} unit={} reason={}", eventLogPath, event.runId(), event.unitId(), e.getMessage());
        }
    }

    public void append(ProgressEvent event) throws IOException {
        if (eventLogPath.getParent() != null) {
            Files.createDirectories(eventLogPath.getParent());
        }
        String line = mapper.writeValueAsString(event) + System.lineSeparator();
        Files.writeString(eventLogPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public List<ProgressEvent> readAll() throws IOException {
        if (!Files.exists(eventLogPath)) {
            return List.of();
        }
        List<ProgressEvent> events = new ArrayList<>();
        for (String line : Files.readAllLines(eventLogPath)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            events.add(mapper.readValue(line, ProgressEvent.class));
        }
        return events;
    }
}
