package com.arenasync.reconcile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Appends one JSON object per event to a log file.
 */
public class JsonLinesEventSink implements EventSink {
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path eventLogPath;
    private volatile boolean closed;

    public JsonLinesEventSink(Path eventLogPath) {
        this.eventLogPath = eventLogPath;
    }

    @Override
    public synchronized void record(SourceEvent event) throws IOException {
        if (closed) {
            throw new IOException("event sink is closed: " + eventLogPath);
        }
        if (eventLogPath.getParent() != null) {
            Files.createDirectories(eventLogPath.getParent());
        }
        String line = mapper.writeValueAsString(event) + System.lineSeparator();
        Files.writeString(eventLogPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public List<SourceEvent> readAll() throws IOException {
        if (!Files.exists(eventLogPath)) {
            return List.of();
        }
        List<SourceEvent> events = new ArrayList<>();
        for (String line : Files.readAllLines(eventLogPath)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            events.add(mapper.readValue(line, SourceEvent.class));
        }
        return events;
    }

    @Override
    public void close() {
        closed = true;
    }
}
