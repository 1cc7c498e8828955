package com.restaurantintel.discovery.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.restaurantintel.discovery.config.DiscoveryProperties;
import com.restaurantintel.discovery.model.ScanEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only newline-delimited JSON log of pipeline progress.
 *
 * Reset at the start of each run. Readable while a run is in progress;
 * lines that fail to parse (e.g. a half-written tail) are skipped.
 * Write failures are logged and never interrupt the pipeline.
 */
@Component
@Slf4j
public class ScanEventLog {

    private final ObjectMapper objectMapper;
    private final Path eventsFile;

    @Autowired
    public ScanEventLog(ObjectMapper objectMapper, DiscoveryProperties properties) {
        this(objectMapper, Paths.get(properties.getStorage().getDataDir(), properties.getStorage().getEventsFile()));
    }

    ScanEventLog(ObjectMapper objectMapper, Path eventsFile) {
        this.objectMapper = objectMapper;
        this.eventsFile = eventsFile;
    }

    public synchronized void reset() {
        try {
            Files.createDirectories(eventsFile.toAbsolutePath().getParent());
            Files.writeString(eventsFile, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.warn("Could not reset scan event log {}: {}", eventsFile, e.getMessage());
        }
    }

    public synchronized void append(ScanEvent event) {
        try {
            String line = objectMapper.writeValueAsString(event) + System.lineSeparator();
            Files.createDirectories(eventsFile.toAbsolutePath().getParent());
            Files.writeString(eventsFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.warn("Could not append {} event to {}: {}", event.getType(), eventsFile, e.getMessage());
        }
    }

    public List<ScanEvent> readAll() {
        List<ScanEvent> events = new ArrayList<>();
        if (!Files.exists(eventsFile)) {
            return events;
        }
        try (BufferedReader reader = Files.newBufferedReader(eventsFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                try {
                    events.add(objectMapper.readValue(line, ScanEvent.class));
                } catch (JsonProcessingException e) {
                    log.debug("Skipping malformed event line: {}", line);
                }
            }
        } catch (IOException e) {
            log.warn("Could not read scan event log {}: {}", eventsFile, e.getMessage());
        }
        return events;
    }
}
