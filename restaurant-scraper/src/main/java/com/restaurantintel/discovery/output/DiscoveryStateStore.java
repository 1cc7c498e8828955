package com.restaurantintel.discovery.output;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.restaurantintel.discovery.config.DiscoveryProperties;
import com.restaurantintel.discovery.model.DiscoveredEntity;
import com.restaurantintel.discovery.service.DiscoveryState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists the known-places map as a single JSON object keyed by place id.
 *
 * A missing or unreadable file loads as an empty state, so a first run
 * (or a run after the file was damaged) starts from scratch instead of failing.
 */
@Component
@Slf4j
public class DiscoveryStateStore {

    private static final TypeReference<LinkedHashMap<String, DiscoveredEntity>> STATE_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path stateFile;

    @Autowired
    public DiscoveryStateStore(ObjectMapper objectMapper, DiscoveryProperties properties) {
        this(objectMapper, Paths.get(properties.getStorage().getDataDir(), properties.getStorage().getStateFile()));
    }

    DiscoveryStateStore(ObjectMapper objectMapper, Path stateFile) {
        this.objectMapper = objectMapper;
        this.stateFile = stateFile;
    }

    public DiscoveryState load() {
        if (!Files.exists(stateFile)) {
            log.info("No discovery state at {} — starting empty", stateFile);
            return new DiscoveryState();
        }
        try {
            Map<String, DiscoveredEntity> entities = objectMapper.readValue(stateFile.toFile(), STATE_TYPE);
            if (entities == null) {
                return new DiscoveryState();
            }
            entities.values().removeIf(e -> e == null || e.getGooglePlaceId() == null);
            log.info("Loaded {} known places from {}", entities.size(), stateFile);
            return new DiscoveryState(entities);
        } catch (IOException e) {
            log.warn("Discovery state {} unreadable, starting empty: {}", stateFile, e.getMessage());
            return new DiscoveryState();
        }
    }

    public void persist(DiscoveryState state) {
        try {
            AtomicFileWriter.write(stateFile, writer ->
                    objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, state.asMap()));
            log.info("Persisted {} known places to {}", state.size(), stateFile);
        } catch (IOException e) {
            log.error("Failed to persist discovery state {}: {}", stateFile, e.getMessage(), e);
            throw new UncheckedIOException("Discovery state write failed", e);
        }
    }
}
