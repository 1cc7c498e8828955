package com.restaurantintel.discovery.output;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.restaurantintel.discovery.config.DiscoveryProperties;
import com.restaurantintel.discovery.model.Zone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and rewrites the ordered zone list (zones.json). Missing or malformed
 * storage reads as "no zones".
 */
@Component
@Slf4j
public class ZoneStore {

    private static final TypeReference<List<Zone>> ZONES_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path zonesFile;

    @Autowired
    public ZoneStore(ObjectMapper objectMapper, DiscoveryProperties properties) {
        this(objectMapper, Paths.get(properties.getStorage().getDataDir(), properties.getStorage().getZonesFile()));
    }

    ZoneStore(ObjectMapper objectMapper, Path zonesFile) {
        this.objectMapper = objectMapper;
        this.zonesFile = zonesFile;
    }

    public List<Zone> load() {
        if (!Files.exists(zonesFile)) {
            return new ArrayList<>();
        }
        try {
            List<Zone> zones = objectMapper.readValue(zonesFile.toFile(), ZONES_TYPE);
            if (zones == null) return new ArrayList<>();
            List<Zone> valid = new ArrayList<>(zones.stream()
                    .filter(Objects::nonNull)
                    .filter(z -> z.getZoneId() != null && !z.getZoneId().isBlank())
                    .toList());
            if (valid.size() < zones.size()) {
                log.warn("Ignored {} zone entries without a zone_id in {}", zones.size() - valid.size(), zonesFile);
            }
            return valid;
        } catch (IOException e) {
            log.warn("Zones file {} unreadable, treating as empty: {}", zonesFile, e.getMessage());
            return new ArrayList<>();
        }
    }

    public void persist(List<Zone> zones) {
        try {
            AtomicFileWriter.write(zonesFile, writer ->
                    objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, zones));
            log.debug("Persisted {} zones to {}", zones.size(), zonesFile);
        } catch (IOException e) {
            log.error("Failed to persist zones {}: {}", zonesFile, e.getMessage(), e);
            throw new UncheckedIOException("Zones write failed", e);
        }
    }
}
