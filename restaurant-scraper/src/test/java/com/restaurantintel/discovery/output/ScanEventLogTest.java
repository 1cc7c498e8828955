package com.restaurantintel.discovery.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.restaurantintel.discovery.model.DiscoveredEntity;
import com.restaurantintel.discovery.model.ScanEvent;
import com.restaurantintel.discovery.model.Zone;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScanEventLogTest {

    @TempDir
    Path dataDir;

    private Path eventsFile;
    private ScanEventLog eventLog;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        eventsFile = dataDir.resolve("logs").resolve("scan_events.jsonl");
        eventLog = new ScanEventLog(objectMapper, eventsFile);
    }

    @Test
    void appendsOneJsonObjectPerLine() throws Exception {
        eventLog.reset();
        eventLog.append(ScanEvent.scanStart("soho", 13));
        eventLog.append(ScanEvent.restaurantFound(DiscoveredEntity.builder()
                .googlePlaceId("p1").name("Bao").zoneId("soho").menuUrl("https://bao.example/menu").build()));

        List<String> lines = Files.readAllLines(eventsFile);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("\"type\":\"scan_start\"", "\"zone_id\":\"soho\"", "\"scan_points\":13")
                .doesNotContain("google_place_id");
        assertThat(lines.get(1)).contains("\"type\":\"restaurant_found\"", "\"menu_url\":\"https://bao.example/menu\"");
    }

    @Test
    void resetTruncatesPreviousRun() {
        eventLog.append(ScanEvent.scanStart("soho", 13));
        eventLog.reset();
        eventLog.append(ScanEvent.zoneScanComplete(Zone.builder()
                .zoneId("soho").scanCount(2).lastScanNewFound(0).totalDiscovered(5).likelyComplete(true).build()));

        List<ScanEvent> events = eventLog.readAll();

        assertThat(events).hasSize(1);
        ScanEvent complete = events.get(0);
        assertThat(complete.getType()).isEqualTo(ScanEvent.ZONE_SCAN_COMPLETE);
        assertThat(complete.getScanId()).isEqualTo(2);
        assertThat(complete.getTotalDiscovered()).isEqualTo(5);
        assertThat(complete.getLikelyComplete()).isTrue();
        assertThat(complete.getTimestamp()).isNotNull();
    }

    @Test
    void readSkipsMalformedTail() throws Exception {
        eventLog.append(ScanEvent.scanStart("soho", 13));
        Files.writeString(eventsFile, "{\"type\":\"restaurant_fo", StandardOpenOption.APPEND);

        assertThat(eventLog.readAll()).extracting(ScanEvent::getType).containsExactly(ScanEvent.SCAN_START);
    }

    @Test
    void missingLogReadsEmpty() {
        assertThat(eventLog.readAll()).isEmpty();
    }
}
