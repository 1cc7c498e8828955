package com.restaurantintel.discovery.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks a single pipeline run for the admin surface and the one-shot runner.
 *
 * Written by the pipeline thread only; status polls read it concurrently.
 */
@Data
@Builder
public class ScanRun {

    public enum Status { RUNNING, SUCCESS, PARTIAL, FAILED, INTERRUPTED }

    private String runId;           // UUID
    private String requestedZoneId; // null = all zones
    private Instant startedAt;
    private volatile Instant completedAt;
    private volatile Status status;
    private volatile int newFound;
    private volatile int failedZones;
    private volatile String errorMessage;    // null on success

    @Builder.Default
    private List<ZoneResult> zoneResults = new CopyOnWriteArrayList<>();

    public record ZoneResult(String zoneId, int scanId, int newFound,
                             int totalDiscovered, boolean likelyComplete) {

        public static ZoneResult of(Zone zone) {
            return new ZoneResult(zone.getZoneId(), zone.getScanCount(), zone.getLastScanNewFound(),
                    zone.getTotalDiscovered(), zone.isLikelyComplete());
        }
    }
}
