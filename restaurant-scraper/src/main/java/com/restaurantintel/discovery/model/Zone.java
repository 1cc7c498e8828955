package com.restaurantintel.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A configured geographic region subject to repeated scanning.
 *
 * Identity fields (zone_id, centre, radius) come from configuration.
 * The telemetry fields are rewritten once per zone per run, after the
 * zone's scan pass has accounted for every search result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Zone {

    // ── Identity ────────────────────────────────────────────────────────────
    private String zoneId;
    private String zoneName;
    private double centerLat;
    private double centerLng;
    private double radiusMeters;

    // ── Scan telemetry ──────────────────────────────────────────────────────
    private int scanCount;
    private Instant lastScannedAt;
    private int lastScanNewFound;

    /** Always equals the number of known entities owned by this zone */
    private int totalDiscovered;

    /** Most recent new-entity counts, oldest first */
    @Builder.Default
    private List<Integer> recentNewFound = new ArrayList<>();

    private boolean likelyComplete;

    @JsonIgnore
    public GeoPoint getCenter() {
        return new GeoPoint(centerLat, centerLng);
    }
}
