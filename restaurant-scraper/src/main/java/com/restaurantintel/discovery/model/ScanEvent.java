package com.restaurantintel.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One line of the scan event log. Only the fields relevant to the event type are set.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanEvent {

    public static final String SCAN_START = "scan_start";
    public static final String RESTAURANT_FOUND = "restaurant_found";
    public static final String ZONE_SCAN_COMPLETE = "zone_scan_complete";

    String type;
    Instant timestamp;
    String zoneId;

    // scan_start
    Integer scanPoints;

    // restaurant_found
    String googlePlaceId;
    String name;
    String menuUrl;

    // zone_scan_complete
    Integer scanId;
    Integer newFound;
    Integer totalDiscovered;
    Boolean likelyComplete;

    public static ScanEvent scanStart(String zoneId, int scanPoints) {
        return ScanEvent.builder()
                .type(SCAN_START)
                .timestamp(Instant.now())
                .zoneId(zoneId)
                .scanPoints(scanPoints)
                .build();
    }

    public static ScanEvent restaurantFound(DiscoveredEntity entity) {
        return ScanEvent.builder()
                .type(RESTAURANT_FOUND)
                .timestamp(Instant.now())
                .zoneId(entity.getZoneId())
                .googlePlaceId(entity.getGooglePlaceId())
                .name(entity.getName())
                .menuUrl(entity.getMenuUrl())
                .build();
    }

    public static ScanEvent zoneScanComplete(Zone zone) {
        return ScanEvent.builder()
                .type(ZONE_SCAN_COMPLETE)
                .timestamp(Instant.now())
                .zoneId(zone.getZoneId())
                .scanId(zone.getScanCount())
                .newFound(zone.getLastScanNewFound())
                .totalDiscovered(zone.getTotalDiscovered())
                .likelyComplete(zone.isLikelyComplete())
                .build();
    }
}
