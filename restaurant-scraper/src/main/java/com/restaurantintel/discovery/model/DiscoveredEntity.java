package com.restaurantintel.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A discovered restaurant, created once at first discovery and never re-enriched.
 *
 * Schema notes:
 *  - googlePlaceId is the dedup key and is unique across all zones
 *  - zoneId is the first zone that found the place; later zones never take it over
 *  - menuUrl is null when the crawl found nothing, which is a normal outcome
 *  - rating / reviewsCount / priceLevel are null when the details call omitted them
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscoveredEntity {

    // ── Identity ────────────────────────────────────────────────────────────
    String googlePlaceId;
    String name;

    // ── Location ────────────────────────────────────────────────────────────
    Double latitude;
    Double longitude;

    @JsonProperty("address_full")
    String formattedAddress;

    /** UK postcode, e.g. "W1F 0RN" */
    String postcode;
    String locality;

    // ── Classification ──────────────────────────────────────────────────────
    String cuisine;
    List<String> categories;

    // ── Details ─────────────────────────────────────────────────────────────
    String website;
    Double rating;
    Integer reviewsCount;

    /** 0 (free) to 4 (very expensive) */
    Integer priceLevel;

    String menuUrl;
    String heroImageUrl;
    List<String> imageUrls;

    // ── Metadata ────────────────────────────────────────────────────────────
    String zoneId;
    Instant discoveredAt;
}
