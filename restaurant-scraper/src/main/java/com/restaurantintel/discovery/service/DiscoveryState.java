package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.model.DiscoveredEntity;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The set of already-known places, keyed by Google place id.
 *
 * Owned by a single pipeline run, which is its only writer. Insertion order is
 * discovery order and is preserved through persistence.
 */
public class DiscoveryState {

    private final Map<String, DiscoveredEntity> entities;

    public DiscoveryState() {
        this.entities = new LinkedHashMap<>();
    }

    public DiscoveryState(Map<String, DiscoveredEntity> entities) {
        this.entities = new LinkedHashMap<>(entities);
    }

    public boolean contains(String placeId) {
        return entities.containsKey(placeId);
    }

    /**
     * @throws IllegalStateException if the id is already known; callers check {@link #contains} first
     */
    public void record(DiscoveredEntity entity) {
        Objects.requireNonNull(entity.getGooglePlaceId(), "googlePlaceId");
        if (entities.containsKey(entity.getGooglePlaceId())) {
            throw new IllegalStateException("Place already recorded: " + entity.getGooglePlaceId());
        }
        entities.put(entity.getGooglePlaceId(), entity);
    }

    public int size() {
        return entities.size();
    }

    public int countInZone(String zoneId) {
        return (int) entities.values().stream()
                .filter(e -> Objects.equals(zoneId, e.getZoneId()))
                .count();
    }

    public List<DiscoveredEntity> entitiesInZone(String zoneId) {
        return entities.values().stream()
                .filter(e -> Objects.equals(zoneId, e.getZoneId()))
                .toList();
    }

    public Collection<DiscoveredEntity> entities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    public Map<String, DiscoveredEntity> asMap() {
        return Collections.unmodifiableMap(entities);
    }
}
