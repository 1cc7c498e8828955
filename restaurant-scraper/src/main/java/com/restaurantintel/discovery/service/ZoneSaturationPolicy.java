package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.config.DiscoveryProperties;
import com.restaurantintel.discovery.model.Zone;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Updates a zone's telemetry at the end of its scan pass.
 *
 * A zone is flagged likely_complete when its two most recent passes each found
 * fewer new places than the threshold. The flag is advisory: zones marked
 * complete are still scanned.
 */
@Component
public class ZoneSaturationPolicy {

    private final int threshold;
    private final int historySize;

    @Autowired
    public ZoneSaturationPolicy(DiscoveryProperties properties) {
        this(properties.getScan().getSaturationThreshold(), properties.getScan().getHistorySize());
    }

    public ZoneSaturationPolicy(int threshold, int historySize) {
        this.threshold = threshold;
        this.historySize = Math.max(2, historySize);
    }

    public void applyScanResult(Zone zone, int newFound, int totalDiscovered, Instant scannedAt) {
        zone.setScanCount(zone.getScanCount() + 1);
        zone.setLastScannedAt(scannedAt);
        zone.setLastScanNewFound(newFound);
        zone.setTotalDiscovered(totalDiscovered);

        List<Integer> history = new ArrayList<>(zone.getRecentNewFound() != null ? zone.getRecentNewFound() : List.of());
        history.add(newFound);
        while (history.size() > historySize) {
            history.remove(0);
        }
        zone.setRecentNewFound(history);
        zone.setLikelyComplete(isSaturated(history));
    }

    boolean isSaturated(List<Integer> history) {
        if (history.size() < 2) return false;
        int last = history.get(history.size() - 1);
        int previous = history.get(history.size() - 2);
        return last < threshold && previous < threshold;
    }
}
