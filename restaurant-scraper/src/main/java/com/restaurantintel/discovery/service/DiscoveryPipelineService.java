package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.config.DiscoveryConfigurationException;
import com.restaurantintel.discovery.config.DiscoveryProperties;
import com.restaurantintel.discovery.config.ScanInProgressException;
import com.restaurantintel.discovery.model.DiscoveredEntity;
import com.restaurantintel.discovery.model.GeoPoint;
import com.restaurantintel.discovery.model.PlacesApiPlace;
import com.restaurantintel.discovery.model.ScanEvent;
import com.restaurantintel.discovery.model.ScanRun;
import com.restaurantintel.discovery.model.Zone;
import com.restaurantintel.discovery.output.CsvWriter;
import com.restaurantintel.discovery.output.DiscoveryStateStore;
import com.restaurantintel.discovery.output.ScanEventLog;
import com.restaurantintel.discovery.output.ZoneStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates a zone scan run.
 *
 * For each zone, for each planner point: search, skip places already known,
 * enrich the rest (details + menu crawl) and record them. Zone telemetry is
 * updated once the zone's points are exhausted. State, zones and the master CSV
 * are flushed at the end of the run, including runs that fail or are interrupted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiscoveryPipelineService {

    private final DiscoveryProperties properties;
    private final ScanPlanner planner;
    private final PlacesApiClient placesApiClient;
    private final MenuDiscoveryCrawler crawler;
    private final PlaceRecordMapper mapper;
    private final ZoneSaturationPolicy saturationPolicy;
    private final DiscoveryStateStore stateStore;
    private final ZoneStore zoneStore;
    private final ScanEventLog eventLog;
    private final CsvWriter csvWriter;

    private final AtomicReference<ScanRun> activeRun = new AtomicReference<>();
    private volatile ScanRun lastRun;

    /**
     * Scan every configured zone, or just one.
     *
     * @param zoneId zone to scan; null scans all zones in configured order
     * @throws DiscoveryConfigurationException if the API key is missing (nothing is touched)
     * @throws ScanInProgressException         if another run is active
     * @throws IllegalArgumentException        if zoneId names no configured zone
     */
    public ScanRun runScan(String zoneId) {
        validateConfiguration();
        List<Zone> zones = loadZones();
        List<Zone> targets = selectZones(zones, zoneId);

        ScanRun run = ScanRun.builder()
                .runId(UUID.randomUUID().toString())
                .requestedZoneId(zoneId)
                .startedAt(Instant.now())
                .status(ScanRun.Status.RUNNING)
                .build();
        if (!activeRun.compareAndSet(null, run)) {
            throw new ScanInProgressException(activeRun.get().getRunId());
        }

        try {
            execute(run, zones, targets);
            return run;
        } finally {
            lastRun = run;
            activeRun.set(null);
        }
    }

    public void validateConfiguration() {
        String key = properties.getApi().getKey();
        if (key == null || key.isBlank()) {
            throw new DiscoveryConfigurationException(
                    "Places API key missing. Set restaurant-discovery.api.key (GOOGLE_API_KEY).");
        }
    }

    /**
     * Zones as persisted, falling back to the configured seed zones.
     */
    public List<Zone> loadZones() {
        List<Zone> zones = zoneStore.load();
        if (zones.isEmpty() && !properties.getZones().isEmpty()) {
            log.info("No persisted zones — using {} configured seed zone(s)", properties.getZones().size());
            zones = new ArrayList<>(properties.getZones().stream()
                    .map(DiscoveryProperties.SeedZone::toZone)
                    .toList());
        }
        return zones;
    }

    public Optional<ScanRun> activeRun() {
        return Optional.ofNullable(activeRun.get());
    }

    public Optional<ScanRun> lastRun() {
        return Optional.ofNullable(lastRun);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<Zone> selectZones(List<Zone> zones, String zoneId) {
        if (zoneId == null || zoneId.isBlank()) {
            return zones;
        }
        List<Zone> selected = zones.stream().filter(z -> zoneId.equals(z.getZoneId())).toList();
        if (selected.isEmpty()) {
            throw new IllegalArgumentException("Unknown zone: " + zoneId);
        }
        return selected;
    }

    private void execute(ScanRun run, List<Zone> allZones, List<Zone> targets) {
        log.info("Scan run {} starting: {} zone(s)", run.getRunId(), targets.size());
        if (targets.isEmpty()) {
            log.warn("No zones configured — nothing to scan");
        }

        DiscoveryState state = stateStore.load();
        eventLog.reset();
        Set<String> attempted = new HashSet<>();

        try {
            for (Zone zone : targets) {
                if (Thread.currentThread().isInterrupted()) {
                    run.setStatus(ScanRun.Status.INTERRUPTED);
                    break;
                }
                try {
                    boolean completed = scanZone(zone, state, attempted, run);
                    if (!completed) {
                        run.setStatus(ScanRun.Status.INTERRUPTED);
                        break;
                    }
                } catch (RuntimeException e) {
                    log.error("Zone {} scan failed: {}", zone.getZoneId(), e.getMessage(), e);
                    run.setFailedZones(run.getFailedZones() + 1);
                    run.setErrorMessage(e.getMessage());
                }
            }

            if (run.getStatus() == ScanRun.Status.RUNNING) {
                run.setStatus(run.getFailedZones() == 0 ? ScanRun.Status.SUCCESS
                        : run.getFailedZones() < targets.size() ? ScanRun.Status.PARTIAL
                        : ScanRun.Status.FAILED);
            }

        } finally {
            flush(run, state, allZones);
            run.setCompletedAt(Instant.now());
            log.info("Scan run {} finished: status={}, new={}, known={}",
                    run.getRunId(), run.getStatus(), run.getNewFound(), state.size());
        }
    }

    /**
     * @return false if the pass was interrupted before every scan point was searched
     */
    private boolean scanZone(Zone zone, DiscoveryState state, Set<String> attempted, ScanRun run) {
        double subScanRadius = properties.getScan().getSubScanRadiusMeters();
        List<GeoPoint> points = planner.plan(zone.getCenter(), zone.getRadiusMeters(), subScanRadius);
        log.info("Zone {}: scanning {} point(s), radius {}m", zone.getZoneId(), points.size(), zone.getRadiusMeters());
        eventLog.append(ScanEvent.scanStart(zone.getZoneId(), points.size()));

        int newFound = 0;
        int pointIndex = 0;
        for (GeoPoint point : points) {
            pointIndex++;
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Zone {} interrupted at point {}/{}", zone.getZoneId(), pointIndex, points.size());
                return false;
            }

            List<PlacesApiPlace> summaries =
                    placesApiClient.searchText(properties.getApi().getSearchQuery(), point, subScanRadius);
            log.debug("Zone {} point {}/{} {}: {} result(s)",
                    zone.getZoneId(), pointIndex, points.size(), point, summaries.size());

            for (PlacesApiPlace summary : summaries) {
                String placeId = summary.getId();
                if (placeId == null || state.contains(placeId) || !attempted.add(placeId)) {
                    continue;
                }
                if (Thread.currentThread().isInterrupted()) {
                    return false;
                }

                try {
                    Optional<DiscoveredEntity> entity = enrich(summary, zone);
                    if (entity.isEmpty()) continue;

                    state.record(entity.get());
                    newFound++;
                    run.setNewFound(run.getNewFound() + 1);
                    eventLog.append(ScanEvent.restaurantFound(entity.get()));
                } catch (RuntimeException e) {
                    log.warn("Skipping place {} in zone {}: {}", placeId, zone.getZoneId(), e.getMessage());
                }

                sleepMs(properties.getScan().getEntityDelayMs());
            }
        }

        saturationPolicy.applyScanResult(zone, newFound, state.countInZone(zone.getZoneId()), Instant.now());
        log.info("Zone {} scan #{} complete: {} new, {} total, likelyComplete={}",
                zone.getZoneId(), zone.getScanCount(), newFound, zone.getTotalDiscovered(), zone.isLikelyComplete());

        csvWriter.writeZoneSnapshot(zone, state.entitiesInZone(zone.getZoneId()));
        eventLog.append(ScanEvent.zoneScanComplete(zone));
        run.getZoneResults().add(ScanRun.ZoneResult.of(zone));
        return true;
    }

    private Optional<DiscoveredEntity> enrich(PlacesApiPlace summary, Zone zone) {
        String name = summary.displayNameText() != null ? summary.displayNameText() : "Unknown";
        log.info("Enriching: {} ({})", name, summary.getId());

        Optional<PlacesApiPlace> details = placesApiClient.getPlaceDetails(summary.getId());
        if (details.isEmpty()) {
            log.warn("Could not fetch details for {} — will retry on a later run", name);
            return Optional.empty();
        }

        String website = details.get().getWebsiteUri();
        String menuUrl = null;
        if (website != null && !website.isBlank()) {
            menuUrl = crawler.findMenu(website).orElse(null);
            if (menuUrl != null) {
                log.info("   Menu detected: {}", menuUrl);
            }
        }

        return Optional.of(mapper.map(details.get(), summary, menuUrl, zone.getZoneId()));
    }

    private void flush(ScanRun run, DiscoveryState state, List<Zone> allZones) {
        // File channels close on interrupt; clear the flag for the writes and restore it after
        boolean interrupted = Thread.interrupted();
        try {
            stateStore.persist(state);
            zoneStore.persist(allZones);
            csvWriter.writeMaster(state.entities());
        } catch (RuntimeException e) {
            log.error("Failed to flush results of run {}: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus(ScanRun.Status.FAILED);
            run.setErrorMessage(e.getMessage());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void sleepMs(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
