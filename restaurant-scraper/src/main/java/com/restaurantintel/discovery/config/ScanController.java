package com.restaurantintel.discovery.config;

import com.restaurantintel.discovery.model.ScanEvent;
import com.restaurantintel.discovery.model.ScanRun;
import com.restaurantintel.discovery.model.Zone;
import com.restaurantintel.discovery.output.CsvWriter;
import com.restaurantintel.discovery.output.ScanEventLog;
import com.restaurantintel.discovery.service.DiscoveryPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScanController {

    private final DiscoveryPipelineService pipelineService;
    private final ScanEventLog eventLog;
    private final CsvWriter csvWriter;

    // ── Scan triggers ────────────────────────────────────────────────────────

    /**
     * Start a scan in the background.
     *
     * POST /scan/trigger?zoneId=soho
     */
    @PostMapping("/scan/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@RequestParam(required = false) String zoneId) {
        try {
            pipelineService.validateConfiguration();
        } catch (DiscoveryConfigurationException e) {
            return ResponseEntity.internalServerError().body(Map.of("status", "error", "message", e.getMessage()));
        }

        Optional<ScanRun> active = pipelineService.activeRun();
        if (active.isPresent()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("status", "running", "runId", active.get().getRunId()));
        }
        if (zoneId != null && pipelineService.loadZones().stream().noneMatch(z -> zoneId.equals(z.getZoneId()))) {
            return ResponseEntity.badRequest().body(Map.of("status", "error", "message", "Unknown zone: " + zoneId));
        }

        new Thread(() -> {
            try {
                pipelineService.runScan(zoneId);
            } catch (ScanInProgressException e) {
                log.warn("Manual scan skipped: {}", e.getMessage());
            } catch (Exception e) {
                log.error("Manual scan failed: {}", e.getMessage(), e);
            }
        }, "manual-zone-scan").start();

        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", zoneId != null ? zoneId : "all"));
    }

    @GetMapping("/scan/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "restaurant-intel-scraper");
        Optional<ScanRun> active = pipelineService.activeRun();
        body.put("running", active.isPresent());
        active.ifPresent(run -> body.put("activeRun", summary(run)));
        pipelineService.lastRun().ifPresent(run -> body.put("lastRun", summary(run)));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/scan/events")
    public List<ScanEvent> events() {
        return eventLog.readAll();
    }

    @GetMapping("/zones")
    public List<Zone> zones() {
        return pipelineService.loadZones();
    }

    // ── Results ──────────────────────────────────────────────────────────────

    /**
     * Download a zone's snapshot CSV, or the master CSV when no snapshot matches.
     *
     * GET /results/download?zoneId=soho&scanNumber=3
     */
    @GetMapping("/results/download")
    public ResponseEntity<?> download(@RequestParam(required = false) String zoneId,
                                      @RequestParam(required = false) Integer scanNumber) {
        Integer scan = scanNumber;
        if (zoneId != null && scan == null) {
            scan = pipelineService.loadZones().stream()
                    .filter(z -> zoneId.equals(z.getZoneId()))
                    .map(Zone::getScanCount)
                    .findFirst()
                    .orElse(null);
        }

        Optional<Path> export = csvWriter.latestExport(zoneId, scan);
        if (export.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "status", "not_ready",
                    "message", "CSV not found yet. Run /scan/trigger first."));
        }

        Path file = export.get();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("text/csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(file.getFileName().toString()).build().toString())
                .body(new FileSystemResource(file));
    }

    // Detached copy: the pipeline thread may still be writing an active run
    private Map<String, Object> summary(ScanRun run) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("runId", run.getRunId());
        summary.put("status", run.getStatus());
        summary.put("startedAt", run.getStartedAt());
        summary.put("completedAt", run.getCompletedAt());
        summary.put("newFound", run.getNewFound());
        summary.put("zones", List.copyOf(run.getZoneResults()));
        String error = run.getErrorMessage();
        if (error != null) {
            summary.put("error", error);
        }
        return summary;
    }
}
