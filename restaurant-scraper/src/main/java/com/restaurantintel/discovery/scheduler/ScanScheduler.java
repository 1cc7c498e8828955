package com.restaurantintel.discovery.scheduler;

import com.restaurantintel.discovery.config.DiscoveryProperties;
import com.restaurantintel.discovery.service.DiscoveryPipelineService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup zone scans.
 *
 * Default schedule: Mondays at 03:00 UTC, off unless
 * restaurant-discovery.scheduling.enabled=true. Repeated runs are cheap because
 * known places are never re-enriched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScanScheduler {

    private final DiscoveryPipelineService pipelineService;
    private final DiscoveryProperties properties;

    @PostConstruct
    public void onStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true — scanning all zones");
            runAllZones("Startup scan");
        } else if (properties.getScheduling().isEnabled()) {
            log.info("Scraper ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${restaurant-discovery.scheduling.cron:0 0 3 * * MON}", zone = "UTC")
    public void scheduledScan() {
        if (!properties.getScheduling().isEnabled()) {
            return;
        }
        log.info("Scheduled zone scan triggered");
        runAllZones("Scheduled scan");
    }

    private void runAllZones(String label) {
        try {
            pipelineService.runScan(null);
        } catch (Exception e) {
            log.error("{} failed: {}", label, e.getMessage(), e);
        }
    }
}
