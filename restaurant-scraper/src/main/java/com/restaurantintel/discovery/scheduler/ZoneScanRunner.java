package com.restaurantintel.discovery.scheduler;

import com.restaurantintel.discovery.config.DiscoveryConfigurationException;
import com.restaurantintel.discovery.model.ScanRun;
import com.restaurantintel.discovery.service.DiscoveryPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * One-shot mode: {@code --zone-scan [--zone-id=soho]} runs a single scan and exits.
 *
 * Exit codes: 0 success or partial, 1 failed or interrupted, 2 configuration fault.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ZoneScanRunner implements CommandLineRunner {

    static final String SCAN_OPTION = "zone-scan";
    static final String ZONE_OPTION = "zone-id";

    private final ApplicationArguments arguments;
    private final DiscoveryPipelineService pipelineService;
    private final ApplicationContext context;

    @Override
    public void run(String... args) {
        if (!arguments.containsOption(SCAN_OPTION)) {
            return;
        }
        String zoneId = arguments.containsOption(ZONE_OPTION)
                ? arguments.getOptionValues(ZONE_OPTION).get(0)
                : null;

        int exitCode = runOnce(zoneId);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    int runOnce(String zoneId) {
        try {
            ScanRun run = pipelineService.runScan(zoneId);
            log.info("Zone scan {} finished with status {} ({} new)", run.getRunId(), run.getStatus(), run.getNewFound());
            return switch (run.getStatus()) {
                case SUCCESS, PARTIAL -> 0;
                default -> 1;
            };
        } catch (DiscoveryConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            log.error("Invalid scan request: {}", e.getMessage());
            return 2;
        } catch (Exception e) {
            log.error("Zone scan failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
