package com.restaurantintel.discovery.config;

import com.restaurantintel.discovery.model.Zone;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "restaurant-discovery")
@Data
public class DiscoveryProperties {

    private Api api = new Api();
    private Scan scan = new Scan();
    private Crawl crawl = new Crawl();
    private Storage storage = new Storage();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    /** Used when the zones file is missing or empty */
    private List<SeedZone> zones = new ArrayList<>();

    @Data
    public static class Api {
        private String key;
        private String baseUrl = "https://places.googleapis.com/v1";
        private String searchQuery = "restaurants";
        private long pageDelayMs = 1500;
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 30;
        private int photoMaxPx = 1600;
        private int maxImages = 5;
    }

    @Data
    public static class Scan {
        private double subScanRadiusMeters = 350;
        private long entityDelayMs = 250;
        private int saturationThreshold = 2;
        private int historySize = 5;
    }

    @Data
    public static class Crawl {
        private int maxDepth = 2;
        /** Per-site fetch budget; 0 or less means no cap */
        private int maxPages = 0;
        private int timeoutSeconds = 12;
        private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
        private List<String> menuKeywords = new ArrayList<>(List.of(
                "menu", "food", "drink", "brunch", "dinner", "breakfast", "lunch",
                "carte", "prix-fixe", "wine-list", "cocktails", "a-la-carte"));
        private List<String> excludedTerms = new ArrayList<>(List.of(
                "instagram", "facebook", "twitter", "login", "booking", "reservation"));
    }

    @Data
    public static class Storage {
        private String dataDir = "./data";
        private String zonesFile = "zones.json";
        private String stateFile = "discovery_state.json";
        private String eventsFile = "scan_events.jsonl";
    }

    @Data
    public static class Output {
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String masterFile = "master_restaurants.csv";
            private boolean includeHeader = true;
        }
    }

    @Data
    public static class Scheduling {
        private boolean enabled = false;
        private String cron = "0 0 3 * * MON";
        private boolean runOnStartup = false;
    }

    @Data
    public static class SeedZone {
        private String zoneId;
        private String zoneName;
        private double centerLat;
        private double centerLng;
        private double radiusMeters;

        public Zone toZone() {
            return Zone.builder()
                    .zoneId(zoneId)
                    .zoneName(zoneName)
                    .centerLat(centerLat)
                    .centerLng(centerLng)
                    .radiusMeters(radiusMeters)
                    .build();
        }
    }
}
