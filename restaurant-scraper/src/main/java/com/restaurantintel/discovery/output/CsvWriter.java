package com.restaurantintel.discovery.output;

import com.opencsv.CSVWriter;
import com.restaurantintel.discovery.config.DiscoveryProperties;
import com.restaurantintel.discovery.model.DiscoveredEntity;
import com.restaurantintel.discovery.model.Zone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Writes discovered restaurants to CSV files.
 *
 * Output files:
 *   {dataDir}/master_restaurants.csv              — every known place, end of run
 *   {dataDir}/zone_{zoneId}_scan_{scanCount}.csv  — places owned by one zone, end of each zone pass
 *
 * Absent values are written as empty cells; downstream loaders read an empty cell
 * as "missing", never as zero.
 */
@Component
@Slf4j
public class CsvWriter {

    static final String[] HEADERS = {
            "google_place_id", "name",
            "latitude", "longitude",
            "zone_id", "discovered_at",
            "rating", "reviews_count", "price_level",
            "website", "menu_url",
            "hero_image_url", "image_urls",
            "address_full", "postcode", "cuisine", "categories"
    };

    private final Path outputDir;
    private final String masterFile;
    private final boolean includeHeader;

    @Autowired
    public CsvWriter(DiscoveryProperties properties) {
        this(Paths.get(properties.getStorage().getDataDir()),
                properties.getOutput().getCsv().getMasterFile(),
                properties.getOutput().getCsv().isIncludeHeader());
    }

    CsvWriter(Path outputDir, String masterFile, boolean includeHeader) {
        this.outputDir = outputDir;
        this.masterFile = masterFile;
        this.includeHeader = includeHeader;
    }

    public Path writeMaster(Collection<DiscoveredEntity> entities) {
        return write(outputDir.resolve(masterFile), entities);
    }

    public Path writeZoneSnapshot(Zone zone, Collection<DiscoveredEntity> entities) {
        return write(zoneSnapshotPath(zone.getZoneId(), zone.getScanCount()), entities);
    }

    public Path zoneSnapshotPath(String zoneId, int scanNumber) {
        return outputDir.resolve(String.format("zone_%s_scan_%d.csv", zoneId, scanNumber));
    }

    public Path masterPath() {
        return outputDir.resolve(masterFile);
    }

    /**
     * Zone snapshot if it exists, otherwise the master file if that exists.
     */
    public Optional<Path> latestExport(String zoneId, Integer scanNumber) {
        if (zoneId != null && scanNumber != null && scanNumber > 0) {
            Path snapshot = zoneSnapshotPath(zoneId, scanNumber);
            if (Files.exists(snapshot)) return Optional.of(snapshot);
        }
        Path master = masterPath();
        return Files.exists(master) ? Optional.of(master) : Optional.empty();
    }

    private Path write(Path outputPath, Collection<DiscoveredEntity> entities) {
        try {
            AtomicFileWriter.write(outputPath, out -> {
                CSVWriter writer = new CSVWriter(out,
                        CSVWriter.DEFAULT_SEPARATOR,
                        CSVWriter.DEFAULT_QUOTE_CHARACTER,
                        CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                        CSVWriter.DEFAULT_LINE_END);

                if (includeHeader) {
                    writer.writeNext(HEADERS);
                }
                for (DiscoveredEntity e : entities) {
                    writer.writeNext(toRow(e));
                }
                writer.flush();
            });

            log.info("Written {} restaurants to CSV: {}", entities.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed", e);
        }
    }

    private String[] toRow(DiscoveredEntity e) {
        return new String[]{
                str(e.getGooglePlaceId()),
                str(e.getName()),
                str(e.getLatitude()),
                str(e.getLongitude()),
                str(e.getZoneId()),
                str(e.getDiscoveredAt()),
                str(e.getRating()),
                str(e.getReviewsCount()),
                str(e.getPriceLevel()),
                str(e.getWebsite()),
                str(e.getMenuUrl()),
                str(e.getHeroImageUrl()),
                join(e.getImageUrls(), "|"),
                str(e.getFormattedAddress()),
                str(e.getPostcode()),
                str(e.getCuisine()),
                join(e.getCategories(), ",")
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private String join(List<String> values, String separator) {
        return values == null ? "" : String.join(separator, values);
    }
}
