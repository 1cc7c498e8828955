package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tiles a circular zone into overlapping search points.
 *
 * Works in a local planar approximation around the zone centre: a square grid
 * with a step of 1.4 × the sub-scan radius (never below 200 m) is laid over the
 * zone's bounding box and only the grid points inside the zone radius are kept.
 * Output order is row-major (south to north, west to east), so plans are reproducible.
 */
@Component
@Slf4j
public class ScanPlanner {

    public static final double METERS_PER_DEGREE_LAT = 111_320.0;
    public static final double STEP_FACTOR = 1.4;
    public static final double MIN_STEP_METERS = 200.0;

    public List<GeoPoint> plan(GeoPoint center, double zoneRadiusMeters, double subScanRadiusMeters) {
        if (zoneRadiusMeters < 0 || subScanRadiusMeters < 0) {
            throw new IllegalArgumentException("Radii must be non-negative: zone=" + zoneRadiusMeters
                    + ", subScan=" + subScanRadiusMeters);
        }

        double step = stepMeters(subScanRadiusMeters);
        int half = (int) Math.floor(zoneRadiusMeters / step);
        double metersPerDegreeLng = METERS_PER_DEGREE_LAT * Math.cos(Math.toRadians(center.latitude()));

        List<GeoPoint> points = new ArrayList<>();
        for (int row = -half; row <= half; row++) {
            double dy = row * step;
            for (int col = -half; col <= half; col++) {
                double dx = col * step;
                if (Math.hypot(dx, dy) > zoneRadiusMeters) continue;

                points.add(new GeoPoint(
                        center.latitude() + dy / METERS_PER_DEGREE_LAT,
                        center.longitude() + dx / metersPerDegreeLng));
            }
        }

        if (points.isEmpty()) {
            points.add(center);
        }

        log.debug("Planned {} scan points for zone radius {}m (step {}m) around {}",
                points.size(), zoneRadiusMeters, step, center);
        return points;
    }

    public static double stepMeters(double subScanRadiusMeters) {
        return Math.max(STEP_FACTOR * subScanRadiusMeters, MIN_STEP_METERS);
    }
}
