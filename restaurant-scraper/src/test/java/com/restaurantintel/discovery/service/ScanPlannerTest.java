package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.model.GeoPoint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScanPlannerTest {

    private static final GeoPoint SOHO = new GeoPoint(51.5136, -0.1331);

    private final ScanPlanner planner = new ScanPlanner();

    @Test
    void sohoZoneProducesDeterministicRowMajorGrid() {
        List<GeoPoint> first = planner.plan(SOHO, 1000, 350);
        List<GeoPoint> second = planner.plan(SOHO, 1000, 350);

        // step 490m: centre, 4 axis neighbours, 4 diagonals at ~693m, 4 axis points at 980m
        assertThat(first).hasSize(13);
        assertThat(first).containsExactlyElementsOf(second);
        assertThat(first).contains(SOHO);

        // southernmost row first, then west to east within a row
        assertThat(first.get(0).latitude()).isLessThan(SOHO.latitude());
        assertThat(first.get(0).longitude()).isEqualTo(SOHO.longitude());
        for (int i = 1; i < first.size(); i++) {
            GeoPoint prev = first.get(i - 1);
            GeoPoint cur = first.get(i);
            assertThat(cur.latitude() > prev.latitude()
                    || (cur.latitude() == prev.latitude() && cur.longitude() > prev.longitude())).isTrue();
        }
    }

    @Test
    void zoneSmallerThanOneGridCellFallsBackToCentre() {
        assertThat(planner.plan(SOHO, 100, 350)).containsExactly(SOHO);
        assertThat(planner.plan(SOHO, 0, 350)).containsExactly(SOHO);
        assertThat(planner.plan(SOHO, 0, 0)).containsExactly(SOHO);
    }

    @Test
    void stepNeverDropsBelowTwoHundredMetres() {
        assertThat(ScanPlanner.stepMeters(50)).isEqualTo(200.0);
        assertThat(ScanPlanner.stepMeters(350)).isCloseTo(490.0, within(1e-9));
    }

    @Test
    void rejectsNegativeRadii() {
        assertThatThrownBy(() -> planner.plan(SOHO, -1, 350)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planner.plan(SOHO, 1000, -5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void everyPlanIsNonEmptyAndInsideTheZone() {
        Random random = new Random(42);
        for (int trial = 0; trial < 300; trial++) {
            GeoPoint center = randomCenter(random);
            double zoneRadius = random.nextDouble() * 5000;
            double subRadius = random.nextDouble() * 1000;

            List<GeoPoint> points = planner.plan(center, zoneRadius, subRadius);

            assertThat(points).isNotEmpty();
            for (GeoPoint p : points) {
                assertThat(planarDistance(center, p, 0, 0)).isLessThanOrEqualTo(zoneRadius + 1e-6);
            }
        }
    }

    @Test
    void pointsInsideTheZoneAreCoveredByAScanPoint() {
        Random random = new Random(7);
        for (int trial = 0; trial < 100; trial++) {
            GeoPoint center = randomCenter(random);
            double subRadius = 150 + random.nextDouble() * 650;   // step = 1.4r throughout
            double zoneRadius = random.nextDouble() * 4000;
            double step = ScanPlanner.stepMeters(subRadius);

            List<GeoPoint> points = planner.plan(center, zoneRadius, subRadius);

            for (int sample = 0; sample < 200; sample++) {
                double distance = zoneRadius * Math.sqrt(random.nextDouble());
                double bearing = random.nextDouble() * 2 * Math.PI;
                double dx = distance * Math.cos(bearing);
                double dy = distance * Math.sin(bearing);

                double nearest = points.stream()
                        .mapToDouble(p -> planarDistance(center, p, dx, dy))
                        .min()
                        .orElseThrow();

                // The grid cell corner nearest the centre is always kept
                assertThat(nearest).isLessThanOrEqualTo(step * Math.sqrt(2) + 1e-6);
                if (distance <= zoneRadius - step * Math.sqrt(2)) {
                    assertThat(nearest).isLessThanOrEqualTo(1.4 * subRadius + 1e-6);
                }
            }
        }
    }

    private static GeoPoint randomCenter(Random random) {
        return new GeoPoint(-60 + random.nextDouble() * 120, -180 + random.nextDouble() * 360);
    }

    /**
     * Distance in metres between scan point p and the point offset (dx, dy) metres from the centre,
     * using the planner's own planar approximation.
     */
    private static double planarDistance(GeoPoint center, GeoPoint p, double dx, double dy) {
        double metersPerDegreeLng = ScanPlanner.METERS_PER_DEGREE_LAT * Math.cos(Math.toRadians(center.latitude()));
        double px = (p.longitude() - center.longitude()) * metersPerDegreeLng;
        double py = (p.latitude() - center.latitude()) * ScanPlanner.METERS_PER_DEGREE_LAT;
        return Math.hypot(px - dx, py - dy);
    }
}
