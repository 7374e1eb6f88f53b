package com.tripmate.routeplanner.routing;

import com.tripmate.routeplanner.model.Point;
import com.tripmate.routeplanner.model.TransportMode;
import com.tripmate.routeplanner.routing.provider.RawEstimate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeodesyCalculatorTest {

    @Test
    void testDistanceKm_samePointIsZero() {
        Point p = new Point(37.5, 127.0);

        assertEquals(0.0, GeodesyCalculator.distanceKm(p, p), 1e-12);
    }

    @Test
    void testDistanceKm_oneDegreeOfLatitude() {
        double d = GeodesyCalculator.distanceKm(new Point(0, 0), new Point(1, 0));

        assertEquals(111.195, d, 0.001);
    }

    @Test
    void testDistanceKm_seoulToBusan() {
        Point seoul = new Point(37.5665, 126.9780);
        Point busan = new Point(35.1796, 129.0756);

        assertEquals(325.1, GeodesyCalculator.distanceKm(seoul, busan), 0.1);
        assertEquals(GeodesyCalculator.distanceKm(seoul, busan), GeodesyCalculator.distanceKm(busan, seoul), 1e-9);
    }

    @Test
    void testDistanceKm_antipodesDoNotFail() {
        double d = GeodesyCalculator.distanceKm(new Point(90, 0), new Point(-90, 180));

        assertEquals(Math.PI * GeodesyCalculator.EARTH_RADIUS_KM, d, 0.001);
    }

    @Test
    void testFallbackEstimate_appliesInflationAndModeSpeed() {
        Point a = new Point(0, 0);
        Point b = new Point(1, 0);

        RawEstimate walking = GeodesyCalculator.fallbackEstimate(a, b, TransportMode.WALKING);
        RawEstimate transit = GeodesyCalculator.fallbackEstimate(a, b, TransportMode.TRANSIT);
        RawEstimate driving = GeodesyCalculator.fallbackEstimate(a, b, TransportMode.DRIVING);

        assertEquals(138.99, walking.getDistanceKm());
        assertEquals(138.99, driving.getDistanceKm());
        assertEquals(1853.2, walking.getDurationMin(), 0.05);
        assertEquals(297.8, transit.getDurationMin(), 0.05);
        assertEquals(238.3, driving.getDurationMin(), 0.05);
    }

    @Test
    void testFallbackEstimate_zeroLength() {
        Point p = new Point(37.5, 127.0);

        RawEstimate estimate = GeodesyCalculator.fallbackEstimate(p, p, TransportMode.DRIVING);

        assertEquals(0.0, estimate.getDistanceKm());
        assertEquals(0.0, estimate.getDurationMin());
    }

    @Test
    void testRound() {
        assertEquals(1.24, GeodesyCalculator.round(1.2449, 2));
        assertEquals(1.25, GeodesyCalculator.round(1.245001, 2));
        assertEquals(3.0, GeodesyCalculator.round(2.96, 1));
    }
}
