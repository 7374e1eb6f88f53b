package com.tripmate.routeplanner.routing;

import com.tripmate.routeplanner.model.Point;
import com.tripmate.routeplanner.model.TransportMode;
import com.tripmate.routeplanner.routing.provider.RawEstimate;

/**
 * Great-circle math shared by the sequencer and the fallback estimator.
 */
public final class GeodesyCalculator {

    public static final double EARTH_RADIUS_KM = 6371.0;

    /** Straight lines under-estimate real road/path length. */
    public static final double ROAD_INFLATION_FACTOR = 1.25;

    private GeodesyCalculator() {
    }

    /**
     * Haversine distance between two points, in kilometers.
     */
    public static double distanceKm(Point a, Point b) {
        double dLat = Math.toRadians(b.getLat() - a.getLat());
        double dLng = Math.toRadians(b.getLng() - a.getLng());
        double lat1 = Math.toRadians(a.getLat());
        double lat2 = Math.toRadians(b.getLat());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Geometric estimate used when no external provider answered: inflated great-circle
     * distance travelled at the mode's assumed speed.
     */
    public static RawEstimate fallbackEstimate(Point a, Point b, TransportMode mode) {
        double adjustedKm = distanceKm(a, b) * ROAD_INFLATION_FACTOR;
        double durationMin = adjustedKm / mode.getFallbackSpeedKmh() * 60.0;
        return new RawEstimate(round(adjustedKm, 2), round(durationMin, 1));
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
