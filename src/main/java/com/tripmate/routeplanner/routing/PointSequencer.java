package com.tripmate.routeplanner.routing;

import com.tripmate.routeplanner.model.Point;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders waypoints with the greedy nearest-neighbor heuristic.
 */
@Service
public class PointSequencer {

    /**
     * Returns copies of {@code waypoints} in visiting order, starting from {@code origin}
     * (which is not part of the result). Equal distances keep input order.
     */
    public List<Point> sequence(Point origin, List<Point> waypoints) {
        if (waypoints == null || waypoints.isEmpty()) {
            return new ArrayList<>();
        }

        List<Point> remaining = new ArrayList<>(waypoints.size());
        for (Point waypoint : waypoints) {
            remaining.add(waypoint.copy());
        }

        List<Point> ordered = new ArrayList<>(remaining.size());
        Point current = origin;

        while (!remaining.isEmpty()) {
            int bestIndex = 0;
            double bestDistance = Double.POSITIVE_INFINITY;

            for (int i = 0; i < remaining.size(); i++) {
                double distance = GeodesyCalculator.distanceKm(current, remaining.get(i));
                // strict comparison keeps the earliest candidate on ties
                if (distance < bestDistance) {
                    bestDistance = distance;
                    bestIndex = i;
                }
            }

            Point next = remaining.remove(bestIndex);
            ordered.add(next);
            current = next;
        }

        return ordered;
    }
}
