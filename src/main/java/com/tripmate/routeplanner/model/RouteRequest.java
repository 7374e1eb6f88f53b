package com.tripmate.routeplanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Validated input of a route optimization. Waypoint order carries no meaning.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteRequest {
    private Point origin;
    private List<Point> waypoints;
    private Point destination;
    private boolean roundTrip;
    private TransportMode mode;

    /**
     * Point that closes the route: the explicit destination, the origin for a round trip, or none.
     */
    public Point closingPoint() {
        if (destination != null) {
            return destination;
        }
        return roundTrip ? origin : null;
    }
}
