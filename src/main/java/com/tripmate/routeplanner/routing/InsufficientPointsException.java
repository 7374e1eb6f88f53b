package com.tripmate.routeplanner.routing;

/**
 * Thrown when a route would have fewer than two points. The message is safe to show to clients.
 *
 * <p>{@link com.tripmate.routeplanner.controller.RouteController} answers this with 400 rather
 * than the 500 used for other optimization failures: too few points is always a fault in the
 * request, never in the service.
 */
public class InsufficientPointsException extends RuntimeException {

    public static final String MESSAGE = "Route optimization requires at least two points.";

    public InsufficientPointsException() {
        super(MESSAGE);
    }
}
