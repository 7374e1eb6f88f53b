package com.tripmate.routeplanner.controller;

import java.util.List;

/**
 * Rejected optimize payload. Message and details are written for API clients.
 */
public class RouteValidationException extends RuntimeException {

    private final List<String> details;

    public RouteValidationException(String message, List<String> details) {
        super(message);
        this.details = List.copyOf(details);
    }

    public List<String> getDetails() {
        return details;
    }
}
