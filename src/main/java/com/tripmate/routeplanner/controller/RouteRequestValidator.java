package com.tripmate.routeplanner.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tripmate.routeplanner.model.Point;
import com.tripmate.routeplanner.model.RouteRequest;
import com.tripmate.routeplanner.model.TransportMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a loosely shaped optimize payload into a {@link RouteRequest}. Accepts the field aliases
 * mobile and web clients send ({@code start}/{@code origin}, {@code lat}/{@code latitude}/{@code y}, ...)
 * and collects every problem before rejecting.
 */
@Component
public class RouteRequestValidator {

    public static final int MAX_WAYPOINTS = 25;
    static final int MAX_TEXT_LENGTH = 120;

    static final String INVALID_PAYLOAD = "Invalid optimize route payload.";
    static final String NOT_AN_OBJECT = "Request body must be a JSON object.";

    public RouteRequest validate(JsonNode body) {
        // arrays pass and are reported through the missing-field details
        if (body == null || !body.isContainerNode()) {
            throw new RouteValidationException(NOT_AN_OBJECT, List.of());
        }

        List<String> errors = new ArrayList<>();

        Point start = parsePoint(first(body, "start", "origin"), "start", errors);
        Point end = parsePoint(first(body, "end", "destination"), "end", errors);
        List<Point> waypoints = parsePoints(first(body, "waypoints", "points", "stops"), "waypoints", errors);
        TransportMode mode = parseMode(first(body, "mode", "transportMode"), errors);
        boolean roundTrip = parseRoundTrip(body.get("roundTrip"), errors);

        if (start == null && !waypoints.isEmpty()) {
            start = waypoints.remove(0);
        }
        if (roundTrip && start != null && end == null) {
            end = start;
        }

        int totalPoints = (start != null ? 1 : 0) + waypoints.size() + (end != null ? 1 : 0);
        if (start == null) {
            errors.add("A start/origin point is required. Provide start/origin or include waypoints/points with at least one item.");
        }
        if (totalPoints < 2) {
            errors.add("At least two points are required to optimize a route.");
        }

        if (!errors.isEmpty()) {
            throw new RouteValidationException(INVALID_PAYLOAD, errors);
        }
        return new RouteRequest(start, waypoints, end, roundTrip, mode);
    }

    private Point parsePoint(JsonNode raw, String label, List<String> errors) {
        if (isAbsent(raw)) {
            return null;
        }
        if (!raw.isContainerNode()) {
            errors.add(label + " must be an object.");
            return null;
        }

        Double lat = finiteNumber(first(raw, "lat", "latitude", "y"));
        Double lng = finiteNumber(first(raw, "lng", "lon", "longitude", "x"));

        boolean latValid = lat != null && lat >= -90 && lat <= 90;
        boolean lngValid = lng != null && lng >= -180 && lng <= 180;
        if (!latValid) {
            errors.add(label + ".lat must be a valid number between -90 and 90.");
        }
        if (!lngValid) {
            errors.add(label + ".lng must be a valid number between -180 and 180.");
        }
        if (!latValid || !lngValid) {
            return null;
        }

        return new Point(optionalText(raw.get("id")), optionalText(first(raw, "name", "title")), lat, lng);
    }

    private List<Point> parsePoints(JsonNode raw, String label, List<String> errors) {
        List<Point> points = new ArrayList<>();
        if (isAbsent(raw)) {
            return points;
        }
        if (!raw.isArray()) {
            errors.add(label + " must be an array.");
            return points;
        }
        if (raw.size() > MAX_WAYPOINTS) {
            errors.add(label + " can include at most " + MAX_WAYPOINTS + " points.");
        }

        int limit = Math.min(raw.size(), MAX_WAYPOINTS);
        for (int i = 0; i < limit; i++) {
            Point point = parsePoint(raw.get(i), label + "[" + i + "]", errors);
            if (point != null) {
                points.add(point);
            }
        }
        return points;
    }

    private TransportMode parseMode(JsonNode raw, List<String> errors) {
        if (isAbsent(raw) || (raw.isTextual() && raw.asText().isEmpty())) {
            return TransportMode.DRIVING;
        }
        if (!raw.isTextual()) {
            errors.add("mode must be a string.");
            return TransportMode.DRIVING;
        }
        Optional<TransportMode> mode = TransportMode.fromText(raw.asText());
        if (mode.isEmpty()) {
            errors.add("mode must be one of driving, transit, or walking.");
            return TransportMode.DRIVING;
        }
        return mode.get();
    }

    private boolean parseRoundTrip(JsonNode raw, List<String> errors) {
        if (isAbsent(raw) || (raw.isTextual() && raw.asText().isEmpty())) {
            return false;
        }
        if (raw.isBoolean()) {
            return raw.booleanValue();
        }
        if (raw.isTextual() && ("true".equals(raw.asText()) || "false".equals(raw.asText()))) {
            return Boolean.parseBoolean(raw.asText());
        }
        errors.add("roundTrip must be a boolean.");
        return false;
    }

    private static JsonNode first(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (!isAbsent(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static Double finiteNumber(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual() && !node.asText().isBlank()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    private static String optionalText(JsonNode node) {
        if (isAbsent(node) || !node.isTextual()) {
            return null;
        }
        String trimmed = node.asText().trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_TEXT_LENGTH ? trimmed.substring(0, MAX_TEXT_LENGTH) : trimmed;
    }
}
