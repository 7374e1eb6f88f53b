package com.tripmate.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A geographic stop on a route. Instances are immutable; reordering code hands out
 * {@link #copy()} results so callers never share an instance with the engine.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Point {
    private final String id;
    private final String name;
    private final double lat;
    private final double lng;

    public Point(double lat, double lng) {
        this(null, null, lat, lng);
    }

    public Point(String id, String name, double lat, double lng) {
        if (!Double.isFinite(lat) || lat < -90 || lat > 90) {
            throw new IllegalArgumentException("lat must be between -90 and 90: " + lat);
        }
        if (!Double.isFinite(lng) || lng < -180 || lng > 180) {
            throw new IllegalArgumentException("lng must be between -180 and 180: " + lng);
        }
        this.id = id;
        this.name = name;
        this.lat = lat;
        this.lng = lng;
    }

    public Point copy() {
        return new Point(id, name, lat, lng);
    }

    public String getId() { return id; }

    public String getName() { return name; }

    public double getLat() { return lat; }

    public double getLng() { return lng; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point)) return false;
        Point other = (Point) o;
        return Double.compare(lat, other.lat) == 0
                && Double.compare(lng, other.lng) == 0
                && Objects.equals(id, other.id)
                && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, lat, lng);
    }

    @Override
    public String toString() {
        return "Point{" + (name != null ? name + " " : "") + "(" + lat + ", " + lng + ")}";
    }
}
