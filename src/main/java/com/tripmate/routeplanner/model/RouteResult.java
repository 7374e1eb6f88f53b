package com.tripmate.routeplanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteResult {

    public static final String MIXED_SOURCE = "mixed";

    private List<Point> orderedPoints;
    private List<SegmentEstimate> segments;
    private double totalDistanceKm;
    private double totalDurationMin;
    /** Provider id shared by every segment, or {@value #MIXED_SOURCE}. */
    private String source;
    private List<String> warnings;
}
