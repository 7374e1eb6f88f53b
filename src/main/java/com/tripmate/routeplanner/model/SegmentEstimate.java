package com.tripmate.routeplanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One directed leg between two consecutive points of a route.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SegmentEstimate {
    private Point from;
    private Point to;
    private double distanceKm;
    private double durationMin;
    private ProviderId provider;
}
