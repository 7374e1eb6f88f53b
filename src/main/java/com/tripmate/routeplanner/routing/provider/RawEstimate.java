package com.tripmate.routeplanner.routing.provider;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Distance and duration of one leg, already normalized to kilometers and minutes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawEstimate {
    private double distanceKm;
    private double durationMin;
}
