package com.tripmate.routeplanner.routing.provider;

import com.tripmate.routeplanner.model.Point;
import com.tripmate.routeplanner.model.ProviderId;

/**
 * Client for one external distance/duration provider.
 */
public interface SegmentEstimator {

    ProviderId provider();

    /** Deadline for a single {@link #estimate} call. */
    long timeoutMs();

    /**
     * Queries the provider for the leg {@code from -> to}. Blocking; callers enforce the deadline
     * and interrupt the calling thread when it expires.
     *
     * @throws ProviderFailureException on a non-success status, a network error, or a response
     *                                  without usable distance/duration fields
     */
    RawEstimate estimate(Point from, Point to, String credential) throws ProviderFailureException;
}
