package com.tripmate.routeplanner.routing;

import com.tripmate.routeplanner.config.ProviderCredentialResolver;
import com.tripmate.routeplanner.model.Point;
import com.tripmate.routeplanner.model.ProviderCapabilities;
import com.tripmate.routeplanner.model.ProviderId;
import com.tripmate.routeplanner.model.RouteRequest;
import com.tripmate.routeplanner.model.RouteResult;
import com.tripmate.routeplanner.model.SegmentEstimate;
import com.tripmate.routeplanner.model.TransportMode;
import com.tripmate.routeplanner.service.PublicTextSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the full route: origin, nearest-neighbor ordered waypoints and the optional closing
 * point, with one estimate per consecutive pair.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteOptimizationService {

    private final PointSequencer pointSequencer;
    private final EstimationProviderChain estimationProviderChain;
    private final ProviderCredentialResolver credentialResolver;
    private final PublicTextSanitizer sanitizer;

    /**
     * @throws InsufficientPointsException if the route has fewer than two points
     */
    public RouteResult optimize(RouteRequest request) {
        TransportMode mode = request.getMode() != null ? request.getMode() : TransportMode.DRIVING;
        Point origin = request.getOrigin();

        List<Point> orderedPoints = new ArrayList<>();
        if (origin != null) {
            orderedPoints.add(origin.copy());
            orderedPoints.addAll(pointSequencer.sequence(origin, request.getWaypoints()));
        }
        Point closing = request.closingPoint();
        if (closing != null) {
            orderedPoints.add(closing.copy());
        }

        if (orderedPoints.size() < 2) {
            throw new InsufficientPointsException();
        }

        ProviderCapabilities capabilities = credentialResolver.resolveCapabilities();
        RouteWarnings warnings = new RouteWarnings(sanitizer);

        // one leg at a time: keeps outbound load on rate-limited providers bounded and warnings in leg order
        List<SegmentEstimate> segments = new ArrayList<>(orderedPoints.size() - 1);
        for (int i = 0; i < orderedPoints.size() - 1; i++) {
            segments.add(estimationProviderChain.estimate(
                    orderedPoints.get(i), orderedPoints.get(i + 1), mode, capabilities, warnings));
        }

        double totalDistanceKm = 0;
        double totalDurationMin = 0;
        for (SegmentEstimate segment : segments) {
            totalDistanceKm += segment.getDistanceKm();
            totalDurationMin += segment.getDurationMin();
        }

        String source = deriveSource(segments);
        log.info("✅ Route optimized: {} points, {} segments, source={}, warnings={}",
                orderedPoints.size(), segments.size(), source, warnings.size());

        return new RouteResult(
                orderedPoints,
                segments,
                GeodesyCalculator.round(totalDistanceKm, 2),
                GeodesyCalculator.round(totalDurationMin, 1),
                source,
                warnings.asList());
    }

    static String deriveSource(List<SegmentEstimate> segments) {
        Set<ProviderId> providers = EnumSet.noneOf(ProviderId.class);
        for (SegmentEstimate segment : segments) {
            providers.add(segment.getProvider());
        }
        if (providers.size() == 1) {
            return providers.iterator().next().getValue();
        }
        return providers.isEmpty() ? ProviderId.FALLBACK.getValue() : RouteResult.MIXED_SOURCE;
    }
}
