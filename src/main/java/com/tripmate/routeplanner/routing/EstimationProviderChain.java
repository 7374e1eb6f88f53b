package com.tripmate.routeplanner.routing;

import com.tripmate.routeplanner.model.Point;
import com.tripmate.routeplanner.model.ProviderCapabilities;
import com.tripmate.routeplanner.model.ProviderId;
import com.tripmate.routeplanner.model.SegmentEstimate;
import com.tripmate.routeplanner.model.TransportMode;
import com.tripmate.routeplanner.routing.provider.ProviderFailureException;
import com.tripmate.routeplanner.routing.provider.RawEstimate;
import com.tripmate.routeplanner.routing.provider.SegmentEstimator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Estimates a single leg by walking the mode's provider list until one answers, then falling back
 * to {@link GeodesyCalculator#fallbackEstimate}.
 *
 * <p>Every provider call runs on {@code routeProviderExecutor} and is awaited with that provider's
 * own deadline. An expired call is cancelled with interruption and counts as an ordinary provider
 * failure; it never affects the other attempts or the request.
 */
@Slf4j
@Service
public class EstimationProviderChain {

    static final String NO_CREDENTIALS_KEY = "no-provider-credentials";
    static final String NO_CREDENTIALS_WARNING =
            "No KAKAO/ODSAY API key configured. Using local fallback estimates.";

    private final Map<ProviderId, SegmentEstimator> estimators = new EnumMap<>(ProviderId.class);
    private final AsyncTaskExecutor executor;

    public EstimationProviderChain(List<SegmentEstimator> estimators,
                                   @Qualifier("routeProviderExecutor") AsyncTaskExecutor executor) {
        for (SegmentEstimator estimator : estimators) {
            SegmentEstimator previous = this.estimators.put(estimator.provider(), estimator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate estimator for provider " + estimator.provider());
            }
        }
        this.executor = executor;
    }

    public SegmentEstimate estimate(Point from, Point to, TransportMode mode,
                                    ProviderCapabilities capabilities, RouteWarnings warnings) {
        if (capabilities.isEmpty()) {
            warnings.addOnce(NO_CREDENTIALS_KEY, NO_CREDENTIALS_WARNING);
        }

        for (ProviderId provider : attemptOrder(mode, capabilities)) {
            SegmentEstimator estimator = estimators.get(provider);
            try {
                RawEstimate raw = callWithDeadline(estimator, from, to, capabilities.credential(provider));
                return new SegmentEstimate(from, to, raw.getDistanceKm(), raw.getDurationMin(), provider);
            } catch (ProviderFailureException e) {
                log.warn("⚠️ {} estimate failed for {} -> {}: {}", provider, from, to, warnings.sanitize(e.getMessage()));
                warnings.add(String.format(Locale.ROOT, "%s estimate failed for %s -> %s (%s).",
                        provider.name(), label(from), label(to), e.getMessage()));
            }
        }

        RawEstimate fallback = GeodesyCalculator.fallbackEstimate(from, to, mode);
        return new SegmentEstimate(from, to, fallback.getDistanceKm(), fallback.getDurationMin(), ProviderId.FALLBACK);
    }

    /**
     * Providers to try for {@code mode}, restricted to those with a credential and a client.
     */
    List<ProviderId> attemptOrder(TransportMode mode, ProviderCapabilities capabilities) {
        List<ProviderId> order = new ArrayList<>();
        for (ProviderId provider : mode.providerPriority()) {
            if (capabilities.isEnabled(provider) && estimators.containsKey(provider)) {
                order.add(provider);
            }
        }
        return order;
    }

    private RawEstimate callWithDeadline(SegmentEstimator estimator, Point from, Point to, String credential)
            throws ProviderFailureException {
        ProviderId provider = estimator.provider();
        long timeoutMs = estimator.timeoutMs();

        Future<RawEstimate> future;
        try {
            future = executor.submit(() -> estimator.estimate(from, to, credential));
        } catch (RejectedExecutionException e) {
            throw new ProviderFailureException(provider, "provider executor saturated", e);
        }

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderFailureException(provider, "timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderFailureException(provider, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderFailureException) {
                throw (ProviderFailureException) cause;
            }
            String reason = cause != null && cause.getMessage() != null ? cause.getMessage() : "unknown error";
            throw new ProviderFailureException(provider, reason, cause);
        }
    }

    private static String label(Point point) {
        return point.getName() != null ? point.getName() : "point";
    }
}
