package com.tripmate.routeplanner.routing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmate.routeplanner.model.Point;
import com.tripmate.routeplanner.model.ProviderId;
import com.tripmate.routeplanner.routing.GeodesyCalculator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.OptionalDouble;

/**
 * ODsay public transit path search. Path info carries total distance in meters and total
 * time already in minutes.
 */
@Component
public class OdsayTransitEstimator implements SegmentEstimator {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final long timeoutMs;

    public OdsayTransitEstimator(
            @Qualifier("odsayRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            @Value("${route.providers.odsay.base-url:https://api.odsay.com}") String baseUrl,
            @Value("${route.providers.odsay.timeout-ms:4500}") long timeoutMs) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public ProviderId provider() {
        return ProviderId.ODSAY;
    }

    @Override
    public long timeoutMs() {
        return timeoutMs;
    }

    @Override
    public RawEstimate estimate(Point from, Point to, String credential) throws ProviderFailureException {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/v1/api/searchPubTransPathT")
                .queryParam("SX", from.getLng())
                .queryParam("SY", from.getLat())
                .queryParam("EX", to.getLng())
                .queryParam("EY", to.getLat())
                .queryParam("apiKey", "{apiKey}")
                .encode()
                .buildAndExpand(credential)
                .toUri();

        JsonNode root = ProviderResponses.fetch(provider(), objectMapper,
                () -> restTemplate.getForObject(uri, String.class));

        JsonNode info = root.path("result").path("path").path(0).path("info");
        OptionalDouble distanceMeters = ProviderResponses.finiteNumber(info.path("totalDistance"));
        OptionalDouble durationMin = ProviderResponses.finiteNumber(info.path("totalTime"));

        if (distanceMeters.isEmpty() || durationMin.isEmpty()) {
            throw new ProviderFailureException(provider(), describeMissing(root));
        }
        if (distanceMeters.getAsDouble() < 0 || durationMin.getAsDouble() < 0) {
            throw new ProviderFailureException(provider(), "response has negative distance/time");
        }

        return new RawEstimate(
                GeodesyCalculator.round(distanceMeters.getAsDouble() / 1000.0, 2),
                GeodesyCalculator.round(durationMin.getAsDouble(), 1));
    }

    // ODsay reports errors with status 200 and an "error" object (sometimes an array of them)
    private String describeMissing(JsonNode root) {
        JsonNode error = root.path("error");
        if (error.isArray()) {
            error = error.path(0);
        }
        String message = error.path("msg").asText(error.path("message").asText(""));
        if (message.isBlank()) {
            return "response missing distance/time";
        }
        return "response missing distance/time: " + message;
    }
}
