package com.tripmate.routeplanner.routing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmate.routeplanner.model.Point;
import com.tripmate.routeplanner.model.ProviderId;
import com.tripmate.routeplanner.routing.GeodesyCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.OptionalDouble;

/**
 * Kakao Mobility car directions. The route summary carries distance in meters and
 * duration in seconds.
 */
@Slf4j
@Component
public class KakaoDirectionsEstimator implements SegmentEstimator {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final long timeoutMs;

    public KakaoDirectionsEstimator(
            @Qualifier("kakaoRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            @Value("${route.providers.kakao.base-url:https://apis-navi.kakaomobility.com}") String baseUrl,
            @Value("${route.providers.kakao.timeout-ms:4000}") long timeoutMs) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public ProviderId provider() {
        return ProviderId.KAKAO;
    }

    @Override
    public long timeoutMs() {
        return timeoutMs;
    }

    @Override
    public RawEstimate estimate(Point from, Point to, String credential) throws ProviderFailureException {
        // Kakao takes "x,y", i.e. lng first
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/v1/directions")
                .queryParam("origin", from.getLng() + "," + from.getLat())
                .queryParam("destination", to.getLng() + "," + to.getLat())
                .queryParam("priority", "RECOMMEND")
                .queryParam("alternatives", "false")
                .queryParam("road_details", "false")
                .encode()
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "KakaoAK " + credential);

        JsonNode root = ProviderResponses.fetch(provider(), objectMapper,
                () -> restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class).getBody());

        JsonNode summary = root.path("routes").path(0).path("summary");
        OptionalDouble distanceMeters = ProviderResponses.finiteNumber(summary.path("distance"));
        OptionalDouble durationSeconds = ProviderResponses.finiteNumber(summary.path("duration"));

        if (distanceMeters.isEmpty() || durationSeconds.isEmpty()) {
            String resultMsg = root.path("routes").path(0).path("result_msg").asText("");
            log.debug("Kakao route without summary: {}", resultMsg);
            throw new ProviderFailureException(provider(), resultMsg.isBlank()
                    ? "response missing distance/duration"
                    : "response missing distance/duration: " + resultMsg);
        }
        if (distanceMeters.getAsDouble() < 0 || durationSeconds.getAsDouble() < 0) {
            throw new ProviderFailureException(provider(), "response has negative distance/duration");
        }

        return new RawEstimate(
                GeodesyCalculator.round(distanceMeters.getAsDouble() / 1000.0, 2),
                GeodesyCalculator.round(durationSeconds.getAsDouble() / 60.0, 1));
    }
}
