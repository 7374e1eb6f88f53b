package com.tripmate.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum TransportMode {
    DRIVING("driving", 35.0, Set.of("driving", "drive", "car", "auto")),
    TRANSIT("transit", 28.0, Set.of("transit", "public", "public-transit", "bus", "subway")),
    WALKING("walking", 4.5, Set.of("walking", "walk", "pedestrian"));

    private final String value;
    private final double fallbackSpeedKmh;
    private final Set<String> synonyms;

    TransportMode(String value, double fallbackSpeedKmh, Set<String> synonyms) {
        this.value = value;
        this.fallbackSpeedKmh = fallbackSpeedKmh;
        this.synonyms = synonyms;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Assumed average speed used by the geometric fallback. */
    public double getFallbackSpeedKmh() {
        return fallbackSpeedKmh;
    }

    /**
     * External providers to try, most suitable first. ODsay knows public transit,
     * Kakao Mobility is the general road director.
     */
    public List<ProviderId> providerPriority() {
        if (this == TRANSIT) {
            return List.of(ProviderId.ODSAY, ProviderId.KAKAO);
        }
        return List.of(ProviderId.KAKAO, ProviderId.ODSAY);
    }

    public static Optional<TransportMode> fromText(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TransportMode mode : values()) {
            if (mode.synonyms.contains(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
