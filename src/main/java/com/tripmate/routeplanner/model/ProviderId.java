package com.tripmate.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a segment estimate.
 */
public enum ProviderId {
    KAKAO("kakao"),
    ODSAY("odsay"),
    FALLBACK("fallback");

    private final String value;

    ProviderId(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
