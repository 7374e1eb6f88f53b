package com.tripmate.routeplanner.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PublicTextSanitizerTest {

    private PublicTextSanitizer sanitizer;

    @BeforeEach
    void setUp() {
        sanitizer = new PublicTextSanitizer(List.of("odsay-live-key-9f8e", "short"));
    }

    @Test
    void testSanitize_authorizationSchemes() {
        assertEquals("Authorization: KakaoAK [REDACTED] rejected",
                sanitizer.sanitize("Authorization: KakaoAK abc123def rejected"));
        assertEquals("bearer [REDACTED]", sanitizer.sanitize("bearer eyJhbGciOi.payload.sig"));
        assertEquals("Basic [REDACTED]", sanitizer.sanitize("Basic dXNlcjpwYXNz"));
    }

    @Test
    void testSanitize_queryParameters() {
        String sanitized = sanitizer.sanitize(
                "I/O error on GET request for \"https://api.odsay.com/v1/api/searchPubTransPathT?SX=127.0&apiKey=abc%2Bdef&token=t0k\"");

        assertTrue(sanitized.contains("&apiKey=[REDACTED]"));
        assertTrue(sanitized.contains("&token=[REDACTED]"));
        assertTrue(sanitized.contains("SX=127.0"));
        assertFalse(sanitized.contains("abc%2Bdef"));
    }

    @Test
    void testSanitize_configuredSecretValues() {
        assertEquals("failed with key [REDACTED] at edge",
                sanitizer.sanitize("failed with key odsay-live-key-9f8e at edge"));
        // values under six characters are too generic to redact
        assertEquals("short answer", sanitizer.sanitize("short answer"));
    }

    @Test
    void testSanitize_longestSecretFirst() {
        PublicTextSanitizer nested = new PublicTextSanitizer(List.of("secret", "secret-extended"));

        assertEquals("[REDACTED] and [REDACTED]", nested.sanitize("secret-extended and secret"));
    }

    @Test
    void testSanitize_collapsesWhitespaceAndCapsLength() {
        assertEquals("a b c", sanitizer.sanitize("  a \n\t b   c  "));

        String sanitized = sanitizer.sanitize("x".repeat(500));

        assertEquals(PublicTextSanitizer.MAX_PUBLIC_MESSAGE_LENGTH, sanitized.length());
        assertTrue(sanitized.endsWith("..."));
    }

    @Test
    void testNormalizeWarning_fallsBackWhenEmpty() {
        assertEquals("fallback", sanitizer.normalizeWarning("   ", "fallback"));
        assertEquals("fallback", sanitizer.normalizeWarning(null, "fallback"));
        assertEquals("real warning", sanitizer.normalizeWarning("real warning", "fallback"));
    }

    @Test
    void testCollectSensitiveValues_filtersByVariableName() {
        List<String> values = PublicTextSanitizer.collectSensitiveValues(
                Map.of("JWT_ACCESS_SECRET", "jwt-secret-value",
                        "DB_PASSWORD", "hunter22",
                        "HOME", "/home/app",
                        "PORT", "4000"),
                List.of("kakao-credential"));

        assertTrue(values.containsAll(List.of("jwt-secret-value", "hunter22", "kakao-credential")));
        assertFalse(values.contains("/home/app"));
        assertFalse(values.contains("4000"));
    }
}
