package com.tripmate.routeplanner.service;

import com.tripmate.routeplanner.config.ProviderCredentialResolver;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrubs text that leaves the service (warnings, error messages) of anything that looks like
 * a credential, and caps its length.
 */
@Component
public class PublicTextSanitizer {

    public static final String REDACTED = "[REDACTED]";

    static final int MAX_PUBLIC_MESSAGE_LENGTH = 180;

    private static final int MIN_SECRET_LENGTH = 6;

    private static final Pattern SENSITIVE_ENV_KEY = Pattern.compile(
            "(key|token|secret|password|passwd|private|auth)", Pattern.CASE_INSENSITIVE);

    private static final Pattern AUTH_SCHEME_TOKEN = Pattern.compile(
            "\\b(Bearer|Basic|KakaoAK)\\s+\\S+", Pattern.CASE_INSENSITIVE);

    private static final Pattern SECRET_QUERY_PARAM = Pattern.compile(
            "([?&](api[_-]?key|key|token|secret|password)=)[^&\\s]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Longest first, so a secret containing another is replaced whole. */
    private final List<String> sensitiveValues;

    @Autowired
    public PublicTextSanitizer(ProviderCredentialResolver credentialResolver) {
        this(collectSensitiveValues(System.getenv(), credentialResolver.resolveCapabilities().credentialValues()));
    }

    public PublicTextSanitizer(Collection<String> sensitiveValues) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String value : sensitiveValues) {
            if (value != null && value.trim().length() >= MIN_SECRET_LENGTH) {
                distinct.add(value.trim());
            }
        }
        List<String> sorted = new ArrayList<>(distinct);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        this.sensitiveValues = List.copyOf(sorted);
    }

    /**
     * Values of environment variables whose names look sensitive, plus the given credentials.
     */
    public static List<String> collectSensitiveValues(Map<String, String> environment, Collection<String> credentials) {
        List<String> values = new ArrayList<>(credentials);
        environment.forEach((name, value) -> {
            if (value != null && SENSITIVE_ENV_KEY.matcher(name).find()) {
                values.add(value);
            }
        });
        return values;
    }

    public String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = WHITESPACE.matcher(raw).replaceAll(" ").trim();
        if (normalized.isEmpty()) {
            return "";
        }

        String redacted = AUTH_SCHEME_TOKEN.matcher(normalized)
                .replaceAll(match -> Matcher.quoteReplacement(match.group(1) + " " + REDACTED));
        redacted = SECRET_QUERY_PARAM.matcher(redacted)
                .replaceAll(match -> Matcher.quoteReplacement(match.group(1) + REDACTED));

        for (String secret : sensitiveValues) {
            if (redacted.contains(secret)) {
                redacted = redacted.replace(secret, REDACTED);
            }
        }

        return limit(redacted);
    }

    /**
     * Sanitized warning text, or {@code fallback} when nothing printable is left.
     */
    public String normalizeWarning(String raw, String fallback) {
        String sanitized = sanitize(raw);
        return sanitized.isEmpty() ? fallback : sanitized;
    }

    private static String limit(String value) {
        if (value.length() <= MAX_PUBLIC_MESSAGE_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_PUBLIC_MESSAGE_LENGTH - 3) + "...";
    }
}
