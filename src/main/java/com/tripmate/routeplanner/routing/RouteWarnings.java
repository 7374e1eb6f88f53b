package com.tripmate.routeplanner.routing;

import com.tripmate.routeplanner.service.PublicTextSanitizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-request warning log. Every entry is sanitized on the way in, so the list can be
 * returned to clients as is.
 */
public class RouteWarnings {

    private static final String GENERIC_WARNING = "Route estimate degraded.";

    private final PublicTextSanitizer sanitizer;
    private final List<String> messages = new ArrayList<>();
    private final Set<String> onceKeys = new HashSet<>();

    public RouteWarnings(PublicTextSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    public void add(String raw) {
        messages.add(sanitizer.normalizeWarning(raw, GENERIC_WARNING));
    }

    /**
     * Redacts {@code raw} the same way warnings are, for text that goes to the server log.
     */
    public String sanitize(String raw) {
        return sanitizer.sanitize(raw);
    }

    /**
     * Adds {@code raw} unless a warning with the same key was already recorded.
     */
    public void addOnce(String key, String raw) {
        if (onceKeys.add(key)) {
            add(raw);
        }
    }

    public List<String> asList() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public int size() {
        return messages.size();
    }
}
