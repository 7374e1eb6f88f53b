package com.tripmate.routeplanner.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Providers that have a usable credential in this process. Immutable once built.
 */
public final class ProviderCapabilities {

    private static final ProviderCapabilities NONE = new ProviderCapabilities(Map.of());

    private final Map<ProviderId, String> credentials;

    public ProviderCapabilities(Map<ProviderId, String> credentials) {
        EnumMap<ProviderId, String> copy = new EnumMap<>(ProviderId.class);
        credentials.forEach((provider, credential) -> {
            if (provider == ProviderId.FALLBACK) {
                throw new IllegalArgumentException("fallback needs no credential");
            }
            if (credential != null && !credential.isBlank()) {
                copy.put(provider, credential.trim());
            }
        });
        this.credentials = Collections.unmodifiableMap(copy);
    }

    public static ProviderCapabilities none() {
        return NONE;
    }

    public boolean isEnabled(ProviderId provider) {
        return credentials.containsKey(provider);
    }

    public String credential(ProviderId provider) {
        return credentials.get(provider);
    }

    public boolean isEmpty() {
        return credentials.isEmpty();
    }

    public Set<ProviderId> enabledProviders() {
        return credentials.keySet();
    }

    public Collection<String> credentialValues() {
        return credentials.values();
    }

    @Override
    public String toString() {
        // credential values stay out of logs
        return "ProviderCapabilities" + enabledProviders();
    }
}
