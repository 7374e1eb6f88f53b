package com.tripmate.routeplanner.routing.provider;

import com.tripmate.routeplanner.model.ProviderId;

/**
 * A single provider attempt did not produce an estimate. Recoverable: the chain moves on to
 * the next provider or the geometric fallback.
 */
public class ProviderFailureException extends Exception {

    private final ProviderId provider;

    public ProviderFailureException(ProviderId provider, String reason) {
        super(reason);
        this.provider = provider;
    }

    public ProviderFailureException(ProviderId provider, String reason, Throwable cause) {
        super(reason, cause);
        this.provider = provider;
    }

    public ProviderId getProvider() {
        return provider;
    }
}
