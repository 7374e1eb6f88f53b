package com.tripmate.routeplanner.config;

import com.tripmate.routeplanner.model.ProviderCapabilities;
import com.tripmate.routeplanner.model.ProviderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides once per process which providers have credentials. Each provider accepts several
 * property/environment names; the first non-blank one wins.
 */
@Slf4j
@Component
public class ProviderCredentialResolver {

    static final Map<ProviderId, List<String>> CREDENTIAL_NAMES;

    static {
        Map<ProviderId, List<String>> names = new LinkedHashMap<>();
        names.put(ProviderId.KAKAO, List.of(
                "route.providers.kakao.api-key", "KAKAO_REST_API_KEY", "KAKAO_API_KEY", "KAKAO_KEY"));
        names.put(ProviderId.ODSAY, List.of(
                "route.providers.odsay.api-key", "ODSAY_API_KEY", "ODSAY_KEY"));
        CREDENTIAL_NAMES = names;
    }

    private final Environment environment;

    private volatile ProviderCapabilities capabilities;

    public ProviderCredentialResolver(Environment environment) {
        this.environment = environment;
    }

    /**
     * Memoized: credentials do not change while the process runs, so the first resolution wins.
     */
    public ProviderCapabilities resolveCapabilities() {
        ProviderCapabilities resolved = capabilities;
        if (resolved == null) {
            synchronized (this) {
                resolved = capabilities;
                if (resolved == null) {
                    resolved = resolve();
                    capabilities = resolved;
                }
            }
        }
        return resolved;
    }

    private ProviderCapabilities resolve() {
        Map<ProviderId, String> credentials = new EnumMap<>(ProviderId.class);
        CREDENTIAL_NAMES.forEach((provider, names) -> {
            for (String name : names) {
                String value = environment.getProperty(name);
                if (value != null && !value.isBlank()) {
                    credentials.put(provider, value.trim());
                    break;
                }
            }
        });

        ProviderCapabilities resolved = new ProviderCapabilities(credentials);
        if (resolved.isEmpty()) {
            log.warn("⚠️ No route provider credentials configured, every segment will use the geometric fallback");
        } else {
            log.info("Route providers enabled: {}", resolved.enabledProviders());
        }
        return resolved;
    }
}
