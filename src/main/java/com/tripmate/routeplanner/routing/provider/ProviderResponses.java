package com.tripmate.routeplanner.routing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmate.routeplanner.model.ProviderId;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Helpers shared by the provider clients: transport error mapping and lenient number reading.
 */
final class ProviderResponses {

    private ProviderResponses() {
    }

    static JsonNode fetch(ProviderId provider, ObjectMapper objectMapper, Supplier<String> call)
            throws ProviderFailureException {
        String body;
        try {
            body = call.get();
        } catch (RestClientResponseException e) {
            throw new ProviderFailureException(provider, "HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new ProviderFailureException(provider, "network error: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ProviderFailureException(provider, e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new ProviderFailureException(provider, "empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ProviderFailureException(provider, "invalid JSON response", e);
        }
    }

    /**
     * Reads a finite number from a JSON number or numeric string.
     */
    static OptionalDouble finiteNumber(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return OptionalDouble.empty();
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual() && !node.asText().isBlank()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
