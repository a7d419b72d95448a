package authkit.core.service.oidc;

import java.util.Map;

/**
 * Adds client authentication to a request bound for a token, introspection or
 * revocation endpoint.
 */
@FunctionalInterface
public interface ClientAuthEnricher {

    /**
     * Enrich a form payload.
     *
     * @param payload  the raw form fields
     * @param audience the endpoint URI the request is sent to
     * @return the enriched form fields plus any headers to add
     */
    EnrichedPayload enrich(Map<String, String> payload, String audience);

    /**
     * Form fields and extra headers for an authenticated client request.
     */
    record EnrichedPayload(Map<String, String> form, Map<String, String> headers) {
        public EnrichedPayload {
            form = form == null ? Map.of() : Map.copyOf(form);
            headers = headers == null ? Map.of() : Map.copyOf(headers);
        }
    }
}
