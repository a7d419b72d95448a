package authkit.core.service.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import authkit.core.model.config.ClientAuthentication;
import authkit.core.model.config.OidcClientConfig;
import authkit.core.service.oidc.ClientAuthEnricher;
import authkit.core.service.oidc.ClientAuthEnricher.EnrichedPayload;

/**
 * Client authentication enrichers, one per client authentication kind.
 */
public final class ClientAuthEnrichers {

    private ClientAuthEnrichers() {}

    /**
     * Select the enricher for a client config.
     */
    public static ClientAuthEnricher forConfig(OidcClientConfig config, Clock clock) {
        final var auth = config.clientAuthentication();
        if (auth instanceof ClientAuthentication.ClientSecret secret) {
            return clientSecret(config.clientId(), secret);
        }
        if (auth instanceof ClientAuthentication.PrivateKeyJwt key) {
            return privateKeyJwt(config.clientId(), new ClientAssertionSigner(config.clientId(), key, clock));
        }
        return none(config.clientId());
    }

    /**
     * Public client: only identifies itself with {@code client_id}.
     */
    public static ClientAuthEnricher none(String clientId) {
        return (payload, audience) -> {
            final var form = new LinkedHashMap<>(payload);
            form.put("client_id", clientId);
            return new EnrichedPayload(form, Map.of());
        };
    }

    /**
     * Shared secret, as HTTP Basic credentials or as form fields.
     */
    public static ClientAuthEnricher clientSecret(String clientId, ClientAuthentication.ClientSecret secret) {
        return (payload, audience) -> {
            final var form = new LinkedHashMap<>(payload);
            form.put("client_id", clientId);
            if (secret.placement() == ClientAuthentication.SecretPlacement.POST) {
                form.put("client_secret", secret.secret());
                return new EnrichedPayload(form, Map.of());
            }
            return new EnrichedPayload(form, Map.of("Authorization", basicAuth(clientId, secret.secret())));
        };
    }

    /**
     * Signed JWT assertion. The assertion audience is the endpoint being called.
     */
    public static ClientAuthEnricher privateKeyJwt(String clientId, ClientAssertionSigner signer) {
        return (payload, audience) -> {
            final var form = new LinkedHashMap<>(payload);
            form.put("client_id", clientId);
            form.put("client_assertion_type", ClientAssertionSigner.ASSERTION_TYPE);
            form.put("client_assertion", signer.sign(audience));
            return new EnrichedPayload(form, Map.of());
        };
    }

    static String basicAuth(String clientId, String secret) {
        // RFC 6749 section 2.3.1: both parts are form-urlencoded before base64
        final var credentials = URLEncoder.encode(clientId, StandardCharsets.UTF_8) + ":"
                + URLEncoder.encode(secret, StandardCharsets.UTF_8);
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
