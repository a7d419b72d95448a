package authkit.core.service.auth;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import org.jboss.logging.Logger;

import authkit.core.AuthContext;
import authkit.core.exception.ConfigException;
import authkit.core.exception.TokenValidationException;
import authkit.core.exception.TokenValidationException.Kind;
import authkit.core.model.auth.UnverifiedJwt;
import authkit.core.model.auth.ValidatedClaims;
import authkit.core.model.config.OidcClientConfig;
import authkit.core.service.client.AuthClients;
import authkit.core.service.client.OidcAuthClient;

/**
 * Validates access tokens from any of a fixed set of trusted issuers.
 *
 * <p>The issuer is read from the token without verification only to pick the trust
 * entry. The token is then fully validated against that entry's keys, so a forged
 * {@code iss} cannot get past the signature check. Issuers match exactly.
 */
public class MultiIssuerValidator {

    private static final Logger LOG = Logger.getLogger(MultiIssuerValidator.class);

    private final Map<String, TrustEntry> trusted;

    public MultiIssuerValidator(Collection<TrustEntry> entries) {
        final var byIssuer = new LinkedHashMap<String, TrustEntry>();
        for (final var entry : entries) {
            if (byIssuer.putIfAbsent(entry.issuer(), entry) != null) {
                throw new ConfigException("Issuer " + entry.issuer() + " is trusted more than once");
            }
        }
        this.trusted = Map.copyOf(byIssuer);
    }

    /**
     * Trust the issuers of the given clients. Each client's config must hold exactly one audience.
     */
    public static MultiIssuerValidator fromClients(Collection<? extends OidcAuthClient> clients) {
        return new MultiIssuerValidator(clients.stream().map(TrustEntry::fromClient).toList());
    }

    /**
     * Trust the issuers described by the given client configs.
     */
    public static MultiIssuerValidator fromConfigs(Collection<OidcClientConfig> configs, AuthContext context) {
        return fromClients(configs.stream().map(c -> AuthClients.createOidc(c, context)).toList());
    }

    public Set<String> trustedIssuers() {
        return trusted.keySet();
    }

    public Result validateAccessToken(String token) {
        return validateAccessToken(token, List.of(), false);
    }

    /**
     * Validate a bearer token.
     *
     * @param token       the compact JWT
     * @param scopesAnyOf scopes of which the token must hold at least one, may be empty
     * @param remoteCheck also ask the issuer whether the token is still active
     * @return the local claims and, when requested, the introspection result
     * @throws TokenValidationException with kind UNTRUSTED_ISSUER if the issuer is not trusted,
     *                                  or the kind of the failed check
     */
    public Result validateAccessToken(String token, Collection<String> scopesAnyOf, boolean remoteCheck) {
        final var issuer = UnverifiedJwt.decode(token)
                .issuer()
                .orElseThrow(() -> new TokenValidationException(Kind.MALFORMED_ARGUMENT, "Token has no issuer"));
        final var entry = trusted.get(issuer);
        if (entry == null) {
            LOG.debugv("Rejecting token from untrusted issuer {0}", issuer);
            throw new TokenValidationException(Kind.UNTRUSTED_ISSUER, "Issuer is not trusted: " + issuer);
        }

        final var claims = entry.validator().validateToken(token, entry.issuer(), entry.audience(), scopesAnyOf);
        if (!remoteCheck) {
            return new Result(claims, null);
        }
        if (entry.remoteCheck() == null) {
            throw new ConfigException("No remote validation available for issuer " + issuer);
        }
        return new Result(claims, entry.remoteCheck().apply(token));
    }

    /**
     * One trusted issuer.
     *
     * @param issuer      the exact {@code iss} value
     * @param audience    the audience tokens must carry
     * @param validator   validator bound to the issuer's keys
     * @param remoteCheck introspection call for the issuer, may be null
     */
    public record TrustEntry(
            String issuer,
            String audience,
            TokenValidator validator,
            Function<String, Map<String, Object>> remoteCheck) {

        public TrustEntry {
            if (issuer == null || issuer.isBlank()) {
                throw new ConfigException("Trusted issuer cannot be blank");
            }
            if (audience == null || audience.isBlank()) {
                throw new ConfigException("Audience for trusted issuer " + issuer + " cannot be blank");
            }
            if (validator == null) {
                throw new ConfigException("Validator for trusted issuer " + issuer + " is required");
            }
        }

        static TrustEntry fromClient(OidcAuthClient client) {
            final var audiences = client.config().audiences();
            if (audiences.size() != 1) {
                throw new ConfigException("Exactly one audience must be configured for trusted auth server "
                        + client.config().authServer());
            }
            return new TrustEntry(
                    client.issuer(), audiences.get(0), client.tokenValidator(), client::validateAccessTokenRemote);
        }
    }

    /**
     * Outcome of a successful validation.
     *
     * @param localClaims  claims verified against the issuer's keys
     * @param remoteClaims introspection response, null unless a remote check was requested
     */
    public record Result(ValidatedClaims localClaims, Map<String, Object> remoteClaims) {

        public Optional<Map<String, Object>> remote() {
            return Optional.ofNullable(remoteClaims);
        }
    }
}
