package authkit.core.model.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;

import authkit.core.exception.ConfigException;
import authkit.core.exception.DataIntegrityException;
import authkit.core.port.out.JsonDocumentStore;
import authkit.core.util.JsonMaps;

/**
 * Parsing and merging of {@link AuthClientConfig} from the key/value form used
 * in config files.
 */
public final class AuthClientConfigs {

    public static final String CLIENT_TYPE = "client_type";

    private AuthClientConfigs() {}

    /**
     * Build a config from its key/value form. The {@code client_type} key selects the variant.
     *
     * @param map the config values
     * @return the validated config
     * @throws ConfigException if the client type is missing or unknown, or required fields are absent
     */
    public static AuthClientConfig fromMap(Map<String, ?> map) {
        if (map == null) {
            throw new ConfigException("Auth client config must not be null");
        }
        final var typeName = JsonMaps.string(map, CLIENT_TYPE)
                .orElseThrow(() -> new ConfigException("'" + CLIENT_TYPE + "' is required in auth client config"));
        final var clientType = ClientType.fromWireName(typeName)
                .orElseThrow(() -> new ConfigException("Unknown auth client type: " + typeName));

        return switch (clientType) {
            case NONE -> new NoOpClientConfig();
            case STATIC_API_KEY -> new StaticApiKeyClientConfig(
                    JsonMaps.string(map, "api_key").orElse(null),
                    JsonMaps.string(map, "bearer_token_prefix").orElse(null));
            case PLANET_LEGACY -> new PlanetLegacyClientConfig(
                    JsonMaps.string(map, "legacy_auth_endpoint").orElse(null),
                    JsonMaps.string(map, "api_key").orElse(null));
            default -> oidcFromMap(clientType, map);
        };
    }

    /**
     * Build a config from a JSON object string.
     */
    public static AuthClientConfig fromJson(String json) {
        try {
            return fromMap(JsonMaps.parseObject(json));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigException("Auth client config is not a valid JSON object: " + e.getMessage(), e);
        }
    }

    /**
     * Load a config file through the given document store.
     *
     * @throws ConfigException if the file does not exist or is invalid
     */
    public static AuthClientConfig fromFile(Path path, JsonDocumentStore store) {
        final Map<String, Object> data;
        try {
            data = store.read(path)
                    .orElseThrow(() -> new ConfigException("Auth client config file not found: " + path));
        } catch (DataIntegrityException e) {
            throw new ConfigException("Auth client config file " + path + " is not valid JSON", e);
        }
        return fromMap(data);
    }

    /**
     * Merge sparse values over an existing config and validate the result.
     * A null value in {@code sparse} removes the key. The original config is never modified.
     *
     * @param config the base config
     * @param sparse values to overlay
     * @return a new validated config
     * @throws ConfigException if the merged values are invalid
     */
    public static AuthClientConfig update(AuthClientConfig config, Map<String, ?> sparse) {
        final var merged = new LinkedHashMap<String, Object>(config.toMap());
        if (sparse != null) {
            sparse.forEach((key, value) -> {
                if (value == null) {
                    merged.remove(key);
                } else {
                    merged.put(key, value);
                }
            });
        }
        return fromMap(merged);
    }

    private static OidcClientConfig oidcFromMap(ClientType clientType, Map<String, ?> map) {
        final var endpoints = new OidcEndpoints(
                str(map, "authorization_endpoint"),
                str(map, "device_authorization_endpoint"),
                str(map, "token_endpoint"),
                str(map, "introspection_endpoint"),
                str(map, "revocation_endpoint"),
                str(map, "userinfo_endpoint"),
                str(map, "jwks_endpoint"));

        final var ackFile = str(map, "authorization_callback_acknowledgement_file");

        return OidcClientConfig.builder(clientType, str(map, "auth_server"), str(map, "client_id"))
                .issuer(str(map, "issuer"))
                .audiences(list(map, "audiences"))
                .scopes(list(map, "scopes"))
                .organization(str(map, "organization"))
                .projectId(str(map, "project_id"))
                .endpoints(endpoints)
                .clientAuthentication(clientAuthentication(clientType, map))
                .localRedirectUri(str(map, "local_redirect_uri"))
                .remoteRedirectUri(str(map, "remote_redirect_uri"))
                .callbackAcknowledgement(str(map, "authorization_callback_acknowledgement"))
                .callbackAcknowledgementFile(ackFile == null ? null : Path.of(ackFile))
                .username(str(map, "username"))
                .password(str(map, "password"))
                .build();
    }

    private static ClientAuthentication clientAuthentication(ClientType clientType, Map<String, ?> map) {
        final var kind = clientType.clientAuthKind().orElseThrow();
        switch (kind) {
            case CLIENT_SECRET:
                final var method = str(map, "client_auth_method");
                final ClientAuthentication.SecretPlacement placement;
                try {
                    placement = method == null
                            ? ClientAuthentication.SecretPlacement.BASIC
                            : ClientAuthentication.SecretPlacement.fromWireName(method);
                } catch (IllegalArgumentException e) {
                    throw new ConfigException(e.getMessage(), e);
                }
                return new ClientAuthentication.ClientSecret(str(map, "client_secret"), placement);
            case PRIVATE_KEY_JWT:
                final var keyFile = str(map, "client_privkey_file");
                return new ClientAuthentication.PrivateKeyJwt(
                        str(map, "client_privkey"),
                        keyFile == null ? null : Path.of(keyFile),
                        str(map, "client_privkey_password"));
            default:
                return new ClientAuthentication.None();
        }
    }

    private static String str(Map<String, ?> map, String key) {
        return JsonMaps.string(map, key).orElse(null);
    }

    private static List<String> list(Map<String, ?> map, String key) {
        return JsonMaps.stringList(map, key);
    }
}
