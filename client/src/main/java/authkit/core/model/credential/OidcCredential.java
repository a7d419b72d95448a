package authkit.core.model.credential;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import authkit.core.exception.DataIntegrityException;
import authkit.core.port.out.JsonDocumentStore;
import authkit.core.util.JsonMaps;

/**
 * OAuth2/OIDC token set as returned by a token endpoint.
 *
 * <p>At least one of access, ID or refresh token must be present.
 */
public class OidcCredential extends Credential {

    public static final String ACCESS_TOKEN = "access_token";
    public static final String ID_TOKEN = "id_token";
    public static final String REFRESH_TOKEN = "refresh_token";
    public static final String TOKEN_TYPE = "token_type";
    public static final String SCOPE = "scope";
    public static final String EXPIRES_IN = "expires_in";

    public OidcCredential(Map<String, ?> data, Path path, JsonDocumentStore store, Clock clock) {
        super(data, path, store, clock);
    }

    /**
     * Build an in-memory credential from a token endpoint response.
     */
    public static OidcCredential fromTokenResponse(Map<String, ?> response, JsonDocumentStore store, Clock clock) {
        return new OidcCredential(stamped(response, clock), null, store, clock);
    }

    @Override
    protected void checkData(Map<String, ?> data) {
        super.checkData(data);
        if (isBlank(data, ACCESS_TOKEN) && isBlank(data, ID_TOKEN) && isBlank(data, REFRESH_TOKEN)) {
            throw new DataIntegrityException(
                    "'access_token', 'id_token', or 'refresh_token' not found in OIDC credential data", path(), null);
        }
    }

    private static boolean isBlank(Map<String, ?> data, String key) {
        return JsonMaps.string(data, key).filter(v -> !v.isBlank()).isEmpty();
    }

    public Optional<String> accessToken() {
        return getString(ACCESS_TOKEN);
    }

    public Optional<String> idToken() {
        return getString(ID_TOKEN);
    }

    public Optional<String> refreshToken() {
        return getString(REFRESH_TOKEN).filter(t -> !t.isBlank());
    }

    public Optional<String> tokenType() {
        return getString(TOKEN_TYPE);
    }

    public Optional<String> scope() {
        return getString(SCOPE);
    }

    public Optional<Long> expiresIn() {
        return data() == null ? Optional.empty() : JsonMaps.number(data(), EXPIRES_IN);
    }
}
