package authkit.core.model.credential;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

import authkit.core.exception.DataIntegrityException;
import authkit.core.port.out.JsonDocumentStore;
import authkit.core.util.JsonMaps;

/**
 * A static API key presented with a configurable header prefix.
 */
public class ApiKeyCredential extends Credential {

    public static final String API_KEY = "api_key";
    public static final String BEARER_TOKEN_PREFIX = "bearer_token_prefix";

    public ApiKeyCredential(Map<String, ?> data, Path path, JsonDocumentStore store, Clock clock) {
        super(data, path, store, clock);
    }

    public static ApiKeyCredential of(String apiKey, String prefix, JsonDocumentStore store, Clock clock) {
        return new ApiKeyCredential(Map.of(API_KEY, apiKey, BEARER_TOKEN_PREFIX, prefix), null, store, clock);
    }

    @Override
    protected void checkData(Map<String, ?> data) {
        super.checkData(data);
        if (JsonMaps.string(data, API_KEY).filter(v -> !v.isBlank()).isEmpty()) {
            throw new DataIntegrityException("'api_key' not found in API key credential data", path(), null);
        }
        if (JsonMaps.string(data, BEARER_TOKEN_PREFIX).isEmpty()) {
            throw new DataIntegrityException(
                    "'bearer_token_prefix' not found in API key credential data", path(), null);
        }
    }

    public String apiKey() {
        return getString(API_KEY).orElse(null);
    }

    public String bearerTokenPrefix() {
        return getString(BEARER_TOKEN_PREFIX).orElse(null);
    }
}
