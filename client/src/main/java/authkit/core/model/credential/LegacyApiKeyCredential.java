package authkit.core.model.credential;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import authkit.core.exception.DataIntegrityException;
import authkit.core.port.out.JsonDocumentStore;
import authkit.core.util.JsonMaps;

/**
 * API key obtained through the legacy login endpoint, optionally with the JWT it was extracted from.
 */
public class LegacyApiKeyCredential extends Credential {

    public static final String KEY = "key";
    public static final String JWT = "jwt";

    public LegacyApiKeyCredential(Map<String, ?> data, Path path, JsonDocumentStore store, Clock clock) {
        super(data, path, store, clock);
    }

    public static LegacyApiKeyCredential of(String key, String jwt, JsonDocumentStore store, Clock clock) {
        final var data = new LinkedHashMap<String, Object>();
        data.put(KEY, key);
        if (jwt != null) {
            data.put(JWT, jwt);
        }
        return new LegacyApiKeyCredential(data, null, store, clock);
    }

    @Override
    protected void checkData(Map<String, ?> data) {
        super.checkData(data);
        if (JsonMaps.string(data, KEY).filter(v -> !v.isBlank()).isEmpty()) {
            throw new DataIntegrityException("'key' not found in legacy API key credential data", path(), null);
        }
    }

    public String legacyApiKey() {
        return getString(KEY).orElse(null);
    }

    public Optional<String> legacyJwt() {
        return getString(JWT);
    }
}
