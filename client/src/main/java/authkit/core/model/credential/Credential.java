package authkit.core.model.credential;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import authkit.core.port.out.JsonDocumentStore;
import authkit.core.util.JsonMaps;

/**
 * Base type for stored credentials.
 *
 * <p>Credentials built from a server response carrying {@code expires_in} are
 * stamped with {@code _iat} and {@code _exp} epoch seconds so their age can be
 * judged without decoding the credential itself.
 */
public class Credential extends FileBackedJsonObject {

    public static final String ISSUED_AT = "_iat";
    public static final String EXPIRES_AT = "_exp";

    public Credential(Map<String, ?> data, Path path, JsonDocumentStore store, Clock clock) {
        super(data, path, store, clock);
    }

    public Optional<Long> issuedAt() {
        return data() == null ? Optional.empty() : JsonMaps.number(data(), ISSUED_AT);
    }

    public Optional<Long> expiresAt() {
        return data() == null ? Optional.empty() : JsonMaps.number(data(), EXPIRES_AT);
    }

    /**
     * Whether the stamped expiry has passed. Credentials without an expiry never expire.
     */
    public boolean isExpired() {
        return expiresAt()
                .map(exp -> clock().instant().getEpochSecond() >= exp)
                .orElse(false);
    }

    /**
     * Copy a server response, adding issue and expiry stamps when it carries {@code expires_in}.
     */
    static Map<String, Object> stamped(Map<String, ?> response, Clock clock) {
        final var data = JsonMaps.withoutNulls(response);
        final var expiresIn = JsonMaps.number(response, "expires_in");
        if (expiresIn.isPresent()) {
            final var now = clock.instant().getEpochSecond();
            data.put(ISSUED_AT, now);
            data.put(EXPIRES_AT, now + expiresIn.get());
        }
        return new LinkedHashMap<>(data);
    }
}
