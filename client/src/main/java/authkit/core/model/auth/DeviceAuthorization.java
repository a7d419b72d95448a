package authkit.core.model.auth;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import authkit.core.exception.ProtocolException;
import authkit.core.util.JsonMaps;

/**
 * An initiated device authorization, as returned by the device authorization endpoint.
 *
 * @param deviceCode              code the client polls with
 * @param userCode                code shown to the user
 * @param verificationUri         where the user enters the code
 * @param verificationUriComplete verification URI with the code embedded, may be null
 * @param expiresIn               lifetime in seconds
 * @param interval                server requested poll interval in seconds, may be null
 * @param initiatedAt             epoch second the authorization was obtained
 */
public record DeviceAuthorization(
        String deviceCode,
        String userCode,
        String verificationUri,
        String verificationUriComplete,
        long expiresIn,
        Long interval,
        long initiatedAt) {

    public DeviceAuthorization {
        if (deviceCode == null || deviceCode.isBlank()) {
            throw new IllegalArgumentException("deviceCode cannot be null or blank");
        }
    }

    /**
     * Parse a device authorization endpoint response.
     *
     * @throws ProtocolException if required fields are missing
     */
    public static DeviceAuthorization fromResponse(
            String endpoint, Map<String, ?> response, long defaultExpiresIn, long now) {
        final var deviceCode = JsonMaps.string(response, "device_code").orElse(null);
        final var userCode = JsonMaps.string(response, "user_code").orElse(null);
        final var verificationUri = JsonMaps.string(response, "verification_uri")
                .or(() -> JsonMaps.string(response, "verification_url"))
                .orElse(null);
        if (deviceCode == null || userCode == null || verificationUri == null) {
            throw new ProtocolException(
                    endpoint,
                    200,
                    "Device authorization response is missing device_code, user_code or verification_uri",
                    JsonMaps.toJson(response));
        }
        return new DeviceAuthorization(
                deviceCode,
                userCode,
                verificationUri,
                JsonMaps.string(response, "verification_uri_complete").orElse(null),
                JsonMaps.number(response, "expires_in").orElse(defaultExpiresIn),
                JsonMaps.number(response, "interval").orElse(null),
                JsonMaps.number(response, "_initiated_at").orElse(now));
    }

    public Optional<String> completeUri() {
        return Optional.ofNullable(verificationUriComplete);
    }

    public Optional<Long> pollInterval() {
        return Optional.ofNullable(interval);
    }

    public long expiresAt() {
        return initiatedAt + expiresIn;
    }

    /**
     * Key/value form, suitable for handing to another process that completes the login.
     */
    public Map<String, Object> toMap() {
        final var map = new LinkedHashMap<String, Object>();
        map.put("device_code", deviceCode);
        map.put("user_code", userCode);
        map.put("verification_uri", verificationUri);
        if (verificationUriComplete != null) {
            map.put("verification_uri_complete", verificationUriComplete);
        }
        map.put("expires_in", expiresIn);
        if (interval != null) {
            map.put("interval", interval);
        }
        map.put("_initiated_at", initiatedAt);
        return map;
    }

    /**
     * Rebuild an authorization from {@link #toMap()} output. A map without {@code _initiated_at}
     * is treated as initiated at {@code now}.
     */
    public static DeviceAuthorization fromMap(Map<String, ?> map, long now) {
        return fromResponse("device authorization", map, 0L, now);
    }
}
