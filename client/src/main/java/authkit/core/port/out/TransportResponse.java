package authkit.core.port.out;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A received HTTP response.
 *
 * @param statusCode HTTP status
 * @param headers    response headers, names lowercased
 * @param body       response body, empty when absent
 */
public record TransportResponse(int statusCode, Map<String, String> headers, String body) {

    public TransportResponse {
        headers = headers == null
                ? Map.of()
                : headers.entrySet().stream()
                        .collect(Collectors.toUnmodifiableMap(
                                e -> e.getKey().toLowerCase(Locale.ROOT), Map.Entry::getValue, (a, b) -> a));
        if (body == null) {
            body = "";
        }
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
