package authkit.core.port.out;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An outgoing HTTP request.
 *
 * @param method  request method
 * @param uri     absolute request URI
 * @param headers request headers
 * @param body    request body, or null for none
 */
public record TransportRequest(Method method, String uri, Map<String, String> headers, String body) {

    public enum Method {
        GET,
        POST
    }

    public TransportRequest {
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportRequest get(String uri, Map<String, String> headers) {
        return new TransportRequest(Method.GET, uri, headers, null);
    }

    public static TransportRequest post(String uri, Map<String, String> headers, String body) {
        return new TransportRequest(Method.POST, uri, headers, body);
    }

    /**
     * Copy of this request with one more header, replacing any header of the same name.
     */
    public TransportRequest withHeader(String name, String value) {
        final var copy = new LinkedHashMap<String, String>();
        headers.forEach((k, v) -> {
            if (!k.equalsIgnoreCase(name)) {
                copy.put(k, v);
            }
        });
        copy.put(name, value);
        return new TransportRequest(method, uri, copy, body);
    }

    public boolean hasHeader(String name) {
        return headers.keySet().stream().anyMatch(k -> k.equalsIgnoreCase(name));
    }
}
