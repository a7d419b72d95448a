package authkit.core.service.oidc;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import authkit.core.config.AuthKitConfig;
import authkit.core.exception.ProtocolException;
import authkit.core.exception.TransportException;
import authkit.core.port.out.HttpTransport;
import authkit.core.port.out.TransportRequest;
import authkit.core.port.out.TransportResponse;
import authkit.core.util.JsonMaps;

/**
 * Base for clients of a single OAuth2/OIDC endpoint.
 *
 * <p>Responses are classified most specific first:
 * <ol>
 *   <li>a JSON payload carrying {@code error} or {@code errorCode} fails with {@link ProtocolException}</li>
 *   <li>a non-2xx status fails with {@link TransportException}</li>
 *   <li>when JSON is expected, a missing or non-JSON payload fails with {@link ProtocolException}</li>
 * </ol>
 */
public abstract class OidcApiClient {

    private static final Logger LOG = Logger.getLogger(OidcApiClient.class);

    static final String APPLICATION_JSON = "application/json";
    static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    private final HttpTransport transport;
    private final String endpointUri;
    private final AuthKitConfig.HttpConfig httpConfig;

    protected OidcApiClient(HttpTransport transport, String endpointUri, AuthKitConfig.HttpConfig httpConfig) {
        if (endpointUri == null || endpointUri.isBlank()) {
            throw new IllegalArgumentException("endpointUri cannot be null or blank");
        }
        this.transport = transport;
        this.endpointUri = endpointUri;
        this.httpConfig = httpConfig;
    }

    public String endpointUri() {
        return endpointUri;
    }

    protected TransportResponse checkedGet(Map<String, String> query, Map<String, String> headers) {
        var uri = endpointUri;
        if (query != null && !query.isEmpty()) {
            uri += (uri.contains("?") ? "&" : "?") + formEncode(query);
        }
        final var response = transport.send(TransportRequest.get(uri, baseHeaders(headers, null)));
        checkResponseBaseline(response);
        return response;
    }

    protected TransportResponse checkedPostForm(Map<String, String> form, Map<String, String> headers) {
        final var response = transport.send(
                TransportRequest.post(endpointUri, baseHeaders(headers, FORM_URLENCODED), formEncode(form)));
        checkResponseBaseline(response);
        return response;
    }

    protected TransportResponse checkedPostJson(Map<String, ?> body, Map<String, String> headers) {
        final var response = transport.send(
                TransportRequest.post(endpointUri, baseHeaders(headers, APPLICATION_JSON), JsonMaps.toJson(body)));
        checkResponseBaseline(response);
        return response;
    }

    protected Map<String, Object> checkedGetJson(Map<String, String> query, Map<String, String> headers) {
        return checkJsonResponse(checkedGet(query, headers));
    }

    protected Map<String, Object> checkedPostFormJson(Map<String, String> form, Map<String, String> headers) {
        return checkJsonResponse(checkedPostForm(form, headers));
    }

    protected Map<String, Object> checkedPostJsonJson(Map<String, ?> body, Map<String, String> headers) {
        return checkJsonResponse(checkedPostJson(body, headers));
    }

    /**
     * Post a form after passing it through the client authentication enricher.
     */
    protected Map<String, Object> enrichedPostFormJson(Map<String, String> form, ClientAuthEnricher enricher) {
        final var enriched = enricher.enrich(form, endpointUri);
        return checkedPostFormJson(enriched.form(), enriched.headers());
    }

    private Map<String, String> baseHeaders(Map<String, String> extra, String contentType) {
        final var headers = new LinkedHashMap<String, String>();
        headers.put("Accept", APPLICATION_JSON);
        headers.put(httpConfig.applicationHeader(), httpConfig.applicationName());
        if (contentType != null) {
            headers.put("Content-Type", contentType);
        }
        if (extra != null) {
            headers.putAll(extra);
        }
        return headers;
    }

    private void checkResponseBaseline(TransportResponse response) {
        checkOidcPayloadError(response);
        checkHttpError(response);
    }

    private void checkOidcPayloadError(TransportResponse response) {
        if (response.body().isEmpty() || !isJson(response)) {
            return;
        }
        final var json = JsonMaps.tryParseObject(response.body());
        if (json.isEmpty()) {
            return;
        }
        final var payload = json.get();
        final var error = JsonMaps.string(payload, "error").filter(s -> !s.isBlank());
        if (error.isPresent()) {
            LOG.debugf("Error payload from %s: %s", endpointUri, error.get());
            throw new ProtocolException(
                    endpointUri,
                    response.statusCode(),
                    error.get(),
                    JsonMaps.string(payload, "error_description").orElse(null),
                    response.body());
        }
        final var errorCode = JsonMaps.string(payload, "errorCode").filter(s -> !s.isBlank());
        if (errorCode.isPresent()) {
            LOG.debugf("Error payload from %s: %s", endpointUri, errorCode.get());
            throw new ProtocolException(
                    endpointUri,
                    response.statusCode(),
                    errorCode.get(),
                    JsonMaps.string(payload, "errorSummary").orElse(null),
                    response.body());
        }
    }

    private void checkHttpError(TransportResponse response) {
        if (!response.isSuccess()) {
            throw new TransportException(
                    String.format("HTTP error from OIDC endpoint at %s: %d", endpointUri, response.statusCode()),
                    response.statusCode());
        }
    }

    private Map<String, Object> checkJsonResponse(TransportResponse response) {
        if (!response.body().isEmpty() && !isJson(response)) {
            throw new ProtocolException(
                    endpointUri,
                    response.statusCode(),
                    String.format(
                            "Error from OIDC endpoint at %s: Expected json content-type, but got \"%s\"",
                            endpointUri, response.header("content-type").orElse("")),
                    response.body());
        }
        return JsonMaps.tryParseObject(response.body())
                .filter(m -> !m.isEmpty())
                .orElseThrow(() -> new ProtocolException(
                        endpointUri,
                        response.statusCode(),
                        String.format(
                                "Error from OIDC endpoint at %s: Expected JSON response payload, but none was found.",
                                endpointUri),
                        response.body()));
    }

    private static boolean isJson(TransportResponse response) {
        return APPLICATION_JSON.equals(parseContentType(response.header("content-type").orElse(null)));
    }

    /**
     * Media type of a Content-Type header value, lowercased and without parameters.
     *
     * @param headerValue the header value, may be null
     * @return the media type, or null if absent
     */
    static String parseContentType(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return null;
        }
        final var semicolon = headerValue.indexOf(';');
        final var mediaType = semicolon >= 0 ? headerValue.substring(0, semicolon) : headerValue;
        return mediaType.trim().toLowerCase(Locale.ROOT);
    }

    static String formEncode(Map<String, String> form) {
        if (form == null) {
            return "";
        }
        return form.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
