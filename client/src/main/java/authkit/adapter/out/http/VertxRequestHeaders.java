package authkit.adapter.out.http;

import java.util.Optional;

import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;

import authkit.core.service.request.RequestAuthenticator;
import authkit.core.service.request.RequestHeaders;

/**
 * Header view of a Vert.x WebClient request, so a {@link RequestAuthenticator} can
 * decorate requests an application sends with its own WebClient.
 */
public class VertxRequestHeaders implements RequestHeaders {

    private final HttpRequest<Buffer> request;

    public VertxRequestHeaders(HttpRequest<Buffer> request) {
        this.request = request;
    }

    /**
     * Run the authenticator's hook and apply its headers to the request.
     *
     * @return the same request, for chaining
     */
    public static HttpRequest<Buffer> authenticate(HttpRequest<Buffer> request, RequestAuthenticator authenticator) {
        authenticator.applyTo(new VertxRequestHeaders(request));
        return request;
    }

    @Override
    public Optional<String> get(String name) {
        return Optional.ofNullable(request.headers().get(name));
    }

    @Override
    public void set(String name, String value) {
        request.putHeader(name, value);
    }
}
