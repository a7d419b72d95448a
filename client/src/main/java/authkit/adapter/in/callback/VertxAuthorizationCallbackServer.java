package authkit.adapter.in.callback;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.http.HttpServer;
import io.vertx.mutiny.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import authkit.core.exception.AuthorizationCodeException;
import authkit.core.model.auth.AuthorizationCallback;
import authkit.core.port.out.AuthorizationCallbackReceiver;

/**
 * Receives authorization redirects on a short-lived local Vert.x HTTP server.
 *
 * <p>The server binds the host and port of the redirect URI and answers only its
 * path. The first request on that path completes the pending callback.
 */
public class VertxAuthorizationCallbackServer implements AuthorizationCallbackReceiver {

    private static final Logger LOG = Logger.getLogger(VertxAuthorizationCallbackServer.class);
    private static final Duration BIND_TIMEOUT = Duration.ofSeconds(10);

    static final String DEFAULT_ACKNOWLEDGEMENT =
            "<html><head><title>Login complete</title></head>"
                    + "<body><p>Login complete. You may close this window.</p></body></html>";

    private final Vertx vertx;

    public VertxAuthorizationCallbackServer(Vertx vertx) {
        this.vertx = vertx;
    }

    @Override
    public PendingCallback listen(URI redirectUri, String acknowledgementHtml) {
        final var host = redirectUri.getHost() == null ? "localhost" : redirectUri.getHost();
        final var port = redirectUri.getPort() > 0 ? redirectUri.getPort() : 80;
        final var path = redirectUri.getPath() == null || redirectUri.getPath().isEmpty() ? "/" : redirectUri.getPath();
        final var body = acknowledgementHtml == null ? DEFAULT_ACKNOWLEDGEMENT : acknowledgementHtml;
        final var result = new CompletableFuture<AuthorizationCallback>();

        final var server = vertx.createHttpServer().requestHandler(request -> handle(request, path, body, result));
        try {
            server.listen(port, host).await().atMost(BIND_TIMEOUT);
        } catch (RuntimeException e) {
            throw new AuthorizationCodeException(
                    AuthorizationCodeException.Reason.SERVER_ERROR,
                    "Could not listen for the authorization callback on " + host + ":" + port,
                    e);
        }
        LOG.debugf("Listening for authorization callback on %s:%d%s", host, port, path);
        return new VertxPendingCallback(server, result);
    }

    private static void handle(
            HttpServerRequest request, String path, String body, CompletableFuture<AuthorizationCallback> result) {
        if (!path.equals(request.path())) {
            request.response().setStatusCode(404).endAndForget();
            return;
        }
        final var callback = new AuthorizationCallback(
                request.getParam("code"),
                request.getParam("state"),
                request.getParam("error"),
                request.getParam("error_description"));
        request.response()
                .setStatusCode(callback.isError() ? 400 : 200)
                .putHeader("Content-Type", "text/html; charset=utf-8")
                .endAndForget(body);
        if (!result.complete(callback)) {
            LOG.debug("Ignoring repeated authorization callback");
        }
    }

    private static final class VertxPendingCallback implements PendingCallback {

        private final HttpServer server;
        private final CompletableFuture<AuthorizationCallback> result;

        VertxPendingCallback(HttpServer server, CompletableFuture<AuthorizationCallback> result) {
            this.server = server;
            this.result = result;
        }

        @Override
        public AuthorizationCallback await(Duration timeout) {
            try {
                return Uni.createFrom().completionStage(result).await().atMost(timeout);
            } catch (TimeoutException e) {
                throw new AuthorizationCodeException(
                        AuthorizationCodeException.Reason.TIMEOUT,
                        "Timed out after " + timeout + " waiting for the authorization callback",
                        e);
            }
        }

        @Override
        public void close() {
            try {
                server.close().await().atMost(BIND_TIMEOUT);
            } catch (RuntimeException e) {
                LOG.warnf("Failed to stop authorization callback listener: %s", e.getMessage());
            }
        }
    }
}
