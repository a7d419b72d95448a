package authkit.adapter.out.http;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import authkit.core.config.AuthKitConfig;
import authkit.core.exception.TransportException;
import authkit.core.port.out.HttpTransport;
import authkit.core.port.out.TransportRequest;
import authkit.core.port.out.TransportResponse;

/**
 * HTTP transport on the Vert.x WebClient.
 *
 * <p>Requests are issued asynchronously and awaited on the calling thread, so
 * this must never be called from a Vert.x event loop thread.
 */
public class VertxHttpTransport implements HttpTransport {

    private static final Logger LOG = Logger.getLogger(VertxHttpTransport.class);
    private static final int TOO_MANY_REQUESTS = 429;

    private final WebClient webClient;
    private final AuthKitConfig.HttpConfig config;

    public VertxHttpTransport(Vertx vertx, AuthKitConfig.HttpConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public TransportResponse send(TransportRequest request) {
        final var timeout = config.requestTimeout();
        // Each attempt gets the full timeout, plus time for the backoff waits.
        final var overall = timeout.multipliedBy(config.maxRetries() + 1L).plus(maxBackoff());
        try {
            return execute(request)
                    .onFailure(RateLimited.class)
                    .retry()
                    .withBackOff(config.retryBackoff())
                    .withJitter(0)
                    .atMost(config.maxRetries())
                    .onFailure(RateLimited.class)
                    .recoverWithItem(e -> ((RateLimited) e).response)
                    .await()
                    .atMost(overall);
        } catch (TimeoutException e) {
            throw new TransportException("Timed out waiting for " + request.method() + " " + request.uri(), e);
        } catch (CompletionException e) {
            throw new TransportException(
                    "HTTP " + request.method() + " " + request.uri() + " failed: " + rootMessage(e), e.getCause());
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransportException(
                    "HTTP " + request.method() + " " + request.uri() + " failed: " + rootMessage(e), e);
        }
    }

    private Uni<TransportResponse> execute(TransportRequest request) {
        return Uni.createFrom().deferred(() -> {
            final HttpRequest<Buffer> httpRequest = webClient
                    .requestAbs(HttpMethod.valueOf(request.method().name()), request.uri())
                    .timeout(config.requestTimeout().toMillis());
            request.headers().forEach(httpRequest::putHeader);

            LOG.debugf("%s %s", request.method(), request.uri());
            final Uni<HttpResponse<Buffer>> sent = request.body() == null
                    ? httpRequest.send()
                    : httpRequest.sendBuffer(Buffer.buffer(request.body()));
            return sent.map(this::toTransportResponse).invoke(response -> {
                LOG.debugf("%s %s -> %d", request.method(), request.uri(), response.statusCode());
                if (response.statusCode() == TOO_MANY_REQUESTS) {
                    LOG.warnf("Rate limited by %s", request.uri());
                    throw new RateLimited(response);
                }
            });
        });
    }

    private TransportResponse toTransportResponse(HttpResponse<Buffer> response) {
        final Map<String, String> headers = new HashMap<>();
        for (var name : response.headers().names()) {
            headers.put(name, response.headers().get(name));
        }
        final var body = response.body() != null ? response.body().toString() : "";
        return new TransportResponse(response.statusCode(), headers, body);
    }

    private Duration maxBackoff() {
        var total = Duration.ZERO;
        var step = config.retryBackoff();
        for (int i = 0; i < config.maxRetries(); i++) {
            total = total.plus(step);
            step = step.multipliedBy(2);
        }
        return total;
    }

    private static String rootMessage(Throwable e) {
        var cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    public void close() {
        webClient.close();
    }

    /**
     * Signals a 429 so the retry operator can see it.
     */
    private static final class RateLimited extends RuntimeException {
        private final transient TransportResponse response;

        RateLimited(TransportResponse response) {
            super("HTTP 429 Too Many Requests", null, false, false);
            this.response = response;
        }
    }
}
