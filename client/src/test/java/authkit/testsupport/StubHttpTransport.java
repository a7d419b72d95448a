package authkit.testsupport;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import authkit.core.port.out.HttpTransport;
import authkit.core.port.out.TransportRequest;
import authkit.core.port.out.TransportResponse;

/**
 * Answers requests from per-URI queues of canned responses and records every request.
 * The last response queued for a URI is repeated once the others are used up.
 */
public class StubHttpTransport implements HttpTransport {

    private final Map<String, Deque<TransportResponse>> responses = new HashMap<>();
    private final List<TransportRequest> requests = new ArrayList<>();

    public StubHttpTransport json(String uri, int status, String body) {
        responses.computeIfAbsent(uri, k -> new ArrayDeque<>())
                .add(new TransportResponse(status, Map.of("Content-Type", "application/json"), body));
        return this;
    }

    public StubHttpTransport json(String uri, String body) {
        return json(uri, 200, body);
    }

    public StubHttpTransport respond(String uri, TransportResponse response) {
        responses.computeIfAbsent(uri, k -> new ArrayDeque<>()).add(response);
        return this;
    }

    @Override
    public TransportResponse send(TransportRequest request) {
        requests.add(request);
        final var query = request.uri().indexOf('?');
        final var base = query >= 0 ? request.uri().substring(0, query) : request.uri();
        final var queue = responses.get(base);
        if (queue == null || queue.isEmpty()) {
            return new TransportResponse(404, Map.of(), "");
        }
        return queue.size() > 1 ? queue.poll() : queue.peek();
    }

    public List<TransportRequest> requests() {
        return requests;
    }

    public List<TransportRequest> requestsTo(String uri) {
        return requests.stream().filter(r -> r.uri().startsWith(uri)).toList();
    }

    /**
     * Decoded form fields of a recorded request body.
     */
    public static Map<String, String> form(TransportRequest request) {
        final var form = new HashMap<String, String>();
        if (request.body() == null || request.body().isEmpty()) {
            return form;
        }
        for (final var pair : request.body().split("&")) {
            final var eq = pair.indexOf('=');
            form.put(
                    URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return form;
    }
}
