package authkit.core.port.out;

/**
 * Port for blocking HTTP exchanges with authorization servers.
 *
 * <p>Calls complete on the caller's thread. Implementations retry HTTP 429
 * responses with exponential backoff a bounded number of times and then return
 * the last 429 response. Other statuses are returned as-is for the caller to classify.
 */
public interface HttpTransport {

    /**
     * Send a request and wait for the response.
     *
     * @param request the request
     * @return the response, whatever its status
     * @throws authkit.core.exception.TransportException on network failure or timeout
     */
    TransportResponse send(TransportRequest request);
}
