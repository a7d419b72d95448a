package authkit.core.port.out;

import java.net.URI;
import java.time.Duration;

import authkit.core.model.auth.AuthorizationCallback;

/**
 * Port for receiving the browser redirect at the end of an authorization request.
 */
public interface AuthorizationCallbackReceiver {

    /**
     * Start listening on the host and port of a local redirect URI.
     *
     * @param redirectUri         a loopback redirect URI
     * @param acknowledgementHtml page served to the browser once the callback arrives
     * @return a handle to await the callback with; closing it stops the listener
     */
    PendingCallback listen(URI redirectUri, String acknowledgementHtml);

    /**
     * A listener waiting for exactly one callback.
     */
    interface PendingCallback extends AutoCloseable {

        /**
         * Block until the callback arrives.
         *
         * @param timeout how long to wait
         * @return the callback parameters
         * @throws authkit.core.exception.AuthorizationCodeException with reason TIMEOUT if nothing arrives
         */
        AuthorizationCallback await(Duration timeout);

        @Override
        void close();
    }
}
