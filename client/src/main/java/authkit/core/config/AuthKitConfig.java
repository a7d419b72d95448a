package authkit.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for library level tunables.
 *
 * <p>Configuration prefix: {@code authkit}
 *
 * <p>Per-client settings (auth server, client ID, scopes, ...) are not read from here.
 * They arrive as an {@link authkit.core.model.config.AuthClientConfig}.
 */
@ConfigMapping(prefix = "authkit")
public interface AuthKitConfig {

    /**
     * HTTP transport settings.
     */
    HttpConfig http();

    /**
     * JWKS fetch and cache settings.
     */
    JwksConfig jwks();

    /**
     * Local token validation settings.
     */
    ValidationConfig validation();

    /**
     * Device code flow settings.
     */
    @WithName("device-code")
    DeviceCodeConfig deviceCode();

    /**
     * Authorization code flow settings.
     */
    @WithName("auth-code")
    AuthCodeConfig authCode();

    interface HttpConfig {

        /**
         * Maximum time to wait for a single response from an authorization server.
         *
         * @return Request timeout duration (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration requestTimeout();

        /**
         * Number of retries after an HTTP 429 response.
         *
         * @return Max retries (default: 3)
         */
        @WithDefault("3")
        int maxRetries();

        /**
         * Initial backoff for 429 retries. Doubles on every attempt.
         *
         * @return Initial backoff (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration retryBackoff();

        /**
         * Name of the header that identifies the calling application.
         *
         * @return Header name (default: X-Authkit-App)
         */
        @WithDefault("X-Authkit-App")
        String applicationHeader();

        /**
         * Value of the application identifying header.
         *
         * @return Header value (default: authkit-java)
         */
        @WithDefault("authkit-java")
        String applicationName();
    }

    interface JwksConfig {

        /**
         * Time-to-live for cached key sets.
         *
         * @return Cache TTL (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration cacheTtl();

        /**
         * Maximum number of JWKS URIs to keep cached.
         *
         * @return Maximum cache entries (default: 100)
         */
        @WithDefault("100")
        int maxCacheEntries();
    }

    interface ValidationConfig {

        /**
         * Allowed clock skew when checking {@code exp} and {@code nbf}.
         *
         * @return Clock skew (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration clockSkew();
    }

    interface DeviceCodeConfig {

        /**
         * Poll interval used when the server does not specify one.
         *
         * @return Poll interval (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration defaultInterval();

        /**
         * Increment applied on {@code slow_down}.
         *
         * @return Interval increment (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration slowDownIncrement();

        /**
         * Overall lifetime used when the server omits {@code expires_in}.
         *
         * @return Default lifetime (default: 10 minutes)
         */
        @WithDefault("PT10M")
        Duration defaultExpiresIn();
    }

    interface AuthCodeConfig {

        /**
         * How long to wait for the browser to deliver the authorization callback.
         *
         * @return Callback timeout (default: 5 minutes)
         */
        @WithDefault("PT5M")
        Duration callbackTimeout();

        /**
         * Body served to the browser after a callback is received, when the client
         * config does not provide one.
         *
         * @return Acknowledgement HTML
         */
        Optional<String> defaultAcknowledgement();
    }
}
