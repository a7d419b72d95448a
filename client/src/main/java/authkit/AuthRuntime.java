package authkit;

import java.time.Clock;

import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import authkit.adapter.in.callback.VertxAuthorizationCallbackServer;
import authkit.adapter.out.browser.DesktopBrowserLauncher;
import authkit.adapter.out.http.VertxHttpTransport;
import authkit.adapter.out.storage.JsonFileStorage;
import authkit.core.AuthContext;
import authkit.core.config.AuthKitConfig;
import authkit.core.config.AuthKitConfigLoader;
import authkit.core.port.out.AuthorizationCallbackReceiver;
import authkit.core.port.out.HttpTransport;
import authkit.core.port.out.JsonDocumentStore;
import authkit.core.port.out.JwksCache;
import authkit.core.service.auth.JwksCacheService;
import authkit.core.service.auth.PkceService;
import authkit.core.util.Sleeper;
import authkit.spi.BrowserLauncher;
import authkit.spi.HeadlessLoginPrompter;
import authkit.spi.LoginPrompter;

/**
 * Wires the library's adapters once per application and owns their resources.
 *
 * <p>Anything not supplied to the builder gets a default: configuration from
 * {@link AuthKitConfigLoader}, the system clock, a Vert.x instance with its HTTP
 * transport and callback server, a Caffeine backed JWKS cache, plain or sops
 * encrypted JSON files, the desktop browser and a headless prompter. A Vert.x
 * instance created here is closed with the runtime.
 */
public final class AuthRuntime implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(AuthRuntime.class);

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final VertxHttpTransport ownedTransport;
    private final AuthContext context;

    private AuthRuntime(Builder builder) {
        final var config = builder.config != null ? builder.config : AuthKitConfigLoader.load();
        final var needsVertx = builder.transport == null || builder.callbackReceiver == null;
        this.ownsVertx = builder.vertx == null && needsVertx;
        this.vertx = builder.vertx != null ? builder.vertx : (needsVertx ? Vertx.vertx() : null);

        HttpTransport transport = builder.transport;
        if (transport == null) {
            this.ownedTransport = new VertxHttpTransport(vertx, config.http());
            transport = ownedTransport;
        } else {
            this.ownedTransport = null;
        }

        this.context = new AuthContext(
                config,
                builder.clock != null ? builder.clock : Clock.systemUTC(),
                builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM,
                transport,
                builder.jwksCache != null ? builder.jwksCache : new JwksCacheService(transport, config),
                builder.documentStore != null ? builder.documentStore : new JsonFileStorage(),
                builder.browserLauncher != null ? builder.browserLauncher : new DesktopBrowserLauncher(),
                builder.loginPrompter != null ? builder.loginPrompter : new HeadlessLoginPrompter(),
                builder.callbackReceiver != null
                        ? builder.callbackReceiver
                        : new VertxAuthorizationCallbackServer(vertx),
                builder.pkceService != null ? builder.pkceService : new PkceService());
        LOG.debugf("Auth runtime started (owns Vert.x: %s)", ownsVertx);
    }

    public static Builder builder() {
        return new Builder();
    }

    public AuthContext context() {
        return context;
    }

    @Override
    public void close() {
        if (ownedTransport != null) {
            ownedTransport.close();
        }
        if (ownsVertx) {
            vertx.closeAndAwait();
        }
        LOG.debug("Auth runtime closed");
    }

    public static class Builder {
        private AuthKitConfig config;
        private Clock clock;
        private Sleeper sleeper;
        private Vertx vertx;
        private HttpTransport transport;
        private JwksCache jwksCache;
        private JsonDocumentStore documentStore;
        private BrowserLauncher browserLauncher;
        private LoginPrompter loginPrompter;
        private AuthorizationCallbackReceiver callbackReceiver;
        private PkceService pkceService;

        private Builder() {}

        public Builder config(AuthKitConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Use an application owned Vert.x instance. It is not closed with the runtime.
         */
        public Builder vertx(Vertx vertx) {
            this.vertx = vertx;
            return this;
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder jwksCache(JwksCache jwksCache) {
            this.jwksCache = jwksCache;
            return this;
        }

        public Builder documentStore(JsonDocumentStore documentStore) {
            this.documentStore = documentStore;
            return this;
        }

        public Builder browserLauncher(BrowserLauncher browserLauncher) {
            this.browserLauncher = browserLauncher;
            return this;
        }

        public Builder loginPrompter(LoginPrompter loginPrompter) {
            this.loginPrompter = loginPrompter;
            return this;
        }

        public Builder callbackReceiver(AuthorizationCallbackReceiver callbackReceiver) {
            this.callbackReceiver = callbackReceiver;
            return this;
        }

        public Builder pkceService(PkceService pkceService) {
            this.pkceService = pkceService;
            return this;
        }

        public AuthRuntime build() {
            return new AuthRuntime(this);
        }
    }
}
