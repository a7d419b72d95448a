package authkit.core.service.client;

import java.net.URI;
import java.time.Duration;

import org.jboss.logging.Logger;

import authkit.core.AuthContext;
import authkit.core.exception.AuthException;
import authkit.core.exception.DeviceCodeException;
import authkit.core.exception.ProtocolException;
import authkit.core.model.auth.DeviceAuthorization;
import authkit.core.model.auth.LoginRequest;
import authkit.core.model.config.OidcClientConfig;
import authkit.core.model.credential.OidcCredential;

/**
 * Device authorization grant (RFC 8628).
 *
 * <p>Polling blocks the calling thread until the user acts or the device code expires.
 */
public final class DeviceCodeAuthClient extends OidcAuthClient
        implements Loginable<OidcCredential>, DeviceLoginable {

    private static final Logger LOG = Logger.getLogger(DeviceCodeAuthClient.class);

    static final String AUTHORIZATION_PENDING = "authorization_pending";
    static final String SLOW_DOWN = "slow_down";
    static final String ACCESS_DENIED = "access_denied";
    static final String EXPIRED_TOKEN = "expired_token";

    public DeviceCodeAuthClient(OidcClientConfig config, AuthContext context) {
        super(config, context);
    }

    @Override
    public OidcCredential login(LoginRequest request) {
        final var authorization = deviceLoginInitiate(request);
        context.loginPrompter().presentDeviceCode(authorization);
        if (request.allowOpenBrowser()) {
            final var uri = authorization.completeUri().orElse(authorization.verificationUri());
            if (!context.browserLauncher().open(URI.create(uri))) {
                LOG.debugf("No browser available for device verification URI");
            }
        }
        return deviceLoginComplete(authorization);
    }

    @Override
    public DeviceAuthorization deviceLoginInitiate(LoginRequest request) {
        final var client = deviceAuthorizationClient();
        final var response = client.requestDeviceCode(
                config.clientId(),
                scopesOrDefault(request.requestedScopes()),
                audiencesOrDefault(request.requestedAudiences()),
                extraWithDefaults(request.extra()),
                enricher);
        return DeviceAuthorization.fromResponse(
                client.endpointUri(),
                response,
                context.config().deviceCode().defaultExpiresIn().toSeconds(),
                context.nowEpochSeconds());
    }

    @Override
    public OidcCredential deviceLoginComplete(DeviceAuthorization authorization) {
        final var tokenClient = tokenClient();
        long interval = authorization.pollInterval()
                .orElse(context.config().deviceCode().defaultInterval().toSeconds());
        final long increment = context.config().deviceCode().slowDownIncrement().toSeconds();

        int polls = 0;
        while (true) {
            polls++;
            try {
                final var tokens =
                        tokenClient.getTokenFromDeviceCode(config.clientId(), authorization.deviceCode(), enricher);
                LOG.debugf("Device login completed after %d polls", polls);
                return credentialFrom(tokens);
            } catch (ProtocolException e) {
                final var code = e.errorCode().orElse("");
                if (SLOW_DOWN.equals(code)) {
                    interval += increment;
                    LOG.debugf("Server asked to slow down, polling every %d seconds", interval);
                } else if (ACCESS_DENIED.equals(code)) {
                    throw new DeviceCodeException(
                            DeviceCodeException.Reason.ACCESS_DENIED, "Device authorization was denied", e);
                } else if (EXPIRED_TOKEN.equals(code)) {
                    throw new DeviceCodeException(
                            DeviceCodeException.Reason.EXPIRED, "Device code expired before it was approved", e);
                } else if (!AUTHORIZATION_PENDING.equals(code)) {
                    throw e;
                }
            }

            if (context.nowEpochSeconds() >= authorization.expiresAt()) {
                throw new DeviceCodeException(
                        DeviceCodeException.Reason.EXPIRED, "Device code expired before it was approved");
            }
            pause(interval);
        }
    }

    private void pause(long seconds) {
        try {
            context.sleeper().sleep(Duration.ofSeconds(seconds));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException("Interrupted while waiting for device authorization", e);
        }
    }
}
