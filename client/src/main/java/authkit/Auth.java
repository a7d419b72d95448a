package authkit;

import java.nio.file.Path;
import java.util.Map;

import org.jboss.logging.Logger;

import authkit.core.AuthContext;
import authkit.core.exception.AuthException;
import authkit.core.model.auth.DeviceAuthorization;
import authkit.core.model.auth.LoginRequest;
import authkit.core.model.config.AuthClientConfig;
import authkit.core.model.config.AuthClientConfigs;
import authkit.core.model.credential.Credential;
import authkit.core.service.client.AuthClient;
import authkit.core.service.client.AuthClients;
import authkit.core.service.client.DeviceLoginable;
import authkit.core.service.client.Loginable;
import authkit.core.service.request.CredentialRequestAuthenticator;
import authkit.core.service.request.RequestAuthenticator.ApplicationHeader;

/**
 * An auth client paired with its token file and request authenticator.
 *
 * <p>Logins performed through this class save the new credential to the token file
 * and hand it to the request authenticator, so requests use it immediately.
 */
public class Auth {

    private static final Logger LOG = Logger.getLogger(Auth.class);

    private final AuthClient client;
    private final Path tokenFile;
    private final CredentialRequestAuthenticator requestAuthenticator;

    private Auth(AuthClient client, Path tokenFile, CredentialRequestAuthenticator requestAuthenticator) {
        this.client = client;
        this.tokenFile = tokenFile;
        this.requestAuthenticator = requestAuthenticator;
    }

    /**
     * @param client    the auth client
     * @param tokenFile where credentials are saved, or null to keep them in memory
     * @param context   the runtime context, used for the application header
     */
    public static Auth fromClient(AuthClient client, Path tokenFile, AuthContext context) {
        final var authenticator = client.defaultRequestAuthenticatorForFile(tokenFile);
        final var http = context.config().http();
        authenticator.withApplicationHeader(new ApplicationHeader(http.applicationHeader(), http.applicationName()));
        return new Auth(client, tokenFile, authenticator);
    }

    public static Auth fromConfig(AuthClientConfig config, Path tokenFile, AuthContext context) {
        return fromClient(AuthClients.create(config, context), tokenFile, context);
    }

    public static Auth fromConfigMap(Map<String, ?> config, Path tokenFile, AuthContext context) {
        return fromConfig(AuthClientConfigs.fromMap(config), tokenFile, context);
    }

    public static Auth fromConfigFile(Path configFile, Path tokenFile, AuthContext context) {
        return fromConfig(AuthClientConfigs.fromFile(configFile, context.documentStore()), tokenFile, context);
    }

    public AuthClient authClient() {
        return client;
    }

    public CredentialRequestAuthenticator requestAuthenticator() {
        return requestAuthenticator;
    }

    public Path tokenFile() {
        return tokenFile;
    }

    /**
     * Log in, save the credential and start using it for requests.
     *
     * @throws AuthException if the client cannot log in
     */
    public Credential login(LoginRequest request) {
        if (!(client instanceof Loginable)) {
            throw new AuthException(client.config().clientType().wireName() + " auth client does not support login");
        }
        return store(((Loginable<?>) client).login(request));
    }

    public DeviceAuthorization deviceLoginInitiate(LoginRequest request) {
        return deviceLoginable().deviceLoginInitiate(request);
    }

    public Credential deviceLoginComplete(DeviceAuthorization authorization) {
        return store(deviceLoginable().deviceLoginComplete(authorization));
    }

    private DeviceLoginable deviceLoginable() {
        if (!(client instanceof DeviceLoginable)) {
            throw new AuthException(
                    client.config().clientType().wireName() + " auth client does not support device login");
        }
        return (DeviceLoginable) client;
    }

    private Credential store(Credential credential) {
        credential.setPath(tokenFile);
        credential.save();
        requestAuthenticator.updateCredential(credential);
        LOG.infov("Saved new credential to {0}", tokenFile == null ? "memory" : tokenFile);
        return credential;
    }
}
