package authkit.core.service.request;

/**
 * Decorates outgoing HTTP requests with an authorization header.
 *
 * <p>Subclasses fill in the header name, token prefix and token body in
 * {@link #preRequestHook()}, which runs immediately before each request and may
 * perform network I/O such as a token refresh. It should never require user
 * interaction unless the application chose a flow that does.
 *
 * <p>Instances are not safe for concurrent use. Use one per worker thread.
 */
public abstract class RequestAuthenticator {

    public static final String DEFAULT_AUTH_HEADER = "Authorization";
    public static final String DEFAULT_TOKEN_PREFIX = "Bearer";

    protected String authHeader;
    protected String tokenPrefix;
    protected String tokenBody;
    private ApplicationHeader applicationHeader = ApplicationHeader.DEFAULT;

    protected RequestAuthenticator(String tokenBody, String tokenPrefix, String authHeader) {
        this.tokenBody = tokenBody;
        this.tokenPrefix = tokenPrefix;
        this.authHeader = authHeader;
    }

    protected RequestAuthenticator() {
        this(null, DEFAULT_TOKEN_PREFIX, DEFAULT_AUTH_HEADER);
    }

    /**
     * Prepare the header triple for the next request.
     */
    public abstract void preRequestHook();

    /**
     * Run the hook, then set the authorization header and, when absent, the
     * application header.
     */
    public void applyTo(RequestHeaders headers) {
        preRequestHook();
        if (tokenBody != null && !tokenBody.isEmpty()) {
            headers.set(authHeader, authHeaderValue());
        }
        if (!headers.contains(applicationHeader.name())) {
            headers.set(applicationHeader.name(), applicationHeader.value());
        }
    }

    /**
     * The authorization header value for the current token, without running the hook.
     */
    public String authHeaderValue() {
        if (tokenPrefix != null && !tokenPrefix.isEmpty()) {
            return tokenPrefix + " " + tokenBody;
        }
        return tokenBody;
    }

    public String authHeaderName() {
        return authHeader;
    }

    public String tokenPrefix() {
        return tokenPrefix;
    }

    public String tokenBody() {
        return tokenBody;
    }

    public RequestAuthenticator withApplicationHeader(ApplicationHeader applicationHeader) {
        this.applicationHeader = applicationHeader;
        return this;
    }

    public ApplicationHeader applicationHeader() {
        return applicationHeader;
    }

    /**
     * Header identifying the calling application.
     */
    public record ApplicationHeader(String name, String value) {
        public static final ApplicationHeader DEFAULT = new ApplicationHeader("X-Authkit-App", "authkit-java");
    }
}
