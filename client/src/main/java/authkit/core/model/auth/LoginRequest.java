package authkit.core.model.auth;

import java.util.List;
import java.util.Map;

/**
 * Options for an interactive or non-interactive login.
 *
 * <p>Empty scopes and audiences, and missing {@code organization} and
 * {@code project_id} entries in {@code extra}, fall back to the client config.
 *
 * @param allowOpenBrowser   whether a browser may be opened
 * @param allowTtyPrompt     whether the user may be prompted for input
 * @param requestedScopes    scopes to request
 * @param requestedAudiences audiences to request
 * @param extra              extra parameters passed to the authorization server
 * @param username           resource owner username, overriding the config
 * @param password           resource owner password, overriding the config
 */
public record LoginRequest(
        boolean allowOpenBrowser,
        boolean allowTtyPrompt,
        List<String> requestedScopes,
        List<String> requestedAudiences,
        Map<String, String> extra,
        String username,
        String password) {

    public LoginRequest {
        requestedScopes = requestedScopes == null ? List.of() : List.copyOf(requestedScopes);
        requestedAudiences = requestedAudiences == null ? List.of() : List.copyOf(requestedAudiences);
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    /**
     * Non-interactive login with every value taken from the client config.
     */
    public static LoginRequest defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .allowOpenBrowser(allowOpenBrowser)
                .allowTtyPrompt(allowTtyPrompt)
                .requestedScopes(requestedScopes)
                .requestedAudiences(requestedAudiences)
                .extra(extra)
                .username(username)
                .password(password);
    }

    @Override
    public String toString() {
        return "LoginRequest[allowOpenBrowser=" + allowOpenBrowser + ", allowTtyPrompt=" + allowTtyPrompt
                + ", requestedScopes=" + requestedScopes + ", requestedAudiences=" + requestedAudiences + "]";
    }

    public static class Builder {
        private boolean allowOpenBrowser;
        private boolean allowTtyPrompt;
        private List<String> requestedScopes = List.of();
        private List<String> requestedAudiences = List.of();
        private Map<String, String> extra = Map.of();
        private String username;
        private String password;

        public Builder allowOpenBrowser(boolean allowOpenBrowser) {
            this.allowOpenBrowser = allowOpenBrowser;
            return this;
        }

        public Builder allowTtyPrompt(boolean allowTtyPrompt) {
            this.allowTtyPrompt = allowTtyPrompt;
            return this;
        }

        public Builder requestedScopes(List<String> requestedScopes) {
            this.requestedScopes = requestedScopes;
            return this;
        }

        public Builder requestedAudiences(List<String> requestedAudiences) {
            this.requestedAudiences = requestedAudiences;
            return this;
        }

        public Builder extra(Map<String, String> extra) {
            this.extra = extra;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public LoginRequest build() {
            return new LoginRequest(
                    allowOpenBrowser, allowTtyPrompt, requestedScopes, requestedAudiences, extra, username, password);
        }
    }
}
