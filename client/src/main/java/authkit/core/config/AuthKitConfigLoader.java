package authkit.core.config;

import java.util.Map;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

/**
 * Builds {@link AuthKitConfig} outside of a managed container.
 *
 * <p>Sources, highest priority first: system properties, environment variables,
 * {@code META-INF/microprofile-config.properties}, then the mapping defaults.
 */
public final class AuthKitConfigLoader {

    private static final int OVERRIDE_ORDINAL = 500;

    private AuthKitConfigLoader() {}

    public static AuthKitConfig load() {
        return load(Map.of());
    }

    /**
     * Load with explicit overrides layered over the default sources.
     *
     * @param overrides property values such as {@code authkit.http.max-retries}
     * @return the mapped configuration
     */
    public static AuthKitConfig load(Map<String, String> overrides) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "authkit-overrides", OVERRIDE_ORDINAL))
                .withMapping(AuthKitConfig.class)
                .build();
        return config.getConfigMapping(AuthKitConfig.class);
    }
}
