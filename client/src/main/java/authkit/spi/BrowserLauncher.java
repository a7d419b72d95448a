package authkit.spi;

import java.net.URI;

/**
 * Opens a URL in the user's browser during interactive login.
 */
@FunctionalInterface
public interface BrowserLauncher {

    /**
     * Open the URL.
     *
     * @param uri the URL to open
     * @return true if a browser was launched, false if that is not possible here
     */
    boolean open(URI uri);

    /**
     * A launcher that never opens anything.
     */
    static BrowserLauncher unavailable() {
        return uri -> false;
    }
}
