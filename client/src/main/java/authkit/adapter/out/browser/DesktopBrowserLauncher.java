package authkit.adapter.out.browser;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;

import org.jboss.logging.Logger;

import authkit.spi.BrowserLauncher;

/**
 * Opens URLs with the desktop's default browser. Reports failure on headless hosts.
 */
public class DesktopBrowserLauncher implements BrowserLauncher {

    private static final Logger LOG = Logger.getLogger(DesktopBrowserLauncher.class);

    @Override
    public boolean open(URI uri) {
        if (GraphicsEnvironment.isHeadless() || !Desktop.isDesktopSupported()) {
            LOG.debug("No desktop available to open a browser");
            return false;
        }
        final var desktop = Desktop.getDesktop();
        if (!desktop.isSupported(Desktop.Action.BROWSE)) {
            LOG.debug("Desktop does not support opening a browser");
            return false;
        }
        try {
            desktop.browse(uri);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            LOG.warnf("Failed to open browser: %s", e.getMessage());
            return false;
        }
    }
}
