package authkit.core.util;

import java.time.Duration;

/**
 * Blocks the calling thread. Injected wherever a flow waits between polls.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
