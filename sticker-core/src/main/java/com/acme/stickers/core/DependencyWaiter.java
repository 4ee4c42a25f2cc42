package com.acme.stickers.core;

import com.acme.stickers.config.StartupConfig;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries a connectivity probe with a fixed delay until it succeeds or the attempts run out. Used
 * at process startup so a dependency that comes up later does not cause a silent hang.
 */
public class DependencyWaiter {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyWaiter.class);

    /** A check that throws when the dependency is not reachable yet. */
    @FunctionalInterface
    public interface Probe {
        void check() throws Exception;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration delay;
    private final Sleeper sleeper;

    public DependencyWaiter(StartupConfig config) {
        this(config.getMaxAttempts(), config.getRetryDelay(), d -> Thread.sleep(d.toMillis()));
    }

    public DependencyWaiter(int maxAttempts, Duration delay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay;
        this.sleeper = sleeper;
    }

    /**
     * @return true once the probe succeeds, false if every attempt failed or the thread was
     *     interrupted while waiting
     */
    public boolean await(String dependency, Probe probe) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                probe.check();
                LOG.info("{} connection successful", dependency);
                return true;
            } catch (Exception e) {
                LOG.warn("Waiting for {}... (attempt {}/{}): {}", dependency, attempt, maxAttempts,
                        e.getMessage());
            }
            if (attempt < maxAttempts) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Interrupted while waiting for {}", dependency);
                    return false;
                }
            }
        }
        LOG.error("Failed to connect to {} after {} attempts", dependency, maxAttempts);
        return false;
    }
}
