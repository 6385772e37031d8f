package com.tictactoe.state;

import com.tictactoe.game.GameSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background sweep that evicts abandoned sessions.
 *
 * A session is evicted once no slot has a live connection and nothing has
 * happened in it for longer than the staleness threshold. A session with at
 * least one live connection is never evicted, however old it is.
 */
public class SessionReaper {

    private static final Logger logger = LoggerFactory.getLogger(SessionReaper.class);

    private final SessionRegistry registry;
    private final Duration staleness;
    private final Duration interval;
    private final Clock clock;

    private ScheduledExecutorService scheduler;

    public SessionReaper(SessionRegistry registry, Duration staleness, Duration interval) {
        this.registry = registry;
        this.staleness = staleness;
        this.interval = interval;
        this.clock = registry.getClock();
    }

    /**
     * Starts sweeping at a fixed rate on a dedicated daemon thread.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "session-reaper");
            thread.setDaemon(true);
            return thread;
        });
        long periodMillis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::sweepSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        logger.info("Session reaper started (staleness {}s, every {}s)",
                staleness.toSeconds(), interval.toSeconds());
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * Runs one pass over all sessions.
     *
     * @return number of sessions removed
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(staleness);
        int removed = 0;

        for (String sessionId : registry.snapshotIds()) {
            GameSession session = registry.get(sessionId);
            if (session == null) {
                continue;
            }
            boolean evicted = session.withLock(() -> {
                if (session.isRemoved() || session.hasLiveConnection()) {
                    return false;
                }
                if (!session.getLastActivity().isBefore(cutoff)) {
                    return false;
                }
                session.markRemoved();
                return registry.remove(sessionId, session);
            });
            if (evicted) {
                removed++;
            }
        }

        if (removed > 0) {
            logger.info("Reaped {} inactive sessions. Remaining: {}", removed, registry.size());
        }
        return removed;
    }

    // An exception escaping a scheduled task would cancel all later runs
    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            logger.error("Session sweep failed", e);
        }
    }
}
