package com.tictactoe.state;

import com.tictactoe.game.GameSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages all game sessions in the server.
 *
 * Design Decisions:
 * - Sessions are created on demand when the first player joins an unknown id
 * - Only the reaper removes sessions
 * - The map is only held for a lookup, insert or remove; session state is
 *   guarded by each session's own lock
 *
 * Thread Safety:
 * - ConcurrentHashMap for session storage
 * - computeIfAbsent for atomic session creation
 */
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, GameSession> sessions;
    private final Clock clock;

    public SessionRegistry() {
        this(Clock.systemUTC());
    }

    public SessionRegistry(Clock clock) {
        this.sessions = new ConcurrentHashMap<>();
        this.clock = clock;
    }

    /**
     * Gets or creates the session with the given id.
     * Thread-safe: uses computeIfAbsent for atomic creation.
     */
    public GameSession getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            logger.info("Creating new session: {}", id);
            return new GameSession(id, clock);
        });
    }

    /**
     * Gets a session by id, returns null if it doesn't exist.
     */
    public GameSession get(String sessionId) {
        return sessions.get(sessionId);
    }

    /**
     * Removes the entry for an id, but only while it still maps to the given
     * instance, so a session created afresh under the same id survives.
     *
     * @return true if the session was removed
     */
    public boolean remove(String sessionId, GameSession session) {
        boolean removed = sessions.remove(sessionId, session);
        if (removed) {
            logger.info("Removed session: {}", sessionId);
        }
        return removed;
    }

    /**
     * Copy of the current ids. Mutators are only held up for the time it
     * takes to copy the keys.
     */
    public List<String> snapshotIds() {
        return List.copyOf(sessions.keySet());
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int size() {
        return sessions.size();
    }

    public Clock getClock() {
        return clock;
    }
}
