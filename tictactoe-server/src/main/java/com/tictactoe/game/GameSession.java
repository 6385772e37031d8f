package com.tictactoe.game;

import com.tictactoe.connection.PlayerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One Tic-Tac-Toe match, keyed by a caller-supplied session id.
 *
 * Thread Safety Strategy:
 * 1. Every session owns its own lock; unrelated sessions never contend
 * 2. All reads and writes of board, slots, scores and status happen inside
 *    {@link #withLock(Supplier)} / {@link #runLocked(Runnable)}
 * 3. The registry map is never locked while a session is being mutated
 *
 * The session outlives its connections. Players disconnecting only clears
 * the connection handle in their slot; the match stays as it was.
 */
public class GameSession {

    private static final Logger logger = LoggerFactory.getLogger(GameSession.class);

    private final String sessionId;
    private final Clock clock;
    private final ReentrantLock lock;

    private final Board board;
    private final Map<Mark, PlayerSlot> players;
    private final Map<Mark, Integer> scores;

    private Mark turn;
    private GameStatus status;
    private Mark winner;
    private boolean draw;

    // Incremented on every accepted mutation so clients can order snapshots
    private long version;
    private Instant lastActivity;
    private boolean removed;

    public GameSession(String sessionId, Clock clock) {
        this.sessionId = sessionId;
        this.clock = clock;
        this.lock = new ReentrantLock();
        this.board = new Board();
        this.players = new EnumMap<>(Mark.class);
        this.scores = new EnumMap<>(Mark.class);
        this.scores.put(Mark.X, 0);
        this.scores.put(Mark.O, 0);
        this.turn = Mark.X;
        this.status = GameStatus.WAITING_FOR_PLAYERS;
        this.lastActivity = clock.instant();
    }

    // === Exclusive access ===

    /**
     * Runs an action while holding this session's exclusive lock.
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    // === Player slots ===

    public Optional<PlayerSlot> getSlot(Mark role) {
        return Optional.ofNullable(players.get(role));
    }

    public Optional<PlayerSlot> findSlotByName(String name) {
        for (PlayerSlot slot : players.values()) {
            if (slot.getName().equals(name)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }

    public Collection<PlayerSlot> getSlots() {
        return Collections.unmodifiableCollection(players.values());
    }

    public boolean hasBothPlayers() {
        return players.containsKey(Mark.X) && players.containsKey(Mark.O);
    }

    /**
     * True when at least one slot is held by a connection the transport still
     * reports as open.
     */
    public boolean hasLiveConnection() {
        for (PlayerSlot slot : players.values()) {
            if (slot.isConnected()) {
                return true;
            }
        }
        return false;
    }

    PlayerSlot addSlot(String name, Mark role, PlayerConnection connection) {
        if (players.containsKey(role)) {
            throw new IllegalStateException("Role " + role + " already taken in session " + sessionId);
        }
        PlayerSlot slot = new PlayerSlot(name, role, connection);
        players.put(role, slot);
        return slot;
    }

    PlayerSlot removeSlot(Mark role) {
        return players.remove(role);
    }

    /**
     * Clears the connection handle of a slot, but only if the slot is still
     * held by the given connection. A newer connection that already reclaimed
     * the slot is left alone.
     *
     * @return true if the slot was detached
     */
    public boolean detach(Mark role, PlayerConnection connection) {
        PlayerSlot slot = players.get(role);
        if (slot == null || !slot.isHeldBy(connection)) {
            return false;
        }
        slot.detach();
        touch();
        logger.debug("Detached {} from role {} in session {}", connection.getId(), role, sessionId);
        return true;
    }

    // === Game state ===

    Board board() {
        return board;
    }

    public Mark getCell(int index) {
        return board.get(index);
    }

    public Mark getTurn() {
        return turn;
    }

    void setTurn(Mark turn) {
        if (!turn.isRole()) {
            throw new IllegalStateException("Turn cannot be " + turn);
        }
        this.turn = turn;
    }

    public GameStatus getStatus() {
        return status;
    }

    void setStatus(GameStatus status) {
        this.status = status;
    }

    /**
     * The winning role of a finished game, or null while playing or after a draw.
     */
    public Mark getWinner() {
        return winner;
    }

    public boolean isDraw() {
        return draw;
    }

    void finish(Mark winner) {
        this.status = GameStatus.FINISHED;
        this.winner = winner;
        this.draw = false;
        scores.merge(winner, 1, Integer::sum);
    }

    void finishAsDraw() {
        this.status = GameStatus.FINISHED;
        this.winner = null;
        this.draw = true;
    }

    void clearBoard() {
        board.clear();
        this.winner = null;
        this.draw = false;
        this.turn = Mark.X;
    }

    public int getScore(Mark role) {
        return scores.getOrDefault(role, 0);
    }

    /**
     * Records an accepted mutation: bumps the version and refreshes the
     * activity timestamp the reaper measures staleness from.
     */
    void touch() {
        version++;
        lastActivity = clock.instant();
    }

    /**
     * Fails fast on a session whose shape no code path should be able to produce.
     *
     * @throws IllegalStateException on an invariant violation
     */
    public void verifyInvariants() {
        if (players.size() > 2 || players.containsKey(Mark.EMPTY)) {
            throw new IllegalStateException("Impossible slot layout in session " + sessionId + ": " + players.keySet());
        }
        for (Map.Entry<Mark, PlayerSlot> entry : players.entrySet()) {
            if (entry.getKey() != entry.getValue().getRole()) {
                throw new IllegalStateException("Slot " + entry.getValue() + " filed under " + entry.getKey());
            }
        }
        if (!turn.isRole()) {
            throw new IllegalStateException("Turn is " + turn + " in session " + sessionId);
        }
    }

    // === Snapshots ===

    /**
     * Captures the externally visible state. Call while holding the lock.
     */
    public SessionSnapshot snapshot() {
        Map<Mark, SessionSnapshot.PlayerView> views = new EnumMap<>(Mark.class);
        for (PlayerSlot slot : players.values()) {
            views.put(slot.getRole(), new SessionSnapshot.PlayerView(slot.getName(), slot.isConnected()));
        }
        return new SessionSnapshot(sessionId, board.toList(), turn, status, winner, draw,
                new EnumMap<>(scores), views, version);
    }

    // === Registry bookkeeping ===

    public boolean isRemoved() {
        return removed;
    }

    /**
     * Flags the session as evicted. Callers that resolved this instance before
     * the eviction see the flag once they hold the lock and look the id up again.
     */
    public void markRemoved() {
        this.removed = true;
    }

    // === Session Info ===

    public String getSessionId() {
        return sessionId;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "GameSession{" +
                "sessionId='" + sessionId + '\'' +
                ", status=" + status +
                ", turn=" + turn +
                ", players=" + players.values() +
                ", version=" + version +
                '}';
    }
}
