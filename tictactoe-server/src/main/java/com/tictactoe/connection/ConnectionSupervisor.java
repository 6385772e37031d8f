package com.tictactoe.connection;

import com.tictactoe.game.GameSession;
import com.tictactoe.game.GameStatus;
import com.tictactoe.game.JoinResult;
import com.tictactoe.game.Mark;
import com.tictactoe.game.MoveResult;
import com.tictactoe.game.TurnEngine;
import com.tictactoe.protocol.MessageSerializer;
import com.tictactoe.state.BroadcastHub;
import com.tictactoe.state.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Binds one live connection to one player slot and carries its requests into
 * the game.
 *
 * Every operation takes the target session's lock, applies the change through
 * the {@link TurnEngine}, and publishes the new snapshot before releasing it.
 * Rejections and connection-level errors go back to this connection only.
 *
 * {@link #unbind()} must run on every exit path of the connection. It only
 * clears the slot if this connection still holds it, so a disconnect that is
 * noticed after the player already reconnected elsewhere changes nothing.
 */
public class ConnectionSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionSupervisor.class);

    static final String NOT_IN_SESSION = "Not in a session";

    private final PlayerConnection connection;
    private final SessionRegistry registry;
    private final TurnEngine engine;
    private final BroadcastHub hub;
    private final MessageSerializer serializer;

    private final AtomicReference<Binding> binding;

    public ConnectionSupervisor(PlayerConnection connection, SessionRegistry registry, TurnEngine engine,
                                BroadcastHub hub, MessageSerializer serializer) {
        this.connection = connection;
        this.registry = registry;
        this.engine = engine;
        this.hub = hub;
        this.serializer = serializer;
        this.binding = new AtomicReference<>(null);
    }

    /**
     * Joins a session, or reclaims a seat held under the same name.
     *
     * A connection that is already seated somewhere keeps that seat until the
     * new join is accepted; a rejected join leaves everything as it was.
     */
    public JoinResult bind(String sessionId, String name) {
        Binding previous = binding.get();

        while (true) {
            GameSession session = registry.getOrCreate(sessionId);
            boolean sameSession = previous != null && previous.session == session;
            JoinResult result = locked(session, () -> {
                if (session.isRemoved()) {
                    // Reaped between lookup and lock; resolve the id again
                    return null;
                }
                if (sameSession && previous.name.equals(name) && holdsSlot(session, previous.role)) {
                    connection.send(serializer.joined(sessionId, previous.role, name, true));
                    connection.send(serializer.state(session.snapshot()));
                    return JoinResult.reconnected(previous.role);
                }
                JoinResult joined = engine.join(session, name, connection);
                if (!joined.isAccepted()) {
                    connection.send(serializer.rejected(sessionId, joined.getRejection()));
                    return joined;
                }
                if (sameSession) {
                    session.detach(previous.role, connection);
                }
                binding.set(new Binding(session, joined.getRole(), name));
                connection.send(serializer.joined(sessionId, joined.getRole(), name, joined.isReconnected()));
                hub.publish(session);
                return joined;
            });

            if (result == null) {
                continue;
            }
            if (result.isAccepted()) {
                logger.info("Player {} {} session {} as {}", name,
                        result.isReconnected() ? "rejoined" : "joined", sessionId, result.getRole());
                if (previous != null && !sameSession) {
                    release(previous);
                }
            } else {
                logger.info("Player {} turned away from session {}: {}", name, sessionId, result.getRejection());
            }
            return result;
        }
    }

    /**
     * Plays a cell for the bound role.
     *
     * @return the engine's verdict, or null if this connection holds no seat
     */
    public MoveResult move(int cell) {
        Binding current = binding.get();
        if (current == null) {
            sendError(NOT_IN_SESSION);
            return null;
        }
        GameSession session = current.session;
        return locked(session, () -> {
            if (!holdsSeat(current)) {
                return null;
            }
            MoveResult result = engine.applyMove(session, current.role, cell);
            if (result.isAccepted()) {
                hub.publish(session);
                if (result.getStatus() == GameStatus.FINISHED) {
                    logger.info("Session {} finished: {}", session.getSessionId(),
                            session.isDraw() ? "draw" : session.getWinner() + " wins");
                }
            } else {
                connection.send(serializer.rejected(session.getSessionId(), result.getRejection()));
            }
            return result;
        });
    }

    /**
     * Clears the board for a new round.
     *
     * @return the status after the reset, or null if this connection holds no seat
     */
    public GameStatus reset() {
        Binding current = binding.get();
        if (current == null) {
            sendError(NOT_IN_SESSION);
            return null;
        }
        GameSession session = current.session;
        return locked(session, () -> {
            if (!holdsSeat(current)) {
                return null;
            }
            GameStatus status = engine.reset(session);
            hub.publish(session);
            logger.info("Session {} reset by {}", session.getSessionId(), current.name);
            return status;
        });
    }

    /**
     * Gives up the seat for good; the name no longer reserves the role.
     */
    public boolean leave() {
        Binding current = binding.getAndSet(null);
        if (current == null) {
            sendError(NOT_IN_SESSION);
            return false;
        }
        GameSession session = current.session;
        return locked(session, () -> {
            if (session.isRemoved() || !holdsSlot(session, current.role)) {
                sendError(NOT_IN_SESSION);
                return false;
            }
            engine.leave(session, current.role);
            hub.publish(session);
            logger.info("Player {} left session {}", current.name, session.getSessionId());
            return true;
        });
    }

    /**
     * Detaches this connection from its seat, keeping the player's identity
     * so the same name can reclaim the role later. Safe to call repeatedly.
     *
     * @return true if a seat was actually released
     */
    public boolean unbind() {
        Binding current = binding.getAndSet(null);
        if (current == null) {
            return false;
        }
        return release(current);
    }

    public void ping() {
        connection.send(serializer.pong());
    }

    public void sendError(String message) {
        connection.send(serializer.error(message));
    }

    public PlayerConnection getConnection() {
        return connection;
    }

    public boolean isBound() {
        return binding.get() != null;
    }

    public String getSessionId() {
        Binding current = binding.get();
        return current != null ? current.session.getSessionId() : null;
    }

    public Mark getRole() {
        Binding current = binding.get();
        return current != null ? current.role : null;
    }

    // === Internals ===

    /**
     * Runs an action under the session lock after checking the session is
     * still sane. An invariant violation propagates to the caller, which ends
     * this connection.
     */
    private <T> T locked(GameSession session, Supplier<T> action) {
        return session.withLock(() -> {
            session.verifyInvariants();
            return action.get();
        });
    }

    /**
     * Detaches this connection from a seat it held and tells the session.
     * Skips the invariant check so a connection closed over a broken session
     * can still let go of it.
     */
    private boolean release(Binding current) {
        GameSession session = current.session;
        boolean detached = session.withLock(() -> {
            if (!session.detach(current.role, connection)) {
                return false;
            }
            hub.publish(session);
            return true;
        });
        if (detached) {
            logger.info("Player {} disconnected from session {} ({})",
                    current.name, session.getSessionId(), current.role);
        }
        return detached;
    }

    private boolean holdsSlot(GameSession session, Mark role) {
        return session.getSlot(role).map(slot -> slot.isHeldBy(connection)).orElse(false);
    }

    /**
     * Checks, under the lock, that this connection still owns its seat. The
     * hub may have dropped it as a slow consumer, or the session may have
     * been reaped.
     */
    private boolean holdsSeat(Binding current) {
        GameSession session = current.session;
        boolean holds = !session.isRemoved() && holdsSlot(session, current.role);
        if (!holds) {
            binding.compareAndSet(current, null);
            sendError(NOT_IN_SESSION);
        }
        return holds;
    }

    private static final class Binding {
        private final GameSession session;
        private final Mark role;
        private final String name;

        private Binding(GameSession session, Mark role, String name) {
            this.session = session;
            this.role = role;
            this.name = name;
        }
    }

    @Override
    public String toString() {
        Binding current = binding.get();
        return "ConnectionSupervisor{" +
                "connection=" + connection.getId() +
                ", sessionId=" + (current != null ? current.session.getSessionId() : null) +
                ", role=" + (current != null ? current.role : null) +
                '}';
    }
}
