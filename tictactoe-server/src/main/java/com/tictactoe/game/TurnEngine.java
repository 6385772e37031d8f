package com.tictactoe.game;

import com.tictactoe.connection.PlayerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The rules of the game as a state machine over a {@link GameSession}.
 *
 * No I/O happens here. Every method expects the caller to hold the session's
 * lock and either mutates the session completely or not at all.
 *
 * State machine:
 * WAITING_FOR_PLAYERS --(second join)--> IN_PROGRESS --(win/draw)--> FINISHED
 * FINISHED --(reset)--> IN_PROGRESS, or WAITING_FOR_PLAYERS if a seat is empty
 */
public class TurnEngine {

    private static final Logger logger = LoggerFactory.getLogger(TurnEngine.class);

    /**
     * Seats a player.
     *
     * A name that matches a slot without a live connection reclaims that slot
     * (reconnection). Otherwise the first free role is assigned, X before O.
     * A disconnected player's slot stays reserved for their name.
     */
    public JoinResult join(GameSession session, String name, PlayerConnection connection) {
        Optional<PlayerSlot> existing = session.findSlotByName(name);
        if (existing.isPresent()) {
            PlayerSlot slot = existing.get();
            if (slot.isConnected()) {
                return JoinResult.rejected(Rejection.NAME_IN_USE);
            }
            slot.attach(connection);
            session.touch();
            logger.debug("{} reclaimed role {} in session {}", name, slot.getRole(), session.getSessionId());
            return JoinResult.reconnected(slot.getRole());
        }

        Mark role = freeRole(session);
        if (role == null) {
            return JoinResult.rejected(Rejection.SESSION_FULL);
        }

        session.addSlot(name, role, connection);
        if (session.getStatus() == GameStatus.WAITING_FOR_PLAYERS && session.hasBothPlayers()) {
            session.setStatus(GameStatus.IN_PROGRESS);
        }
        session.touch();
        return JoinResult.joined(role);
    }

    /**
     * Plays a mark for a role.
     *
     * Checks run in a fixed order (status, turn, bounds, occupancy) so the
     * same illegal move always reports the same rejection.
     */
    public MoveResult applyMove(GameSession session, Mark role, int cell) {
        GameStatus status = session.getStatus();
        if (status == GameStatus.FINISHED) {
            return MoveResult.rejected(Rejection.GAME_FINISHED);
        }
        if (status == GameStatus.WAITING_FOR_PLAYERS || !session.hasBothPlayers()) {
            return MoveResult.rejected(Rejection.NOT_STARTED);
        }
        if (role != session.getTurn()) {
            return MoveResult.rejected(Rejection.NOT_YOUR_TURN);
        }
        if (!Board.isValidIndex(cell)) {
            return MoveResult.rejected(Rejection.INVALID_CELL);
        }
        Board board = session.board();
        if (!board.isEmpty(cell)) {
            return MoveResult.rejected(Rejection.CELL_OCCUPIED);
        }

        board.place(cell, role);

        Mark winner = board.winner();
        if (winner.isRole()) {
            session.finish(winner);
            logger.debug("Session {}: {} wins", session.getSessionId(), winner);
        } else if (board.isFull()) {
            session.finishAsDraw();
            logger.debug("Session {}: draw", session.getSessionId());
        } else {
            session.setTurn(role.opponent());
        }

        session.touch();
        return MoveResult.accepted(session.getStatus());
    }

    /**
     * Starts a new round: empty board, X to move, scores kept.
     */
    public GameStatus reset(GameSession session) {
        session.clearBoard();
        session.setStatus(session.hasBothPlayers() ? GameStatus.IN_PROGRESS : GameStatus.WAITING_FOR_PLAYERS);
        session.touch();
        return session.getStatus();
    }

    /**
     * Frees a role entirely, dropping the player's identity. The status is
     * left as it is; a new player may take the seat and carry on.
     *
     * @return the slot that was vacated, if the role was occupied
     */
    public Optional<PlayerSlot> leave(GameSession session, Mark role) {
        PlayerSlot removed = session.removeSlot(role);
        if (removed != null) {
            session.touch();
        }
        return Optional.ofNullable(removed);
    }

    private static Mark freeRole(GameSession session) {
        if (session.getSlot(Mark.X).isEmpty()) {
            return Mark.X;
        }
        if (session.getSlot(Mark.O).isEmpty()) {
            return Mark.O;
        }
        return null;
    }
}
