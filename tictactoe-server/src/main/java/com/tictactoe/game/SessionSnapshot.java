package com.tictactoe.game;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Externally visible state of a session at one point in time.
 *
 * Immutable, so a snapshot taken under the session lock can be serialized and
 * handed to any thread afterwards.
 *
 * JSON form:
 * {
 *     "sessionId": "abc",
 *     "board": ["X", "EMPTY", ...],
 *     "turn": "O",
 *     "status": "IN_PROGRESS",
 *     "scores": {"X": 1, "O": 0},
 *     "players": {"X": {"name": "Alice", "connected": true}, ...},
 *     "version": 7
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionSnapshot {

    private final String sessionId;
    private final List<Mark> board;
    private final Mark turn;
    private final GameStatus status;
    private final Mark winner;
    private final boolean draw;
    private final Map<Mark, Integer> scores;
    private final Map<Mark, PlayerView> players;
    private final long version;

    public SessionSnapshot(String sessionId, List<Mark> board, Mark turn, GameStatus status,
                           Mark winner, boolean draw, Map<Mark, Integer> scores,
                           Map<Mark, PlayerView> players, long version) {
        this.sessionId = sessionId;
        this.board = List.copyOf(board);
        this.turn = turn;
        this.status = status;
        this.winner = winner;
        this.draw = draw;
        this.scores = Collections.unmodifiableMap(scores);
        this.players = Collections.unmodifiableMap(players);
        this.version = version;
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<Mark> getBoard() {
        return board;
    }

    public Mark getTurn() {
        return turn;
    }

    public GameStatus getStatus() {
        return status;
    }

    public Mark getWinner() {
        return winner;
    }

    public boolean isDraw() {
        return draw;
    }

    public Map<Mark, Integer> getScores() {
        return scores;
    }

    public Map<Mark, PlayerView> getPlayers() {
        return players;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Who sits in a role and whether they are online.
     */
    public static class PlayerView {

        private final String name;
        private final boolean connected;

        public PlayerView(String name, boolean connected) {
            this.name = name;
            this.connected = connected;
        }

        public String getName() {
            return name;
        }

        public boolean isConnected() {
            return connected;
        }

        @Override
        public String toString() {
            return name + (connected ? "" : " (offline)");
        }
    }

    @Override
    public String toString() {
        return "SessionSnapshot{" +
                "sessionId='" + sessionId + '\'' +
                ", board=" + board +
                ", turn=" + turn +
                ", status=" + status +
                ", winner=" + winner +
                ", scores=" + scores +
                ", players=" + players +
                ", version=" + version +
                '}';
    }
}
