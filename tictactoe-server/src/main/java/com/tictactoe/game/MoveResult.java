package com.tictactoe.game;

/**
 * Outcome of {@link TurnEngine#applyMove}: the session status after an
 * accepted move, or the first rule the move broke.
 */
public final class MoveResult {

    private final GameStatus status;
    private final Rejection rejection;

    private MoveResult(GameStatus status, Rejection rejection) {
        this.status = status;
        this.rejection = rejection;
    }

    public static MoveResult accepted(GameStatus status) {
        return new MoveResult(status, null);
    }

    public static MoveResult rejected(Rejection rejection) {
        return new MoveResult(null, rejection);
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public GameStatus getStatus() {
        return status;
    }

    public Rejection getRejection() {
        return rejection;
    }

    @Override
    public String toString() {
        return isAccepted()
                ? "MoveResult{status=" + status + '}'
                : "MoveResult{rejected=" + rejection + '}';
    }
}
