package com.tictactoe.game;

/**
 * Caller-correctable reasons for refusing a join or a move.
 *
 * A rejection is reported to the originating connection only and never
 * changes the session.
 */
public enum Rejection {
    NOT_STARTED("Waiting for a second player"),
    GAME_FINISHED("Game is over, reset to play again"),
    NOT_YOUR_TURN("It is not your turn"),
    INVALID_CELL("Cell index must be between 0 and 8"),
    CELL_OCCUPIED("Cell already taken"),
    SESSION_FULL("Session already has two players"),
    NAME_IN_USE("A connected player already uses that name");

    private final String message;

    Rejection(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
