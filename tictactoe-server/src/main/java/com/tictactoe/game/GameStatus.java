package com.tictactoe.game;

/**
 * Lifecycle of a match.
 *
 * WAITING_FOR_PLAYERS → IN_PROGRESS on the second join, IN_PROGRESS → FINISHED
 * on a win or draw. Leaving FINISHED is only possible through a reset.
 */
public enum GameStatus {
    WAITING_FOR_PLAYERS,
    IN_PROGRESS,
    FINISHED
}
