package com.tictactoe.game;

/**
 * Contents of a board cell. X and O double as the two player roles.
 */
public enum Mark {
    EMPTY,
    X,
    O;

    /**
     * Returns the other playable mark.
     *
     * @throws IllegalStateException for EMPTY, which has no opponent
     */
    public Mark opponent() {
        return switch (this) {
            case X -> O;
            case O -> X;
            case EMPTY -> throw new IllegalStateException("EMPTY has no opponent");
        };
    }

    public boolean isRole() {
        return this != EMPTY;
    }
}
