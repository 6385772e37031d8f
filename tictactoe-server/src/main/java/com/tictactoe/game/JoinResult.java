package com.tictactoe.game;

/**
 * Outcome of {@link TurnEngine#join}: either the role the caller now plays,
 * or the reason it was turned away.
 */
public final class JoinResult {

    private final Mark role;
    private final boolean reconnected;
    private final Rejection rejection;

    private JoinResult(Mark role, boolean reconnected, Rejection rejection) {
        this.role = role;
        this.reconnected = reconnected;
        this.rejection = rejection;
    }

    public static JoinResult joined(Mark role) {
        return new JoinResult(role, false, null);
    }

    public static JoinResult reconnected(Mark role) {
        return new JoinResult(role, true, null);
    }

    public static JoinResult rejected(Rejection rejection) {
        return new JoinResult(null, false, rejection);
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public Mark getRole() {
        return role;
    }

    /**
     * True when the caller reclaimed a slot it held before disconnecting.
     */
    public boolean isReconnected() {
        return reconnected;
    }

    public Rejection getRejection() {
        return rejection;
    }

    @Override
    public String toString() {
        return isAccepted()
                ? "JoinResult{role=" + role + ", reconnected=" + reconnected + '}'
                : "JoinResult{rejected=" + rejection + '}';
    }
}
