package com.tictactoe.game;

import com.tictactoe.connection.PlayerConnection;

import java.util.Optional;

/**
 * A seat at the board: the player's name, the role it plays, and the
 * connection currently speaking for it, if any.
 *
 * The name is the player's identity. It survives disconnects so that a later
 * join with the same name can reclaim the role.
 */
public class PlayerSlot {

    private final String name;
    private final Mark role;
    private PlayerConnection connection;

    PlayerSlot(String name, Mark role, PlayerConnection connection) {
        if (!role.isRole()) {
            throw new IllegalArgumentException("Slot role must be X or O, got " + role);
        }
        this.name = name;
        this.role = role;
        this.connection = connection;
    }

    public String getName() {
        return name;
    }

    public Mark getRole() {
        return role;
    }

    public Optional<PlayerConnection> getConnection() {
        return Optional.ofNullable(connection);
    }

    /**
     * A slot is connected when it holds a connection the transport still
     * reports as active. A closed connection whose cleanup has not run yet
     * counts as disconnected.
     */
    public boolean isConnected() {
        return connection != null && connection.isActive();
    }

    public boolean isHeldBy(PlayerConnection candidate) {
        return connection != null && connection == candidate;
    }

    void attach(PlayerConnection connection) {
        this.connection = connection;
    }

    void detach() {
        this.connection = null;
    }

    @Override
    public String toString() {
        return "PlayerSlot{" +
                "name='" + name + '\'' +
                ", role=" + role +
                ", connected=" + isConnected() +
                '}';
    }
}
