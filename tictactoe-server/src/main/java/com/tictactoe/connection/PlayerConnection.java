package com.tictactoe.connection;

/**
 * A live transport connection as seen by the game core.
 *
 * Game sessions only hold these as optional handles; a session never owns or
 * keeps a connection alive, and a connection closing never invalidates the
 * session it was bound to.
 */
public interface PlayerConnection {

    /**
     * Stable identifier of the connection, for logging and equality checks.
     */
    String getId();

    /**
     * Whether the transport still reports this connection as open.
     */
    boolean isActive();

    /**
     * Queues a serialized message for delivery.
     *
     * @return false if the connection is closed or cannot take more data right
     *         now; the caller decides what to do with a connection that refuses
     */
    boolean send(String message);

    /**
     * Closes the connection. Idempotent.
     */
    void close();
}
