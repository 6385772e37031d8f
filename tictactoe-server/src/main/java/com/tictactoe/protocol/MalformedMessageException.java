package com.tictactoe.protocol;

/**
 * Thrown when an inbound frame cannot be turned into a usable message.
 *
 * This is a transport-level fault: it is answered with an ERROR frame on the
 * offending connection and never reaches a game session.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
