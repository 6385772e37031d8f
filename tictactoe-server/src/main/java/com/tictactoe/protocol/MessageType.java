package com.tictactoe.protocol;

/**
 * Defines all message types for the game protocol.
 *
 * Client → Server:
 * - JOIN: Take a seat in a session (creates the session on first join)
 * - MOVE: Place a mark on a cell
 * - RESET: Clear the board for a new round, scores kept
 * - LEAVE: Give up the seat for good
 * - PING: Application-level heartbeat
 *
 * Server → Client:
 * - JOINED: Role assignment, sent only to the joining connection
 * - STATE: Full session snapshot, broadcast to every bound connection
 * - REJECTED: A join or move broke a rule, sent only to the originator
 * - ERROR: Connection-level problem (malformed message, not in a session)
 * - PONG: Heartbeat reply
 */
public enum MessageType {
    // Client → Server
    JOIN,
    MOVE,
    RESET,
    LEAVE,
    PING,

    // Server → Client
    JOINED,
    STATE,
    REJECTED,
    ERROR,
    PONG
}
