package com.tictactoe.state;

import com.tictactoe.connection.PlayerConnection;
import com.tictactoe.game.GameSession;
import com.tictactoe.game.PlayerSlot;
import com.tictactoe.protocol.MessageSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fans a session's snapshots out to every connection bound to it.
 *
 * Ordering: publish is only called while the session lock is held, and every
 * connection queues writes in call order, so all recipients of one session see
 * its snapshots in the order they were produced.
 *
 * Full-buffer policy: disconnect the slow consumer. A connection that refuses
 * a snapshot (closed, or its outbound buffer is over the high water mark) is
 * closed and detached from its slot, and the snapshot is published again so
 * the remaining player sees the opponent as disconnected. Delivery to one
 * connection never waits on another.
 */
public class BroadcastHub {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastHub.class);

    private final MessageSerializer serializer;

    public BroadcastHub(MessageSerializer serializer) {
        this.serializer = serializer;
    }

    /**
     * Delivers the current snapshot of a session to all of its bound connections.
     *
     * @return number of connections that accepted the final snapshot
     * @throws IllegalStateException if the caller does not hold the session lock
     */
    public int publish(GameSession session) {
        if (!session.isHeldByCurrentThread()) {
            throw new IllegalStateException("publish requires the lock of session " + session.getSessionId());
        }

        while (true) {
            String json = serializer.state(session.snapshot());
            List<PlayerSlot> refused = new ArrayList<>();
            int delivered = 0;

            for (PlayerSlot slot : session.getSlots()) {
                Optional<PlayerConnection> connection = slot.getConnection();
                if (connection.isEmpty()) {
                    continue;
                }
                if (connection.get().send(json)) {
                    delivered++;
                } else {
                    refused.add(slot);
                }
            }

            if (refused.isEmpty()) {
                return delivered;
            }

            // Each pass detaches at least one connection, so this terminates
            for (PlayerSlot slot : refused) {
                PlayerConnection connection = slot.getConnection().orElse(null);
                if (connection == null) {
                    continue;
                }
                logger.warn("Dropping connection {} ({} in session {}): snapshot refused",
                        connection.getId(), slot.getRole(), session.getSessionId());
                connection.close();
                session.detach(slot.getRole(), connection);
            }
        }
    }
}
