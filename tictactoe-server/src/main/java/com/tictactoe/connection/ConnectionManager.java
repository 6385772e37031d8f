package com.tictactoe.connection;

import com.tictactoe.game.TurnEngine;
import com.tictactoe.protocol.MessageSerializer;
import com.tictactoe.state.BroadcastHub;
import com.tictactoe.state.SessionRegistry;
import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the supervisor of every open channel.
 *
 * Thread Safety:
 * - Uses ConcurrentHashMap for thread-safe operations
 * - All methods can be called from any thread safely
 */
public class ConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final Map<String, ConnectionSupervisor> supervisorsByChannelId;

    private final SessionRegistry registry;
    private final TurnEngine engine;
    private final BroadcastHub hub;
    private final MessageSerializer serializer;

    public ConnectionManager(SessionRegistry registry, TurnEngine engine,
                             BroadcastHub hub, MessageSerializer serializer) {
        this.supervisorsByChannelId = new ConcurrentHashMap<>();
        this.registry = registry;
        this.engine = engine;
        this.hub = hub;
        this.serializer = serializer;
    }

    /**
     * Creates and registers a supervisor for a newly opened channel.
     */
    public ConnectionSupervisor register(Channel channel) {
        ConnectionSupervisor supervisor = new ConnectionSupervisor(
                new ChannelConnection(channel), registry, engine, hub, serializer);
        String channelId = channel.id().asLongText();
        supervisorsByChannelId.put(channelId, supervisor);

        logger.debug("Connection registered: {} (total: {})", channelId, supervisorsByChannelId.size());
        return supervisor;
    }

    /**
     * Forgets a closed channel and releases its seat, if it held one.
     *
     * @return the removed supervisor, or null if the channel was unknown
     */
    public ConnectionSupervisor remove(Channel channel) {
        String channelId = channel.id().asLongText();
        ConnectionSupervisor supervisor = supervisorsByChannelId.remove(channelId);

        if (supervisor != null) {
            supervisor.unbind();
            logger.debug("Connection removed: {} (total: {})", channelId, supervisorsByChannelId.size());
        }
        return supervisor;
    }

    public ConnectionSupervisor get(Channel channel) {
        return supervisorsByChannelId.get(channel.id().asLongText());
    }

    public int getConnectionCount() {
        return supervisorsByChannelId.size();
    }

    public SessionRegistry getRegistry() {
        return registry;
    }
}
