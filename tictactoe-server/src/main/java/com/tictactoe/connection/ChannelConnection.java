package com.tictactoe.connection;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;

/**
 * A WebSocket connection backed by a Netty channel.
 *
 * Thread Safety:
 * - The channel is immutable after creation
 * - send may be called from any thread; writes are queued on the channel's
 *   event loop in call order
 */
public class ChannelConnection implements PlayerConnection {

    private static final Logger logger = LoggerFactory.getLogger(ChannelConnection.class);

    private final Channel channel;
    private final String id;

    public ChannelConnection(Channel channel) {
        this.channel = channel;
        this.id = channel.id().asShortText();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isActive() {
        return channel.isActive();
    }

    /**
     * Queues a text frame. Refuses when the channel is closed or its outbound
     * buffer is above the high water mark; a failed write closes the channel.
     */
    @Override
    public boolean send(String message) {
        if (!channel.isActive()) {
            return false;
        }
        if (!channel.isWritable()) {
            logger.debug("Channel {} not writable, refusing message", id);
            return false;
        }
        // Always go through the task queue. Writing inline when already on the
        // event loop would overtake frames other threads queued before us.
        try {
            channel.eventLoop().execute(() ->
                    channel.writeAndFlush(new TextWebSocketFrame(message))
                            .addListener(ChannelFutureListener.CLOSE_ON_FAILURE));
        } catch (RejectedExecutionException e) {
            logger.debug("Event loop of channel {} is shutting down", id);
            return false;
        }
        return true;
    }

    @Override
    public void close() {
        channel.close();
    }

    @Override
    public String toString() {
        return "ChannelConnection{" +
                "id='" + id + '\'' +
                ", active=" + isActive() +
                '}';
    }
}
