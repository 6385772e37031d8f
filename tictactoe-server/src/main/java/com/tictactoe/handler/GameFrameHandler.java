package com.tictactoe.handler;

import com.tictactoe.connection.ConnectionManager;
import com.tictactoe.connection.ConnectionSupervisor;
import com.tictactoe.protocol.MalformedMessageException;
import com.tictactoe.protocol.Message;
import com.tictactoe.protocol.MessageSerializer;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns WebSocket frames into calls on the connection's supervisor.
 *
 * - JOIN: take a seat (or reclaim one) and receive the full state
 * - MOVE / RESET / LEAVE: change the session, everyone bound gets the new state
 * - PING: answered with PONG
 *
 * Threading Model:
 * - Each channel is handled by a single Netty worker thread
 * - Session state is shared between channels and guarded by per-session locks
 *   inside the supervisor
 *
 * Malformed frames are answered with ERROR and the connection stays open. An
 * invariant violation ends this connection only.
 */
public class GameFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger logger = LoggerFactory.getLogger(GameFrameHandler.class);

    private final ConnectionManager connectionManager;
    private final MessageSerializer serializer;

    public GameFrameHandler(ConnectionManager connectionManager, MessageSerializer serializer) {
        this.connectionManager = connectionManager;
        this.serializer = serializer;
    }

    /**
     * Called when a new connection is established.
     */
    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        connectionManager.register(ctx.channel());
        logger.debug("New connection: {}", ctx.channel().id().asShortText());
    }

    /**
     * Called on every way a connection can end: close, timeout, error.
     */
    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        connectionManager.remove(ctx.channel());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        // We only handle text frames (JSON messages)
        if (!(frame instanceof TextWebSocketFrame)) {
            logger.warn("Unsupported frame type: {}", frame.getClass().getName());
            return;
        }

        String json = ((TextWebSocketFrame) frame).text();
        ConnectionSupervisor supervisor = connectionManager.get(ctx.channel());

        if (supervisor == null) {
            logger.error("Received message from unknown channel");
            return;
        }

        try {
            Message message = serializer.deserialize(json);
            handleMessage(supervisor, message);
        } catch (MalformedMessageException e) {
            logger.debug("Rejected frame from {}: {}", ctx.channel().id().asShortText(), e.getMessage());
            supervisor.sendError(e.getMessage());
        } catch (IllegalStateException e) {
            logger.error("Invariant violation while handling {} on {}, closing connection",
                    json, ctx.channel().id().asShortText(), e);
            ctx.close();
        }
    }

    /**
     * Routes the message to the appropriate supervisor operation.
     */
    private void handleMessage(ConnectionSupervisor supervisor, Message message) {
        logger.debug("Received {} from {}", message.getType(), supervisor.getConnection().getId());

        switch (message.getType()) {
            case JOIN -> supervisor.bind(message.requireSessionId(), message.requireText("name", "Player name"));
            case MOVE -> supervisor.move(message.requireInt("cell", "Cell"));
            case RESET -> supervisor.reset();
            case LEAVE -> supervisor.leave();
            case PING -> supervisor.ping();
            default -> throw new MalformedMessageException("Unexpected message type: " + message.getType());
        }
    }

    // === Netty Event Handlers ===

    /**
     * A connection silent for longer than the heartbeat interval is treated as
     * gone. Closing it runs handlerRemoved, which releases the seat.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", ctx.channel().id().asShortText());
                ctx.close();
                return;
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("WebSocket error on {}", ctx.channel().id().asShortText(), cause);
        ctx.close();
    }
}
