package com.tictactoe.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.handler.timeout.IdleStateHandler;

import com.tictactoe.connection.ConnectionManager;
import com.tictactoe.game.TurnEngine;
import com.tictactoe.handler.GameFrameHandler;
import com.tictactoe.protocol.MessageSerializer;
import com.tictactoe.state.BroadcastHub;
import com.tictactoe.state.SessionReaper;
import com.tictactoe.state.SessionRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket game server using Netty's NIO.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: N threads (CPU cores) that handle I/O for the connections
 * - Reaper: 1 scheduled thread that evicts abandoned sessions
 *
 * Connections are served in parallel; sessions are independent of each other
 * and each is guarded by its own lock.
 */
public class GameServer {

    private static final Logger logger = LoggerFactory.getLogger(GameServer.class);

    // Outbound bytes queued per channel before it counts as a slow consumer
    private static final WriteBufferWaterMark WATER_MARK = new WriteBufferWaterMark(32 * 1024, 64 * 1024);

    private final ServerConfig config;
    private final MessageSerializer serializer;
    private final SessionRegistry registry;
    private final ConnectionManager connectionManager;
    private final SessionReaper reaper;

    // Netty event loop groups
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public GameServer(ServerConfig config) {
        this(config, new SessionRegistry());
    }

    public GameServer(ServerConfig config, SessionRegistry registry) {
        this.config = config;
        this.serializer = new MessageSerializer();
        this.registry = registry;
        this.connectionManager = new ConnectionManager(
                registry, new TurnEngine(), new BroadcastHub(serializer), serializer);
        this.reaper = new SessionReaper(registry, config.getStaleness(), config.getReaperInterval());
    }

    /**
     * Starts the server and blocks until it is shut down.
     */
    public void start() throws InterruptedException {
        try {
            bind();
            // Block until the server channel is closed
            serverChannel.closeFuture().sync();
        } finally {
            shutdown();
        }
    }

    /**
     * Binds the listening socket and starts the reaper, then returns.
     */
    public synchronized void bind() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }

        // Boss group: accepts incoming connections (1 thread is enough)
        bossGroup = new NioEventLoopGroup(1);
        // Worker group: handles I/O for accepted connections
        workerGroup = new NioEventLoopGroup();

        long idleSeconds = config.getIdleTimeout().toSeconds();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, WATER_MARK)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        // Silence on the read side is the heartbeat timeout
                        pipeline.addLast(new IdleStateHandler(idleSeconds, 0, 0, TimeUnit.SECONDS));

                        // HTTP codec and aggregation for the WebSocket handshake
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(config.getMaxFrameSize()));
                        pipeline.addLast(new WebSocketServerCompressionHandler());

                        // Handshake, ping/pong, close frames
                        pipeline.addLast(new WebSocketServerProtocolHandler(
                                config.getPath(),
                                null,      // subprotocols
                                true,      // allow extensions
                                config.getMaxFrameSize(),
                                false,     // allow mask mismatch
                                true,      // check starting slash
                                10000L     // handshake timeout ms
                        ));

                        pipeline.addLast(new GameFrameHandler(connectionManager, serializer));
                    }
                });

        serverChannel = bootstrap.bind(config.getPort()).sync().channel();
        reaper.start();

        logger.info("Server started successfully!");
        logger.info("WebSocket endpoint: ws://localhost:{}{}", getPort(), config.getPath());
    }

    /**
     * Gracefully shuts down the server.
     * - Stops the reaper and stops accepting new connections
     * - Releases the event loops
     */
    public synchronized void shutdown() {
        logger.info("Shutting down server...");

        reaper.stop();

        if (serverChannel != null) {
            serverChannel.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }

        logger.info("Server shutdown complete.");
    }

    /**
     * The port actually bound, which differs from the configured one when
     * the configuration asks for port 0.
     */
    public int getPort() {
        if (serverChannel != null && serverChannel.localAddress() instanceof InetSocketAddress) {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }
        return config.getPort();
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public SessionReaper getReaper() {
        return reaper;
    }
}
