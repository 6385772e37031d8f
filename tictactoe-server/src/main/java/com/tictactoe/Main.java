package com.tictactoe;

import com.tictactoe.server.GameServer;
import com.tictactoe.server.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the Tic-Tac-Toe session server.
 *
 * Two players join a session by id over WebSocket; the server keeps the
 * authoritative board and streams every change to both of them.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfig config;
        try {
            config = ServerConfig.load();
        } catch (RuntimeException e) {
            logger.error("Invalid configuration", e);
            System.exit(1);
            return;
        }

        // Allow port override via command line argument
        if (args.length > 0) {
            try {
                config = config.withPort(Integer.parseInt(args[0]));
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid port argument '{}', using port {}", args[0], config.getPort());
            }
        }

        logger.info("===========================================");
        logger.info("  Tic-Tac-Toe Session Server");
        logger.info("  Starting on port {}", config.getPort());
        logger.info("===========================================");
        logger.debug("Configuration: {}", config);

        GameServer server = new GameServer(config);

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping server...");
            server.shutdown();
        }));

        try {
            server.start();
        } catch (Exception e) {
            logger.error("Failed to start server", e);
            System.exit(1);
        }
    }
}
