package com.tictac.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class Main {

    public static void main(String[] args) throws IOException, InterruptedException {
        ServerConfig config = ServerConfig.fromEnvironment(System.getenv());
        initLogging(config.getLogDir());

        GameServer server = new GameServer(config);
        server.start();
        System.out.printf("Tic-tac-toe server running on %s:%d%n", config.getHost(), server.getPort());
        System.out.printf("Move timeout %d seconds%n", config.getMoveTimeout().toSeconds());

        WebSocketGateway wsGateway = null;
        if (config.getWebSocketPort() != null) {
            wsGateway = new WebSocketGateway(new InetSocketAddress(config.getHost(), config.getWebSocketPort()), server::accept);
            wsGateway.start();
            System.out.printf("WebSocket server started on port %d%n", config.getWebSocketPort());
        }
        addShutdownHook(server, wsGateway);
        server.join();
    }

    private static void addShutdownHook(GameServer server, WebSocketGateway wsGateway) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down server...");
            try {
                if (wsGateway != null) {
                    wsGateway.stop(1000);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                server.close();
            }
        }));
    }

    private static void initLogging(Path configuredDir) {
        try {
            Path logDir = configuredDir.toAbsolutePath().normalize();
            Files.createDirectories(logDir);
            Path logFile = logDir.resolve("tictac.log");

            Logger root = Logger.getLogger("");
            for (Handler handler : root.getHandlers()) {
                root.removeHandler(handler);
            }
            FileHandler fh = new FileHandler(logFile.toString(), true);
            fh.setFormatter(new SimpleFormatter());
            fh.setLevel(Level.INFO);

            root.addHandler(fh);
            root.setLevel(Level.INFO);
            System.out.printf("Logging to %s%n", logFile);
        } catch (IOException e) {
            System.err.printf("Failed to initialize logging: %s%n", e.getMessage());
        }
    }
}
