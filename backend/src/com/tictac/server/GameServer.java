package com.tictac.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TCP front door. Each accepted client gets its own worker that greets it and puts it
 * in the matchmaking queue; each formed pair gets a session worker.
 */
public class GameServer implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(GameServer.class.getName());

    private final ServerConfig config;
    private final Transport transport;
    private final MatchmakingQueue queue;
    private final ExecutorService clientWorkers = Executors.newCachedThreadPool(new DaemonThreadFactory("tictac-client"));
    private final ExecutorService sessionWorkers = Executors.newCachedThreadPool(new DaemonThreadFactory("tictac-session"));

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;

    public GameServer(ServerConfig config) {
        this.config = config;
        this.transport = new Transport(config.getBufferSize());
        this.queue = new MatchmakingQueue(this::startSession);
    }

    public synchronized void start() throws IOException {
        if (running) {
            throw new IllegalStateException("Server already started");
        }
        ServerSocket socket = new ServerSocket();
        try {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(config.getHost(), config.getPort()));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        this.serverSocket = socket;
        this.running = true;
        this.acceptThread = new Thread(this::acceptLoop, "tictac-acceptor");
        acceptThread.start();
        LOGGER.info(() -> String.format("Server running on %s:%d", config.getHost(), getPort()));
    }

    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : config.getPort();
    }

    public int getWaitingCount() {
        return queue.waitingCount();
    }

    /**
     * Hands a freshly connected client to a worker. TCP and WebSocket clients both
     * enter here.
     */
    public void accept(Connection connection) {
        LOGGER.info(() -> "Connected by " + connection.getEndpoint());
        try {
            clientWorkers.execute(() -> welcome(connection));
        } catch (RejectedExecutionException e) {
            LOGGER.warning(() -> "Server is shutting down, dropping " + connection.getEndpoint());
            Transport.closeQuietly(connection);
        }
    }

    public void join() throws InterruptedException {
        Thread thread = acceptThread;
        if (thread != null) {
            thread.join();
        }
    }

    @Override
    public synchronized void close() {
        running = false;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Failed to close server socket", e);
            }
        }
        clientWorkers.shutdownNow();
        sessionWorkers.shutdownNow();
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket socket = serverSocket.accept();
                accept(new TcpConnection(socket));
            } catch (IOException e) {
                if (running) {
                    LOGGER.log(Level.WARNING, "Error accepting client connection", e);
                }
            }
        }
        LOGGER.info("Accept loop stopped");
    }

    private void welcome(Connection connection) {
        try {
            transport.send(connection, Protocol.line(Protocol.WELCOME));
        } catch (PlayerFailureException e) {
            LOGGER.info(() -> "Could not greet client: " + e.getMessage());
            Transport.closeQuietly(connection);
            return;
        }
        queue.offer(connection);
    }

    private void startSession(Connection first, Connection second) {
        sessionWorkers.execute(new GameSession(first, second, transport, config.getMoveTimeout()));
    }
}
