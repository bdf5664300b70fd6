package com.tictac.server;

import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;

import java.net.InetSocketAddress;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Lets browser clients play: every WebSocket connection joins the same matchmaking
 * path as a TCP client, one text frame per message.
 */
public class WebSocketGateway extends WebSocketServer {
    private static final Logger LOGGER = Logger.getLogger(WebSocketGateway.class.getName());

    private final Consumer<Connection> acceptor;

    public WebSocketGateway(InetSocketAddress address, Consumer<Connection> acceptor) {
        super(address);
        this.acceptor = acceptor;
        setReuseAddr(true);
    }

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        WebSocketConnection connection = new WebSocketConnection(conn);
        conn.setAttachment(connection);
        acceptor.accept(connection);
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        WebSocketConnection connection = conn.getAttachment();
        if (connection != null) {
            connection.markClosed();
        }
        LOGGER.fine(() -> "WS closed: " + conn.getRemoteSocketAddress() + " code " + code);
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        WebSocketConnection connection = conn.getAttachment();
        if (connection != null) {
            connection.enqueue(message);
        }
    }

    @Override
    public void onError(WebSocket conn, Exception ex) {
        LOGGER.warning("WebSocket error: " + ex.getMessage());
    }

    @Override
    public void onStart() {
        LOGGER.info("WebSocket server started");
    }
}
