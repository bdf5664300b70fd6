package com.tictac.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebSocketGatewayTest {

    private final List<Connection> accepted = new ArrayList<>();
    private WebSocketGateway gateway;
    private WebSocket socket;

    @BeforeEach
    void setUp() {
        gateway = new WebSocketGateway(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), accepted::add);
        socket = mock(WebSocket.class);
        when(socket.getRemoteSocketAddress()).thenReturn(new InetSocketAddress("10.0.0.3", 7001));
    }

    private WebSocketConnection open() {
        gateway.onOpen(socket, mock(ClientHandshake.class));
        WebSocketConnection connection = (WebSocketConnection) accepted.get(0);
        when(socket.<WebSocketConnection>getAttachment()).thenReturn(connection);
        return connection;
    }

    @Test
    void openedSocketIsHandedToAcceptor() {
        WebSocketConnection connection = open();

        assertThat(accepted).hasSize(1);
        assertThat(connection.getEndpoint()).isEqualTo(new Endpoint("10.0.0.3", 7001));
        verify(socket).setAttachment(connection);
    }

    @Test
    void messagesReachTheConnection() throws IOException {
        WebSocketConnection connection = open();

        gateway.onMessage(socket, "MOVE 4");

        byte[] buffer = new byte[64];
        int read = connection.read(buffer);
        assertThat(new String(buffer, 0, read, StandardCharsets.UTF_8)).isEqualTo("MOVE 4");
    }

    @Test
    void closeEndsTheStream() throws IOException {
        WebSocketConnection connection = open();

        gateway.onClose(socket, 1000, "bye", true);

        assertThat(connection.read(new byte[64])).isEqualTo(-1);
    }
}
