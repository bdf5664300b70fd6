package com.tictac.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransportTest {

    private final Transport transport = new Transport(1024);

    private SocketPair pair;
    private TcpConnection connection;

    @BeforeEach
    void setUp() throws IOException {
        pair = SocketPair.open();
        connection = new TcpConnection(pair.server);
    }

    @AfterEach
    void tearDown() throws IOException {
        pair.close();
    }

    private void clientWrites(String text) throws IOException {
        OutputStream out = pair.client.getOutputStream();
        out.write(text.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @Test
    void sendWritesWholeText() throws IOException {
        transport.send(connection, "Welcome! Waiting for opponent...\n");

        InputStream in = pair.client.getInputStream();
        byte[] expected = "Welcome! Waiting for opponent...\n".getBytes(StandardCharsets.UTF_8);
        assertThat(in.readNBytes(expected.length)).isEqualTo(expected);
    }

    @Test
    void receiveTrimsSurroundingWhitespace() throws IOException {
        clientWrites("  MOVE 4 \r\n");

        assertThat(transport.receive(connection, Duration.ofSeconds(2))).isEqualTo("MOVE 4");
    }

    @Test
    void receiveTimesOutAndClearsDeadline() throws IOException {
        assertThatThrownBy(() -> transport.receive(connection, Duration.ofMillis(200)))
                .isInstanceOfSatisfying(PlayerFailureException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(PlayerFailure.TIMEOUT);
                    assertThat(e.getEndpoint()).isEqualTo(connection.getEndpoint());
                    assertThat(e.getMessage()).startsWith("Timed out after 200 ms");
                });

        assertThat(pair.server.getSoTimeout()).isZero();
    }

    @Test
    void connectionStaysUsableAfterTimeout() throws IOException {
        assertThatThrownBy(() -> transport.receive(connection, Duration.ofMillis(100)))
                .isInstanceOf(PlayerFailureException.class);

        clientWrites("QUIT\n");

        assertThat(transport.receive(connection, Duration.ofSeconds(2))).isEqualTo("QUIT");
        assertThat(pair.server.getSoTimeout()).isZero();
    }

    @Test
    void orderlyCloseIsADisconnect() throws IOException {
        pair.client.close();

        assertThatThrownBy(() -> transport.receive(connection, Duration.ofSeconds(2)))
                .isInstanceOfSatisfying(PlayerFailureException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(PlayerFailure.DISCONNECTED);
                    assertThat(e.getMessage()).startsWith("client closed connection");
                });
        assertThat(pair.server.getSoTimeout()).isZero();
    }

    @Test
    void sendOnClosedSocketIsADisconnect() throws IOException {
        pair.server.close();

        assertThatThrownBy(() -> transport.send(connection, "hello\n"))
                .isInstanceOfSatisfying(PlayerFailureException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(PlayerFailure.DISCONNECTED);
                    assertThat(e.getEndpoint()).isEqualTo(connection.getEndpoint());
                    assertThat(e.getMessage()).startsWith("send failed:");
                });
    }

    @Test
    void unresolvableEndpointFallsBackToUnknown() {
        TcpConnection unconnected = new TcpConnection(new Socket());

        assertThatThrownBy(() -> transport.send(unconnected, "hello\n"))
                .isInstanceOfSatisfying(PlayerFailureException.class,
                        e -> assertThat(e.getEndpoint()).isEqualTo(Endpoint.UNKNOWN));
    }

    @Test
    void readFailureIsADisconnectAndDeadlineIsStillCleared() throws IOException {
        Connection broken = mock(Connection.class);
        when(broken.getEndpoint()).thenReturn(new Endpoint("10.1.1.1", 7000));
        when(broken.read(any(byte[].class))).thenThrow(new IOException("Connection reset"));

        assertThatThrownBy(() -> transport.receive(broken, Duration.ofSeconds(30)))
                .isInstanceOfSatisfying(PlayerFailureException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(PlayerFailure.DISCONNECTED);
                    assertThat(e.getMessage()).isEqualTo("recv failed: Connection reset: 10.1.1.1:7000");
                });
        verify(broken).setReadTimeout(30_000);
        verify(broken).setReadTimeout(0);
    }

    @Test
    void closeQuietlyToleratesFailingClose() throws IOException {
        Connection failing = mock(Connection.class);
        doThrow(new IOException("already closed")).when(failing).close();

        Transport.closeQuietly(failing);
        Transport.closeQuietly(null);

        verify(failing).close();
    }

    @Test
    void rejectsNonPositiveBufferSize() {
        assertThatThrownBy(() -> new Transport(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describesWholeSecondsAndMillis() {
        assertThat(Transport.describe(Duration.ofSeconds(30))).isEqualTo("30 seconds");
        assertThat(Transport.describe(Duration.ofMillis(1500))).isEqualTo("1500 ms");
    }
}
