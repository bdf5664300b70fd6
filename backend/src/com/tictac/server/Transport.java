package com.tictac.server;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Blocking send/receive over a {@link Connection}. Every I/O problem surfaces as a
 * {@link PlayerFailureException} so the game loop only has one failure type to handle.
 */
public class Transport {
    private static final Logger LOGGER = Logger.getLogger(Transport.class.getName());

    private final int bufferSize;

    public Transport(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public void send(Connection connection, String text) {
        try {
            connection.write(text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw PlayerFailureException.disconnected(endpointOf(connection), "send failed: " + e.getMessage());
        }
    }

    /**
     * Waits up to {@code timeout} for one message and returns it with surrounding
     * whitespace removed. The read deadline is always cleared before returning.
     */
    public String receive(Connection connection, Duration timeout) {
        byte[] buffer = new byte[bufferSize];
        try {
            connection.setReadTimeout(toMillis(timeout));
            int read = connection.read(buffer);
            if (read < 0) {
                throw PlayerFailureException.disconnected(endpointOf(connection), "client closed connection");
            }
            return new String(buffer, 0, read, StandardCharsets.UTF_8).strip();
        } catch (SocketTimeoutException e) {
            throw PlayerFailureException.timeout(endpointOf(connection), "Timed out after " + describe(timeout));
        } catch (IOException e) {
            throw PlayerFailureException.disconnected(endpointOf(connection), "recv failed: " + e.getMessage());
        } finally {
            clearDeadline(connection);
        }
    }

    public static void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Failed to close connection " + connection, e);
        }
    }

    private static void clearDeadline(Connection connection) {
        try {
            connection.setReadTimeout(0);
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Failed to clear read deadline on " + connection, e);
        }
    }

    private static Endpoint endpointOf(Connection connection) {
        Endpoint endpoint = connection.getEndpoint();
        return endpoint != null ? endpoint : Endpoint.UNKNOWN;
    }

    private static int toMillis(Duration timeout) {
        long millis = timeout.toMillis();
        if (millis <= 0) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        return (int) Math.min(Integer.MAX_VALUE, millis);
    }

    static String describe(Duration timeout) {
        if (timeout.toMillis() % 1000 == 0) {
            return timeout.toSeconds() + " seconds";
        }
        return timeout.toMillis() + " ms";
    }
}
