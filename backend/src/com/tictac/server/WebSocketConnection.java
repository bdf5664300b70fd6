package com.tictac.server;

import org.java_websocket.WebSocket;
import org.java_websocket.exceptions.WebsocketNotConnectedException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Presents a WebSocket client as a {@link Connection}. Text frames pushed in by the
 * gateway are read back as message units; bytes that do not fit the caller's buffer
 * are returned by the next read.
 */
public class WebSocketConnection implements Connection {
    private static final byte[] END_OF_STREAM = new byte[0];

    private final WebSocket socket;
    private final Endpoint endpoint;
    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
    private volatile int readTimeoutMillis = 0;
    private byte[] pending;
    private int pendingOffset;

    public WebSocketConnection(WebSocket socket) {
        this.socket = socket;
        this.endpoint = Endpoint.of(socket.getRemoteSocketAddress());
    }

    @Override
    public Endpoint getEndpoint() {
        return endpoint;
    }

    void enqueue(String message) {
        inbound.add(message.getBytes(StandardCharsets.UTF_8));
    }

    void markClosed() {
        inbound.add(END_OF_STREAM);
    }

    @Override
    public void write(byte[] data) throws IOException {
        try {
            socket.send(new String(data, StandardCharsets.UTF_8));
        } catch (WebsocketNotConnectedException e) {
            throw new IOException("WebSocket is not connected", e);
        }
    }

    @Override
    public synchronized int read(byte[] buffer) throws IOException {
        if (pending == null) {
            byte[] next = nextMessage();
            if (next == END_OF_STREAM) {
                // keep the marker so later reads see end of stream too
                inbound.add(END_OF_STREAM);
                return -1;
            }
            pending = next;
            pendingOffset = 0;
        }
        int count = Math.min(buffer.length, pending.length - pendingOffset);
        System.arraycopy(pending, pendingOffset, buffer, 0, count);
        pendingOffset += count;
        if (pendingOffset >= pending.length) {
            pending = null;
        }
        return count;
    }

    @Override
    public void setReadTimeout(int millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("Timeout must not be negative: " + millis);
        }
        this.readTimeoutMillis = millis;
    }

    @Override
    public void close() {
        socket.close();
    }

    @Override
    public String toString() {
        return "ws:" + endpoint;
    }

    private byte[] nextMessage() throws IOException {
        try {
            int timeout = readTimeoutMillis;
            if (timeout == 0) {
                return inbound.take();
            }
            byte[] next = inbound.poll(timeout, TimeUnit.MILLISECONDS);
            if (next == null) {
                throw new SocketTimeoutException("Read timed out");
            }
            return next;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for a message");
        }
    }
}
