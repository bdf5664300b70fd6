package com.tictac.server;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented client used to drive the server the way a terminal player would.
 */
final class TestClient implements Closeable {
    private static final int READ_TIMEOUT_MILLIS = 5000;
    static final int BOARD_LINES = 5;

    private final Socket socket;
    private final BufferedReader reader;
    private final OutputStream out;

    TestClient(Socket socket) throws IOException {
        this.socket = socket;
        socket.setSoTimeout(READ_TIMEOUT_MILLIS);
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.out = socket.getOutputStream();
    }

    static TestClient connect(int port) throws IOException {
        return new TestClient(new Socket(InetAddress.getLoopbackAddress(), port));
    }

    String readLine() throws IOException {
        return reader.readLine();
    }

    List<String> readBoard() throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < BOARD_LINES; i++) {
            lines.add(readLine());
        }
        return lines;
    }

    /**
     * Reads up to and including the first line equal to {@code expected}.
     */
    List<String> readUntil(String expected) throws IOException {
        List<String> lines = new ArrayList<>();
        while (true) {
            String line = readLine();
            if (line == null) {
                throw new AssertionError("Stream ended before '" + expected + "', got " + lines);
            }
            lines.add(line);
            if (line.equals(expected)) {
                return lines;
            }
        }
    }

    /**
     * Reads until the server closes the stream.
     */
    List<String> readRemaining() throws IOException {
        List<String> lines = new ArrayList<>();
        try {
            String line;
            while ((line = readLine()) != null) {
                lines.add(line);
            }
        } catch (SocketException e) {
            // reset by the server while closing
        }
        return lines;
    }

    void send(String text) throws IOException {
        out.write((text + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
