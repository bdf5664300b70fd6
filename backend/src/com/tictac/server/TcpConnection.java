package com.tictac.server;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;

public class TcpConnection implements Connection {
    private final Socket socket;
    private final Endpoint endpoint;

    public TcpConnection(Socket socket) {
        this.socket = socket;
        this.endpoint = Endpoint.of(socket.getRemoteSocketAddress());
    }

    @Override
    public Endpoint getEndpoint() {
        return endpoint;
    }

    @Override
    public synchronized void write(byte[] data) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(data);
        out.flush();
    }

    @Override
    public int read(byte[] buffer) throws IOException {
        return socket.getInputStream().read(buffer);
    }

    @Override
    public void setReadTimeout(int millis) throws IOException {
        socket.setSoTimeout(millis);
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    @Override
    public String toString() {
        return "tcp:" + endpoint;
    }
}
