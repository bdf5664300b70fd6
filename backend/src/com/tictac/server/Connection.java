package com.tictac.server;

import java.io.Closeable;
import java.io.IOException;

/**
 * A bidirectional byte stream to one client. Implementations capture the remote
 * endpoint when the connection is created so it stays available after close.
 */
public interface Connection extends Closeable {

    Endpoint getEndpoint();

    void write(byte[] data) throws IOException;

    /**
     * Reads at most {@code buffer.length} bytes.
     *
     * @return number of bytes read, or {@code -1} once the peer has closed the stream
     * @throws java.net.SocketTimeoutException when the read timeout elapses first
     */
    int read(byte[] buffer) throws IOException;

    /**
     * @param millis read deadline, {@code 0} blocks forever
     */
    void setReadTimeout(int millis) throws IOException;

    /**
     * Closes the stream. Calling it on an already closed connection is a no-op.
     */
    @Override
    void close() throws IOException;
}
