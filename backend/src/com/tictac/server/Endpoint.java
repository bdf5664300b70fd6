package com.tictac.server;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * Remote address of a connected player. Used to tell the two players of a game apart
 * when a failure is reported.
 */
public final class Endpoint {
    public static final Endpoint UNKNOWN = new Endpoint("unknown", 0);

    private final String host;
    private final int port;

    public Endpoint(String host, int port) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
    }

    public static Endpoint of(SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            return new Endpoint(inet.getHostString(), inet.getPort());
        }
        return UNKNOWN;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Endpoint other)) {
            return false;
        }
        return port == other.port && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
