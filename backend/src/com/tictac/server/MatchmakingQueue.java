package com.tictac.server;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connections waiting for an opponent, oldest first. Appending and taking a pair
 * happen under the same lock, so a connection is paired at most once.
 */
public class MatchmakingQueue {
    private static final Logger LOGGER = Logger.getLogger(MatchmakingQueue.class.getName());

    private final Deque<Connection> waiting = new ArrayDeque<>();
    private final MatchStarter starter;

    public MatchmakingQueue(MatchStarter starter) {
        this.starter = Objects.requireNonNull(starter, "starter");
    }

    /**
     * Adds {@code connection} and, once two are waiting, hands the two oldest to the
     * starter.
     *
     * @return whether a pair was formed by this call
     */
    public synchronized boolean offer(Connection connection) {
        Objects.requireNonNull(connection, "connection");
        waiting.addLast(connection);
        if (waiting.size() < 2) {
            LOGGER.info(() -> String.format("%s is waiting for an opponent", connection.getEndpoint()));
            return false;
        }
        Connection first = waiting.pollFirst();
        Connection second = waiting.pollFirst();
        LOGGER.info(() -> String.format("Paired %s with %s", first.getEndpoint(), second.getEndpoint()));
        try {
            starter.start(first, second);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to start game for " + first.getEndpoint() + " and " + second.getEndpoint(), e);
            Transport.closeQuietly(first);
            Transport.closeQuietly(second);
        }
        return true;
    }

    public synchronized int waitingCount() {
        return waiting.size();
    }
}
