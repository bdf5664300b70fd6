package com.tictac.server;

/**
 * Receives each freshly formed pair. Called with the queue lock held, so
 * implementations hand the pair off and return without touching the network.
 */
@FunctionalInterface
public interface MatchStarter {
    void start(Connection first, Connection second);
}
