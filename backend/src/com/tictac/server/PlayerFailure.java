package com.tictac.server;

/**
 * Ways a player can drop out of the request/response loop.
 */
public enum PlayerFailure {
    DISCONNECTED("Player disconnected", true),
    QUIT("Player quit", true),
    TIMEOUT("Timeout waiting for player", true),
    INVALID_MESSAGE("Invalid message", false);

    private final String defaultCause;
    private final boolean terminal;

    PlayerFailure(String defaultCause, boolean terminal) {
        this.defaultCause = defaultCause;
        this.terminal = terminal;
    }

    public String getDefaultCause() {
        return defaultCause;
    }

    /**
     * Whether the failure ends the game. Only an invalid message lets play continue.
     */
    public boolean isTerminal() {
        return terminal;
    }
}
