package com.tictac.server;

public class PlayerFailureException extends RuntimeException {
    private final PlayerFailure kind;
    private final Endpoint endpoint;

    public PlayerFailureException(PlayerFailure kind, Endpoint endpoint, String cause) {
        super((cause != null ? cause : kind.getDefaultCause()) + ": " + endpoint);
        this.kind = kind;
        this.endpoint = endpoint;
    }

    public static PlayerFailureException disconnected(Endpoint endpoint, String cause) {
        return new PlayerFailureException(PlayerFailure.DISCONNECTED, endpoint, cause);
    }

    public static PlayerFailureException quit(Endpoint endpoint) {
        return new PlayerFailureException(PlayerFailure.QUIT, endpoint, null);
    }

    public static PlayerFailureException timeout(Endpoint endpoint, String cause) {
        return new PlayerFailureException(PlayerFailure.TIMEOUT, endpoint, cause);
    }

    public static PlayerFailureException invalidMessage(Endpoint endpoint, String cause) {
        return new PlayerFailureException(PlayerFailure.INVALID_MESSAGE, endpoint, cause);
    }

    public PlayerFailure getKind() {
        return kind;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }
}
