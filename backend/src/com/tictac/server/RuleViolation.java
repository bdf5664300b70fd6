package com.tictac.server;

public enum RuleViolation {
    OUT_OF_RANGE("OutOfRange", true),
    CELL_OCCUPIED("CellOccupied", true),
    NOT_YOUR_TURN("NotYourTurn", true),
    INVALID_MOVE("InvalidMove", true),
    PLAYER_NOT_RECOGNIZED("PlayerNotRecognized", false),
    GAME_OVER("GameOver", false);

    private final String displayName;
    private final boolean recoverable;

    RuleViolation(String displayName, boolean recoverable) {
        this.displayName = displayName;
        this.recoverable = recoverable;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
