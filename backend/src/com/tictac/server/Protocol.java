package com.tictac.server;

/**
 * Server-to-client wire messages. Every message goes out newline-terminated.
 */
public final class Protocol {
    public static final String WELCOME = "Welcome! Waiting for opponent...";
    public static final String YOUR_MOVE = "Your move (0-8) or QUIT:";
    public static final String WAITING_FOR_OPPONENT = "Waiting for opponent...";
    public static final String DRAW = "Game over! It's a draw.";
    public static final String WIN = "You win!";
    public static final String LOSE = "You lose!";
    public static final String OPPONENT_TIMEOUT = "OPPONENT_TIMEOUT - you win";
    public static final String OPPONENT_QUIT = "OPPONENT_QUIT - you win";
    public static final String OPPONENT_DISCONNECTED = "OPPONENT_DISCONNECTED - you win";

    public static final String QUIT_COMMAND = "QUIT";
    public static final String MOVE_COMMAND = "MOVE";

    private Protocol() {
    }

    public static String line(String message) {
        return message + "\n";
    }

    public static String gameStart(Mark mark) {
        return "Game start! You are " + mark.name();
    }

    public static String invalidFormat(String text) {
        return "Invalid move format: " + text;
    }

    public static String error(RuleViolation violation, String detail) {
        return "ERROR: " + violation.getDisplayName() + ": " + detail;
    }

    public static String playerNotRecognized(String detail) {
        return "ERROR: Player not recognized: " + detail;
    }

    public static String invalidMessage(String detail) {
        return "INVALID_MESSAGE: " + detail;
    }

    public static String gameOver(String detail) {
        return "GAME OVER: " + detail;
    }

    public static String serverError(String detail) {
        return "Server error: " + detail;
    }

    /**
     * Notice for the player left in the game after the opponent dropped out.
     */
    public static String opponentNotice(PlayerFailure failure) {
        return switch (failure) {
            case TIMEOUT -> OPPONENT_TIMEOUT;
            case QUIT -> OPPONENT_QUIT;
            case DISCONNECTED -> OPPONENT_DISCONNECTED;
            case INVALID_MESSAGE -> throw new IllegalArgumentException("Invalid messages do not end the game");
        };
    }
}
