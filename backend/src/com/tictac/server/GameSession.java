package com.tictac.server;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Drives one paired game from the greeting to the final notice and closes both
 * connections on the way out, whatever ended the game.
 */
public class GameSession implements Runnable {
    private static final Logger LOGGER = Logger.getLogger(GameSession.class.getName());
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public enum State {
        STARTING,
        AWAITING_MOVE,
        TERMINATED
    }

    private final String id = UUID.randomUUID().toString();
    private final Connection p1;
    private final Connection p2;
    private final GameEngine<Connection> game;
    private final Transport transport;
    private final Duration moveTimeout;
    private volatile State state = State.STARTING;
    // false after a rejected message: the board did not change, so only the prompt is repeated
    private boolean boardChanged = true;

    public GameSession(Connection p1, Connection p2, Transport transport, Duration moveTimeout) {
        this(p1, p2, new TicTacToeGame<>(p1, p2), transport, moveTimeout);
    }

    GameSession(Connection p1, Connection p2, GameEngine<Connection> game, Transport transport, Duration moveTimeout) {
        this.p1 = p1;
        this.p2 = p2;
        this.game = game;
        this.transport = transport;
        this.moveTimeout = moveTimeout;
    }

    public String getId() {
        return id;
    }

    public State getState() {
        return state;
    }

    @Override
    public void run() {
        LOGGER.info(() -> String.format("Session %s started: %s vs %s", id, p1.getEndpoint(), p2.getEndpoint()));
        try {
            if (greet()) {
                state = State.AWAITING_MOVE;
                playUntilFinished();
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Unexpected failure in session " + id, e);
        } finally {
            state = State.TERMINATED;
            Transport.closeQuietly(p1);
            Transport.closeQuietly(p2);
            LOGGER.info(() -> String.format("Session %s ended", id));
        }
    }

    private boolean greet() {
        try {
            send(p1, Protocol.gameStart(game.getMark(p1)));
            send(p2, Protocol.gameStart(game.getMark(p2)));
            return true;
        } catch (PlayerFailureException e) {
            LOGGER.info(() -> String.format("Session %s: player disconnected during start: %s", id, e.getMessage()));
            return false;
        }
    }

    private void playUntilFinished() {
        boolean running = true;
        while (running) {
            try {
                running = playTurn();
            } catch (PlayerFailureException e) {
                running = handlePlayerFailure(e);
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Unexpected server error in session " + id, e);
                sendQuietly(p1, Protocol.serverError(e.getMessage()));
                sendQuietly(p2, Protocol.serverError(e.getMessage()));
                running = false;
            }
        }
    }

    /**
     * One request/response round with the turn owner.
     *
     * @return whether the game goes on
     */
    private boolean playTurn() {
        if (boardChanged) {
            broadcast(game.renderBoard());
        }
        boardChanged = true;

        Connection current = game.getCurrentPlayer();
        Connection other = opponentOf(current);
        send(current, Protocol.YOUR_MOVE);
        send(other, Protocol.WAITING_FOR_OPPONENT);

        String reply = transport.receive(current, moveTimeout);
        Optional<String> move = parseMove(current, reply);
        if (move.isEmpty()) {
            send(current, Protocol.invalidFormat(reply));
            boardChanged = false;
            return true;
        }

        try {
            game.makeMove(current, move.get());
        } catch (GameRuleException e) {
            return handleRejectedMove(current, e);
        }

        broadcast(game.renderBoard());
        if (game.isFinished()) {
            announceResult();
            return false;
        }
        return true;
    }

    private Optional<String> parseMove(Connection current, String reply) {
        if (Protocol.QUIT_COMMAND.equalsIgnoreCase(reply)) {
            throw PlayerFailureException.quit(current.getEndpoint());
        }
        String[] parts = WHITESPACE.split(reply);
        if (Protocol.MOVE_COMMAND.equalsIgnoreCase(parts[0])) {
            if (parts.length != 2 || !DIGITS.matcher(parts[1]).matches()) {
                throw PlayerFailureException.invalidMessage(current.getEndpoint(), "Malformed MOVE: " + reply);
            }
            return Optional.of(parts[1]);
        }
        if (DIGITS.matcher(reply).matches()) {
            return Optional.of(reply);
        }
        return Optional.empty();
    }

    private boolean handleRejectedMove(Connection current, GameRuleException e) {
        switch (e.getViolation()) {
            case PLAYER_NOT_RECOGNIZED -> {
                LOGGER.severe(() -> String.format("Session %s: engine rejected player %s: %s",
                        id, current.getEndpoint(), e.getMessage()));
                send(current, Protocol.playerNotRecognized(e.getMessage()));
                return false;
            }
            case GAME_OVER -> {
                String board = game.renderBoard();
                for (Connection player : new Connection[]{p1, p2}) {
                    sendQuietly(player, board);
                    sendQuietly(player, Protocol.gameOver(e.getMessage()));
                }
                return false;
            }
            default -> {
                send(current, Protocol.error(e.getViolation(), e.getMessage()));
                boardChanged = false;
                return true;
            }
        }
    }

    private void announceResult() {
        if (game.isDraw()) {
            LOGGER.info(() -> String.format("Session %s finished in a draw", id));
            sendQuietly(p1, Protocol.DRAW);
            sendQuietly(p2, Protocol.DRAW);
            return;
        }
        Mark winner = game.getWinner();
        LOGGER.info(() -> String.format("Session %s won by %s", id, winner));
        for (Connection player : new Connection[]{p1, p2}) {
            sendQuietly(player, game.getMark(player) == winner ? Protocol.WIN : Protocol.LOSE);
        }
    }

    private boolean handlePlayerFailure(PlayerFailureException e) {
        if (!e.getKind().isTerminal()) {
            LOGGER.info(() -> String.format("Session %s: %s", id, e.getMessage()));
            sendQuietly(game.getCurrentPlayer(), Protocol.invalidMessage(e.getMessage()));
            boardChanged = false;
            return true;
        }
        LOGGER.info(() -> String.format("Session %s: %s (%s)", id, e.getKind(), e.getMessage()));
        Connection survivor = p1.getEndpoint().equals(e.getEndpoint()) ? p2 : p1;
        sendQuietly(survivor, Protocol.opponentNotice(e.getKind()));
        return false;
    }

    private Connection opponentOf(Connection player) {
        return player == p1 ? p2 : p1;
    }

    private void broadcast(String message) {
        send(p1, message);
        send(p2, message);
    }

    private void send(Connection connection, String message) {
        transport.send(connection, Protocol.line(message));
    }

    private void sendQuietly(Connection connection, String message) {
        try {
            send(connection, message);
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "Dropped message to " + connection.getEndpoint() + " in session " + id, e);
        }
    }
}
