package com.tictac.server;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class TicTacToeGame<P> implements GameEngine<P> {
    private static final int SIZE = 3;
    private static final int CELLS = SIZE * SIZE;
    private static final int[][] LINES = {
            {0, 1, 2}, {3, 4, 5}, {6, 7, 8},
            {0, 3, 6}, {1, 4, 7}, {2, 5, 8},
            {0, 4, 8}, {2, 4, 6}
    };

    private final Mark[] board = new Mark[CELLS];
    private final List<P> players;
    private final Map<P, Mark> marks = new LinkedHashMap<>();
    private int currentPlayerIndex = 0;
    private int moveCount = 0;
    private boolean finished;
    private boolean draw;
    private Mark winner;

    public TicTacToeGame(P first, P second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.equals(second)) {
            throw new IllegalArgumentException("Tic-tac-toe requires two distinct players");
        }
        this.players = List.of(first, second);
        marks.put(first, Mark.X);
        marks.put(second, Mark.O);
    }

    /**
     * Turn owner. Once the game is finished this stays on the player who made the
     * last move.
     */
    @Override
    public synchronized P getCurrentPlayer() {
        return players.get(currentPlayerIndex);
    }

    @Override
    public synchronized Mark getMark(P player) {
        Mark mark = marks.get(player);
        if (mark == null) {
            throw new GameRuleException(RuleViolation.PLAYER_NOT_RECOGNIZED, "Unknown player " + player);
        }
        return mark;
    }

    @Override
    public List<P> getPlayerOrder() {
        return players;
    }

    @Override
    public synchronized void makeMove(P player, String move) {
        Mark mark = getMark(player);
        if (finished) {
            throw new GameRuleException(RuleViolation.GAME_OVER, "Game already finished");
        }
        if (!player.equals(players.get(currentPlayerIndex))) {
            throw new GameRuleException(RuleViolation.NOT_YOUR_TURN, "Not your turn");
        }
        int cell = parseCell(move);
        if (board[cell] != null) {
            throw new GameRuleException(RuleViolation.CELL_OCCUPIED, "Cell " + cell + " is already occupied");
        }
        board[cell] = mark;
        moveCount++;
        if (hasLine(mark)) {
            winner = mark;
            finished = true;
            return;
        }
        if (moveCount >= CELLS) {
            draw = true;
            finished = true;
            return;
        }
        currentPlayerIndex = (currentPlayerIndex + 1) % players.size();
    }

    @Override
    public synchronized String renderBoard() {
        List<String> rows = new ArrayList<>(SIZE);
        for (int row = 0; row < SIZE; row++) {
            StringBuilder sb = new StringBuilder();
            for (int col = 0; col < SIZE; col++) {
                int cell = row * SIZE + col;
                if (col > 0) {
                    sb.append('|');
                }
                sb.append(' ').append(board[cell] != null ? board[cell].name() : String.valueOf(cell)).append(' ');
            }
            rows.add(sb.toString());
        }
        return String.join("\n---+---+---\n", rows);
    }

    @Override
    public synchronized boolean isFinished() {
        return finished;
    }

    @Override
    public synchronized boolean isDraw() {
        return draw;
    }

    @Override
    public synchronized Mark getWinner() {
        return winner;
    }

    public synchronized Mark getCell(int cell) {
        if (cell < 0 || cell >= CELLS) {
            throw new IndexOutOfBoundsException("Cell " + cell);
        }
        return board[cell];
    }

    public synchronized int getMoveCount() {
        return moveCount;
    }

    private int parseCell(String move) {
        if (move == null || move.isBlank() || !move.trim().chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
            throw new GameRuleException(RuleViolation.INVALID_MOVE, "Move must be a number, got '" + move + "'");
        }
        int cell;
        try {
            cell = Integer.parseInt(move.trim());
        } catch (NumberFormatException e) {
            cell = -1;
        }
        if (cell < 0 || cell >= CELLS) {
            throw new GameRuleException(RuleViolation.OUT_OF_RANGE, "Move must be between 0 and " + (CELLS - 1));
        }
        return cell;
    }

    private boolean hasLine(Mark mark) {
        for (int[] line : LINES) {
            if (board[line[0]] == mark && board[line[1]] == mark && board[line[2]] == mark) {
                return true;
            }
        }
        return false;
    }
}
