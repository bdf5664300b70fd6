package com.tictac.server;

import java.util.List;

/**
 * Rules and board state for one pairing. Players are identified by whatever handle
 * the caller uses for them; the server passes its {@link Connection}s.
 *
 * @param <P> player handle type
 */
public interface GameEngine<P> {

    P getCurrentPlayer();

    Mark getMark(P player);

    List<P> getPlayerOrder();

    String renderBoard();

    /**
     * Applies {@code move} for {@code player}.
     *
     * @throws GameRuleException when the move is rejected; state is left untouched
     */
    void makeMove(P player, String move);

    boolean isFinished();

    boolean isDraw();

    /**
     * @return the winning mark, or {@code null} while in progress or after a draw
     */
    Mark getWinner();
}
