package com.tradingcards.service;

import com.tradingcards.model.Game;
import com.tradingcards.model.GamePhase;

/**
 * Outcome of an advance operation. {@code applied == false} means the precondition did not hold
 * and nothing changed; the game is reported in whatever phase it is in.
 */
public record TransitionResult(
        long gameId,
        boolean applied,
        GamePhase phase,
        String detail
) {
    public static TransitionResult applied(Game game, String detail) {
        return new TransitionResult(game.id(), true, game.phase(), detail);
    }

    public static TransitionResult notApplied(Game game, String reason) {
        return new TransitionResult(game.id(), false, game.phase(), reason);
    }
}
