package com.tradingcards.service.randomness;

import com.tradingcards.model.RandomnessMode;

/**
 * Supplies card identifiers for a game's card set.
 */
public interface RandomnessSource {

    /**
     * Draws exactly {@code count} identifiers, each independently within the card identifier range.
     * Repeats across positions are allowed.
     *
     * @throws RandomnessUnavailableException when the source cannot produce a draw
     */
    RandomDraw draw(long gameId, int count);

    RandomnessMode mode();
}
