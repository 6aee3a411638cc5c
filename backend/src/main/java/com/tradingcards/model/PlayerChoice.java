package com.tradingcards.model;

import java.time.Instant;
import java.util.List;

public record PlayerChoice(
        long gameId,
        String player,
        List<Integer> selectedCards,
        Instant committedAt,
        boolean committed
) {
    public PlayerChoice {
        selectedCards = List.copyOf(selectedCards);
    }

    public static PlayerChoice uncommitted(long gameId, String player) {
        return new PlayerChoice(gameId, player, List.of(), null, false);
    }
}
