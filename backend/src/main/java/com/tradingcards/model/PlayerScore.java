package com.tradingcards.model;

public record PlayerScore(
        long totalPoints,
        long gamesPlayed,
        long gamesWon
) {
    public static final PlayerScore ZERO = new PlayerScore(0, 0, 0);

    public PlayerScore plus(long points, boolean won) {
        return new PlayerScore(totalPoints + points, gamesPlayed + 1, won ? gamesWon + 1 : gamesWon);
    }
}
