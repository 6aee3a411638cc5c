package com.tradingcards.repository;

import com.tradingcards.model.PlayerScore;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cumulative per-player counters. Additive only.
 */
@Repository
public class ScoreBook {

    private final Map<String, PlayerScore> scores = new ConcurrentHashMap<>();

    public PlayerScore credit(String player, long points, boolean won) {
        if (points < 0) {
            throw new IllegalArgumentException("points must be non-negative");
        }
        return scores.merge(player, PlayerScore.ZERO.plus(points, won),
                (current, ignored) -> current.plus(points, won));
    }

    public PlayerScore find(String player) {
        return scores.getOrDefault(player, PlayerScore.ZERO);
    }
}
