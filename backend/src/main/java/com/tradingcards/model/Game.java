package com.tradingcards.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one game. Every write replaces the whole snapshot in the registry.
 * Choice and resolution deadlines stay {@code null} until the game starts.
 */
public record Game(
        long id,
        GamePhase phase,
        Instant createdAt,
        Instant lobbyDeadline,
        Instant choiceDeadline,
        Instant resolutionDeadline,
        List<String> players,
        List<Integer> cards,
        RandomnessMode randomnessMode,
        String randomnessProvenance,
        Map<Integer, PredictionResult> predictionResults,
        Instant endedAt
) {
    public Game {
        players = List.copyOf(players);
        cards = List.copyOf(cards);
        predictionResults = Map.copyOf(predictionResults);
    }

    public static Game open(long id, String creator, Instant createdAt, Instant lobbyDeadline) {
        return new Game(id, GamePhase.LOBBY, createdAt, lobbyDeadline, null, null,
                List.of(creator), List.of(), null, null, Map.of(), null);
    }

    public Game withPlayer(String player) {
        List<String> joined = new ArrayList<>(players);
        joined.add(player);
        return new Game(id, phase, createdAt, lobbyDeadline, choiceDeadline, resolutionDeadline,
                joined, cards, randomnessMode, randomnessProvenance, predictionResults, endedAt);
    }

    public Game started(List<Integer> generatedCards,
                        RandomnessMode mode,
                        String provenance,
                        Instant choiceDeadlineAt,
                        Instant resolutionDeadlineAt) {
        return new Game(id, GamePhase.CHOICE, createdAt, lobbyDeadline, choiceDeadlineAt, resolutionDeadlineAt,
                players, generatedCards, mode, provenance, predictionResults, endedAt);
    }

    public Game withPhase(GamePhase next) {
        return new Game(id, next, createdAt, lobbyDeadline, choiceDeadline, resolutionDeadline,
                players, cards, randomnessMode, randomnessProvenance, predictionResults, endedAt);
    }

    public Game withPredictionResults(Map<Integer, PredictionResult> results) {
        Map<Integer, PredictionResult> merged = new LinkedHashMap<>(predictionResults);
        merged.putAll(results);
        return new Game(id, phase, createdAt, lobbyDeadline, choiceDeadline, resolutionDeadline,
                players, cards, randomnessMode, randomnessProvenance, merged, endedAt);
    }

    public Game ended(Instant at) {
        return new Game(id, GamePhase.ENDED, createdAt, lobbyDeadline, choiceDeadline, resolutionDeadline,
                players, cards, randomnessMode, randomnessProvenance, predictionResults, at);
    }

    public boolean hasPlayer(String player) {
        return players.contains(player);
    }

    public boolean containsCard(int identifier) {
        return cards.contains(identifier);
    }

    public int playerCount() {
        return players.size();
    }

    public int cardCount() {
        return cards.size();
    }
}
