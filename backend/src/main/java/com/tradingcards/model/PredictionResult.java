package com.tradingcards.model;

public record PredictionResult(
        int cardIdentifier,
        boolean resolved,
        boolean correct,
        int pointsEarned
) {
    public static PredictionResult unresolved(int cardIdentifier) {
        return new PredictionResult(cardIdentifier, false, false, 0);
    }

    public static PredictionResult of(int cardIdentifier, boolean correct, int points) {
        return new PredictionResult(cardIdentifier, true, correct, correct ? points : 0);
    }
}
