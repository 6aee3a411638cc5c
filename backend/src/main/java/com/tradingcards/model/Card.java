package com.tradingcards.model;

/**
 * Prediction card decoded from its identifier.
 * Threshold types carry {@code targetBps}; PERCENTAGE_CHANGE carries {@code percentageChangeBps} and a direction.
 */
public record Card(
        int identifier,
        Asset asset,
        PredictionType predictionType,
        Integer targetBps,
        Integer percentageChangeBps,
        Direction direction
) {
}
