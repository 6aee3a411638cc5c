package com.tradingcards.model;

/**
 * Raw lookup-table indices extracted from a card identifier.
 */
public record CardAttributes(
        int assetIndex,
        int predictionTypeIndex,
        int directionIndex,
        int targetIndex
) {
}
