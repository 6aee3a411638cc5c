package com.tradingcards.model;

/**
 * Tradable asset a card can reference, bound to its oracle price feed.
 */
public record Asset(
        String symbol,
        String name,
        AssetType type,
        String priceFeedId
) {
}
