package com.tradingcards.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Quantity observed on an asset feed. Market cap and volume arrive as already-derived observations.
 */
public enum PriceMetric {
    @JsonProperty("price")
    PRICE,
    @JsonProperty("market_cap")
    MARKET_CAP,
    @JsonProperty("volume")
    VOLUME
}
