package com.tradingcards.model;

public enum PredictionType {
    PRICE_UP(PriceMetric.PRICE),
    PRICE_DOWN(PriceMetric.PRICE),
    PRICE_ABOVE(PriceMetric.PRICE),
    PRICE_BELOW(PriceMetric.PRICE),
    MARKET_CAP_ABOVE(PriceMetric.MARKET_CAP),
    VOLUME_ABOVE(PriceMetric.VOLUME),
    PERCENTAGE_CHANGE(PriceMetric.PRICE);

    private final PriceMetric metric;

    PredictionType(PriceMetric metric) {
        this.metric = metric;
    }

    public PriceMetric metric() {
        return metric;
    }

    public boolean hasTarget() {
        return switch (this) {
            case PRICE_ABOVE, PRICE_BELOW, MARKET_CAP_ABOVE, VOLUME_ABOVE -> true;
            default -> false;
        };
    }
}
