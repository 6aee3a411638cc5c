package com.tradingcards.oracle;

import com.tradingcards.model.PriceMetric;

import java.util.Map;

/**
 * Opening and closing observations per feed, already checked by the oracle.
 */
public record VerifiedPrices(Map<FeedKey, Window> windows) {

    public VerifiedPrices {
        windows = Map.copyOf(windows);
    }

    public Window window(String feedId, PriceMetric metric) {
        FeedKey key = new FeedKey(feedId, metric);
        Window window = windows.get(key);
        if (window == null) {
            throw PriceEvidenceException.missingPrice("No verified observations for " + key);
        }
        return window;
    }

    /**
     * @param opening observation closest to the choice deadline
     * @param closing most recent fresh observation
     */
    public record Window(PriceObservation opening, PriceObservation closing) {
    }
}
