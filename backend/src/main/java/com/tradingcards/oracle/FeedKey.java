package com.tradingcards.oracle;

import com.tradingcards.model.PriceMetric;
import com.tradingcards.service.CardCatalog;

public record FeedKey(String feedId, PriceMetric metric) {

    public FeedKey {
        feedId = CardCatalog.normalizeFeedId(feedId);
    }

    @Override
    public String toString() {
        return feedId + "/" + metric.name().toLowerCase();
    }
}
