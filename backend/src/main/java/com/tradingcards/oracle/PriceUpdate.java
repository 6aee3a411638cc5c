package com.tradingcards.oracle;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradingcards.model.PriceMetric;

import java.math.BigInteger;

/**
 * One observation in Hermes "parsed" layout, tagged with the metric it reports.
 */
public record PriceUpdate(
        String id,
        PriceMetric metric,
        Price price
) {
    public PriceUpdate {
        metric = metric == null ? PriceMetric.PRICE : metric;
    }

    public record Price(
            BigInteger price,
            BigInteger conf,
            int expo,
            @JsonProperty("publish_time") long publishTime
    ) {
    }
}
