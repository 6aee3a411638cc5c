package com.tradingcards.oracle;

import com.tradingcards.model.FixedPointValue;

import java.time.Instant;

public record PriceObservation(FixedPointValue value, Instant publishTime) {
}
