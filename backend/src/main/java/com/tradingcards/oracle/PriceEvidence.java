package com.tradingcards.oracle;

import java.math.BigInteger;
import java.util.List;

/**
 * Caller-supplied price data for one resolution, plus the fee the caller provisioned for it.
 * The engine never looks inside; only a {@link PriceOracle} interprets it.
 */
public record PriceEvidence(
        List<PriceUpdate> updates,
        BigInteger fee
) {
    public PriceEvidence {
        updates = updates == null ? List.of() : List.copyOf(updates);
        fee = fee == null ? BigInteger.ZERO : fee;
    }
}
