package com.tradingcards.oracle;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Set;

/**
 * Pull-based price oracle adapter: callers fetch price updates out of band and submit them with
 * the resolve call, paying the fee this adapter reports.
 */
public interface PriceOracle {

    BigInteger getUpdateFee(PriceEvidence evidence);

    /**
     * Checks the fee and every update, then selects for each required feed the observation closest to
     * {@code openingAt} and the latest observation, which must be fresh relative to {@code now}.
     *
     * @throws PriceEvidenceException when the evidence cannot be used
     */
    VerifiedPrices verify(PriceEvidence evidence, Set<FeedKey> required, Instant openingAt, Instant now);
}
