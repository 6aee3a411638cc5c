package com.tradingcards.oracle;

import com.tradingcards.config.TradingCardsProperties;
import com.tradingcards.model.FixedPointValue;
import com.tradingcards.service.CardCatalog;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates Pyth-style price updates against the card catalog.
 * Signature verification of the signed update payloads is the settlement chain's job; this adapter
 * enforces the fee, feed whitelist, and publish-time windows.
 */
@Component
@RequiredArgsConstructor
public class PythPriceOracle implements PriceOracle {

    private static final Logger log = LoggerFactory.getLogger(PythPriceOracle.class);
    private static final int MAX_ABS_EXPONENT = 30;

    private final TradingCardsProperties tradingCardsProperties;
    private final CardCatalog cardCatalog;

    @Override
    public BigInteger getUpdateFee(PriceEvidence evidence) {
        BigInteger perUpdate = tradingCardsProperties.getOracle().getUpdateFeeWei();
        return perUpdate.multiply(BigInteger.valueOf(evidence.updates().size()));
    }

    @Override
    public VerifiedPrices verify(PriceEvidence evidence, Set<FeedKey> required, Instant openingAt, Instant now) {
        BigInteger fee = getUpdateFee(evidence);
        if (evidence.fee().compareTo(fee) < 0) {
            throw PriceEvidenceException.insufficientFee(
                    "Update fee is " + fee + " wei, caller provided " + evidence.fee());
        }

        Map<FeedKey, List<PriceObservation>> observationsByFeed = new HashMap<>();
        for (PriceUpdate update : evidence.updates()) {
            PriceObservation observation = toObservation(update, now);
            observationsByFeed
                    .computeIfAbsent(new FeedKey(update.id(), update.metric()), key -> new ArrayList<>())
                    .add(observation);
        }

        Duration maxAge = tradingCardsProperties.getOracle().getMaxPriceAge();
        Map<FeedKey, VerifiedPrices.Window> windows = new HashMap<>();
        for (FeedKey key : required) {
            List<PriceObservation> observations = observationsByFeed.getOrDefault(key, List.of());
            if (observations.isEmpty()) {
                throw PriceEvidenceException.missingPrice("Evidence has no update for " + key);
            }

            PriceObservation opening = observations.stream()
                    .filter(o -> !o.publishTime().isBefore(openingAt.minus(maxAge))
                            && !o.publishTime().isAfter(openingAt.plus(maxAge)))
                    .min(Comparator
                            .comparing((PriceObservation o) -> Duration.between(o.publishTime(), openingAt).abs())
                            .thenComparing(PriceObservation::publishTime))
                    .orElseThrow(() -> PriceEvidenceException.missingPrice(
                            "Evidence has no update for " + key + " within " + maxAge + " of " + openingAt));

            PriceObservation closing = observations.stream()
                    .max(Comparator.comparing(PriceObservation::publishTime))
                    .orElseThrow();
            if (closing.publishTime().isBefore(now.minus(maxAge))) {
                throw PriceEvidenceException.stalePrice(
                        "Latest update for " + key + " was published at " + closing.publishTime()
                                + ", older than " + maxAge);
            }

            windows.put(key, new VerifiedPrices.Window(opening, closing));
        }

        log.debug("Verified {} price windows from {} updates", windows.size(), evidence.updates().size());
        return new VerifiedPrices(windows);
    }

    private PriceObservation toObservation(PriceUpdate update, Instant now) {
        if (!StringUtils.hasText(update.id())) {
            throw PriceEvidenceException.invalidUpdate("Price update without feed id");
        }
        if (cardCatalog.findByPriceFeedId(update.id()).isEmpty()) {
            throw PriceEvidenceException.unrecognizedFeed("Feed " + update.id() + " is not in the asset catalog");
        }

        PriceUpdate.Price price = update.price();
        if (price == null || price.price() == null) {
            throw PriceEvidenceException.invalidUpdate("Price update for " + update.id() + " has no price");
        }
        if (price.expo() < -MAX_ABS_EXPONENT || price.expo() > MAX_ABS_EXPONENT) {
            throw PriceEvidenceException.invalidUpdate(
                    "Price update for " + update.id() + " has out-of-range exponent " + price.expo());
        }
        // range-check the raw seconds so Instant.ofEpochSecond cannot overflow
        if (price.publishTime() <= 0 || price.publishTime() > now.getEpochSecond()) {
            throw PriceEvidenceException.invalidUpdate(
                    "Price update for " + update.id() + " has invalid publish time " + price.publishTime());
        }

        return new PriceObservation(new FixedPointValue(price.price(), price.expo()),
                Instant.ofEpochSecond(price.publishTime()));
    }
}
