package com.tradingcards.config;

import com.tradingcards.model.Asset;
import com.tradingcards.oracle.HermesPriceClient;
import com.tradingcards.oracle.PriceUpdate;
import com.tradingcards.service.CardCatalog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
public class PriceOracleHealthIndicator implements HealthIndicator {

    private final HermesPriceClient hermesPriceClient;
    private final CardCatalog cardCatalog;
    private final TradingCardsProperties tradingCardsProperties;
    private final Clock clock;

    public PriceOracleHealthIndicator(HermesPriceClient hermesPriceClient,
                                      CardCatalog cardCatalog,
                                      TradingCardsProperties tradingCardsProperties,
                                      Clock clock) {
        this.hermesPriceClient = hermesPriceClient;
        this.cardCatalog = cardCatalog;
        this.tradingCardsProperties = tradingCardsProperties;
        this.clock = clock;
    }

    @Override
    public Health health() {
        TradingCardsProperties.Oracle oracle = tradingCardsProperties.getOracle();
        if (!hermesPriceClient.isConfigured()) {
            return Health.unknown()
                    .withDetail("hermesConfigured", false)
                    .withDetail("updateFeeWei", oracle.getUpdateFeeWei())
                    .build();
        }

        Asset probe = cardCatalog.assetAt(0);
        try {
            List<PriceUpdate> updates = hermesPriceClient.fetchLatest(List.of(probe.priceFeedId()));
            if (updates.isEmpty()) {
                return Health.down()
                        .withDetail("hermesConfigured", true)
                        .withDetail("probeAsset", probe.symbol())
                        .withDetail("reason", "no price returned")
                        .build();
            }

            Instant publishTime = Instant.ofEpochSecond(updates.get(0).price().publishTime());
            Duration age = Duration.between(publishTime, clock.instant());
            Health.Builder builder = age.compareTo(oracle.getMaxPriceAge()) <= 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("hermesConfigured", true)
                    .withDetail("probeAsset", probe.symbol())
                    .withDetail("latestPublishTime", publishTime.toString())
                    .withDetail("priceAgeSeconds", age.getSeconds())
                    .withDetail("maxPriceAgeSeconds", oracle.getMaxPriceAge().getSeconds())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("hermesConfigured", true)
                    .withDetail("probeAsset", probe.symbol())
                    .withException(e)
                    .build();
        }
    }
}
