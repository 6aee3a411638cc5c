package com.tradingcards.config;

import com.tradingcards.model.PriceMetric;
import com.tradingcards.oracle.HermesPriceClient;
import com.tradingcards.oracle.PriceUpdate;
import com.tradingcards.service.CardCatalog;
import com.tradingcards.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.web.client.ResourceAccessException;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PriceOracleHealthIndicatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private HermesPriceClient hermesPriceClient;

    private PriceOracleHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new PriceOracleHealthIndicator(
                hermesPriceClient, CardCatalog.defaults(), new TradingCardsProperties(), new MutableClock(NOW));
    }

    @Test
    void unconfiguredHermesReportsUnknown() {
        when(hermesPriceClient.isConfigured()).thenReturn(false);

        Health health = indicator.health();

        assertEquals(Status.UNKNOWN, health.getStatus());
        assertEquals(false, health.getDetails().get("hermesConfigured"));
    }

    @Test
    void freshPriceReportsUp() {
        when(hermesPriceClient.isConfigured()).thenReturn(true);
        when(hermesPriceClient.fetchLatest(anyCollection())).thenReturn(List.of(update(NOW.minusSeconds(5))));

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("BTC", health.getDetails().get("probeAsset"));
        assertEquals(5L, health.getDetails().get("priceAgeSeconds"));
    }

    @Test
    void stalePriceReportsDown() {
        when(hermesPriceClient.isConfigured()).thenReturn(true);
        when(hermesPriceClient.fetchLatest(anyCollection())).thenReturn(List.of(update(NOW.minusSeconds(300))));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    void unreachableHermesReportsDown() {
        when(hermesPriceClient.isConfigured()).thenReturn(true);
        when(hermesPriceClient.fetchLatest(anyCollection())).thenThrow(new ResourceAccessException("timeout"));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    private static PriceUpdate update(Instant publishTime) {
        return new PriceUpdate(CardCatalog.defaults().assetAt(0).priceFeedId(), PriceMetric.PRICE,
                new PriceUpdate.Price(BigInteger.TEN, BigInteger.ONE, 0, publishTime.getEpochSecond()));
    }
}
