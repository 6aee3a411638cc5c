package com.tradingcards.oracle;

import com.tradingcards.config.TradingCardsProperties;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HermesPriceClientTest {

    @Test
    void blankUrlDisablesFetching() {
        HermesPriceClient client = new HermesPriceClient(new TradingCardsProperties(), RestClient.builder());

        assertFalse(client.isConfigured());
        assertThrows(IllegalStateException.class, () -> client.fetchLatest(List.of("0xaa")));
    }

    @Test
    void emptyFeedListNeedsNoRequest() {
        TradingCardsProperties properties = new TradingCardsProperties();
        properties.getOracle().setHermesUrl("https://hermes.example.invalid");
        HermesPriceClient client = new HermesPriceClient(properties, RestClient.builder());

        assertTrue(client.isConfigured());
        assertTrue(client.fetchLatest(List.of()).isEmpty());
    }
}
