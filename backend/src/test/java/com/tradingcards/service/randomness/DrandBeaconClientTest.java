package com.tradingcards.service.randomness;

import com.tradingcards.config.TradingCardsProperties;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.assertThrows;

class DrandBeaconClientTest {

    @Test
    void unconfiguredBeaconIsUnavailable() {
        DrandBeaconClient client = new DrandBeaconClient(new TradingCardsProperties(), RestClient.builder());

        assertThrows(RandomnessUnavailableException.class, client::latestRound);
    }
}
