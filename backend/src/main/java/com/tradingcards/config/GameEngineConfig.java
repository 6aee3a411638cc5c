package com.tradingcards.config;

import com.tradingcards.service.CardCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GameEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(GameEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CardCatalog cardCatalog(CardCatalogProperties cardCatalogProperties) {
        CardCatalog catalog = CardCatalog.of(cardCatalogProperties.toAssets());
        log.info("Card catalog initialized with {} assets", catalog.assets().size());
        return catalog;
    }
}
