package com.tradingcards.service;

import com.tradingcards.config.TradingCardsProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GameKeeperScheduler {

    private static final Logger log = LoggerFactory.getLogger(GameKeeperScheduler.class);

    private final TradingCardsProperties tradingCardsProperties;
    private final GameKeeperService gameKeeperService;

    @Scheduled(
            fixedRateString = "${tradingcards.keeper.poll-interval-ms:5000}",
            initialDelayString = "${tradingcards.keeper.initial-delay-ms:5000}"
    )
    public void processKeeperTick() {
        if (!tradingCardsProperties.getKeeper().isEnabled()) {
            return;
        }

        GameKeeperService.TickSummary tickSummary = gameKeeperService.processTick();
        if (tickSummary.hasWork()) {
            log.info(
                    "Keeper tick: gamesStarted={}, choicesClosed={}, gamesResolved={}, gamesEnded={}, failures={}",
                    tickSummary.gamesStarted(),
                    tickSummary.choicesClosed(),
                    tickSummary.gamesResolved(),
                    tickSummary.gamesEnded(),
                    tickSummary.failures()
            );
        } else {
            log.debug("Keeper tick completed with no state changes");
        }
    }
}
