package com.tradingcards.service;

import com.tradingcards.config.TradingCardsProperties;
import com.tradingcards.model.Game;
import com.tradingcards.model.GamePhase;
import com.tradingcards.model.PlayerChoice;
import com.tradingcards.model.PriceMetric;
import com.tradingcards.oracle.FeedKey;
import com.tradingcards.oracle.HermesPriceClient;
import com.tradingcards.oracle.PriceEvidence;
import com.tradingcards.oracle.PriceEvidenceException;
import com.tradingcards.oracle.PriceOracle;
import com.tradingcards.oracle.PriceUpdate;
import com.tradingcards.repository.GameRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Calls the public advance operations for games whose deadlines have passed.
 * The keeper holds no privileges; anything it does a player could do with the same calls.
 * A failure on one game is logged and never blocks the others.
 */
@Service
@RequiredArgsConstructor
public class GameKeeperService {

    private static final Logger log = LoggerFactory.getLogger(GameKeeperService.class);

    private final GameRegistry gameRegistry;
    private final PhaseScheduler phaseScheduler;
    private final ChoiceLedger choiceLedger;
    private final ResolutionEngine resolutionEngine;
    private final PriceOracle priceOracle;
    private final HermesPriceClient hermesPriceClient;
    private final TradingCardsProperties tradingCardsProperties;
    private final Clock clock;

    public TickSummary processTick() {
        Instant now = clock.instant();
        int gamesStarted = 0;
        int choicesClosed = 0;
        int gamesResolved = 0;
        int gamesEnded = 0;
        int failures = 0;

        for (Game game : gameRegistry.findByPhaseIn(EnumSet.of(GamePhase.LOBBY, GamePhase.CHOICE, GamePhase.RESOLUTION))) {
            try {
                switch (game.phase()) {
                    case LOBBY -> {
                        if (!now.isBefore(game.lobbyDeadline())
                                && phaseScheduler.startGame(game.id(), tradingCardsProperties.getKeeper().isSecureRandomness()).applied()) {
                            gamesStarted++;
                        }
                    }
                    case CHOICE -> {
                        if (!now.isBefore(game.choiceDeadline()) && phaseScheduler.advanceToResolution(game.id()).applied()) {
                            choicesClosed++;
                        }
                    }
                    case RESOLUTION -> {
                        if (now.isBefore(game.resolutionDeadline())) {
                            break;
                        }
                        if (tryResolve(game)) {
                            gamesResolved++;
                        } else if (graceExpired(game, now) && phaseScheduler.endGame(game.id()).applied()) {
                            log.warn("Game {} ended without price evidence after grace period", game.id());
                            gamesEnded++;
                        }
                    }
                    default -> {
                    }
                }
            } catch (RuntimeException e) {
                failures++;
                log.error("Keeper failed to advance game {} in phase {}", game.id(), game.phase(), e);
            }
        }

        return new TickSummary(gamesStarted, choicesClosed, gamesResolved, gamesEnded, failures);
    }

    private boolean tryResolve(Game game) {
        if (!tradingCardsProperties.getKeeper().isAutoResolve() || !hermesPriceClient.isConfigured()) {
            return false;
        }

        List<PlayerChoice> committed = choiceLedger.findCommitted(game);
        Set<FeedKey> required = resolutionEngine.requiredFeeds(committed);
        if (required.stream().anyMatch(feed -> feed.metric() != PriceMetric.PRICE)) {
            log.debug("Game {} needs market-cap or volume evidence, leaving it for a caller", game.id());
            return false;
        }

        List<String> feedIds = required.stream().map(FeedKey::feedId).distinct().toList();
        List<PriceUpdate> updates = new ArrayList<>();
        if (!feedIds.isEmpty()) {
            updates.addAll(hermesPriceClient.fetchAt(game.choiceDeadline(), feedIds));
            updates.addAll(hermesPriceClient.fetchLatest(feedIds));
        }

        PriceEvidence unpaid = new PriceEvidence(updates, BigInteger.ZERO);
        PriceEvidence evidence = new PriceEvidence(updates, priceOracle.getUpdateFee(unpaid));
        try {
            return phaseScheduler.resolveAndEnd(game.id(), evidence).applied();
        } catch (PriceEvidenceException e) {
            log.info("Keeper could not resolve game {} yet: {}", game.id(), e.getCode());
            return false;
        }
    }

    private boolean graceExpired(Game game, Instant now) {
        Instant cutoff = game.resolutionDeadline().plus(tradingCardsProperties.getKeeper().getEndWithoutEvidenceAfter());
        return !now.isBefore(cutoff);
    }

    public record TickSummary(
            int gamesStarted,
            int choicesClosed,
            int gamesResolved,
            int gamesEnded,
            int failures
    ) {
        public boolean hasWork() {
            return gamesStarted > 0 || choicesClosed > 0 || gamesResolved > 0 || gamesEnded > 0 || failures > 0;
        }
    }
}
