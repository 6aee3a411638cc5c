package com.tradingcards.service;

import com.tradingcards.config.TradingCardsProperties;
import com.tradingcards.model.Game;
import com.tradingcards.model.GamePhase;
import com.tradingcards.model.PlayerChoice;
import com.tradingcards.model.PredictionResult;
import com.tradingcards.model.RandomnessMode;
import com.tradingcards.oracle.PriceEvidence;
import com.tradingcards.oracle.PriceEvidenceException;
import com.tradingcards.oracle.PriceOracle;
import com.tradingcards.oracle.VerifiedPrices;
import com.tradingcards.repository.GameRegistry;
import com.tradingcards.repository.ScoreBook;
import com.tradingcards.service.randomness.RandomDraw;
import com.tradingcards.service.randomness.RandomnessSource;
import com.tradingcards.service.randomness.RandomnessUnavailableException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Game state machine: LOBBY -> CHOICE -> RESOLUTION -> ENDED.
 * There is no operator. Once a deadline passes anyone may call the matching advance; the first call
 * applies the transition and every later call reports that nothing was needed.
 * All writes run inside the registry's write section and validate before they mutate.
 */
@Service
@RequiredArgsConstructor
public class PhaseScheduler {

    private static final Logger log = LoggerFactory.getLogger(PhaseScheduler.class);

    private final GameRegistry gameRegistry;
    private final ChoiceLedger choiceLedger;
    private final ScoreBook scoreBook;
    private final ResolutionEngine resolutionEngine;
    private final PriceOracle priceOracle;
    private final List<RandomnessSource> randomnessSources;
    private final TradingCardsProperties tradingCardsProperties;
    private final Clock clock;

    public long createGame(String caller) {
        String player = PlayerAddresses.normalize(caller);
        return gameRegistry.write(() -> {
            requireNoActiveGame(player);
            Instant now = clock.instant();
            long gameId = gameRegistry.allocateId();
            Game game = Game.open(gameId, player, now, now.plus(tradingCardsProperties.getGame().getLobbyDuration()));
            gameRegistry.save(game);
            gameRegistry.assignActiveGame(player, gameId);
            log.info("Game {} created by {}, lobby closes at {}", gameId, player, game.lobbyDeadline());
            return gameId;
        });
    }

    public Game joinGame(long gameId, String caller) {
        String player = PlayerAddresses.normalize(caller);
        return gameRegistry.write(() -> {
            Game game = requireGame(gameId);
            if (game.phase() != GamePhase.LOBBY) {
                throw GameRuleViolationException.wrongPhase(
                        "Game " + gameId + " is in " + game.phase() + ", players can only join in LOBBY");
            }
            if (game.hasPlayer(player)) {
                throw GameRuleViolationException.alreadyParticipant(
                        "Player " + player + " already joined game " + gameId);
            }
            requireNoActiveGame(player);

            Game joined = gameRegistry.save(game.withPlayer(player));
            gameRegistry.assignActiveGame(player, gameId);
            log.info("Player {} joined game {} ({} players)", player, gameId, joined.playerCount());
            return joined;
        });
    }

    /**
     * LOBBY -> CHOICE once the lobby deadline has passed. Generates the card set.
     *
     * @throws RandomnessUnavailableException when the selected source cannot draw; the game stays in LOBBY
     */
    public TransitionResult startGame(long gameId, boolean secureRandomness) {
        Game current = requireGame(gameId);
        Optional<String> blocker = startBlocker(current, clock.instant());
        if (blocker.isPresent()) {
            log.debug("startGame({}) not applied: {}", gameId, blocker.get());
            return TransitionResult.notApplied(current, blocker.get());
        }

        int cardSetSize = tradingCardsProperties.getGame().getCardSetSize();
        RandomDraw draw = sourceFor(secureRandomness ? RandomnessMode.SECURE : RandomnessMode.INSECURE)
                .draw(gameId, cardSetSize);
        requireValidDraw(draw, cardSetSize);

        return gameRegistry.write(() -> {
            Game game = requireGame(gameId);
            Instant now = clock.instant();
            Optional<String> reason = startBlocker(game, now);
            if (reason.isPresent()) {
                log.debug("startGame({}) lost the race: {}", gameId, reason.get());
                return TransitionResult.notApplied(game, reason.get());
            }

            TradingCardsProperties.Game rules = tradingCardsProperties.getGame();
            Instant choiceDeadline = now.plus(rules.getChoiceDuration());
            Instant resolutionDeadline = choiceDeadline.plus(rules.getResolutionDuration());
            Game started = gameRegistry.save(game.started(
                    draw.identifiers(), draw.mode(), draw.provenance(), choiceDeadline, resolutionDeadline));

            log.info("Game {} moved to CHOICE with {} cards ({} randomness, {}), choices close at {}",
                    gameId, started.cardCount(), draw.mode(), draw.provenance(), choiceDeadline);
            return TransitionResult.applied(started, "Cards generated");
        });
    }

    public PlayerChoice commitChoices(long gameId, String caller, List<Integer> selectedCards) {
        String player = PlayerAddresses.normalize(caller);
        return gameRegistry.write(() -> {
            Game game = requireGame(gameId);
            if (game.phase() != GamePhase.CHOICE) {
                throw GameRuleViolationException.wrongPhase(
                        "Game " + gameId + " is in " + game.phase() + ", choices can only be committed in CHOICE");
            }
            Instant now = clock.instant();
            if (!now.isBefore(game.choiceDeadline())) {
                throw GameRuleViolationException.deadlinePassed(
                        "Choice deadline for game " + gameId + " passed at " + game.choiceDeadline());
            }

            PlayerChoice choice = choiceLedger.commit(game, player, selectedCards, now);
            log.info("Player {} committed cards {} in game {}", player, choice.selectedCards(), gameId);
            return choice;
        });
    }

    /**
     * CHOICE -> RESOLUTION once the choice deadline has passed. Pure phase flip.
     */
    public TransitionResult advanceToResolution(long gameId) {
        return gameRegistry.write(() -> {
            Game game = requireGame(gameId);
            if (game.phase() != GamePhase.CHOICE) {
                return notApplied(game, "Game is in " + game.phase() + ", not CHOICE");
            }
            Instant now = clock.instant();
            if (now.isBefore(game.choiceDeadline())) {
                return notApplied(game, "Choice deadline not reached until " + game.choiceDeadline());
            }

            Game resolving = gameRegistry.save(game.withPhase(GamePhase.RESOLUTION));
            log.info("Game {} moved to RESOLUTION, resolvable from {}", gameId, resolving.resolutionDeadline());
            return TransitionResult.applied(resolving, "Choices closed");
        });
    }

    /**
     * Scores every committed player with the supplied evidence and ends the game.
     *
     * @throws PriceEvidenceException when the oracle rejects the evidence; the game stays in RESOLUTION
     */
    public TransitionResult resolveAndEnd(long gameId, PriceEvidence evidence) {
        Game current = requireGame(gameId);
        Instant now = clock.instant();
        Optional<String> blocker = resolutionBlocker(current, now);
        if (blocker.isPresent()) {
            log.debug("resolveAndEnd({}) not applied: {}", gameId, blocker.get());
            return TransitionResult.notApplied(current, blocker.get());
        }

        List<PlayerChoice> committed = choiceLedger.findCommitted(current);
        Map<Integer, PredictionResult> results;
        try {
            VerifiedPrices prices = priceOracle.verify(
                    evidence, resolutionEngine.requiredFeeds(committed), current.choiceDeadline(), now);
            results = resolutionEngine.resolve(current.players(), committed, prices).predictionResults();
        } catch (PriceEvidenceException e) {
            log.warn("Price evidence for game {} rejected ({}): {}", gameId, e.getCode(), e.getMessage());
            throw e;
        }

        return gameRegistry.write(() -> {
            Game game = requireGame(gameId);
            Optional<String> reason = resolutionBlocker(game, clock.instant());
            if (reason.isPresent()) {
                log.debug("resolveAndEnd({}) lost the race: {}", gameId, reason.get());
                return TransitionResult.notApplied(game, reason.get());
            }
            return TransitionResult.applied(finish(game, results), "Resolved with price evidence");
        });
    }

    /**
     * Terminal half of {@link #resolveAndEnd}: scores from whatever prediction results are already recorded.
     */
    public TransitionResult endGame(long gameId) {
        return gameRegistry.write(() -> {
            Game game = requireGame(gameId);
            Optional<String> reason = resolutionBlocker(game, clock.instant());
            if (reason.isPresent()) {
                log.debug("endGame({}) not applied: {}", gameId, reason.get());
                return TransitionResult.notApplied(game, reason.get());
            }
            return TransitionResult.applied(finish(game, Map.of()), "Ended with recorded results");
        });
    }

    private Game finish(Game game, Map<Integer, PredictionResult> newResults) {
        Game scored = game.withPredictionResults(newResults);
        List<PlayerChoice> committed = choiceLedger.findCommitted(scored);
        ResolutionEngine.ResolutionOutcome outcome =
                resolutionEngine.tally(scored.players(), committed, scored.predictionResults());

        for (PlayerChoice choice : committed) {
            long points = outcome.playerPoints().getOrDefault(choice.player(), 0L);
            scoreBook.credit(choice.player(), points, choice.player().equals(outcome.winner()));
        }
        for (String player : scored.players()) {
            gameRegistry.releaseActiveGame(player, scored.id());
        }

        Game ended = gameRegistry.save(scored.ended(clock.instant()));
        log.info("Game {} ended: points={}, winner={}", ended.id(), outcome.playerPoints(),
                outcome.winner() != null ? outcome.winner() : "none");
        return ended;
    }

    private Optional<String> startBlocker(Game game, Instant now) {
        if (game.phase() != GamePhase.LOBBY) {
            return Optional.of("Game is in " + game.phase() + ", not LOBBY");
        }
        if (now.isBefore(game.lobbyDeadline())) {
            return Optional.of("Lobby deadline not reached until " + game.lobbyDeadline());
        }
        return Optional.empty();
    }

    private Optional<String> resolutionBlocker(Game game, Instant now) {
        if (game.phase() != GamePhase.RESOLUTION) {
            return Optional.of("Game is in " + game.phase() + ", not RESOLUTION");
        }
        if (now.isBefore(game.resolutionDeadline())) {
            return Optional.of("Resolution deadline not reached until " + game.resolutionDeadline());
        }
        return Optional.empty();
    }

    private TransitionResult notApplied(Game game, String reason) {
        log.debug("Advance of game {} not applied: {}", game.id(), reason);
        return TransitionResult.notApplied(game, reason);
    }

    private RandomnessSource sourceFor(RandomnessMode mode) {
        return randomnessSources.stream()
                .filter(source -> source.mode() == mode)
                .findFirst()
                .orElseThrow(() -> new RandomnessUnavailableException("No randomness source for mode " + mode));
    }

    private static void requireValidDraw(RandomDraw draw, int expectedSize) {
        if (draw.identifiers().size() != expectedSize) {
            throw new IllegalStateException(
                    "Randomness source returned " + draw.identifiers().size() + " identifiers, expected " + expectedSize);
        }
        for (int identifier : draw.identifiers()) {
            if (!CardCodec.isValidIdentifier(identifier)) {
                throw new IllegalStateException("Randomness source returned out-of-range identifier " + identifier);
            }
        }
    }

    private Game requireGame(long gameId) {
        return gameRegistry.findById(gameId).orElseThrow(() -> GameRuleViolationException.gameNotFound(gameId));
    }

    private void requireNoActiveGame(String player) {
        gameRegistry.findActiveGameId(player).ifPresent(activeGameId -> {
            throw GameRuleViolationException.alreadyInActiveGame(
                    "Player " + player + " is already in active game " + activeGameId);
        });
    }
}
