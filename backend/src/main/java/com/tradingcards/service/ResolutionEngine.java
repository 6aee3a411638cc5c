package com.tradingcards.service;

import com.tradingcards.config.TradingCardsProperties;
import com.tradingcards.model.Card;
import com.tradingcards.model.Direction;
import com.tradingcards.model.FixedPointValue;
import com.tradingcards.model.PlayerChoice;
import com.tradingcards.model.PredictionResult;
import com.tradingcards.model.PredictionType;
import com.tradingcards.oracle.FeedKey;
import com.tradingcards.oracle.VerifiedPrices;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores committed cards against verified price windows.
 * A card earns its full point value when its prediction holds and nothing otherwise.
 */
@Service
@RequiredArgsConstructor
public class ResolutionEngine {

    private static final long BPS_DENOMINATOR = 10_000L;

    private final TradingCardsProperties tradingCardsProperties;
    private final CardCatalog cardCatalog;

    /**
     * Feeds the oracle must cover to score the given choices.
     */
    public Set<FeedKey> requiredFeeds(Collection<PlayerChoice> choices) {
        Set<FeedKey> feeds = new LinkedHashSet<>();
        for (PlayerChoice choice : choices) {
            for (int identifier : choice.selectedCards()) {
                Card card = CardCodec.toCard(identifier, cardCatalog);
                feeds.add(new FeedKey(card.asset().priceFeedId(), card.predictionType().metric()));
            }
        }
        return feeds;
    }

    public PredictionResult evaluate(int identifier, VerifiedPrices prices) {
        Card card = CardCodec.toCard(identifier, cardCatalog);
        VerifiedPrices.Window window = prices.window(card.asset().priceFeedId(), card.predictionType().metric());
        boolean correct = isCorrect(card, window.opening().value(), window.closing().value());
        return PredictionResult.of(identifier, correct, pointsFor(card.predictionType()));
    }

    public ResolutionOutcome resolve(List<String> participants, List<PlayerChoice> committed, VerifiedPrices prices) {
        Map<Integer, PredictionResult> results = new LinkedHashMap<>();
        for (PlayerChoice choice : committed) {
            for (int identifier : choice.selectedCards()) {
                results.computeIfAbsent(identifier, id -> evaluate(id, prices));
            }
        }
        return tally(participants, committed, results);
    }

    /**
     * Sums recorded per-card results for each committed player. Cards without a recorded result score zero.
     * The winner is picked across all participants; those who never committed stand on zero.
     */
    public ResolutionOutcome tally(List<String> participants, List<PlayerChoice> committed,
                                   Map<Integer, PredictionResult> results) {
        Map<String, Long> playerPoints = new LinkedHashMap<>();
        for (PlayerChoice choice : committed) {
            long total = 0;
            for (int identifier : choice.selectedCards()) {
                PredictionResult result = results.get(identifier);
                if (result != null) {
                    total += result.pointsEarned();
                }
            }
            playerPoints.put(choice.player(), total);
        }

        Map<String, Long> standings = new LinkedHashMap<>();
        for (String participant : participants) {
            standings.put(participant, 0L);
        }
        standings.putAll(playerPoints);
        return new ResolutionOutcome(results, playerPoints, winnerOf(standings));
    }

    public int pointsFor(PredictionType type) {
        TradingCardsProperties.Points points = tradingCardsProperties.getPoints();
        return switch (type) {
            case PRICE_UP, PRICE_DOWN -> points.getPriceUpDown();
            case PRICE_ABOVE, PRICE_BELOW -> points.getPriceAboveBelow();
            case MARKET_CAP_ABOVE, VOLUME_ABOVE -> points.getMarketCapVolume();
            case PERCENTAGE_CHANGE -> points.getPercentageChange();
        };
    }

    static boolean isCorrect(Card card, FixedPointValue open, FixedPointValue close) {
        return switch (card.predictionType()) {
            case PRICE_UP -> close.compareTo(open) > 0;
            case PRICE_DOWN -> close.compareTo(open) < 0;
            case PRICE_ABOVE, MARKET_CAP_ABOVE, VOLUME_ABOVE ->
                    close.multiply(BPS_DENOMINATOR).compareTo(open.multiply(BPS_DENOMINATOR + card.targetBps())) >= 0;
            case PRICE_BELOW ->
                    close.multiply(BPS_DENOMINATOR).compareTo(open.multiply(BPS_DENOMINATOR - card.targetBps())) <= 0;
            case PERCENTAGE_CHANGE -> {
                FixedPointValue move = card.direction() == Direction.UP ? close.subtract(open) : open.subtract(close);
                yield move.multiply(BPS_DENOMINATOR).compareTo(open.multiply(card.percentageChangeBps())) >= 0;
            }
        };
    }

    /**
     * Unique strict top scorer; {@code null} when nobody committed or the top score is shared.
     */
    static String winnerOf(Map<String, Long> playerPoints) {
        String leader = null;
        long best = Long.MIN_VALUE;
        boolean shared = false;
        for (Map.Entry<String, Long> entry : playerPoints.entrySet()) {
            if (entry.getValue() > best) {
                leader = entry.getKey();
                best = entry.getValue();
                shared = false;
            } else if (entry.getValue() == best) {
                shared = true;
            }
        }
        return shared ? null : leader;
    }

    public record ResolutionOutcome(
            Map<Integer, PredictionResult> predictionResults,
            Map<String, Long> playerPoints,
            String winner
    ) {
    }
}
