package com.tradingcards.controller.dto;

import com.tradingcards.model.Card;
import com.tradingcards.model.Direction;
import com.tradingcards.model.Game;
import com.tradingcards.model.GamePhase;
import com.tradingcards.model.PlayerChoice;
import com.tradingcards.model.PlayerScore;
import com.tradingcards.model.PredictionResult;
import com.tradingcards.model.PredictionType;
import com.tradingcards.model.RandomnessMode;
import com.tradingcards.service.TransitionResult;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

public final class GameResponses {

    private GameResponses() {
    }

    public record GameCreated(
            long gameId
    ) {
    }

    public record GameState(
            long gameId,
            GamePhase phase,
            Instant createdAt,
            Instant lobbyDeadline,
            Instant choiceDeadline,
            Instant resolutionDeadline,
            Instant endedAt,
            int playerCount,
            int cardCount,
            RandomnessMode randomnessMode,
            String randomnessProvenance
    ) {
        public static GameState from(Game game) {
            return new GameState(
                    game.id(),
                    game.phase(),
                    game.createdAt(),
                    game.lobbyDeadline(),
                    game.choiceDeadline(),
                    game.resolutionDeadline(),
                    game.endedAt(),
                    game.playerCount(),
                    game.cardCount(),
                    game.randomnessMode(),
                    game.randomnessProvenance()
            );
        }
    }

    public record GamePlayers(
            long gameId,
            List<String> players
    ) {
    }

    public record CardView(
            int identifier,
            String assetSymbol,
            String assetName,
            PredictionType predictionType,
            Integer targetBps,
            Integer percentageChangeBps,
            Direction direction
    ) {
        public static CardView from(Card card) {
            return new CardView(
                    card.identifier(),
                    card.asset().symbol(),
                    card.asset().name(),
                    card.predictionType(),
                    card.targetBps(),
                    card.percentageChangeBps(),
                    card.direction()
            );
        }
    }

    public record GameCards(
            long gameId,
            List<Integer> identifiers,
            List<CardView> cards
    ) {
    }

    public record PlayerChoices(
            long gameId,
            String player,
            List<Integer> selectedCards,
            Instant committedAt,
            boolean committed
    ) {
        public static PlayerChoices from(PlayerChoice choice) {
            return new PlayerChoices(
                    choice.gameId(),
                    choice.player(),
                    choice.selectedCards(),
                    choice.committedAt(),
                    choice.committed()
            );
        }
    }

    public record Prediction(
            long gameId,
            int cardIdentifier,
            boolean resolved,
            boolean correct,
            int pointsEarned
    ) {
        public static Prediction from(long gameId, PredictionResult result) {
            return new Prediction(gameId, result.cardIdentifier(), result.resolved(), result.correct(), result.pointsEarned());
        }
    }

    public record Score(
            String player,
            long totalPoints,
            long gamesPlayed,
            long gamesWon,
            Long activeGameId
    ) {
        public static Score from(String player, PlayerScore score, Long activeGameId) {
            return new Score(player, score.totalPoints(), score.gamesPlayed(), score.gamesWon(), activeGameId);
        }
    }

    public record NextGameId(
            long nextGameId
    ) {
    }

    public record Transition(
            long gameId,
            boolean applied,
            GamePhase phase,
            String detail
    ) {
        public static Transition from(TransitionResult result) {
            return new Transition(result.gameId(), result.applied(), result.phase(), result.detail());
        }
    }

    public record NoActionNeeded(
            String code,
            String message,
            long gameId,
            GamePhase phase
    ) {
        public static NoActionNeeded from(TransitionResult result) {
            return new NoActionNeeded("no_action_needed", result.detail(), result.gameId(), result.phase());
        }
    }

    public record GameConfig(
            long lobbyDurationSeconds,
            long choiceDurationSeconds,
            long resolutionDurationSeconds,
            int selectionSize,
            int cardSetSize,
            boolean allowDuplicateSelections,
            int priceUpDownPoints,
            int priceAboveBelowPoints,
            int marketCapVolumePoints,
            int percentageChangePoints
    ) {
    }

    public record UpdateFee(
            int updateCount,
            BigInteger feeWei
    ) {
    }
}
