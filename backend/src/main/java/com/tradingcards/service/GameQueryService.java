package com.tradingcards.service;

import com.tradingcards.model.Card;
import com.tradingcards.model.Game;
import com.tradingcards.model.PlayerChoice;
import com.tradingcards.model.PlayerScore;
import com.tradingcards.model.PredictionResult;
import com.tradingcards.repository.GameRegistry;
import com.tradingcards.repository.ScoreBook;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side. Never waits on a writer and never mutates.
 */
@Service
@RequiredArgsConstructor
public class GameQueryService {

    private final GameRegistry gameRegistry;
    private final ChoiceLedger choiceLedger;
    private final ScoreBook scoreBook;
    private final CardCatalog cardCatalog;

    public Game getGame(long gameId) {
        return gameRegistry.findById(gameId).orElseThrow(() -> GameRuleViolationException.gameNotFound(gameId));
    }

    public List<String> getGamePlayers(long gameId) {
        return getGame(gameId).players();
    }

    public List<Integer> getGameCards(long gameId) {
        return getGame(gameId).cards();
    }

    public List<Card> getDecodedGameCards(long gameId) {
        return getGame(gameId).cards().stream()
                .map(identifier -> CardCodec.toCard(identifier, cardCatalog))
                .toList();
    }

    /**
     * The player's committed selection, or an uncommitted placeholder when there is none.
     */
    public PlayerChoice getPlayerChoices(long gameId, String player) {
        getGame(gameId);
        String normalized = PlayerAddresses.normalize(player);
        return choiceLedger.find(gameId, normalized)
                .orElseGet(() -> PlayerChoice.uncommitted(gameId, normalized));
    }

    public PredictionResult getPredictionResult(long gameId, int cardIdentifier) {
        PredictionResult result = getGame(gameId).predictionResults().get(cardIdentifier);
        return result != null ? result : PredictionResult.unresolved(cardIdentifier);
    }

    public PlayerScore getPlayerScore(String player) {
        return scoreBook.find(PlayerAddresses.normalize(player));
    }

    public Optional<Long> getActiveGameId(String player) {
        return gameRegistry.findActiveGameId(PlayerAddresses.normalize(player));
    }

    public long getNextGameId() {
        return gameRegistry.peekNextGameId();
    }
}
