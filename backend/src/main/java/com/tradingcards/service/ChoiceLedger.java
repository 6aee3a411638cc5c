package com.tradingcards.service;

import com.tradingcards.config.TradingCardsProperties;
import com.tradingcards.model.Game;
import com.tradingcards.model.PlayerChoice;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Committed card selections per (game, player). A selection is recorded once and never changes.
 * Phase and deadline checks belong to the caller; this ledger enforces participation,
 * single commit, cardinality and card-set membership.
 */
@Component
@RequiredArgsConstructor
public class ChoiceLedger {

    private final TradingCardsProperties tradingCardsProperties;
    private final Map<ChoiceKey, PlayerChoice> choices = new ConcurrentHashMap<>();

    public void validate(Game game, String player, List<Integer> selectedCards) {
        Objects.requireNonNull(game, "game is required");
        if (!game.hasPlayer(player)) {
            throw GameRuleViolationException.notParticipant(
                    "Player " + player + " is not a participant of game " + game.id());
        }
        if (isCommitted(game.id(), player)) {
            throw GameRuleViolationException.alreadyCommitted(
                    "Player " + player + " already committed choices for game " + game.id());
        }

        int selectionSize = tradingCardsProperties.getGame().getSelectionSize();
        if (selectedCards == null || selectedCards.size() != selectionSize) {
            int actual = selectedCards == null ? 0 : selectedCards.size();
            throw GameRuleViolationException.invalidSelectionSize(
                    "Exactly " + selectionSize + " cards must be selected, got " + actual);
        }

        Set<Integer> seen = new HashSet<>();
        for (Integer card : selectedCards) {
            if (card == null || !game.containsCard(card)) {
                throw GameRuleViolationException.cardNotInGame(
                        "Card " + card + " is not part of game " + game.id());
            }
            if (!seen.add(card) && !tradingCardsProperties.getGame().isAllowDuplicateSelections()) {
                throw GameRuleViolationException.duplicateSelection(
                        "Card " + card + " is selected more than once");
            }
        }
    }

    public PlayerChoice commit(Game game, String player, List<Integer> selectedCards, Instant committedAt) {
        validate(game, player, selectedCards);
        PlayerChoice choice = new PlayerChoice(game.id(), player, selectedCards, committedAt, true);
        PlayerChoice existing = choices.putIfAbsent(new ChoiceKey(game.id(), player), choice);
        if (existing != null) {
            throw GameRuleViolationException.alreadyCommitted(
                    "Player " + player + " already committed choices for game " + game.id());
        }
        return choice;
    }

    public Optional<PlayerChoice> find(long gameId, String player) {
        return Optional.ofNullable(choices.get(new ChoiceKey(gameId, player)));
    }

    public boolean isCommitted(long gameId, String player) {
        return choices.containsKey(new ChoiceKey(gameId, player));
    }

    /**
     * Committed choices of the game's players, in join order.
     */
    public List<PlayerChoice> findCommitted(Game game) {
        return game.players().stream()
                .map(player -> choices.get(new ChoiceKey(game.id(), player)))
                .filter(Objects::nonNull)
                .toList();
    }

    private record ChoiceKey(long gameId, String player) {
    }
}
