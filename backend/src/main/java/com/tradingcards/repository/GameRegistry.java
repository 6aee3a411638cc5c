package com.tradingcards.repository;

import com.tradingcards.model.Game;
import com.tradingcards.model.GamePhase;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Arena of games keyed by id plus the player -> active game index.
 * Mutations run one at a time inside {@link #write(Supplier)}; reads go straight to the
 * concurrent maps and never wait on a writer.
 */
@Repository
public class GameRegistry {

    private final Map<Long, Game> games = new ConcurrentHashMap<>();
    private final Map<String, Long> activeGameByPlayer = new ConcurrentHashMap<>();
    private final AtomicLong nextGameId = new AtomicLong(1);
    private final ReentrantLock writeLock = new ReentrantLock();

    public <T> T write(Supplier<T> operation) {
        writeLock.lock();
        try {
            return operation.get();
        } finally {
            writeLock.unlock();
        }
    }

    public long allocateId() {
        requireWriteSection();
        return nextGameId.getAndIncrement();
    }

    public Game save(Game game) {
        requireWriteSection();
        games.put(game.id(), game);
        return game;
    }

    public Optional<Game> findById(long gameId) {
        return Optional.ofNullable(games.get(gameId));
    }

    public List<Game> findByPhaseIn(Collection<GamePhase> phases) {
        return games.values().stream()
                .filter(game -> phases.contains(game.phase()))
                .sorted(Comparator.comparingLong(Game::id))
                .toList();
    }

    public Optional<Long> findActiveGameId(String player) {
        return Optional.ofNullable(activeGameByPlayer.get(player));
    }

    public void assignActiveGame(String player, long gameId) {
        requireWriteSection();
        activeGameByPlayer.put(player, gameId);
    }

    /**
     * Clears the player's slot only while it still points at {@code gameId}.
     */
    public void releaseActiveGame(String player, long gameId) {
        requireWriteSection();
        activeGameByPlayer.remove(player, gameId);
    }

    public long peekNextGameId() {
        return nextGameId.get();
    }

    private void requireWriteSection() {
        if (!writeLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Game registry mutations must run inside write()");
        }
    }
}
