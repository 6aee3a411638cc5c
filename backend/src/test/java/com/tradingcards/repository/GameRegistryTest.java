package com.tradingcards.repository;

import com.tradingcards.model.Game;
import com.tradingcards.model.GamePhase;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GameRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final GameRegistry registry = new GameRegistry();

    @Test
    void mutationsOutsideWriteSectionAreRejected() {
        assertThrows(IllegalStateException.class, registry::allocateId);
        assertThrows(IllegalStateException.class, () -> registry.save(Game.open(1, "alice", NOW, NOW)));
        assertThrows(IllegalStateException.class, () -> registry.assignActiveGame("alice", 1));
    }

    @Test
    void idsAreMonotonicStartingAtOne() {
        assertEquals(1, registry.peekNextGameId());
        assertEquals(1L, registry.write(registry::allocateId));
        assertEquals(2L, registry.write(registry::allocateId));
        assertEquals(3, registry.peekNextGameId());
    }

    @Test
    void findByPhaseInReturnsGamesOrderedById() {
        registry.write(() -> {
            registry.save(Game.open(2, "bob", NOW, NOW));
            registry.save(Game.open(1, "alice", NOW, NOW).ended(NOW));
            registry.save(Game.open(3, "carol", NOW, NOW));
            return null;
        });

        List<Game> active = registry.findByPhaseIn(EnumSet.of(GamePhase.LOBBY));
        assertEquals(List.of(2L, 3L), active.stream().map(Game::id).toList());
    }

    @Test
    void releaseOnlyClearsMatchingSlot() {
        registry.write(() -> {
            registry.assignActiveGame("alice", 5);
            registry.releaseActiveGame("alice", 4);
            return null;
        });
        assertEquals(5L, registry.findActiveGameId("alice").orElseThrow());

        registry.write(() -> {
            registry.releaseActiveGame("alice", 5);
            return null;
        });
        assertTrue(registry.findActiveGameId("alice").isEmpty());
    }
}
