package com.tradingcards.service.randomness;

import com.tradingcards.model.RandomnessMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Local, fast draw seeded from the game id, the current instant and an engine-wide draw counter.
 * Callers cannot choose the seed, but anyone who controls timing can predict it: fine for
 * casual play and tests, not for adversarial games.
 */
@Component
@RequiredArgsConstructor
public class InsecureRandomnessSource implements RandomnessSource {

    private final Clock clock;
    private final AtomicLong drawCounter = new AtomicLong();

    @Override
    public RandomDraw draw(long gameId, int count) {
        Instant now = clock.instant();
        byte[] seed = ByteBuffer.allocate(Long.BYTES * 4)
                .putLong(gameId)
                .putLong(now.getEpochSecond())
                .putLong(now.getNano())
                .putLong(drawCounter.incrementAndGet())
                .array();
        String provenance = "seed:" + Numeric.toHexString(KeccakDraws.keccak256(seed));
        return new RandomDraw(KeccakDraws.expand(seed, count), RandomnessMode.INSECURE, provenance);
    }

    @Override
    public RandomnessMode mode() {
        return RandomnessMode.INSECURE;
    }
}
