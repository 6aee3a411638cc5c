package com.tradingcards.service.randomness;

import com.tradingcards.model.RandomnessMode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

import java.nio.ByteBuffer;
import java.util.regex.Pattern;

/**
 * Draw backed by a verifiable beacon round. The beacon output is public and signed, so anyone can
 * recompute the card set from the recorded round and the game id.
 */
@Component
@RequiredArgsConstructor
public class BeaconRandomnessSource implements RandomnessSource {

    private static final Logger log = LoggerFactory.getLogger(BeaconRandomnessSource.class);
    private static final Pattern HEX_64 = Pattern.compile("^(0x)?[0-9a-fA-F]{64}$");

    private final RandomnessBeaconClient randomnessBeaconClient;

    @Override
    public RandomDraw draw(long gameId, int count) {
        RandomnessBeaconClient.BeaconRound round = randomnessBeaconClient.latestRound();
        if (round == null || round.randomness() == null || !HEX_64.matcher(round.randomness()).matches()) {
            throw new RandomnessUnavailableException("Beacon returned malformed randomness");
        }

        byte[] randomness = Numeric.hexStringToByteArray(round.randomness());
        byte[] seed = ByteBuffer.allocate(randomness.length + Long.BYTES)
                .put(randomness)
                .putLong(gameId)
                .array();

        log.debug("Drawing {} cards for game {} from beacon round {}", count, gameId, round.round());
        return new RandomDraw(KeccakDraws.expand(seed, count), RandomnessMode.SECURE, "beacon-round:" + round.round());
    }

    @Override
    public RandomnessMode mode() {
        return RandomnessMode.SECURE;
    }
}
