package com.tradingcards.service.randomness;

/**
 * Public verifiable randomness beacon.
 */
public interface RandomnessBeaconClient {

    /**
     * @throws RandomnessUnavailableException when the beacon is not configured or unreachable
     */
    BeaconRound latestRound();

    record BeaconRound(
            long round,
            String randomness,
            String signature
    ) {
    }
}
