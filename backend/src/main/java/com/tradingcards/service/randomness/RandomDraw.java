package com.tradingcards.service.randomness;

import com.tradingcards.model.RandomnessMode;

import java.util.List;

/**
 * Identifiers produced by one draw plus a provenance string for auditing how they were derived.
 */
public record RandomDraw(
        List<Integer> identifiers,
        RandomnessMode mode,
        String provenance
) {
    public RandomDraw {
        identifiers = List.copyOf(identifiers);
    }
}
