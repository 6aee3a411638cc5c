package com.tradingcards.service.randomness;

import com.tradingcards.service.CardCodec;
import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a seed into card identifiers: identifier i = keccak256(seed || i) mod 10000.
 */
final class KeccakDraws {

    private static final BigInteger IDENTIFIER_SPACE = BigInteger.valueOf(CardCodec.IDENTIFIER_SPACE);

    private KeccakDraws() {
    }

    static List<Integer> expand(byte[] seed, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
        List<Integer> identifiers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte[] preimage = ByteBuffer.allocate(seed.length + Integer.BYTES)
                    .put(seed)
                    .putInt(i)
                    .array();
            BigInteger value = new BigInteger(1, keccak256(preimage));
            identifiers.add(value.mod(IDENTIFIER_SPACE).intValue());
        }
        return identifiers;
    }

    static byte[] keccak256(byte[] input) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        return digest.digest(input);
    }
}
