package com.tradingcards.service;

import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;

/**
 * Player identities are EVM addresses, stored in EIP-55 checksum form so that
 * differently-cased spellings of one address map to the same player.
 */
public final class PlayerAddresses {

    private PlayerAddresses() {
    }

    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            throw GameRuleViolationException.invalidPlayerAddress("Player address is required");
        }
        String trimmed = address.trim();
        if (!WalletUtils.isValidAddress(trimmed)) {
            throw GameRuleViolationException.invalidPlayerAddress("Not a valid EVM address: " + trimmed);
        }
        return Keys.toChecksumAddress(trimmed);
    }
}
