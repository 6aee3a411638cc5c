package com.tradingcards.oracle;

import lombok.Getter;

/**
 * Evidence rejected by the oracle. The game stays in RESOLUTION and may be retried with fresh evidence.
 */
@Getter
public class PriceEvidenceException extends RuntimeException {

    private final Reason reason;

    public PriceEvidenceException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String getCode() {
        return reason.code();
    }

    public static PriceEvidenceException insufficientFee(String detail) {
        return new PriceEvidenceException(Reason.INSUFFICIENT_FEE, detail);
    }

    public static PriceEvidenceException stalePrice(String detail) {
        return new PriceEvidenceException(Reason.STALE_PRICE, detail);
    }

    public static PriceEvidenceException missingPrice(String detail) {
        return new PriceEvidenceException(Reason.MISSING_PRICE, detail);
    }

    public static PriceEvidenceException unrecognizedFeed(String detail) {
        return new PriceEvidenceException(Reason.UNRECOGNIZED_FEED, detail);
    }

    public static PriceEvidenceException invalidUpdate(String detail) {
        return new PriceEvidenceException(Reason.INVALID_UPDATE, detail);
    }

    public enum Reason {
        INSUFFICIENT_FEE("insufficient_fee"),
        STALE_PRICE("stale_price"),
        MISSING_PRICE("missing_price"),
        UNRECOGNIZED_FEED("unrecognized_feed"),
        INVALID_UPDATE("invalid_update");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }
}
