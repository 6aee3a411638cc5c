package com.tradingcards.model;

public enum RandomnessMode {
    INSECURE,
    SECURE
}
