package com.tradingcards.model;

public enum AssetType {
    CRYPTO,
    STOCK
}
