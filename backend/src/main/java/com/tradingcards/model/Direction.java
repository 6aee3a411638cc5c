package com.tradingcards.model;

public enum Direction {
    UP,
    DOWN
}
