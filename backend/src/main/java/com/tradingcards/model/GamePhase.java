package com.tradingcards.model;

/**
 * Game lifecycle: LOBBY -> CHOICE -> RESOLUTION -> ENDED.
 */
public enum GamePhase {
    LOBBY,
    CHOICE,
    RESOLUTION,
    ENDED;

    public boolean isActive() {
        return this != ENDED;
    }
}
