package com.tradingcards.service.randomness;

public class RandomnessUnavailableException extends RuntimeException {

    public RandomnessUnavailableException(String message) {
        super(message);
    }

    public RandomnessUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
