package com.tradingcards;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TradingCardsApplication {
    public static void main(String[] args) {
        SpringApplication.run(TradingCardsApplication.class, args);
    }
}
