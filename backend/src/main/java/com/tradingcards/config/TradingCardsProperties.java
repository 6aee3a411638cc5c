package com.tradingcards.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Game rules, oracle and keeper settings.
 * Durations and point values are read-only to callers once the context is up.
 */
@Getter
@Setter
@Component
@Validated
@ConfigurationProperties(prefix = "tradingcards")
public class TradingCardsProperties {

    @Valid
    private Game game = new Game();
    @Valid
    private Points points = new Points();
    @Valid
    private Oracle oracle = new Oracle();
    private Randomness randomness = new Randomness();
    @Valid
    private Keeper keeper = new Keeper();

    @Getter
    @Setter
    public static class Game {
        private Duration lobbyDuration = Duration.ofSeconds(60);
        private Duration choiceDuration = Duration.ofSeconds(60);
        private Duration resolutionDuration = Duration.ofSeconds(600);

        /**
         * Number of cards each player commits.
         */
        @Min(1)
        private int selectionSize = 3;

        /**
         * Number of cards generated when a game starts.
         */
        @Min(1)
        private int cardSetSize = 10;

        /**
         * Whether one commit may name the same card identifier more than once.
         */
        private boolean allowDuplicateSelections = false;

        @AssertTrue(message = "lobby, choice and resolution durations must be positive")
        public boolean isPhaseDurationsPositive() {
            return isPositive(lobbyDuration) && isPositive(choiceDuration) && isPositive(resolutionDuration);
        }

        @AssertTrue(message = "selection-size cannot exceed card-set-size unless duplicate selections are allowed")
        public boolean isSelectionSatisfiable() {
            return allowDuplicateSelections || selectionSize <= cardSetSize;
        }
    }

    @Getter
    @Setter
    public static class Points {
        @PositiveOrZero
        private int priceUpDown = 10;
        @PositiveOrZero
        private int priceAboveBelow = 15;
        @PositiveOrZero
        private int marketCapVolume = 18;
        @PositiveOrZero
        private int percentageChange = 20;
    }

    @Getter
    @Setter
    public static class Oracle {
        /**
         * Hermes base URL. Blank disables evidence fetching by the keeper and the health probe.
         */
        private String hermesUrl = "";

        /**
         * Fee charged per price update entry, in wei.
         */
        @NotNull
        @PositiveOrZero
        private BigInteger updateFeeWei = BigInteger.ONE;

        /**
         * Maximum age of a closing price, and the window an opening price may precede the choice deadline by.
         */
        private Duration maxPriceAge = Duration.ofSeconds(60);

        private Duration requestTimeout = Duration.ofSeconds(10);

        @AssertTrue(message = "max-price-age must be positive")
        public boolean isMaxPriceAgePositive() {
            return isPositive(maxPriceAge);
        }
    }

    @Getter
    @Setter
    public static class Randomness {
        /**
         * Base URL of a drand-compatible beacon. Blank leaves secure randomness unavailable.
         */
        private String beaconUrl = "";

        private Duration requestTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Keeper {
        private boolean enabled = false;
        private long initialDelayMs = 5_000;
        private long pollIntervalMs = 5_000;
        private boolean secureRandomness = false;
        private boolean autoResolve = false;

        /**
         * Grace period after the resolution deadline before a game that cannot be resolved is ended without points.
         */
        private Duration endWithoutEvidenceAfter = Duration.ofMinutes(30);

        @AssertTrue(message = "end-without-evidence-after cannot be negative")
        public boolean isEndWithoutEvidenceAfterValid() {
            return endWithoutEvidenceAfter != null && !endWithoutEvidenceAfter.isNegative();
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
