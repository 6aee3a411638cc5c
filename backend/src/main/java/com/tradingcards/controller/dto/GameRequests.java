package com.tradingcards.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradingcards.model.PriceMetric;
import com.tradingcards.oracle.PriceEvidence;
import com.tradingcards.oracle.PriceUpdate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.util.List;

public final class GameRequests {

    private GameRequests() {
    }

    public record StartGameRequest(
            boolean secureRandomness
    ) {
    }

    public record CommitChoicesRequest(
            @NotEmpty(message = "cards is required")
            List<@NotNull(message = "card identifiers must not be null") Integer> cards
    ) {
    }

    /**
     * Price evidence body. Mirrors Hermes parsed entries plus a metric discriminator.
     */
    public record PriceEvidenceRequest(
            @NotNull(message = "updates is required")
            List<@Valid PriceUpdateRequest> updates,

            @DecimalMin(value = "0", message = "fee must be non-negative")
            BigInteger fee
    ) {
        public PriceEvidence toEvidence() {
            List<PriceUpdate> converted = updates.stream()
                    .map(update -> new PriceUpdate(
                            update.id(),
                            update.metric(),
                            new PriceUpdate.Price(
                                    update.price().price(),
                                    update.price().conf() != null ? update.price().conf() : BigInteger.ZERO,
                                    update.price().expo(),
                                    update.price().publishTime()
                            )
                    ))
                    .toList();
            return new PriceEvidence(converted, fee);
        }
    }

    public record PriceUpdateRequest(
            @NotBlank(message = "update id is required")
            String id,

            PriceMetric metric,

            @NotNull(message = "update price is required")
            @Valid
            PriceRequest price
    ) {
    }

    public record PriceRequest(
            @NotNull(message = "price is required")
            BigInteger price,

            BigInteger conf,

            int expo,

            @JsonProperty("publish_time")
            long publishTime
    ) {
    }
}
