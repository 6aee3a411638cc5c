package com.tradingcards.service.randomness;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradingcards.config.TradingCardsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Reads the latest round from a drand HTTP endpoint ({@code GET {beacon-url}/public/latest}).
 */
@Component
public class DrandBeaconClient implements RandomnessBeaconClient {

    private static final Logger log = LoggerFactory.getLogger(DrandBeaconClient.class);

    private final String beaconUrl;
    private final RestClient restClient;

    public DrandBeaconClient(TradingCardsProperties tradingCardsProperties, RestClient.Builder restClientBuilder) {
        TradingCardsProperties.Randomness randomness = tradingCardsProperties.getRandomness();
        this.beaconUrl = StringUtils.hasText(randomness.getBeaconUrl()) ? randomness.getBeaconUrl().trim() : null;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(randomness.getRequestTimeout());
        requestFactory.setReadTimeout(randomness.getRequestTimeout());
        this.restClient = restClientBuilder.requestFactory(requestFactory).build();
    }

    @Override
    public BeaconRound latestRound() {
        if (beaconUrl == null) {
            throw new RandomnessUnavailableException(
                    "Secure randomness requested but tradingcards.randomness.beacon-url is not configured");
        }

        JsonNode body;
        try {
            body = restClient.get()
                    .uri(beaconUrl + "/public/latest")
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.warn("Randomness beacon request to {} failed", beaconUrl, e);
            throw new RandomnessUnavailableException("Randomness beacon is unreachable", e);
        }

        if (body == null || !body.hasNonNull("round") || !body.hasNonNull("randomness")) {
            throw new RandomnessUnavailableException("Randomness beacon returned an incomplete round");
        }
        return new BeaconRound(
                body.get("round").asLong(),
                body.get("randomness").asText(),
                body.path("signature").asText(null)
        );
    }
}
