package com.tradingcards.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradingcards.config.TradingCardsProperties;
import com.tradingcards.model.PriceMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Fetches parsed price updates from a Pyth Hermes endpoint.
 * Only spot prices are available there; market-cap and volume observations must come from the caller.
 */
@Component
public class HermesPriceClient {

    private static final Logger log = LoggerFactory.getLogger(HermesPriceClient.class);

    private final String hermesUrl;
    private final RestClient restClient;

    public HermesPriceClient(TradingCardsProperties tradingCardsProperties, RestClient.Builder restClientBuilder) {
        TradingCardsProperties.Oracle oracle = tradingCardsProperties.getOracle();
        this.hermesUrl = StringUtils.hasText(oracle.getHermesUrl()) ? oracle.getHermesUrl().trim() : null;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(oracle.getRequestTimeout());
        requestFactory.setReadTimeout(oracle.getRequestTimeout());
        this.restClient = restClientBuilder.requestFactory(requestFactory).build();
    }

    public boolean isConfigured() {
        return hermesUrl != null;
    }

    public List<PriceUpdate> fetchLatest(Collection<String> feedIds) {
        return fetch("/v2/updates/price/latest", feedIds);
    }

    /**
     * Updates published at or right after {@code publishTime}.
     */
    public List<PriceUpdate> fetchAt(Instant publishTime, Collection<String> feedIds) {
        return fetch("/v2/updates/price/" + publishTime.getEpochSecond(), feedIds);
    }

    private List<PriceUpdate> fetch(String path, Collection<String> feedIds) {
        if (!isConfigured()) {
            throw new IllegalStateException("tradingcards.oracle.hermes-url is not configured");
        }
        if (feedIds.isEmpty()) {
            return List.of();
        }

        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(hermesUrl).path(path).queryParam("parsed", true);
        feedIds.forEach(id -> uri.queryParam("ids[]", id));

        JsonNode body;
        try {
            body = restClient.get()
                    .uri(uri.encode().build().toUri())
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.warn("Hermes request {} failed", path, e);
            throw e;
        }

        List<PriceUpdate> updates = new ArrayList<>();
        if (body == null) {
            return updates;
        }
        for (JsonNode parsed : body.path("parsed")) {
            JsonNode price = parsed.path("price");
            if (!parsed.hasNonNull("id") || !price.hasNonNull("price")) {
                continue;
            }
            updates.add(new PriceUpdate(
                    parsed.get("id").asText(),
                    PriceMetric.PRICE,
                    new PriceUpdate.Price(
                            new BigInteger(price.get("price").asText()),
                            new BigInteger(price.path("conf").asText("0")),
                            price.path("expo").asInt(),
                            price.path("publish_time").asLong()
                    )
            ));
        }
        return updates;
    }
}
