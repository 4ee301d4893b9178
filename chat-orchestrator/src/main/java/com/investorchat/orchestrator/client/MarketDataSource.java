package com.investorchat.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Market-data lookups returning provider-shaped JSON.
 *
 * <p>A body that lacks the expected keys (notice objects, client errors) is still a
 * successful emission; only transport failures, server errors and missing credentials
 * are signalled as errors.
 */
public interface MarketDataSource {

    Mono<JsonNode> globalQuote(String symbol);

    Mono<JsonNode> companyOverview(String symbol);

    Mono<JsonNode> newsSentiment(NewsQuery query);
}
