package com.investorchat.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alpha Vantage {@code /query} lookups.
 *
 * <p>Status handling: 2xx bodies are returned as is; any other status produces an empty
 * JSON object, so the caller finds no data for that lookup only. Timeouts, transport
 * errors and unreadable bodies propagate as errors.
 */
public class AlphaVantageClient implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageClient.class);

    private static final List<String> NOTICE_KEYS = List.of("Note", "Information", "Error Message");

    private final WebClient webClient;
    private final String apiKey;
    private final boolean logHttpBody;

    public AlphaVantageClient(WebClient alphaVantageWebClient, String apiKey, boolean logHttpBody) {
        this.webClient   = alphaVantageWebClient;
        this.apiKey      = apiKey;
        this.logHttpBody = logHttpBody;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<JsonNode> globalQuote(String symbol) {
        return query(params("GLOBAL_QUOTE", "symbol", symbol));
    }

    @Override
    public Mono<JsonNode> companyOverview(String symbol) {
        return query(params("OVERVIEW", "symbol", symbol));
    }

    @Override
    public Mono<JsonNode> newsSentiment(NewsQuery query) {
        Map<String, String> params = params("NEWS_SENTIMENT");
        if (query.tickers() != null) params.put("tickers", query.tickers());
        if (query.topics() != null)  params.put("topics", query.topics());
        if (query.limit() != null)   params.put("limit", String.valueOf(query.limit()));
        if (query.sort() != null)    params.put("sort", query.sort());
        return query(params);
    }

    private Mono<JsonNode> query(Map<String, String> params) {
        String function = params.get("function");
        if (!isConfigured()) {
            return Mono.error(new IllegalStateException("ALPHA_VANTAGE_API_KEY is not set"));
        }

        return webClient.get()
            .uri(uriBuilder -> {
                uriBuilder.path("/query");
                params.forEach(uriBuilder::queryParam);
                return uriBuilder.queryParam("apikey", apiKey).build();
            })
            .<JsonNode>exchangeToMono(response -> {
                log.debug("AlphaVantage response. function={} status={}", function, response.statusCode().value());
                if (!response.statusCode().is2xxSuccessful()) {
                    log.warn("AlphaVantage non-success status — treating as no data. function={} status={}",
                             function, response.statusCode().value());
                    return response.releaseBody().thenReturn((JsonNode) JsonNodeFactory.instance.objectNode());
                }
                return response.bodyToMono(JsonNode.class)
                    .defaultIfEmpty(JsonNodeFactory.instance.objectNode());
            })
            .doOnNext(body -> logBody(function, body))
            .doOnError(e -> log.warn("AlphaVantage request failed. function={} reason={}", function, e.getMessage()));
    }

    private void logBody(String function, JsonNode body) {
        if (logHttpBody) {
            log.debug("AlphaVantage response body. function={} body={}", function, body);
        } else if (log.isDebugEnabled()) {
            List<String> keys = new ArrayList<>();
            body.fieldNames().forEachRemaining(keys::add);
            log.debug("AlphaVantage response keys. function={} keys={}", function, keys);
        }
        List<String> notices = NOTICE_KEYS.stream().filter(body::has).toList();
        if (!notices.isEmpty()) {
            log.warn("AlphaVantage API notice. function={} keysPresent={}", function, String.join(",", notices));
        }
    }

    private static Map<String, String> params(String function, String... keyValues) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("function", function);
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put(keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
