package com.investorchat.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.investorchat.common.model.NewsItem;
import com.investorchat.common.model.StockPayload;
import com.investorchat.orchestrator.client.MarketDataSource;
import com.investorchat.orchestrator.client.NewsQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Gathers external data for the data-backed intents.
 *
 * <p>An empty {@code Mono} is the no-data signal; errors never leave this component.
 * <ul>
 *   <li><b>Stock</b>: quote, overview and ticker news fetched concurrently. If any branch
 *       fails the whole aggregation yields no data. Otherwise each branch contributes the
 *       sections its body carries.</li>
 *   <li><b>Market news</b>: a single lookup of the financial-markets topic.</li>
 * </ul>
 */
@Component
public class DataAggregator {

    private static final Logger log = LoggerFactory.getLogger(DataAggregator.class);

    static final int    TICKER_NEWS_LIMIT  = 5;
    static final int    MARKET_NEWS_LIMIT  = 5;
    static final String MARKET_NEWS_TOPIC  = "financial_markets";

    private final MarketDataSource marketDataSource;

    public DataAggregator(MarketDataSource marketDataSource) {
        this.marketDataSource = marketDataSource;
    }

    public Mono<StockPayload> gatherStock(String ticker) {
        log.info("Dispatching 3 stock fetches in parallel. ticker={}", ticker);

        return Mono.zip(
                FetchOutcome.capture("quote", Mono.defer(() -> marketDataSource.globalQuote(ticker))),
                FetchOutcome.capture("overview", Mono.defer(() -> marketDataSource.companyOverview(ticker))),
                FetchOutcome.capture("news", Mono.defer(() ->
                    marketDataSource.newsSentiment(NewsQuery.forTicker(ticker, TICKER_NEWS_LIMIT)))))
            .flatMap(joined -> {
                List<FetchOutcome<JsonNode>> outcomes = List.of(joined.getT1(), joined.getT2(), joined.getT3());
                Optional<FetchOutcome<JsonNode>> failure = outcomes.stream().filter(FetchOutcome::failed).findFirst();
                if (failure.isPresent()) {
                    log.error("Stock fetch failed — aborting aggregation. ticker={} branch={} reason={}",
                              ticker, failure.get().branch(), failure.get().error().getMessage());
                    return Mono.<StockPayload>empty();
                }

                StockPayload payload = new StockPayload(
                    AlphaVantageMapper.toQuote(joined.getT1().value()),
                    AlphaVantageMapper.toOverview(joined.getT2().value()),
                    AlphaVantageMapper.toHeadlines(joined.getT3().value()));
                log.info("Stock data gathered. ticker={} quote={} overview={} news={}",
                         ticker, payload.quote() != null, payload.overview() != null,
                         payload.news() != null ? payload.news().size() : 0);

                if (payload.isEmpty()) {
                    log.warn("Stock fetches returned no usable sections. ticker={}", ticker);
                    return Mono.<StockPayload>empty();
                }
                return Mono.just(payload);
            });
    }

    public Mono<List<NewsItem>> gatherMarketNews() {
        return Mono.defer(() -> marketDataSource.newsSentiment(NewsQuery.forTopic(MARKET_NEWS_TOPIC, MARKET_NEWS_LIMIT)))
            .flatMap(body -> {
                if (!body.has("feed")) {
                    log.warn("Market news response has no feed");
                    return Mono.<List<NewsItem>>empty();
                }
                List<NewsItem> items = AlphaVantageMapper.toNewsItems(body, MARKET_NEWS_LIMIT);
                log.info("Market news gathered. items={}", items.size());
                return items.isEmpty() ? Mono.<List<NewsItem>>empty() : Mono.just(items);
            })
            .onErrorResume(e -> {
                log.error("Market news fetch failed. reason={}", e.getMessage());
                return Mono.empty();
            });
    }
}
