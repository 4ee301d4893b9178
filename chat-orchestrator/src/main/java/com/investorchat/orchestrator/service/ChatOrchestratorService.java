package com.investorchat.orchestrator.service;

import com.investorchat.common.model.ChatResult;
import com.investorchat.common.model.NewsItem;
import com.investorchat.common.model.Plan;
import com.investorchat.common.model.StockPayload;
import com.investorchat.common.trace.TraceContextUtil;
import com.investorchat.orchestrator.ai.CompletionClient;
import com.investorchat.orchestrator.logger.ChatFlowLogger;
import com.investorchat.orchestrator.pipeline.DataAggregator;
import com.investorchat.orchestrator.pipeline.ResponseSynthesizer;
import com.investorchat.orchestrator.planner.IntentPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Per-request pipeline: plan → route on intent → gather (data-backed intents) → synthesize.
 *
 * <table>
 *   <caption>Routing</caption>
 *   <tr><th>intent</th><th>no data</th><th>data</th></tr>
 *   <tr><td>stock_analysis, no ticker</td><td colspan="2">fixed "need ticker" text, no gathering</td></tr>
 *   <tr><td>stock_analysis</td><td>"couldn't retrieve data for TICKER"</td><td>stock synthesis</td></tr>
 *   <tr><td>market_news</td><td>"couldn't retrieve market news"</td><td>news digest</td></tr>
 *   <tr><td>general_chat</td><td colspan="2">general synthesis, no gathering</td></tr>
 * </table>
 *
 * <p>Anticipated failures are turned into text by the stages themselves; anything that
 * still errors here propagates to the caller.
 */
@Service
public class ChatOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(ChatOrchestratorService.class);

    static final String NEED_TICKER     = "I can analyze a stock, but I need a valid ticker symbol.";
    static final String NO_STOCK_DATA   = "Sorry, I couldn't retrieve financial data for %s.";
    static final String NO_MARKET_NEWS  = "Sorry, I couldn't retrieve the latest market news at the moment.";

    private final IntentPlanner planner;
    private final DataAggregator dataAggregator;
    private final ResponseSynthesizer synthesizer;
    private final CompletionClient completionClient;
    private final ChatFlowLogger chatFlowLogger;

    public ChatOrchestratorService(IntentPlanner planner,
                                   DataAggregator dataAggregator,
                                   ResponseSynthesizer synthesizer,
                                   CompletionClient completionClient,
                                   ChatFlowLogger chatFlowLogger) {
        this.planner          = planner;
        this.dataAggregator   = dataAggregator;
        this.synthesizer      = synthesizer;
        this.completionClient = completionClient;
        this.chatFlowLogger   = chatFlowLogger;
    }

    public Mono<ChatResult> process(String text) {
        String requestId = TraceContextUtil.newRequestId();

        Mono<ChatResult> pipeline = Mono.defer(() -> {
                log.info("Chat request received. textLength={} requestId={}", text.length(), requestId);
                return planner.plan(text);
            })
            .doOnEach(chatFlowLogger.stage(ChatFlowLogger.PLANNING))
            .flatMap(plan -> route(plan, text, requestId))
            .doOnEach(chatFlowLogger.stage(ChatFlowLogger.DONE));

        return TraceContextUtil.withRequestId(pipeline, requestId);
    }

    private Mono<ChatResult> route(Plan plan, String text, String requestId) {
        chatFlowLogger.logWithRequestId(ChatFlowLogger.ROUTING, requestId, "intent=" + plan.intent().wireName());
        return switch (plan.intent()) {
            case STOCK_ANALYSIS -> stockAnalysis(plan);
            case MARKET_NEWS    -> marketNews(text);
            case GENERAL_CHAT   -> synthesizer.synthesizeGeneral(text)
                .doOnEach(chatFlowLogger.stage(ChatFlowLogger.SYNTHESIZING))
                .map(this::result);
        };
    }

    private Mono<ChatResult> stockAnalysis(Plan plan) {
        Optional<String> ticker = plan.ticker();
        if (ticker.isEmpty()) {
            log.info("stock_analysis without a usable ticker — short-circuiting");
            return Mono.just(result(NEED_TICKER));
        }
        String symbol = ticker.get();

        return dataAggregator.gatherStock(symbol)
            .map(Optional::of)
            .defaultIfEmpty(Optional.<StockPayload>empty())
            .doOnEach(chatFlowLogger.stage(ChatFlowLogger.GATHERING))
            .flatMap(payload -> payload.isEmpty()
                ? Mono.just(result(String.format(NO_STOCK_DATA, symbol)))
                : synthesizer.synthesizeStock(symbol, payload.get())
                    .doOnEach(chatFlowLogger.stage(ChatFlowLogger.SYNTHESIZING))
                    .map(this::result));
    }

    private Mono<ChatResult> marketNews(String text) {
        return dataAggregator.gatherMarketNews()
            .map(Optional::of)
            .defaultIfEmpty(Optional.<List<NewsItem>>empty())
            .doOnEach(chatFlowLogger.stage(ChatFlowLogger.GATHERING))
            .flatMap(items -> items.isEmpty()
                ? Mono.just(result(NO_MARKET_NEWS))
                : synthesizer.synthesizeNewsDigest(text, items.get())
                    .doOnEach(chatFlowLogger.stage(ChatFlowLogger.SYNTHESIZING))
                    .map(this::result));
    }

    private ChatResult result(String responseText) {
        return new ChatResult(responseText, completionClient.backendId());
    }
}
