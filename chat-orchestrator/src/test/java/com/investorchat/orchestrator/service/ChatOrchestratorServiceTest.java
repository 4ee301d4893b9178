package com.investorchat.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investorchat.common.completion.ChatMessage;
import com.investorchat.common.completion.TokenCount;
import com.investorchat.common.exception.ChatPipelineException;
import com.investorchat.common.model.ChatResult;
import com.investorchat.orchestrator.ai.CompletionClient;
import com.investorchat.orchestrator.client.MarketDataSource;
import com.investorchat.orchestrator.logger.ChatFlowLogger;
import com.investorchat.orchestrator.pipeline.DataAggregator;
import com.investorchat.orchestrator.pipeline.ResponseSynthesizer;
import com.investorchat.orchestrator.planner.IntentPlanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Drives the whole pipeline with the two outbound boundaries mocked: the completion
 * backend answers by prompt type, the market data source by function.
 */
class ChatOrchestratorServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CompletionClient completionClient;
    private MarketDataSource marketDataSource;
    private ChatOrchestratorService service;

    /** Raw planner reply for the next request. */
    private final AtomicReference<String> plannerReply = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        completionClient = mock(CompletionClient.class);
        marketDataSource = mock(MarketDataSource.class);
        when(completionClient.backendId()).thenReturn("gemini");
        when(completionClient.countTokens(anyString())).thenReturn(Mono.just(TokenCount.of(50)));
        when(completionClient.generate(anyList(), anyDouble(), anyInt())).thenAnswer(inv -> {
            List<ChatMessage> messages = inv.getArgument(0);
            String system = messages.get(0).content();
            if (system.startsWith("You are a routing agent")) {
                return Mono.just(plannerReply.get());
            }
            if (system.startsWith("You are a smart stock analyst")) return Mono.just("Tesla looks strong.");
            if (system.startsWith("You are a financial news assistant. Summarize")) return Mono.just("item summary");
            if (system.startsWith("You are a financial news assistant.")) return Mono.just("Markets digest.");
            return Mono.just("Hello! How can I help?");
        });

        ResponseSynthesizer synthesizer = new ResponseSynthesizer(completionClient, MAPPER, 1024);
        service = new ChatOrchestratorService(
            new IntentPlanner(completionClient, MAPPER),
            new DataAggregator(marketDataSource),
            synthesizer,
            completionClient,
            new ChatFlowLogger());
    }

    private static JsonNode json(String raw) {
        try {
            return MAPPER.readTree(raw);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    private void stockDataAvailable() {
        when(marketDataSource.globalQuote("TSLA")).thenReturn(Mono.just(json(
            "{\"Global Quote\":{\"05. price\":\"250.00\",\"06. volume\":\"1000\",\"10. change percent\":\"1.5%\"}}")));
        when(marketDataSource.companyOverview("TSLA")).thenReturn(Mono.just(json(
            "{\"MarketCapitalization\":\"800000000000\",\"PERatio\":\"70\"}")));
        when(marketDataSource.newsSentiment(any())).thenReturn(Mono.just(json(
            "{\"feed\":[{\"title\":\"Tesla ships\",\"overall_sentiment_label\":\"Bullish\"}]}")));
    }

    @Nested
    @DisplayName("stock_analysis")
    class StockAnalysis {

        @Test
        @DisplayName("ticker present and data gathered → synthesized analysis")
        @SuppressWarnings("unchecked")
        void analyzesTicker() {
            plannerReply.set("{\"intent\":\"stock_analysis\",\"entities\":[{\"type\":\"ticker\",\"value\":\"TSLA\"}]}");
            stockDataAvailable();

            StepVerifier.create(service.process("Analyze Tesla (TSLA)"))
                .expectNext(new ChatResult("Tesla looks strong.", "gemini"))
                .verifyComplete();

            ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
            verify(completionClient).generate(messages.capture(), eq(0.5), eq(1024));
            String user = messages.getValue().get(1).content();
            assertTrue(user.startsWith("Data for TSLA:"));
            assertTrue(user.contains("\"quote\"") && user.contains("\"overview\"") && user.contains("\"news\""));
        }

        @Test
        @DisplayName("no ticker entity → fixed text, no data fetched")
        void missingTicker() {
            plannerReply.set("{\"intent\":\"stock_analysis\",\"entities\":[]}");

            StepVerifier.create(service.process("Analyze that company"))
                .expectNext(new ChatResult(ChatOrchestratorService.NEED_TICKER, "gemini"))
                .verifyComplete();

            verifyNoInteractions(marketDataSource);
        }

        @Test
        @DisplayName("first entity not a ticker → fixed text, no data fetched")
        void firstEntityNotTicker() {
            plannerReply.set("{\"intent\":\"stock_analysis\",\"entities\":[{\"type\":\"company\",\"value\":\"Tesla\"},"
                + "{\"type\":\"ticker\",\"value\":\"TSLA\"}]}");

            StepVerifier.create(service.process("Analyze Tesla"))
                .expectNext(new ChatResult(ChatOrchestratorService.NEED_TICKER, "gemini"))
                .verifyComplete();

            verifyNoInteractions(marketDataSource);
        }

        @Test
        @DisplayName("first entity is a ticker without a value → fixed text even if a later entity has one")
        void firstTickerWithoutValue() {
            plannerReply.set("{\"intent\":\"stock_analysis\",\"entities\":[{\"type\":\"ticker\"},"
                + "{\"type\":\"ticker\",\"value\":\"TSLA\"}]}");

            StepVerifier.create(service.process("Analyze TSLA"))
                .expectNext(new ChatResult(ChatOrchestratorService.NEED_TICKER, "gemini"))
                .verifyComplete();

            verifyNoInteractions(marketDataSource);
        }

        @Test
        @DisplayName("gathering fails → fixed no-data text naming the ticker, no synthesis")
        void gatheringFails() {
            plannerReply.set("{\"intent\":\"stock_analysis\",\"entities\":[{\"type\":\"ticker\",\"value\":\"TSLA\"}]}");
            when(marketDataSource.globalQuote("TSLA")).thenReturn(Mono.error(new IllegalStateException("connection reset")));
            when(marketDataSource.companyOverview("TSLA")).thenReturn(Mono.just(json("{}")));
            when(marketDataSource.newsSentiment(any())).thenReturn(Mono.just(json("{}")));

            StepVerifier.create(service.process("Analyze TSLA"))
                .expectNext(new ChatResult("Sorry, I couldn't retrieve financial data for TSLA.", "gemini"))
                .verifyComplete();

            // only the planner call
            verify(completionClient, times(1)).generate(anyList(), anyDouble(), anyInt());
        }
    }

    @Nested
    @DisplayName("market_news")
    class MarketNews {

        @Test
        @DisplayName("news gathered → per-item summaries then one final digest")
        void digest() {
            plannerReply.set("{\"intent\":\"market_news\",\"entities\":[]}");
            when(marketDataSource.newsSentiment(any())).thenReturn(Mono.just(json(
                "{\"feed\":[{\"title\":\"A\",\"summary\":\"a\"},{\"title\":\"B\",\"summary\":\"b\"}]}")));

            StepVerifier.create(service.process("give me the latest market news"))
                .expectNext(new ChatResult("Markets digest.", "gemini"))
                .verifyComplete();

            verify(completionClient).generate(
                argThat(messages -> messages.get(1).content().equals("Market News:\nitem summary\nitem summary")),
                eq(0.5), eq(2048));
        }

        @Test
        @DisplayName("no news → fixed text, no synthesis")
        void noNews() {
            plannerReply.set("{\"intent\":\"market_news\",\"entities\":[]}");
            when(marketDataSource.newsSentiment(any())).thenReturn(Mono.just(json("{\"Information\":\"limit\"}")));

            StepVerifier.create(service.process("market news please"))
                .expectNext(new ChatResult(ChatOrchestratorService.NO_MARKET_NEWS, "gemini"))
                .verifyComplete();

            verify(completionClient, never()).countTokens(anyString());
        }
    }

    @Nested
    @DisplayName("general_chat")
    class GeneralChat {

        @Test
        @DisplayName("greeting → general synthesis capped at 512 tokens, no data fetched")
        void greeting() {
            plannerReply.set("{\"intent\":\"general_chat\",\"entities\":[]}");

            StepVerifier.create(service.process("Hi there"))
                .expectNext(new ChatResult("Hello! How can I help?", "gemini"))
                .verifyComplete();

            verify(completionClient).generate(anyList(), eq(0.5), eq(512));
            verifyNoInteractions(marketDataSource);
        }

        @Test
        @DisplayName("malformed planner reply routes to general chat")
        void malformedPlan() {
            plannerReply.set("Sorry, something went wrong. Please contact the administrator.");

            StepVerifier.create(service.process("Analyze TSLA"))
                .expectNext(new ChatResult("Hello! How can I help?", "gemini"))
                .verifyComplete();

            verifyNoInteractions(marketDataSource);
        }
    }

    @Test
    @DisplayName("same input and same backend answers → equal results")
    void idempotent() {
        plannerReply.set("{\"intent\":\"stock_analysis\",\"entities\":[{\"type\":\"ticker\",\"value\":\"TSLA\"}]}");
        stockDataAvailable();

        ChatResult first  = service.process("Analyze TSLA").block();
        ChatResult second = service.process("Analyze TSLA").block();

        assertEquals(first, second);
    }

    @Test
    @DisplayName("unanticipated synthesis error propagates to the caller")
    void unanticipatedErrorPropagates() {
        plannerReply.set("{\"intent\":\"general_chat\",\"entities\":[]}");
        doReturn(Mono.error(new ChatPipelineException("SYNTHESIZING", "backend exploded")))
            .when(completionClient).generate(anyList(), eq(0.5), eq(512));

        StepVerifier.create(service.process("Hi there"))
            .expectErrorMatches(e -> e instanceof ChatPipelineException
                && e.getMessage().contains("backend exploded"))
            .verify();
    }
}
