package com.investorchat.orchestrator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investorchat.common.completion.ChatMessage;
import com.investorchat.common.completion.TokenCount;
import com.investorchat.common.exception.ChatPipelineException;
import com.investorchat.common.model.NewsDigestState;
import com.investorchat.common.model.NewsItem;
import com.investorchat.common.model.StockPayload;
import com.investorchat.orchestrator.ai.CompletionClient;
import com.investorchat.orchestrator.logger.ChatFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Final natural-language generation for each intent.
 *
 * <p><strong>News digest</strong>: items are summarised one at a time, in provider order.
 * Each candidate summary is measured with the backend's token counter and appended only
 * while the accumulated count stays within {@code maxTokens}; the first candidate that
 * would exceed it ends the loop and later items are never summarised. After each append
 * the whole accumulated text is re-measured. A second, coarser call then rewrites the
 * accumulated summaries into one digest.
 *
 * <p>When a count is unavailable the loop stops without appending that candidate, so the
 * budget can never be exceeded on an unmeasured summary.
 *
 * <p>Digest state is local to each call; nothing is shared between requests.
 */
@Component
public class ResponseSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseSynthesizer.class);

    static final double TEMPERATURE        = 0.5;
    static final int    GENERAL_MAX_TOKENS = 512;

    static final String ANSWER_ONLY_INSTRUCTION =
        "Only provide the answer content. Do not include meta commentary, disclaimers, "
        + "or statements about tokens or formatting.";

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    private final int maxTokens;

    public ResponseSynthesizer(CompletionClient completionClient, ObjectMapper objectMapper,
                               @Value("${chat.synthesis.max-tokens:1024}") int maxTokens) {
        this.completionClient = completionClient;
        this.objectMapper     = objectMapper;
        this.maxTokens        = maxTokens;
    }

    // ── stock_analysis ────────────────────────────────────────────────────────

    public Mono<String> synthesizeStock(String ticker, StockPayload payload) {
        return Mono.fromCallable(() -> objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload))
            .onErrorMap(JsonProcessingException.class, e -> serializationFailure("stock payload for " + ticker, e))
            .flatMap(json -> completionClient.generate(List.of(
                    ChatMessage.system(stockInstruction()),
                    ChatMessage.user("Data for " + ticker + ":\n" + json)),
                TEMPERATURE, maxTokens))
            .doOnNext(text -> log.info("[Synthesizer] stock analysis synthesized. ticker={} length={}", ticker, text.length()));
    }

    // ── market_news ───────────────────────────────────────────────────────────

    public Mono<String> synthesizeNewsDigest(String userText, List<NewsItem> items) {
        return digest(items)
            .flatMap(state -> {
                if (state.isEmpty()) {
                    log.warn("[Synthesizer] no news summary fit the token budget. budget={}", maxTokens);
                } else {
                    log.info("[Synthesizer] news digest accumulated. tokens={} budget={}",
                             state.accumulatedTokenCount(), maxTokens);
                }
                return completionClient.generate(List.of(
                        ChatMessage.system(finalDigestInstruction(userText)),
                        ChatMessage.user("Market News:\n" + state.accumulatedText())),
                    TEMPERATURE, maxTokens * 2);
            });
    }

    /** Runs the per-item summarisation loop and returns the final accumulated state. */
    Mono<NewsDigestState> digest(List<NewsItem> items) {
        return digestFrom(items, 0, NewsDigestState.empty());
    }

    private Mono<NewsDigestState> digestFrom(List<NewsItem> items, int index, NewsDigestState state) {
        if (index >= items.size()) {
            return Mono.just(state);
        }
        NewsItem item = items.get(index);

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(item))
            .onErrorMap(JsonProcessingException.class, e -> serializationFailure("news item " + (index + 1), e))
            .flatMap(json -> completionClient.generate(List.of(
                    ChatMessage.system(newsItemInstruction()),
                    ChatMessage.user("Market News:\n" + json)),
                TEMPERATURE, maxTokens))
            .flatMap(candidate -> completionClient.countTokens(candidate)
                .flatMap(candidateCount -> {
                    if (!candidateCount.isAvailable()) {
                        log.warn("[Synthesizer] token count unavailable — stopping digest at item {}", index + 1);
                        return Mono.just(state);
                    }
                    if (!state.admits(candidateCount.value(), maxTokens)) {
                        log.info("[Synthesizer] token budget reached — stopping digest at item {} ({} + {} > {})",
                                 index + 1, state.accumulatedTokenCount(), candidateCount.value(), maxTokens);
                        return Mono.just(state);
                    }
                    String joined = state.joinedWith(candidate);
                    return completionClient.countTokens(joined)
                        .flatMap(total -> appendMeasured(items, index, state, joined, total));
                }));
    }

    private Mono<NewsDigestState> appendMeasured(List<NewsItem> items, int index, NewsDigestState state,
                                                 String joined, TokenCount total) {
        if (!total.isAvailable()) {
            log.warn("[Synthesizer] re-measure unavailable — discarding item {} and stopping digest", index + 1);
            return Mono.just(state);
        }
        log.debug("[Synthesizer] item {} appended. accumulatedTokens={}", index + 1, total.value());
        return digestFrom(items, index + 1, state.measured(joined, total.value()));
    }

    private static ChatPipelineException serializationFailure(String what, JsonProcessingException e) {
        return new ChatPipelineException(ChatFlowLogger.SYNTHESIZING, "failed to serialize " + what, e);
    }

    // ── general_chat ──────────────────────────────────────────────────────────

    public Mono<String> synthesizeGeneral(String userText) {
        return completionClient.generate(List.of(
                ChatMessage.system(generalInstruction()),
                ChatMessage.user(userText)),
            TEMPERATURE, GENERAL_MAX_TOKENS);
    }

    // ── instructions ──────────────────────────────────────────────────────────

    String stockInstruction() {
        return "You are a smart stock analyst. Synthesize the following data into a concise analysis "
            + "for a retail investor. Start the response directly with the analysis. Format response and "
            + "provide response less than " + maxTokens + " tokens. " + ANSWER_ONLY_INSTRUCTION;
    }

    String newsItemInstruction() {
        return "You are a financial news assistant. Summarize the following market news headlines and "
            + "summaries into a clear, easy-to-read list for a general audience. Format response and "
            + "provide response less than " + maxTokens + " tokens. " + ANSWER_ONLY_INSTRUCTION;
    }

    String finalDigestInstruction(String userText) {
        return "You are a financial news assistant. " + userText + " Summarize the following market news "
            + "headlines and summaries into a clear, easy-to-read list for a general audience. Format "
            + "response and provide response less than " + maxTokens + " tokens. " + ANSWER_ONLY_INSTRUCTION;
    }

    String generalInstruction() {
        return "You are a financial assistant. You can provide a detailed analysis of a stock if given a "
            + "ticker (e.g., 'analyze TSLA') or provide the latest general market news. For other topics, "
            + "act as a helpful assistant. Format response and provide response less than " + maxTokens
            + " tokens. " + ANSWER_ONLY_INSTRUCTION;
    }
}
