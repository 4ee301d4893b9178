package com.investorchat.orchestrator.ai;

import com.investorchat.common.completion.ChatMessage;
import com.investorchat.common.completion.TokenCount;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Text-generation backend as seen by the planner and the synthesizer.
 *
 * <p>Implementations never signal errors from {@link #generate}: blocked, empty or failed
 * generations complete with a fixed apologetic string. {@link #countTokens} completes with
 * {@link TokenCount#unavailable()} instead of failing.
 */
public interface CompletionClient {

    Mono<String> generate(List<ChatMessage> messages, double temperature, int maxOutputTokens);

    Mono<TokenCount> countTokens(String text);

    /** Fixed identifier reported to callers as the serving backend. */
    String backendId();
}
