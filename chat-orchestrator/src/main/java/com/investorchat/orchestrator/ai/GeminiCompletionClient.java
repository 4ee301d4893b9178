package com.investorchat.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investorchat.common.completion.ChatMessage;
import com.investorchat.common.completion.CompletionReply;
import com.investorchat.common.completion.TokenCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gemini {@code generateContent} / {@code countTokens} over the REST API.
 *
 * <p><strong>Fallback behaviour</strong>: {@link #generate} never errors. A missing API key,
 * a blocked or empty reply, and any transport failure each complete with a fixed string,
 * so a backend problem degrades the answer instead of failing the request.
 * {@link #countTokens} degrades to {@link TokenCount#unavailable()}.
 *
 * <p>Stateless apart from configuration; one instance serves all concurrent requests.
 */
public class GeminiCompletionClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiCompletionClient.class);

    public static final String BACKEND_ID = "gemini";

    static final String NOT_CONFIGURED = "Gemini API is not configured. Set GEMINI_API_KEY and restart.";
    static final String BLOCKED        = "Sorry, I can’t respond to that request due to safety policies. Please try rephrasing.";
    static final String EMPTY          = "I'm sorry, I didn't understand that. Can you rephrase?";
    static final String FAILED         = "Sorry, something went wrong. Please contact the administrator.";

    private final WebClient geminiClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final Duration timeout;
    private final boolean logPrompts;

    public GeminiCompletionClient(WebClient geminiClient, ObjectMapper objectMapper,
                                  String apiKey, String model, long timeoutMs, boolean logPrompts) {
        this.geminiClient = geminiClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
        this.model        = model;
        this.timeout      = Duration.ofMillis(timeoutMs);
        this.logPrompts   = logPrompts;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String backendId() {
        return BACKEND_ID;
    }

    @Override
    public Mono<String> generate(List<ChatMessage> messages, double temperature, int maxOutputTokens) {
        if (!isConfigured()) {
            log.warn("[Gemini] No API key configured — returning not-configured message");
            return Mono.just(NOT_CONFIGURED);
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(
                buildGenerateRequest(messages, temperature, maxOutputTokens)))
            .doOnNext(body -> logRequest(messages, temperature, maxOutputTokens))
            .flatMap(bodyJson ->
                geminiClient.post()
                    .uri("/v1beta/models/{model}:generateContent", model)
                    .header("x-goog-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout))
            .map(this::decode)
            .map(this::toText)
            .defaultIfEmpty(EMPTY)
            .onErrorResume(e -> {
                log.error("[Gemini] generateContent failed. model={} reason={}", model, e.getMessage());
                return Mono.just(FAILED);
            });
    }

    @Override
    public Mono<TokenCount> countTokens(String text) {
        if (!isConfigured()) {
            return Mono.just(TokenCount.unavailable());
        }
        Map<String, Object> requestBody = Map.of(
            "contents", List.of(Map.of("parts", List.of(Map.of("text", text != null ? text : ""))))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                geminiClient.post()
                    .uri("/v1beta/models/{model}:countTokens", model)
                    .header("x-goog-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout))
            .map(response -> {
                try {
                    JsonNode total = objectMapper.readTree(response).path("totalTokens");
                    return total.canConvertToInt() && total.asInt() >= 0
                        ? TokenCount.of(total.asInt())
                        : TokenCount.unavailable();
                } catch (Exception e) {
                    throw new IllegalStateException("Failed to read countTokens response", e);
                }
            })
            .defaultIfEmpty(TokenCount.unavailable())
            .onErrorResume(e -> {
                log.debug("[Gemini] countTokens failed. model={} reason={}", model, e.getMessage());
                return Mono.just(TokenCount.unavailable());
            });
    }

    // ── request / response mapping ────────────────────────────────────────────

    /**
     * System messages become {@code systemInstruction}; user messages are joined into a
     * single user turn. Both joins use a blank line.
     */
    Map<String, Object> buildGenerateRequest(List<ChatMessage> messages, double temperature, int maxOutputTokens) {
        String systemPrompt = join(messages, ChatMessage.Role.SYSTEM);
        String userPrompt   = join(messages, ChatMessage.Role.USER);

        Map<String, Object> body = new LinkedHashMap<>();
        if (!systemPrompt.isEmpty()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemPrompt))));
        }
        body.put("contents", List.of(Map.of(
            "role", "user",
            "parts", List.of(Map.of("text", userPrompt)))));
        body.put("generationConfig", Map.of(
            "temperature", temperature,
            "maxOutputTokens", maxOutputTokens));
        return body;
    }

    private static String join(List<ChatMessage> messages, ChatMessage.Role role) {
        return messages.stream()
            .filter(m -> m.role() == role)
            .map(ChatMessage::content)
            .collect(Collectors.joining("\n\n"));
    }

    private CompletionReply decode(String response) {
        try {
            return GeminiResponseDecoder.decode(objectMapper.readTree(response));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse Gemini response", e);
        }
    }

    private String toText(CompletionReply reply) {
        if (reply.hasText()) {
            log.debug("[Gemini] response kind={} preview={}", reply.kind(), preview(reply.text()));
            return reply.text();
        }
        if (reply.kind() == CompletionReply.Kind.BLOCKED) {
            log.warn("[Gemini] response blocked by safety. {}", reply.detail());
            return BLOCKED;
        }
        log.debug("[Gemini] response empty ({}) — returning default message", reply.detail());
        return EMPTY;
    }

    private void logRequest(List<ChatMessage> messages, double temperature, int maxOutputTokens) {
        if (!log.isDebugEnabled()) return;
        if (logPrompts) {
            log.debug("[Gemini] request model={} temp={} maxTokens={} system={} user={}",
                model, temperature, maxOutputTokens,
                join(messages, ChatMessage.Role.SYSTEM), join(messages, ChatMessage.Role.USER));
        } else {
            log.debug("[Gemini] request model={} messages={} systemLen={} userLen={} temp={} maxTokens={}",
                model, messages.size(), join(messages, ChatMessage.Role.SYSTEM).length(),
                join(messages, ChatMessage.Role.USER).length(), temperature, maxOutputTokens);
        }
    }

    private static String preview(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200);
    }
}
