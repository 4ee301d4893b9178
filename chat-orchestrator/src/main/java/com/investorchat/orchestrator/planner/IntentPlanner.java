package com.investorchat.orchestrator.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investorchat.common.completion.ChatMessage;
import com.investorchat.common.model.Entity;
import com.investorchat.common.model.Intent;
import com.investorchat.common.model.Plan;
import com.investorchat.orchestrator.ai.CompletionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Routing step: one deterministic completion call that classifies the utterance into an
 * {@link Intent} and extracts ticker entities.
 *
 * <p>Planning never fails a request. Anything other than a JSON object with a textual
 * {@code intent} yields {@link Plan#generalChat()}. The call is not retried.
 */
@Component
public class IntentPlanner {

    private static final Logger log = LoggerFactory.getLogger(IntentPlanner.class);

    static final double TEMPERATURE       = 0.0;
    static final int    MAX_OUTPUT_TOKENS = 1000;

    static final String ROUTING_INSTRUCTION = """
        You are a routing agent. Analyze the user's request and output a JSON plan. \
        Possible intents are 'stock_analysis', 'market_news', and 'general_chat'. \
        The entity type is 'ticker'. Only output the JSON plan. Examples:
        User: 'Analyze Tesla (TSLA)' -> {"intent": "stock_analysis", "entities": [{"type": "ticker", "value": "TSLA"}]}
        User: 'give me the latest market news' -> {"intent": "market_news", "entities": []}
        User: 'Hi there' -> {"intent": "general_chat", "entities": []}""";

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;

    public IntentPlanner(CompletionClient completionClient, ObjectMapper objectMapper) {
        this.completionClient = completionClient;
        this.objectMapper     = objectMapper;
    }

    public Mono<Plan> plan(String userText) {
        List<ChatMessage> messages = List.of(
            ChatMessage.system(ROUTING_INSTRUCTION),
            ChatMessage.user(userText));

        return completionClient.generate(messages, TEMPERATURE, MAX_OUTPUT_TOKENS)
            .map(this::parsePlan)
            .defaultIfEmpty(Plan.generalChat())
            .doOnNext(plan -> log.info("[Planner] intent={} entities={}", plan.intent().wireName(), plan.entities().size()))
            .onErrorResume(e -> {
                log.warn("[Planner] completion call failed — falling back to general_chat. reason={}", e.getMessage());
                return Mono.just(Plan.generalChat());
            });
    }

    Plan parsePlan(String raw) {
        if (raw == null) {
            return Plan.generalChat();
        }
        try {
            JsonNode root = objectMapper.readTree(stripCodeFence(raw));
            if (root == null || !root.isObject() || !root.path("intent").isTextual()) {
                log.warn("[Planner] plan has no textual intent — falling back to general_chat. raw={}", raw);
                return Plan.generalChat();
            }
            return new Plan(Intent.fromWire(root.get("intent").asText()), readEntities(root.path("entities")));
        } catch (JsonProcessingException e) {
            log.warn("[Planner] failed to decode JSON — falling back to general_chat. reason={} raw={}",
                     e.getOriginalMessage(), raw);
            return Plan.generalChat();
        }
    }

    /**
     * Keeps every entry in position so the ticker rule always inspects the planner's first
     * entity; non-textual or missing fields become {@code null}.
     */
    private static List<Entity> readEntities(JsonNode entities) {
        List<Entity> result = new ArrayList<>();
        if (!entities.isArray()) return result;
        for (JsonNode e : entities) {
            result.add(new Entity(textOrNull(e.path("type")), textOrNull(e.path("value"))));
        }
        return result;
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }

    /** Removes a leading {@code ```json} (or bare {@code ```}) fence and its closing fence. */
    static String stripCodeFence(String raw) {
        String cleaned = raw.strip();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring("```json".length());
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring("```".length());
        } else {
            return cleaned;
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - "```".length());
        }
        return cleaned.strip();
    }
}
