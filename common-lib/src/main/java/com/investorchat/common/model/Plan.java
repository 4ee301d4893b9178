package com.investorchat.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Output of the planner — one per request, never mutated after creation.
 *
 * <p>{@link #generalChat()} is the single fallback for any malformed planner output.
 */
public record Plan(
    @JsonProperty("intent")   Intent intent,
    @JsonProperty("entities") List<Entity> entities
) {
    public Plan {
        intent   = intent != null ? intent : Intent.GENERAL_CHAT;
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    public static Plan generalChat() {
        return new Plan(Intent.GENERAL_CHAT, List.of());
    }

    /**
     * The ticker symbol, only when the first entity is a ticker with a non-blank value.
     * Later entities are ignored even if they are tickers.
     */
    public Optional<String> ticker() {
        if (entities.isEmpty()) return Optional.empty();
        Entity first = entities.get(0);
        if (!first.isTicker() || first.value() == null || first.value().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(first.value().trim());
    }
}
