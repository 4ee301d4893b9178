package com.investorchat.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.investorchat.common.completion.CompletionReply;

import java.util.Set;

/**
 * Collapses a {@code generateContent} reply into a {@link CompletionReply}.
 *
 * <p>Order of inspection: top-level {@code text}, first candidate's text parts, candidate
 * finish reason, prompt feedback. Non-text parts (inline data, function calls) are ignored.
 */
public final class GeminiResponseDecoder {

    private static final Set<String> BLOCKING_FINISH_REASONS =
        Set.of("SAFETY", "PROHIBITED_CONTENT", "BLOCKLIST", "SPII");

    private GeminiResponseDecoder() {}

    public static CompletionReply decode(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return CompletionReply.empty("no body");
        }

        JsonNode topLevelText = root.path("text");
        if (topLevelText.isTextual() && !topLevelText.asText().isBlank()) {
            return CompletionReply.plainText(topLevelText.asText());
        }

        String finishReason = null;
        JsonNode candidates = root.path("candidates");
        if (candidates.isArray() && candidates.size() > 0) {
            JsonNode first = candidates.get(0);
            finishReason = first.path("finishReason").asText(null);

            StringBuilder text = new StringBuilder();
            for (JsonNode part : first.path("content").path("parts")) {
                JsonNode partText = part.path("text");
                if (partText.isTextual()) {
                    text.append(partText.asText());
                }
            }
            String joined = text.toString().strip();
            if (!joined.isEmpty()) {
                return CompletionReply.candidates(joined);
            }
            if (finishReason != null && BLOCKING_FINISH_REASONS.contains(finishReason.toUpperCase())) {
                return CompletionReply.blocked("finishReason=" + finishReason);
            }
        }

        JsonNode blockReason = root.path("promptFeedback").path("blockReason");
        if (!blockReason.isMissingNode() && !blockReason.isNull()) {
            return CompletionReply.blocked("blockReason=" + blockReason.asText());
        }

        return CompletionReply.empty(finishReason != null ? "finishReason=" + finishReason : "no candidates");
    }
}
