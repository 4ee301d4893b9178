package com.investorchat.common.completion;

/**
 * Decoded shape of a completion backend reply.
 *
 * <p>The decode step at the client boundary collapses every reply into one of four kinds,
 * so planner and synthesizer only ever see usable text or a fixed fallback string.
 * {@code text} is non-null only for {@link Kind#PLAIN_TEXT} and
 * {@link Kind#STRUCTURED_CANDIDATES}; {@code detail} carries the block or finish reason
 * for logging.
 */
public record CompletionReply(Kind kind, String text, String detail) {

    public enum Kind {
        /** Reply exposed a top-level text field. */
        PLAIN_TEXT,
        /** Text assembled from the first candidate's content parts. */
        STRUCTURED_CANDIDATES,
        /** Safety filtering blocked the prompt or the candidate. */
        BLOCKED,
        /** Nothing usable (e.g. truncated before emitting text). */
        EMPTY
    }

    public static CompletionReply plainText(String text) {
        return new CompletionReply(Kind.PLAIN_TEXT, text, null);
    }

    public static CompletionReply candidates(String text) {
        return new CompletionReply(Kind.STRUCTURED_CANDIDATES, text, null);
    }

    public static CompletionReply blocked(String reason) {
        return new CompletionReply(Kind.BLOCKED, null, reason);
    }

    public static CompletionReply empty(String reason) {
        return new CompletionReply(Kind.EMPTY, null, reason);
    }

    public boolean hasText() {
        return kind == Kind.PLAIN_TEXT || kind == Kind.STRUCTURED_CANDIDATES;
    }
}
