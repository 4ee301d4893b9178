package com.investorchat.common.model;

/**
 * Running state of the news digest loop for a single request.
 *
 * <p>{@code accumulatedTokenCount} is always the measured token count of
 * {@code accumulatedText}; callers re-measure after every append and hand the result to
 * {@link #measured(String, int)} instead of summing per-item counts.
 * Instances are immutable and never shared across requests.
 */
public record NewsDigestState(String accumulatedText, int accumulatedTokenCount) {

    public static NewsDigestState empty() {
        return new NewsDigestState("", 0);
    }

    /** True when a candidate of {@code candidateTokens} still fits under {@code budget}. */
    public boolean admits(int candidateTokens, int budget) {
        return accumulatedTokenCount + candidateTokens <= budget;
    }

    /** Newline-joined text that would result from appending {@code candidate}. */
    public String joinedWith(String candidate) {
        return accumulatedText.isEmpty() ? candidate : accumulatedText + "\n" + candidate;
    }

    public NewsDigestState measured(String text, int tokenCount) {
        return new NewsDigestState(text, tokenCount);
    }

    public boolean isEmpty() {
        return accumulatedText.isEmpty();
    }
}
