package com.investorchat.common.completion;

import java.util.NoSuchElementException;

/**
 * Best-effort token count: either a measured value or {@code unavailable}.
 *
 * <p>Replaces a {@code -1} sentinel so that callers have to branch on
 * {@link #isAvailable()} before reading the value.
 */
public final class TokenCount {

    private static final TokenCount UNAVAILABLE = new TokenCount(-1);

    private final int value;

    private TokenCount(int value) {
        this.value = value;
    }

    public static TokenCount of(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("token count must be >= 0, was " + value);
        }
        return new TokenCount(value);
    }

    public static TokenCount unavailable() {
        return UNAVAILABLE;
    }

    public boolean isAvailable() {
        return value >= 0;
    }

    /** @throws NoSuchElementException when the count is unavailable */
    public int value() {
        if (!isAvailable()) {
            throw new NoSuchElementException("token count unavailable");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenCount other)) return false;
        return value == other.value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return isAvailable() ? "TokenCount[" + value + "]" : "TokenCount[unavailable]";
    }
}
