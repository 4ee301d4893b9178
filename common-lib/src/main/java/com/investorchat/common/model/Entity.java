package com.investorchat.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured value extracted from the user's text during planning.
 * Only {@code ticker} entities are acted on today.
 */
public record Entity(
    @JsonProperty("type")  String type,
    @JsonProperty("value") String value
) {
    public static final String TICKER = "ticker";

    public boolean isTicker() {
        return TICKER.equals(type);
    }
}
