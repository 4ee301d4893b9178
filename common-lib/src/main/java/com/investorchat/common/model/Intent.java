package com.investorchat.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classified purpose of a user utterance, produced by the planner.
 *
 * <p>Wire names are the lowercase tokens the routing prompt asks the model to emit.
 * Anything unrecognised resolves to {@link #GENERAL_CHAT}.
 */
public enum Intent {
    STOCK_ANALYSIS("stock_analysis"),
    MARKET_NEWS("market_news"),
    GENERAL_CHAT("general_chat");

    private final String wireName;

    Intent(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Intent fromWire(String value) {
        if (value == null) return GENERAL_CHAT;
        for (Intent intent : values()) {
            if (intent.wireName.equals(value.trim())) {
                return intent;
            }
        }
        return GENERAL_CHAT;
    }
}
