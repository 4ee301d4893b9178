package com.investorchat.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Latest quote fields as reported by the provider (kept as provider strings). */
public record StockQuote(
    @JsonProperty("price")          String price,
    @JsonProperty("change_percent") String changePercent,
    @JsonProperty("volume")         String volume
) {}
