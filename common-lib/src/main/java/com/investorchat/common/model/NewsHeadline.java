package com.investorchat.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Ticker-scoped headline with the provider's overall sentiment label. */
public record NewsHeadline(
    @JsonProperty("title")     String title,
    @JsonProperty("sentiment") String sentiment
) {}
