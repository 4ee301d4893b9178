package com.investorchat.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** General market news entry fed to the digest loop, in provider order. */
public record NewsItem(
    @JsonProperty("title")   String title,
    @JsonProperty("summary") String summary
) {}
