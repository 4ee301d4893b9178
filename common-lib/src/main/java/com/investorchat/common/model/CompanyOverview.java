package com.investorchat.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CompanyOverview(
    @JsonProperty("market_cap")   String marketCap,
    @JsonProperty("pe_ratio")     String peRatio,
    @JsonProperty("eps")          String eps,
    @JsonProperty("52_week_high") String week52High,
    @JsonProperty("52_week_low")  String week52Low
) {}
