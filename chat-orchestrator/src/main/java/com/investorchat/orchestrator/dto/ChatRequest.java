package com.investorchat.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChatRequest(
    @JsonProperty("text") String text
) {}
