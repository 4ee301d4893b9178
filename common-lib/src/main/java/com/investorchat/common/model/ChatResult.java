package com.investorchat.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminal artifact of one chat request.
 *
 * @param responseText reader-facing answer (or one of the fixed fallback texts)
 * @param backend      identifier of the completion backend that served the request
 */
public record ChatResult(
    @JsonProperty("response") String responseText,
    @JsonProperty("backend")  String backend
) {}
