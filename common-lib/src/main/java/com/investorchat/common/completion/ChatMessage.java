package com.investorchat.common.completion;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Role-tagged message sent to the completion backend. */
public record ChatMessage(
    @JsonProperty("role")    Role role,
    @JsonProperty("content") String content
) {
    public enum Role { SYSTEM, USER }

    public static ChatMessage system(String content) {
        return new ChatMessage(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }
}
