package com.investorchat.orchestrator.controller;

import com.investorchat.common.exception.ChatPipelineException;
import com.investorchat.common.model.ChatResult;
import com.investorchat.orchestrator.service.ChatOrchestratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ChatControllerTest {

    private ChatOrchestratorService orchestratorService;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        orchestratorService = mock(ChatOrchestratorService.class);
        webTestClient = WebTestClient.bindToController(new ChatController(orchestratorService)).build();
    }

    @Test
    @DisplayName("POST /api/chat → response and backend")
    void chat() {
        when(orchestratorService.process("Hi there")).thenReturn(Mono.just(new ChatResult("Hello!", "gemini")));

        webTestClient.post().uri("/api/chat")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"text\":\"Hi there\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.response").isEqualTo("Hello!")
            .jsonPath("$.backend").isEqualTo("gemini");
    }

    @Test
    @DisplayName("missing text → 400, pipeline not invoked")
    void missingText() {
        webTestClient.post().uri("/api/chat")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.detail").isEqualTo("text is required");

        verify(orchestratorService, never()).process(anyString());
    }

    @Test
    @DisplayName("pipeline error → 500 with detail")
    void pipelineError() {
        when(orchestratorService.process(anyString()))
            .thenReturn(Mono.error(new ChatPipelineException("SYNTHESIZING", "boom")));

        webTestClient.post().uri("/api/chat")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"text\":\"Hi\"}")
            .exchange()
            .expectStatus().is5xxServerError()
            .expectBody()
            .jsonPath("$.detail").isEqualTo("[SYNTHESIZING] boom");
    }

    @Test
    void health() {
        webTestClient.get().uri("/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("ok");
    }
}
