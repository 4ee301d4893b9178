package com.investorchat.orchestrator.controller;

import com.investorchat.orchestrator.dto.ChatRequest;
import com.investorchat.orchestrator.service.ChatOrchestratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final ChatOrchestratorService orchestratorService;

    public ChatController(ChatOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/api/chat")
    public Mono<ResponseEntity<?>> chat(@RequestBody ChatRequest request) {
        if (request == null || request.text() == null) {
            return Mono.just(ResponseEntity.badRequest().body(Map.of("detail", "text is required")));
        }
        return orchestratorService.process(request.text())
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("Chat endpoint failed", e);
                String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                return Mono.just(ResponseEntity.internalServerError().body(Map.of("detail", detail)));
            });
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        log.debug("Health check endpoint hit");
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
