package com.investorchat.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatOrchestratorApplication.class, args);
    }
}
