package com.investorchat.orchestrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports missing provider credentials once, at startup.
 *
 * <p>The application still starts: calls needing a missing credential answer with a
 * "not configured" text (Gemini) or the no-data message (Alpha Vantage).
 */
@Configuration
public class CredentialsValidator {

    private static final Logger log = LoggerFactory.getLogger(CredentialsValidator.class);

    @Value("${gemini.api-key:}")
    private String geminiApiKey;

    @Value("${alpha-vantage.api-key:}")
    private String alphaVantageApiKey;

    @EventListener(ContextRefreshedEvent.class)
    public void validate() {
        List<String> missing = missingCredentials(geminiApiKey, alphaVantageApiKey);
        missing.forEach(name -> log.error("{} is not set — dependent chat features will answer with a fallback message", name));
        if (missing.isEmpty()) {
            log.info("Provider credentials configured. gemini=true alphaVantage=true");
        }
    }

    static List<String> missingCredentials(String geminiApiKey, String alphaVantageApiKey) {
        List<String> missing = new ArrayList<>();
        if (geminiApiKey == null || geminiApiKey.isBlank()) missing.add("GEMINI_API_KEY");
        if (alphaVantageApiKey == null || alphaVantageApiKey.isBlank()) missing.add("ALPHA_VANTAGE_API_KEY");
        return missing;
    }
}
