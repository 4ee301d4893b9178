package com.investorchat.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

@Configuration
public class OrchestratorConfig {

    // Comma-separated exact origins; when blank the regex below applies instead.
    @Value("${chat.cors.allow-origins:}")
    private String allowOrigins;

    @Value("${chat.cors.allow-origin-regex:https?://(localhost|127\\.0\\.0\\.1)(:\\d+)?}")
    private String allowOriginRegex;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    public CorsWebFilter corsWebFilter() {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", corsConfiguration(allowOrigins, allowOriginRegex));
        return new CorsWebFilter(source);
    }

    static CorsConfiguration corsConfiguration(String allowOrigins, String allowOriginRegex) {
        List<String> origins = Arrays.stream(allowOrigins.split(","))
            .map(String::trim)
            .filter(o -> !o.isEmpty())
            .toList();

        CorsConfiguration cors = origins.isEmpty()
            ? new RegexOriginCorsConfiguration(Pattern.compile(allowOriginRegex))
            : new CorsConfiguration();
        if (!origins.isEmpty()) {
            cors.setAllowedOrigins(origins);
        }
        cors.setAllowCredentials(true);
        cors.addAllowedMethod(CorsConfiguration.ALL);
        cors.addAllowedHeader(CorsConfiguration.ALL);
        return cors;
    }

    /** Spring origin patterns are globs, so full-regex matching needs its own check. */
    static class RegexOriginCorsConfiguration extends CorsConfiguration {

        private final Pattern originPattern;

        RegexOriginCorsConfiguration(Pattern originPattern) {
            this.originPattern = originPattern;
        }

        @Override
        public String checkOrigin(String origin) {
            return origin != null && originPattern.matcher(origin).matches() ? origin : null;
        }
    }
}
