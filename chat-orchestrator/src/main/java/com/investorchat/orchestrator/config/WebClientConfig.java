package com.investorchat.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.investorchat.orchestrator.ai.CompletionClient;
import com.investorchat.orchestrator.ai.GeminiCompletionClient;
import com.investorchat.orchestrator.client.AlphaVantageClient;
import com.investorchat.orchestrator.client.MarketDataSource;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    // ── Alpha Vantage ────────────────────────────────────────────────────────
    @Value("${alpha-vantage.base-url:https://www.alphavantage.co}")
    private String alphaVantageBaseUrl;

    @Value("${alpha-vantage.api-key:}")
    private String alphaVantageApiKey;

    @Value("${chat.logging.http-body:false}")
    private boolean logHttpBody;

    // ── Gemini ───────────────────────────────────────────────────────────────
    @Value("${gemini.base-url:https://generativelanguage.googleapis.com}")
    private String geminiBaseUrl;

    @Value("${gemini.api-key:}")
    private String geminiApiKey;

    @Value("${gemini.model:gemini-2.5-flash}")
    private String geminiModel;

    @Value("${gemini.timeout-ms:30000}")
    private long geminiTimeoutMs;

    @Value("${chat.logging.llm-prompts:false}")
    private boolean logLlmPrompts;

    @Bean
    public WebClient alphaVantageWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(alphaVantageBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient(15)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public MarketDataSource alphaVantageClient(@Qualifier("alphaVantageWebClient") WebClient alphaVantageWebClient) {
        return new AlphaVantageClient(alphaVantageWebClient, alphaVantageApiKey, logHttpBody);
    }

    @Bean
    public WebClient geminiWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(geminiBaseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient(60)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public CompletionClient geminiCompletionClient(@Qualifier("geminiWebClient") WebClient geminiWebClient,
                                                    ObjectMapper objectMapper) {
        return new GeminiCompletionClient(geminiWebClient, objectMapper,
            geminiApiKey, geminiModel, geminiTimeoutMs, logLlmPrompts);
    }

    private static HttpClient httpClient(int readTimeoutSeconds) {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String uri = clientRequest.url().toString();
            String sanitized = uri.replaceAll("(apikey|key)=[^&]+", "$1=***");
            LoggerFactory.getLogger(WebClientConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
