package com.investorchat.orchestrator.client;

/** Parameters for a news-sentiment lookup; null fields are left off the request. */
public record NewsQuery(String tickers, String topics, Integer limit, String sort) {

    public static NewsQuery forTicker(String ticker, int limit) {
        return new NewsQuery(ticker, null, limit, null);
    }

    public static NewsQuery forTopic(String topic, int limit) {
        return new NewsQuery(null, topic, limit, null);
    }
}
