package com.investorchat.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.investorchat.common.model.CompanyOverview;
import com.investorchat.common.model.NewsHeadline;
import com.investorchat.common.model.NewsItem;
import com.investorchat.common.model.StockPayload;
import com.investorchat.common.model.StockQuote;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps provider bodies to payload sections. Each method returns {@code null} when the
 * body lacks the section's key, so a notice object simply omits that section.
 */
final class AlphaVantageMapper {

    private static final List<String> OVERVIEW_FIELDS =
        List.of("MarketCapitalization", "PERatio", "EPS", "52WeekHigh", "52WeekLow");

    private AlphaVantageMapper() {}

    static StockQuote toQuote(JsonNode body) {
        if (!body.has("Global Quote")) return null;
        JsonNode quote = body.path("Global Quote");
        return new StockQuote(text(quote, "05. price"), text(quote, "10. change percent"), text(quote, "06. volume"));
    }

    static CompanyOverview toOverview(JsonNode body) {
        if (OVERVIEW_FIELDS.stream().noneMatch(body::has)) return null;
        return new CompanyOverview(
            text(body, "MarketCapitalization"),
            text(body, "PERatio"),
            text(body, "EPS"),
            text(body, "52WeekHigh"),
            text(body, "52WeekLow"));
    }

    static List<NewsHeadline> toHeadlines(JsonNode body) {
        if (!body.has("feed")) return null;
        List<NewsHeadline> headlines = new ArrayList<>();
        for (JsonNode item : body.path("feed")) {
            if (headlines.size() == StockPayload.MAX_HEADLINES) break;
            headlines.add(new NewsHeadline(text(item, "title"), text(item, "overall_sentiment_label")));
        }
        return headlines;
    }

    /** Feed entries in provider order, capped at {@code limit}; empty when there is no feed. */
    static List<NewsItem> toNewsItems(JsonNode body, int limit) {
        List<NewsItem> items = new ArrayList<>();
        for (JsonNode item : body.path("feed")) {
            if (items.size() == limit) break;
            items.add(new NewsItem(text(item, "title"), text(item, "summary")));
        }
        return items;
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
