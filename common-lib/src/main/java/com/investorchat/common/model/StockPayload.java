package com.investorchat.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Consolidated data for one ticker, merged from up to three independent fetches.
 *
 * <p>Each section is nullable: a fetch that succeeded but carried no usable data omits
 * only its own section. {@code news} holds at most {@link #MAX_HEADLINES} entries.
 * Owned by a single request and discarded after synthesis.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StockPayload(
    @JsonProperty("quote")    StockQuote quote,
    @JsonProperty("overview") CompanyOverview overview,
    @JsonProperty("news")     List<NewsHeadline> news
) {
    public static final int MAX_HEADLINES = 3;

    public StockPayload {
        if (news != null) {
            news = List.copyOf(news.subList(0, Math.min(MAX_HEADLINES, news.size())));
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return quote == null && overview == null && news == null;
    }
}
