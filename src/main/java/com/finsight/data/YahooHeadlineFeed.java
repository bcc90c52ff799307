package com.finsight.data;

import com.finsight.config.Config;
import com.finsight.core.diagnostics.CauseCode;
import com.finsight.data.http.HttpClientEx;
import com.finsight.data.rss.RssParser;
import com.finsight.errors.NoDataError;
import com.finsight.errors.PipelineStageException;
import com.finsight.errors.TransientFetchError;
import com.finsight.model.NewsItem;
import com.finsight.model.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 模块说明：YahooHeadlineFeed（class）。
 * 主要职责：拉取 Yahoo Finance 单标的标题 RSS，解析为按发布时间倒序的 NewsItem 列表。
 * 使用建议：HTTP 状态与网络异常复用 FetchErrors 分类；空 feed 视为 NoDataError。
 */
public final class YahooHeadlineFeed implements HeadlineSource {
    private static final Logger LOG = LogManager.getLogger(YahooHeadlineFeed.class);
    static final String PROVIDER = "yahoo-rss";

    private final HttpClientEx http;
    private final String baseUrl;
    private final String region;
    private final String lang;
    private final int timeoutSec;

    public YahooHeadlineFeed(Config config, HttpClientEx http) {
        this.http = http;
        this.baseUrl = config.getString("news.yahoo.base_url", "https://feeds.finance.yahoo.com/rss/2.0/headline");
        this.region = config.getString("news.region", "US");
        this.lang = config.getString("news.lang", "en-US");
        this.timeoutSec = Math.max(1, config.getInt("news.timeout_sec", 20));
    }

    @Override
    public String sourceId() {
        return PROVIDER;
    }

    @Override
    public List<NewsItem> fetchHeadlines(Symbol symbol, int limit) throws TransientFetchError, NoDataError {
        String url = baseUrl
                + "?s=" + URLEncoder.encode(symbol.value, StandardCharsets.UTF_8)
                + "&region=" + URLEncoder.encode(region, StandardCharsets.UTF_8)
                + "&lang=" + URLEncoder.encode(lang, StandardCharsets.UTF_8);
        String body;
        try {
            body = http.getText(url, timeoutSec);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchError(CauseCode.CANCELLED, PROVIDER + " " + symbol.value + ": interrupted", e);
        } catch (Exception e) {
            PipelineStageException mapped = FetchErrors.classify(PROVIDER, symbol, e);
            if (mapped instanceof NoDataError) {
                throw (NoDataError) mapped;
            }
            throw (TransientFetchError) mapped;
        }
        List<NewsItem> items = parse(symbol, body, limit);
        LOG.debug("headlines symbol={} items={}", symbol, items.size());
        return items;
    }

    List<NewsItem> parse(Symbol symbol, String body, int limit) throws TransientFetchError, NoDataError {
        List<NewsItem> items;
        try {
            items = new ArrayList<>(RssParser.parse(body, Math.max(1, limit)));
        } catch (IOException e) {
            throw new TransientFetchError(CauseCode.PARSE, PROVIDER + " " + symbol.value + ": " + e.getMessage(), e);
        }
        if (items.isEmpty()) {
            throw new NoDataError(PROVIDER + " " + symbol.value + ": no headlines");
        }
        items.sort(Comparator.comparing((NewsItem item) -> item.publishedAt == null ? Instant.MIN : item.publishedAt).reversed());
        return items;
    }
}
