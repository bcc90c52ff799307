package com.finsight.model;

import java.time.Instant;

/**
 * 模块说明：NewsItem（class）。
 * 主要职责：承载单条新闻标题、链接、来源与发布时间，来自行情源的标题 RSS。
 * 使用建议：publishedAt 可能为空，排序时视为最旧。
 */
public final class NewsItem {
    public final String title;
    public final String link;
    public final String source;
    public final Instant publishedAt;

    public NewsItem(String title, String link, String source, Instant publishedAt) {
        this.title = title == null ? "" : title.trim();
        this.link = link == null ? "" : link.trim();
        this.source = source == null ? "" : source.trim();
        this.publishedAt = publishedAt;
    }
}
