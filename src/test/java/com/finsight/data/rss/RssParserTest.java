package com.finsight.data.rss;

import com.finsight.model.NewsItem;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RssParserTest {
    static final String FEED = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<rss version=\"2.0\"><channel><title>Yahoo! Finance: AAPL News</title>\n"
            + "<item><title>Apple &amp; Google strike &lt;b&gt;AI&lt;/b&gt;  deal</title>"
            + "<link>https://finance.yahoo.com/news/a1</link>"
            + "<pubDate>Mon, 03 Jun 2024 10:00:00 +0000</pubDate></item>\n"
            + "<item><title>Apple shares surge - Reuters</title>"
            + "<link>https://www.reuters.com/markets/x</link>"
            + "<pubDate>Mon, 03 Jun 2024 11:30:00 +0000</pubDate></item>\n"
            + "<item><title>   </title><link>https://finance.yahoo.com/news/blank</link></item>\n"
            + "<item><title>Older story</title><link>https://finance.yahoo.com/news/a0</link>"
            + "<pubDate>yesterday</pubDate><source url=\"https://www.marketwatch.com\">MarketWatch</source></item>\n"
            + "</channel></rss>";

    @Test
    void parseShouldCleanTitlesAndResolvePublisher() throws Exception {
        List<NewsItem> items = RssParser.parse(FEED, 10);

        assertEquals(3, items.size());
        assertEquals("Apple & Google strike AI deal", items.get(0).title);
        assertEquals("finance.yahoo.com", items.get(0).source);
        assertEquals(Instant.parse("2024-06-03T10:00:00Z"), items.get(0).publishedAt);
        assertEquals("Reuters", items.get(1).source);
        assertEquals("MarketWatch", items.get(2).source);
        assertNull(items.get(2).publishedAt);
    }

    @Test
    void parseShouldStopAtMaxItems() throws Exception {
        List<NewsItem> items = RssParser.parse(FEED, 1);

        assertEquals(1, items.size());
        assertEquals("https://finance.yahoo.com/news/a1", items.get(0).link);
    }

    @Test
    void malformedOrDoctypeFeedShouldFail() {
        assertThrows(IOException.class, () -> RssParser.parse("<html><body>oops", 5));
        String withDoctype = "<?xml version=\"1.0\"?><!DOCTYPE rss [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
                + "<rss><channel><item><title>&x;</title></item></channel></rss>";
        assertThrows(IOException.class, () -> RssParser.parse(withDoctype, 5));
    }
}
