package com.finsight.data.rss;

import com.finsight.model.NewsItem;
import org.jsoup.Jsoup;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public final class RssParser {

    private RssParser() {
    }

    /**
     * Parses RSS 2.0 items in feed order. Titles are stripped of markup; items without a title are dropped.
     */
    public static List<NewsItem> parse(String xml, int maxItems) throws IOException {
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            doc = factory.newDocumentBuilder()
                    .parse(new ByteArrayInputStream((xml == null ? "" : xml).getBytes(StandardCharsets.UTF_8)));
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("malformed rss: " + e.getMessage(), e);
        }

        List<NewsItem> out = new ArrayList<>();
        NodeList items = doc.getElementsByTagName("item");
        for (int i = 0; i < items.getLength() && out.size() < maxItems; i++) {
            Element item = (Element) items.item(i);
            String title = cleanText(text(item, "title"));
            if (title.isEmpty()) {
                continue;
            }
            String link = text(item, "link");
            out.add(new NewsItem(title, link, sourceText(item, title, link), publishedAt(text(item, "pubDate"))));
        }
        return out;
    }

    static String cleanText(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return Jsoup.parse(raw).text().replaceAll("\\s+", " ").trim();
    }

    private static Instant publishedAt(String pubDate) {
        if (pubDate == null || pubDate.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(pubDate.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String text(Element parent, String tag) {
        NodeList nl = parent.getElementsByTagName(tag);
        if (nl.getLength() == 0) return null;
        Node n = nl.item(0);
        return n == null ? null : n.getTextContent();
    }

    private static String sourceText(Element item, String title, String link) {
        String source = text(item, "source");
        if (source != null && !source.trim().isEmpty()) return source.trim();

        // 聚合来源常将媒体名拼在标题里，格式通常是“标题 - 来源”
        if (title.contains(" - ")) {
            String[] parts = title.split(" - ");
            String guessed = parts[parts.length - 1].trim();
            if (!guessed.isEmpty()) return guessed;
        }

        if (link != null && !link.isBlank()) {
            try {
                String host = URI.create(link.trim()).getHost();
                if (host != null && !host.isBlank()) return host.trim();
            } catch (IllegalArgumentException e) {
                return "";
            }
        }
        return "";
    }
}
