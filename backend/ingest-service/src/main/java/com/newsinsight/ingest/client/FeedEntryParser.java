package com.newsinsight.ingest.client;

import com.newsinsight.ingest.exception.FetchException;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import org.jsoup.Jsoup;

import java.io.StringReader;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RSS/Atom 문서를 Rome으로 파싱하고 엔트리를 원시 레코드로 바꾼다.
 */
final class FeedEntryParser {

    private FeedEntryParser() {
    }

    static List<SyndEntry> parse(String xml, String sourceId, String feedUrl) {
        try {
            SyndFeedInput input = new SyndFeedInput();
            SyndFeed feed = input.build(new StringReader(xml));
            return feed.getEntries();
        } catch (FeedException | IllegalArgumentException e) {
            throw FetchException.invalidResponse(sourceId, "Unparseable feed from " + feedUrl + ": " + e.getMessage(), e);
        }
    }

    static RawArticle toRawArticle(SyndEntry entry, String sourceId, String searchKey, String publisher) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("link", entry.getLink());
        fields.put("title", normalizeText(entry.getTitle()));
        if (entry.getDescription() != null) {
            fields.put("description", htmlToText(entry.getDescription().getValue()));
        }
        Date published = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        if (published != null) {
            fields.put("pubDate", published);
        }
        if (entry.getEnclosures() != null && !entry.getEnclosures().isEmpty()) {
            fields.put("image", entry.getEnclosures().get(0).getUrl());
        }
        fields.put("searchKey", searchKey);
        if (publisher != null) {
            fields.put("publisher", publisher);
        }
        return new RawArticle(sourceId, fields);
    }

    static boolean mentions(SyndEntry entry, String query) {
        String needle = query.toLowerCase();
        String title = entry.getTitle() == null ? "" : entry.getTitle().toLowerCase();
        String description = entry.getDescription() == null || entry.getDescription().getValue() == null
                ? "" : entry.getDescription().getValue().toLowerCase();
        return title.contains(needle) || description.contains(needle);
    }

    /**
     * 공백을 정리하여 텍스트를 정규화
     */
    static String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    static String htmlToText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return normalizeText(Jsoup.parse(html).text());
    }
}
