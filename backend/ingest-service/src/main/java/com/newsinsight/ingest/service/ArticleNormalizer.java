package com.newsinsight.ingest.service;

import com.newsinsight.ingest.client.RawArticle;
import com.newsinsight.ingest.config.IngestProperties;
import com.newsinsight.ingest.entity.Article;
import com.newsinsight.ingest.exception.NormalizeException;
import com.newsinsight.ingest.util.KeywordExtractor;
import com.newsinsight.ingest.util.UrlCanonicalizer;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * 어댑터 원시 레코드를 표준 기사 형태로 변환한다.
 */
@Service
@Slf4j
public class ArticleNormalizer {

    // 소스별 필드 이름 별칭 (앞쪽 우선)
    private static final List<String> URL_FIELDS = List.of("url", "link");
    private static final List<String> TITLE_FIELDS = List.of("title", "headline");
    private static final List<String> BODY_FIELDS = List.of("body", "content");
    private static final List<String> DESCRIPTION_FIELDS = List.of("description", "summary", "excerpt");
    private static final List<String> DATE_FIELDS = List.of("published_at", "published", "date", "pubDate", "publishedAt");
    private static final List<String> IMAGE_FIELDS = List.of("image_url", "image", "urlToImage");
    private static final List<String> SEARCH_KEY_FIELDS = List.of("search_key", "searchKey");

    // ISO-8601 (offset 포함/미포함), RFC-1123 순서로 시도
    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()
    );

    private final KeywordExtractor keywordExtractor;
    private final List<String> blockedPhrases;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ArticleNormalizer(KeywordExtractor keywordExtractor,
                             IngestProperties properties,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.keywordExtractor = keywordExtractor;
        this.blockedPhrases = properties.getNormalizer().getBlockedBodyPhrases().stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * @throws NormalizeException when url or title is missing, or the body is known boilerplate
     */
    public Article normalize(RawArticle raw, String sourceId) {
        String url = UrlCanonicalizer.canonicalize(text(raw, URL_FIELDS));
        if (url == null || url.isEmpty()) {
            throw NormalizeException.missingField("url", sourceId);
        }
        String title = text(raw, TITLE_FIELDS);
        if (title == null || title.isEmpty()) {
            throw NormalizeException.missingField("title", sourceId);
        }

        String body = text(raw, BODY_FIELDS);
        if (body == null || body.isEmpty()) {
            body = text(raw, DESCRIPTION_FIELDS);
        }
        if (body == null) {
            body = "";
        }
        String lowerBody = body.toLowerCase(Locale.ROOT);
        for (String phrase : blockedPhrases) {
            if (lowerBody.contains(phrase)) {
                throw new NormalizeException(NormalizeException.Reason.BLOCKED_CONTENT,
                        "Boilerplate body in record " + url + " from " + sourceId);
            }
        }

        return Article.builder()
                .url(url)
                .title(title)
                .body(body)
                .publishedAt(publishedAt(raw))
                .source(sourceId)
                .searchKey(text(raw, SEARCH_KEY_FIELDS))
                .imageUrl(text(raw, IMAGE_FIELDS))
                .keywords(new ArrayList<>(keywordExtractor.extract(title, body)))
                .build();
    }

    /**
     * Normalizes every record; invalid ones are logged, counted and left out.
     */
    public List<Article> normalizeAll(List<RawArticle> raws, String sourceId) {
        List<Article> articles = new ArrayList<>(raws.size());
        for (RawArticle raw : raws) {
            try {
                articles.add(normalize(raw, sourceId));
            } catch (NormalizeException e) {
                meterRegistry.counter("ingest.records.dropped",
                        "source", sourceId, "reason", e.getReason().name()).increment();
                log.debug("Dropped record from {}: {}", sourceId, e.getMessage());
            }
        }
        return articles;
    }

    private Instant publishedAt(RawArticle raw) {
        for (String field : DATE_FIELDS) {
            Instant parsed = toInstant(raw.get(field));
            if (parsed != null) {
                return parsed;
            }
        }
        // 날짜가 없거나 해석 불가하면 수집 시각
        return clock.instant();
    }

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        String s = value.toString().trim();
        if (s.isEmpty()) {
            return null;
        }
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(s);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' not in expected format: {}", s, e.getMessage());
            }
        }
        log.debug("Unparseable date '{}'", s);
        return null;
    }

    private static String text(RawArticle raw, List<String> aliases) {
        for (String alias : aliases) {
            Object value = raw.get(alias);
            if (value != null) {
                String s = value.toString().trim();
                if (!s.isEmpty()) {
                    return s;
                }
            }
        }
        return null;
    }
}
