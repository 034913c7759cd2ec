package com.newsinsight.ingest.util;

import com.newsinsight.ingest.config.IngestProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 제목과 본문에서 빈도 기반 키워드 태그를 뽑는다. 보조 신호일 뿐 분류 결과가 아니다.
 */
@Component
public class KeywordExtractor {

    private static final Pattern ALPHA_RUN = Pattern.compile("\\p{IsAlphabetic}+");

    private final int limit;
    private final int minLength;
    private final Set<String> stopwords;

    public KeywordExtractor(IngestProperties properties) {
        IngestProperties.Normalizer config = properties.getNormalizer();
        this.limit = config.getKeywordLimit();
        this.minLength = config.getMinKeywordLength();
        this.stopwords = new HashSet<>();
        config.getStopwords().forEach(w -> stopwords.add(w.toLowerCase(Locale.ROOT)));
    }

    /**
     * Top keywords by frequency; ties keep first-occurrence order.
     */
    public List<String> extract(String... texts) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                continue;
            }
            Matcher matcher = ALPHA_RUN.matcher(text.toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                String token = matcher.group();
                if (token.length() >= minLength && !stopwords.contains(token)) {
                    counts.merge(token, 1, Integer::sum);
                }
            }
        }

        // List.sort는 안정 정렬이므로 동률은 최초 등장 순서를 유지
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        return entries.stream()
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }
}
