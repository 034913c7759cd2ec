package com.newsinsight.ingest.util;

import com.newsinsight.ingest.config.IngestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordExtractorTest {

    private KeywordExtractor extractor;

    @BeforeEach
    void setUp() {
        IngestProperties properties = new IngestProperties();
        properties.getNormalizer().setKeywordLimit(3);
        extractor = new KeywordExtractor(properties);
    }

    @Test
    @DisplayName("빈도순 상위 N개, 동률은 최초 등장 순서")
    void ranksByFrequencyThenFirstOccurrence() {
        List<String> keywords = extractor.extract(
                "Inflation cools as markets rally",
                "Markets cheered the inflation print. Inflation expectations fell; bonds rally.");

        assertThat(keywords).containsExactly("inflation", "markets", "rally");
    }

    @Test
    @DisplayName("4글자 미만, 불용어, 숫자는 제외")
    void filtersShortTokensStopwordsAndDigits() {
        List<String> keywords = extractor.extract("The Fed said that 2024 GDP grew with wage gains");

        assertThat(keywords).containsExactly("grew", "wage", "gains");
    }

    @Test
    @DisplayName("null 또는 빈 텍스트는 빈 목록")
    void emptyInput() {
        assertThat(extractor.extract(null, "  ")).isEmpty();
    }
}
