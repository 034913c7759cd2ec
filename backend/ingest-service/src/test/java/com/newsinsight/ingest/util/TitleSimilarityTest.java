package com.newsinsight.ingest.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * TitleSimilarity 단위 테스트
 */
class TitleSimilarityTest {

    @Test
    @DisplayName("동일한 제목은 1.0")
    void identicalTitles() {
        assertThat(TitleSimilarity.ratio("Fed Raises Rates Again", "Fed Raises Rates Again")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("대소문자는 구분하지 않는다")
    void caseInsensitive() {
        assertThat(TitleSimilarity.ratio("FED RAISES RATES", "fed raises rates")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("공통 문자가 없으면 0.0")
    void disjointTitles() {
        assertThat(TitleSimilarity.ratio("abc", "xyz")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("빈 문자열끼리는 1.0, 한쪽만 비면 0.0")
    void emptyTitles() {
        assertThat(TitleSimilarity.ratio("", "")).isEqualTo(1.0);
        assertThat(TitleSimilarity.ratio("", "abc")).isEqualTo(0.0);
        assertThat(TitleSimilarity.ratio(null, "abc")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("가장 긴 블록 후 좌우 구간을 재귀적으로 누적한다")
    void accumulatesMatchingBlocks() {
        // " rates again"(12) + "fed raises"(10) = 22 일치, 전체 22 + 31 = 53
        double ratio = TitleSimilarity.ratio("Fed Raises Rates Again", "Fed Raises Interest Rates Again");

        assertThat(ratio).isCloseTo(44.0 / 53.0, within(1e-9));
    }

    @Test
    @DisplayName("접미어만 추가된 제목은 0.85를 넘는다")
    void appendedWordScoresAboveDefaultThreshold() {
        double ratio = TitleSimilarity.ratio("Fed Raises Rates Again", "Fed Raises Rates Again Today");

        assertThat(ratio).isCloseTo(44.0 / 50.0, within(1e-9));
        assertThat(ratio).isGreaterThan(0.85);
    }

    @Test
    @DisplayName("블록이 교차하는 순서는 한쪽만 인정한다")
    void crossingBlocksCountOnce() {
        // "ab" 와 "ba": 최장 블록 1글자, 좌우 구간이 비어 추가 일치 없음
        assertThat(TitleSimilarity.matchingCharacters("ab", "ba")).isEqualTo(1);
    }

    @Test
    @DisplayName("대칭은 아니지만 범위는 [0, 1]")
    void boundedRatio() {
        double ratio = TitleSimilarity.ratio("Oil prices slump as OPEC output rises", "OPEC output rises, oil slumps");

        assertThat(ratio).isBetween(0.0, 1.0);
    }
}
