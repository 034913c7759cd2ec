package com.newsinsight.ingest.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 문자 단위 제목 유사도 (Ratcliff/Obershelp).
 *
 * 가장 긴 공통 블록을 찾고 그 좌우 구간에 대해 재귀적으로 반복하여 일치 문자 수 M을 누적한다.
 * ratio = 2M / (|a| + |b|). 대소문자는 구분하지 않는다.
 */
public final class TitleSimilarity {

    private TitleSimilarity() {
    }

    public static double ratio(String first, String second) {
        String a = first == null ? "" : first.toLowerCase(Locale.ROOT);
        String b = second == null ? "" : second.toLowerCase(Locale.ROOT);
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    /**
     * Sum of the sizes of all matching blocks.
     */
    static int matchingCharacters(String a, String b) {
        Map<Character, List<Integer>> positionsInB = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            positionsInB.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
        }

        int matched = 0;
        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, a.length(), 0, b.length()});
        while (!ranges.isEmpty()) {
            int[] r = ranges.pop();
            int[] block = longestMatch(a, positionsInB, r[0], r[1], r[2], r[3]);
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            int i = block[0];
            int j = block[1];
            if (r[0] < i && r[2] < j) {
                ranges.push(new int[]{r[0], i, r[2], j});
            }
            if (i + size < r[1] && j + size < r[3]) {
                ranges.push(new int[]{i + size, r[1], j + size, r[3]});
            }
        }
        return matched;
    }

    /**
     * Longest block a[i..i+k) == b[j..j+k) inside the given ranges.
     * Among equally long blocks the one starting earliest in a, then earliest in b, wins.
     *
     * @return {i, j, k}
     */
    private static int[] longestMatch(String a, Map<Character, List<Integer>> positionsInB,
                                      int aLow, int aHigh, int bLow, int bHigh) {
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        // 직전 행에서 b의 위치 j에서 끝나는 일치 길이
        Map<Integer, Integer> lengthsEndingAt = new HashMap<>();
        for (int i = aLow; i < aHigh; i++) {
            Map<Integer, Integer> next = new HashMap<>();
            for (int j : positionsInB.getOrDefault(a.charAt(i), List.of())) {
                if (j < bLow) {
                    continue;
                }
                if (j >= bHigh) {
                    break;
                }
                int k = lengthsEndingAt.getOrDefault(j - 1, 0) + 1;
                next.put(j, k);
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            lengthsEndingAt = next;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
