package com.newsinsight.ingest.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 기사 URL 정규화: 공백 제거, scheme/host 소문자화, fragment 및 utm_* 추적 파라미터 제거.
 * 파싱할 수 없는 URL은 공백만 제거해 그대로 돌려준다.
 */
public final class UrlCanonicalizer {

    private static final String TRACKING_PREFIX = "utm_";

    private UrlCanonicalizer() {
    }

    public static String canonicalize(String rawUrl) {
        if (rawUrl == null) {
            return null;
        }
        String trimmed = rawUrl.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return trimmed;
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            return trimmed;
        }

        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme().toLowerCase(Locale.ROOT)).append("://");
        if (uri.getRawUserInfo() != null) {
            sb.append(uri.getRawUserInfo()).append('@');
        }
        if (uri.getHost() != null) {
            sb.append(uri.getHost().toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1) {
                sb.append(':').append(uri.getPort());
            }
        } else {
            sb.append(uri.getRawAuthority().toLowerCase(Locale.ROOT));
        }
        if (uri.getRawPath() != null) {
            sb.append(uri.getRawPath());
        }

        String query = stripTrackingParameters(uri.getRawQuery());
        if (!query.isEmpty()) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    private static String stripTrackingParameters(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        return Arrays.stream(rawQuery.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> !param.toLowerCase(Locale.ROOT).startsWith(TRACKING_PREFIX))
                .collect(Collectors.joining("&"));
    }
}
