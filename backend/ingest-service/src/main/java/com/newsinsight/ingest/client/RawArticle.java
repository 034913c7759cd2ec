package com.newsinsight.ingest.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 어댑터가 돌려준 가공 전 레코드. 필드 이름은 소스마다 다르며 정규화기가 별칭을 해석한다.
 */
public record RawArticle(String sourceId, Map<String, Object> fields) {

    public RawArticle {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }
}
