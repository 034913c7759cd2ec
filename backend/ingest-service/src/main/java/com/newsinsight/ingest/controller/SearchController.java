package com.newsinsight.ingest.controller;

import com.newsinsight.ingest.config.IngestProperties;
import com.newsinsight.ingest.dto.SearchResultDTO;
import com.newsinsight.ingest.mapper.EntityMapper;
import com.newsinsight.ingest.service.search.ArticleSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class SearchController {

    private final ArticleSearchService searchService;
    private final IngestProperties properties;
    private final EntityMapper entityMapper;

    /**
     * GET /api/v1/search?q=...&maxAgeHours=168&sources=gnews,rss&limit=20
     */
    @GetMapping
    public ResponseEntity<List<SearchResultDTO>> search(
            @RequestParam("q") String query,
            @RequestParam(required = false) Long maxAgeHours,
            @RequestParam(required = false) Set<String> sources,
            @RequestParam(required = false) Integer limit) {

        IngestProperties.Search config = properties.getSearch();
        if (maxAgeHours != null && maxAgeHours <= 0) {
            throw new IllegalArgumentException("maxAgeHours must be positive");
        }
        Duration maxAge = maxAgeHours == null ? config.getDefaultMaxAge() : Duration.ofHours(maxAgeHours);
        int effectiveLimit = Math.min(limit == null ? config.getDefaultLimit() : Math.max(1, limit), config.getMaxLimit());

        List<SearchResultDTO> results = searchService.rank(query, maxAge, sources, effectiveLimit).stream()
                .map(entityMapper::toDTO)
                .toList();
        return ResponseEntity.ok(results);
    }
}
