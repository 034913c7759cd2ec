package com.newsinsight.ingest.controller;

import com.newsinsight.ingest.dto.FeedSourceCreateRequest;
import com.newsinsight.ingest.dto.FeedSourceDTO;
import com.newsinsight.ingest.service.FeedSourceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/feed-sources")
@RequiredArgsConstructor
public class FeedSourceController {

    private final FeedSourceService feedSourceService;

    @GetMapping
    public ResponseEntity<List<FeedSourceDTO>> listFeeds(
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(feedSourceService.listFeeds(category, activeOnly));
    }

    @PostMapping
    public ResponseEntity<FeedSourceDTO> addFeed(@Valid @RequestBody FeedSourceCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(feedSourceService.addFeed(request));
    }

    /**
     * POST /api/v1/feed-sources/{id}/toggle - 활성 상태 전환 (active 생략 시 반전)
     */
    @PostMapping("/{id}/toggle")
    public ResponseEntity<FeedSourceDTO> toggleFeed(@PathVariable Long id,
                                                    @RequestParam(required = false) Boolean active) {
        return ResponseEntity.ok(feedSourceService.toggleFeed(id, active));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> removeFeed(@PathVariable Long id) {
        feedSourceService.removeFeed(id);
        return ResponseEntity.noContent().build();
    }
}
