package com.newsinsight.ingest.controller;

import com.newsinsight.ingest.dto.IngestionResult;
import com.newsinsight.ingest.dto.TopicCreateRequest;
import com.newsinsight.ingest.dto.TopicDTO;
import com.newsinsight.ingest.dto.TopicUpdateRequest;
import com.newsinsight.ingest.service.TopicService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/topics")
@RequiredArgsConstructor
public class TopicController {

    private final TopicService topicService;

    /**
     * GET /api/v1/topics - 토픽 목록 (우선순위 순)
     */
    @GetMapping
    public ResponseEntity<List<TopicDTO>> listTopics(
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(topicService.listTopics(category, includeInactive));
    }

    @GetMapping("/{query}")
    public ResponseEntity<TopicDTO> getTopic(@PathVariable String query) {
        return ResponseEntity.ok(topicService.getTopic(query));
    }

    /**
     * POST /api/v1/topics - 토픽 추가 (기존 질의어면 갱신)
     */
    @PostMapping
    public ResponseEntity<TopicDTO> addTopic(@Valid @RequestBody TopicCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(topicService.addTopic(request));
    }

    @PatchMapping("/{query}")
    public ResponseEntity<TopicDTO> updateTopic(@PathVariable String query,
                                                @Valid @RequestBody TopicUpdateRequest request) {
        return ResponseEntity.ok(topicService.update(query, request));
    }

    /**
     * POST /api/v1/topics/{query}/toggle - 활성 상태 전환 (active 생략 시 반전)
     */
    @PostMapping("/{query}/toggle")
    public ResponseEntity<TopicDTO> toggleTopic(@PathVariable String query,
                                                @RequestParam(required = false) Boolean active) {
        return ResponseEntity.ok(topicService.toggleTopic(query, active));
    }

    @DeleteMapping("/{query}")
    public ResponseEntity<Void> removeTopic(@PathVariable String query) {
        topicService.removeTopic(query);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/topics/run?query=... - 즉시 수집
     */
    @PostMapping("/run")
    public ResponseEntity<List<IngestionResult>> runNow(@RequestParam String query) {
        return ResponseEntity.ok(topicService.runNow(query));
    }
}
