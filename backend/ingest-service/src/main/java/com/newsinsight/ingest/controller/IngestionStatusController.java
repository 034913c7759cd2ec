package com.newsinsight.ingest.controller;

import com.newsinsight.ingest.dto.IngestionStatusDTO;
import com.newsinsight.ingest.scheduler.ScheduledJob;
import com.newsinsight.ingest.scheduler.TopicScheduler;
import com.newsinsight.ingest.service.IngestionStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/ingest")
@RequiredArgsConstructor
public class IngestionStatusController {

    private final IngestionStatusService statusService;
    private final TopicScheduler topicScheduler;

    /**
     * GET /api/v1/ingest/status - 기사 통계, 작업 집합, 소스별 회로 상태
     */
    @GetMapping("/status")
    public ResponseEntity<IngestionStatusDTO> status() {
        return ResponseEntity.ok(statusService.status());
    }

    /**
     * POST /api/v1/ingest/schedule/refresh - 작업 집합 즉시 재계산
     */
    @PostMapping("/schedule/refresh")
    public ResponseEntity<List<ScheduledJob>> refreshSchedule() {
        return ResponseEntity.ok(topicScheduler.refresh());
    }
}
