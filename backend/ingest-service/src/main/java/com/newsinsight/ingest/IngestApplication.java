package com.newsinsight.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * NewsInsight Ingest Service Application
 *
 * 토픽별 뉴스 수집 오케스트레이션 서비스
 * - 우선순위/시차 기반 (토픽, 소스) 수집 작업 스케줄링
 * - 재시도 + 소스별 회로 차단기로 외부 호출 보호
 * - URL 기반 upsert 및 유사 제목 중복 제거
 * - 최신성/키워드 복합 점수 검색
 */
@SpringBootApplication
public class IngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestApplication.class, args);
    }
}
