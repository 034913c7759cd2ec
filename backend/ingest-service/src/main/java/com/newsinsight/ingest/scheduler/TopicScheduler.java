package com.newsinsight.ingest.scheduler;

import com.newsinsight.ingest.config.IngestProperties;
import com.newsinsight.ingest.exception.ScheduleException;
import com.newsinsight.ingest.repository.TopicRepository;
import com.newsinsight.ingest.service.IngestionService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 토픽 수집 스케줄러.
 *
 * 작업 집합은 토픽 변경 이벤트, 주기적 갱신, 기동 시점에 다시 계산된다.
 * 트리거는 파이프라인을 고정 크기 워커 풀에 넘기기만 하며, 같은 (토픽, 소스)의 직전 실행이
 * 끝나지 않았으면 이번 회차는 건너뛴다. 실행 중인 파이프라인은 취소하지 않는다.
 */
@Component
@Slf4j
public class TopicScheduler {

    private final TopicRepository topicRepository;
    private final JobPlanner jobPlanner;
    private final IngestionService ingestionService;
    private final TaskScheduler taskScheduler;
    private final Executor pipelineExecutor;
    private final IngestProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, ActiveJob> jobs = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private volatile ScheduleException lastFailure;
    private volatile Instant lastFailureAt;
    private volatile Instant lastRefreshAt;

    public TopicScheduler(TopicRepository topicRepository,
                          JobPlanner jobPlanner,
                          IngestionService ingestionService,
                          @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                          @Qualifier("pipelineExecutor") Executor pipelineExecutor,
                          IngestProperties properties,
                          MeterRegistry meterRegistry,
                          Clock clock) {
        this.topicRepository = topicRepository;
        this.jobPlanner = jobPlanner;
        this.ingestionService = ingestionService;
        this.taskScheduler = taskScheduler;
        this.pipelineExecutor = pipelineExecutor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Topic scheduling disabled (ingest.scheduler.enabled=false)");
            return;
        }
        log.info("Starting topic scheduler");
        refresh();
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onTopicsChanged(TopicsChangedEvent event) {
        if (!properties.getScheduler().isEnabled()) {
            return;
        }
        log.info("Topic '{}' {}; recomputing jobs", event.query(), event.change());
        refresh();
    }

    @Scheduled(fixedDelayString = "${ingest.scheduler.refresh-interval-ms:3600000}",
               initialDelayString = "${ingest.scheduler.refresh-interval-ms:3600000}")
    public void periodicRefresh() {
        if (properties.getScheduler().isEnabled()) {
            refresh();
        }
    }

    /**
     * 전체 작업 집합 재계산. 실패하면 직전 작업 집합을 유지하고 오류를 기록한다.
     *
     * @return the job set in effect afterwards
     */
    public synchronized List<ScheduledJob> refresh() {
        try {
            Instant now = clock.instant();
            List<ScheduledJob> planned = jobPlanner.plan(topicRepository.findAllByOrderByPriorityAscIdAsc(), now);
            apply(planned);
            lastRefreshAt = now;
            lastFailure = null;
            lastFailureAt = null;
            log.info("Job set recomputed: {} jobs", jobs.size());
        } catch (RuntimeException e) {
            lastFailure = new ScheduleException(
                    "Job set recomputation failed; keeping " + jobs.size() + " previous jobs", e);
            lastFailureAt = clock.instant();
            meterRegistry.counter("ingest.scheduler.recompute.failures").increment();
            log.error("Job set recomputation failed, keeping {} previous jobs: {}", jobs.size(), e.getMessage(), e);
        }
        return currentJobs();
    }

    /**
     * 토픽의 모든 작업 취소. 진행 중인 실행은 끝까지 돈다.
     */
    public synchronized void unschedule(String topicQuery) {
        Iterator<ActiveJob> it = jobs.values().iterator();
        while (it.hasNext()) {
            ActiveJob active = it.next();
            if (active.job().topicQuery().equals(topicQuery)) {
                active.future().cancel(false);
                it.remove();
                log.info("Unscheduled {}", active.job().key());
            }
        }
    }

    /**
     * Active jobs in stagger order, with the next trigger time of each running timer.
     */
    public List<ScheduledJob> currentJobs() {
        Instant now = clock.instant();
        List<ScheduledJob> result = new ArrayList<>();
        for (ActiveJob active : jobs.values()) {
            long delayMs = active.future().getDelay(TimeUnit.MILLISECONDS);
            result.add(delayMs > 0 ? active.job().withNextRunAt(now.plusMillis(delayMs)) : active.job());
        }
        result.sort(Comparator.comparing(ScheduledJob::initialOffset).thenComparing(ScheduledJob::key));
        return result;
    }

    public Optional<ScheduleException> getLastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    public Optional<Instant> getLastFailureAt() {
        return Optional.ofNullable(lastFailureAt);
    }

    public Optional<Instant> getLastRefreshAt() {
        return Optional.ofNullable(lastRefreshAt);
    }

    public boolean isInFlight(String topicQuery, String source) {
        return inFlight.contains(ScheduledJob.keyOf(topicQuery, source));
    }

    @PreDestroy
    public synchronized void shutdown() {
        jobs.values().forEach(active -> active.future().cancel(false));
        jobs.clear();
    }

    /**
     * 새 타이머를 모두 등록한 뒤에만 기존 작업을 교체한다. 등록 중 실패하면 새로 만든 타이머만 취소하므로
     * 기존 작업 집합은 그대로 남는다.
     */
    private void apply(List<ScheduledJob> planned) {
        Map<String, ScheduledJob> plannedByKey = new HashMap<>();
        planned.forEach(job -> plannedByKey.put(job.key(), job));

        Map<String, ActiveJob> started = new LinkedHashMap<>();
        try {
            for (ScheduledJob job : planned) {
                ActiveJob existing = jobs.get(job.key());
                if (existing != null && existing.job().sameScheduleAs(job)) {
                    continue;
                }
                ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(
                        () -> dispatch(job), job.nextRunAt(), job.interval());
                started.put(job.key(), new ActiveJob(job, future));
            }
        } catch (RuntimeException e) {
            started.values().forEach(active -> active.future().cancel(false));
            throw e;
        }

        // 계획에서 빠진 작업 취소
        Iterator<Map.Entry<String, ActiveJob>> it = jobs.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ActiveJob> entry = it.next();
            if (!plannedByKey.containsKey(entry.getKey())) {
                entry.getValue().future().cancel(false);
                it.remove();
                log.info("Cancelled job {}", entry.getKey());
            }
        }

        for (ActiveJob active : started.values()) {
            ScheduledJob job = active.job();
            ActiveJob replaced = jobs.put(job.key(), active);
            if (replaced != null) {
                replaced.future().cancel(false);
            }
            log.info("Scheduled {} every {} starting {} (offset {})",
                    job.key(), job.interval(), job.nextRunAt(), job.initialOffset());
        }
    }

    /**
     * 트리거 1회: 워커 풀에 제출만 하고 즉시 반환한다.
     */
    void dispatch(ScheduledJob job) {
        String key = job.key();
        if (!inFlight.add(key)) {
            meterRegistry.counter("ingest.scheduler.skipped", "reason", "in_flight").increment();
            log.debug("Previous run of {} still in flight; skipping this tick", key);
            return;
        }
        try {
            pipelineExecutor.execute(() -> {
                try {
                    ingestionService.ingest(job.topicQuery(), job.source());
                } catch (RuntimeException e) {
                    log.error("Pipeline {} failed: {}", key, e.getMessage(), e);
                } finally {
                    inFlight.remove(key);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(key);
            meterRegistry.counter("ingest.scheduler.skipped", "reason", "pool_saturated").increment();
            log.warn("Worker pool saturated; skipping tick of {}", key);
        }
    }

    private record ActiveJob(ScheduledJob job, ScheduledFuture<?> future) {
    }
}
