package com.newsinsight.ingest.scheduler;

import com.newsinsight.ingest.client.FetcherRegistry;
import com.newsinsight.ingest.config.IngestProperties;
import com.newsinsight.ingest.entity.Topic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 토픽 목록으로부터 시차를 둔 (토픽, 소스) 작업 계획을 계산한다. 순수 계산이며 부수효과가 없다.
 *
 * 우선순위 오름차순(동률은 입력 순서), 토픽 내 소스 ID 순으로 쌍을 나열하고
 * i번째 쌍(n개 중)에 i * staggerWindow / n 오프셋을 준다.
 */
@Component
@Slf4j
public class JobPlanner {

    private final FetcherRegistry fetcherRegistry;
    private final IngestProperties.Scheduler config;

    public JobPlanner(FetcherRegistry fetcherRegistry, IngestProperties properties) {
        this.fetcherRegistry = fetcherRegistry;
        this.config = properties.getScheduler();
    }

    public List<ScheduledJob> plan(List<Topic> topics, Instant now) {
        List<Topic> ordered = topics.stream()
                .filter(Topic::isActiveTopic)
                .sorted(Comparator.comparingInt(Topic::getPriority))
                .toList();

        Map<String, Pair> pairs = new LinkedHashMap<>();
        for (Topic topic : ordered) {
            boolean lowPriority = topic.getPriority() > config.getLowPriorityThreshold();
            for (String source : topic.getSources().stream().sorted().toList()) {
                if (!fetcherRegistry.contains(source)) {
                    log.warn("Topic '{}' references unknown source '{}'; skipped", topic.getQuery(), source);
                    continue;
                }
                if (lowPriority && fetcherRegistry.isHeavyweight(source)) {
                    log.debug("Topic '{}' (priority {}) skips heavyweight source '{}'",
                            topic.getQuery(), topic.getPriority(), source);
                    continue;
                }
                pairs.putIfAbsent(ScheduledJob.keyOf(topic.getQuery(), source), new Pair(topic, source));
            }
        }

        int n = pairs.size();
        long windowNanos = config.getStaggerWindow().toNanos();
        List<ScheduledJob> jobs = new ArrayList<>(n);
        int i = 0;
        for (Pair pair : pairs.values()) {
            Duration offset = Duration.ofNanos(windowNanos / n * i + windowNanos % n * i / n);
            Duration interval = pair.topic().getUpdateFrequencyOr(config.getDefaultFrequency());
            jobs.add(new ScheduledJob(pair.topic().getQuery(), pair.source(), now.plus(offset), interval, offset));
            i++;
        }
        return jobs;
    }

    private record Pair(Topic topic, String source) {
    }
}
