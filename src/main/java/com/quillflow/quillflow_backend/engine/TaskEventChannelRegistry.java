package com.quillflow.quillflow_backend.engine;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Channels for tasks running (or recently finished) in this process. Closed channels stay
 * around for the configured retention so late subscribers can still replay the terminal event.
 */
@Slf4j
@Component
public class TaskEventChannelRegistry {

    private final Map<UUID, TaskEventChannel> channels = new ConcurrentHashMap<>();
    private final PipelineProperties properties;
    private final Clock clock;

    public TaskEventChannelRegistry(PipelineProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public TaskEventChannel open(UUID taskId) {
        PipelineProperties.Streaming cfg = properties.getStreaming();
        return channels.computeIfAbsent(taskId,
                id -> new TaskEventChannel(id, cfg.getHistoryLimit(), cfg.getSubscriberBuffer()));
    }

    public Optional<TaskEventChannel> find(UUID taskId) {
        return Optional.ofNullable(channels.get(taskId));
    }

    @Scheduled(fixedDelayString = "${pipeline.streaming.eviction-interval:PT1M}")
    public void evictClosed() {
        Instant cutoff = clock.instant().minus(properties.getStreaming().getChannelRetention());
        int before = channels.size();
        channels.values().removeIf(c -> c.isClosed() && c.getClosedAt() != null && c.getClosedAt().isBefore(cutoff));
        int evicted = before - channels.size();
        if (evicted > 0) {
            log.debug("Evicted {} closed task channel(s)", evicted);
        }
    }

    int size() {
        return channels.size();
    }
}
