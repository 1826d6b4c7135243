package com.quillflow.quillflow_backend.service;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.model.domain.ContentTask;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;
import com.quillflow.quillflow_backend.repository.ContentTaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Picks up tasks left non-terminal by a crashed or stopped instance. Runs once at startup
 * and then on a fixed delay; the lease claim decides which instance resumes a task.
 */
@Slf4j
@Component
public class TaskRecoveryScanner {

    private final ContentTaskRepository taskRepository;
    private final ContentTaskService taskService;
    private final PipelineProperties properties;
    private final Clock clock;

    public TaskRecoveryScanner(ContentTaskRepository taskRepository,
                               ContentTaskService taskService,
                               PipelineProperties properties,
                               Clock clock) {
        this.taskRepository = taskRepository;
        this.taskService = taskService;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        scan();
    }

    @Scheduled(fixedDelayString = "${pipeline.recovery.interval:PT30S}",
               initialDelayString = "${pipeline.recovery.interval:PT30S}")
    public void scan() {
        if (!properties.getRecovery().isEnabled()) {
            return;
        }
        List<ContentTask> candidates;
        try {
            candidates = taskRepository.findRecoverable(TaskStatus.NON_TERMINAL, clock.instant());
        } catch (DataAccessException e) {
            log.warn("Recovery scan skipped, task store unavailable: {}", e.getMessage());
            return;
        }
        int resumed = 0;
        for (ContentTask task : candidates) {
            try {
                if (taskService.resume(task.getId())) {
                    resumed++;
                }
            } catch (RuntimeException e) {
                log.error("Could not resume task {}: {}", task.getId(), e.getMessage(), e);
            }
        }
        if (!candidates.isEmpty()) {
            log.info("Recovery scan: {} candidate(s), {} resumed by {}", candidates.size(), resumed, properties.getInstanceId());
        }
    }
}
