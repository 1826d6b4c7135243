package com.quillflow.quillflow_backend.service;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.engine.TaskSubscription;
import com.quillflow.quillflow_backend.model.dto.TaskView;
import com.quillflow.quillflow_backend.model.pipeline.PipelineEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapts a task's event channel to Server-Sent Events. When this instance has no channel for
 * the task, the stream carries one event synthesized from the stored task and ends.
 */
@Slf4j
@Service
public class TaskStreamService {

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final ContentTaskService taskService;
    private final PipelineProperties properties;
    private final Executor streamExecutor;
    private final Clock clock;

    public TaskStreamService(ContentTaskService taskService,
                             PipelineProperties properties,
                             @Qualifier("streamExecutor") Executor streamExecutor,
                             Clock clock) {
        this.taskService = taskService;
        this.properties = properties;
        this.streamExecutor = streamExecutor;
        this.clock = clock;
    }

    public SseEmitter stream(UUID taskId, long afterSequence) {
        TaskView current = taskService.poll(taskId);
        SseEmitter emitter = newEmitter();

        Optional<TaskSubscription> subscription = taskService.subscribe(taskId, afterSequence);
        if (subscription.isEmpty()) {
            streamExecutor.execute(() -> sendSnapshot(emitter, current));
            return emitter;
        }

        TaskSubscription sub = subscription.get();
        AtomicBoolean open = new AtomicBoolean(true);
        Runnable stop = () -> {
            open.set(false);
            sub.close();
        };
        emitter.onCompletion(stop);
        emitter.onTimeout(stop);
        emitter.onError(e -> stop.run());
        streamExecutor.execute(() -> pump(taskId, sub, emitter, open));
        return emitter;
    }

    SseEmitter newEmitter() {
        return new SseEmitter(properties.getStreaming().getSseTimeout().toMillis());
    }

    private void pump(UUID taskId, TaskSubscription sub, SseEmitter emitter, AtomicBoolean open) {
        try {
            while (open.get() && !sub.isFinished()) {
                PipelineEvent event = sub.poll(POLL_INTERVAL);
                if (event != null) {
                    send(emitter, event);
                }
            }
            emitter.complete();
        } catch (IOException e) {
            log.debug("SSE client for task {} went away: {}", taskId, e.getMessage());
            sub.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sub.close();
            emitter.complete();
        }
    }

    private void sendSnapshot(SseEmitter emitter, TaskView view) {
        boolean terminal = view.status().isTerminal();
        PipelineEvent event = new PipelineEvent(0, view.taskId(), view.phase(), view.status(), view.progress(),
                view.qualityScore(), view.costSoFar(), null, terminal, view.result(), view.error(), clock.instant());
        try {
            send(emitter, event);
            emitter.complete();
        } catch (IOException e) {
            log.debug("SSE client for task {} went away: {}", view.taskId(), e.getMessage());
        }
    }

    private static void send(SseEmitter emitter, PipelineEvent event) throws IOException {
        SseEmitter.SseEventBuilder builder = SseEmitter.event()
                .name(event.terminal() ? "terminal" : "phase")
                .data(event);
        if (event.sequence() > 0) {
            builder.id(Long.toString(event.sequence()));
        }
        emitter.send(builder);
    }
}
