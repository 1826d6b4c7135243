package com.quillflow.quillflow_backend.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.model.domain.ContentTask;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;
import com.quillflow.quillflow_backend.model.pipeline.RetryConfig;
import com.quillflow.quillflow_backend.repository.ContentTaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Writes PipelineState into the task row. Only the lease owner may write; every write renews
 * the lease. Failed writes are retried with exponential backoff, each attempt bounded by the
 * configured write timeout.
 */
@Slf4j
@Component
public class TaskSnapshotWriter {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ContentTaskRepository taskRepository;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;
    private final Executor ioExecutor;
    private final Clock clock;

    public TaskSnapshotWriter(ContentTaskRepository taskRepository,
                              ObjectMapper objectMapper,
                              PipelineProperties properties,
                              @Qualifier("ioExecutor") Executor ioExecutor,
                              Clock clock) {
        this.taskRepository = taskRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
    }

    /**
     * Confirms that {@code owner} still holds the task when its run is dequeued, marks a pending
     * task RUNNING and renews the lease. Throws {@link LeaseLostException} when a later run has
     * claimed the task in the meantime.
     *
     * @return true when a cancellation was requested for the task in the store
     */
    public boolean beginRun(PipelineState state, String owner) {
        ContentTask started = withRetry("at run start", () -> {
            UUID taskId = UUID.fromString(state.getTaskId());
            ContentTask task = taskRepository.findById(taskId)
                    .orElseThrow(() -> new LeaseLostException(taskId, owner));
            if (!owner.equals(task.getLeaseOwner()) || task.getStatus().isTerminal()) {
                throw new LeaseLostException(taskId, owner);
            }
            Instant now = clock.instant();
            if (task.getStatus() == TaskStatus.PENDING) {
                task.setStatus(TaskStatus.RUNNING);
            }
            task.setUpdatedAt(now);
            task.setLeaseExpiresAt(now.plus(properties.getPersistence().getLeaseDuration()));
            return taskRepository.save(task);
        }, state.getPhase());
        return started.isCancelRequested();
    }

    /**
     * Persists a phase-boundary snapshot.
     *
     * @return true when a cancellation was requested for the task in the store
     */
    public boolean writeSnapshot(PipelineState state, TaskStatus status, String owner) {
        ContentTask saved = withRetry(label(state.getPhase()), () -> write(state, status, null, owner), state.getPhase());
        return saved.isCancelRequested();
    }

    /**
     * Persists the terminal state and releases the lease. A completion that races with an
     * accepted cancel request is stored as CANCELLED.
     */
    public ContentTask writeTerminal(PipelineState state, TaskStatus status, String error, String owner) {
        return withRetry(label(state.getPhase()), () -> write(state, status, error, owner), state.getPhase());
    }

    public PipelineState readSnapshot(ContentTask task) {
        if (task.getStateSnapshot() == null) {
            throw new IllegalStateException("Task " + task.getId() + " has no state snapshot");
        }
        return objectMapper.convertValue(task.getStateSnapshot(), PipelineState.class);
    }

    public Map<String, Object> toSnapshot(PipelineState state) {
        return objectMapper.convertValue(state, MAP_TYPE);
    }

    /** Copies the state's projection onto a task row without saving it. */
    public ContentTask applyTo(ContentTask task, PipelineState state, TaskStatus status, String error) {
        Instant now = clock.instant();
        boolean terminal = status.isTerminal();
        task.setStatus(status);
        task.setPhase(state.getPhase());
        task.setTopic(state.getTopic());
        task.setContent(state.getFinalContent());
        task.setQualityScore(status == TaskStatus.COMPLETED || state.getQuality() == null
                ? state.getBestScore() : Double.valueOf(state.getQuality().overallScore()));
        task.setRefinementCount(state.getRefinementCount());
        task.setNeedsReview(state.isNeedsReview());
        task.setProgress(status == TaskStatus.COMPLETED ? 1.0
                : Math.min(PipelineGraph.MAX_RUNNING_PROGRESS, state.getProgressFraction()));
        task.setCostSoFar(state.getCostSoFar());
        task.setMetadata(state.getMetadata() == null || state.getMetadata().isEmpty() ? null : state.getMetadata());
        if (state.getSelection() != null) {
            task.setProviderSelections(state.getSelection().toStorageMap());
        }
        task.setStateSnapshot(toSnapshot(state));
        task.setError(error);
        task.setUpdatedAt(now);
        if (terminal) {
            task.setCompletedAt(now);
            task.setLeaseOwner(null);
            task.setLeaseExpiresAt(null);
        } else {
            task.setLeaseExpiresAt(now.plus(properties.getPersistence().getLeaseDuration()));
        }
        return task;
    }

    private ContentTask write(PipelineState state, TaskStatus status, String error, String owner) {
        UUID taskId = UUID.fromString(state.getTaskId());
        ContentTask task = taskRepository.findById(taskId)
                .orElseThrow(() -> new LeaseLostException(taskId, owner));
        if (!owner.equals(task.getLeaseOwner()) || task.getStatus().isTerminal()) {
            throw new LeaseLostException(taskId, owner);
        }
        TaskStatus effective = status == TaskStatus.COMPLETED && task.isCancelRequested()
                ? TaskStatus.CANCELLED : status;
        applyTo(task, state, effective, effective == TaskStatus.CANCELLED ? null : error);
        return taskRepository.save(task);
    }

    private ContentTask withRetry(String label, Supplier<ContentTask> write, Phase phase) {
        RetryConfig retry = properties.getPersistence().getSnapshotRetry();
        int maxRetries = Math.max(0, Math.min(10, retry.getMaxRetries()));
        long delayMs = retry.getBackoffMs() > 0 ? retry.getBackoffMs() : 200L;
        double multiplier = retry.getBackoffMultiplier() > 0 ? retry.getBackoffMultiplier() : 1.0d;
        long timeoutMs = properties.getPersistence().getWriteTimeout().toMillis();

        int attempt = 0;
        while (true) {
            attempt++;
            RuntimeException failure;
            try {
                return CompletableFuture.supplyAsync(write, ioExecutor).get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                failure = e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof LeaseLostException lost) {
                    throw lost;
                }
                failure = cause instanceof RuntimeException re ? re : new IllegalStateException(cause);
            } catch (TimeoutException e) {
                failure = new IllegalStateException("write timed out after " + timeoutMs + " ms", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskPersistenceException(phase, "Interrupted while persisting state " + label, e);
            }

            // a concurrent cancel request bumps the version; re-reading picks it up
            boolean conflict = failure instanceof ObjectOptimisticLockingFailureException;
            if (attempt > maxRetries) {
                log.error("Persisting state {} failed after {} attempt(s): {}", label, attempt, failure.getMessage());
                throw new TaskPersistenceException(phase,
                        "Failed to persist state " + label + ": " + failure.getMessage(), failure);
            }
            log.warn("Persisting state {} failed on attempt {}/{}{}. Retrying in {} ms", label, attempt,
                    maxRetries + 1, conflict ? " (version conflict)" : "", delayMs);
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TaskPersistenceException(phase, "Interrupted while persisting state " + label, ie);
            }
            delayMs = (long) Math.max(0L, delayMs * multiplier);
        }
    }

    private static String label(Phase phase) {
        return phase != null ? "after phase " + phase.key() : "after task creation";
    }
}
