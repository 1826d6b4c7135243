package com.quillflow.quillflow_backend.engine;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.executor.phase.PhaseContext;
import com.quillflow.quillflow_backend.executor.phase.PhaseNodeRegistry;
import com.quillflow.quillflow_backend.model.domain.ContentTask;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;
import com.quillflow.quillflow_backend.model.dto.TaskView;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.model.pipeline.PipelineEvent;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;
import com.quillflow.quillflow_backend.model.pipeline.QualityAssessment;
import com.quillflow.quillflow_backend.router.ChainExhaustedException;
import com.quillflow.quillflow_backend.service.TaskViewMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs one task's graph from wherever its state left off to a terminal status.
 * After every phase the state is snapshotted and a stream event is emitted; cancellation and the
 * overall deadline are checked at every phase boundary.
 */
@Slf4j
@Service
public class PipelineExecutionEngine {

    private final PhaseNodeRegistry nodeRegistry;
    private final TaskSnapshotWriter snapshotWriter;
    private final ExecutionEventPublisher eventPublisher;
    private final CancellationRegistry cancellations;
    private final PipelineProperties properties;
    private final Clock clock;

    public PipelineExecutionEngine(PhaseNodeRegistry nodeRegistry,
                                   TaskSnapshotWriter snapshotWriter,
                                   ExecutionEventPublisher eventPublisher,
                                   CancellationRegistry cancellations,
                                   PipelineProperties properties,
                                   Clock clock) {
        this.nodeRegistry = nodeRegistry;
        this.snapshotWriter = snapshotWriter;
        this.eventPublisher = eventPublisher;
        this.cancellations = cancellations;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Executes until a terminal status. {@code owner} identifies this run and must match the task's
     * lease on every write; {@code token} is the run's registered cancellation token.
     * Returns the terminal view, or null when the lease was lost to another run and this one
     * stopped without writing.
     */
    public TaskView execute(PipelineState state, String owner, CancellationToken token) {
        UUID taskId = token.getTaskId();
        try {
            return run(state, token, owner);
        } catch (LeaseLostException e) {
            log.warn("Task {} stopped: {}", taskId, e.getMessage());
            return null;
        } finally {
            cancellations.release(taskId, token);
        }
    }

    private TaskView run(PipelineState state, CancellationToken token, String owner) {
        UUID taskId = token.getTaskId();
        if (state.getStartedAt() == null) {
            state.setStartedAt(clock.instant());
        }
        if (state.getDeadline() == null) {
            state.setDeadline(clock.instant().plus(properties.getExecution().getOverallTimeout()));
        }
        PhaseContext context = new PhaseContext(taskId, state.getSelection(), token, state.getDeadline());
        int invocationCap = PipelineGraph.maxInvocations(state.getConstraints().getMaxRefinements());

        Phase current = null;
        try {
            if (snapshotWriter.beginRun(state, owner)) {
                token.cancel();
            }
            Phase next = PipelineGraph.next(state.getPhase(), state);
            while (next != null) {
                token.throwIfCancelled();
                current = next;
                if (!clock.instant().isBefore(state.getDeadline())) {
                    throw new PipelineTimeoutException(current, properties.getExecution().getOverallTimeout());
                }
                if (state.getPhaseInvocations() >= invocationCap) {
                    throw new IllegalStateException("Phase invocation limit " + invocationCap + " reached before " + current.key());
                }

                log.info("[Engine] task={} phase={} started (invocation {})", taskId, current.key(), state.getPhaseInvocations() + 1);
                long startedAt = System.currentTimeMillis();
                nodeRegistry.get(current).execute(state, context);

                state.setPhase(current);
                state.setPhaseInvocations(state.getPhaseInvocations() + 1);
                state.getPhaseTrace().add(traceEntry(current, state));
                state.setProgressFraction(PipelineGraph.progressAfter(current, state.getPhaseInvocations(), state,
                        state.getProgressFraction()));
                state.setUpdatedAt(clock.instant());
                log.info("[Engine] task={} phase={} finished in {} ms, progress={}", taskId, current.key(),
                        System.currentTimeMillis() - startedAt, String.format("%.2f", state.getProgressFraction()));

                TaskStatus status = current == Phase.ASSESS && PipelineGraph.shouldRefine(state)
                        ? TaskStatus.AWAITING_REFINEMENT : TaskStatus.RUNNING;
                boolean cancelRequested = snapshotWriter.writeSnapshot(state, status, owner);
                eventPublisher.publish(phaseEvent(state, status));
                if (cancelRequested) {
                    token.cancel();
                }
                next = PipelineGraph.next(current, state);
            }
            token.throwIfCancelled();
            return finish(state, TaskStatus.COMPLETED, null, owner);
        } catch (LeaseLostException e) {
            throw e;
        } catch (TaskCancelledException e) {
            log.info("[Engine] task={} cancelled at {}", taskId, current != null ? current.key() : "start");
            return finish(state, TaskStatus.CANCELLED, null, owner);
        } catch (ChainExhaustedException | PipelineTimeoutException | TaskPersistenceException e) {
            log.error("[Engine] task={} failed: {}", taskId, e.getMessage());
            return finish(state, TaskStatus.FAILED, e.getMessage(), owner);
        } catch (RuntimeException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[Engine] task={} phase {} threw: {}", taskId, current != null ? current.key() : "-", msg, e);
            return finish(state, TaskStatus.FAILED,
                    "Phase " + (current != null ? current.key() : "startup") + " failed: " + msg, owner);
        }
    }

    private TaskView finish(PipelineState state, TaskStatus status, String error, String owner) {
        state.setUpdatedAt(clock.instant());
        if (status == TaskStatus.COMPLETED) {
            state.setProgressFraction(1.0);
        }
        ContentTask stored;
        try {
            stored = snapshotWriter.writeTerminal(state, status, error, owner);
        } catch (LeaseLostException e) {
            throw e;
        } catch (RuntimeException e) {
            // the store is unreachable; streaming clients still get a terminal event
            log.error("[Engine] task={} terminal write failed: {}", state.getTaskId(), e.getMessage());
            ContentTask detached = new ContentTask();
            detached.setId(UUID.fromString(state.getTaskId()));
            stored = snapshotWriter.applyTo(detached, state, TaskStatus.FAILED, e.getMessage());
        }
        TaskView view = TaskViewMapper.toView(stored);
        eventPublisher.publish(new PipelineEvent(0, view.taskId(), view.phase(), view.status(), view.progress(),
                view.qualityScore(), view.costSoFar(), null, true, view.result(), view.error(), clock.instant()));
        log.info("[Engine] task={} finished with status {} after {} phase(s), trace={}", state.getTaskId(),
                view.status(), state.getPhaseInvocations(), state.getPhaseTrace());
        return view;
    }

    private PipelineEvent phaseEvent(PipelineState state, TaskStatus status) {
        QualityAssessment quality = state.getQuality();
        return new PipelineEvent(0, state.getTaskId(), state.getPhase(), status, state.getProgressFraction(),
                quality != null ? quality.overallScore() : null, state.getCostSoFar(), preview(state),
                false, null, null, clock.instant());
    }

    private String preview(PipelineState state) {
        String text = state.getFinalContent() != null ? state.getFinalContent()
                : state.getDraft() != null ? state.getDraft()
                : state.getOutline() != null ? state.getOutline()
                : state.getResearchNotes();
        if (text == null) return null;
        int max = properties.getExecution().getContentPreviewChars();
        return text.length() > max ? text.substring(0, max) : text;
    }

    static String traceEntry(Phase phase, PipelineState state) {
        if (phase == Phase.ASSESS && state.getQuality() != null) {
            return "assess(score=" + state.getQuality().overallScore() + ", "
                    + (state.getQuality().passed() ? "pass" : "fail") + ")";
        }
        return phase.key();
    }
}
