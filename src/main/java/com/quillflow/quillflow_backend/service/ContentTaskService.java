package com.quillflow.quillflow_backend.service;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.engine.CancellationRegistry;
import com.quillflow.quillflow_backend.engine.CancellationToken;
import com.quillflow.quillflow_backend.engine.ExecutionEventPublisher;
import com.quillflow.quillflow_backend.engine.PipelineExecutionEngine;
import com.quillflow.quillflow_backend.engine.TaskEventChannelRegistry;
import com.quillflow.quillflow_backend.engine.TaskSnapshotWriter;
import com.quillflow.quillflow_backend.engine.TaskSubscription;
import com.quillflow.quillflow_backend.model.domain.ContentTask;
import com.quillflow.quillflow_backend.model.domain.CostRecord;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;
import com.quillflow.quillflow_backend.model.dto.CostEstimateRequest;
import com.quillflow.quillflow_backend.model.dto.CreateTaskRequest;
import com.quillflow.quillflow_backend.model.dto.CreateTaskResponse;
import com.quillflow.quillflow_backend.model.dto.TaskView;
import com.quillflow.quillflow_backend.model.pipeline.CostBreakdown;
import com.quillflow.quillflow_backend.model.pipeline.GenerationConstraints;
import com.quillflow.quillflow_backend.model.pipeline.ModelSelection;
import com.quillflow.quillflow_backend.model.pipeline.PipelineEvent;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;
import com.quillflow.quillflow_backend.repository.ContentTaskRepository;
import com.quillflow.quillflow_backend.router.CostEstimator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
public class ContentTaskService {

    private static final int MAX_TOPIC_LENGTH = 500;

    private final ContentTaskRepository taskRepository;
    private final ModelSelectionResolver selectionResolver;
    private final CostEstimator costEstimator;
    private final CostMetricsService costMetrics;
    private final PipelineExecutionEngine engine;
    private final TaskSnapshotWriter snapshotWriter;
    private final TaskEventChannelRegistry channels;
    private final ExecutionEventPublisher eventPublisher;
    private final CancellationRegistry cancellations;
    private final PipelineProperties properties;
    private final Executor pipelineExecutor;
    private final Clock clock;

    public ContentTaskService(ContentTaskRepository taskRepository,
                              ModelSelectionResolver selectionResolver,
                              CostEstimator costEstimator,
                              CostMetricsService costMetrics,
                              PipelineExecutionEngine engine,
                              TaskSnapshotWriter snapshotWriter,
                              TaskEventChannelRegistry channels,
                              ExecutionEventPublisher eventPublisher,
                              CancellationRegistry cancellations,
                              PipelineProperties properties,
                              @Qualifier("pipelineExecutor") Executor pipelineExecutor,
                              Clock clock) {
        this.taskRepository = taskRepository;
        this.selectionResolver = selectionResolver;
        this.costEstimator = costEstimator;
        this.costMetrics = costMetrics;
        this.engine = engine;
        this.snapshotWriter = snapshotWriter;
        this.channels = channels;
        this.eventPublisher = eventPublisher;
        this.cancellations = cancellations;
        this.properties = properties;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
    }

    /**
     * Validates, prices and stores a new task, then starts it in the background.
     * Nothing is stored when validation fails.
     */
    public CreateTaskResponse create(CreateTaskRequest request) {
        String owner = newRunOwner();
        ContentTask task = persistNew(request, owner);
        PipelineState state = snapshotWriter.readSnapshot(task);
        channels.open(task.getId());
        submit(task.getId(), state, owner);

        CreateTaskResponse.Subscription subscription = request.stream()
                ? new CreateTaskResponse.Subscription("/api/tasks/" + task.getId() + "/events",
                        ExecutionEventPublisher.TOPIC + task.getId())
                : null;
        return new CreateTaskResponse(task.getId().toString(), TaskStatus.PENDING, task.getEstimatedCost(),
                task.isBudgetWarning(), task.getBudgetWarningReason(), subscription);
    }

    /**
     * Creates a task and waits for its terminal state. The wait is bounded by the overall timeout
     * plus the time allowed for the final write.
     */
    public TaskView runBlocking(CreateTaskRequest request) {
        String owner = newRunOwner();
        ContentTask task = persistNew(request, owner);
        UUID taskId = task.getId();
        PipelineState state = snapshotWriter.readSnapshot(task);
        channels.open(taskId);

        Duration wait = properties.getExecution().getOverallTimeout()
                .plus(properties.getPersistence().getWriteTimeout().multipliedBy(2));
        CompletableFuture<TaskView> run = submit(taskId, state, owner);
        try {
            TaskView view = run.get(wait.toMillis(), TimeUnit.MILLISECONDS);
            return view != null ? view : poll(taskId);
        } catch (TimeoutException e) {
            log.warn("Blocking run of task {} did not finish within {}; cancelling", taskId, wait);
            return cancel(taskId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancel(taskId);
        } catch (ExecutionException e) {
            log.error("Blocking run of task {} failed: {}", taskId, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return poll(taskId);
        }
    }

    public TaskView poll(UUID taskId) {
        return TaskViewMapper.toView(load(taskId));
    }

    public List<TaskView> recent() {
        return taskRepository.findTop100ByOrderByCreatedAtDesc().stream().map(TaskViewMapper::toView).toList();
    }

    /**
     * Requests cancellation. A task nobody has picked up is cancelled at once. A queued task stops
     * before its first phase; a running one stops at its next phase boundary and its in-flight
     * provider call is abandoned. Terminal tasks are left as they are.
     */
    public TaskView cancel(UUID taskId) {
        ContentTask task = load(taskId);
        if (task.getStatus().isTerminal()) {
            return TaskViewMapper.toView(task);
        }
        Instant now = clock.instant();
        if (taskRepository.cancelUnclaimed(taskId, now, TaskStatus.PENDING, TaskStatus.CANCELLED) == 1) {
            log.info("Task {} cancelled before any worker claimed it", taskId);
            TaskView view = poll(taskId);
            eventPublisher.publish(new PipelineEvent(0, view.taskId(), view.phase(), view.status(), view.progress(),
                    view.qualityScore(), view.costSoFar(), null, true, null, null, now));
            return view;
        }
        taskRepository.requestCancel(taskId, now, TaskStatus.NON_TERMINAL);
        boolean local = cancellations.cancel(taskId);
        log.info("Cancellation requested for task {} ({})", taskId, local ? "queued or running here" : "flag set in store");
        return poll(taskId);
    }

    /** Live subscription when this instance holds the task's channel. */
    public Optional<TaskSubscription> subscribe(UUID taskId, long afterSequence) {
        return channels.find(taskId).map(c -> c.subscribe(afterSequence));
    }

    public List<CostRecord> costs(UUID taskId) {
        load(taskId);
        return costMetrics.forTask(taskId);
    }

    public CostBreakdown estimate(CostEstimateRequest request) {
        ModelSelection selection = selectionResolver.resolve(request.preset(), request.providers());
        return costEstimator.estimate(selection, targetLength(request.targetLength()));
    }

    /**
     * Takes over a non-terminal task whose lease expired and runs it from its last snapshot.
     * Returns false when another instance won the claim.
     */
    public boolean resume(UUID taskId) {
        Instant now = clock.instant();
        String owner = newRunOwner();
        int claimed = taskRepository.claimLease(taskId, owner, now,
                now.plus(properties.getPersistence().getLeaseDuration()), TaskStatus.NON_TERMINAL);
        if (claimed != 1) {
            return false;
        }
        ContentTask task = load(taskId);
        PipelineState state = snapshotWriter.readSnapshot(task);
        state.setDeadline(now.plus(properties.getExecution().getOverallTimeout()));
        log.info("Resuming task {} after phase {}", taskId, state.getPhase() != null ? state.getPhase().key() : "-");
        channels.open(taskId);
        submit(taskId, state, owner);
        return true;
    }

    /** Lease owner for a single run: the instance id plus a run id. */
    private String newRunOwner() {
        return properties.getInstanceId() + "/" + UUID.randomUUID();
    }

    private CompletableFuture<TaskView> submit(UUID taskId, PipelineState state, String owner) {
        CancellationToken token = cancellations.register(taskId);
        try {
            return CompletableFuture.supplyAsync(() -> engine.execute(state, owner, token), pipelineExecutor);
        } catch (TaskRejectedException e) {
            cancellations.release(taskId, token);
            log.error("Task {} rejected by the pipeline executor: {}", taskId, e.getMessage());
            ContentTask stored = snapshotWriter.writeTerminal(state, TaskStatus.FAILED,
                    "Pipeline executor is saturated; task was not started", owner);
            TaskView view = TaskViewMapper.toView(stored);
            eventPublisher.publish(new PipelineEvent(0, view.taskId(), view.phase(), view.status(), view.progress(),
                    view.qualityScore(), view.costSoFar(), null, true, null, view.error(), clock.instant()));
            return CompletableFuture.completedFuture(view);
        }
    }

    private ContentTask persistNew(CreateTaskRequest request, String owner) {
        String topic = request.topic() == null ? "" : request.topic().trim();
        if (topic.isEmpty()) {
            throw new TaskValidationException("Topic must not be empty");
        }
        if (topic.length() > MAX_TOPIC_LENGTH) {
            throw new TaskValidationException("Topic must be at most " + MAX_TOPIC_LENGTH + " characters");
        }
        GenerationConstraints constraints = constraints(request);
        ModelSelection selection = selectionResolver.resolve(request.preset(), request.providers());

        CostBreakdown estimate = costEstimator.estimate(selection, constraints.getTargetLength());
        CostMetricsService.BudgetCheck budget = costMetrics.checkBudget(estimate.total(), constraints.getBudgetCeiling());
        if (budget.warning()) {
            if (properties.getBudget().getPolicy() == PipelineProperties.BudgetPolicy.BLOCK) {
                throw new BudgetExceededException(budget.reason());
            }
            log.warn("Budget warning for new task on '{}': {}", topic, budget.reason());
        }

        Instant now = clock.instant();
        UUID taskId = UUID.randomUUID();
        PipelineState state = PipelineState.builder()
                .taskId(taskId.toString())
                .topic(topic)
                .constraints(constraints)
                .selection(selection)
                .createdAt(now)
                .updatedAt(now)
                .build();

        ContentTask task = new ContentTask();
        task.setId(taskId);
        task.setStatus(TaskStatus.PENDING);
        task.setTopic(topic);
        task.setEstimatedCost(estimate.total());
        task.setBudgetWarning(budget.warning());
        task.setBudgetWarningReason(budget.reason());
        task.setProviderSelections(selection.toStorageMap());
        task.setStateSnapshot(snapshotWriter.toSnapshot(state));
        task.setLeaseOwner(owner);
        task.setLeaseExpiresAt(now.plus(properties.getPersistence().getLeaseDuration()));
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        ContentTask saved = taskRepository.save(task);
        log.info("Created task {} topic='{}' preset={} estimate={}", taskId, topic, selection.preset(), estimate.total());
        return saved;
    }

    private GenerationConstraints constraints(CreateTaskRequest request) {
        PipelineProperties.Quality quality = properties.getQuality();
        double threshold = request.qualityThreshold() != null ? request.qualityThreshold() : quality.getDefaultThreshold();
        if (threshold < 0 || threshold > 100 || Double.isNaN(threshold)) {
            throw new TaskValidationException("Quality threshold must be between 0 and 100");
        }
        int maxRefinements = request.maxRefinements() != null ? request.maxRefinements() : quality.getDefaultMaxRefinements();
        if (maxRefinements < 0 || maxRefinements > quality.getMaxRefinementsLimit()) {
            throw new TaskValidationException("Max refinements must be between 0 and " + quality.getMaxRefinementsLimit());
        }
        BigDecimal ceiling = request.budgetCeiling();
        if (ceiling != null && ceiling.signum() <= 0) {
            throw new TaskValidationException("Budget ceiling must be positive");
        }
        List<String> keywords = new ArrayList<>();
        if (request.keywords() != null) {
            request.keywords().stream()
                    .filter(k -> k != null && !k.isBlank())
                    .map(String::trim)
                    .forEach(keywords::add);
        }
        return GenerationConstraints.builder()
                .targetLength(targetLength(request.targetLength()))
                .style(request.style())
                .tone(request.tone())
                .audience(request.audience())
                .keywords(keywords)
                .qualityThreshold(threshold)
                .maxRefinements(maxRefinements)
                .budgetCeiling(ceiling)
                .build();
    }

    private int targetLength(Integer requested) {
        PipelineProperties.Execution cfg = properties.getExecution();
        if (requested == null) {
            return cfg.getDefaultTargetLength();
        }
        if (requested <= 0 || requested > cfg.getMaxTargetLength()) {
            throw new TaskValidationException("Target length must be between 1 and " + cfg.getMaxTargetLength() + " words");
        }
        return requested;
    }

    private ContentTask load(UUID taskId) {
        return taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }
}
