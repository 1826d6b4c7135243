package com.quillflow.quillflow_backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.engine.CancellationRegistry;
import com.quillflow.quillflow_backend.engine.CancellationToken;
import com.quillflow.quillflow_backend.engine.ExecutionEventPublisher;
import com.quillflow.quillflow_backend.engine.PipelineExecutionEngine;
import com.quillflow.quillflow_backend.engine.TaskEventChannelRegistry;
import com.quillflow.quillflow_backend.engine.TaskSnapshotWriter;
import com.quillflow.quillflow_backend.model.domain.ContentTask;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;
import com.quillflow.quillflow_backend.model.dto.CreateTaskRequest;
import com.quillflow.quillflow_backend.model.dto.CreateTaskResponse;
import com.quillflow.quillflow_backend.model.dto.TaskView;
import com.quillflow.quillflow_backend.model.pipeline.PipelineEvent;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;
import com.quillflow.quillflow_backend.model.pipeline.TaskResult;
import com.quillflow.quillflow_backend.repository.ContentTaskRepository;
import com.quillflow.quillflow_backend.repository.CostRecordRepository;
import com.quillflow.quillflow_backend.router.CostEstimator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentTaskServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-11T09:00:00Z");

    @Mock
    private ContentTaskRepository taskRepository;
    @Mock
    private CostRecordRepository costRecordRepository;
    @Mock
    private PipelineExecutionEngine engine;
    @Mock
    private ExecutionEventPublisher eventPublisher;

    private PipelineProperties properties;
    private CancellationRegistry cancellations;
    private ContentTaskService service;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.setInstanceId("node-a");
        cancellations = new CancellationRegistry();
        service = service(Runnable::run);
        lenient().when(taskRepository.save(any(ContentTask.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private ContentTaskService service(Executor pipelineExecutor) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        return new ContentTaskService(
                taskRepository,
                new ModelSelectionResolver(properties),
                new CostEstimator(properties),
                new CostMetricsService(costRecordRepository, properties, clock),
                engine,
                new TaskSnapshotWriter(taskRepository, mapper, properties, Runnable::run, clock),
                new TaskEventChannelRegistry(properties, clock),
                eventPublisher,
                cancellations,
                properties,
                pipelineExecutor,
                clock);
    }

    private ContentTask savedTask() {
        ArgumentCaptor<ContentTask> saved = ArgumentCaptor.forClass(ContentTask.class);
        verify(taskRepository).save(saved.capture());
        return saved.getValue();
    }

    private static CreateTaskRequest request(String topic, BigDecimal ceiling) {
        return new CreateTaskRequest(topic, 1200, "informative", "friendly", "engineers", List.of("solar", " "),
                "balanced", null, 80.0, 2, ceiling, true);
    }

    private static CreateTaskRequest withLimits(Integer targetLength, Double threshold, Integer maxRefinements) {
        return new CreateTaskRequest("renewable energy", targetLength, null, null, null, null,
                null, null, threshold, maxRefinements, null, false);
    }

    private static ContentTask stored(UUID id, TaskStatus status) {
        ContentTask task = new ContentTask();
        task.setId(id);
        task.setTopic("renewable energy");
        task.setStatus(status);
        return task;
    }

    @Test
    @DisplayName("create stores a pending task with estimate and lease, then starts it")
    void createStartsTask() {
        CreateTaskResponse response = service.create(request("  renewable energy trends ", null));

        ArgumentCaptor<ContentTask> saved = ArgumentCaptor.forClass(ContentTask.class);
        verify(taskRepository).save(saved.capture());
        ContentTask task = saved.getValue();
        assertEquals(TaskStatus.PENDING, response.status());
        assertEquals(task.getId().toString(), response.taskId());
        assertEquals("renewable energy trends", task.getTopic());
        assertTrue(task.getLeaseOwner().startsWith("node-a/"));
        assertEquals(new BigDecimal("0.008000"), response.estimatedCost());
        assertFalse(response.budgetWarning());
        assertEquals("/api/tasks/" + task.getId() + "/events", response.subscription().sseUrl());

        ArgumentCaptor<PipelineState> state = ArgumentCaptor.forClass(PipelineState.class);
        verify(engine).execute(state.capture(), eq(task.getLeaseOwner()), any(CancellationToken.class));
        assertEquals(List.of("solar"), state.getValue().getConstraints().getKeywords());
        assertEquals(2, state.getValue().getConstraints().getMaxRefinements());
        assertTrue(service.subscribe(task.getId(), 0).isPresent());
    }

    @Test
    @DisplayName("ceiling below the estimate warns and still runs the task")
    void budgetCeilingWarns() {
        CreateTaskResponse response = service.create(request("renewable energy trends", new BigDecimal("0.001")));

        assertTrue(response.budgetWarning());
        assertTrue(response.budgetWarningReason().contains("ceiling"));
        verify(engine).execute(any(PipelineState.class), anyString(), any(CancellationToken.class));
    }

    @Test
    @DisplayName("blocking budget policy rejects the task without storing it")
    void budgetCeilingBlocks() {
        properties.getBudget().setPolicy(PipelineProperties.BudgetPolicy.BLOCK);

        assertThrows(BudgetExceededException.class,
                () -> service.create(request("renewable energy trends", new BigDecimal("0.001"))));
        verify(taskRepository, never()).save(any());
        verify(engine, never()).execute(any(), anyString(), any());
    }

    @Test
    @DisplayName("invalid requests are rejected before anything is stored")
    void validation() {
        assertThrows(TaskValidationException.class, () -> service.create(request("   ", null)));
        assertThrows(TaskValidationException.class, () -> service.create(request("x".repeat(501), null)));
        assertThrows(TaskValidationException.class, () -> service.create(withLimits(0, null, null)));
        assertThrows(TaskValidationException.class, () -> service.create(withLimits(null, 101.0, null)));
        assertThrows(TaskValidationException.class, () -> service.create(withLimits(null, null, 11)));
        assertThrows(TaskValidationException.class, () -> service.create(withLimits(null, null, -1)));
        assertThrows(TaskValidationException.class,
                () -> service.create(request("renewable energy", BigDecimal.ZERO)));
        assertThrows(TaskValidationException.class, () -> service.create(new CreateTaskRequest("renewable energy",
                null, null, null, null, null, "fast", Map.of("assess", List.of("groq")), null, null, null, false)));
        verify(taskRepository, never()).save(any());
    }

    @Test
    @DisplayName("blocking run returns the engine's terminal view")
    void runBlockingReturnsTerminalView() {
        TaskResult result = new TaskResult("# Title", Map.of("title", "Title"), 85.0, 1, false);
        TaskView terminal = new TaskView("id", "renewable energy", TaskStatus.COMPLETED, null, 1.0,
                BigDecimal.ONE, 85.0, 1, false, result, null);
        when(engine.execute(any(PipelineState.class), startsWith("node-a/"), any(CancellationToken.class))).thenReturn(terminal);

        assertSame(terminal, service.runBlocking(request("renewable energy", null)));
    }

    @Test
    @DisplayName("cancelling an unclaimed task ends it at once with a terminal event")
    void cancelUnclaimed() {
        UUID id = UUID.randomUUID();
        ContentTask task = stored(id, TaskStatus.PENDING);
        when(taskRepository.findById(id)).thenReturn(Optional.of(task));
        when(taskRepository.cancelUnclaimed(id, NOW, TaskStatus.PENDING, TaskStatus.CANCELLED)).thenAnswer(inv -> {
            task.setStatus(TaskStatus.CANCELLED);
            return 1;
        });

        TaskView view = service.cancel(id);

        assertEquals(TaskStatus.CANCELLED, view.status());
        ArgumentCaptor<PipelineEvent> event = ArgumentCaptor.forClass(PipelineEvent.class);
        verify(eventPublisher).publish(event.capture());
        assertTrue(event.getValue().terminal());
        verify(taskRepository, never()).requestCancel(any(), any(), any());
    }

    @Test
    @DisplayName("cancelling a running task sets the store flag and trips the local token")
    void cancelRunning() {
        UUID id = UUID.randomUUID();
        when(taskRepository.findById(id)).thenReturn(Optional.of(stored(id, TaskStatus.RUNNING)));
        when(taskRepository.cancelUnclaimed(id, NOW, TaskStatus.PENDING, TaskStatus.CANCELLED)).thenReturn(0);
        CancellationToken token = cancellations.register(id);

        service.cancel(id);

        verify(taskRepository).requestCancel(id, NOW, TaskStatus.NON_TERMINAL);
        assertTrue(token.isCancelled());
    }

    @Test
    @DisplayName("cancelling a finished task changes nothing")
    void cancelTerminal() {
        UUID id = UUID.randomUUID();
        when(taskRepository.findById(id)).thenReturn(Optional.of(stored(id, TaskStatus.COMPLETED)));

        assertEquals(TaskStatus.COMPLETED, service.cancel(id).status());
        verify(taskRepository, never()).cancelUnclaimed(any(), any(), any(), any());
        verify(taskRepository, never()).requestCancel(any(), any(), any());
    }

    @Test
    @DisplayName("unknown task id is reported as not found")
    void pollUnknown() {
        UUID id = UUID.randomUUID();
        when(taskRepository.findById(id)).thenReturn(Optional.empty());

        assertThrows(TaskNotFoundException.class, () -> service.poll(id));
    }

    @Test
    @DisplayName("resume claims the lease for a new run and restarts from the snapshot with a fresh deadline")
    void resume() {
        service.create(request("renewable energy trends", null));
        ContentTask task = savedTask();
        UUID id = task.getId();

        Duration lease = properties.getPersistence().getLeaseDuration();
        ArgumentCaptor<String> claimedBy = ArgumentCaptor.forClass(String.class);
        when(taskRepository.claimLease(eq(id), claimedBy.capture(), eq(NOW), eq(NOW.plus(lease)),
                eq(TaskStatus.NON_TERMINAL))).thenReturn(1);
        when(taskRepository.findById(id)).thenReturn(Optional.of(task));

        assertTrue(service.resume(id));

        ArgumentCaptor<PipelineState> state = ArgumentCaptor.forClass(PipelineState.class);
        ArgumentCaptor<String> owners = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<CancellationToken> tokens = ArgumentCaptor.forClass(CancellationToken.class);
        verify(engine, times(2)).execute(state.capture(), owners.capture(), tokens.capture());
        // the queued first run and the resumed run never share a lease owner or a token
        assertEquals(task.getLeaseOwner(), owners.getAllValues().get(0));
        assertEquals(claimedBy.getValue(), owners.getAllValues().get(1));
        assertNotEquals(owners.getAllValues().get(0), owners.getAllValues().get(1));
        assertTrue(owners.getAllValues().get(1).startsWith("node-a/"));
        assertNotSame(tokens.getAllValues().get(0), tokens.getAllValues().get(1));
        PipelineState resumed = state.getAllValues().get(1);
        assertEquals("renewable energy trends", resumed.getTopic());
        assertNotNull(resumed.getDeadline());
        assertEquals(NOW.plus(properties.getExecution().getOverallTimeout()), resumed.getDeadline());
        assertNull(resumed.getPhase());
    }

    @Test
    @DisplayName("resume backs off when another instance holds the lease")
    void resumeLost() {
        UUID id = UUID.randomUUID();
        Duration lease = properties.getPersistence().getLeaseDuration();
        when(taskRepository.claimLease(eq(id), startsWith("node-a/"), eq(NOW), eq(NOW.plus(lease)),
                eq(TaskStatus.NON_TERMINAL))).thenReturn(0);

        assertFalse(service.resume(id));
        verify(engine, never()).execute(any(), anyString(), any());
    }

    @Test
    @DisplayName("cancelling a queued task with a live lease sets the flag and trips its token")
    void cancelQueued() {
        service.create(request("renewable energy trends", null));
        ContentTask task = savedTask();
        UUID id = task.getId();
        ArgumentCaptor<CancellationToken> token = ArgumentCaptor.forClass(CancellationToken.class);
        verify(engine).execute(any(PipelineState.class), anyString(), token.capture());
        when(taskRepository.findById(id)).thenReturn(Optional.of(task));
        when(taskRepository.cancelUnclaimed(id, NOW, TaskStatus.PENDING, TaskStatus.CANCELLED)).thenReturn(0);

        service.cancel(id);

        verify(taskRepository).requestCancel(id, NOW, TaskStatus.NON_TERMINAL);
        assertTrue(token.getValue().isCancelled());
    }

    @Test
    @DisplayName("blocking run that times out records a durable cancel request")
    void runBlockingTimeoutCancels() {
        properties.getExecution().setOverallTimeout(Duration.ofMillis(20));
        properties.getPersistence().setWriteTimeout(Duration.ofMillis(5));
        AtomicReference<ContentTask> stored = new AtomicReference<>();
        when(taskRepository.save(any(ContentTask.class))).thenAnswer(inv -> {
            stored.set(inv.getArgument(0));
            return inv.getArgument(0);
        });
        when(taskRepository.findById(any(UUID.class))).thenAnswer(inv -> Optional.ofNullable(stored.get()));
        // the run stays queued and never reaches the engine
        ContentTaskService queued = service(r -> { });

        TaskView view = queued.runBlocking(request("renewable energy trends", null));

        UUID id = stored.get().getId();
        assertEquals(TaskStatus.PENDING, view.status());
        verify(taskRepository).cancelUnclaimed(id, NOW, TaskStatus.PENDING, TaskStatus.CANCELLED);
        verify(taskRepository).requestCancel(id, NOW, TaskStatus.NON_TERMINAL);
        assertTrue(cancellations.find(id).map(CancellationToken::isCancelled).orElse(false));
        verify(engine, never()).execute(any(), anyString(), any());
    }
}
