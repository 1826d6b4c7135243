package com.quillflow.quillflow_backend.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.executor.phase.PhaseContext;
import com.quillflow.quillflow_backend.executor.phase.PhaseNode;
import com.quillflow.quillflow_backend.executor.phase.PhaseNodeRegistry;
import com.quillflow.quillflow_backend.model.domain.ContentTask;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;
import com.quillflow.quillflow_backend.model.dto.TaskView;
import com.quillflow.quillflow_backend.model.pipeline.GenerationConstraints;
import com.quillflow.quillflow_backend.model.pipeline.ModelPreset;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.model.pipeline.PipelineEvent;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;
import com.quillflow.quillflow_backend.model.pipeline.QualityAssessment;
import com.quillflow.quillflow_backend.repository.ContentTaskRepository;
import com.quillflow.quillflow_backend.router.ChainExhaustedException;
import com.quillflow.quillflow_backend.service.TaskViewMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PipelineExecutionEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-11T09:00:00Z");
    private static final String OWNER = "node-a/run-1";

    @Mock
    private ContentTaskRepository repository;
    @Mock
    private SimpMessagingTemplate messagingTemplate;
    @Mock
    private ObjectProvider<RedisWebSocketBridge> redisBridge;

    private final Deque<Double> scores = new ArrayDeque<>();
    private final List<PhaseNode> nodes = new ArrayList<>();

    private PipelineProperties properties;
    private TaskEventChannelRegistry channels;
    private CancellationRegistry cancellations;
    private ContentTask row;
    private UUID taskId;
    private Executor ioExecutor = Runnable::run;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getPersistence().getSnapshotRetry().setMaxRetries(1);
        properties.getPersistence().getSnapshotRetry().setBackoffMs(1);
        channels = new TaskEventChannelRegistry(properties, Clock.fixed(NOW, ZoneOffset.UTC));
        cancellations = new CancellationRegistry();

        taskId = UUID.randomUUID();
        row = new ContentTask();
        row.setId(taskId);
        row.setTopic("renewable energy trends");
        row.setStatus(TaskStatus.PENDING);
        row.setLeaseOwner(OWNER);
        lenient().when(repository.findById(taskId)).thenAnswer(inv -> Optional.of(row));
        lenient().when(repository.save(any(ContentTask.class))).thenAnswer(inv -> inv.getArgument(0));

        nodes.add(new FakeNode(Phase.RESEARCH, (s, c) -> { s.setResearchNotes("notes"); s.addCost(new BigDecimal("0.001")); }));
        nodes.add(new FakeNode(Phase.OUTLINE, (s, c) -> s.setOutline("# Outline")));
        nodes.add(new FakeNode(Phase.DRAFT, (s, c) -> s.setDraft("draft v0")));
        nodes.add(new FakeNode(Phase.ASSESS, (s, c) -> assess(s)));
        nodes.add(new FakeNode(Phase.REFINE, (s, c) -> {
            s.setRefinementCount(s.getRefinementCount() + 1);
            s.setDraft("draft v" + s.getRefinementCount());
        }));
        nodes.add(new FakeNode(Phase.FINALIZE, (s, c) -> {
            boolean passed = s.getQuality().passed();
            s.setFinalContent(passed ? s.getDraft() : s.getBestDraft());
            s.setNeedsReview(!passed);
            s.setMetadata(new LinkedHashMap<>(Map.of("title", "Renewable Energy Trends")));
        }));
    }

    private void assess(PipelineState s) {
        double score = scores.removeFirst();
        double threshold = s.getConstraints().getQualityThreshold();
        QualityAssessment a = new QualityAssessment(Map.of(), score, threshold, score >= threshold, Map.of(),
                s.getRefinementCount(), NOW);
        s.setQuality(a);
        s.getAssessments().add(a);
        if (s.getBestScore() == null || score > s.getBestScore()) {
            s.setBestScore(score);
            s.setBestDraft(s.getDraft());
        }
    }

    private PipelineExecutionEngine engine() {
        PhaseNodeRegistry registry = new PhaseNodeRegistry(nodes);
        registry.init();
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        TaskSnapshotWriter writer = new TaskSnapshotWriter(repository, mapper, properties, ioExecutor, clock);
        ExecutionEventPublisher publisher = new ExecutionEventPublisher(channels, messagingTemplate, redisBridge);
        return new PipelineExecutionEngine(registry, writer, publisher, cancellations, properties, clock);
    }

    private TaskView run(PipelineState state) {
        return engine().execute(state, OWNER, cancellations.register(taskId));
    }

    private PipelineState state(double threshold, int maxRefinements) {
        return PipelineState.builder()
                .taskId(taskId.toString())
                .topic("renewable energy trends")
                .constraints(GenerationConstraints.builder()
                        .targetLength(800)
                        .qualityThreshold(threshold)
                        .maxRefinements(maxRefinements)
                        .build())
                .selection(ModelPreset.BALANCED.toSelection())
                .createdAt(NOW)
                .build();
    }

    private static List<PipelineEvent> drain(TaskSubscription sub) throws InterruptedException {
        List<PipelineEvent> out = new ArrayList<>();
        PipelineEvent e;
        while ((e = sub.poll(Duration.ofMillis(10))) != null) {
            out.add(e);
        }
        return out;
    }

    @Test
    @DisplayName("failed first assessment refines once, then passes and completes")
    void refineThenPass() throws InterruptedException {
        scores.add(62.0);
        scores.add(85.0);
        TaskSubscription sub = channels.open(taskId).subscribe(0);
        PipelineState state = state(80, 3);

        TaskView view = run(state);

        assertEquals(TaskStatus.COMPLETED, view.status());
        assertEquals(List.of("research", "outline", "draft", "assess(score=62.0, fail)", "refine",
                "assess(score=85.0, pass)", "finalize"), state.getPhaseTrace());
        assertEquals(7, state.getPhaseInvocations());
        assertEquals(1, view.refinementCount());
        assertEquals(85.0, view.qualityScore());
        assertEquals("draft v1", view.result().content());
        assertFalse(view.result().needsReview());
        assertEquals(1.0, view.progress());

        List<PipelineEvent> events = drain(sub);
        assertEquals(8, events.size());
        assertEquals(TaskStatus.AWAITING_REFINEMENT, events.get(3).status());
        PipelineEvent terminal = events.get(events.size() - 1);
        assertTrue(terminal.terminal());
        assertEquals(view.result(), terminal.result());
        assertEquals(view, TaskViewMapper.toView(row));
        for (int i = 1; i < events.size(); i++) {
            assertTrue(events.get(i).progressFraction() >= events.get(i - 1).progressFraction());
            assertEquals(events.get(i - 1).sequence() + 1, events.get(i).sequence());
        }
    }

    @Test
    @DisplayName("zero refinements finalize the failing draft and flag it for review")
    void noRefinementsAllowed() {
        scores.add(62.0);
        PipelineState state = state(80, 0);

        TaskView view = run(state);

        assertEquals(TaskStatus.COMPLETED, view.status());
        assertEquals(5, state.getPhaseInvocations());
        assertEquals(0, view.refinementCount());
        assertTrue(view.result().needsReview());
        assertEquals(62.0, view.result().qualityScore());
        assertNull(row.getLeaseOwner());
    }

    @Test
    @DisplayName("exhausted provider chain fails the task with the phase in the error")
    void chainExhaustedFails() {
        nodes.removeIf(n -> n.supportedPhase() == Phase.DRAFT);
        nodes.add(new FakeNode(Phase.DRAFT, (s, c) -> {
            throw new ChainExhaustedException(Phase.DRAFT, List.of("GROQ SERVER_ERROR: boom"));
        }));

        TaskView view = run(state(80, 3));

        assertEquals(TaskStatus.FAILED, view.status());
        assertTrue(view.error().contains("draft"));
        assertNull(view.result());
        assertEquals(TaskStatus.FAILED, row.getStatus());
        assertEquals(Phase.OUTLINE, row.getPhase());
    }

    @Test
    @DisplayName("cancel flag seen at a snapshot stops the run at the next boundary")
    void cancelRequestedInStore() {
        nodes.removeIf(n -> n.supportedPhase() == Phase.RESEARCH);
        nodes.add(new FakeNode(Phase.RESEARCH, (s, c) -> {
            s.setResearchNotes("notes");
            row.setCancelRequested(true);
        }));
        PipelineState state = state(80, 3);

        TaskView view = run(state);

        assertEquals(TaskStatus.CANCELLED, view.status());
        assertEquals(List.of("research"), state.getPhaseTrace());
        assertNull(view.error());
        assertTrue(cancellations.find(taskId).isEmpty());
    }

    @Test
    @DisplayName("snapshot write failure fails the task after retries")
    void persistenceFailure() {
        lenient().when(repository.save(any(ContentTask.class)))
                .thenAnswer(inv -> inv.getArgument(0))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        TaskView view = run(state(80, 3));

        assertEquals(TaskStatus.FAILED, view.status());
        assertTrue(view.error().contains("Failed to persist state after phase research"));
    }

    @Test
    @DisplayName("run superseded by a later claim stops before any phase and writes nothing")
    void leaseLost() {
        row.setLeaseOwner("node-a/run-2");
        PipelineState state = state(80, 3);

        TaskView view = run(state);

        assertNull(view);
        assertTrue(state.getPhaseTrace().isEmpty());
        assertEquals(TaskStatus.PENDING, row.getStatus());
        assertFalse(channels.open(taskId).isClosed());
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("cancel requested while the task was queued stops it before the first phase")
    void cancelledWhileQueued() {
        row.setCancelRequested(true);
        PipelineState state = state(80, 3);

        TaskView view = run(state);

        assertEquals(TaskStatus.CANCELLED, view.status());
        assertTrue(state.getPhaseTrace().isEmpty());
        assertNull(state.getResearchNotes());
    }

    @Test
    @DisplayName("token cancelled before the run is dequeued stops it before the first phase")
    void tokenCancelledWhileQueued() {
        CancellationToken token = cancellations.register(taskId);
        token.cancel();
        PipelineState state = state(80, 3);

        TaskView view = engine().execute(state, OWNER, token);

        assertEquals(TaskStatus.CANCELLED, view.status());
        assertTrue(state.getPhaseTrace().isEmpty());
    }

    @Test
    @DisplayName("cancel landing during an in-flight provider call ends cancelled, never completed")
    void cancelDuringProviderCall() {
        nodes.removeIf(n -> n.supportedPhase() == Phase.DRAFT);
        nodes.add(new FakeNode(Phase.DRAFT, (s, c) -> {
            // the router abandons the call once the token trips
            c.cancellation().cancel();
            c.cancellation().throwIfCancelled();
        }));
        PipelineState state = state(80, 3);

        TaskView view = run(state);

        assertEquals(TaskStatus.CANCELLED, view.status());
        assertEquals(TaskStatus.CANCELLED, row.getStatus());
        assertEquals(List.of("research", "outline"), state.getPhaseTrace());
        assertNull(view.result());
        assertTrue(view.progress() < 1.0);
    }

    @Test
    @DisplayName("cancel accepted after finalize is stored as cancelled with progress below 1.0")
    void cancelAfterFinalize() throws InterruptedException {
        scores.add(90.0);
        nodes.removeIf(n -> n.supportedPhase() == Phase.FINALIZE);
        nodes.add(new FakeNode(Phase.FINALIZE, (s, c) -> {
            s.setFinalContent(s.getDraft());
            row.setCancelRequested(true);
        }));
        TaskSubscription sub = channels.open(taskId).subscribe(0);

        TaskView view = run(state(80, 3));

        assertEquals(TaskStatus.CANCELLED, view.status());
        assertTrue(view.progress() < 1.0);
        List<PipelineEvent> events = drain(sub);
        assertTrue(events.stream().allMatch(e -> e.progressFraction() < 1.0));
        assertTrue(events.get(events.size() - 1).terminal());
    }

    @Test
    @DisplayName("saturated write executor still ends the run with a failed terminal event")
    void writeExecutorSaturated() throws InterruptedException {
        ioExecutor = r -> {
            throw new TaskRejectedException("ioExecutor saturated");
        };
        TaskEventChannel channel = channels.open(taskId);
        TaskSubscription sub = channel.subscribe(0);

        TaskView view = run(state(80, 3));

        assertEquals(TaskStatus.FAILED, view.status());
        assertTrue(view.error().contains("ioExecutor saturated"));
        List<PipelineEvent> events = drain(sub);
        assertEquals(1, events.size());
        assertTrue(events.get(0).terminal());
        assertEquals(TaskStatus.FAILED, events.get(0).status());
        assertTrue(channel.isClosed());
        assertTrue(cancellations.find(taskId).isEmpty());
    }

    @Test
    @DisplayName("expired deadline fails the task before the next phase")
    void deadlineExceeded() {
        PipelineState state = state(80, 3);
        state.setDeadline(NOW.minusSeconds(1));

        TaskView view = run(state);

        assertEquals(TaskStatus.FAILED, view.status());
        assertNotNull(view.error());
        assertTrue(state.getPhaseTrace().isEmpty());
    }

    @Test
    @DisplayName("resumed state continues after its last completed phase")
    void resumesFromSnapshot() {
        scores.add(90.0);
        PipelineState state = state(80, 3);
        state.setPhase(Phase.OUTLINE);
        state.setPhaseInvocations(2);
        state.getPhaseTrace().addAll(List.of("research", "outline"));

        TaskView view = run(state);

        assertEquals(TaskStatus.COMPLETED, view.status());
        assertEquals(List.of("research", "outline", "draft", "assess(score=90.0, pass)", "finalize"), state.getPhaseTrace());
    }

    private static final class FakeNode implements PhaseNode {

        private final Phase phase;
        private final BiConsumer<PipelineState, PhaseContext> body;

        FakeNode(Phase phase, BiConsumer<PipelineState, PhaseContext> body) {
            this.phase = phase;
            this.body = body;
        }

        @Override
        public Phase supportedPhase() {
            return phase;
        }

        @Override
        public PipelineState execute(PipelineState state, PhaseContext context) {
            body.accept(state, context);
            return state;
        }
    }
}
