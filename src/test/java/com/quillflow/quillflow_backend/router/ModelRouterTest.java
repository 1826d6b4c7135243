package com.quillflow.quillflow_backend.router;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.engine.CancellationToken;
import com.quillflow.quillflow_backend.engine.PipelineTimeoutException;
import com.quillflow.quillflow_backend.engine.TaskCancelledException;
import com.quillflow.quillflow_backend.executor.llm.LlmClient;
import com.quillflow.quillflow_backend.executor.llm.LlmClientFactory;
import com.quillflow.quillflow_backend.executor.llm.ProviderCredentials;
import com.quillflow.quillflow_backend.executor.llm.ProviderCredentialsResolver;
import com.quillflow.quillflow_backend.executor.phase.PhaseContext;
import com.quillflow.quillflow_backend.model.domain.AttemptOutcome;
import com.quillflow.quillflow_backend.model.domain.CostRecord;
import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.llm.LlmFailureKind;
import com.quillflow.quillflow_backend.model.llm.LlmRequest;
import com.quillflow.quillflow_backend.model.llm.LlmResponse;
import com.quillflow.quillflow_backend.model.pipeline.ModelPreset;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.service.CostMetricsService;
import org.junit.jupiter.api.AfterEach;
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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ModelRouterTest {

    private static final Instant NOW = Instant.parse("2026-03-11T09:00:00Z");

    @Mock
    private LlmClientFactory clientFactory;
    @Mock
    private ProviderCredentialsResolver credentialsResolver;
    @Mock
    private CostMetricsService costMetrics;

    private final Map<LlmProvider, ScriptedClient> clients = new EnumMap<>(LlmProvider.class);
    private final ExecutorService callPool = Executors.newCachedThreadPool();
    private PipelineProperties properties;
    private ModelRouter router;
    private CancellationToken token;
    private PhaseContext context;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        router = router(Runnable::run);

        for (LlmProvider p : LlmProvider.values()) {
            clients.put(p, new ScriptedClient(p));
        }
        lenient().when(clientFactory.isRegistered(any())).thenReturn(true);
        lenient().when(clientFactory.getClient(any())).thenAnswer(inv -> clients.get(inv.<LlmProvider>getArgument(0)));
        lenient().when(credentialsResolver.resolve(any()))
                .thenReturn(Optional.of(new ProviderCredentials("key", "http://localhost", "model")));

        UUID taskId = UUID.randomUUID();
        token = new CancellationToken(taskId);
        context = new PhaseContext(taskId, ModelPreset.BALANCED.toSelection(), token, NOW.plus(Duration.ofMinutes(15)));
    }

    @AfterEach
    void tearDown() {
        callPool.shutdownNow();
    }

    private ModelRouter router(Executor providerCallExecutor) {
        return new ModelRouter(clientFactory, credentialsResolver, new CostEstimator(properties), costMetrics,
                properties, providerCallExecutor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static LlmRequest request() {
        return LlmRequest.of("system", "write a draft", 2000, 0.7);
    }

    private List<CostRecord> recorded(int expected) {
        ArgumentCaptor<CostRecord> captor = ArgumentCaptor.forClass(CostRecord.class);
        verify(costMetrics, times(expected)).record(captor.capture());
        return captor.getAllValues();
    }

    @Test
    @DisplayName("primary success bills one attempt at the provider's rate")
    void primarySucceeds() {
        clients.get(LlmProvider.GROQ).respond(LlmResponse.ok("draft text", "llama", 1000, 1000));

        RoutedResponse response = router.invoke(Phase.DRAFT, request(), context);

        assertEquals(LlmProvider.GROQ, response.provider());
        assertEquals(1, response.attempts());
        assertEquals(new BigDecimal("0.001200"), response.actualCost());
        List<CostRecord> records = recorded(1);
        assertEquals(AttemptOutcome.SUCCESS, records.get(0).getOutcome());
        assertEquals(0, clients.get(LlmProvider.OPENAI).calls.get());
    }

    @Test
    @DisplayName("fallback records a zero-cost failure and bills only the serving provider")
    void fallbackSplitsBilling() {
        clients.get(LlmProvider.GROQ).respond(LlmResponse.error(LlmFailureKind.RATE_LIMITED, "429 from Groq"));
        clients.get(LlmProvider.OPENAI).respond(LlmResponse.ok("draft text", "gpt-4o", 1000, 500));

        RoutedResponse response = router.invoke(Phase.DRAFT, request(), context);

        assertEquals(LlmProvider.OPENAI, response.provider());
        assertEquals(2, response.attempts());
        assertEquals(new BigDecimal("0.007500"), response.actualCost());

        List<CostRecord> records = recorded(2);
        assertEquals(LlmProvider.GROQ, records.get(0).getProvider());
        assertEquals(AttemptOutcome.FAILURE, records.get(0).getOutcome());
        assertEquals(0, BigDecimal.ZERO.compareTo(records.get(0).getActualCost()));
        assertEquals(1, records.get(0).getAttempt());
        assertEquals(LlmProvider.OPENAI, records.get(1).getProvider());
        assertEquals(AttemptOutcome.SUCCESS, records.get(1).getOutcome());
        assertEquals(2, records.get(1).getAttempt());
        assertEquals(Phase.DRAFT, records.get(1).getPhase());
    }

    @Test
    @DisplayName("every provider failing exhausts the chain with one record per attempt")
    void chainExhausted() {
        clients.values().forEach(c -> c.respond(LlmResponse.error(LlmFailureKind.SERVER_ERROR, "boom")));

        ChainExhaustedException e = assertThrows(ChainExhaustedException.class,
                () -> router.invoke(Phase.DRAFT, request(), context));

        assertEquals(Phase.DRAFT, e.getPhase());
        assertEquals(3, e.getFailures().size());
        assertTrue(recorded(3).stream().allMatch(r -> r.getOutcome() == AttemptOutcome.FAILURE));
    }

    @Test
    @DisplayName("provider without credentials is skipped")
    void missingCredentialsFallsThrough() {
        lenient().when(credentialsResolver.resolve(LlmProvider.GROQ)).thenReturn(Optional.empty());
        clients.get(LlmProvider.OPENAI).respond(LlmResponse.ok("text", "gpt-4o", 10, 10));

        RoutedResponse response = router.invoke(Phase.DRAFT, request(), context);

        assertEquals(LlmProvider.OPENAI, response.provider());
        assertEquals(0, clients.get(LlmProvider.GROQ).calls.get());
        assertTrue(recorded(2).get(0).getErrorMessage().contains("credentials"));
    }

    @Test
    @DisplayName("empty text counts as a malformed response")
    void emptyTextFallsThrough() {
        clients.get(LlmProvider.GROQ).respond(LlmResponse.ok("   ", "llama", 5, 0));
        clients.get(LlmProvider.OPENAI).respond(LlmResponse.ok("text", "gpt-4o", 10, 10));

        assertEquals(LlmProvider.OPENAI, router.invoke(Phase.DRAFT, request(), context).provider());
    }

    @Test
    @DisplayName("cancelled task stops before calling any provider")
    void cancelledBeforeCall() {
        token.cancel();

        assertThrows(TaskCancelledException.class, () -> router.invoke(Phase.DRAFT, request(), context));
        verify(costMetrics, never()).record(any());
    }

    @Test
    @DisplayName("provider reporting no usage is billed on estimated tokens")
    void estimatedUsage() {
        clients.get(LlmProvider.GROQ).respond(LlmResponse.ok("x".repeat(400), "llama", 0, 0));

        RoutedResponse response = router.invoke(Phase.DRAFT, request(), context);

        assertEquals(100, response.outputTokens());
        assertTrue(response.inputTokens() > 0);
    }

    @Test
    @DisplayName("cancelling during a provider call interrupts it and ends the phase as cancelled")
    void cancelDuringCall() throws Exception {
        ScriptedClient groq = clients.get(LlmProvider.GROQ);
        groq.hang();
        ModelRouter pooled = router(callPool);

        Future<?> canceller = callPool.submit(() -> {
            groq.entered.await(5, TimeUnit.SECONDS);
            token.cancel();
            return null;
        });

        assertThrows(TaskCancelledException.class, () -> pooled.invoke(Phase.DRAFT, request(), context));
        canceller.get(5, TimeUnit.SECONDS);

        List<CostRecord> records = recorded(1);
        assertEquals(AttemptOutcome.CANCELLED, records.get(0).getOutcome());
        assertEquals(0, BigDecimal.ZERO.compareTo(records.get(0).getActualCost()));
        assertTrue(groq.interrupted.await(5, TimeUnit.SECONDS));
        assertEquals(0, clients.get(LlmProvider.OPENAI).calls.get());
    }

    @Test
    @DisplayName("provider exceeding the per-call timeout is recorded as a timeout and the chain moves on")
    void perCallTimeoutFallsBack() {
        properties.getExecution().setProviderCallTimeout(Duration.ofMillis(100));
        clients.get(LlmProvider.GROQ).hang();
        clients.get(LlmProvider.OPENAI).respond(LlmResponse.ok("draft text", "gpt-4o", 10, 10));

        RoutedResponse response = router(callPool).invoke(Phase.DRAFT, request(), context);

        assertEquals(LlmProvider.OPENAI, response.provider());
        assertEquals(2, response.attempts());
        List<CostRecord> records = recorded(2);
        assertEquals(AttemptOutcome.TIMEOUT, records.get(0).getOutcome());
        assertEquals(AttemptOutcome.SUCCESS, records.get(1).getOutcome());
    }

    @Test
    @DisplayName("call cut short by the task deadline fails the task instead of falling back")
    void deadlineBoundTimeout() {
        clients.get(LlmProvider.GROQ).hang();
        PhaseContext nearDeadline = new PhaseContext(context.taskId(), ModelPreset.BALANCED.toSelection(), token,
                NOW.plus(Duration.ofMillis(50)));

        assertThrows(PipelineTimeoutException.class,
                () -> router(callPool).invoke(Phase.DRAFT, request(), nearDeadline));

        List<CostRecord> records = recorded(1);
        assertEquals(AttemptOutcome.TIMEOUT, records.get(0).getOutcome());
        assertEquals(0, clients.get(LlmProvider.OPENAI).calls.get());
    }

    @Test
    @DisplayName("deadline already passed fails before any provider is called")
    void deadlinePassed() {
        PhaseContext expired = new PhaseContext(context.taskId(), ModelPreset.BALANCED.toSelection(), token, NOW);

        assertThrows(PipelineTimeoutException.class, () -> router.invoke(Phase.DRAFT, request(), expired));
        assertEquals(0, clients.get(LlmProvider.GROQ).calls.get());
    }

    @Test
    @DisplayName("saturated call pool counts as an unavailable provider")
    void saturatedPoolFallsThrough() {
        ModelRouter saturated = router(r -> {
            throw new RejectedExecutionException("pool full");
        });

        ChainExhaustedException e = assertThrows(ChainExhaustedException.class,
                () -> saturated.invoke(Phase.DRAFT, request(), context));

        assertEquals(3, e.getFailures().size());
        assertTrue(e.getFailures().stream().allMatch(f -> f.contains("No provider-call worker free")));
        assertTrue(recorded(3).stream().allMatch(r -> r.getOutcome() == AttemptOutcome.FAILURE));
    }

    private static final class ScriptedClient implements LlmClient {

        private final LlmProvider provider;
        private final AtomicInteger calls = new AtomicInteger();
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch interrupted = new CountDownLatch(1);
        private volatile boolean hang;
        private LlmResponse response = LlmResponse.error(LlmFailureKind.SERVER_ERROR, "not scripted");

        void hang() {
            this.hang = true;
        }

        ScriptedClient(LlmProvider provider) {
            this.provider = provider;
        }

        void respond(LlmResponse response) {
            this.response = response;
        }

        @Override
        public LlmProvider getProvider() {
            return provider;
        }

        @Override
        public String getDefaultModel() {
            return provider.getDefaultModel();
        }

        @Override
        public BigDecimal getCostPerThousandTokens() {
            return provider.getDefaultCostPerThousandTokens();
        }

        @Override
        public LlmResponse call(LlmRequest request, ProviderCredentials credentials) {
            calls.incrementAndGet();
            if (hang) {
                entered.countDown();
                try {
                    new CountDownLatch(1).await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return LlmResponse.error(LlmFailureKind.TRANSPORT, "interrupted");
            }
            return response;
        }
    }
}
