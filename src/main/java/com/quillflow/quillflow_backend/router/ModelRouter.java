package com.quillflow.quillflow_backend.router;

import com.quillflow.quillflow_backend.config.PipelineProperties;
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
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.service.CostMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Walks a phase's fallback chain in order until one provider returns usable text.
 * Every attempt, failed or not, is recorded as its own cost record; only the successful
 * attempt carries a non-zero actual cost.
 */
@Slf4j
@Service
public class ModelRouter {

    private final LlmClientFactory clientFactory;
    private final ProviderCredentialsResolver credentialsResolver;
    private final CostEstimator costEstimator;
    private final CostMetricsService costMetrics;
    private final PipelineProperties properties;
    private final Executor providerCallExecutor;
    private final Clock clock;

    public ModelRouter(LlmClientFactory clientFactory,
                       ProviderCredentialsResolver credentialsResolver,
                       CostEstimator costEstimator,
                       CostMetricsService costMetrics,
                       PipelineProperties properties,
                       @Qualifier("providerCallExecutor") Executor providerCallExecutor,
                       Clock clock) {
        this.clientFactory = clientFactory;
        this.credentialsResolver = credentialsResolver;
        this.costEstimator = costEstimator;
        this.costMetrics = costMetrics;
        this.properties = properties;
        this.providerCallExecutor = providerCallExecutor;
        this.clock = clock;
    }

    public RoutedResponse invoke(Phase phase, LlmRequest request, PhaseContext context) {
        List<LlmProvider> chain = context.selection().chainFor(phase);
        List<String> failures = new ArrayList<>();
        int attempt = 0;

        for (LlmProvider provider : chain) {
            context.cancellation().throwIfCancelled();
            attempt++;
            long startedNanos = System.nanoTime();
            BigDecimal estimated = BigDecimal.ZERO;
            String model = null;
            try {
                LlmClient client = clientFor(provider);
                estimated = costEstimator.estimateCall(client, request);
                ProviderCredentials credentials = credentialsResolver.resolve(provider)
                        .orElseThrow(() -> new ProviderUnavailableException(provider, LlmFailureKind.NOT_CONFIGURED,
                                provider.getDisplayName() + " has no credentials configured or is disabled"));
                model = request.getModel() != null ? request.getModel() : credentials.model();

                log.info("[Router] task={} phase={} attempt={} provider={}", context.taskId(), phase.key(), attempt, provider);
                LlmResponse response = call(provider, client, request, credentials, context, phase);

                RoutedResponse routed = bill(phase, provider, client, request, response, attempt, estimated,
                        elapsedMs(startedNanos), context);
                log.info("[Router] task={} phase={} served by {} ({} in / {} out, cost {})", context.taskId(),
                        phase.key(), provider, routed.inputTokens(), routed.outputTokens(), routed.actualCost());
                return routed;
            } catch (ProviderUnavailableException e) {
                AttemptOutcome outcome = outcomeOf(e.getKind());
                recordFailure(context, phase, provider, model, attempt, estimated, outcome, e.getMessage(), elapsedMs(startedNanos));
                if (e.getKind() == LlmFailureKind.CANCELLED) {
                    throw new TaskCancelledException(context.taskId());
                }
                failures.add(provider.name() + " " + e.getKind() + ": " + e.getMessage());
                log.warn("[Router] task={} phase={} provider {} unavailable ({}), falling back", context.taskId(),
                        phase.key(), provider, e.getKind());
            } catch (PipelineTimeoutException e) {
                recordFailure(context, phase, provider, model, attempt, estimated, AttemptOutcome.TIMEOUT,
                        e.getMessage(), elapsedMs(startedNanos));
                throw e;
            }
        }

        log.error("[Router] task={} phase={} chain exhausted after {} attempt(s)", context.taskId(), phase.key(), attempt);
        throw new ChainExhaustedException(phase, failures);
    }

    private LlmClient clientFor(LlmProvider provider) {
        if (!clientFactory.isRegistered(provider)) {
            throw new ProviderUnavailableException(provider, LlmFailureKind.NOT_CONFIGURED,
                    "No client registered for " + provider.getDisplayName());
        }
        return clientFactory.getClient(provider);
    }

    private LlmResponse call(LlmProvider provider, LlmClient client, LlmRequest request,
                             ProviderCredentials credentials, PhaseContext context, Phase phase) {
        Duration remaining = Duration.between(clock.instant(), context.deadline());
        if (remaining.isNegative() || remaining.isZero()) {
            throw new PipelineTimeoutException(phase, properties.getExecution().getOverallTimeout());
        }
        Duration perCall = properties.getExecution().getProviderCallTimeout();
        boolean deadlineBound = remaining.compareTo(perCall) < 0;
        Duration timeout = deadlineBound ? remaining : perCall;

        // cancel(true) on a FutureTask interrupts the worker blocked in the exchange
        FutureTask<LlmResponse> future = new FutureTask<>(() -> client.call(request, credentials));
        try {
            providerCallExecutor.execute(future);
        } catch (RejectedExecutionException e) {
            throw new ProviderUnavailableException(provider, LlmFailureKind.TRANSPORT,
                    "No provider-call worker free for " + provider.getDisplayName());
        }
        context.cancellation().track(future);
        LlmResponse response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (deadlineBound) {
                throw new PipelineTimeoutException(phase, properties.getExecution().getOverallTimeout());
            }
            throw new ProviderUnavailableException(provider, LlmFailureKind.TIMEOUT,
                    provider.getDisplayName() + " did not answer within " + timeout);
        } catch (CancellationException e) {
            throw new ProviderUnavailableException(provider, LlmFailureKind.CANCELLED, "Call cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ProviderUnavailableException(provider, LlmFailureKind.CANCELLED, "Worker interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ProviderUnavailableException(provider, LlmFailureKind.TRANSPORT,
                    provider.getDisplayName() + " client threw: " + cause.getMessage());
        } finally {
            context.cancellation().untrack(future);
        }

        if (!response.isSuccess()) {
            LlmFailureKind kind = response.getFailureKind() != null ? response.getFailureKind() : LlmFailureKind.SERVER_ERROR;
            throw new ProviderUnavailableException(provider, kind, response.getErrorMessage());
        }
        if (response.getRawText() == null || response.getRawText().isBlank()) {
            throw new ProviderUnavailableException(provider, LlmFailureKind.MALFORMED_RESPONSE,
                    provider.getDisplayName() + " returned empty text");
        }
        return response;
    }

    private RoutedResponse bill(Phase phase, LlmProvider provider, LlmClient client, LlmRequest request,
                                LlmResponse response, int attempt, BigDecimal estimated, long durationMs,
                                PhaseContext context) {
        int in = response.getInputTokens();
        int out = response.getOutputTokens();
        if (in == 0 && out == 0) {
            // provider reported no usage; price on our own counts
            in = client.estimateTokens(request.getSystemPrompt()) + client.estimateTokens(request.getUserPrompt());
            out = client.estimateTokens(response.getRawText());
        }
        BigDecimal actual = costEstimator.price(provider, in + out);

        costMetrics.record(CostRecord.builder()
                .taskId(context.taskId())
                .phase(phase)
                .provider(provider)
                .model(response.getModel())
                .attempt(attempt)
                .estimatedCost(estimated)
                .actualCost(actual)
                .inputTokens(in)
                .outputTokens(out)
                .outcome(AttemptOutcome.SUCCESS)
                .durationMs(durationMs)
                .createdAt(clock.instant())
                .build());

        return new RoutedResponse(response.getRawText(), provider, response.getModel(), in, out, actual, attempt);
    }

    private void recordFailure(PhaseContext context, Phase phase, LlmProvider provider, String model, int attempt,
                               BigDecimal estimated, AttemptOutcome outcome, String message, long durationMs) {
        costMetrics.record(CostRecord.builder()
                .taskId(context.taskId())
                .phase(phase)
                .provider(provider)
                .model(model)
                .attempt(attempt)
                .estimatedCost(estimated)
                .actualCost(BigDecimal.ZERO)
                .outcome(outcome)
                .errorMessage(message)
                .durationMs(durationMs)
                .createdAt(clock.instant())
                .build());
    }

    private static AttemptOutcome outcomeOf(LlmFailureKind kind) {
        if (kind == LlmFailureKind.TIMEOUT) return AttemptOutcome.TIMEOUT;
        if (kind == LlmFailureKind.CANCELLED) return AttemptOutcome.CANCELLED;
        return AttemptOutcome.FAILURE;
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
