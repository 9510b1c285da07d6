/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.ensembleai.core.client;

import com.google.common.base.Strings;
import com.phonepe.ensembleai.core.config.AgentConfig;
import com.phonepe.ensembleai.core.config.AgentConfigValidator;
import com.phonepe.ensembleai.core.engine.CancellationToken;
import com.phonepe.ensembleai.core.errors.EnsembleError;
import com.phonepe.ensembleai.core.errors.EnsembleException;
import com.phonepe.ensembleai.core.errors.ErrorType;
import com.phonepe.ensembleai.core.utils.AgentUtils;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.Policy;
import dev.failsafe.RetryPolicy;
import dev.failsafe.Timeout;
import dev.failsafe.TimeoutExceededException;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A live, invocable agent. Wraps a {@link TextGenerator} with the agent's configuration and adds retries with
 * exponential backoff, a hard timeout per attempt, cancellation checks and lifecycle management.
 * <p>
 * A client is safe to call from multiple threads. Once closed it rejects all further invocations.
 */
@Slf4j
public class AgentClient implements AutoCloseable {
    public static final String TEMPERATURE_PARAM = "temperature";
    public static final String MAX_TOKENS_PARAM = "max_tokens";
    public static final String MAX_TOKENS_ALT_PARAM = "maxTokens";
    public static final String MODEL_PARAM = "model";
    public static final String SYSTEM_PROMPT_PARAM = "system_prompt";
    public static final String TASK_TYPE_PARAM = "task_type";

    private static final Set<String> RESERVED_PARAMS = Set.of(TEMPERATURE_PARAM,
                                                              MAX_TOKENS_PARAM,
                                                              MAX_TOKENS_ALT_PARAM,
                                                              MODEL_PARAM,
                                                              SYSTEM_PROMPT_PARAM,
                                                              TASK_TYPE_PARAM);
    private static final int LOG_TEXT_LIMIT = 100;

    @Getter
    private final AgentConfig config;
    private final TextGenerator generator;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean reachable = new AtomicBoolean(true);
    private final AtomicLong totalInvocations = new AtomicLong();
    private final AtomicLong failedInvocations = new AtomicLong();
    private final AtomicReference<Instant> lastInvocation = new AtomicReference<>();

    private record Attempt(String text, EnsembleError error) {
        static Attempt success(String text) {
            return new Attempt(text, null);
        }

        static Attempt failure(EnsembleError error) {
            return new Attempt(null, error);
        }

        boolean retryable() {
            return error != null && error.isRetryable();
        }
    }

    /**
     * Wakes up the invoking thread when a run gets cancelled while it waits out a retry backoff. The thread is never
     * interrupted while an attempt is running, and any interrupt raised here is cleared once the invocation is over.
     */
    private static final class BackoffGuard {
        private final Thread invokingThread;
        private boolean inAttempt;
        private boolean finished;
        private boolean interrupted;

        BackoffGuard(Thread invokingThread) {
            this.invokingThread = invokingThread;
        }

        synchronized boolean enterAttempt(CancellationToken token) {
            if (token.isCancelled()) {
                return false;
            }
            inAttempt = true;
            return true;
        }

        synchronized void exitAttempt() {
            inAttempt = false;
        }

        synchronized void interruptIfWaiting() {
            if (!inAttempt && !finished && !interrupted) {
                interrupted = true;
                invokingThread.interrupt();
            }
        }

        synchronized boolean isInterrupted() {
            return interrupted;
        }

        synchronized void finish() {
            finished = true;
            if (interrupted) {
                //Clear our own interrupt so that it does not leak to the caller
                Thread.interrupted();
            }
        }
    }

    public AgentClient(@NonNull AgentConfig config, @NonNull TextGenerator generator) {
        this.config = AgentConfigValidator.validate(config);
        this.generator = generator;
    }

    public String getName() {
        return config.getName();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Result of the last completed call or probe. Does not make any remote call.
     */
    public boolean isReachable() {
        return !closed.get() && reachable.get();
    }

    public InvocationOutput invoke(final String prompt, final Map<String, Object> parameters) {
        return invoke(prompt, parameters, null, CancellationToken.none());
    }

    /**
     * Generate text for the prompt. Never throws for call failures, they are reported in the returned output.
     *
     * @param prompt     Input text
     * @param parameters Per call overrides. Known keys are temperature, max_tokens, model, system_prompt and
     *                   task_type; everything else is passed through to the remote API
     * @param timeout    Hard limit for every single attempt. The configured timeout is used if null
     * @param token      Checked before every attempt. Cancelling it also cuts short a pending retry backoff
     * @return Output with text or error, the number of attempts made and the total elapsed time
     */
    public InvocationOutput invoke(
            final String prompt,
            final Map<String, Object> parameters,
            final Duration timeout,
            @NonNull final CancellationToken token) {
        final var output = execute(prompt, parameters, timeout, token);
        recordInvocation(output);
        return output;
    }

    /**
     * Check that the remote API is reachable with the configured credentials. Updates the reachability flag.
     */
    public boolean validate() {
        if (closed.get()) {
            return false;
        }
        try {
            final var result = generator.probe();
            reachable.set(result);
            log.debug("Probe for agent {} returned {}", getName(), result);
            return result;
        }
        catch (RuntimeException e) {
            log.warn("Probe for agent {} failed: {}", getName(), AgentUtils.rootCause(e).getMessage());
            reachable.set(false);
            return false;
        }
    }

    /**
     * Invocation counters and last known state. Makes no remote call.
     */
    public AgentStatus status() {
        final var total = totalInvocations.get();
        final var failed = failedInvocations.get();
        return AgentStatus.builder()
                .name(getName())
                .modelFamily(config.getModelFamily())
                .model(config.getModel())
                .active(!closed.get())
                .reachable(isReachable())
                .totalInvocations(total)
                .succeededInvocations(total - failed)
                .failedInvocations(failed)
                .lastInvocation(lastInvocation.get())
                .build();
    }

    /**
     * Release the generator. Only the first call has any effect. Errors while releasing are logged and dropped.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            log.debug("Client for agent {} is already closed", getName());
            return;
        }
        log.info("Closing client for agent {}", getName());
        try {
            generator.close();
        }
        catch (InterruptedException e) {
            log.warn("Interrupted while closing client for agent {}", getName());
            Thread.currentThread().interrupt();
        }
        catch (Exception e) {
            log.warn("Error closing client for agent {}: {}", getName(), AgentUtils.rootCause(e).getMessage(), e);
        }
    }

    private InvocationOutput execute(
            final String prompt,
            final Map<String, Object> parameters,
            final Duration timeout,
            final CancellationToken token) {
        final var startTime = System.nanoTime();
        final var attempts = new AtomicInteger(0);
        if (closed.get()) {
            return InvocationOutput.error(EnsembleError.error(ErrorType.CLIENT_CLOSED, getName()),
                                          0,
                                          AgentUtils.elapsedSince(startTime));
        }
        final var attemptTimeout = (null == timeout || timeout.isZero() || timeout.isNegative())
                                   ? config.getTimeout()
                                   : timeout;
        final GenerationRequest request;
        try {
            request = buildRequest(prompt, Objects.requireNonNullElse(parameters, Map.of()), attemptTimeout);
        }
        catch (IllegalArgumentException e) {
            log.error("Invalid parameters for agent {}: {}", getName(), e.getMessage());
            return InvocationOutput.error(EnsembleError.error(ErrorType.NON_RETRYABLE, e.getMessage()),
                                          0,
                                          AgentUtils.elapsedSince(startTime));
        }
        final var timeoutPolicy = Timeout.<Attempt>builder(attemptTimeout)
                .withInterrupt()
                .build();
        final var backoffGuard = new BackoffGuard(Thread.currentThread());
        try (final var ignored = token.onCancel(backoffGuard::interruptIfWaiting)) {
            final var attempt = Failsafe.with(List.<Policy<Attempt>>of(buildRetryPolicy(token), timeoutPolicy))
                    .get(() -> makeAttempt(request, token, attempts, backoffGuard));
            if (null == attempt.error()) {
                reachable.set(true);
                log.debug("Agent {} responded after {} attempt(s): {}",
                          getName(), attempts.get(), AgentUtils.abbreviate(attempt.text(), LOG_TEXT_LIMIT));
                return InvocationOutput.success(attempt.text(), attempts.get(), AgentUtils.elapsedSince(startTime));
            }
            if (attempt.retryable()) {
                return token.isCancelled()
                       ? cancelledAfter(attempts.get(), startTime)
                       : exhausted(attempts.get(), attempt.error().getMessage(), startTime);
            }
            log.warn("Call to agent {} failed: {}", getName(), attempt.error().getMessage());
            return InvocationOutput.error(attempt.error(), attempts.get(), AgentUtils.elapsedSince(startTime));
        }
        catch (TimeoutExceededException e) {
            if (token.isCancelled()) {
                return cancelledAfter(attempts.get(), startTime);
            }
            return exhausted(attempts.get(),
                             EnsembleError.error(ErrorType.TIMEOUT, attemptTimeout).getMessage(),
                             startTime);
        }
        catch (FailsafeException e) {
            if (backoffGuard.isInterrupted()) {
                return cancelledAfter(attempts.get(), startTime);
            }
            log.error("Unexpected error calling agent {}: {}", getName(), AgentUtils.rootCause(e).getMessage(), e);
            return InvocationOutput.error(EnsembleError.error(ErrorType.UNKNOWN, e),
                                          attempts.get(),
                                          AgentUtils.elapsedSince(startTime));
        }
        finally {
            backoffGuard.finish();
        }
    }

    private Attempt makeAttempt(
            GenerationRequest request,
            CancellationToken token,
            AtomicInteger attempts,
            BackoffGuard backoffGuard) {
        if (closed.get()) {
            return Attempt.failure(EnsembleError.error(ErrorType.CLIENT_CLOSED, getName()));
        }
        if (!backoffGuard.enterAttempt(token)) {
            return Attempt.failure(EnsembleError.error(ErrorType.CANCELLED,
                                                       "Run cancelled before attempt " + (attempts.get() + 1)));
        }
        try {
            final var attempt = attempts.incrementAndGet();
            log.debug("Calling agent {}. Attempt: {}", getName(), attempt);
            return Attempt.success(generator.generate(request));
        }
        catch (EnsembleException e) {
            return Attempt.failure(e.getError());
        }
        catch (UncheckedIOException e) {
            return Attempt.failure(EnsembleError.error(ErrorType.TRANSIENT, e));
        }
        catch (RuntimeException e) {
            log.error("Unexpected error from generator for agent {}", getName(), e);
            return Attempt.failure(EnsembleError.error(ErrorType.UNKNOWN, e));
        }
        finally {
            backoffGuard.exitAttempt();
        }
    }

    private RetryPolicy<Attempt> buildRetryPolicy(CancellationToken token) {
        final var builder = RetryPolicy.<Attempt>builder()
                .withMaxRetries(config.getMaxRetries())
                .handleResultIf(Attempt::retryable)
                .handle(TimeoutExceededException.class)
                .abortIf((attempt, failure) -> token.isCancelled())
                .onRetry(event -> log.warn("Attempt {} for agent {} failed: {}. Retrying",
                                           event.getAttemptCount(),
                                           getName(),
                                           null != event.getLastException()
                                           ? event.getLastException().getMessage()
                                           : event.getLastResult().error().getMessage()));
        final var initialBackoff = config.getInitialBackoff();
        if (!initialBackoff.isZero()) {
            if (config.getBackoffFactor() > 1.0 && initialBackoff.compareTo(config.getMaxBackoff()) < 0) {
                builder.withBackoff(initialBackoff, config.getMaxBackoff(), config.getBackoffFactor());
            }
            else {
                builder.withDelay(initialBackoff);
            }
        }
        return builder.build();
    }

    private void recordInvocation(InvocationOutput output) {
        totalInvocations.incrementAndGet();
        if (!output.isSuccess()) {
            failedInvocations.incrementAndGet();
        }
        lastInvocation.set(Instant.now());
    }

    private InvocationOutput cancelledAfter(int attempts, long startTime) {
        log.info("Call to agent {} cancelled after {} attempt(s)", getName(), attempts);
        return InvocationOutput.error(EnsembleError.error(ErrorType.CANCELLED,
                                                          "Run cancelled after attempt " + attempts),
                                      attempts,
                                      AgentUtils.elapsedSince(startTime));
    }

    private InvocationOutput exhausted(int attempts, String lastError, long startTime) {
        reachable.set(false);
        log.error("Giving up on agent {} after {} attempt(s). Last error: {}", getName(), attempts, lastError);
        return InvocationOutput.error(EnsembleError.error(ErrorType.EXHAUSTED, attempts, lastError),
                                      attempts,
                                      AgentUtils.elapsedSince(startTime));
    }

    private GenerationRequest buildRequest(String prompt, Map<String, Object> parameters, Duration timeout) {
        final var taskType = stringParam(parameters, TASK_TYPE_PARAM, null);
        final var templates = Objects.requireNonNullElse(config.getPromptTemplates(), Map.<String, String>of());
        final var template = Strings.isNullOrEmpty(taskType) ? null : templates.get(taskType);
        final var extras = new LinkedHashMap<String, Object>();
        parameters.forEach((key, value) -> {
            if (!RESERVED_PARAMS.contains(key) && null != value) {
                extras.put(key, value);
            }
        });
        final var maxTokens = parameters.containsKey(MAX_TOKENS_PARAM)
                              ? intParam(parameters, MAX_TOKENS_PARAM, config.getMaxTokens())
                              : intParam(parameters, MAX_TOKENS_ALT_PARAM, config.getMaxTokens());
        return GenerationRequest.builder()
                .agentName(getName())
                .model(stringParam(parameters, MODEL_PARAM, config.getModel()))
                .systemPrompt(stringParam(parameters, SYSTEM_PROMPT_PARAM, config.getSystemPrompt()))
                .prompt(PromptRenderer.render(template, prompt, parameters))
                .temperature(doubleParam(parameters, TEMPERATURE_PARAM, config.getTemperature()))
                .maxTokens(maxTokens)
                .taskType(taskType)
                .timeout(timeout)
                .extraParameters(extras)
                .build();
    }

    private static String stringParam(Map<String, Object> parameters, String name, String defaultValue) {
        final var value = parameters.get(name);
        return null == value ? defaultValue : value.toString();
    }

    private static double doubleParam(Map<String, Object> parameters, String name, double defaultValue) {
        final var value = parameters.get(name);
        if (null == value) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be a number. Found: " + value, e);
        }
    }

    private static int intParam(Map<String, Object> parameters, String name, int defaultValue) {
        final var value = parameters.get(name);
        if (null == value) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be an integer. Found: " + value, e);
        }
    }
}
