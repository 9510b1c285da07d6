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

package com.phonepe.ensembleai.core.engine;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import com.phonepe.ensembleai.core.client.AgentClient;
import com.phonepe.ensembleai.core.client.InvocationOutput;
import com.phonepe.ensembleai.core.errors.EnsembleError;
import com.phonepe.ensembleai.core.errors.ErrorType;
import com.phonepe.ensembleai.core.registry.AgentRegistry;
import com.phonepe.ensembleai.core.task.BatchSummary;
import com.phonepe.ensembleai.core.task.Task;
import com.phonepe.ensembleai.core.task.TaskResult;
import com.phonepe.ensembleai.core.task.TaskStatus;
import com.phonepe.ensembleai.core.utils.AgentUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs batches of tasks against the agents in an {@link AgentRegistry}.
 * <p>
 * Every run returns exactly one {@link TaskResult} per task, in the order the tasks were submitted, regardless of the
 * order in which they complete. Failures of individual tasks are recorded in their results and never abort the rest
 * of the batch. In parallel mode no more than the requested number of tasks are in flight at any time and
 * {@link #run} does not return before every task it started has finished.
 * <p>
 * The engine keeps no per run state and can be used by multiple callers at the same time.
 */
@Slf4j
public class ExecutionEngine implements AutoCloseable {
    private static final long ADMISSION_POLL_MILLIS = 50;
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(30);

    private final AgentRegistry registry;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;
    private final Duration defaultTimeout;

    /**
     * @param registry        Source of agent clients
     * @param executorService Worker pool for parallel runs. A pool owned by the engine is created if null.
     * @param defaultTimeout  Per attempt timeout for tasks that don't set one. Agent's own timeout is used if null.
     */
    @Builder
    public ExecutionEngine(@NonNull AgentRegistry registry, ExecutorService executorService, Duration defaultTimeout) {
        this.registry = registry;
        this.ownsExecutor = null == executorService;
        this.executorService = Objects.requireNonNullElseGet(
                executorService,
                () -> Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                                                            .setNameFormat("ensemble-worker-%d")
                                                            .setDaemon(true)
                                                            .build()));
        this.defaultTimeout = defaultTimeout;
    }

    public TaskResult runSingle(@NonNull final Task task) {
        return run(List.of(task), ExecutionMode.SERIAL, 1, CancellationToken.none()).get(0);
    }

    public List<TaskResult> run(@NonNull final List<Task> tasks, @NonNull final ExecutionMode mode, int maxConcurrency) {
        return run(tasks, mode, maxConcurrency, CancellationToken.none());
    }

    /**
     * Run a batch of tasks.
     *
     * @param tasks          Tasks to run. May be empty.
     * @param mode           Serial or parallel
     * @param maxConcurrency Max number of tasks in flight at any time. Must be positive. Ignored in serial mode.
     * @param token          Tasks not yet started when this gets cancelled are reported as
     *                       {@link TaskStatus#CANCELLED}
     * @return One result per task, in input order
     */
    public List<TaskResult> run(
            @NonNull final List<Task> tasks,
            @NonNull final ExecutionMode mode,
            int maxConcurrency,
            @NonNull final CancellationToken token) {
        Preconditions.checkArgument(maxConcurrency > 0, "maxConcurrency must be positive. Provided: %s", maxConcurrency);
        if (tasks.isEmpty()) {
            return List.of();
        }
        final var startTime = System.nanoTime();
        log.debug("Running {} task(s) in {} mode with max concurrency {}", tasks.size(), mode, maxConcurrency);
        final var results = switch (mode) {
            case SERIAL -> runSerially(tasks, token);
            case PARALLEL -> runInParallel(tasks, maxConcurrency, token);
        };
        log.info("Batch of {} task(s) completed in {} mode: {}",
                 tasks.size(), mode, BatchSummary.of(results, AgentUtils.elapsedSince(startTime)));
        return results;
    }

    /**
     * Shuts down the worker pool if the engine created it. Waits for running tasks to complete.
     */
    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        log.info("Shutting down execution engine worker pool");
        if (!MoreExecutors.shutdownAndAwaitTermination(executorService, SHUTDOWN_WAIT)) {
            log.warn("Worker pool did not terminate within {}", SHUTDOWN_WAIT);
        }
    }

    private List<TaskResult> runSerially(List<Task> tasks, CancellationToken token) {
        final var results = new ArrayList<TaskResult>(tasks.size());
        for (final var task : tasks) {
            results.add(token.isCancelled() ? cancelled(task) : execute(task, token));
        }
        return results;
    }

    private List<TaskResult> runInParallel(List<Task> tasks, int maxConcurrency, CancellationToken token) {
        final var results = new TaskResult[tasks.size()];
        final var futures = new ArrayList<Future<?>>(tasks.size());
        final var permits = new Semaphore(maxConcurrency);
        try {
            for (int i = 0; i < tasks.size(); i++) {
                final var task = tasks.get(i);
                if (!acquire(permits, token)) {
                    results[i] = cancelled(task);
                    continue;
                }
                final var index = i;
                try {
                    futures.add(executorService.submit(() -> {
                        try {
                            results[index] = execute(task, token);
                        }
                        finally {
                            permits.release();
                        }
                    }));
                }
                catch (RejectedExecutionException e) {
                    permits.release();
                    log.error("Worker pool rejected task {}", task.getId());
                    results[index] = TaskResult.notExecuted(
                            task, TaskStatus.FAILED, EnsembleError.error(ErrorType.UNKNOWN, "Worker pool is shut down"));
                }
            }
        }
        finally {
            futures.forEach(ExecutionEngine::awaitCompletion);
        }
        for (int i = 0; i < results.length; i++) {
            if (null == results[i]) {
                results[i] = TaskResult.notExecuted(
                        tasks.get(i), TaskStatus.FAILED, EnsembleError.error(ErrorType.UNKNOWN, "Task did not complete"));
            }
        }
        return Arrays.asList(results);
    }

    private TaskResult execute(Task task, CancellationToken token) {
        if (token.isCancelled()) {
            return cancelled(task);
        }
        final var client = registry.resolve(task.getAgentName()).orElse(null);
        if (null == client) {
            log.warn("No agent named {} for task {}", task.getAgentName(), task.getId());
            return TaskResult.notExecuted(task,
                                          TaskStatus.FAILED,
                                          EnsembleError.error(ErrorType.AGENT_NOT_FOUND, task.getAgentName()));
        }
        final var startTime = System.nanoTime();
        try {
            final var parameters = new HashMap<>(task.getParameters());
            if (null != task.getTaskType()) {
                parameters.putIfAbsent(AgentClient.TASK_TYPE_PARAM, task.getTaskType());
            }
            final var timeout = Objects.requireNonNullElse(task.getTimeout(), defaultTimeout);
            return toResult(task, client.invoke(task.getInput(), parameters, timeout, token));
        }
        catch (RuntimeException e) {
            log.error("Error executing task {} on agent {}", task.getId(), task.getAgentName(), e);
            return TaskResult.builder()
                    .task(task)
                    .agentName(task.getAgentName())
                    .status(TaskStatus.FAILED)
                    .error(EnsembleError.error(ErrorType.UNKNOWN, e))
                    .elapsed(AgentUtils.elapsedSince(startTime))
                    .completedAt(Instant.now())
                    .build();
        }
    }

    private static TaskResult toResult(Task task, InvocationOutput output) {
        final var status = output.isSuccess()
                           ? TaskStatus.SUCCEEDED
                           : (output.getError().getErrorType() == ErrorType.CANCELLED
                              ? TaskStatus.CANCELLED
                              : TaskStatus.FAILED);
        return TaskResult.builder()
                .task(task)
                .agentName(task.getAgentName())
                .status(status)
                .response(output.getText())
                .error(output.getError())
                .attemptsUsed(output.getAttemptsUsed())
                .elapsed(output.getElapsed())
                .completedAt(Instant.now())
                .build();
    }

    private static TaskResult cancelled(Task task) {
        return TaskResult.notExecuted(task,
                                      TaskStatus.CANCELLED,
                                      EnsembleError.error(ErrorType.CANCELLED, "Run cancelled before task started"));
    }

    private static boolean acquire(Semaphore permits, CancellationToken token) {
        try {
            while (!token.isCancelled()) {
                if (permits.tryAcquire(ADMISSION_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
            return false;
        }
        catch (InterruptedException e) {
            log.warn("Interrupted while waiting to schedule task");
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void awaitCompletion(Future<?> future) {
        try {
            Uninterruptibles.getUninterruptibly(future);
        }
        catch (ExecutionException e) {
            log.error("Task execution failed unexpectedly", e.getCause());
        }
    }
}
