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

package com.phonepe.ensembleai.core;

import com.phonepe.ensembleai.core.client.AgentClient;
import com.phonepe.ensembleai.core.client.AgentStatus;
import com.phonepe.ensembleai.core.client.TextGeneratorFactory;
import com.phonepe.ensembleai.core.config.AgentConfig;
import com.phonepe.ensembleai.core.config.AgentConfigValidator;
import com.phonepe.ensembleai.core.config.EnsembleConfig;
import com.phonepe.ensembleai.core.engine.CancellationToken;
import com.phonepe.ensembleai.core.engine.ExecutionEngine;
import com.phonepe.ensembleai.core.engine.ExecutionMode;
import com.phonepe.ensembleai.core.errors.EnsembleException;
import com.phonepe.ensembleai.core.errors.ErrorType;
import com.phonepe.ensembleai.core.project.InMemoryProjectStore;
import com.phonepe.ensembleai.core.project.Project;
import com.phonepe.ensembleai.core.project.ProjectCoordinator;
import com.phonepe.ensembleai.core.project.StageResult;
import com.phonepe.ensembleai.core.registry.AgentRegistry;
import com.phonepe.ensembleai.core.task.Task;
import com.phonepe.ensembleai.core.task.TaskResult;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point to the library. Ties together the {@link AgentRegistry}, the {@link ExecutionEngine} and the
 * {@link ProjectCoordinator}.
 * <p>
 * Usage:
 * <pre>{@code
 * try (final var ensemble = Ensemble.fromConfig(config, new HttpTextGeneratorFactory())) {
 *     final var result = ensemble.submit("writer", "Write a haiku about rain", Map.of());
 * }
 * }</pre>
 */
@Slf4j
public class Ensemble implements AutoCloseable {
    @Getter
    private final AgentRegistry registry;
    @Getter
    private final ExecutionEngine engine;
    @Getter
    private final ProjectCoordinator coordinator;
    private final int defaultConcurrency;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Ensemble(
            @NonNull AgentRegistry registry,
            @NonNull ExecutionEngine engine,
            @NonNull ProjectCoordinator coordinator,
            int defaultConcurrency) {
        this.registry = registry;
        this.engine = engine;
        this.coordinator = coordinator;
        this.defaultConcurrency = defaultConcurrency > 0 ? defaultConcurrency : Project.DEFAULT_MAX_PARALLEL_AGENTS;
    }

    /**
     * Build an ensemble and register all agents in the config. Nothing is registered if any agent config is invalid.
     */
    public static Ensemble fromConfig(@NonNull EnsembleConfig config, @NonNull TextGeneratorFactory factory) {
        final var registry = AgentRegistry.builder()
                .generatorFactory(factory)
                .validateOnRegistration(config.isValidateAgentsOnRegistration())
                .build();
        final var engine = ExecutionEngine.builder()
                .registry(registry)
                .defaultTimeout(config.defaultTimeout())
                .build();
        final var coordinator = ProjectCoordinator.builder()
                .engine(engine)
                .store(new InMemoryProjectStore())
                .defaultMaxParallelAgents(config.getMaxParallelAgents())
                .build();
        final var ensemble = new Ensemble(registry, engine, coordinator, config.getMaxParallelAgents());
        try {
            ensemble.registerAgents(config.getAgents());
        }
        catch (RuntimeException e) {
            ensemble.close();
            throw e;
        }
        return ensemble;
    }

    /**
     * Register a list of agents. The whole list is validated first, so either every config is accepted or nothing
     * is registered because of an invalid config.
     *
     * @throws EnsembleException with {@link ErrorType#CONFIG_INVALID} listing every invalid config
     */
    public List<AgentClient> registerAgents(@NonNull final List<AgentConfig> configs) {
        ensureOpen();
        final var violations = new ArrayList<String>();
        final var names = new HashSet<String>();
        for (final var config : configs) {
            final var errors = AgentConfigValidator.violations(config);
            if (!errors.isEmpty()) {
                violations.add("[%s] %s".formatted(null == config ? null : config.getName(), String.join(", ", errors)));
            }
            else if (!names.add(config.getName())) {
                violations.add("[%s] duplicate agent name".formatted(config.getName()));
            }
        }
        if (!violations.isEmpty()) {
            throw EnsembleException.of(ErrorType.CONFIG_INVALID, String.join("; ", violations));
        }
        final var existing = names.stream()
                .filter(name -> registry.resolve(name).isPresent())
                .sorted()
                .toList();
        if (!existing.isEmpty()) {
            throw EnsembleException.of(ErrorType.AGENT_ALREADY_REGISTERED, String.join(", ", existing));
        }
        final var registered = new ArrayList<AgentClient>();
        try {
            for (final var config : configs) {
                registered.add(registry.register(config));
            }
        }
        catch (RuntimeException e) {
            log.error("Registration failed. Rolling back {} agent(s) registered from this list", registered.size());
            registered.forEach(client -> rollback(client, e));
            throw e;
        }
        return registered;
    }

    public AgentClient addAgent(@NonNull final AgentConfig config) {
        ensureOpen();
        return registry.register(config);
    }

    public AgentClient replaceAgent(@NonNull final AgentConfig config) {
        ensureOpen();
        return registry.replace(config);
    }

    public void removeAgent(@NonNull final String name) {
        registry.unregister(name);
    }

    public List<String> agents() {
        return registry.names();
    }

    public TaskResult submit(@NonNull final String agentName, final String input, final Map<String, Object> parameters) {
        return submit(Task.builder()
                              .agentName(agentName)
                              .input(input)
                              .parameters(parameters)
                              .build());
    }

    public TaskResult submit(@NonNull final Task task) {
        ensureOpen();
        return engine.runSingle(task);
    }

    public List<TaskResult> submitBatch(@NonNull final List<Task> tasks, @NonNull final ExecutionMode mode) {
        return submitBatch(tasks, mode, defaultConcurrency);
    }

    public List<TaskResult> submitBatch(@NonNull final List<Task> tasks, @NonNull final ExecutionMode mode, int concurrency) {
        return submitBatch(tasks, mode, concurrency, CancellationToken.none());
    }

    public List<TaskResult> submitBatch(
            @NonNull final List<Task> tasks,
            @NonNull final ExecutionMode mode,
            int concurrency,
            @NonNull final CancellationToken token) {
        ensureOpen();
        return engine.run(tasks, mode, concurrency, token);
    }

    /**
     * Cheap status check. Uses the last known reachability of each agent and makes no remote calls.
     */
    public SystemStatus systemStatus() {
        final var clients = registry.clients();
        return new SystemStatus(clients.size(),
                                clients.stream().anyMatch(client -> !client.isReachable()));
    }

    /**
     * Invocation counters and last known state of an agent. Makes no remote call.
     */
    public Optional<AgentStatus> agentStatus(final String name) {
        return registry.resolve(name).map(AgentClient::status);
    }

    /**
     * Probe every registered agent
     *
     * @return Probe result for every agent, keyed by agent name
     */
    public Map<String, Boolean> healthCheck() {
        final var health = new LinkedHashMap<String, Boolean>();
        registry.clients().forEach(client -> health.put(client.getName(), client.validate()));
        return health;
    }

    public Project createProject(@NonNull final String name, final String description) {
        ensureOpen();
        return coordinator.createProject(name, description);
    }

    public List<StageResult> runProject(@NonNull final Project project) {
        ensureOpen();
        return coordinator.runProject(project);
    }

    public List<StageResult> runProject(@NonNull final String projectName) {
        ensureOpen();
        return coordinator.runProject(projectName);
    }

    /**
     * Shut down the worker pool and close every agent client. Returns after everything has been released.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down ensemble with {} agent(s)", registry.size());
        engine.close();
        registry.close();
    }

    private void rollback(AgentClient client, RuntimeException cause) {
        try {
            registry.unregister(client.getName());
        }
        catch (RuntimeException e) {
            log.warn("Could not roll back agent {}: {}", client.getName(), e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Ensemble has been closed");
        }
    }
}
