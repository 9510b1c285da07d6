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

import com.phonepe.ensembleai.core.client.ScriptedTextGenerator;
import com.phonepe.ensembleai.core.client.TestConfigs;
import com.phonepe.ensembleai.core.client.TextGeneratorFactory;
import com.phonepe.ensembleai.core.config.EnsembleConfig;
import com.phonepe.ensembleai.core.engine.ExecutionMode;
import com.phonepe.ensembleai.core.errors.EnsembleException;
import com.phonepe.ensembleai.core.errors.ErrorType;
import com.phonepe.ensembleai.core.project.Stage;
import com.phonepe.ensembleai.core.project.StageStatus;
import com.phonepe.ensembleai.core.task.Task;
import com.phonepe.ensembleai.core.task.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link Ensemble}
 */
class EnsembleTest {
    private final Map<String, ScriptedTextGenerator> generators = new ConcurrentHashMap<>();

    private TextGeneratorFactory factory() {
        return config -> generators.computeIfAbsent(
                config.getName(),
                name -> name.startsWith("broken")
                        ? ScriptedTextGenerator.failing(ErrorType.TRANSIENT)
                        : ScriptedTextGenerator.echo(Duration.ofMillis(5)));
    }

    private Ensemble ensemble() {
        return Ensemble.fromConfig(EnsembleConfig.builder()
                                           .maxParallelAgents(2)
                                           .agent(TestConfigs.agent("writer"))
                                           .agent(TestConfigs.agent("researcher"))
                                           .build(),
                                   factory());
    }

    @Test
    void testSubmit() {
        try (final var ensemble = ensemble()) {
            assertEquals(List.of("researcher", "writer"), ensemble.agents());
            final var result = ensemble.submit("writer", "hello", Map.of("temperature", 0.2));
            assertTrue(result.isSuccess());
            assertEquals("echo:hello", result.getResponse());
            assertEquals("writer", result.getAgentName());
            assertEquals(0.2, generators.get("writer").getRequests().get(0).getTemperature());
        }
    }

    @Test
    void testSubmitToUnknownAgent() {
        try (final var ensemble = ensemble()) {
            final var result = ensemble.submit("editor", "hello", null);
            assertEquals(TaskStatus.FAILED, result.getStatus());
            assertEquals(ErrorType.AGENT_NOT_FOUND, result.getError().getErrorType());
        }
    }

    @Test
    void testSubmitBatch() {
        try (final var ensemble = ensemble()) {
            final var tasks = List.of(Task.of("writer", "one"),
                                      Task.of("researcher", "two"),
                                      Task.of("writer", "three"),
                                      Task.of("missing", "four"));
            final var results = ensemble.submitBatch(tasks, ExecutionMode.PARALLEL, 2);
            assertEquals(4, results.size());
            assertEquals("echo:one", results.get(0).getResponse());
            assertEquals("echo:two", results.get(1).getResponse());
            assertEquals("echo:three", results.get(2).getResponse());
            assertEquals(ErrorType.AGENT_NOT_FOUND, results.get(3).getError().getErrorType());
            assertEquals(4, ensemble.submitBatch(tasks, ExecutionMode.SERIAL).size());
        }
    }

    @Test
    void testRegisterAgentsIsAllOrNothing() {
        try (final var ensemble = ensemble()) {
            final var error = assertThrows(EnsembleException.class, () -> ensemble.registerAgents(
                    List.of(TestConfigs.agent("editor"),
                            TestConfigs.agent("reviewer").withTimeoutSeconds(-1),
                            TestConfigs.agent("").withMaxRetries(-2))));
            assertEquals(ErrorType.CONFIG_INVALID, error.getErrorType());
            assertTrue(error.getMessage().contains("reviewer"));
            assertEquals(List.of("researcher", "writer"), ensemble.agents());

            final var duplicate = assertThrows(EnsembleException.class, () -> ensemble.registerAgents(
                    List.of(TestConfigs.agent("editor"), TestConfigs.agent("writer"))));
            assertEquals(ErrorType.AGENT_ALREADY_REGISTERED, duplicate.getErrorType());
            assertEquals(2, ensemble.agents().size());
        }
    }

    @Test
    void testInvalidConfigFailsConstruction() {
        final var config = EnsembleConfig.builder()
                .agent(TestConfigs.agent("writer"))
                .agent(TestConfigs.agent("writer"))
                .build();
        final var factory = factory();
        final var error = assertThrows(EnsembleException.class, () -> Ensemble.fromConfig(config, factory));
        assertEquals(ErrorType.CONFIG_INVALID, error.getErrorType());
        assertTrue(generators.isEmpty());
    }

    @Test
    void testAgentLifecycle() {
        try (final var ensemble = ensemble()) {
            ensemble.addAgent(TestConfigs.agent("editor"));
            assertTrue(ensemble.agents().contains("editor"));
            ensemble.replaceAgent(TestConfigs.agent("editor").withModel("better-model"));
            assertEquals("better-model",
                         ensemble.getRegistry().resolve("editor").orElseThrow().getConfig().getModel());
            ensemble.removeAgent("editor");
            assertFalse(ensemble.agents().contains("editor"));
            assertEquals(ErrorType.AGENT_NOT_FOUND,
                         ensemble.submit("editor", "hi", Map.of()).getError().getErrorType());
        }
    }

    @Test
    void testSystemStatus() {
        try (final var ensemble = ensemble()) {
            assertEquals(new SystemStatus(2, false), ensemble.systemStatus());
            ensemble.addAgent(TestConfigs.agent("broken", 0));
            assertEquals(new SystemStatus(3, false), ensemble.systemStatus());
            final var result = ensemble.submit("broken", "hi", Map.of());
            assertEquals(ErrorType.EXHAUSTED, result.getError().getErrorType());
            assertEquals(new SystemStatus(3, true), ensemble.systemStatus());
        }
    }

    @Test
    void testAgentStatus() {
        try (final var ensemble = ensemble()) {
            final var initial = ensemble.agentStatus("writer").orElseThrow();
            assertEquals("writer", initial.getName());
            assertEquals("test-model", initial.getModel());
            assertTrue(initial.isActive());
            assertEquals(0, initial.getTotalInvocations());
            assertNull(initial.getLastInvocation());

            ensemble.submit("writer", "one", Map.of());
            ensemble.submit("writer", "two", Map.of("max_tokens", "lots"));
            final var status = ensemble.agentStatus("writer").orElseThrow();
            assertEquals(2, status.getTotalInvocations());
            assertEquals(1, status.getSucceededInvocations());
            assertEquals(1, status.getFailedInvocations());
            assertNotNull(status.getLastInvocation());
            assertEquals(0, ensemble.agentStatus("researcher").orElseThrow().getTotalInvocations());
            assertTrue(ensemble.agentStatus("editor").isEmpty());
        }
    }

    @Test
    void testRollbackSurvivesConcurrentRemoval() {
        final var holder = new AtomicReference<Ensemble>();
        final TextGeneratorFactory removingFactory = config -> {
            if (config.getName().equals("reviewer")) {
                holder.get().removeAgent("editor");
                throw EnsembleException.of(ErrorType.CONFIG_INVALID, "no endpoint for reviewer");
            }
            return factory().create(config);
        };
        try (final var ensemble = Ensemble.fromConfig(EnsembleConfig.builder().build(), removingFactory)) {
            holder.set(ensemble);
            final var agents = List.of(TestConfigs.agent("editor"),
                                       TestConfigs.agent("translator"),
                                       TestConfigs.agent("reviewer"));
            final var error = assertThrows(EnsembleException.class, () -> ensemble.registerAgents(agents));
            assertEquals(ErrorType.CONFIG_INVALID, error.getErrorType());
            assertEquals(1, error.getSuppressed().length);
            assertEquals(ErrorType.AGENT_NOT_FOUND, ((EnsembleException) error.getSuppressed()[0]).getErrorType());
            assertEquals(List.of(), ensemble.agents());
            assertEquals(1, generators.get("translator").closeCount());
        }
    }

    @Test
    void testHealthCheck() {
        try (final var ensemble = ensemble()) {
            ensemble.submit("writer", "warm up", Map.of());
            generators.get("writer").setProbeResult(false);
            assertEquals(Map.of("researcher", true, "writer", false), ensemble.healthCheck());
            assertTrue(ensemble.systemStatus().isAnyAgentUnreachable());
        }
    }

    @Test
    void testProjects() {
        try (final var ensemble = ensemble()) {
            final var project = ensemble.createProject("article", "Research and write")
                    .addStage(Stage.builder()
                                      .name("research")
                                      .task(Task.of("researcher", "topic"))
                                      .build())
                    .addStage(Stage.builder()
                                      .name("write")
                                      .task(Task.of("writer", "Article on ${research.0}"))
                                      .build());
            final var results = ensemble.runProject(project);
            assertEquals(2, results.size());
            assertTrue(results.stream().allMatch(stage -> stage.getStatus() == StageStatus.COMPLETED));
            assertEquals("echo:Article on echo:topic", results.get(1).getResults().get(0).getResponse());
            assertEquals(2, project.getMaxParallelAgents());
        }
    }

    @Test
    void testCloseReleasesEverything() {
        final var ensemble = ensemble();
        ensemble.submit("writer", "hello", Map.of());
        ensemble.close();
        ensemble.close();
        generators.values().forEach(generator -> assertEquals(1, generator.closeCount()));
        assertEquals(0, ensemble.getRegistry().size());
        assertThrows(IllegalStateException.class, () -> ensemble.submit("writer", "hello", Map.of()));
        assertThrows(IllegalStateException.class, () -> ensemble.addAgent(TestConfigs.agent("late")));
    }
}
