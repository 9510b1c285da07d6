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

package com.phonepe.ensembleai.core.project;

import com.google.common.base.Preconditions;
import com.phonepe.ensembleai.core.engine.CancellationToken;
import com.phonepe.ensembleai.core.engine.ExecutionEngine;
import com.phonepe.ensembleai.core.errors.EnsembleError;
import com.phonepe.ensembleai.core.errors.EnsembleException;
import com.phonepe.ensembleai.core.errors.ErrorType;
import com.phonepe.ensembleai.core.task.Task;
import com.phonepe.ensembleai.core.task.TaskResult;
import com.phonepe.ensembleai.core.task.TaskStatus;
import com.phonepe.ensembleai.core.utils.AgentUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Manages projects and runs them stage by stage on an {@link ExecutionEngine}.
 * <p>
 * Before a stage is dispatched, references to results of earlier stages are substituted into its tasks. A task whose
 * referenced result did not succeed is reported as {@link TaskStatus#SKIPPED}; a task with a reference to a result
 * that does not exist fails with {@link ErrorType#INVALID_REFERENCE}. Neither is sent to an agent.
 */
@Slf4j
public class ProjectCoordinator {
    private final ExecutionEngine engine;
    private final ProjectStore store;
    private final int defaultMaxParallelAgents;

    @Builder
    public ProjectCoordinator(@NonNull ExecutionEngine engine, ProjectStore store, int defaultMaxParallelAgents) {
        this.engine = engine;
        this.store = Objects.requireNonNullElseGet(store, InMemoryProjectStore::new);
        this.defaultMaxParallelAgents = defaultMaxParallelAgents > 0
                                        ? defaultMaxParallelAgents
                                        : Project.DEFAULT_MAX_PARALLEL_AGENTS;
    }

    /**
     * Create and store an empty project
     *
     * @throws EnsembleException with {@link ErrorType#PROJECT_ALREADY_EXISTS} if the name is taken
     */
    public Project createProject(@NonNull final String name, final String description) {
        Preconditions.checkArgument(!name.isBlank(), "Project name cannot be empty");
        final var project = store.create(Project.builder()
                                                 .name(name)
                                                 .description(description)
                                                 .maxParallelAgents(defaultMaxParallelAgents)
                                                 .build())
                .orElseThrow(() -> EnsembleException.of(ErrorType.PROJECT_ALREADY_EXISTS, name));
        log.info("Created project {}", name);
        return project;
    }

    /**
     * Store a project, replacing any existing definition with the same name
     */
    public Project saveProject(@NonNull final Project project) {
        validate(project);
        return store.update(project);
    }

    /**
     * Append a stage to a stored project
     */
    public Project addStage(@NonNull final String projectName, @NonNull final Stage stage) {
        final var updated = findProject(projectName)
                .orElseThrow(() -> EnsembleException.of(ErrorType.PROJECT_NOT_FOUND, projectName))
                .addStage(stage);
        return saveProject(updated);
    }

    public Optional<Project> findProject(final String name) {
        return store.read(name);
    }

    public List<Project> listProjects() {
        return store.list();
    }

    public boolean deleteProject(final String name) {
        final var removed = store.remove(name);
        if (removed) {
            log.info("Deleted project {}", name);
        }
        return removed;
    }

    public List<StageResult> runProject(@NonNull final String projectName) {
        return runProject(findProject(projectName)
                                  .orElseThrow(() -> EnsembleException.of(ErrorType.PROJECT_NOT_FOUND, projectName)),
                          CancellationToken.none());
    }

    public List<StageResult> runProject(@NonNull final Project project) {
        return runProject(project, CancellationToken.none());
    }

    /**
     * Run every stage of the project in order
     *
     * @return One result per stage, in declaration order
     */
    public List<StageResult> runProject(@NonNull final Project project, @NonNull final CancellationToken token) {
        validate(project);
        log.info("Running project {} with {} stage(s)", project.getName(), project.getStages().size());
        final var completed = new LinkedHashMap<String, StageResult>();
        final var stageResults = new ArrayList<StageResult>();
        var aborted = false;
        for (final var stage : project.getStages()) {
            if (aborted) {
                stageResults.add(notExecuted(stage));
                continue;
            }
            final var result = runStage(project, stage, completed, token);
            log.info("Stage {} of project {} finished with status {}: {}",
                     stage.getName(), project.getName(), result.getStatus(), result.summary());
            completed.put(stage.getName(), result);
            stageResults.add(result);
            if (project.isAbortOnStageFailure() && result.getStatus() == StageStatus.ALL_FAILED) {
                log.warn("Every task of stage {} failed. Aborting project {}", stage.getName(), project.getName());
                aborted = true;
            }
        }
        return stageResults;
    }

    private StageResult runStage(
            Project project,
            Stage stage,
            LinkedHashMap<String, StageResult> completed,
            CancellationToken token) {
        final var startTime = System.nanoTime();
        final var tasks = stage.getTasks();
        final var results = new TaskResult[tasks.size()];
        final var dispatched = new ArrayList<Task>();
        final var dispatchedIndices = new ArrayList<Integer>();
        for (int i = 0; i < tasks.size(); i++) {
            final var resolution = PlaceholderResolver.resolve(tasks.get(i), completed);
            if (resolution.isResolved()) {
                dispatched.add(resolution.getTask());
                dispatchedIndices.add(i);
            }
            else {
                final var status = resolution.getError().getErrorType() == ErrorType.SKIPPED
                                   ? TaskStatus.SKIPPED
                                   : TaskStatus.FAILED;
                log.warn("Not dispatching task {} of stage {}: {}",
                         tasks.get(i).getId(), stage.getName(), resolution.getError().getMessage());
                results[i] = TaskResult.notExecuted(tasks.get(i), status, resolution.getError());
            }
        }
        final var executed = engine.run(dispatched, stage.getMode(), project.getMaxParallelAgents(), token);
        for (int i = 0; i < executed.size(); i++) {
            results[dispatchedIndices.get(i)] = executed.get(i);
        }
        final var anySucceeded = Arrays.stream(results).anyMatch(TaskResult::isSuccess);
        final var status = results.length == 0 || anySucceeded ? StageStatus.COMPLETED : StageStatus.ALL_FAILED;
        return new StageResult(stage.getName(), status, Arrays.asList(results), AgentUtils.elapsedSince(startTime));
    }

    private static StageResult notExecuted(Stage stage) {
        final var results = stage.getTasks()
                .stream()
                .map(task -> TaskResult.notExecuted(
                        task,
                        TaskStatus.CANCELLED,
                        EnsembleError.error(ErrorType.CANCELLED, "Project aborted before stage " + stage.getName())))
                .toList();
        return new StageResult(stage.getName(), StageStatus.NOT_EXECUTED, results, Duration.ZERO);
    }

    private static void validate(Project project) {
        Preconditions.checkArgument(project.getMaxParallelAgents() > 0,
                                    "maxParallelAgents must be positive for project %s", project.getName());
        final var names = new HashSet<String>();
        project.getStages().forEach(stage -> Preconditions.checkArgument(
                names.add(stage.getName()),
                "Duplicate stage name %s in project %s", stage.getName(), project.getName()));
    }
}
