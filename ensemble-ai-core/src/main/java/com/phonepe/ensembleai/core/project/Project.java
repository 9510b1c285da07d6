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

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A named, ordered sequence of {@link Stage}s. Stages run strictly one after the other.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class Project {
    public static final int DEFAULT_MAX_PARALLEL_AGENTS = 5;

    @NonNull
    String name;

    String description;

    @Singular
    List<Stage> stages;

    /**
     * Concurrency bound for every stage of the project
     */
    @Builder.Default
    int maxParallelAgents = DEFAULT_MAX_PARALLEL_AGENTS;

    /**
     * If set, a stage in which every task failed stops the project. Remaining stages are reported as not executed.
     * By default the project always runs to the end.
     */
    boolean abortOnStageFailure;

    @Builder.Default
    Instant createdAt = Instant.now();

    /**
     * @return A copy of this project with the stage appended
     */
    public Project addStage(@NonNull Stage stage) {
        return toBuilder()
                .stage(stage)
                .build();
    }
}
