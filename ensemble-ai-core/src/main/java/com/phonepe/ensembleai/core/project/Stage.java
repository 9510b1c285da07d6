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

import com.phonepe.ensembleai.core.engine.ExecutionMode;
import com.phonepe.ensembleai.core.task.Task;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A set of tasks executed together as one step of a {@link Project}.
 * Task inputs and string parameters can refer to results of earlier stages as <code>${stage.taskId}</code> or
 * <code>${stage.index}</code> (zero based).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Stage {
    @NonNull
    String name;

    @Singular
    List<Task> tasks;

    @Builder.Default
    ExecutionMode mode = ExecutionMode.PARALLEL;
}
