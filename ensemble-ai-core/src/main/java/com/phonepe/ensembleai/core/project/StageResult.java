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

import com.phonepe.ensembleai.core.task.BatchSummary;
import com.phonepe.ensembleai.core.task.TaskResult;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one stage of a project run. Contains one result per task of the stage, in declaration order.
 */
@Value
public class StageResult {
    String stageName;
    StageStatus status;
    List<TaskResult> results;
    Duration elapsed;

    public BatchSummary summary() {
        return BatchSummary.of(results, elapsed);
    }

    /**
     * Find the result for a task either by id or by its zero based position in the stage
     */
    public Optional<TaskResult> find(String taskIdOrIndex) {
        final var byId = results.stream()
                .filter(result -> result.getTaskId().equals(taskIdOrIndex))
                .findFirst();
        if (byId.isPresent()) {
            return byId;
        }
        try {
            final var index = Integer.parseInt(taskIdOrIndex);
            return index >= 0 && index < results.size()
                   ? Optional.of(results.get(index))
                   : Optional.empty();
        }
        catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
