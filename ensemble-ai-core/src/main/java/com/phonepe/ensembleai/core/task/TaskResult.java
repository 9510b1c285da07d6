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

package com.phonepe.ensembleai.core.task;

import com.phonepe.ensembleai.core.errors.EnsembleError;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of executing a {@link Task}. Every submitted task gets exactly one result.
 */
@Value
@Builder
public class TaskResult {
    Task task;
    String agentName;
    TaskStatus status;

    /**
     * Generated text. Set only when status is {@link TaskStatus#SUCCEEDED}.
     */
    String response;

    /**
     * Set for every status other than {@link TaskStatus#SUCCEEDED}
     */
    EnsembleError error;

    int attemptsUsed;
    Duration elapsed;
    Instant completedAt;

    public String getTaskId() {
        return task.getId();
    }

    public boolean isSuccess() {
        return status == TaskStatus.SUCCEEDED;
    }

    public static TaskResult notExecuted(Task task, TaskStatus status, EnsembleError error) {
        return TaskResult.builder()
                .task(task)
                .agentName(task.getAgentName())
                .status(status)
                .error(error)
                .attemptsUsed(0)
                .elapsed(Duration.ZERO)
                .completedAt(Instant.now())
                .build();
    }
}
