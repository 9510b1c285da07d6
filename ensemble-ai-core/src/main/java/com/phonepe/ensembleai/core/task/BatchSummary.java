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

import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Aggregate view over a list of task results
 */
@Value
public class BatchSummary {
    int total;
    int succeeded;
    int failed;
    int skipped;
    int cancelled;
    Duration elapsed;

    public static BatchSummary of(List<TaskResult> results, Duration elapsed) {
        return new BatchSummary(results.size(),
                                count(results, TaskStatus.SUCCEEDED),
                                count(results, TaskStatus.FAILED),
                                count(results, TaskStatus.SKIPPED),
                                count(results, TaskStatus.CANCELLED),
                                elapsed);
    }

    public boolean allSucceeded() {
        return total == succeeded;
    }

    private static int count(List<TaskResult> results, TaskStatus status) {
        return (int) results.stream()
                .filter(result -> result.getStatus() == status)
                .count();
    }
}
