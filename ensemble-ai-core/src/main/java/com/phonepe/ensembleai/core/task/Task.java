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

import com.google.common.base.Strings;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of work: one prompt to be sent to one named agent. Tasks are immutable once built.
 */
@Value
@With
public class Task {
    /**
     * Unique id. Generated if not provided.
     */
    String id;

    @NonNull
    String agentName;

    String input;

    /**
     * Per task overrides for agent defaults. See {@link com.phonepe.ensembleai.core.client.AgentClient} for the
     * keys that are understood; anything else is passed through to the remote API.
     */
    Map<String, Object> parameters;

    /**
     * Selects a prompt template on the agent. Optional.
     */
    String taskType;

    /**
     * Hard limit for every attempt made for this task. The agent's configured timeout is used if null.
     */
    Duration timeout;

    @Builder
    @Jacksonized
    public Task(
            String id,
            @NonNull String agentName,
            String input,
            Map<String, Object> parameters,
            String taskType,
            Duration timeout) {
        this.id = Strings.isNullOrEmpty(id) ? UUID.randomUUID().toString() : id;
        this.agentName = agentName;
        this.input = Strings.nullToEmpty(input);
        this.parameters = copyOf(parameters);
        this.taskType = taskType;
        this.timeout = timeout;
    }

    public static Task of(String agentName, String input) {
        return Task.builder()
                .agentName(agentName)
                .input(input)
                .build();
    }

    private static Map<String, Object> copyOf(Map<String, Object> parameters) {
        final var params = Objects.requireNonNullElse(parameters, Map.<String, Object>of());
        //Map.copyOf does not allow null values
        final var copy = new LinkedHashMap<String, Object>();
        params.forEach((key, value) -> {
            if (null != value) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
