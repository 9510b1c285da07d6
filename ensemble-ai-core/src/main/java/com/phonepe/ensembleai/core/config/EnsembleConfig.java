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

package com.phonepe.ensembleai.core.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;

/**
 * Top level configuration for an {@link com.phonepe.ensembleai.core.Ensemble}
 */
@Value
@Builder
@Jacksonized
public class EnsembleConfig {
    public static final int DEFAULT_MAX_PARALLEL_AGENTS = 5;

    /**
     * Per attempt timeout for tasks that do not set one. Each agent's own timeout applies if this is not set.
     */
    Integer defaultTimeoutSeconds;

    /**
     * Concurrency bound used for parallel batches and project stages when none is specified
     */
    @Builder.Default
    int maxParallelAgents = DEFAULT_MAX_PARALLEL_AGENTS;

    /**
     * Probe each agent's remote API when it gets registered. Registration fails if the probe fails.
     */
    boolean validateAgentsOnRegistration;

    /**
     * Agents to be registered, in order
     */
    @Singular
    List<AgentConfig> agents;

    public Duration defaultTimeout() {
        return null == defaultTimeoutSeconds || defaultTimeoutSeconds <= 0
               ? null
               : Duration.ofSeconds(defaultTimeoutSeconds);
    }
}
