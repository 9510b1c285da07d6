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

package com.phonepe.ensembleai.core.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * A single request to a {@link TextGenerator}. Agent defaults have already been merged with per call parameters.
 */
@Value
@Builder
public class GenerationRequest {
    String agentName;
    String model;
    String systemPrompt;

    /**
     * Prompt after the task type template (if any) has been applied
     */
    String prompt;
    double temperature;
    int maxTokens;
    String taskType;

    /**
     * Hard limit for this call. Generators that do blocking I/O must give up once it has passed, as an interrupt
     * alone does not stop a blocked socket read. May be null, in which case the generator's own limits apply.
     */
    Duration timeout;

    /**
     * Parameters not understood by the engine. Passed through to the remote API as is.
     */
    @Singular
    Map<String, Object> extraParameters;
}
