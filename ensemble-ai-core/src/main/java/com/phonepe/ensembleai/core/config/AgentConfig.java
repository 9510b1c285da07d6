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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for a single agent. An agent is a named binding to one remote text generation capability.
 * Configs are immutable, a changed configuration is registered by replacing the old one wholesale.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class AgentConfig {
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 1000;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;
    public static final long DEFAULT_INITIAL_BACKOFF_MILLIS = 1_000;
    public static final long DEFAULT_MAX_BACKOFF_MILLIS = 30_000;

    /**
     * Unique name of the agent. Tasks refer to agents by this name.
     */
    String name;

    String description;

    /**
     * Family of the remote API, for example kimi, qwen or openai. Used to pick the wire format.
     */
    String modelFamily;

    /**
     * Model id sent to the remote API
     */
    String model;

    /**
     * Endpoint for the remote API. Generators fall back to a default for the family if empty.
     */
    String endpoint;

    /**
     * API key reference. Use <code>env:VARIABLE</code> to read it from the environment.
     */
    @ToString.Exclude
    String apiKey;

    /**
     * System prompt sent with every call made by this agent
     */
    String systemPrompt;

    /**
     * Prompt templates keyed by task type. Templates can use <code>${input}</code> and task parameters as
     * placeholders.
     */
    @Builder.Default
    Map<String, String> promptTemplates = Map.of();

    @Builder.Default
    double temperature = DEFAULT_TEMPERATURE;

    @Builder.Default
    int maxTokens = DEFAULT_MAX_TOKENS;

    /**
     * Hard timeout for a single attempt
     */
    @Builder.Default
    int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

    /**
     * Number of retries after the first attempt for transient failures
     */
    @Builder.Default
    int maxRetries = DEFAULT_MAX_RETRIES;

    /**
     * Multiplier applied to the delay after every failed attempt
     */
    @Builder.Default
    double backoffFactor = DEFAULT_BACKOFF_FACTOR;

    @Builder.Default
    long initialBackoffMillis = DEFAULT_INITIAL_BACKOFF_MILLIS;

    @Builder.Default
    long maxBackoffMillis = DEFAULT_MAX_BACKOFF_MILLIS;

    @JsonIgnore
    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    @JsonIgnore
    public Duration getInitialBackoff() {
        return Duration.ofMillis(initialBackoffMillis);
    }

    @JsonIgnore
    public Duration getMaxBackoff() {
        return Duration.ofMillis(maxBackoffMillis);
    }
}
