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

package com.phonepe.ensembleai.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Classes of failure that can be reported for an agent invocation or a task.
 * Retryable types are retried by the {@link com.phonepe.ensembleai.core.client.AgentClient} as per its retry budget.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", false),
    CONFIG_INVALID("Invalid agent configuration: %s", false),
    AGENT_NOT_FOUND("Agent not found: %s", false),
    AGENT_ALREADY_REGISTERED("Agent already registered: %s", false),
    TRANSIENT("Transient failure: %s", true),
    RATE_LIMITED("Rate limit exceeded: %s", true),
    TIMEOUT("Attempt timed out after %s", true),
    EXHAUSTED("Retries exhausted after %d attempts. Last error: %s", false),
    NON_RETRYABLE("Call failed permanently: %s", false),
    CANCELLED("Cancelled: %s", false),
    CLIENT_CLOSED("Client for agent %s has been closed", false),
    SKIPPED("Skipped as dependency failed: %s", false),
    INVALID_REFERENCE("Reference to unknown task result: %s", false),
    PROJECT_NOT_FOUND("Project not found: %s", false),
    PROJECT_ALREADY_EXISTS("Project already exists: %s", false),
    UNKNOWN("Unexpected error: %s", false)
    ;

    private final String message;
    private final boolean retryable;
}
