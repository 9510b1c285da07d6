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
import lombok.Value;

import java.time.Instant;

/**
 * Point in time status of a single agent, as seen by its {@link AgentClient}
 */
@Value
@Builder
public class AgentStatus {
    String name;
    String modelFamily;
    String model;

    /**
     * False once the client has been closed
     */
    boolean active;

    /**
     * Last known reachability. No remote call is made to compute this.
     */
    boolean reachable;

    long totalInvocations;
    long succeededInvocations;
    long failedInvocations;

    /**
     * Completion time of the latest invocation. Null if the agent was never invoked.
     */
    Instant lastInvocation;
}
