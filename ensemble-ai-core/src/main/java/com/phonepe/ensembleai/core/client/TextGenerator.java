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

/**
 * The capability behind an agent: turn a prompt into text using a remote text generation API.
 * There is one implementation per remote API variant. Engine code never looks at the concrete type.
 * <p>
 * Implementations report failures by throwing {@link com.phonepe.ensembleai.core.errors.EnsembleException} with one
 * of {@link com.phonepe.ensembleai.core.errors.ErrorType#TRANSIENT},
 * {@link com.phonepe.ensembleai.core.errors.ErrorType#RATE_LIMITED} or
 * {@link com.phonepe.ensembleai.core.errors.ErrorType#NON_RETRYABLE}. Retries, timeouts and lifecycle are handled by
 * {@link AgentClient}; implementations must not retry by themselves.
 * <p>
 * An implementation exclusively owns its connection resources. They are released in {@link #close()}, which is
 * called exactly once by the owning {@link AgentClient}.
 */
public interface TextGenerator extends AutoCloseable {

    /**
     * Make one call to the remote API.
     *
     * @param request Fully resolved request
     * @return Generated text
     */
    String generate(final GenerationRequest request);

    /**
     * Lightweight check to see if the remote API is reachable with the configured credentials
     *
     * @return true if reachable
     */
    default boolean probe() {
        return true;
    }

    /**
     * Release connection resources. Must be a no-op if nothing was ever opened.
     */
    @Override
    default void close() throws Exception {
        //Nothing to release by default
    }
}
