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

import com.google.common.base.Strings;
import com.phonepe.ensembleai.core.errors.EnsembleException;
import com.phonepe.ensembleai.core.errors.ErrorType;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates {@link AgentConfig} before it is handed over to the registry. All violations are reported together.
 */
@UtilityClass
public class AgentConfigValidator {

    public static List<String> violations(final AgentConfig config) {
        final var violations = new ArrayList<String>();
        if (null == config) {
            violations.add("config is null");
            return violations;
        }
        if (Strings.isNullOrEmpty(config.getName()) || config.getName().isBlank()) {
            violations.add("name must not be empty");
        }
        if (config.getTimeoutSeconds() <= 0) {
            violations.add("timeout_seconds must be positive, found %d".formatted(config.getTimeoutSeconds()));
        }
        if (config.getMaxRetries() < 0) {
            violations.add("max_retries must not be negative, found %d".formatted(config.getMaxRetries()));
        }
        if (config.getMaxTokens() <= 0) {
            violations.add("max_tokens must be positive, found %d".formatted(config.getMaxTokens()));
        }
        if (config.getBackoffFactor() < 1.0) {
            violations.add("backoff_factor must be at least 1, found %s".formatted(config.getBackoffFactor()));
        }
        if (config.getInitialBackoffMillis() < 0) {
            violations.add("initial_backoff_millis must not be negative, found %d"
                                   .formatted(config.getInitialBackoffMillis()));
        }
        if (config.getMaxBackoffMillis() < config.getInitialBackoffMillis()) {
            violations.add("max_backoff_millis must not be less than initial_backoff_millis");
        }
        return violations;
    }

    /**
     * @param config Config to validate
     * @return The config if valid
     * @throws EnsembleException of type {@link ErrorType#CONFIG_INVALID} listing all violations
     */
    public static AgentConfig validate(final AgentConfig config) {
        final var violations = violations(config);
        if (!violations.isEmpty()) {
            final var name = config == null ? null : config.getName();
            throw EnsembleException.of(ErrorType.CONFIG_INVALID,
                                       "[%s] %s".formatted(name, String.join(", ", violations)));
        }
        return config;
    }
}
