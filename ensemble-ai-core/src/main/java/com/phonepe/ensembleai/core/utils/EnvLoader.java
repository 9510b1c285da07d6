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

package com.phonepe.ensembleai.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.Optional;

/**
 * Loads variables from environment
 */
@UtilityClass
public class EnvLoader {
    /**
     * Prefix used in configuration to point to an environment variable instead of carrying the value itself.
     */
    public static final String ENV_REFERENCE_PREFIX = "env:";

    /**
     * Reads an environment variable
     * @param variable the name of the variable
     * @return the value of the variable if set
     */
    public static Optional<String> readEnv(final String variable) {
        return Optional.ofNullable(Strings.emptyToNull(System.getenv(variable)));
    }

    /**
     * Resolves a secret reference. A reference of the form <code>env:NAME</code> is read from the environment
     * variable NAME, anything else is returned as is.
     *
     * @param reference The reference from config. Can be null.
     * @return Resolved value or empty if the reference is empty or points to an unset variable
     */
    public static Optional<String> resolveReference(final String reference) {
        if (Strings.isNullOrEmpty(reference)) {
            return Optional.empty();
        }
        if (reference.startsWith(ENV_REFERENCE_PREFIX)) {
            final var variable = reference.substring(ENV_REFERENCE_PREFIX.length()).trim();
            return readEnv(Objects.requireNonNull(Strings.emptyToNull(variable),
                                                  "Empty environment variable name in reference: " + reference));
        }
        return Optional.of(reference);
    }
}
