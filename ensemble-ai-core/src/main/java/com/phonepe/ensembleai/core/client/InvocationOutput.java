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

import com.phonepe.ensembleai.core.errors.EnsembleError;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of {@link AgentClient#invoke}. Exactly one of text and error is set.
 */
@Value
public class InvocationOutput {
    String text;
    EnsembleError error;
    int attemptsUsed;
    Duration elapsed;

    public static InvocationOutput success(String text, int attemptsUsed, Duration elapsed) {
        return new InvocationOutput(text, null, attemptsUsed, elapsed);
    }

    public static InvocationOutput error(EnsembleError error, int attemptsUsed, Duration elapsed) {
        return new InvocationOutput(null, error, attemptsUsed, elapsed);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
