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

package com.phonepe.ensembleai.core.project;

import com.phonepe.ensembleai.core.errors.EnsembleError;
import com.phonepe.ensembleai.core.errors.ErrorType;
import com.phonepe.ensembleai.core.task.Task;
import com.phonepe.ensembleai.core.task.TaskResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.experimental.UtilityClass;
import org.apache.commons.text.StringSubstitutor;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Replaces references to results of earlier stages in a task's input and string parameters.
 * A reference looks like <code>${stage.taskId}</code> or <code>${stage.index}</code>. Placeholders without a stage
 * prefix (for example <code>${input}</code> in prompt templates) are not touched.
 */
@UtilityClass
public class PlaceholderResolver {
    private static final Pattern REFERENCE = Pattern.compile("\\$\\{([^.{}]+)\\.([^{}]+)}");

    /**
     * Outcome of resolving the references of a single task
     */
    @Value
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class Resolution {
        Task task;
        EnsembleError error;

        public boolean isResolved() {
            return null == error;
        }
    }

    /**
     * Resolve all references in the task
     *
     * @param task            Task with possible references
     * @param completedStages Results of stages that have already run, keyed by stage name
     * @return Resolution with the substituted task, or with {@link ErrorType#SKIPPED} if a referenced result did not
     * succeed, or with {@link ErrorType#INVALID_REFERENCE} if a referenced result does not exist
     */
    public static Resolution resolve(final Task task, final Map<String, StageResult> completedStages) {
        final var references = new LinkedHashSet<String>();
        collect(task.getInput(), references);
        task.getParameters().values().forEach(value -> {
            if (value instanceof String) {
                collect((String) value, references);
            }
        });
        if (references.isEmpty()) {
            return new Resolution(task, null);
        }
        final var values = new HashMap<String, String>();
        for (final var reference : references) {
            final var separator = reference.indexOf('.');
            final var stageName = reference.substring(0, separator);
            final var key = reference.substring(separator + 1);
            final var result = completedStages.containsKey(stageName)
                               ? completedStages.get(stageName).find(key).orElse(null)
                               : null;
            if (null == result) {
                return new Resolution(task, EnsembleError.error(ErrorType.INVALID_REFERENCE, reference));
            }
            if (!result.isSuccess()) {
                return new Resolution(task,
                                      EnsembleError.error(ErrorType.SKIPPED,
                                                          "%s is %s".formatted(reference, result.getStatus())));
            }
            values.put(reference, result.getResponse());
        }
        final var substitutor = new StringSubstitutor(values);
        substitutor.setDisableSubstitutionInValues(true);
        final var parameters = new LinkedHashMap<String, Object>();
        task.getParameters().forEach((name, value) -> parameters.put(
                name,
                value instanceof String ? substitutor.replace((String) value) : value));
        return new Resolution(task.withInput(substitutor.replace(task.getInput()))
                                      .withParameters(parameters),
                              null);
    }

    private static void collect(String text, Set<String> references) {
        if (null == text) {
            return;
        }
        final var matcher = REFERENCE.matcher(text);
        while (matcher.find()) {
            references.add(matcher.group(1) + "." + matcher.group(2));
        }
    }
}
