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

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;
import org.apache.commons.text.StringSubstitutor;

import java.util.HashMap;
import java.util.Map;

/**
 * Applies an agent's task type template to the raw task input.
 * Templates use <code>${input}</code> for the input and <code>${name}</code> for any task parameter. Placeholders
 * with no matching value are left as is. Substituted values are inserted verbatim, placeholders inside them are not
 * expanded.
 */
@UtilityClass
public class PromptRenderer {
    public static final String INPUT_VARIABLE = "input";

    public static String render(final String template, final String input, final Map<String, Object> parameters) {
        if (Strings.isNullOrEmpty(template)) {
            return input;
        }
        final var context = new HashMap<String, Object>();
        parameters.forEach((key, value) -> {
            if (null != value) {
                context.put(key, value);
            }
        });
        context.put(INPUT_VARIABLE, Strings.nullToEmpty(input));
        final var substitutor = new StringSubstitutor(context);
        substitutor.setDisableSubstitutionInValues(true);
        return substitutor.replace(template);
    }
}
