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

package com.phonepe.ensembleai.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import com.phonepe.ensembleai.core.client.GenerationRequest;
import com.phonepe.ensembleai.core.config.AgentConfig;
import okhttp3.OkHttpClient;

import java.util.Optional;

/**
 * Generator for chat completion APIs that follow the OpenAI wire format. Used for OpenAI and Moonshot (Kimi).
 */
public class OpenAICompatibleTextGenerator extends HttpTextGenerator {

    public OpenAICompatibleTextGenerator(
            AgentConfig config,
            String endpoint,
            String apiKey,
            OkHttpClient httpClient,
            ObjectMapper mapper) {
        super(config, endpoint, apiKey, httpClient, mapper);
    }

    @Override
    protected ObjectNode createPayload(GenerationRequest request) {
        final var payload = mapper.createObjectNode();
        payload.put("model", request.getModel());
        final var messages = payload.putArray("messages");
        if (!Strings.isNullOrEmpty(request.getSystemPrompt())) {
            messages.addObject()
                    .put("role", "system")
                    .put("content", request.getSystemPrompt());
        }
        messages.addObject()
                .put("role", "user")
                .put("content", request.getPrompt());
        payload.put("max_tokens", request.getMaxTokens());
        payload.put("temperature", request.getTemperature());
        request.getExtraParameters().forEach((name, value) -> payload.set(name, mapper.valueToTree(value)));
        return payload;
    }

    @Override
    protected Optional<String> extractText(JsonNode response) {
        final var content = response.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? Optional.of(content.asText()) : Optional.empty();
    }
}
