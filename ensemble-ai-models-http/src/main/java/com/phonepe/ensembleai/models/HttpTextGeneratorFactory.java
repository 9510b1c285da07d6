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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.ensembleai.core.client.TextGenerator;
import com.phonepe.ensembleai.core.client.TextGeneratorFactory;
import com.phonepe.ensembleai.core.config.AgentConfig;
import com.phonepe.ensembleai.core.errors.EnsembleException;
import com.phonepe.ensembleai.core.errors.ErrorType;
import com.phonepe.ensembleai.core.utils.EnvLoader;
import com.phonepe.ensembleai.core.utils.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Creates HTTP backed generators. The wire format is picked from {@link AgentConfig#getModelFamily()}: qwen and
 * dashscope use the DashScope API, everything else uses the OpenAI compatible chat completion API.
 * <p>
 * Every generator gets its own {@link OkHttpClient} so that closing one agent never affects another.
 */
@Slf4j
public class HttpTextGeneratorFactory implements TextGeneratorFactory {
    public static final String OPENAI_ENDPOINT = "https://api.openai.com/v1/chat/completions";
    public static final String KIMI_ENDPOINT = "https://api.moonshot.cn/v1/chat/completions";
    public static final String DASHSCOPE_ENDPOINT
            = "https://dashscope.aliyuncs.com/api/v1/services/aigc/text-generation/generation";

    private static final Map<String, String> DEFAULT_ENDPOINTS = Map.of(
            "openai", OPENAI_ENDPOINT,
            "kimi", KIMI_ENDPOINT,
            "moonshot", KIMI_ENDPOINT,
            "qwen", DASHSCOPE_ENDPOINT,
            "dashscope", DASHSCOPE_ENDPOINT);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final ObjectMapper mapper;

    public HttpTextGeneratorFactory() {
        this(JsonUtils.createMapper());
    }

    public HttpTextGeneratorFactory(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public TextGenerator create(AgentConfig config) {
        final var family = Strings.isNullOrEmpty(config.getModelFamily())
                           ? "openai"
                           : config.getModelFamily().toLowerCase(Locale.ROOT);
        final var endpoint = Strings.isNullOrEmpty(config.getEndpoint())
                             ? DEFAULT_ENDPOINTS.get(family)
                             : config.getEndpoint();
        if (null == endpoint) {
            throw EnsembleException.of(ErrorType.CONFIG_INVALID,
                                       "[%s] endpoint is required for model family %s"
                                               .formatted(config.getName(), family));
        }
        final var apiKey = EnvLoader.resolveReference(config.getApiKey())
                .orElseThrow(() -> EnsembleException.of(ErrorType.CONFIG_INVALID,
                                                        "[%s] api key is not available".formatted(config.getName())));
        //Reads are bounded by the call timeout, which every request overrides with its attempt timeout
        final var httpClient = new OkHttpClient.Builder()
                .connectTimeout(CONNECT_TIMEOUT)
                .readTimeout(Duration.ZERO)
                .callTimeout(config.getTimeout())
                .build();
        log.debug("Creating {} generator for agent {} with endpoint {}", family, config.getName(), endpoint);
        return switch (family) {
            case "qwen", "dashscope" -> new DashScopeTextGenerator(config, endpoint, apiKey, httpClient, mapper);
            default -> new OpenAICompatibleTextGenerator(config, endpoint, apiKey, httpClient, mapper);
        };
    }
}
