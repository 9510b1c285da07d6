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

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phonepe.ensembleai.core.client.GenerationRequest;
import com.phonepe.ensembleai.core.config.AgentConfig;
import com.phonepe.ensembleai.core.utils.JsonUtils;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests {@link DashScopeTextGenerator}
 */
@WireMockTest
class DashScopeTextGeneratorTest {
    private static final String PATH = "/api/v1/services/aigc/text-generation/generation";

    private static DashScopeTextGenerator generator(WireMockRuntimeInfo wiremock) {
        return new DashScopeTextGenerator(AgentConfig.builder()
                                                  .name("qwen")
                                                  .model("qwen-turbo")
                                                  .build(),
                                          wiremock.getHttpBaseUrl() + PATH,
                                          "sk-dash",
                                          new OkHttpClient.Builder().build(),
                                          JsonUtils.createMapper());
    }

    private static GenerationRequest request() {
        return GenerationRequest.builder()
                .agentName("qwen")
                .model("qwen-turbo")
                .systemPrompt("You are Qwen")
                .prompt("你好")
                .temperature(0.5)
                .maxTokens(200)
                .extraParameter("seed", 42)
                .build();
    }

    @Test
    void testGenerate(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo(PATH))
                        .withHeader("Authorization", equalTo("Bearer sk-dash"))
                        .withHeader("X-DashScope-SSE", equalTo("disable"))
                        .withRequestBody(equalToJson("""
                                                             {
                                                               "model": "qwen-turbo",
                                                               "input": {
                                                                 "messages": [
                                                                   {"role": "system", "content": "You are Qwen"},
                                                                   {"role": "user", "content": "你好"}
                                                                 ]
                                                               },
                                                               "parameters": {
                                                                 "max_tokens": 200,
                                                                 "temperature": 0.5,
                                                                 "result_format": "message",
                                                                 "seed": 42
                                                               }
                                                             }
                                                             """))
                        .willReturn(okJson("""
                                                   {
                                                     "output": {
                                                       "choices": [
                                                         {"finish_reason": "stop", "message": {"role": "assistant", "content": "你好！"}}
                                                       ]
                                                     },
                                                     "request_id": "abc"
                                                   }
                                                   """)));
        try (final var generator = generator(wiremock)) {
            assertEquals("你好！", generator.generate(request()));
        }
    }

    @Test
    void testTextOutputFormat(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo(PATH))
                        .willReturn(okJson("""
                                                   {"output": {"text": "plain text", "finish_reason": "stop"}}
                                                   """)));
        try (final var generator = generator(wiremock)) {
            assertEquals("plain text", generator.generate(request()));
        }
    }
}
