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

import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phonepe.ensembleai.core.client.GenerationRequest;
import com.phonepe.ensembleai.core.config.AgentConfig;
import com.phonepe.ensembleai.core.errors.EnsembleException;
import com.phonepe.ensembleai.core.errors.ErrorType;
import com.phonepe.ensembleai.core.utils.JsonUtils;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link OpenAICompatibleTextGenerator}
 */
@WireMockTest
class OpenAICompatibleTextGeneratorTest {
    private static final String PATH = "/v1/chat/completions";

    private static OpenAICompatibleTextGenerator generator(WireMockRuntimeInfo wiremock) {
        return new OpenAICompatibleTextGenerator(AgentConfig.builder()
                                                         .name("kimi")
                                                         .model("moonshot-v1-8k")
                                                         .build(),
                                                 wiremock.getHttpBaseUrl() + PATH,
                                                 "sk-test",
                                                 new OkHttpClient.Builder().build(),
                                                 JsonUtils.createMapper());
    }

    private static GenerationRequest request() {
        return GenerationRequest.builder()
                .agentName("kimi")
                .model("moonshot-v1-8k")
                .systemPrompt("You are Kimi")
                .prompt("Hello")
                .temperature(0.3)
                .maxTokens(100)
                .extraParameter("top_p", 0.9)
                .build();
    }

    @Test
    void testGenerate(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo(PATH))
                        .withHeader("Authorization", equalTo("Bearer sk-test"))
                        .withRequestBody(equalToJson("""
                                                             {
                                                               "model": "moonshot-v1-8k",
                                                               "messages": [
                                                                 {"role": "system", "content": "You are Kimi"},
                                                                 {"role": "user", "content": "Hello"}
                                                               ],
                                                               "max_tokens": 100,
                                                               "temperature": 0.3,
                                                               "top_p": 0.9
                                                             }
                                                             """))
                        .willReturn(jsonResponse("""
                                                         {
                                                           "id": "chatcmpl-1",
                                                           "choices": [
                                                             {"index": 0, "message": {"role": "assistant", "content": "Hi there"}}
                                                           ]
                                                         }
                                                         """, 200)));
        try (final var generator = generator(wiremock)) {
            assertEquals("Hi there", generator.generate(request()));
        }
    }

    @Test
    void testSystemPromptOmittedWhenEmpty(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo(PATH))
                        .withRequestBody(notMatching(".*\"system\".*"))
                        .willReturn(jsonResponse("""
                                                         {"choices": [{"message": {"content": "ok"}}]}
                                                         """, 200)));
        try (final var generator = generator(wiremock)) {
            assertEquals("ok", generator.generate(GenerationRequest.builder()
                                                           .model("moonshot-v1-8k")
                                                           .prompt("Hello")
                                                           .maxTokens(10)
                                                           .build()));
        }
    }

    @Test
    void testStatusMapping(final WireMockRuntimeInfo wiremock) {
        try (final var generator = generator(wiremock)) {
            assertFailure(generator, 429, ErrorType.RATE_LIMITED);
            assertFailure(generator, 503, ErrorType.TRANSIENT);
            assertFailure(generator, 500, ErrorType.TRANSIENT);
            assertFailure(generator, 408, ErrorType.TRANSIENT);
            assertFailure(generator, 401, ErrorType.NON_RETRYABLE);
            assertFailure(generator, 400, ErrorType.NON_RETRYABLE);
        }
    }

    @Test
    void testMalformedResponsesAreTransient(final WireMockRuntimeInfo wiremock) {
        try (final var generator = generator(wiremock)) {
            stubFor(post(urlEqualTo(PATH)).willReturn(okJson("{\"choices\": []}")));
            assertEquals(ErrorType.TRANSIENT,
                         assertThrows(EnsembleException.class, () -> generator.generate(request())).getErrorType());

            stubFor(post(urlEqualTo(PATH)).willReturn(ok("not json {")));
            assertEquals(ErrorType.TRANSIENT,
                         assertThrows(EnsembleException.class, () -> generator.generate(request())).getErrorType());
        }
    }

    @Test
    void testNetworkErrorIsTransient(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo(PATH)).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));
        try (final var generator = generator(wiremock)) {
            final var error = assertThrows(EnsembleException.class, () -> generator.generate(request()));
            assertEquals(ErrorType.TRANSIENT, error.getErrorType());
        }
    }

    @Test
    void testSlowResponseCutOffAtRequestTimeout(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo(PATH)).willReturn(okJson("{\"choices\": [{\"message\": {\"content\": \"late\"}}]}")
                                                          .withFixedDelay(4_000)));
        try (final var generator = generator(wiremock)) {
            final var request = GenerationRequest.builder()
                    .agentName("kimi")
                    .model("moonshot-v1-8k")
                    .prompt("Hello")
                    .maxTokens(100)
                    .timeout(Duration.ofMillis(300))
                    .build();
            final var startTime = System.nanoTime();
            final var error = assertThrows(EnsembleException.class, () -> generator.generate(request));
            final var elapsed = Duration.ofNanos(System.nanoTime() - startTime);
            assertEquals(ErrorType.TRANSIENT, error.getErrorType());
            assertTrue(elapsed.toMillis() < 2_000, "Took " + elapsed);
        }
    }

    @Test
    void testProbe(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo(PATH))
                        .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("1")))
                        .willReturn(okJson("{\"choices\": [{\"message\": {\"content\": \"p\"}}]}")));
        try (final var generator = generator(wiremock)) {
            assertTrue(generator.probe());
            stubFor(post(urlEqualTo(PATH)).willReturn(aResponse().withStatus(401)));
            assertFalse(generator.probe());
        }
    }

    private static void assertFailure(OpenAICompatibleTextGenerator generator, int status, ErrorType expected) {
        stubFor(post(urlEqualTo(PATH)).willReturn(aResponse().withStatus(status).withBody("{\"error\": \"x\"}")));
        final var error = assertThrows(EnsembleException.class, () -> generator.generate(request()));
        assertEquals(expected, error.getErrorType(), "Status " + status);
        assertTrue(error.getMessage().contains(String.valueOf(status)));
    }
}
