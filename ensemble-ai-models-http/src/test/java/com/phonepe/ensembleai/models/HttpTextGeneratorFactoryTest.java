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
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import com.phonepe.ensembleai.core.client.AgentClient;
import com.phonepe.ensembleai.core.config.AgentConfig;
import com.phonepe.ensembleai.core.engine.CancellationToken;
import com.phonepe.ensembleai.core.errors.EnsembleException;
import com.phonepe.ensembleai.core.errors.ErrorType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link HttpTextGeneratorFactory}
 */
@WireMockTest
class HttpTextGeneratorFactoryTest {
    private final HttpTextGeneratorFactory factory = new HttpTextGeneratorFactory();

    @Test
    void testGeneratorSelection() throws Exception {
        try (final var kimi = factory.create(config("kimi", null))) {
            assertInstanceOf(OpenAICompatibleTextGenerator.class, kimi);
            assertEquals(HttpTextGeneratorFactory.KIMI_ENDPOINT, ((HttpTextGenerator) kimi).getEndpoint());
        }
        try (final var qwen = factory.create(config("QWEN", null))) {
            assertInstanceOf(DashScopeTextGenerator.class, qwen);
            assertEquals(HttpTextGeneratorFactory.DASHSCOPE_ENDPOINT, ((HttpTextGenerator) qwen).getEndpoint());
        }
        try (final var openai = factory.create(config(null, null))) {
            assertEquals(HttpTextGeneratorFactory.OPENAI_ENDPOINT, ((HttpTextGenerator) openai).getEndpoint());
        }
        try (final var custom = factory.create(config("deepseek", "http://localhost:9999/v1/chat/completions"))) {
            assertInstanceOf(OpenAICompatibleTextGenerator.class, custom);
        }
    }

    @Test
    void testUnknownFamilyNeedsEndpoint() {
        final var config = config("deepseek", null);
        final var error = assertThrows(EnsembleException.class, () -> factory.create(config));
        assertEquals(ErrorType.CONFIG_INVALID, error.getErrorType());
    }

    @Test
    void testMissingApiKey() {
        final var config = config("kimi", null).withApiKey("env:ENSEMBLE_AI_SURELY_UNSET_VARIABLE");
        final var error = assertThrows(EnsembleException.class, () -> factory.create(config));
        assertEquals(ErrorType.CONFIG_INVALID, error.getErrorType());
    }

    @Test
    void testClientRetriesTransientHttpFailures(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/chat/completions"))
                        .inScenario("flaky")
                        .whenScenarioStateIs(Scenario.STARTED)
                        .willReturn(aResponse().withStatus(503))
                        .willSetStateTo("recovering"));
        stubFor(post(urlEqualTo("/v1/chat/completions"))
                        .inScenario("flaky")
                        .whenScenarioStateIs("recovering")
                        .willReturn(aResponse().withStatus(429))
                        .willSetStateTo("recovered"));
        stubFor(post(urlEqualTo("/v1/chat/completions"))
                        .inScenario("flaky")
                        .whenScenarioStateIs("recovered")
                        .willReturn(okJson("{\"choices\": [{\"message\": {\"content\": \"finally\"}}]}")));
        final var config = config("openai", wiremock.getHttpBaseUrl() + "/v1/chat/completions")
                .withMaxRetries(2)
                .withInitialBackoffMillis(10)
                .withMaxBackoffMillis(50);
        try (final var client = new AgentClient(config, factory.create(config))) {
            final var output = client.invoke("hello", Map.of());
            assertTrue(output.isSuccess());
            assertEquals("finally", output.getText());
            assertEquals(3, output.getAttemptsUsed());
        }
        verify(3, postRequestedFor(urlEqualTo("/v1/chat/completions")));
    }

    @Test
    void testAttemptTimeoutHoldsOverHttp(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(okJson("{\"choices\": [{\"message\": {\"content\": \"late\"}}]}")
                                            .withFixedDelay(4_000)));
        final var config = config("openai", wiremock.getHttpBaseUrl() + "/v1/chat/completions")
                .withTimeoutSeconds(10)
                .withMaxRetries(0);
        try (final var client = new AgentClient(config, factory.create(config))) {
            final var startTime = System.nanoTime();
            final var output = client.invoke("hello", Map.of(), Duration.ofMillis(300), CancellationToken.none());
            final var elapsed = Duration.ofNanos(System.nanoTime() - startTime);
            assertEquals(ErrorType.EXHAUSTED, output.getError().getErrorType());
            assertEquals(1, output.getAttemptsUsed());
            assertTrue(elapsed.toMillis() < 2_000, "Took " + elapsed);
        }
    }

    @Test
    void testClientFailsFastOnAuthError(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/chat/completions")).willReturn(aResponse().withStatus(401)));
        final var config = config("openai", wiremock.getHttpBaseUrl() + "/v1/chat/completions");
        try (final var client = new AgentClient(config, factory.create(config))) {
            final var output = client.invoke("hello", Map.of());
            assertEquals(ErrorType.NON_RETRYABLE, output.getError().getErrorType());
            assertEquals(1, output.getAttemptsUsed());
        }
        verify(1, postRequestedFor(urlEqualTo("/v1/chat/completions")));
    }

    private static AgentConfig config(String family, String endpoint) {
        return AgentConfig.builder()
                .name("agent")
                .modelFamily(family)
                .model("model")
                .endpoint(endpoint)
                .apiKey("sk-literal")
                .build();
    }
}
