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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.ensembleai.core.client.GenerationRequest;
import com.phonepe.ensembleai.core.client.TextGenerator;
import com.phonepe.ensembleai.core.config.AgentConfig;
import com.phonepe.ensembleai.core.errors.EnsembleException;
import com.phonepe.ensembleai.core.utils.AgentUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Base for generators that talk to a JSON over HTTP text generation API. Each instance owns its own
 * {@link OkHttpClient}, which is shut down in {@link #close()}.
 * <p>
 * HTTP status codes are mapped to failure classes as follows: 429 is rate limited; 408 and 5xx are transient; any
 * other non 2xx status fails permanently. Network errors, calls running past the request timeout and unparseable bodies
 * are transient.
 */
@Slf4j
public abstract class HttpTextGenerator implements TextGenerator {
    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String PROBE_PROMPT = "ping";
    private static final int ERROR_BODY_LOG_LIMIT = 200;

    @Getter
    private final AgentConfig config;
    @Getter
    private final String endpoint;
    private final String apiKey;
    private final OkHttpClient httpClient;
    protected final ObjectMapper mapper;

    protected HttpTextGenerator(
            @NonNull AgentConfig config,
            @NonNull String endpoint,
            @NonNull String apiKey,
            @NonNull OkHttpClient httpClient,
            @NonNull ObjectMapper mapper) {
        this.config = config;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.httpClient = httpClient;
        this.mapper = mapper;
    }

    /**
     * Build the JSON payload for the remote API
     */
    protected abstract ObjectNode createPayload(final GenerationRequest request);

    /**
     * Pull the generated text out of a successful response
     */
    protected abstract Optional<String> extractText(final JsonNode response);

    /**
     * Hook to add API specific headers
     */
    protected void addHeaders(final Request.Builder requestBuilder) {
        //Nothing extra by default
    }

    @Override
    public String generate(GenerationRequest request) {
        final var response = post(createPayload(request), request.getTimeout());
        return extractText(response)
                .orElseThrow(() -> EnsembleException.transientFailure(
                        "No generated text in response from " + endpoint, null));
    }

    @Override
    public boolean probe() {
        try {
            generate(GenerationRequest.builder()
                             .agentName(config.getName())
                             .model(config.getModel())
                             .prompt(PROBE_PROMPT)
                             .temperature(0)
                             .maxTokens(1)
                             .timeout(config.getTimeout())
                             .build());
            return true;
        }
        catch (EnsembleException e) {
            log.warn("Probe to {} for agent {} failed: {}", endpoint, config.getName(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        log.debug("Releasing http resources for agent {}", config.getName());
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private JsonNode post(ObjectNode payload, Duration timeout) {
        final Request request;
        try {
            final var requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(mapper.writeValueAsBytes(payload), JSON));
            addHeaders(requestBuilder);
            request = requestBuilder.build();
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            throw EnsembleException.nonRetryable("Could not build request for %s: %s"
                                                         .formatted(endpoint, AgentUtils.rootCause(e).getMessage()));
        }
        final var call = httpClient.newCall(request);
        if (null != timeout) {
            //Bounds the whole call, a thread interrupt does not unblock a socket read
            call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        try (final var response = call.execute()) {
            final var responseBody = response.body();
            final var body = null == responseBody ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw failureFor(response.code(), body);
            }
            try {
                return mapper.readTree(body);
            }
            catch (JsonProcessingException e) {
                throw EnsembleException.transientFailure("Unparseable response from " + endpoint, e);
            }
        }
        catch (IOException e) {
            throw EnsembleException.transientFailure(
                    "Error calling %s: %s".formatted(endpoint, AgentUtils.rootCause(e).getMessage()), e);
        }
    }

    private EnsembleException failureFor(int statusCode, String body) {
        final var message = "Received status %d from %s: %s"
                .formatted(statusCode, endpoint, AgentUtils.abbreviate(body, ERROR_BODY_LOG_LIMIT));
        log.debug("Call for agent {} failed. {}", config.getName(), message);
        if (statusCode == 429) {
            return EnsembleException.rateLimited(message);
        }
        if (statusCode == 408 || statusCode >= 500) {
            return EnsembleException.transientFailure(message, null);
        }
        return EnsembleException.nonRetryable(message);
    }
}
