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

package com.phonepe.ensembleai.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.phonepe.ensembleai.core.utils.JsonUtils;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Utility class for loading ensemble and agent configuration from YAML (or JSON, which is valid YAML).
 * Keys are expected in snake_case.
 */
@UtilityClass
@Slf4j
public class ConfigReaders {

    @SneakyThrows
    public static EnsembleConfig loadEnsembleConfig(final Path path) {
        log.info("Loading ensemble configuration from {}", path);
        return loadEnsembleConfigFromContent(Files.readAllBytes(path));
    }

    @SneakyThrows
    public static EnsembleConfig loadEnsembleConfigFromContent(byte[] content) {
        return Objects.requireNonNull(JsonUtils.createYamlMapper().readValue(content, EnsembleConfig.class),
                                      "Empty ensemble configuration");
    }

    @SneakyThrows
    public static List<AgentConfig> loadAgents(final Path path) {
        log.info("Loading agent configurations from {}", path);
        return loadAgentsFromContent(Files.readAllBytes(path));
    }

    /**
     * Reads an ordered list of agent configs. Configs are not validated here.
     */
    @SneakyThrows
    public static List<AgentConfig> loadAgentsFromContent(byte[] content) {
        final var agents = JsonUtils.createYamlMapper()
                .readValue(content, new TypeReference<List<AgentConfig>>() {
                });
        if (log.isDebugEnabled()) {
            log.debug("Read agent configs: {}",
                      Objects.requireNonNullElse(agents, List.<AgentConfig>of())
                              .stream()
                              .map(AgentConfig::getName)
                              .toList());
        }
        return Objects.requireNonNullElseGet(agents, List::of);
    }
}
