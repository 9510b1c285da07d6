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

package com.phonepe.ensembleai.core.registry;

import com.phonepe.ensembleai.core.client.AgentClient;
import com.phonepe.ensembleai.core.client.TextGeneratorFactory;
import com.phonepe.ensembleai.core.config.AgentConfig;
import com.phonepe.ensembleai.core.config.AgentConfigValidator;
import com.phonepe.ensembleai.core.errors.EnsembleException;
import com.phonepe.ensembleai.core.errors.ErrorType;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the live {@link AgentClient} for every registered agent, keyed by agent name.
 * <p>
 * Lookups are lock free and can run concurrently with task execution. Registration, replacement and removal are
 * serialized. A client removed from the registry is closed only after the mapping is gone, so a lookup never returns
 * a closed client that is still mapped. Invocations already holding the old client finish with
 * {@link ErrorType#CLIENT_CLOSED} at their next attempt boundary.
 */
@Slf4j
public class AgentRegistry implements AutoCloseable {
    private final TextGeneratorFactory generatorFactory;
    private final boolean validateOnRegistration;

    private final Map<String, AgentClient> clients = new ConcurrentHashMap<>();
    private final Lock mutationLock = new ReentrantLock();

    @Builder
    public AgentRegistry(@NonNull TextGeneratorFactory generatorFactory, boolean validateOnRegistration) {
        this.generatorFactory = generatorFactory;
        this.validateOnRegistration = validateOnRegistration;
    }

    /**
     * Build a client for the config and add it to the registry.
     *
     * @throws EnsembleException with {@link ErrorType#CONFIG_INVALID} if the config is invalid or the probe fails,
     *                           or {@link ErrorType#AGENT_ALREADY_REGISTERED} if the name is taken
     */
    public AgentClient register(@NonNull final AgentConfig config) {
        AgentConfigValidator.validate(config);
        mutationLock.lock();
        try {
            if (clients.containsKey(config.getName())) {
                throw EnsembleException.of(ErrorType.AGENT_ALREADY_REGISTERED, config.getName());
            }
            final var client = createClient(config);
            clients.put(config.getName(), client);
            log.info("Registered agent {} [family: {}, model: {}]",
                     config.getName(), config.getModelFamily(), config.getModel());
            return client;
        }
        finally {
            mutationLock.unlock();
        }
    }

    /**
     * Swap the client for an agent with one built from the new config. If the new client cannot be built the old one
     * remains registered and untouched. If no agent exists with the name, this behaves like
     * {@link #register(AgentConfig)}.
     */
    public AgentClient replace(@NonNull final AgentConfig config) {
        AgentConfigValidator.validate(config);
        final AgentClient old;
        final AgentClient client;
        mutationLock.lock();
        try {
            client = createClient(config);
            old = clients.put(config.getName(), client);
        }
        finally {
            mutationLock.unlock();
        }
        if (null != old) {
            log.info("Replaced client for agent {}", config.getName());
            old.close();
        }
        else {
            log.info("Registered agent {} [family: {}, model: {}]",
                     config.getName(), config.getModelFamily(), config.getModel());
        }
        return client;
    }

    /**
     * Remove the agent and release its client
     *
     * @throws EnsembleException with {@link ErrorType#AGENT_NOT_FOUND} if there is no such agent
     */
    public void unregister(@NonNull final String name) {
        final AgentClient removed;
        mutationLock.lock();
        try {
            removed = clients.remove(name);
        }
        finally {
            mutationLock.unlock();
        }
        if (null == removed) {
            throw EnsembleException.of(ErrorType.AGENT_NOT_FOUND, name);
        }
        log.info("Unregistered agent {}", name);
        removed.close();
    }

    public Optional<AgentClient> resolve(final String name) {
        return null == name ? Optional.empty() : Optional.ofNullable(clients.get(name));
    }

    public List<String> names() {
        return clients.keySet()
                .stream()
                .sorted()
                .toList();
    }

    public List<AgentClient> clients() {
        return clients.values()
                .stream()
                .sorted(Comparator.comparing(AgentClient::getName))
                .toList();
    }

    public int size() {
        return clients.size();
    }

    /**
     * Remove and close every client
     */
    @Override
    public void close() {
        final List<AgentClient> removed;
        mutationLock.lock();
        try {
            removed = new ArrayList<>(clients.values());
            clients.clear();
        }
        finally {
            mutationLock.unlock();
        }
        log.info("Closing {} agent client(s)", removed.size());
        removed.forEach(AgentClient::close);
    }

    private AgentClient createClient(AgentConfig config) {
        final var client = new AgentClient(config, generatorFactory.create(config));
        if (validateOnRegistration && !client.validate()) {
            client.close();
            throw EnsembleException.of(ErrorType.CONFIG_INVALID,
                                       "[%s] probe failed for endpoint".formatted(config.getName()));
        }
        return client;
    }
}
