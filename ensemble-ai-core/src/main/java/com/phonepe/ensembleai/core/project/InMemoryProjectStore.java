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

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Project store that keeps projects in memory. Contents are lost on shutdown.
 */
public class InMemoryProjectStore implements ProjectStore {

    private final Map<String, Project> projects = new ConcurrentHashMap<>();

    @Override
    public Optional<Project> create(Project project) {
        return projects.putIfAbsent(project.getName(), project) == null
               ? Optional.of(project)
               : Optional.empty();
    }

    @Override
    public Project update(Project project) {
        projects.put(project.getName(), project);
        return project;
    }

    @Override
    public Optional<Project> read(String name) {
        return Optional.ofNullable(projects.get(name));
    }

    @Override
    public List<Project> list() {
        return projects.values()
                .stream()
                .sorted(Comparator.comparing(Project::getName))
                .toList();
    }

    @Override
    public boolean remove(String name) {
        return projects.remove(name) != null;
    }
}
