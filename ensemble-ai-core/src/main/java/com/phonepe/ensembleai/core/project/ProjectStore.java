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

import java.util.List;
import java.util.Optional;

/**
 * Storage for project definitions. Results of project runs are not stored.
 */
public interface ProjectStore {
    /**
     * Save a new project
     *
     * @param project the project to be saved
     * @return the saved project, or empty if a project with the same name already exists
     */
    Optional<Project> create(final Project project);

    /**
     * Save a project, overwriting any existing project with the same name
     *
     * @param project the project to be saved
     * @return the saved project
     */
    Project update(final Project project);

    Optional<Project> read(final String name);

    /**
     * Lists all the projects in this store
     *
     * @return projects sorted by name
     */
    List<Project> list();

    /**
     * Removes the project with the given name
     *
     * @param name the name of the project
     * @return true if the project was removed, false if it did not exist
     */
    boolean remove(final String name);
}
