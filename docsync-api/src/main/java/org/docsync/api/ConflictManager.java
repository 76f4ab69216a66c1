/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.docsync.api;

import java.util.List;

import org.docsync.api.content.Page;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.ResolutionChoice;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Explicit resolution of sync conflicts. Conflicts are never resolved
 * automatically.
 */
public interface ConflictManager {

    /**
     * Resolves the conflict of a page.
     *
     * @param content the merged content, required for {@link ResolutionChoice#MERGED}
     * @return the page after resolution
     * @throws ContentException NotFound for an unknown page, Validation if the
     *         page has no conflict or merged content is missing
     */
    @NotNull
    Page resolveConflict(@NotNull String pageId, @NotNull ResolutionChoice choice,
                         @Nullable PageContent content, @NotNull String actorId) throws ContentException;

    /**
     * Pages of a space with an unresolved conflict.
     */
    @NotNull
    List<Page> getConflicts(@NotNull String spaceId) throws ContentException;
}
