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
import org.docsync.api.content.PageVersion;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The version log of pages. Versions are immutable and numbered 1, 2, 3, ...
 * per page without gaps.
 */
public interface VersionManager {

    /**
     * Records the current content of a page as a new version.
     */
    @NotNull
    PageVersion createVersion(@NotNull String pageId, @Nullable String changeSummary,
                              @NotNull String actorId) throws ContentException;

    /**
     * All versions of a page, oldest first.
     */
    @NotNull
    List<PageVersion> listVersions(@NotNull String pageId) throws ContentException;

    @NotNull
    PageVersion getVersion(@NotNull String pageId, int versionNumber) throws ContentException;

    /**
     * Makes the content of a version the current content of the page. The
     * current content is recorded as a new version first, unless it already
     * equals the restored content.
     */
    @NotNull
    Page restoreVersion(@NotNull String pageId, int versionNumber, @NotNull String actorId) throws ContentException;
}
