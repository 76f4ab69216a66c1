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

import org.docsync.api.sync.GitBranch;
import org.docsync.api.sync.GitCommitRecord;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.api.sync.SyncDirection;
import org.docsync.api.sync.SyncHistory;
import org.docsync.api.sync.WebhookEvent;
import org.jetbrains.annotations.NotNull;

/**
 * Repository bindings and the sync runs between a space and its repository.
 */
public interface SyncManager {

    /**
     * Binds a space to a repository using the default settings.
     *
     * @throws ContentException Conflict if the space is already bound
     */
    @NotNull
    GitSyncConfig createSyncConfig(@NotNull String spaceId, @NotNull String repositoryUrl,
                                   @NotNull String actorId) throws ContentException;

    /**
     * Updates branch, root path, patterns, commit template and auto sync flag
     * from the given config. Sync state is not touched.
     */
    @NotNull
    GitSyncConfig updateSyncConfig(@NotNull GitSyncConfig config, @NotNull String actorId) throws ContentException;

    @NotNull
    GitSyncConfig getSyncConfig(@NotNull String configId) throws ContentException;

    @NotNull
    GitSyncConfig getSyncConfigForSpace(@NotNull String spaceId) throws ContentException;

    /**
     * Registers a webhook for the binding with the repository.
     */
    @NotNull
    GitSyncConfig registerWebhook(@NotNull String configId, @NotNull String callbackUrl,
                                  @NotNull String actorId) throws ContentException;

    @NotNull
    GitBranch addBranch(@NotNull String configId, @NotNull String name) throws ContentException;

    @NotNull
    List<GitBranch> getBranches(@NotNull String configId) throws ContentException;

    /**
     * Starts a sync run in the background.
     *
     * @return the id of the sync history record of the run
     * @throws ContentException Conflict if a run is already in flight
     */
    @NotNull
    String triggerSync(@NotNull String configId, @NotNull SyncDirection direction,
                       @NotNull String actorId) throws ContentException;

    /**
     * Starts a pull for the commits referenced by a webhook event. A redelivered
     * event whose commits were all seen before starts nothing and returns the id
     * of the run that recorded them.
     */
    @NotNull
    String handleWebhook(@NotNull String configId, @NotNull WebhookEvent event) throws ContentException;

    @NotNull
    SyncHistory getSyncHistory(@NotNull String syncHistoryId) throws ContentException;

    /**
     * Sync runs of a binding, most recent first.
     */
    @NotNull
    List<SyncHistory> getSyncHistories(@NotNull String configId) throws ContentException;

    /**
     * Commits recorded for a binding, in the order they were recorded.
     */
    @NotNull
    List<GitCommitRecord> getCommits(@NotNull String configId) throws ContentException;
}
