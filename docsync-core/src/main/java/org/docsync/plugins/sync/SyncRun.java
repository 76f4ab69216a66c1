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

package org.docsync.plugins.sync;

import static com.google.common.collect.Lists.newArrayList;
import static org.docsync.api.ContentException.CONFLICT;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

import org.docsync.api.ContentException;
import org.docsync.api.sync.GitCommitRecord;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.api.sync.SyncDirection;
import org.docsync.api.sync.SyncHistory;
import org.docsync.plugins.git.FileMapping;
import org.docsync.spi.git.GitRepository;
import org.docsync.spi.store.StoreSession;

/**
 * State of one sync run: the binding as it was when the run started and the
 * outcome collected while it runs. The outcome is written to the store when
 * the run completes.
 */
class SyncRun {

    final String historyId;

    final GitSyncConfig config;

    final SyncDirection direction;

    final String actorId;

    /**
     * Commits announced for this run, in any order; the run pulls up to the
     * newest of them. Empty to pull up to the head of the branch.
     */
    final Set<String> targetShas;

    /**
     * Announced commits that are not on the branch.
     */
    final Set<String> missingShas = new LinkedHashSet<String>();

    final FileMapping mapping;

    GitRepository repository;

    int filesProcessed;

    int pagesCreated;

    int pagesUpdated;

    int pagesDeleted;

    final List<String> errors = newArrayList();

    final List<String> conflicts = newArrayList();

    final Map<String, String> metadata = new LinkedHashMap<String, String>();

    /**
     * Commit the binding is at after the run, {@code null} if unchanged.
     */
    String endCommit;

    final List<GitCommitRecord> commits = newArrayList();

    /**
     * New synced file of pages, a {@code null} value clears it.
     */
    final Map<String, String> syncedPaths = new LinkedHashMap<String, String>();

    SyncRun(SyncHistory history, GitSyncConfig config, String actorId, Collection<String> targetShas) {
        this.historyId = history.getId();
        this.config = config;
        this.direction = history.getDirection();
        this.actorId = actorId;
        this.targetShas = ImmutableSet.copyOf(targetShas);
        this.mapping = new FileMapping(config);
    }

    /**
     * Fails with a Conflict if this run is no longer the active run of its
     * binding, e.g. because the watchdog expired it.
     */
    void checkActive(StoreSession session) throws ContentException {
        GitSyncConfig current = session.getSyncConfig(config.getId());
        if (current == null || !historyId.equals(current.getActiveSyncId())) {
            throw new ContentException(CONFLICT, 41, "Sync " + historyId + " was superseded");
        }
    }

    String getSpaceId() {
        return config.getSpaceId();
    }

    @Override
    public String toString() {
        return direction + " " + historyId + " of " + config.getRepositoryUrl();
    }
}
