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

package org.docsync.core;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Closeable;
import java.io.IOException;

import com.google.common.io.Closer;
import org.docsync.api.ChangeRequestManager;
import org.docsync.api.ConflictManager;
import org.docsync.api.DocSyncRepository;
import org.docsync.api.PageManager;
import org.docsync.api.SyncManager;
import org.docsync.api.VersionManager;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DocSyncRepository} holding the wired managers. Closing it closes
 * the resources registered with it, e.g. the watchdog schedule and the
 * executors of the sync engine.
 */
public class DocSyncRepositoryImpl implements DocSyncRepository {

    private static final Logger LOG = LoggerFactory.getLogger(DocSyncRepositoryImpl.class);

    private final PageManager pageManager;

    private final VersionManager versionManager;

    private final ConflictManager conflictManager;

    private final SyncManager syncManager;

    private final ChangeRequestManager changeRequestManager;

    private final Closer closer = Closer.create();

    private volatile boolean closed;

    public DocSyncRepositoryImpl(@NotNull PageManager pageManager, @NotNull VersionManager versionManager,
                                 @NotNull ConflictManager conflictManager, @NotNull SyncManager syncManager,
                                 @NotNull ChangeRequestManager changeRequestManager) {
        this.pageManager = checkNotNull(pageManager);
        this.versionManager = checkNotNull(versionManager);
        this.conflictManager = checkNotNull(conflictManager);
        this.syncManager = checkNotNull(syncManager);
        this.changeRequestManager = checkNotNull(changeRequestManager);
    }

    /**
     * Registers a resource to close with the repository. Resources are closed
     * in reverse order of registration.
     */
    @NotNull
    public <C extends Closeable> C register(@NotNull C closeable) {
        return closer.register(checkNotNull(closeable));
    }

    @NotNull
    @Override
    public PageManager getPageManager() {
        return pageManager;
    }

    @NotNull
    @Override
    public VersionManager getVersionManager() {
        return versionManager;
    }

    @NotNull
    @Override
    public ConflictManager getConflictManager() {
        return conflictManager;
    }

    @NotNull
    @Override
    public SyncManager getSyncManager() {
        return syncManager;
    }

    @NotNull
    @Override
    public ChangeRequestManager getChangeRequestManager() {
        return changeRequestManager;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        LOG.info("Closing repository");
        closer.close();
    }
}
