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

package org.docsync;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Closeable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.docsync.api.DocSyncRepository;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.commons.concurrent.ExecutorCloser;
import org.docsync.core.DocSyncRepositoryImpl;
import org.docsync.plugins.commit.PageConflictManager;
import org.docsync.plugins.memory.MemoryContentStore;
import org.docsync.plugins.review.ChangeRequestWorkflow;
import org.docsync.plugins.sync.GitSyncEngine;
import org.docsync.plugins.sync.Retries;
import org.docsync.plugins.sync.SyncWatchdog;
import org.docsync.plugins.tree.PageTreeManager;
import org.docsync.plugins.version.PageVersionManager;
import org.docsync.spi.git.GitRepository;
import org.docsync.spi.git.GitRepositoryException;
import org.docsync.spi.git.GitRepositoryProvider;
import org.docsync.spi.security.AccessControl;
import org.docsync.spi.store.ContentStore;
import org.docsync.stats.Clock;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builder for a DocSync repository: a content store together with the
 * plugins and settings to run it with. This class hides the implementation
 * classes and how they are wired together.
 * <pre>
 * DocSyncRepository repository = new DocSync()
 *         .with(new DocSyncOptions().setRequiredApprovals(2))
 *         .with(repositoryProvider)
 *         .createRepository();
 * </pre>
 */
public class DocSync {

    private static final Logger LOG = LoggerFactory.getLogger(DocSync.class);

    /**
     * Provider for stores that are not bound to any repository.
     */
    private static final GitRepositoryProvider NO_REPOSITORIES = new GitRepositoryProvider() {
        @NotNull
        @Override
        public GitRepository getRepository(@NotNull GitSyncConfig config) throws GitRepositoryException {
            throw new GitRepositoryException(GitRepositoryException.Reason.NOT_FOUND,
                    "No repository provider configured for " + config.getRepositoryUrl());
        }

        @Override
        public String toString() {
            return "NO_REPOSITORIES";
        }
    };

    private final ContentStore store;

    private Clock clock = Clock.SIMPLE;

    private DocSyncOptions options = new DocSyncOptions();

    private AccessControl accessControl = AccessControl.OPEN;

    private GitRepositoryProvider repositories = NO_REPOSITORIES;

    private ExecutorService syncExecutor;

    private ScheduledExecutorService scheduledExecutor;

    public DocSync(@NotNull ContentStore store) {
        this.store = checkNotNull(store);
    }

    public DocSync() {
        this(new MemoryContentStore());
    }

    /**
     * Default executor for sync runs: a small pool of daemon threads.
     */
    public static ExecutorService defaultSyncExecutor() {
        return Executors.newFixedThreadPool(4, daemonThreads("docsync-sync-"));
    }

    /**
     * Default executor for the sync watchdog.
     */
    public static ScheduledExecutorService defaultScheduledExecutor() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("docsync-scheduled-"));
    }

    private static ThreadFactory daemonThreads(final String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(@NotNull Runnable r) {
                Thread thread = new Thread(r, prefix + counter.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        };
    }

    @NotNull
    public DocSync with(@NotNull Clock clock) {
        this.clock = checkNotNull(clock);
        return this;
    }

    @NotNull
    public DocSync with(@NotNull DocSyncOptions options) {
        this.options = checkNotNull(options);
        return this;
    }

    @NotNull
    public DocSync with(@NotNull AccessControl accessControl) {
        this.accessControl = checkNotNull(accessControl);
        return this;
    }

    @NotNull
    public DocSync with(@NotNull GitRepositoryProvider repositories) {
        this.repositories = checkNotNull(repositories);
        return this;
    }

    /**
     * Executor for sync runs. An executor passed in is not shut down when
     * the repository is closed.
     */
    @NotNull
    public DocSync with(@NotNull ExecutorService syncExecutor) {
        this.syncExecutor = checkNotNull(syncExecutor);
        return this;
    }

    /**
     * Executor for the sync watchdog. An executor passed in is not shut down
     * when the repository is closed.
     */
    @NotNull
    public DocSync with(@NotNull ScheduledExecutorService scheduledExecutor) {
        this.scheduledExecutor = checkNotNull(scheduledExecutor);
        return this;
    }

    @NotNull
    public DocSyncRepository createRepository() {
        Retries retries = new Retries(options.getGitMaxAttempts(), options.getGitInitialBackoffMillis(),
                options.getGitMaxBackoffMillis());
        ExecutorService executor = syncExecutor;
        boolean ownExecutor = executor == null;
        if (ownExecutor) {
            executor = defaultSyncExecutor();
        }
        ScheduledExecutorService scheduler = scheduledExecutor;
        boolean ownScheduler = scheduler == null;
        if (ownScheduler) {
            scheduler = defaultScheduledExecutor();
        }

        GitSyncEngine syncEngine = new GitSyncEngine(store, repositories, clock, accessControl, executor, retries);
        DocSyncRepositoryImpl repository = new DocSyncRepositoryImpl(
                new PageTreeManager(store, clock, accessControl),
                new PageVersionManager(store, clock, accessControl),
                new PageConflictManager(store, clock, accessControl),
                syncEngine,
                new ChangeRequestWorkflow(store, repositories, clock, accessControl, retries,
                        options.getRequiredApprovals(), options.getMergeLockTimeoutMillis()));

        // closed in reverse order: the watchdog first, then the executors
        if (ownExecutor) {
            repository.register(new ExecutorCloser("sync", executor));
        }
        if (ownScheduler) {
            repository.register(new ExecutorCloser("scheduled", scheduler));
        }
        final ScheduledFuture<?> watchdog = scheduler.scheduleAtFixedRate(
                new SyncWatchdog(syncEngine, options.getSyncTimeoutMillis()),
                options.getWatchdogIntervalMillis(), options.getWatchdogIntervalMillis(), TimeUnit.MILLISECONDS);
        Closeable cancelWatchdog = () -> watchdog.cancel(false);
        repository.register(cancelWatchdog);
        LOG.info("Created repository on {} with {}", store, options);
        return repository;
    }
}
