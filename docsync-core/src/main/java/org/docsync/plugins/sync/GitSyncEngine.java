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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.Lists.newArrayList;
import static org.docsync.api.ContentException.CONFLICT;
import static org.docsync.api.ContentException.INTERNAL;
import static org.docsync.api.ContentException.NOT_FOUND;
import static org.docsync.api.ContentException.VALIDATION;

import java.security.SecureRandom;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.BaseEncoding;
import org.docsync.api.ContentException;
import org.docsync.api.SyncManager;
import org.docsync.api.content.Page;
import org.docsync.api.sync.CommitResult;
import org.docsync.api.sync.GitBranch;
import org.docsync.api.sync.GitCommitRecord;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.api.sync.SyncDirection;
import org.docsync.api.sync.SyncHistory;
import org.docsync.api.sync.SyncOperation;
import org.docsync.api.sync.SyncStatus;
import org.docsync.api.sync.WebhookEvent;
import org.docsync.plugins.commit.PageConflictManager;
import org.docsync.spi.git.GitRepository;
import org.docsync.spi.git.GitRepositoryProvider;
import org.docsync.spi.security.AccessControl;
import org.docsync.spi.security.Permission;
import org.docsync.spi.security.SpaceResource;
import org.docsync.spi.store.ContentStore;
import org.docsync.spi.store.StoreSession;
import org.docsync.stats.Clock;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SyncManager} running pulls and pushes in the background.
 * <p>
 * The sync status of a binding is its mutex: a run starts with a single store
 * write that moves the status to {@link SyncStatus#SYNCING}, records the run
 * as the active sync of the binding and appends its history record. A second
 * trigger during that time fails. The run ends with a single store write that
 * completes the history record and releases the binding, unless the run was
 * superseded in the meantime (see {@link #expireSyncs(long)}).
 */
public class GitSyncEngine implements SyncManager {

    private static final Logger LOG = LoggerFactory.getLogger(GitSyncEngine.class);

    private static final SecureRandom SECRETS = new SecureRandom();

    private final ContentStore store;

    private final GitRepositoryProvider repositories;

    private final Clock clock;

    private final AccessControl.Checker access;

    private final ExecutorService executor;

    private final Retries retries;

    private final Map<String, Future<?>> running = new ConcurrentHashMap<String, Future<?>>();

    public GitSyncEngine(@NotNull ContentStore store, @NotNull GitRepositoryProvider repositories,
                         @NotNull Clock clock, @NotNull AccessControl accessControl,
                         @NotNull ExecutorService executor, @NotNull Retries retries) {
        this.store = checkNotNull(store);
        this.repositories = checkNotNull(repositories);
        this.clock = checkNotNull(clock);
        this.access = new AccessControl.Checker(checkNotNull(accessControl));
        this.executor = checkNotNull(executor);
        this.retries = checkNotNull(retries);
    }

    //------------------------------------------------------< configuration >---

    @NotNull
    @Override
    public GitSyncConfig createSyncConfig(@NotNull final String spaceId, @NotNull final String repositoryUrl,
                                          @NotNull final String actorId) throws ContentException {
        access.check(actorId, new SpaceResource(spaceId), Permission.ADMINISTER);
        if (repositoryUrl.trim().isEmpty()) {
            throw new ContentException(VALIDATION, 40, "Repository url must not be empty");
        }
        GitSyncConfig created = store.write((StoreSession session) -> {
            GitSyncConfig config = new GitSyncConfig();
            config.setId(session.newId());
            config.setSpaceId(spaceId);
            config.setRepositoryUrl(repositoryUrl);
            config.setCreatedAt(clock.getTime());
            config.setCreatedBy(actorId);
            session.putSyncConfig(config);
            GitBranch branch = newBranch(session, config.getId(), config.getDefaultBranch());
            branch.setDefaultBranch(true);
            session.putBranch(branch);
            return config;
        });
        LOG.info("Bound space {} to {}", spaceId, repositoryUrl);
        return created;
    }

    @NotNull
    @Override
    public GitSyncConfig updateSyncConfig(@NotNull final GitSyncConfig update, @NotNull final String actorId)
            throws ContentException {
        checkNotNull(update.getId());
        return store.write((StoreSession session) -> {
            GitSyncConfig config = getConfig(session, update.getId());
            access.check(actorId, new SpaceResource(config.getSpaceId()), Permission.ADMINISTER);
            if (isBlank(update.getDefaultBranch()) || isBlank(update.getCommitMessageTemplate())) {
                throw new ContentException(VALIDATION, 41, "Branch and commit message template must not be empty");
            }
            config.setRepositoryUrl(isBlank(update.getRepositoryUrl())
                    ? config.getRepositoryUrl() : update.getRepositoryUrl());
            config.setRootPath(update.getRootPath());
            config.setIncludePatterns(update.getIncludePatterns());
            config.setExcludePatterns(update.getExcludePatterns());
            config.setCommitMessageTemplate(update.getCommitMessageTemplate());
            config.setAutoSync(update.isAutoSync());
            if (!config.getDefaultBranch().equals(update.getDefaultBranch())) {
                config.setDefaultBranch(update.getDefaultBranch());
                GitBranch branch = session.getBranch(config.getId(), update.getDefaultBranch());
                if (branch == null) {
                    branch = newBranch(session, config.getId(), update.getDefaultBranch());
                }
                branch.setDefaultBranch(true);
                session.putBranch(branch);
            }
            session.putSyncConfig(config);
            return config;
        });
    }

    @NotNull
    @Override
    public GitSyncConfig getSyncConfig(@NotNull final String configId) throws ContentException {
        return store.read((StoreSession session) -> getConfig(session, configId));
    }

    @NotNull
    @Override
    public GitSyncConfig getSyncConfigForSpace(@NotNull final String spaceId) throws ContentException {
        return store.read((StoreSession session) -> {
            GitSyncConfig config = session.getSyncConfigForSpace(spaceId);
            if (config == null) {
                throw new ContentException(NOT_FOUND, 41, "Space " + spaceId + " is not bound to a repository");
            }
            return config;
        });
    }

    @NotNull
    @Override
    public GitSyncConfig registerWebhook(@NotNull final String configId, @NotNull final String callbackUrl,
                                         @NotNull final String actorId) throws ContentException {
        final GitSyncConfig config = getSyncConfig(configId);
        access.check(actorId, new SpaceResource(config.getSpaceId()), Permission.ADMINISTER);
        byte[] bytes = new byte[20];
        SECRETS.nextBytes(bytes);
        final String secret = BaseEncoding.base16().lowerCase().encode(bytes);
        final GitRepository repository = retries.call("resolve repository " + config.getRepositoryUrl(),
                () -> repositories.getRepository(config));
        final String hookId = retries.call("register webhook", () -> repository.registerWebhook(callbackUrl, secret));
        GitSyncConfig updated = store.write((StoreSession session) -> {
            GitSyncConfig current = getConfig(session, configId);
            current.setWebhookId(hookId);
            current.setWebhookSecret(secret);
            current.setWebhookActive(true);
            session.putSyncConfig(current);
            return current;
        });
        LOG.info("Registered webhook {} for {}", hookId, config.getRepositoryUrl());
        return updated;
    }

    @NotNull
    @Override
    public GitBranch addBranch(@NotNull final String configId, @NotNull final String name) throws ContentException {
        if (isBlank(name)) {
            throw new ContentException(VALIDATION, 42, "Branch name must not be empty");
        }
        return store.write((StoreSession session) -> {
            getConfig(session, configId);
            GitBranch branch = newBranch(session, configId, name);
            session.putBranch(branch);
            return session.getBranch(configId, name);
        });
    }

    @NotNull
    @Override
    public List<GitBranch> getBranches(@NotNull final String configId) throws ContentException {
        return store.read((StoreSession session) -> {
            getConfig(session, configId);
            return session.getBranches(configId);
        });
    }

    //--------------------------------------------------------------< runs >---

    @NotNull
    @Override
    public String triggerSync(@NotNull final String configId, @NotNull final SyncDirection direction,
                              @NotNull final String actorId) throws ContentException {
        checkNotNull(direction);
        GitSyncConfig config = getSyncConfig(configId);
        access.check(actorId, new SpaceResource(config.getSpaceId()), Permission.WRITE);
        SyncRun run = store.write((StoreSession session) -> {
            GitSyncConfig current = getConfig(session, configId);
            SyncOperation operation = current.getLastSyncCommit() == null
                    ? SyncOperation.FULL_SYNC : SyncOperation.INCREMENTAL;
            SyncHistory history = begin(session, current, operation, direction, actorId);
            return new SyncRun(history, current, actorId, ImmutableSet.<String>of());
        });
        submit(run);
        return run.historyId;
    }

    @NotNull
    @Override
    public String handleWebhook(@NotNull final String configId, @NotNull final WebhookEvent event)
            throws ContentException {
        final String actorId = event.getDeliveryId() == null ? "webhook" : "webhook:" + event.getDeliveryId();
        Object result = store.write((StoreSession session) -> {
            GitSyncConfig config = getConfig(session, configId);
            if (!config.getDefaultBranch().equals(event.getBranch())) {
                throw new ContentException(VALIDATION, 43, "Event for branch " + event.getBranch()
                        + " ignored, binding follows " + config.getDefaultBranch());
            }
            if (event.getCommitShas().isEmpty()) {
                throw new ContentException(VALIDATION, 44, "Event references no commits");
            }
            List<String> unknown = newArrayList();
            String recordedBy = null;
            for (String sha : event.getCommitShas()) {
                GitCommitRecord record = session.getCommit(configId, sha);
                if (record == null) {
                    unknown.add(sha);
                } else if (record.getSyncHistoryId() != null) {
                    recordedBy = record.getSyncHistoryId();
                }
            }
            if (unknown.isEmpty() && recordedBy != null) {
                return recordedBy;
            }
            SyncHistory history = begin(session, config, SyncOperation.WEBHOOK, SyncDirection.PULL, actorId);
            for (String sha : unknown) {
                GitCommitRecord record = new GitCommitRecord();
                record.setId(session.newId());
                record.setConfigId(configId);
                record.setSha(sha);
                record.setMessage("");
                record.setAuthorId(actorId);
                record.setCommittedAt(clock.getTime());
                record.setDirection(SyncDirection.PULL);
                record.setResult(CommitResult.PENDING);
                record.setSyncHistoryId(history.getId());
                session.putCommit(record);
            }
            return new SyncRun(history, config, actorId, event.getCommitShas());
        });
        if (result instanceof String) {
            LOG.debug("Webhook delivery {} already handled by sync {}", event.getDeliveryId(), result);
            return (String) result;
        }
        SyncRun run = (SyncRun) result;
        submit(run);
        return run.historyId;
    }

    /**
     * Acquires the binding for a new run and appends its history record.
     */
    private SyncHistory begin(StoreSession session, GitSyncConfig config, SyncOperation operation,
                              SyncDirection direction, String actorId) throws ContentException {
        if (config.getSyncStatus().isRunning()) {
            throw new ContentException(CONFLICT, 40, "Sync " + config.getActiveSyncId()
                    + " of " + config.getRepositoryUrl() + " is still running");
        }
        long now = clock.getTime();
        SyncHistory history = new SyncHistory();
        history.setId(session.newId());
        history.setConfigId(config.getId());
        history.setOperation(operation);
        history.setDirection(direction);
        history.setStartCommit(config.getLastSyncCommit());
        history.setStatus(SyncStatus.SYNCING);
        history.setStartedAt(now);
        history.setTriggeredBy(actorId);
        session.putSyncHistory(history);

        config.setSyncStatus(SyncStatus.SYNCING);
        config.setActiveSyncId(history.getId());
        config.setSyncStartedAt(now);
        session.putSyncConfig(config);
        LOG.info("Starting {} {} of {}", operation, direction, config.getRepositoryUrl());
        return history;
    }

    private void submit(final SyncRun run) throws ContentException {
        Future<?> future;
        try {
            future = executor.submit(() -> execute(run));
        } catch (RejectedExecutionException e) {
            ContentException failure = new ContentException(INTERNAL, 40, "Sync engine is shut down", e);
            completeQuietly(run, failure.getMessage());
            throw failure;
        }
        running.put(run.historyId, future);
        if (future.isDone()) {
            running.remove(run.historyId, future);
        }
    }

    private void execute(SyncRun run) {
        try {
            run.repository = retries.call("resolve repository " + run.config.getRepositoryUrl(),
                    () -> repositories.getRepository(run.config));
            if (run.direction == SyncDirection.PUSH) {
                new PushSync(store, clock, retries, run).run();
            } else {
                new PullSync(store, clock, retries, run).run();
            }
            complete(run, null);
        } catch (ContentException e) {
            if (e.isConflict() && e.getCode() == 41) {
                LOG.warn("Sync {} was superseded, dropping its results", run.historyId);
            } else {
                LOG.error("Sync {} failed", run, e);
                completeQuietly(run, e.getMessage());
            }
        } catch (RuntimeException e) {
            LOG.error("Sync {} failed unexpectedly", run, e);
            completeQuietly(run, new ContentException(INTERNAL, 41, String.valueOf(e), e).getMessage());
        } finally {
            running.remove(run.historyId);
        }
    }

    private void completeQuietly(SyncRun run, String error) {
        try {
            complete(run, error);
        } catch (ContentException e) {
            LOG.error("Could not record the end of sync {}", run.historyId, e);
        }
    }

    /**
     * Completes the history record of a run and releases its binding.
     *
     * @param error the failure of the run, {@code null} if it succeeded
     */
    private void complete(final SyncRun run, @Nullable final String error) throws ContentException {
        SyncHistory history = store.write((StoreSession session) -> {
            SyncHistory h = session.getSyncHistory(run.historyId);
            GitSyncConfig config = session.getSyncConfig(run.config.getId());
            if (h == null || h.isCompleted() || config == null
                    || !run.historyId.equals(config.getActiveSyncId())) {
                return null;
            }
            long now = clock.getTime();
            List<String> errors = newArrayList(run.errors);
            SyncStatus status;
            if (error == null) {
                for (GitCommitRecord record : run.commits) {
                    GitCommitRecord existing = session.getCommit(config.getId(), record.getSha());
                    if (existing == null) {
                        record.setId(session.newId());
                        session.putCommit(record);
                    } else if (existing.getResult() != CommitResult.SUCCESS) {
                        existing.setResult(CommitResult.SUCCESS);
                        existing.setMessage(record.getMessage());
                        existing.setAuthorId(record.getAuthorId());
                        existing.setCommittedAt(record.getCommittedAt());
                        existing.setFilesChanged(record.getFilesChanged());
                        existing.setErrorMessage(null);
                        session.putCommit(existing);
                    }
                }
                for (GitCommitRecord record : session.getCommits(config.getId())) {
                    // announced commits at or behind the last synced commit, or not on the branch
                    if (run.historyId.equals(record.getSyncHistoryId())
                            && record.getResult() == CommitResult.PENDING) {
                        if (run.missingShas.contains(record.getSha())) {
                            record.setResult(CommitResult.FAILED);
                            record.setErrorMessage("Commit " + record.getSha() + " not found on "
                                    + config.getDefaultBranch());
                            errors.add(record.getErrorMessage());
                        } else {
                            record.setResult(CommitResult.SUCCESS);
                        }
                        session.putCommit(record);
                    }
                }
                for (Map.Entry<String, String> e : run.syncedPaths.entrySet()) {
                    Page page = session.getPage(e.getKey());
                    if (page != null) {
                        page.setSyncedPath(e.getValue());
                        session.putPage(page);
                    }
                }
                if (run.endCommit != null) {
                    config.setLastSyncCommit(run.endCommit);
                    GitBranch branch = session.getBranch(config.getId(), config.getDefaultBranch());
                    if (branch != null) {
                        branch.setHeadCommit(run.endCommit);
                        session.putBranch(branch);
                    }
                }
                status = PageConflictManager.getConflicts(session, config.getSpaceId()).isEmpty()
                        ? SyncStatus.SUCCESS : SyncStatus.CONFLICT;
                config.setLastError(null);
            } else {
                for (GitCommitRecord record : session.getCommits(config.getId())) {
                    if (run.historyId.equals(record.getSyncHistoryId())
                            && record.getResult() == CommitResult.PENDING) {
                        record.setResult(CommitResult.FAILED);
                        record.setErrorMessage(error);
                        session.putCommit(record);
                    }
                }
                errors.add(error);
                status = SyncStatus.ERROR;
                config.setLastError(error);
            }
            h.setStatus(status);
            h.setEndCommit(error == null && run.endCommit != null ? run.endCommit : config.getLastSyncCommit());
            h.setFilesProcessed(run.filesProcessed);
            h.setPagesCreated(run.pagesCreated);
            h.setPagesUpdated(run.pagesUpdated);
            h.setPagesDeleted(run.pagesDeleted);
            h.setErrors(errors);
            h.setConflicts(run.conflicts);
            h.setMetadata(run.metadata);
            h.setCompletedAt(now);
            h.setDurationMs(now - h.getStartedAt());
            session.putSyncHistory(h);

            config.setSyncStatus(status);
            config.setActiveSyncId(null);
            config.setSyncStartedAt(null);
            config.setLastSyncAt(now);
            session.putSyncConfig(config);
            return h;
        });
        if (history == null) {
            LOG.warn("Sync {} was superseded, dropping its results", run.historyId);
        } else {
            LOG.info("Sync {} ended with {}: {} file(s), {} created, {} updated, {} deleted, {} conflict(s)",
                    history.getId(), history.getStatus(), history.getFilesProcessed(), history.getPagesCreated(),
                    history.getPagesUpdated(), history.getPagesDeleted(), history.getConflicts().size());
        }
    }

    /**
     * Expires runs that have been syncing for longer than the timeout: their
     * history record is completed with an error, their binding released and
     * their background task cancelled. Results of an expired run are dropped
     * when it finishes later.
     *
     * @return the ids of the expired runs
     */
    @NotNull
    public List<String> expireSyncs(final long timeoutMillis) throws ContentException {
        List<String> expired = store.write((StoreSession session) -> {
            List<String> ids = newArrayList();
            long now = clock.getTime();
            for (GitSyncConfig config : session.getSyncConfigs()) {
                Long started = config.getSyncStartedAt();
                if (!config.getSyncStatus().isRunning() || started == null || now - started <= timeoutMillis) {
                    continue;
                }
                String error = "Sync timed out after " + (now - started) + " ms";
                String historyId = config.getActiveSyncId();
                SyncHistory history = historyId == null ? null : session.getSyncHistory(historyId);
                if (history != null && !history.isCompleted()) {
                    List<String> errors = newArrayList(history.getErrors());
                    errors.add(error);
                    history.setErrors(errors);
                    history.setStatus(SyncStatus.ERROR);
                    history.setCompletedAt(now);
                    history.setDurationMs(now - history.getStartedAt());
                    session.putSyncHistory(history);
                }
                for (GitCommitRecord record : session.getCommits(config.getId())) {
                    if (historyId != null && historyId.equals(record.getSyncHistoryId())
                            && record.getResult() == CommitResult.PENDING) {
                        record.setResult(CommitResult.FAILED);
                        record.setErrorMessage(error);
                        session.putCommit(record);
                    }
                }
                config.setSyncStatus(SyncStatus.ERROR);
                config.setLastError(error);
                config.setActiveSyncId(null);
                config.setSyncStartedAt(null);
                session.putSyncConfig(config);
                if (historyId != null) {
                    ids.add(historyId);
                }
            }
            return ids;
        });
        for (String id : expired) {
            LOG.warn("Sync {} timed out after {} ms, cancelling it", id, timeoutMillis);
            Future<?> future = running.remove(id);
            if (future != null) {
                future.cancel(true);
            }
        }
        return expired;
    }

    //-----------------------------------------------------------< history >---

    @NotNull
    @Override
    public SyncHistory getSyncHistory(@NotNull final String syncHistoryId) throws ContentException {
        return store.read((StoreSession session) -> {
            SyncHistory history = session.getSyncHistory(syncHistoryId);
            if (history == null) {
                throw new ContentException(NOT_FOUND, 42, "Sync history " + syncHistoryId + " not found");
            }
            return history;
        });
    }

    @NotNull
    @Override
    public List<SyncHistory> getSyncHistories(@NotNull final String configId) throws ContentException {
        return store.read((StoreSession session) -> {
            getConfig(session, configId);
            return session.getSyncHistories(configId);
        });
    }

    @NotNull
    @Override
    public List<GitCommitRecord> getCommits(@NotNull final String configId) throws ContentException {
        return store.read((StoreSession session) -> {
            getConfig(session, configId);
            return session.getCommits(configId);
        });
    }

    //-----------------------------------------------------------< internal >---

    private static GitSyncConfig getConfig(StoreSession session, String configId) throws ContentException {
        GitSyncConfig config = session.getSyncConfig(configId);
        if (config == null) {
            throw new ContentException(NOT_FOUND, 40, "Sync config " + configId + " not found");
        }
        return config;
    }

    private static GitBranch newBranch(StoreSession session, String configId, String name) {
        GitBranch branch = new GitBranch();
        branch.setId(session.newId());
        branch.setConfigId(configId);
        branch.setName(name);
        branch.setActive(true);
        return branch;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    @Override
    public String toString() {
        return "GitSyncEngine[" + retries + "]";
    }
}
