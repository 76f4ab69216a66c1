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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.docsync.api.ContentException;
import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageConflict;
import org.docsync.api.content.PageContent;
import org.docsync.api.sync.CommitResult;
import org.docsync.api.sync.GitCommitRecord;
import org.docsync.api.sync.SyncDirection;
import org.docsync.commons.PathUtils;
import org.docsync.plugins.commit.ThreeWayMerge;
import org.docsync.plugins.git.MarkdownParser;
import org.docsync.plugins.tree.PageHierarchy;
import org.docsync.plugins.tree.PageNames;
import org.docsync.plugins.version.VersionedContent;
import org.docsync.spi.git.FileChange;
import org.docsync.spi.git.RemoteCommit;
import org.docsync.spi.store.ContentStore;
import org.docsync.spi.store.StoreSession;
import org.docsync.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the commits of the repository made since the last sync to the
 * pages of the space. Every changed file is merged three-way: the file at the
 * last synced commit is the base, the page is the local side and the file at
 * the new head is the remote side. Each file is applied in its own store
 * write.
 */
class PullSync {

    private static final Logger LOG = LoggerFactory.getLogger(PullSync.class);

    static final String CREATED_FOLDERS = "createdFolders";

    private final ContentStore store;

    private final Clock clock;

    private final Retries retries;

    private final SyncRun run;

    private final List<String> createdFolders = newArrayList();

    PullSync(ContentStore store, Clock clock, Retries retries, SyncRun run) {
        this.store = store;
        this.clock = clock;
        this.retries = retries;
        this.run = run;
    }

    void run() throws ContentException {
        final String branch = run.config.getDefaultBranch();
        final String since = run.config.getLastSyncCommit();
        List<RemoteCommit> commits = retries.call("fetch commits of " + branch,
                () -> run.repository.fetchCommits(branch, since));
        commits = upToTarget(branch, commits);
        if (commits.isEmpty()) {
            LOG.debug("Nothing to pull for {}", run);
            return;
        }
        final String head = commits.get(commits.size() - 1).getSha();

        // last change of a path wins; parents sort before their children
        Map<String, FileChange.Kind> changed = new TreeMap<String, FileChange.Kind>();
        for (RemoteCommit commit : commits) {
            for (FileChange change : commit.getChanges()) {
                changed.put(change.getPath(), change.getKind());
            }
        }
        for (Map.Entry<String, FileChange.Kind> e : changed.entrySet()) {
            String file = e.getKey();
            if (!run.mapping.isSynced(file)) {
                LOG.debug("Skipping {}", file);
                continue;
            }
            run.filesProcessed++;
            try {
                pullFile(file, since, head);
            } catch (ContentException ex) {
                if (!ex.isValidation()) {
                    throw ex;
                }
                LOG.warn("Skipping {}: {}", file, ex.getMessage());
                run.errors.add(file + ": " + ex.getMessage());
            }
        }
        for (RemoteCommit commit : commits) {
            run.commits.add(record(commit));
        }
        if (!createdFolders.isEmpty()) {
            run.metadata.put(CREATED_FOLDERS, Joiner.on(',').join(createdFolders));
        }
        run.endCommit = head;
    }

    /**
     * Cuts the fetched commits after the newest announced one. Announced
     * commits that are neither fetched nor in the history of the branch are
     * collected as missing.
     */
    private List<RemoteCommit> upToTarget(final String branch, List<RemoteCommit> commits)
            throws ContentException {
        if (run.targetShas.isEmpty()) {
            return commits;
        }
        int last = -1;
        Set<String> unseen = new LinkedHashSet<String>(run.targetShas);
        for (int i = 0; i < commits.size(); i++) {
            if (unseen.remove(commits.get(i).getSha())) {
                last = i;
            }
        }
        if (!unseen.isEmpty()) {
            for (RemoteCommit commit : retries.call("fetch history of " + branch,
                    () -> run.repository.fetchCommits(branch, null))) {
                unseen.remove(commit.getSha());
            }
            run.missingShas.addAll(unseen);
        }
        if (last < 0) {
            // nothing announced beyond the last synced commit
            return newArrayList();
        }
        return commits.subList(0, last + 1);
    }

    private void pullFile(final String file, final String since, final String head) throws ContentException {
        final String pagePath = run.mapping.toPagePath(file);
        final String slug = PathUtils.getName(pagePath);
        String baseText = since == null ? null
                : retries.call("read " + file, () -> run.repository.getFileContents(file, since));
        String remoteText = retries.call("read " + file, () -> run.repository.getFileContents(file, head));
        final PageContent base = baseText == null ? null : MarkdownParser.parse(baseText, PageNames.titleOf(slug));
        final PageContent remote = remoteText == null ? null
                : MarkdownParser.parse(remoteText, PageNames.titleOf(slug));

        FileResult result = store.write((StoreSession session) -> {
            run.checkActive(session);
            FileResult r = new FileResult();
            long now = clock.getTimeMonotonic();
            Page page = findPage(session, pagePath, file);
            PageContent local = page == null || page.isDeleted() || isPlaceholder(session, page)
                    ? null : VersionedContent.read(session, page);

            if (page != null && page.hasConflict()) {
                // still unresolved, refresh the remote side
                PageConflict previous = page.getConflict();
                page.setConflict(new PageConflict(previous.getBase(), local, remote, head, now));
                session.putPage(page);
                r.conflict = pagePath;
                return r;
            }

            ThreeWayMerge merge = ThreeWayMerge.merge(base, local, remote);
            switch (merge.getOutcome()) {
                case UNCHANGED:
                    if (page != null && !page.isDeleted()) {
                        r.syncedPaths.put(page.getId(), file);
                    }
                    break;
                case KEEP_LOCAL:
                    LOG.debug("Keeping local changes of {}", pagePath);
                    break;
                case CONFLICT:
                    if (page != null) {
                        LOG.info("Conflict on {} at {}", pagePath, head);
                        page.setConflict(new PageConflict(base, local, remote, head, now));
                        session.putPage(page);
                        r.conflict = pagePath;
                        break;
                    }
                    // no page left to hold the conflict, take the remote side
                    fastForward(session, null, pagePath, slug, file, remote, head, now, r);
                    break;
                case FAST_FORWARD:
                    fastForward(session, page, pagePath, slug, file, merge.getResult(), head, now, r);
                    break;
                default:
                    throw new IllegalStateException("Unknown outcome " + merge.getOutcome());
            }
            return r;
        });
        result.applyTo(run, createdFolders);
    }

    private void fastForward(StoreSession session, Page page, String pagePath, String slug, String file,
                             PageContent remote, String head, long now, FileResult r) throws ContentException {
        String summary = "Pulled " + shortSha(head);
        if (remote == null) {
            if (page == null || page.isDeleted()) {
                return;
            }
            if (session.getChildren(page.getSpaceId(), page.getId()).isEmpty()) {
                PageHierarchy.softDelete(session, page, run.actorId, now);
                r.deleted++;
            } else {
                // the pages below stay, only the content of the page is gone
                VersionedContent.replace(session, page, new PageContent(page.getTitle(),
                        ImmutableList.<ContentBlock>of()), summary, run.actorId, head, now);
                r.updated++;
            }
            r.syncedPaths.put(page.getId(), null);
            return;
        }
        if (page == null || page.isDeleted()) {
            Page parent = PageHierarchy.ensureParent(session, run.getSpaceId(), pagePath, run.actorId, now,
                    r.folders);
            page = PageHierarchy.create(session, run.getSpaceId(), parent == null ? null : parent.getId(),
                    slug, remote.getTitle(), run.actorId, now);
            r.created++;
        } else {
            r.updated++;
        }
        VersionedContent.replace(session, page, remote, summary, run.actorId, head, now);
        r.syncedPaths.put(page.getId(), file);
    }

    /**
     * What applying a single file did. Added to the run once the store write
     * of the file succeeded.
     */
    private static final class FileResult {

        int created;

        int updated;

        int deleted;

        String conflict;

        final List<Page> folders = newArrayList();

        final Map<String, String> syncedPaths = new LinkedHashMap<String, String>();

        void applyTo(SyncRun run, List<String> createdFolders) {
            run.pagesCreated += created;
            run.pagesUpdated += updated;
            run.pagesDeleted += deleted;
            if (conflict != null) {
                run.conflicts.add(conflict);
            }
            for (Page folder : folders) {
                createdFolders.add(folder.getPath());
            }
            run.syncedPaths.putAll(syncedPaths);
        }
    }

    /**
     * The live page at the path, or else the deleted page last synced with
     * the file.
     */
    private Page findPage(StoreSession session, String pagePath, String file) {
        Page page = session.getPageByPath(run.getSpaceId(), pagePath);
        if (page != null) {
            return page;
        }
        Page deleted = null;
        for (Page p : session.getPages(run.getSpaceId())) {
            if (p.isDeleted() && file.equals(p.getSyncedPath())) {
                deleted = p;
            }
        }
        return deleted;
    }

    /**
     * Pages never synced nor edited, like the folder pages created for the
     * parents of pulled files, count as absent.
     */
    private static boolean isPlaceholder(StoreSession session, Page page) {
        return page.getSyncedPath() == null
                && session.getVersions(page.getId()).isEmpty()
                && session.getBlocks(page.getId()).isEmpty();
    }

    private GitCommitRecord record(RemoteCommit commit) {
        GitCommitRecord record = new GitCommitRecord();
        record.setConfigId(run.config.getId());
        record.setSha(commit.getSha());
        record.setMessage(commit.getMessage());
        record.setAuthorId(commit.getAuthor());
        record.setCommittedAt(commit.getTimestamp());
        record.setDirection(SyncDirection.PULL);
        List<String> files = newArrayList();
        for (FileChange change : commit.getChanges()) {
            files.add(change.getPath());
        }
        record.setFilesChanged(files);
        record.setResult(CommitResult.SUCCESS);
        record.setSyncHistoryId(run.historyId);
        return record;
    }

    static String shortSha(String sha) {
        return sha.length() > 7 ? sha.substring(0, 7) : sha;
    }
}
