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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.docsync.api.ContentException;
import org.docsync.api.content.Page;
import org.docsync.api.sync.CommitResult;
import org.docsync.api.sync.GitCommitRecord;
import org.docsync.api.sync.SyncDirection;
import org.docsync.plugins.git.MarkdownSerializer;
import org.docsync.plugins.version.VersionedContent;
import org.docsync.spi.git.CommitFile;
import org.docsync.spi.git.GitRepositoryException;
import org.docsync.spi.git.RemoteCommit;
import org.docsync.spi.store.ContentStore;
import org.docsync.spi.store.StoreSession;
import org.docsync.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the pages of a space that differ from the repository as a single
 * commit. Pages moved since the last sync get their old file deleted, deleted
 * pages lose their file. Pages with an unresolved conflict are left out.
 */
class PushSync {

    private static final Logger LOG = LoggerFactory.getLogger(PushSync.class);

    static final String SUMMARY = "{summary}";

    private final ContentStore store;

    private final Clock clock;

    private final Retries retries;

    private final SyncRun run;

    private final MarkdownSerializer serializer = new MarkdownSerializer();

    PushSync(ContentStore store, Clock clock, Retries retries, SyncRun run) {
        this.store = store;
        this.clock = clock;
        this.retries = retries;
        this.run = run;
    }

    void run() throws ContentException {
        final String branch = run.config.getDefaultBranch();
        final String since = run.config.getLastSyncCommit();
        List<RemoteCommit> unpulled = retries.call("fetch commits of " + branch, () -> {
            try {
                return run.repository.fetchCommits(branch, since);
            } catch (GitRepositoryException e) {
                if (since == null && e.getReason() == GitRepositoryException.Reason.NOT_FOUND) {
                    // a new branch
                    return newArrayList();
                }
                throw e;
            }
        });
        if (!unpulled.isEmpty()) {
            throw new ContentException(CONFLICT, 42, "Branch " + branch + " has " + unpulled.size()
                    + " commit(s) not pulled yet");
        }

        final Map<String, String> texts = new LinkedHashMap<String, String>();
        final Set<String> deletions = new LinkedHashSet<String>();
        final Set<String> deletedPages = new LinkedHashSet<String>();
        List<Page> pages = store.read((StoreSession session) -> {
            List<Page> result = newArrayList();
            for (Page page : session.getPages(run.getSpaceId())) {
                if (page.hasConflict()) {
                    run.conflicts.add(page.getPath());
                    continue;
                }
                String synced = page.getSyncedPath();
                if (page.isDeleted()) {
                    if (synced != null) {
                        deletions.add(synced);
                        deletedPages.add(synced);
                        run.syncedPaths.put(page.getId(), null);
                    }
                    continue;
                }
                String file = run.mapping.toFilePath(page.getPath());
                if (!run.mapping.isSynced(file)) {
                    continue;
                }
                if (synced != null && !synced.equals(file)) {
                    deletions.add(synced);
                }
                texts.put(file, serializer.serialize(VersionedContent.read(session, page)));
                run.syncedPaths.put(page.getId(), file);
                result.add(page);
            }
            return result;
        });
        deletions.removeAll(texts.keySet());
        deletedPages.retainAll(deletions);
        run.pagesDeleted = deletedPages.size();

        List<CommitFile> files = newArrayList();
        for (Map.Entry<String, String> e : texts.entrySet()) {
            final String file = e.getKey();
            String current = since == null ? null
                    : retries.call("read " + file, () -> run.repository.getFileContents(file, since));
            if (current == null) {
                files.add(CommitFile.write(file, e.getValue()));
                run.pagesCreated++;
            } else if (!current.equals(e.getValue())) {
                files.add(CommitFile.write(file, e.getValue()));
                run.pagesUpdated++;
            }
        }
        for (String file : deletions) {
            files.add(CommitFile.delete(file));
        }
        run.filesProcessed = files.size();
        if (files.isEmpty()) {
            LOG.debug("Nothing to push for {}", run);
            return;
        }

        final List<CommitFile> commitFiles = files;
        final String message = run.config.getCommitMessageTemplate()
                .replace(SUMMARY, summary(files.size(), pages.size()));
        String sha = retries.call("commit to " + branch,
                () -> run.repository.createCommit(branch, since, commitFiles, message, run.actorId));
        LOG.info("Pushed {} file(s) to {} as {}", files.size(), branch, sha);

        GitCommitRecord record = new GitCommitRecord();
        record.setConfigId(run.config.getId());
        record.setSha(sha);
        record.setMessage(message);
        record.setAuthorId(run.actorId);
        record.setCommittedAt(clock.getTime());
        record.setDirection(SyncDirection.PUSH);
        List<String> paths = newArrayList();
        for (CommitFile file : files) {
            paths.add(file.getPath());
        }
        record.setFilesChanged(paths);
        record.setResult(CommitResult.SUCCESS);
        record.setSyncHistoryId(run.historyId);
        run.commits.add(record);
        run.endCommit = sha;
    }

    private static String summary(int files, int pages) {
        return "update " + files + (files == 1 ? " file" : " files") + " of " + pages
                + (pages == 1 ? " page" : " pages");
    }
}
