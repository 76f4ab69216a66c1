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

package org.docsync.plugins.commit;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.Lists.newArrayList;
import static org.docsync.api.ContentException.NOT_FOUND;
import static org.docsync.api.ContentException.VALIDATION;

import java.util.List;

import org.docsync.api.ConflictManager;
import org.docsync.api.ContentException;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageConflict;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.ResolutionChoice;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.api.sync.SyncStatus;
import org.docsync.plugins.tree.PageHierarchy;
import org.docsync.plugins.version.VersionedContent;
import org.docsync.spi.security.AccessControl;
import org.docsync.spi.security.PageResource;
import org.docsync.spi.security.Permission;
import org.docsync.spi.store.ContentStore;
import org.docsync.spi.store.StoreSession;
import org.docsync.stats.Clock;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the conflicts the sync engine stores on pages. Resolving a page
 * is a single store write: the content change with its version, the cleared
 * conflict marker and, for the last conflict of a space, the status of the
 * space's sync config.
 */
public class PageConflictManager implements ConflictManager {

    private static final Logger LOG = LoggerFactory.getLogger(PageConflictManager.class);

    private final ContentStore store;

    private final Clock clock;

    private final AccessControl.Checker access;

    public PageConflictManager(@NotNull ContentStore store, @NotNull Clock clock,
                               @NotNull AccessControl accessControl) {
        this.store = checkNotNull(store);
        this.clock = checkNotNull(clock);
        this.access = new AccessControl.Checker(checkNotNull(accessControl));
    }

    @NotNull
    @Override
    public Page resolveConflict(@NotNull final String pageId, @NotNull final ResolutionChoice choice,
                                @Nullable final PageContent content, @NotNull final String actorId)
            throws ContentException {
        checkNotNull(choice);
        Page resolved = store.write((StoreSession session) -> {
            Page page = session.getPage(pageId);
            if (page == null) {
                throw new ContentException(NOT_FOUND, 30, "Page " + pageId + " not found");
            }
            access.check(actorId, new PageResource(page.getSpaceId(), pageId), Permission.WRITE);
            PageConflict conflict = page.getConflict();
            if (conflict == null) {
                throw new ContentException(VALIDATION, 40, "Page " + page.getPath() + " has no conflict");
            }
            long now = clock.getTimeMonotonic();
            page.setConflict(null);
            switch (choice) {
                case KEEP_LOCAL:
                    page.setUpdatedAt(now);
                    page.setUpdatedBy(actorId);
                    session.putPage(page);
                    break;
                case TAKE_REMOTE:
                    apply(session, page, conflict.getRemote(), "Resolved conflict with remote content",
                            actorId, conflict.getRemoteCommitSha(), now);
                    break;
                case MERGED:
                    if (content == null) {
                        throw new ContentException(VALIDATION, 41, "Merged content is required");
                    }
                    apply(session, page, content, "Resolved conflict with merged content", actorId, null, now);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown choice " + choice);
            }
            clearSpaceConflict(session, page.getSpaceId());
            return page;
        });
        LOG.info("Resolved conflict on page {} ({})", resolved.getPath(), choice);
        return resolved;
    }

    @NotNull
    @Override
    public List<Page> getConflicts(@NotNull final String spaceId) throws ContentException {
        return store.read((StoreSession session) -> getConflicts(session, spaceId));
    }

    /**
     * Pages of a space with a conflict, deleted pages included.
     */
    @NotNull
    public static List<Page> getConflicts(@NotNull StoreSession session, @NotNull String spaceId) {
        List<Page> conflicts = newArrayList();
        for (Page page : session.getPages(spaceId)) {
            if (page.hasConflict()) {
                conflicts.add(page);
            }
        }
        return conflicts;
    }

    private static void apply(StoreSession session, Page page, PageContent target, String summary,
                              String actorId, String commitSha, long now) throws ContentException {
        if (target == null) {
            if (page.isDeleted()) {
                session.putPage(page);
            } else {
                PageHierarchy.softDelete(session, page, actorId, now);
            }
            return;
        }
        if (page.isDeleted()) {
            PageHierarchy.undelete(session, page, actorId, now);
        }
        if (!VersionedContent.replace(session, page, target, summary, actorId, commitSha, now)) {
            page.setUpdatedAt(now);
            page.setUpdatedBy(actorId);
            session.putPage(page);
        }
    }

    private static void clearSpaceConflict(StoreSession session, String spaceId) throws ContentException {
        GitSyncConfig config = session.getSyncConfigForSpace(spaceId);
        if (config != null && config.getSyncStatus() == SyncStatus.CONFLICT
                && getConflicts(session, spaceId).isEmpty()) {
            config.setSyncStatus(SyncStatus.SUCCESS);
            session.putSyncConfig(config);
            LOG.info("All conflicts of space {} resolved", spaceId);
        }
    }
}
