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

package org.docsync.plugins.version;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.docsync.api.ContentException.NOT_FOUND;

import java.util.List;

import org.docsync.api.ContentException;
import org.docsync.api.VersionManager;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.PageVersion;
import org.docsync.plugins.tree.PageHierarchy;
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
 * {@link VersionManager} on top of a {@link ContentStore}.
 */
public class PageVersionManager implements VersionManager {

    private static final Logger LOG = LoggerFactory.getLogger(PageVersionManager.class);

    private final ContentStore store;

    private final Clock clock;

    private final AccessControl.Checker access;

    public PageVersionManager(@NotNull ContentStore store, @NotNull Clock clock, @NotNull AccessControl accessControl) {
        this.store = checkNotNull(store);
        this.clock = checkNotNull(clock);
        this.access = new AccessControl.Checker(checkNotNull(accessControl));
    }

    @NotNull
    @Override
    public PageVersion createVersion(@NotNull final String pageId, @Nullable final String changeSummary,
                                     @NotNull final String actorId) throws ContentException {
        return store.write((StoreSession session) -> {
            Page page = PageHierarchy.getLivePage(session, pageId);
            access.check(actorId, new PageResource(page.getSpaceId(), pageId), Permission.WRITE);
            PageVersion version = VersionedContent.snapshot(session, page, VersionedContent.read(session, page),
                    changeSummary, actorId, null, clock.getTimeMonotonic());
            LOG.debug("Created version {} of page {}", version.getVersionNumber(), page.getPath());
            return version;
        });
    }

    @NotNull
    @Override
    public List<PageVersion> listVersions(@NotNull final String pageId) throws ContentException {
        return store.read((StoreSession session) -> {
            PageHierarchy.getLivePage(session, pageId);
            return session.getVersions(pageId);
        });
    }

    @NotNull
    @Override
    public PageVersion getVersion(@NotNull final String pageId, final int versionNumber) throws ContentException {
        return store.read((StoreSession session) -> getVersion(session, pageId, versionNumber));
    }

    @NotNull
    @Override
    public Page restoreVersion(@NotNull final String pageId, final int versionNumber,
                               @NotNull final String actorId) throws ContentException {
        return store.write((StoreSession session) -> {
            Page page = PageHierarchy.getLivePage(session, pageId);
            access.check(actorId, new PageResource(page.getSpaceId(), pageId), Permission.WRITE);
            PageContent restored = getVersion(session, pageId, versionNumber).getContent();
            boolean changed = VersionedContent.replace(session, page, restored,
                    "Restored version " + versionNumber, actorId, null, clock.getTimeMonotonic());
            if (changed) {
                LOG.info("Restored page {} to version {}", page.getPath(), versionNumber);
            }
            return page;
        });
    }

    private static PageVersion getVersion(StoreSession session, String pageId, int versionNumber)
            throws ContentException {
        PageHierarchy.getLivePage(session, pageId);
        PageVersion version = session.getVersion(pageId, versionNumber);
        if (version == null) {
            throw new ContentException(NOT_FOUND, 20, "Version " + versionNumber + " of page "
                    + pageId + " not found");
        }
        return version;
    }
}
