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

import org.docsync.api.ContentException;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.PageVersion;
import org.docsync.plugins.tree.BlockTrees;
import org.docsync.plugins.tree.PageNames;
import org.docsync.spi.store.StoreSession;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Content changes of a page within a store session. A change always records
 * the previous content as a new version first, in the same session, so a
 * version without the matching content change (or the other way round) is
 * never committed.
 */
public final class VersionedContent {

    private VersionedContent() {
    }

    @NotNull
    public static PageContent read(@NotNull StoreSession session, @NotNull Page page) {
        return BlockTrees.toContent(page.getTitle(), session.getBlocks(page.getId()));
    }

    /**
     * Records the given content as the next version of the page.
     */
    @NotNull
    public static PageVersion snapshot(@NotNull StoreSession session, @NotNull Page page,
                                       @NotNull PageContent content, @Nullable String changeSummary,
                                       @NotNull String actorId, @Nullable String commitSha, long now)
            throws ContentException {
        PageVersion version = new PageVersion();
        version.setId(session.newId());
        version.setPageId(page.getId());
        version.setVersionNumber(session.getVersions(page.getId()).size() + 1);
        version.setContent(content);
        version.setAuthorId(actorId);
        version.setChangeSummary(changeSummary);
        version.setCommitSha(commitSha);
        version.setCreatedAt(now);
        session.addVersion(version);
        return version;
    }

    /**
     * Replaces the content of a page, recording the current content as a new
     * version first. The page is updated in the session.
     *
     * @return {@code false} if the content was already equal and nothing changed
     */
    public static boolean replace(@NotNull StoreSession session, @NotNull Page page, @NotNull PageContent content,
                                  @Nullable String changeSummary, @NotNull String actorId,
                                  @Nullable String commitSha, long now) throws ContentException {
        PageNames.checkTitle(content.getTitle());
        PageContent current = read(session, page);
        if (current.equals(content)) {
            return false;
        }
        snapshot(session, page, current, changeSummary, actorId, commitSha, now);
        session.setBlocks(page.getId(), BlockTrees.toBlocks(page.getId(), content.getBlocks(), session));
        page.setTitle(content.getTitle());
        page.setUpdatedAt(now);
        page.setUpdatedBy(actorId);
        session.putPage(page);
        return true;
    }
}
