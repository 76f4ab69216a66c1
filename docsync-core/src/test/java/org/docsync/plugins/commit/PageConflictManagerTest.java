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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.docsync.api.ContentException;
import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageConflict;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.PageVersion;
import org.docsync.api.content.ResolutionChoice;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.api.sync.SyncStatus;
import org.docsync.plugins.memory.MemoryContentStore;
import org.docsync.plugins.tree.PageTreeManager;
import org.docsync.plugins.version.PageVersionManager;
import org.docsync.spi.security.AccessControl;
import org.docsync.spi.store.StoreSession;
import org.docsync.stats.Clock;
import org.junit.Before;
import org.junit.Test;

public class PageConflictManagerTest {

    private static final String SPACE = "space";

    private static final String USER = "carol";

    private static final PageContent LOCAL = PageContent.of("Page", ContentBlock.paragraph("local"));

    private static final PageContent REMOTE = PageContent.of("Page", ContentBlock.paragraph("remote"));

    private MemoryContentStore store;

    private PageTreeManager pages;

    private PageConflictManager conflicts;

    private Page page;

    @Before
    public void setUp() throws ContentException {
        store = new MemoryContentStore();
        Clock clock = new Clock.Virtual();
        pages = new PageTreeManager(store, clock, AccessControl.OPEN);
        conflicts = new PageConflictManager(store, clock, AccessControl.OPEN);
        page = pages.createPage(SPACE, null, "page", "Page", USER);
        pages.updateContent(page.getId(), LOCAL, null, USER);
        store.write((StoreSession session) -> {
            GitSyncConfig config = new GitSyncConfig();
            config.setId(session.newId());
            config.setSpaceId(SPACE);
            config.setRepositoryUrl("memory:docs");
            config.setSyncStatus(SyncStatus.CONFLICT);
            session.putSyncConfig(config);
            return null;
        });
    }

    private void markConflict(final String pageId, final PageContent remote) throws ContentException {
        store.write((StoreSession session) -> {
            Page p = session.getPage(pageId);
            p.setConflict(new PageConflict(PageContent.of("Page"), LOCAL, remote, "c0ffee", 1));
            session.putPage(p);
            return null;
        });
    }

    @Test
    public void takeRemote() throws ContentException {
        markConflict(page.getId(), REMOTE);
        assertEquals(1, conflicts.getConflicts(SPACE).size());

        Page resolved = conflicts.resolveConflict(page.getId(), ResolutionChoice.TAKE_REMOTE, null, USER);
        assertFalse(resolved.hasConflict());
        assertEquals(REMOTE, pages.getContent(page.getId()));
        List<PageVersion> versions = new PageVersionManager(store, Clock.SIMPLE, AccessControl.OPEN)
                .listVersions(page.getId());
        assertEquals("c0ffee", versions.get(versions.size() - 1).getCommitSha());
        assertTrue(conflicts.getConflicts(SPACE).isEmpty());
        assertEquals(SyncStatus.SUCCESS, syncStatus());
    }

    @Test
    public void keepLocal() throws ContentException {
        markConflict(page.getId(), REMOTE);
        conflicts.resolveConflict(page.getId(), ResolutionChoice.KEEP_LOCAL, null, USER);
        assertEquals(LOCAL, pages.getContent(page.getId()));
        assertFalse(pages.getPage(page.getId()).hasConflict());
    }

    @Test
    public void merged() throws ContentException {
        markConflict(page.getId(), REMOTE);
        try {
            conflicts.resolveConflict(page.getId(), ResolutionChoice.MERGED, null, USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isValidation());
            assertEquals(41, e.getCode());
        }
        // the failed resolution left the conflict in place
        assertTrue(pages.getPage(page.getId()).hasConflict());

        PageContent merged = PageContent.of("Page", ContentBlock.paragraph("local"),
                ContentBlock.paragraph("remote"));
        conflicts.resolveConflict(page.getId(), ResolutionChoice.MERGED, merged, USER);
        assertEquals(merged, pages.getContent(page.getId()));
    }

    @Test
    public void remoteDeletion() throws ContentException {
        markConflict(page.getId(), null);
        conflicts.resolveConflict(page.getId(), ResolutionChoice.TAKE_REMOTE, null, USER);
        try {
            pages.getPage(page.getId());
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isNotFound());
        }
    }

    @Test
    public void spaceStaysInConflictUntilLastResolution() throws ContentException {
        Page other = pages.createPage(SPACE, null, "other", "Other", USER);
        markConflict(page.getId(), REMOTE);
        markConflict(other.getId(), REMOTE);

        conflicts.resolveConflict(page.getId(), ResolutionChoice.KEEP_LOCAL, null, USER);
        assertEquals(SyncStatus.CONFLICT, syncStatus());
        conflicts.resolveConflict(other.getId(), ResolutionChoice.KEEP_LOCAL, null, USER);
        assertEquals(SyncStatus.SUCCESS, syncStatus());
    }

    @Test
    public void noConflict() throws ContentException {
        try {
            conflicts.resolveConflict(page.getId(), ResolutionChoice.KEEP_LOCAL, null, USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(40, e.getCode());
        }
        try {
            conflicts.resolveConflict("missing", ResolutionChoice.KEEP_LOCAL, null, USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isNotFound());
            assertEquals(30, e.getCode());
        }
    }

    private SyncStatus syncStatus() throws ContentException {
        GitSyncConfig config = store.read((StoreSession session) -> session.getSyncConfigForSpace(SPACE));
        assertNull(config.getLastError());
        return config.getSyncStatus();
    }
}
