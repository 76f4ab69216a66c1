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

package org.docsync.plugins.memory;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.docsync.api.ContentException;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.PageVersion;
import org.docsync.api.sync.GitCommitRecord;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.api.sync.SyncDirection;
import org.docsync.spi.store.StoreSession;
import org.junit.Before;
import org.junit.Test;

public class MemoryContentStoreTest {

    private MemoryContentStore store;

    @Before
    public void setUp() {
        store = new MemoryContentStore();
    }

    @Test
    public void failedWriteLeavesNoTrace() throws Exception {
        try {
            store.write((StoreSession session) -> {
                session.putPage(page(session, "a"));
                throw new ContentException(ContentException.VALIDATION, 99, "abort");
            });
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(99, e.getCode());
        }
        assertNull(store.read((StoreSession session) -> session.getPageByPath("s1", "/a")));
    }

    @Test
    public void writesAreVisibleWithinTheSession() throws Exception {
        Page page = store.write((StoreSession session) -> {
            Page p = page(session, "a");
            session.putPage(p);
            assertNotNull(session.getPageByPath("s1", "/a"));
            return p;
        });
        assertEquals(page.getId(), store.read((StoreSession session) ->
                session.getPageByPath("s1", "/a")).getId());
    }

    @Test
    public void returnedEntitiesAreCopies() throws Exception {
        final Page page = store.write((StoreSession session) -> {
            Page p = page(session, "a");
            session.putPage(p);
            return p;
        });
        page.setTitle("Changed");
        assertEquals("A", store.read((StoreSession session) -> session.getPage(page.getId())).getTitle());
    }

    @Test
    public void duplicatePath() throws Exception {
        store.write((StoreSession session) -> {
            session.putPage(page(session, "a"));
            return null;
        });
        try {
            store.write((StoreSession session) -> {
                session.putPage(page(session, "a"));
                return null;
            });
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
        }
    }

    @Test
    public void depthMustMatchParent() throws Exception {
        try {
            store.write((StoreSession session) -> {
                Page p = page(session, "a");
                p.setDepth(1);
                session.putPage(p);
                return null;
            });
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isValidation());
        }
    }

    @Test
    public void ownAncestor() throws Exception {
        final Page a = store.write((StoreSession session) -> {
            Page p = page(session, "a");
            session.putPage(p);
            return p;
        });
        final Page b = store.write((StoreSession session) -> {
            Page p = page(session, "b");
            p.setParentId(a.getId());
            p.setDepth(1);
            p.setPath("/a/b");
            session.putPage(p);
            return p;
        });
        try {
            store.write((StoreSession session) -> {
                a.setParentId(b.getId());
                a.setDepth(2);
                a.setPath("/a/b/a");
                session.putPage(a);
                return null;
            });
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
        }
    }

    @Test
    public void versionsAreSequential() throws Exception {
        final Page page = store.write((StoreSession session) -> {
            Page p = page(session, "a");
            session.putPage(p);
            session.addVersion(version(session, p, 1));
            session.addVersion(version(session, p, 2));
            return p;
        });
        try {
            store.write((StoreSession session) -> {
                session.addVersion(version(session, page, 4));
                return null;
            });
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
        }
        List<PageVersion> versions = store.read((StoreSession session) -> session.getVersions(page.getId()));
        assertEquals(2, versions.size());
        assertEquals(2, versions.get(1).getVersionNumber());
    }

    @Test
    public void commitShaIsRecordedOnce() throws Exception {
        final GitSyncConfig config = store.write((StoreSession session) -> {
            GitSyncConfig c = new GitSyncConfig();
            c.setId(session.newId());
            c.setSpaceId("s1");
            c.setRepositoryUrl("memory:docs");
            session.putSyncConfig(c);
            session.putCommit(commit(session, c, "abc"));
            return c;
        });
        try {
            store.write((StoreSession session) -> {
                session.putCommit(commit(session, config, "abc"));
                return null;
            });
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
        }
    }

    @Test
    public void removePageKeepsParentsWithChildren() throws Exception {
        final Page a = store.write((StoreSession session) -> {
            Page p = page(session, "a");
            session.putPage(p);
            session.addVersion(version(session, p, 1));
            return p;
        });
        final Page b = store.write((StoreSession session) -> {
            Page p = page(session, "b");
            p.setParentId(a.getId());
            p.setDepth(1);
            p.setPath("/a/b");
            session.putPage(p);
            return p;
        });
        try {
            store.write((StoreSession session) -> {
                session.removePage(a.getId());
                return null;
            });
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
            assertEquals(9, e.getCode());
        }

        store.write((StoreSession session) -> {
            session.removePage(b.getId());
            session.removePage(a.getId());
            return null;
        });
        store.read((StoreSession session) -> {
            assertNull(session.getPage(a.getId()));
            assertNull(session.getPageByPath("s1", "/a/b"));
            assertTrue(session.getVersions(a.getId()).isEmpty());
            return null;
        });
        // the path is free again
        store.write((StoreSession session) -> {
            session.putPage(page(session, "a"));
            return null;
        });
        try {
            store.write((StoreSession session) -> {
                session.removePage(a.getId());
                return null;
            });
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isNotFound());
            assertEquals(2, e.getCode());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void readSessionIsReadOnly() throws Exception {
        store.read((StoreSession session) -> {
            session.putPage(page(session, "a"));
            return null;
        });
    }

    private static Page page(StoreSession session, String slug) {
        Page page = new Page();
        page.setId(session.newId());
        page.setSpaceId("s1");
        page.setSlug(slug);
        page.setTitle(slug.toUpperCase());
        page.setPath("/" + slug);
        return page;
    }

    private static PageVersion version(StoreSession session, Page page, int number) {
        PageVersion version = new PageVersion();
        version.setId(session.newId());
        version.setPageId(page.getId());
        version.setVersionNumber(number);
        version.setContent(PageContent.of(page.getTitle()));
        version.setAuthorId("u1");
        return version;
    }

    private static GitCommitRecord commit(StoreSession session, GitSyncConfig config, String sha) {
        GitCommitRecord record = new GitCommitRecord();
        record.setId(session.newId());
        record.setConfigId(config.getId());
        record.setSha(sha);
        record.setMessage("m");
        record.setAuthorId("u1");
        record.setDirection(SyncDirection.PULL);
        return record;
    }
}
