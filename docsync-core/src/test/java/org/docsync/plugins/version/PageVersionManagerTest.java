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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.docsync.api.ContentException;
import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.PageVersion;
import org.docsync.plugins.memory.MemoryContentStore;
import org.docsync.plugins.tree.PageTreeManager;
import org.docsync.spi.security.AccessControl;
import org.docsync.stats.Clock;
import org.junit.Before;
import org.junit.Test;

public class PageVersionManagerTest {

    private static final String USER = "bob";

    private PageTreeManager pages;

    private PageVersionManager versions;

    private Page page;

    @Before
    public void setUp() throws ContentException {
        MemoryContentStore store = new MemoryContentStore();
        Clock clock = new Clock.Virtual();
        pages = new PageTreeManager(store, clock, AccessControl.OPEN);
        versions = new PageVersionManager(store, clock, AccessControl.OPEN);
        page = pages.createPage("space", null, "notes", "Notes", USER);
    }

    @Test
    public void contentUpdatesRecordPreviousContent() throws ContentException {
        PageContent first = PageContent.of("Notes", ContentBlock.paragraph("one"));
        PageContent second = PageContent.of("Notes", ContentBlock.paragraph("two"));
        pages.updateContent(page.getId(), first, "first", USER);
        pages.updateContent(page.getId(), second, "second", USER);

        List<PageVersion> list = versions.listVersions(page.getId());
        assertEquals(2, list.size());
        assertEquals(1, list.get(0).getVersionNumber());
        assertEquals(PageContent.of("Notes"), list.get(0).getContent());
        assertEquals(first, list.get(1).getContent());
        assertEquals("second", list.get(1).getChangeSummary());
        assertEquals(second, pages.getContent(page.getId()));
    }

    @Test
    public void renameRecordsPreviousTitle() throws ContentException {
        PageContent first = PageContent.of("Notes", ContentBlock.paragraph("one"));
        pages.updateContent(page.getId(), first, null, USER);
        assertEquals("Renamed", pages.updatePage(page.getId(), "Renamed", null, USER).getTitle());
        pages.updateContent(page.getId(), PageContent.of("Renamed", ContentBlock.paragraph("two")), null, USER);

        List<PageVersion> list = versions.listVersions(page.getId());
        assertEquals(3, list.size());
        assertEquals(first, list.get(1).getContent());
        assertEquals("Renamed from 'Notes'", list.get(1).getChangeSummary());
        assertEquals(first.withTitle("Renamed"), list.get(2).getContent());
        // the same title again is no change
        pages.updatePage(page.getId(), "Renamed", null, USER);
        assertEquals(3, versions.listVersions(page.getId()).size());
    }

    @Test
    public void unchangedContentCreatesNoVersion() throws ContentException {
        PageContent content = PageContent.of("Notes", ContentBlock.paragraph("one"));
        pages.updateContent(page.getId(), content, null, USER);
        pages.updateContent(page.getId(), content, null, USER);
        assertEquals(1, versions.listVersions(page.getId()).size());
    }

    @Test
    public void versionNumbersAreSequential() throws ContentException {
        for (int i = 1; i <= 3; i++) {
            PageVersion version = versions.createVersion(page.getId(), "v" + i, USER);
            assertEquals(i, version.getVersionNumber());
            assertEquals(USER, version.getAuthorId());
        }
        assertEquals("v2", versions.getVersion(page.getId(), 2).getChangeSummary());
    }

    @Test
    public void restore() throws ContentException {
        PageContent first = PageContent.of("Notes", ContentBlock.paragraph("one"));
        PageContent second = PageContent.of("Renamed", ContentBlock.paragraph("two"));
        pages.updateContent(page.getId(), first, null, USER);
        pages.updateContent(page.getId(), second, null, USER);

        Page restored = versions.restoreVersion(page.getId(), 2, USER);
        assertEquals("Notes", restored.getTitle());
        assertEquals(first, pages.getContent(page.getId()));

        List<PageVersion> list = versions.listVersions(page.getId());
        assertEquals(3, list.size());
        assertEquals(second, list.get(2).getContent());
        assertEquals("Restored version 2", list.get(2).getChangeSummary());
    }

    @Test
    public void restoreCurrentContentIsNoOp() throws ContentException {
        PageContent first = PageContent.of("Notes", ContentBlock.paragraph("one"));
        pages.updateContent(page.getId(), first, null, USER);
        versions.createVersion(page.getId(), null, USER);

        versions.restoreVersion(page.getId(), 2, USER);
        versions.restoreVersion(page.getId(), 2, USER);
        assertEquals(2, versions.listVersions(page.getId()).size());
    }

    @Test
    public void missingVersion() throws ContentException {
        try {
            versions.getVersion(page.getId(), 1);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isNotFound());
            assertEquals(20, e.getCode());
        }
    }

    @Test
    public void deletedPageHasNoVersions() throws ContentException {
        versions.createVersion(page.getId(), null, USER);
        pages.deletePage(page.getId(), USER);
        try {
            versions.listVersions(page.getId());
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isNotFound());
        }
    }
}
