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

package org.docsync.plugins.tree;

import static com.google.common.collect.Lists.newArrayList;
import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;

import java.util.List;

import org.docsync.api.ContentException;
import org.docsync.api.PageManager;
import org.docsync.api.content.BlockType;
import org.docsync.api.content.BreadcrumbItem;
import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.PageTree;
import org.docsync.plugins.memory.MemoryContentStore;
import org.docsync.spi.security.AccessControl;
import org.docsync.spi.store.StoreSession;
import org.docsync.stats.Clock;
import org.junit.Before;
import org.junit.Test;

public class PageTreeManagerTest {

    private static final String SPACE = "space";

    private static final String USER = "alice";

    private PageTreeManager pages;

    @Before
    public void setUp() {
        pages = new PageTreeManager(new MemoryContentStore(), new Clock.Virtual(), AccessControl.OPEN);
    }

    @Test
    public void createHierarchy() throws ContentException {
        Page guide = pages.createPage(SPACE, null, "guide", "Guide", USER);
        Page setup = pages.createPage(SPACE, guide.getId(), "setup", "Setup", USER);
        Page usage = pages.createPage(SPACE, guide.getId(), "usage", "Usage", USER);

        assertEquals("/guide", guide.getPath());
        assertEquals(0, guide.getDepth());
        assertEquals("/guide/setup", setup.getPath());
        assertEquals(1, setup.getDepth());
        assertEquals(0, setup.getPosition());
        assertEquals(1, usage.getPosition());
        assertEquals(setup.getId(), pages.getPageByPath(SPACE, "/guide/setup").getId());
        assertEquals(2, pages.getChildren(SPACE, guide.getId()).size());
        assertEquals(1, pages.getSiblings(setup.getId()).size());
    }

    @Test
    public void duplicateSlug() throws ContentException {
        pages.createPage(SPACE, null, "guide", "Guide", USER);
        try {
            pages.createPage(SPACE, null, "guide", "Other", USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
        }
        // same slug in another space is fine
        pages.createPage("other", null, "guide", "Guide", USER);
    }

    @Test
    public void invalidNames() throws ContentException {
        for (String slug : asList("Guide", "a--b", "-a", "a b", "")) {
            try {
                pages.createPage(SPACE, null, slug, "Title", USER);
                fail("expected ContentException for '" + slug + "'");
            } catch (ContentException e) {
                assertTrue(e.isValidation());
                assertEquals(20, e.getCode());
            }
        }
        try {
            pages.createPage(SPACE, null, "ok", " ", USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(21, e.getCode());
        }
    }

    @Test
    public void maximumNestingDepth() throws ContentException {
        String parentId = null;
        for (int depth = 0; depth <= PageManager.MAX_NESTING_DEPTH; depth++) {
            parentId = pages.createPage(SPACE, parentId, "p" + depth, "Page " + depth, USER).getId();
        }
        assertEquals(PageManager.MAX_NESTING_DEPTH, pages.getPage(parentId).getDepth());
        try {
            pages.createPage(SPACE, parentId, "too-deep", "Too Deep", USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isValidation());
            assertEquals(22, e.getCode());
        }
    }

    @Test
    public void moveBelowDescendant() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        Page b = pages.createPage(SPACE, a.getId(), "b", "B", USER);
        try {
            pages.movePage(a.getId(), b.getId(), 0, USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
            assertEquals(10, e.getCode());
        }
        try {
            pages.movePage(a.getId(), a.getId(), 0, USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
        }
        assertEquals("/a/b", pages.getPage(b.getId()).getPath());
    }

    @Test
    public void moveUpdatesSubtree() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        Page b = pages.createPage(SPACE, a.getId(), "b", "B", USER);
        Page c = pages.createPage(SPACE, b.getId(), "c", "C", USER);
        Page x = pages.createPage(SPACE, null, "x", "X", USER);

        Page moved = pages.movePage(b.getId(), x.getId(), 0, USER);
        assertEquals("/x/b", moved.getPath());
        assertEquals(1, moved.getDepth());

        Page child = pages.getPage(c.getId());
        assertEquals("/x/b/c", child.getPath());
        assertEquals(2, child.getDepth());
        assertTrue(pages.getChildren(SPACE, a.getId()).isEmpty());
        assertEquals(x.getId(), pages.getPage(b.getId()).getParentId());
    }

    @Test
    public void moveToRootKeepsPositionsDense() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        Page b = pages.createPage(SPACE, a.getId(), "b", "B", USER);
        pages.createPage(SPACE, a.getId(), "c", "C", USER);
        pages.createPage(SPACE, null, "d", "D", USER);

        pages.movePage(b.getId(), null, 1, USER);

        List<Page> roots = pages.getChildren(SPACE, null);
        assertEquals(asList("a", "b", "d"), slugs(roots));
        for (int i = 0; i < roots.size(); i++) {
            assertEquals(i, roots.get(i).getPosition());
        }
        List<Page> remaining = pages.getChildren(SPACE, a.getId());
        assertEquals(1, remaining.size());
        assertEquals(0, remaining.get(0).getPosition());
    }

    @Test
    public void moveTooDeep() throws ContentException {
        String parentId = null;
        for (int depth = 0; depth < PageManager.MAX_NESTING_DEPTH; depth++) {
            parentId = pages.createPage(SPACE, parentId, "p" + depth, "Page " + depth, USER).getId();
        }
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        pages.createPage(SPACE, a.getId(), "b", "B", USER);
        try {
            pages.movePage(a.getId(), parentId, 0, USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isValidation());
        }
    }

    @Test
    public void reorder() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        Page b = pages.createPage(SPACE, null, "b", "B", USER);
        Page c = pages.createPage(SPACE, null, "c", "C", USER);

        pages.reorderChildren(SPACE, null, asList(c.getId(), a.getId(), b.getId()), USER);
        assertEquals(asList("c", "a", "b"), slugs(pages.getChildren(SPACE, null)));

        try {
            pages.reorderChildren(SPACE, null, asList(c.getId(), a.getId()), USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(24, e.getCode());
        }
        try {
            pages.reorderChildren(SPACE, null, asList(c.getId(), a.getId(), a.getId()), USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(25, e.getCode());
        }
    }

    @Test
    public void renameUpdatesDescendants() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        Page b = pages.createPage(SPACE, a.getId(), "b", "B", USER);

        Page renamed = pages.updatePage(a.getId(), "Renamed", "renamed", USER);
        assertEquals("/renamed", renamed.getPath());
        assertEquals("Renamed", renamed.getTitle());
        assertEquals("/renamed/b", pages.getPage(b.getId()).getPath());
    }

    @Test
    public void breadcrumb() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        Page b = pages.createPage(SPACE, a.getId(), "b", "B", USER);
        Page c = pages.createPage(SPACE, b.getId(), "c", "C", USER);

        List<BreadcrumbItem> items = pages.getBreadcrumb(c.getId());
        assertEquals(3, items.size());
        assertEquals(new BreadcrumbItem(a.getId(), "A", "/a"), items.get(0));
        assertEquals("/a/b/c", items.get(2).getPath());
    }

    @Test
    public void subtree() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        Page b = pages.createPage(SPACE, a.getId(), "b", "B", USER);
        pages.createPage(SPACE, b.getId(), "c", "C", USER);

        PageTree full = pages.getSubtree(SPACE, a.getId(), 5);
        assertEquals(a.getId(), full.getPage().getId());
        assertEquals(1, full.getChildren().size());
        assertEquals(1, full.getChildren().get(0).getChildren().size());

        PageTree shallow = pages.getSubtree(SPACE, a.getId(), 1);
        PageTree child = shallow.getChildren().get(0);
        assertTrue(child.getChildren().isEmpty());
        assertTrue(child.isTruncated());

        PageTree space = pages.getSubtree(SPACE, null, 0);
        assertNull(space.getPage());
        assertEquals(1, space.getChildren().size());
        assertTrue(space.getChildren().get(0).isTruncated());
    }

    @Test
    public void deleteRemovesSubtree() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        Page b = pages.createPage(SPACE, a.getId(), "b", "B", USER);
        Page c = pages.createPage(SPACE, null, "c", "C", USER);

        pages.deletePage(a.getId(), USER);
        for (String id : asList(a.getId(), b.getId())) {
            try {
                pages.getPage(id);
                fail("expected ContentException");
            } catch (ContentException e) {
                assertTrue(e.isNotFound());
            }
        }
        assertEquals(0, pages.getPage(c.getId()).getPosition());
        // the path is free again
        pages.createPage(SPACE, null, "a", "A", USER);
    }

    @Test
    public void permanentDeleteRemovesSubtreeWithContent() throws ContentException {
        MemoryContentStore store = new MemoryContentStore();
        pages = new PageTreeManager(store, new Clock.Virtual(), AccessControl.OPEN);
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        Page b = pages.createPage(SPACE, a.getId(), "b", "B", USER);
        Page gone = pages.createPage(SPACE, a.getId(), "gone", "Gone", USER);
        Page c = pages.createPage(SPACE, null, "c", "C", USER);
        pages.updateContent(b.getId(), PageContent.of("B", ContentBlock.paragraph("text")), null, USER);
        pages.deletePage(gone.getId(), USER);

        pages.deletePage(a.getId(), true, USER);
        store.read((StoreSession session) -> {
            for (String id : asList(a.getId(), b.getId(), gone.getId())) {
                assertNull(session.getPage(id));
                assertTrue(session.getBlocks(id).isEmpty());
                assertTrue(session.getVersions(id).isEmpty());
            }
            return null;
        });
        assertEquals(0, pages.getPage(c.getId()).getPosition());
        try {
            pages.deletePage(a.getId(), true, USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isNotFound());
        }
    }

    @Test
    public void permanentDeleteOfSoftDeletedPage() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        pages.deletePage(a.getId(), USER);
        Page again = pages.createPage(SPACE, null, "a", "A again", USER);
        pages.deletePage(a.getId(), true, USER);
        // the live page at the same path stays
        assertEquals(again.getId(), pages.getPageByPath(SPACE, "/a").getId());
    }

    @Test
    public void syncedPagesAreNotDeletedPermanently() throws ContentException {
        MemoryContentStore store = new MemoryContentStore();
        pages = new PageTreeManager(store, new Clock.Virtual(), AccessControl.OPEN);
        final Page a = pages.createPage(SPACE, null, "a", "A", USER);
        store.write((StoreSession session) -> {
            Page page = session.getPage(a.getId());
            page.setSyncedPath("docs/a.md");
            session.putPage(page);
            return page;
        });
        try {
            pages.deletePage(a.getId(), true, USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
            assertEquals(11, e.getCode());
        }
        assertEquals("A", pages.getPage(a.getId()).getTitle());
    }

    @Test
    public void publish() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        assertFalse(a.isPublished());
        Page published = pages.publish(a.getId(), USER);
        assertTrue(published.isPublished());
        assertTrue(published.getPublishedAt() != null);
        try {
            pages.publish(a.getId(), USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(27, e.getCode());
        }
        assertNull(pages.unpublish(a.getId(), USER).getPublishedAt());
    }

    @Test
    public void duplicate() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        pages.updateContent(a.getId(), PageContent.of("A", ContentBlock.paragraph("Hello")), null, USER);

        Page copy = pages.duplicatePage(a.getId(), USER);
        assertEquals("a-copy", copy.getSlug());
        assertEquals("A (Copy)", copy.getTitle());
        assertEquals(1, copy.getPosition());
        assertEquals(PageContent.of("A (Copy)", ContentBlock.paragraph("Hello")), pages.getContent(copy.getId()));

        assertEquals("a-copy-2", pages.duplicatePage(a.getId(), USER).getSlug());
    }

    @Test
    public void duplicateWithChildren() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        Page b = pages.createPage(SPACE, a.getId(), "b", "B", USER);
        Page c = pages.createPage(SPACE, b.getId(), "c", "C", USER);
        Page d = pages.createPage(SPACE, a.getId(), "d", "D", USER);
        pages.deletePage(d.getId(), USER);
        PageContent content = PageContent.of("C", ContentBlock.paragraph("deep"));
        pages.updateContent(c.getId(), content, null, USER);

        Page copy = pages.duplicatePage(a.getId(), true, USER);
        assertEquals("/a-copy", copy.getPath());
        List<Page> children = pages.getChildren(SPACE, copy.getId());
        assertEquals(1, children.size());
        assertEquals("B", children.get(0).getTitle());
        Page copiedC = pages.getPageByPath(SPACE, "/a-copy/b/c");
        assertEquals(2, copiedC.getDepth());
        assertEquals(content, pages.getContent(copiedC.getId()));
        assertFalse(copiedC.getId().equals(c.getId()));
        // the original is untouched
        assertEquals(1, pages.getChildren(SPACE, a.getId()).size());

        Page single = pages.duplicatePage(a.getId(), false, USER);
        assertTrue(pages.getChildren(SPACE, single.getId()).isEmpty());
    }

    @Test
    public void contentRoundTrip() throws ContentException {
        Page a = pages.createPage(SPACE, null, "a", "A", USER);
        PageContent content = PageContent.of("Title",
                ContentBlock.heading(1, "Intro"),
                ContentBlock.paragraph("Text").withAttribute("align", "center"),
                ContentBlock.of(BlockType.TOGGLE, "More")
                        .withChildren(asList(ContentBlock.paragraph("Hidden"))));
        Page updated = pages.updateContent(a.getId(), content, "first", USER);
        assertEquals("Title", updated.getTitle());
        assertEquals(content, pages.getContent(a.getId()));
    }

    @Test
    public void forbidden() throws ContentException {
        PageTreeManager denied = new PageTreeManager(new MemoryContentStore(), Clock.SIMPLE,
                mock(AccessControl.class));
        try {
            denied.createPage(SPACE, null, "a", "A", USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isForbidden());
            assertEquals(1, e.getCode());
        }
    }

    private static List<String> slugs(List<Page> pages) {
        List<String> slugs = newArrayList();
        for (Page page : pages) {
            slugs.add(page.getSlug());
        }
        return slugs;
    }
}
