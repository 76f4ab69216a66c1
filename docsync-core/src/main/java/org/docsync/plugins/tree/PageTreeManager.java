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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.Lists.newArrayList;
import static org.docsync.api.ContentException.NOT_FOUND;
import static org.docsync.api.ContentException.VALIDATION;

import java.util.Collections;
import java.util.List;

import org.docsync.api.ContentException;
import org.docsync.api.PageManager;
import org.docsync.api.content.BreadcrumbItem;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.PageTree;
import org.docsync.plugins.version.VersionedContent;
import org.docsync.spi.security.AccessControl;
import org.docsync.spi.security.PageResource;
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
 * {@link PageManager} on top of a {@link ContentStore}. Every operation is a
 * single store read or write.
 */
public class PageTreeManager implements PageManager {

    private static final Logger LOG = LoggerFactory.getLogger(PageTreeManager.class);

    private final ContentStore store;

    private final Clock clock;

    private final AccessControl.Checker access;

    public PageTreeManager(@NotNull ContentStore store, @NotNull Clock clock, @NotNull AccessControl accessControl) {
        this.store = checkNotNull(store);
        this.clock = checkNotNull(clock);
        this.access = new AccessControl.Checker(checkNotNull(accessControl));
    }

    @NotNull
    @Override
    public Page createPage(@NotNull final String spaceId, @Nullable final String parentId,
                           @NotNull final String slug, @NotNull final String title,
                           @NotNull final String actorId) throws ContentException {
        access.check(actorId, new SpaceResource(spaceId), Permission.WRITE);
        Page page = store.write((StoreSession session) ->
                PageHierarchy.create(session, spaceId, parentId, slug, title, actorId, clock.getTimeMonotonic()));
        LOG.debug("Created page {} in space {}", page.getPath(), spaceId);
        return page;
    }

    @NotNull
    @Override
    public Page getPage(@NotNull final String pageId) throws ContentException {
        return store.read((StoreSession session) -> PageHierarchy.getLivePage(session, pageId));
    }

    @NotNull
    @Override
    public Page getPageByPath(@NotNull final String spaceId, @NotNull final String path) throws ContentException {
        return store.read((StoreSession session) -> {
            Page page = session.getPageByPath(spaceId, path);
            if (page == null) {
                throw new ContentException(NOT_FOUND, 12, "No page at " + path + " in space " + spaceId);
            }
            return page;
        });
    }

    @NotNull
    @Override
    public Page updatePage(@NotNull final String pageId, @Nullable final String title, @Nullable final String slug,
                           @NotNull final String actorId) throws ContentException {
        return store.write((StoreSession session) -> {
            Page page = writablePage(session, pageId, actorId);
            long now = clock.getTimeMonotonic();
            if (title != null && !title.equals(page.getTitle())) {
                // the title is part of the versioned content
                VersionedContent.replace(session, page, VersionedContent.read(session, page).withTitle(title),
                        "Renamed from '" + page.getTitle() + "'", actorId, null, now);
            }
            if (slug != null && !slug.equals(page.getSlug())) {
                PageHierarchy.rename(session, page, slug, actorId, now);
            }
            return page;
        });
    }

    @NotNull
    @Override
    public Page updateContent(@NotNull final String pageId, @NotNull final PageContent content,
                              @Nullable final String changeSummary, @NotNull final String actorId)
            throws ContentException {
        return store.write((StoreSession session) -> {
            Page page = writablePage(session, pageId, actorId);
            if (VersionedContent.replace(session, page, content, changeSummary, actorId, null,
                    clock.getTimeMonotonic())) {
                LOG.debug("Updated content of page {}", page.getPath());
            }
            return page;
        });
    }

    @NotNull
    @Override
    public PageContent getContent(@NotNull final String pageId) throws ContentException {
        return store.read((StoreSession session) ->
                VersionedContent.read(session, PageHierarchy.getLivePage(session, pageId)));
    }

    @NotNull
    @Override
    public Page movePage(@NotNull final String pageId, @Nullable final String newParentId, final int position,
                         @NotNull final String actorId) throws ContentException {
        return store.write((StoreSession session) -> {
            Page page = writablePage(session, pageId, actorId);
            Page parent = newParentId == null ? null : PageHierarchy.getLivePage(session, newParentId);
            PageHierarchy.move(session, page, parent, position, actorId, clock.getTimeMonotonic());
            LOG.debug("Moved page {} to position {}", page.getPath(), position);
            return page;
        });
    }

    @NotNull
    @Override
    public List<Page> reorderChildren(@NotNull final String spaceId, @Nullable final String parentId,
                                      @NotNull final List<String> orderedPageIds, @NotNull final String actorId)
            throws ContentException {
        access.check(actorId, new SpaceResource(spaceId), Permission.WRITE);
        return store.write((StoreSession session) ->
                PageHierarchy.reorder(session, spaceId, parentId, orderedPageIds));
    }

    @NotNull
    @Override
    public PageTree getSubtree(@NotNull final String spaceId, @Nullable final String rootPageId, final int maxDepth)
            throws ContentException {
        if (maxDepth < 0) {
            throw new ContentException(VALIDATION, 26, "maxDepth must not be negative: " + maxDepth);
        }
        return store.read((StoreSession session) -> {
            if (rootPageId == null) {
                return tree(session, spaceId, null, maxDepth + 1);
            }
            Page root = PageHierarchy.getLivePage(session, rootPageId);
            return tree(session, spaceId, root, maxDepth);
        });
    }

    private static PageTree tree(StoreSession session, String spaceId, Page page, int levels) {
        List<Page> children = session.getChildren(spaceId, page == null ? null : page.getId());
        if (levels == 0) {
            return new PageTree(page, Collections.<PageTree>emptyList(), !children.isEmpty());
        }
        List<PageTree> subtrees = newArrayList();
        for (Page child : children) {
            subtrees.add(tree(session, spaceId, child, levels - 1));
        }
        return new PageTree(page, subtrees, false);
    }

    @NotNull
    @Override
    public List<BreadcrumbItem> getBreadcrumb(@NotNull final String pageId) throws ContentException {
        return store.read((StoreSession session) -> {
            List<BreadcrumbItem> items = newArrayList();
            Page current = PageHierarchy.getLivePage(session, pageId);
            for (int i = 0; current != null && i <= MAX_NESTING_DEPTH; i++) {
                items.add(new BreadcrumbItem(current.getId(), current.getTitle(), current.getPath()));
                current = current.getParentId() == null ? null : session.getPage(current.getParentId());
            }
            Collections.reverse(items);
            return items;
        });
    }

    @NotNull
    @Override
    public List<Page> getChildren(@NotNull final String spaceId, @Nullable final String parentId)
            throws ContentException {
        return store.read((StoreSession session) -> {
            if (parentId != null) {
                PageHierarchy.getLivePage(session, parentId);
            }
            return session.getChildren(spaceId, parentId);
        });
    }

    @NotNull
    @Override
    public List<Page> getSiblings(@NotNull final String pageId) throws ContentException {
        return store.read((StoreSession session) -> {
            Page page = PageHierarchy.getLivePage(session, pageId);
            List<Page> siblings = newArrayList();
            for (Page sibling : session.getChildren(page.getSpaceId(), page.getParentId())) {
                if (!sibling.getId().equals(pageId)) {
                    siblings.add(sibling);
                }
            }
            return siblings;
        });
    }

    @NotNull
    @Override
    public Page publish(@NotNull String pageId, @NotNull String actorId) throws ContentException {
        return setPublished(pageId, true, actorId);
    }

    @NotNull
    @Override
    public Page unpublish(@NotNull String pageId, @NotNull String actorId) throws ContentException {
        return setPublished(pageId, false, actorId);
    }

    private Page setPublished(final String pageId, final boolean published, final String actorId)
            throws ContentException {
        return store.write((StoreSession session) -> {
            Page page = writablePage(session, pageId, actorId);
            if (page.isPublished() == published) {
                throw new ContentException(VALIDATION, 27, "Page " + page.getPath() + " is already "
                        + (published ? "published" : "unpublished"));
            }
            long now = clock.getTimeMonotonic();
            page.setPublished(published);
            page.setPublishedAt(published ? Long.valueOf(now) : null);
            page.setUpdatedAt(now);
            page.setUpdatedBy(actorId);
            session.putPage(page);
            return page;
        });
    }

    @Override
    public void deletePage(@NotNull String pageId, @NotNull String actorId) throws ContentException {
        deletePage(pageId, false, actorId);
    }

    @Override
    public void deletePage(@NotNull final String pageId, final boolean permanent, @NotNull final String actorId)
            throws ContentException {
        if (!permanent) {
            List<Page> deleted = store.write((StoreSession session) ->
                    PageHierarchy.softDelete(session, writablePage(session, pageId, actorId), actorId,
                            clock.getTimeMonotonic()));
            LOG.debug("Deleted page {} and {} descendants", deleted.get(0).getPath(), deleted.size() - 1);
            return;
        }
        List<Page> removed = store.write((StoreSession session) -> {
            Page page = session.getPage(pageId);
            if (page == null) {
                throw new ContentException(NOT_FOUND, 10, "Page " + pageId + " not found");
            }
            access.check(actorId, new PageResource(page.getSpaceId(), pageId), Permission.WRITE);
            return PageHierarchy.purge(session, page);
        });
        LOG.info("Permanently deleted page {} and {} descendants", removed.get(0).getPath(), removed.size() - 1);
    }

    @NotNull
    @Override
    public Page duplicatePage(@NotNull String pageId, @NotNull String actorId) throws ContentException {
        return duplicatePage(pageId, false, actorId);
    }

    @NotNull
    @Override
    public Page duplicatePage(@NotNull final String pageId, final boolean includeChildren,
                              @NotNull final String actorId) throws ContentException {
        return store.write((StoreSession session) -> {
            Page original = writablePage(session, pageId, actorId);
            Page parent = original.getParentId() == null ? null : session.getPage(original.getParentId());
            String slug = PageNames.withSuffix(original.getSlug(), "-copy");
            for (int n = 2; session.getPageByPath(original.getSpaceId(),
                    PageHierarchy.pathOf(parent, slug)) != null; n++) {
                slug = PageNames.withSuffix(original.getSlug(), "-copy-" + n);
            }
            String title = original.getTitle();
            String copyTitle = title.length() + 7 <= MAX_TITLE_LENGTH ? title + " (Copy)" : title;
            long now = clock.getTimeMonotonic();
            Page copy = copy(session, original, original.getParentId(), slug, copyTitle, actorId, now);
            if (includeChildren) {
                copyChildren(session, original, copy, actorId, now);
            }
            return copy;
        });
    }

    private static Page copy(StoreSession session, Page original, String parentId, String slug, String title,
                             String actorId, long now) throws ContentException {
        Page copy = PageHierarchy.create(session, original.getSpaceId(), parentId, slug, title, actorId, now);
        PageContent content = VersionedContent.read(session, original);
        VersionedContent.replace(session, copy, content.withTitle(title), "Duplicated from "
                + original.getPath(), actorId, null, now);
        return copy;
    }

    private static void copyChildren(StoreSession session, Page original, Page copy, String actorId, long now)
            throws ContentException {
        for (Page child : session.getChildren(original.getSpaceId(), original.getId())) {
            Page childCopy = copy(session, child, copy.getId(), child.getSlug(), child.getTitle(), actorId, now);
            copyChildren(session, child, childCopy, actorId, now);
        }
    }

    private Page writablePage(StoreSession session, String pageId, String actorId) throws ContentException {
        Page page = PageHierarchy.getLivePage(session, pageId);
        access.check(actorId, new PageResource(page.getSpaceId(), pageId), Permission.WRITE);
        return page;
    }
}
