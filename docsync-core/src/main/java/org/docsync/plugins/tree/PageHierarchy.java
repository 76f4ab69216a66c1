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
import static org.docsync.api.ContentException.CONFLICT;
import static org.docsync.api.ContentException.NOT_FOUND;
import static org.docsync.api.ContentException.VALIDATION;

import java.util.List;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import org.docsync.api.ContentException;
import org.docsync.api.PageManager;
import org.docsync.api.content.Page;
import org.docsync.commons.PathUtils;
import org.docsync.spi.store.StoreSession;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Hierarchy changes of pages within a store session: creating, moving,
 * renaming and deleting pages, with the path and depth of all descendants
 * kept consistent. Shared by the page manager, the sync engine and the
 * change request workflow.
 */
public final class PageHierarchy {

    private PageHierarchy() {
    }

    /**
     * Returns the live page with the given id.
     *
     * @throws ContentException NotFound if there is no such page or it is deleted
     */
    @NotNull
    public static Page getLivePage(@NotNull StoreSession session, @NotNull String pageId) throws ContentException {
        Page page = session.getPage(pageId);
        if (page == null || page.isDeleted()) {
            throw new ContentException(NOT_FOUND, 10, "Page " + pageId + " not found");
        }
        return page;
    }

    /**
     * Creates an empty page as the last child of its parent.
     */
    @NotNull
    public static Page create(@NotNull StoreSession session, @NotNull String spaceId, @Nullable String parentId,
                              @NotNull String slug, @NotNull String title, @NotNull String actorId, long now)
            throws ContentException {
        PageNames.checkSlug(slug);
        PageNames.checkTitle(title);
        Page parent = null;
        if (parentId != null) {
            parent = getLivePage(session, parentId);
            if (!parent.getSpaceId().equals(spaceId)) {
                throw new ContentException(NOT_FOUND, 11, "Page " + parentId + " not found in space " + spaceId);
            }
        }
        int depth = childDepth(parent);
        Page page = new Page();
        page.setId(session.newId());
        page.setSpaceId(spaceId);
        page.setParentId(parentId);
        page.setSlug(slug);
        page.setTitle(title);
        page.setPath(pathOf(parent, slug));
        page.setDepth(depth);
        page.setPosition(session.getChildren(spaceId, parentId).size());
        page.setCreatedAt(now);
        page.setCreatedBy(actorId);
        page.setUpdatedAt(now);
        page.setUpdatedBy(actorId);
        session.putPage(page);
        return page;
    }

    /**
     * Depth of a new child of the given parent.
     *
     * @param parent the parent, {@code null} for a root page
     * @throws ContentException Validation if the child would be too deep
     */
    public static int childDepth(@Nullable Page parent) throws ContentException {
        int depth = parent == null ? 0 : parent.getDepth() + 1;
        if (depth > PageManager.MAX_NESTING_DEPTH) {
            throw new ContentException(VALIDATION, 22, "Maximum nesting depth "
                    + PageManager.MAX_NESTING_DEPTH + " exceeded");
        }
        return depth;
    }

    /**
     * Makes sure all ancestors of a page path exist, creating missing ones as
     * empty pages titled after their slug.
     *
     * @param created receives the pages created
     * @return the parent page of {@code path}, {@code null} for a root path
     */
    @Nullable
    public static Page ensureParent(@NotNull StoreSession session, @NotNull String spaceId, @NotNull String path,
                                    @NotNull String actorId, long now, @NotNull List<Page> created)
            throws ContentException {
        Page parent = null;
        String parentPath = PathUtils.getParentPath(path);
        for (String slug : PathUtils.elements(parentPath)) {
            String current = pathOf(parent, slug);
            Page page = session.getPageByPath(spaceId, current);
            if (page == null) {
                page = create(session, spaceId, parent == null ? null : parent.getId(),
                        slug, PageNames.titleOf(slug), actorId, now);
                created.add(page);
            }
            parent = page;
        }
        return parent;
    }

    /**
     * Moves a page with its subtree below a new parent.
     *
     * @throws ContentException Conflict if the new parent is the page or one
     *         of its descendants, Validation if the subtree would get too deep
     */
    public static void move(@NotNull StoreSession session, @NotNull Page page, @Nullable Page newParent,
                            int position, @NotNull String actorId, long now) throws ContentException {
        if (newParent != null) {
            if (!newParent.getSpaceId().equals(page.getSpaceId())) {
                throw new ContentException(VALIDATION, 23, "Pages can not be moved across spaces");
            }
            if (isSelfOrAncestor(session, page.getId(), newParent)) {
                throw new ContentException(CONFLICT, 10, "Can not move " + page.getPath()
                        + " below itself or one of its descendants");
            }
        }
        int depth = newParent == null ? 0 : newParent.getDepth() + 1;
        int height = height(session, page);
        if (depth + height > PageManager.MAX_NESTING_DEPTH) {
            throw new ContentException(VALIDATION, 22, "Maximum nesting depth "
                    + PageManager.MAX_NESTING_DEPTH + " exceeded");
        }

        String oldParentId = page.getParentId();
        String newParentId = newParent == null ? null : newParent.getId();
        List<Page> siblings = session.getChildren(page.getSpaceId(), newParentId);
        removeById(siblings, page.getId());

        page.setParentId(newParentId);
        page.setDepth(depth);
        page.setPath(pathOf(newParent, page.getSlug()));
        page.setUpdatedAt(now);
        page.setUpdatedBy(actorId);
        session.putPage(page);
        updateDescendants(session, page);

        int index = Math.max(0, Math.min(position, siblings.size()));
        siblings.add(index, page);
        setPositions(session, siblings);
        if (!equal(oldParentId, newParentId)) {
            renumber(session, page.getSpaceId(), oldParentId);
        }
    }

    /**
     * Changes the slug of a page and the paths of its descendants.
     */
    public static void rename(@NotNull StoreSession session, @NotNull Page page, @NotNull String slug,
                              @NotNull String actorId, long now) throws ContentException {
        PageNames.checkSlug(slug);
        Page parent = page.getParentId() == null ? null : getLivePage(session, page.getParentId());
        page.setSlug(slug);
        page.setPath(pathOf(parent, slug));
        page.setUpdatedAt(now);
        page.setUpdatedBy(actorId);
        session.putPage(page);
        updateDescendants(session, page);
    }

    /**
     * Soft deletes a page and all its live descendants.
     *
     * @return the deleted pages, the page itself first
     */
    @NotNull
    public static List<Page> softDelete(@NotNull StoreSession session, @NotNull Page page,
                                        @NotNull String actorId, long now) throws ContentException {
        List<Page> subtree = subtree(session, page);
        for (Page p : subtree) {
            p.setDeletedAt(now);
            p.setUpdatedAt(now);
            p.setUpdatedBy(actorId);
            session.putPage(p);
        }
        renumber(session, page.getSpaceId(), page.getParentId());
        return subtree;
    }

    /**
     * Removes a page and all its descendants, soft deleted ones included,
     * with their blocks and versions. Pages still bound to a repository file
     * are kept until a push has removed the file.
     *
     * @return the removed pages, the page itself first
     * @throws ContentException Conflict if a page still has a synced file
     */
    @NotNull
    public static List<Page> purge(@NotNull StoreSession session, @NotNull Page page) throws ContentException {
        ListMultimap<String, Page> children = ArrayListMultimap.create();
        for (Page p : session.getPages(page.getSpaceId())) {
            if (p.getParentId() != null) {
                children.put(p.getParentId(), p);
            }
        }
        List<Page> removed = newArrayList();
        collectAll(children, page, removed);
        for (Page p : removed) {
            if (p.getSyncedPath() != null) {
                throw new ContentException(CONFLICT, 11, "Page " + p.getPath() + " is synced to "
                        + p.getSyncedPath() + ", delete and push it first");
            }
        }
        for (Page p : Lists.reverse(removed)) {
            session.removePage(p.getId());
        }
        if (!page.isDeleted()) {
            renumber(session, page.getSpaceId(), page.getParentId());
        }
        return removed;
    }

    private static void collectAll(ListMultimap<String, Page> children, Page page, List<Page> result) {
        result.add(page);
        for (Page child : children.get(page.getId())) {
            collectAll(children, child, result);
        }
    }

    /**
     * Brings back a soft deleted page (without its descendants) as the last
     * child of its parent.
     *
     * @throws ContentException NotFound if the parent is gone, Conflict if the
     *         path was taken in the meantime
     */
    public static void undelete(@NotNull StoreSession session, @NotNull Page page,
                                @NotNull String actorId, long now) throws ContentException {
        Page parent = page.getParentId() == null ? null : getLivePage(session, page.getParentId());
        page.setDeletedAt(null);
        page.setDepth(parent == null ? 0 : parent.getDepth() + 1);
        page.setPath(pathOf(parent, page.getSlug()));
        page.setPosition(session.getChildren(page.getSpaceId(), page.getParentId()).size());
        page.setUpdatedAt(now);
        page.setUpdatedBy(actorId);
        session.putPage(page);
    }

    /**
     * Reorders the children of a parent.
     *
     * @throws ContentException Validation unless {@code orderedIds} lists every
     *         child exactly once
     */
    @NotNull
    public static List<Page> reorder(@NotNull StoreSession session, @NotNull String spaceId,
                                     @Nullable String parentId, @NotNull List<String> orderedIds)
            throws ContentException {
        List<Page> children = session.getChildren(spaceId, parentId);
        if (children.size() != orderedIds.size()) {
            throw new ContentException(VALIDATION, 24, "Expected " + children.size()
                    + " page ids, got " + orderedIds.size());
        }
        List<Page> ordered = newArrayList();
        for (String id : orderedIds) {
            Page page = findById(children, id);
            if (page == null || ordered.contains(page)) {
                throw new ContentException(VALIDATION, 25, "Page " + id + " is not a child or listed twice");
            }
            ordered.add(page);
        }
        setPositions(session, ordered);
        return ordered;
    }

    /**
     * Live pages of the subtree rooted at {@code page}, in pre-order.
     */
    @NotNull
    public static List<Page> subtree(@NotNull StoreSession session, @NotNull Page page) {
        List<Page> result = newArrayList();
        collect(session, page, result);
        return result;
    }

    private static void collect(StoreSession session, Page page, List<Page> result) {
        result.add(page);
        for (Page child : session.getChildren(page.getSpaceId(), page.getId())) {
            collect(session, child, result);
        }
    }

    /**
     * Walks the ancestor chain from {@code start} to the root, looking for
     * {@code pageId}. The walk is bounded by the maximum nesting depth.
     */
    public static boolean isSelfOrAncestor(@NotNull StoreSession session, @NotNull String pageId,
                                           @NotNull Page start) {
        Page current = start;
        for (int i = 0; current != null && i <= PageManager.MAX_NESTING_DEPTH + 1; i++) {
            if (current.getId().equals(pageId)) {
                return true;
            }
            current = current.getParentId() == null ? null : session.getPage(current.getParentId());
        }
        return false;
    }

    public static void renumber(@NotNull StoreSession session, @NotNull String spaceId, @Nullable String parentId)
            throws ContentException {
        setPositions(session, session.getChildren(spaceId, parentId));
    }

    @NotNull
    public static String pathOf(@Nullable Page parent, @NotNull String slug) {
        return PathUtils.concat(parent == null ? PathUtils.ROOT_PATH : parent.getPath(), slug);
    }

    private static void setPositions(StoreSession session, List<Page> ordered) throws ContentException {
        for (int i = 0; i < ordered.size(); i++) {
            Page page = ordered.get(i);
            if (page.getPosition() != i) {
                page.setPosition(i);
                session.putPage(page);
            }
        }
    }

    private static void updateDescendants(StoreSession session, Page parent) throws ContentException {
        for (Page child : session.getChildren(parent.getSpaceId(), parent.getId())) {
            child.setPath(pathOf(parent, child.getSlug()));
            child.setDepth(parent.getDepth() + 1);
            session.putPage(child);
            updateDescendants(session, child);
        }
    }

    private static int height(StoreSession session, Page page) {
        int max = 0;
        for (Page child : session.getChildren(page.getSpaceId(), page.getId())) {
            max = Math.max(max, 1 + height(session, child));
        }
        return max;
    }

    private static Page findById(List<Page> pages, String id) {
        for (Page page : pages) {
            if (page.getId().equals(id)) {
                return page;
            }
        }
        return null;
    }

    private static void removeById(List<Page> pages, String id) {
        Page page = findById(pages, id);
        if (page != null) {
            pages.remove(page);
        }
    }

    private static boolean equal(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }
}
