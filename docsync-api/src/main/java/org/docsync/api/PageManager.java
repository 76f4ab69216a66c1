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

package org.docsync.api;

import java.util.List;

import org.docsync.api.content.BreadcrumbItem;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.PageTree;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The hierarchy of pages of a space.
 * <p>
 * Paths are unique among the live pages of a space, {@code depth} is always
 * the parent's depth plus one (0 for root pages) and the hierarchy never
 * contains a cycle. Soft deleted pages are invisible to all lookups.
 */
public interface PageManager {

    /**
     * Maximum depth of a page (root pages have depth 0).
     */
    int MAX_NESTING_DEPTH = 10;

    int MAX_SLUG_LENGTH = 100;

    int MAX_TITLE_LENGTH = 255;

    /**
     * Creates an empty, unpublished page as the last child of its parent.
     *
     * @throws ContentException NotFound if the parent does not exist,
     *         Conflict if the path is taken, Validation for a malformed slug or
     *         title or when the maximum depth would be exceeded
     */
    @NotNull
    Page createPage(@NotNull String spaceId, @Nullable String parentId, @NotNull String slug,
                    @NotNull String title, @NotNull String actorId) throws ContentException;

    @NotNull
    Page getPage(@NotNull String pageId) throws ContentException;

    @NotNull
    Page getPageByPath(@NotNull String spaceId, @NotNull String path) throws ContentException;

    /**
     * Changes title and/or slug. A slug change recomputes the paths of the
     * page and all its descendants.
     */
    @NotNull
    Page updatePage(@NotNull String pageId, @Nullable String title, @Nullable String slug,
                    @NotNull String actorId) throws ContentException;

    /**
     * Replaces the content of a page. The previous content is recorded as a
     * new version in the same atomic step. Identical content is a no-op.
     */
    @NotNull
    Page updateContent(@NotNull String pageId, @NotNull PageContent content,
                       @Nullable String changeSummary, @NotNull String actorId) throws ContentException;

    @NotNull
    PageContent getContent(@NotNull String pageId) throws ContentException;

    /**
     * Moves a page (with its subtree) below a new parent at the given
     * position among the new siblings.
     *
     * @throws ContentException Conflict if the new parent is the page itself or
     *         one of its descendants, or if the new path is taken
     */
    @NotNull
    Page movePage(@NotNull String pageId, @Nullable String newParentId, int position,
                  @NotNull String actorId) throws ContentException;

    /**
     * Reorders the children of a parent. {@code orderedPageIds} must list
     * every child exactly once.
     */
    @NotNull
    List<Page> reorderChildren(@NotNull String spaceId, @Nullable String parentId,
                               @NotNull List<String> orderedPageIds, @NotNull String actorId) throws ContentException;

    /**
     * Returns the tree below {@code rootPageId} (or the whole space if
     * {@code null}) down to {@code maxDepth} levels.
     */
    @NotNull
    PageTree getSubtree(@NotNull String spaceId, @Nullable String rootPageId, int maxDepth) throws ContentException;

    /**
     * Ancestors of the page from the root down to the page itself.
     */
    @NotNull
    List<BreadcrumbItem> getBreadcrumb(@NotNull String pageId) throws ContentException;

    @NotNull
    List<Page> getChildren(@NotNull String spaceId, @Nullable String parentId) throws ContentException;

    /**
     * Other children of the page's parent, in position order.
     */
    @NotNull
    List<Page> getSiblings(@NotNull String pageId) throws ContentException;

    @NotNull
    Page publish(@NotNull String pageId, @NotNull String actorId) throws ContentException;

    @NotNull
    Page unpublish(@NotNull String pageId, @NotNull String actorId) throws ContentException;

    /**
     * Soft deletes the page and its descendants.
     */
    void deletePage(@NotNull String pageId, @NotNull String actorId) throws ContentException;

    /**
     * Deletes the page and its descendants. A permanent delete also removes
     * their blocks and versions, and works on soft deleted pages too; it is
     * refused while a page is still synced to a repository file.
     */
    void deletePage(@NotNull String pageId, boolean permanent, @NotNull String actorId) throws ContentException;

    /**
     * Copies a page with its content next to the original, using the slug
     * {@code <slug>-copy} (or {@code <slug>-copy-2}, ...).
     */
    @NotNull
    Page duplicatePage(@NotNull String pageId, @NotNull String actorId) throws ContentException;

    /**
     * Like {@link #duplicatePage(String, String)}, optionally copying all
     * live descendants below the copy with their slugs and titles.
     */
    @NotNull
    Page duplicatePage(@NotNull String pageId, boolean includeChildren, @NotNull String actorId)
            throws ContentException;
}
