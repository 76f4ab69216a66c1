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

package org.docsync.spi.store;

import java.util.List;

import org.docsync.api.ContentException;
import org.docsync.api.content.Block;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageVersion;
import org.docsync.api.review.ChangeRequest;
import org.docsync.api.review.ChangeRequestChange;
import org.docsync.api.review.ChangeRequestComment;
import org.docsync.api.review.Review;
import org.docsync.api.review.ReviewPolicy;
import org.docsync.api.sync.GitBranch;
import org.docsync.api.sync.GitCommitRecord;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.api.sync.SyncHistory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * View of the store within one {@link ContentStore#read read} or
 * {@link ContentStore#write write}. Entities are copied in and out: changing
 * a returned object has no effect until it is put back. Changes made in a
 * write session are visible to later calls of the same session.
 * <p>
 * The {@code put} and {@code add} methods throw {@link IllegalStateException}
 * in a read session.
 */
public interface StoreSession {

    /**
     * Returns a new unique identifier.
     */
    @NotNull
    String newId();

    // pages

    /**
     * Returns the page with the given id, soft deleted pages included.
     */
    @Nullable
    Page getPage(@NotNull String pageId);

    /**
     * Returns the live page with the given path.
     */
    @Nullable
    Page getPageByPath(@NotNull String spaceId, @NotNull String path);

    /**
     * Live children of a parent ({@code null} for the root pages of the
     * space), ordered by position.
     */
    @NotNull
    List<Page> getChildren(@NotNull String spaceId, @Nullable String parentId);

    /**
     * All pages of a space ordered by path, soft deleted pages included.
     */
    @NotNull
    List<Page> getPages(@NotNull String spaceId);

    void putPage(@NotNull Page page) throws ContentException;

    /**
     * Removes a page together with its blocks and versions.
     *
     * @throws ContentException NotFound if there is no such page, Conflict if
     *         it still has child pages, soft deleted ones included
     */
    void removePage(@NotNull String pageId) throws ContentException;

    // blocks

    /**
     * Blocks of a page, parents before children and siblings by position.
     */
    @NotNull
    List<Block> getBlocks(@NotNull String pageId);

    @Nullable
    Block getBlock(@NotNull String blockId);

    /**
     * Replaces all blocks of a page.
     */
    void setBlocks(@NotNull String pageId, @NotNull List<Block> blocks) throws ContentException;

    // versions

    /**
     * Versions of a page ordered by version number.
     */
    @NotNull
    List<PageVersion> getVersions(@NotNull String pageId);

    @Nullable
    PageVersion getVersion(@NotNull String pageId, int versionNumber);

    void addVersion(@NotNull PageVersion version) throws ContentException;

    // sync configs, commits, branches and history

    @Nullable
    GitSyncConfig getSyncConfig(@NotNull String configId);

    @Nullable
    GitSyncConfig getSyncConfigForSpace(@NotNull String spaceId);

    @NotNull
    List<GitSyncConfig> getSyncConfigs();

    void putSyncConfig(@NotNull GitSyncConfig config) throws ContentException;

    @Nullable
    GitCommitRecord getCommit(@NotNull String configId, @NotNull String sha);

    /**
     * Commits of a config in the order they were first recorded.
     */
    @NotNull
    List<GitCommitRecord> getCommits(@NotNull String configId);

    void putCommit(@NotNull GitCommitRecord commit) throws ContentException;

    @NotNull
    List<GitBranch> getBranches(@NotNull String configId);

    @Nullable
    GitBranch getBranch(@NotNull String configId, @NotNull String name);

    /**
     * Adds or updates a branch. The first branch of a config becomes its
     * default branch; making a branch the default clears the flag of the
     * previous default.
     */
    void putBranch(@NotNull GitBranch branch) throws ContentException;

    @Nullable
    SyncHistory getSyncHistory(@NotNull String historyId);

    /**
     * History records of a config, most recently started first.
     */
    @NotNull
    List<SyncHistory> getSyncHistories(@NotNull String configId);

    void putSyncHistory(@NotNull SyncHistory history) throws ContentException;

    // change requests

    @Nullable
    ChangeRequest getChangeRequest(@NotNull String changeRequestId);

    @NotNull
    List<ChangeRequest> getChangeRequests(@NotNull String spaceId);

    void putChangeRequest(@NotNull ChangeRequest changeRequest) throws ContentException;

    @Nullable
    ChangeRequestChange getChange(@NotNull String changeId);

    @NotNull
    List<ChangeRequestChange> getChanges(@NotNull String changeRequestId);

    void putChange(@NotNull ChangeRequestChange change) throws ContentException;

    void removeChange(@NotNull String changeId);

    @Nullable
    Review getReview(@NotNull String changeRequestId, @NotNull String reviewerId);

    @NotNull
    List<Review> getReviews(@NotNull String changeRequestId);

    /**
     * Inserts or replaces the review of a reviewer. A replaced review keeps
     * its id.
     */
    void putReview(@NotNull Review review) throws ContentException;

    @Nullable
    ChangeRequestComment getComment(@NotNull String commentId);

    @NotNull
    List<ChangeRequestComment> getComments(@NotNull String changeRequestId);

    void putComment(@NotNull ChangeRequestComment comment) throws ContentException;

    @Nullable
    ReviewPolicy getReviewPolicy(@NotNull String spaceId);

    void putReviewPolicy(@NotNull ReviewPolicy policy);
}
