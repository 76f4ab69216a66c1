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

import org.docsync.api.content.PageContent;
import org.docsync.api.content.ResolutionChoice;
import org.docsync.api.review.ChangeRequest;
import org.docsync.api.review.ChangeRequestAction;
import org.docsync.api.review.ChangeRequestChange;
import org.docsync.api.review.ChangeRequestComment;
import org.docsync.api.review.MergeResult;
import org.docsync.api.review.Review;
import org.docsync.api.review.ReviewPolicy;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Isolated, reviewable sets of page changes and their merge into a target
 * branch.
 */
public interface ChangeRequestManager {

    @NotNull
    ChangeRequest createChangeRequest(@NotNull String spaceId, @NotNull String title,
                                      @NotNull String sourceBranch, @NotNull String targetBranch,
                                      @NotNull String actorId) throws ContentException;

    @NotNull
    ChangeRequest getChangeRequest(@NotNull String changeRequestId) throws ContentException;

    @NotNull
    List<ChangeRequest> getChangeRequests(@NotNull String spaceId) throws ContentException;

    @NotNull
    ChangeRequest addReviewer(@NotNull String changeRequestId, @NotNull String reviewerId,
                              @NotNull String actorId) throws ContentException;

    /**
     * Proposes new content for an existing page. A second proposal for the
     * same page replaces the first.
     */
    @NotNull
    ChangeRequestChange proposeUpdate(@NotNull String changeRequestId, @NotNull String pageId,
                                      @NotNull PageContent content, @NotNull String actorId) throws ContentException;

    @NotNull
    ChangeRequestChange proposePage(@NotNull String changeRequestId, @Nullable String parentId,
                                    @NotNull String slug, @NotNull PageContent content,
                                    @NotNull String actorId) throws ContentException;

    @NotNull
    ChangeRequestChange proposeDeletion(@NotNull String changeRequestId, @NotNull String pageId,
                                        @NotNull String actorId) throws ContentException;

    @NotNull
    List<ChangeRequestChange> getChanges(@NotNull String changeRequestId) throws ContentException;

    /**
     * Applies a state machine action.
     *
     * @throws ContentException Forbidden for an invalid transition or if the
     *         actor does not have the required role
     */
    @NotNull
    ChangeRequest transitionChangeRequest(@NotNull String changeRequestId, @NotNull ChangeRequestAction action,
                                          @NotNull String actorId) throws ContentException;

    @NotNull
    ChangeRequest transitionChangeRequest(@NotNull String changeRequestId, @NotNull ChangeRequestAction action,
                                          @NotNull String actorId, @Nullable String body) throws ContentException;

    @NotNull
    List<Review> getReviews(@NotNull String changeRequestId) throws ContentException;

    /**
     * Compares every change with the current content of its page and updates
     * the conflict markers.
     *
     * @return the changes that are in conflict
     */
    @NotNull
    List<ChangeRequestChange> refreshConflicts(@NotNull String changeRequestId) throws ContentException;

    /**
     * Resolves the conflict of a change. {@code KEEP_LOCAL} keeps the target
     * content (the change becomes empty), {@code TAKE_REMOTE} keeps the
     * proposal and {@code MERGED} replaces the proposal with {@code content}.
     */
    @NotNull
    ChangeRequestChange resolveChangeConflict(@NotNull String changeRequestId, @NotNull String changeId,
                                              @NotNull ResolutionChoice choice, @Nullable PageContent content,
                                              @NotNull String actorId) throws ContentException;

    /**
     * Atomically applies all changes to the target pages.
     *
     * @throws ContentException Forbidden if the request is not approved (and
     *         the space requires approval), Conflict if a change conflicts with
     *         the target, External if the repository rejects the commit
     */
    @NotNull
    MergeResult mergeChangeRequest(@NotNull String changeRequestId, @NotNull String actorId) throws ContentException;

    @NotNull
    ChangeRequestComment addComment(@NotNull String changeRequestId, @Nullable String parentCommentId,
                                    @Nullable String pageId, @NotNull String body,
                                    @NotNull String actorId) throws ContentException;

    @NotNull
    ChangeRequestComment resolveComment(@NotNull String changeRequestId, @NotNull String commentId,
                                        @NotNull String actorId) throws ContentException;

    @NotNull
    List<ChangeRequestComment> getComments(@NotNull String changeRequestId) throws ContentException;

    @NotNull
    ReviewPolicy setReviewPolicy(@NotNull String spaceId, int requiredApprovals,
                                 @NotNull String actorId) throws ContentException;

    @NotNull
    ReviewPolicy getReviewPolicy(@NotNull String spaceId) throws ContentException;
}
