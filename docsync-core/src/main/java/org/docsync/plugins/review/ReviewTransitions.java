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

package org.docsync.plugins.review;

import static org.docsync.api.ContentException.FORBIDDEN;

import java.util.EnumSet;
import java.util.Set;

import org.docsync.api.ContentException;
import org.docsync.api.review.ChangeRequest;
import org.docsync.api.review.ChangeRequestAction;
import org.docsync.api.review.ChangeRequestStatus;
import org.jetbrains.annotations.NotNull;

/**
 * The change request state machine. Each action is taken either by the
 * creator of a request or by one of its assigned reviewers, and is allowed
 * from a fixed set of states.
 */
final class ReviewTransitions {

    enum Role {
        CREATOR,
        REVIEWER
    }

    private static final Set<ChangeRequestStatus> UNDER_REVIEW = EnumSet.of(
            ChangeRequestStatus.PENDING_REVIEW, ChangeRequestStatus.IN_REVIEW);

    private static final Set<ChangeRequestStatus> SUBMITTED = EnumSet.of(
            ChangeRequestStatus.PENDING_REVIEW, ChangeRequestStatus.IN_REVIEW, ChangeRequestStatus.APPROVED);

    private static final Set<ChangeRequestStatus> OPEN = EnumSet.of(
            ChangeRequestStatus.DRAFT, ChangeRequestStatus.PENDING_REVIEW, ChangeRequestStatus.IN_REVIEW,
            ChangeRequestStatus.APPROVED, ChangeRequestStatus.REJECTED);

    private ReviewTransitions() {
    }

    static Role roleOf(@NotNull ChangeRequestAction action) {
        switch (action) {
            case SUBMIT:
            case CLOSE:
            case REOPEN:
                return Role.CREATOR;
            default:
                return Role.REVIEWER;
        }
    }

    static Set<ChangeRequestStatus> sourcesOf(@NotNull ChangeRequestAction action) {
        switch (action) {
            case SUBMIT:
                return EnumSet.of(ChangeRequestStatus.DRAFT);
            case START_REVIEW:
                return EnumSet.of(ChangeRequestStatus.PENDING_REVIEW);
            case APPROVE:
            case REJECT:
                return UNDER_REVIEW;
            case COMMENT:
                return SUBMITTED;
            case CLOSE:
                return OPEN;
            case REOPEN:
                return EnumSet.of(ChangeRequestStatus.REJECTED, ChangeRequestStatus.CLOSED);
            default:
                throw new IllegalArgumentException("Unknown action " + action);
        }
    }

    /**
     * Checks that the actor may take the action on the request in its current
     * state.
     *
     * @throws ContentException Forbidden otherwise
     */
    static void check(@NotNull ChangeRequest cr, @NotNull ChangeRequestAction action, @NotNull String actorId)
            throws ContentException {
        boolean creator = actorId.equals(cr.getCreatedBy());
        Role role = roleOf(action);
        if (role == Role.CREATOR && !creator) {
            throw new ContentException(FORBIDDEN, 51, "Only the creator of change request " + cr.getId()
                    + " may " + action);
        }
        if (role == Role.REVIEWER && creator) {
            throw new ContentException(FORBIDDEN, 52, "The creator of change request " + cr.getId()
                    + " may not " + action + " it");
        }
        if (role == Role.REVIEWER && !cr.getReviewers().contains(actorId)) {
            throw new ContentException(FORBIDDEN, 56, actorId + " is not a reviewer of change request "
                    + cr.getId());
        }
        if (!sourcesOf(action).contains(cr.getStatus())) {
            throw new ContentException(FORBIDDEN, 53, "Can not " + action + " change request " + cr.getId()
                    + " in state " + cr.getStatus());
        }
    }

    /**
     * The state after the action.
     *
     * @param approvals number of approving reviews after the action
     * @param requiredApprovals approvals required by the space
     */
    @NotNull
    static ChangeRequestStatus next(@NotNull ChangeRequestStatus current, @NotNull ChangeRequestAction action,
                                    int approvals, int requiredApprovals) {
        switch (action) {
            case SUBMIT:
                return ChangeRequestStatus.PENDING_REVIEW;
            case START_REVIEW:
                return ChangeRequestStatus.IN_REVIEW;
            case APPROVE:
                return approvals >= requiredApprovals
                        ? ChangeRequestStatus.APPROVED : ChangeRequestStatus.IN_REVIEW;
            case REJECT:
                return ChangeRequestStatus.REJECTED;
            case COMMENT:
                return current == ChangeRequestStatus.PENDING_REVIEW ? ChangeRequestStatus.IN_REVIEW : current;
            case CLOSE:
                return ChangeRequestStatus.CLOSED;
            case REOPEN:
                return ChangeRequestStatus.DRAFT;
            default:
                throw new IllegalArgumentException("Unknown action " + action);
        }
    }

    /**
     * Whether the request may be merged under the given approval requirement.
     */
    static boolean isMergeable(@NotNull ChangeRequestStatus status, int requiredApprovals) {
        return status == ChangeRequestStatus.APPROVED
                || (requiredApprovals == 0 && status.isSubmitted());
    }
}
