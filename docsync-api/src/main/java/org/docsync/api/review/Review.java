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

package org.docsync.api.review;

import org.jetbrains.annotations.Nullable;

/**
 * The review of one reviewer on a change request. There is at most one per
 * reviewer; a new decision replaces the previous one.
 */
public class Review {

    private String id;
    private String changeRequestId;
    private String reviewerId;
    private ReviewStatus status = ReviewStatus.PENDING;
    private String body;
    private Long submittedAt;

    public Review() {
    }

    public Review(Review other) {
        this.id = other.id;
        this.changeRequestId = other.changeRequestId;
        this.reviewerId = other.reviewerId;
        this.status = other.status;
        this.body = other.body;
        this.submittedAt = other.submittedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getChangeRequestId() {
        return changeRequestId;
    }

    public void setChangeRequestId(String changeRequestId) {
        this.changeRequestId = changeRequestId;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public void setReviewerId(String reviewerId) {
        this.reviewerId = reviewerId;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public void setStatus(ReviewStatus status) {
        this.status = status;
    }

    @Nullable
    public String getBody() {
        return body;
    }

    public void setBody(@Nullable String body) {
        this.body = body;
    }

    @Nullable
    public Long getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(@Nullable Long submittedAt) {
        this.submittedAt = submittedAt;
    }
}
