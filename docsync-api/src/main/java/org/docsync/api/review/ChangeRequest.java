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

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

public class ChangeRequest {

    private String id;
    private String spaceId;
    private String title;
    private String description;
    private ChangeRequestStatus status = ChangeRequestStatus.DRAFT;
    private String sourceBranch;
    private String targetBranch;
    private String createdBy;
    private List<String> reviewers = ImmutableList.of();
    private List<String> approvers = ImmutableList.of();
    private String mergedBy;
    private Long mergedAt;
    private String mergedCommitSha;
    private long createdAt;
    private long updatedAt;

    public ChangeRequest() {
    }

    public ChangeRequest(ChangeRequest other) {
        this.id = other.id;
        this.spaceId = other.spaceId;
        this.title = other.title;
        this.description = other.description;
        this.status = other.status;
        this.sourceBranch = other.sourceBranch;
        this.targetBranch = other.targetBranch;
        this.createdBy = other.createdBy;
        this.reviewers = other.reviewers;
        this.approvers = other.approvers;
        this.mergedBy = other.mergedBy;
        this.mergedAt = other.mergedAt;
        this.mergedCommitSha = other.mergedCommitSha;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSpaceId() {
        return spaceId;
    }

    public void setSpaceId(String spaceId) {
        this.spaceId = spaceId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    public void setDescription(@Nullable String description) {
        this.description = description;
    }

    public ChangeRequestStatus getStatus() {
        return status;
    }

    public void setStatus(ChangeRequestStatus status) {
        this.status = status;
    }

    public String getSourceBranch() {
        return sourceBranch;
    }

    public void setSourceBranch(String sourceBranch) {
        this.sourceBranch = sourceBranch;
    }

    public String getTargetBranch() {
        return targetBranch;
    }

    public void setTargetBranch(String targetBranch) {
        this.targetBranch = targetBranch;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public List<String> getReviewers() {
        return reviewers;
    }

    public void setReviewers(List<String> reviewers) {
        this.reviewers = ImmutableList.copyOf(reviewers);
    }

    public List<String> getApprovers() {
        return approvers;
    }

    public void setApprovers(List<String> approvers) {
        this.approvers = ImmutableList.copyOf(approvers);
    }

    @Nullable
    public String getMergedBy() {
        return mergedBy;
    }

    public void setMergedBy(@Nullable String mergedBy) {
        this.mergedBy = mergedBy;
    }

    @Nullable
    public Long getMergedAt() {
        return mergedAt;
    }

    public void setMergedAt(@Nullable Long mergedAt) {
        this.mergedAt = mergedAt;
    }

    @Nullable
    public String getMergedCommitSha() {
        return mergedCommitSha;
    }

    public void setMergedCommitSha(@Nullable String mergedCommitSha) {
        this.mergedCommitSha = mergedCommitSha;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }
}
