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
import org.docsync.api.content.PageContent;
import org.jetbrains.annotations.Nullable;

/**
 * A proposed change to one page. {@code before} is the content the change
 * was proposed against (absent for creations), {@code after} the proposed
 * content (absent for deletions).
 */
public class ChangeRequestChange {

    private String id;
    private String changeRequestId;
    private String pageId;
    private ChangeType changeType;
    private PageContent before;
    private PageContent after;
    private List<BlockDiff> blockDiffs = ImmutableList.of();
    private String parentId;
    private String slug;
    private boolean conflict;
    private PageContent conflictContent;
    private long createdAt;
    private String createdBy;

    public ChangeRequestChange() {
    }

    public ChangeRequestChange(ChangeRequestChange other) {
        this.id = other.id;
        this.changeRequestId = other.changeRequestId;
        this.pageId = other.pageId;
        this.changeType = other.changeType;
        this.before = other.before;
        this.after = other.after;
        this.blockDiffs = other.blockDiffs;
        this.parentId = other.parentId;
        this.slug = other.slug;
        this.conflict = other.conflict;
        this.conflictContent = other.conflictContent;
        this.createdAt = other.createdAt;
        this.createdBy = other.createdBy;
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

    /**
     * The affected page, {@code null} for a page that is yet to be created.
     */
    @Nullable
    public String getPageId() {
        return pageId;
    }

    public void setPageId(@Nullable String pageId) {
        this.pageId = pageId;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public void setChangeType(ChangeType changeType) {
        this.changeType = changeType;
    }

    @Nullable
    public PageContent getBefore() {
        return before;
    }

    public void setBefore(@Nullable PageContent before) {
        this.before = before;
    }

    @Nullable
    public PageContent getAfter() {
        return after;
    }

    public void setAfter(@Nullable PageContent after) {
        this.after = after;
    }

    public List<BlockDiff> getBlockDiffs() {
        return blockDiffs;
    }

    public void setBlockDiffs(List<BlockDiff> blockDiffs) {
        this.blockDiffs = ImmutableList.copyOf(blockDiffs);
    }

    /**
     * Parent of a page to create.
     */
    @Nullable
    public String getParentId() {
        return parentId;
    }

    public void setParentId(@Nullable String parentId) {
        this.parentId = parentId;
    }

    /**
     * Slug of a page to create.
     */
    @Nullable
    public String getSlug() {
        return slug;
    }

    public void setSlug(@Nullable String slug) {
        this.slug = slug;
    }

    public boolean isConflict() {
        return conflict;
    }

    public void setConflict(boolean conflict) {
        this.conflict = conflict;
    }

    /**
     * Content of the target page when the conflict was detected.
     */
    @Nullable
    public PageContent getConflictContent() {
        return conflictContent;
    }

    public void setConflictContent(@Nullable PageContent conflictContent) {
        this.conflictContent = conflictContent;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }
}
