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
 * A comment on a change request. Replies point to their parent comment;
 * a comment may be anchored to a page of the request.
 */
public class ChangeRequestComment {

    private String id;
    private String changeRequestId;
    private String parentId;
    private String pageId;
    private String authorId;
    private String body;
    private boolean resolved;
    private String resolvedBy;
    private long createdAt;

    public ChangeRequestComment() {
    }

    public ChangeRequestComment(ChangeRequestComment other) {
        this.id = other.id;
        this.changeRequestId = other.changeRequestId;
        this.parentId = other.parentId;
        this.pageId = other.pageId;
        this.authorId = other.authorId;
        this.body = other.body;
        this.resolved = other.resolved;
        this.resolvedBy = other.resolvedBy;
        this.createdAt = other.createdAt;
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

    @Nullable
    public String getParentId() {
        return parentId;
    }

    public void setParentId(@Nullable String parentId) {
        this.parentId = parentId;
    }

    @Nullable
    public String getPageId() {
        return pageId;
    }

    public void setPageId(@Nullable String pageId) {
        this.pageId = pageId;
    }

    public String getAuthorId() {
        return authorId;
    }

    public void setAuthorId(String authorId) {
        this.authorId = authorId;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public boolean isResolved() {
        return resolved;
    }

    public void setResolved(boolean resolved) {
        this.resolved = resolved;
    }

    @Nullable
    public String getResolvedBy() {
        return resolvedBy;
    }

    public void setResolvedBy(@Nullable String resolvedBy) {
        this.resolvedBy = resolvedBy;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }
}
