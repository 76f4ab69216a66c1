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

package org.docsync.api.content;

import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.Nullable;

/**
 * A page in the content tree of a space. Root pages have no parent and
 * depth 0. The path of a page is the path of its parent followed by its
 * slug, e.g. {@code /guide/setup}.
 */
public class Page {

    private String id;
    private String spaceId;
    private String parentId;
    private String slug;
    private String title;
    private String path;
    private int depth;
    private int position;
    private boolean published;
    private Long publishedAt;
    private Long deletedAt;
    private long createdAt;
    private String createdBy;
    private long updatedAt;
    private String updatedBy;
    private PageConflict conflict;
    private String syncedPath;

    public Page() {
    }

    public Page(Page other) {
        this.id = other.id;
        this.spaceId = other.spaceId;
        this.parentId = other.parentId;
        this.slug = other.slug;
        this.title = other.title;
        this.path = other.path;
        this.depth = other.depth;
        this.position = other.position;
        this.published = other.published;
        this.publishedAt = other.publishedAt;
        this.deletedAt = other.deletedAt;
        this.createdAt = other.createdAt;
        this.createdBy = other.createdBy;
        this.updatedAt = other.updatedAt;
        this.updatedBy = other.updatedBy;
        this.conflict = other.conflict;
        this.syncedPath = other.syncedPath;
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

    @Nullable
    public String getParentId() {
        return parentId;
    }

    public void setParentId(@Nullable String parentId) {
        this.parentId = parentId;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public boolean isPublished() {
        return published;
    }

    public void setPublished(boolean published) {
        this.published = published;
    }

    @Nullable
    public Long getPublishedAt() {
        return publishedAt;
    }

    public void setPublishedAt(@Nullable Long publishedAt) {
        this.publishedAt = publishedAt;
    }

    /**
     * Soft delete marker.
     */
    @Nullable
    public Long getDeletedAt() {
        return deletedAt;
    }

    public void setDeletedAt(@Nullable Long deletedAt) {
        this.deletedAt = deletedAt;
    }

    public boolean isDeleted() {
        return deletedAt != null;
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

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public void setUpdatedBy(String updatedBy) {
        this.updatedBy = updatedBy;
    }

    /**
     * The unresolved conflict of this page, or {@code null}.
     */
    @Nullable
    public PageConflict getConflict() {
        return conflict;
    }

    public void setConflict(@Nullable PageConflict conflict) {
        this.conflict = conflict;
    }

    public boolean hasConflict() {
        return conflict != null;
    }

    /**
     * The repository file this page was last written to or read from, for
     * example {@code docs/guide/setup.md}, or {@code null} if it was never
     * synced.
     */
    @Nullable
    public String getSyncedPath() {
        return syncedPath;
    }

    public void setSyncedPath(@Nullable String syncedPath) {
        this.syncedPath = syncedPath;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("id", id)
                .add("spaceId", spaceId)
                .add("path", path)
                .add("depth", depth)
                .add("position", position)
                .add("deletedAt", deletedAt)
                .toString();
    }
}
