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

import org.jetbrains.annotations.Nullable;

/**
 * Immutable snapshot of a page's content. Version numbers of a page start
 * at 1 and increase by one with every snapshot.
 */
public class PageVersion {

    private String id;
    private String pageId;
    private int versionNumber;
    private PageContent content;
    private String authorId;
    private String changeSummary;
    private String commitSha;
    private long createdAt;

    public PageVersion() {
    }

    public PageVersion(PageVersion other) {
        this.id = other.id;
        this.pageId = other.pageId;
        this.versionNumber = other.versionNumber;
        this.content = other.content;
        this.authorId = other.authorId;
        this.changeSummary = other.changeSummary;
        this.commitSha = other.commitSha;
        this.createdAt = other.createdAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPageId() {
        return pageId;
    }

    public void setPageId(String pageId) {
        this.pageId = pageId;
    }

    public int getVersionNumber() {
        return versionNumber;
    }

    public void setVersionNumber(int versionNumber) {
        this.versionNumber = versionNumber;
    }

    public PageContent getContent() {
        return content;
    }

    public void setContent(PageContent content) {
        this.content = content;
    }

    public String getAuthorId() {
        return authorId;
    }

    public void setAuthorId(String authorId) {
        this.authorId = authorId;
    }

    @Nullable
    public String getChangeSummary() {
        return changeSummary;
    }

    public void setChangeSummary(@Nullable String changeSummary) {
        this.changeSummary = changeSummary;
    }

    /**
     * The commit this version was created from or pushed with, if any.
     */
    @Nullable
    public String getCommitSha() {
        return commitSha;
    }

    public void setCommitSha(@Nullable String commitSha) {
        this.commitSha = commitSha;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }
}
