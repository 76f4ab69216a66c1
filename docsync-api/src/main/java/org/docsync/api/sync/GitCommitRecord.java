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

package org.docsync.api.sync;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

/**
 * A commit seen or created by a repository binding. The commit sha is unique
 * per binding.
 */
public class GitCommitRecord {

    private String id;
    private String configId;
    private String sha;
    private String message;
    private String authorId;
    private long committedAt;
    private SyncDirection direction;
    private String changeRequestId;
    private List<String> filesChanged = ImmutableList.of();
    private CommitResult result = CommitResult.PENDING;
    private String syncHistoryId;
    private String errorMessage;

    public GitCommitRecord() {
    }

    public GitCommitRecord(GitCommitRecord other) {
        this.id = other.id;
        this.configId = other.configId;
        this.sha = other.sha;
        this.message = other.message;
        this.authorId = other.authorId;
        this.committedAt = other.committedAt;
        this.direction = other.direction;
        this.changeRequestId = other.changeRequestId;
        this.filesChanged = other.filesChanged;
        this.result = other.result;
        this.syncHistoryId = other.syncHistoryId;
        this.errorMessage = other.errorMessage;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getConfigId() {
        return configId;
    }

    public void setConfigId(String configId) {
        this.configId = configId;
    }

    public String getSha() {
        return sha;
    }

    public void setSha(String sha) {
        this.sha = sha;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getAuthorId() {
        return authorId;
    }

    public void setAuthorId(String authorId) {
        this.authorId = authorId;
    }

    public long getCommittedAt() {
        return committedAt;
    }

    public void setCommittedAt(long committedAt) {
        this.committedAt = committedAt;
    }

    public SyncDirection getDirection() {
        return direction;
    }

    public void setDirection(SyncDirection direction) {
        this.direction = direction;
    }

    @Nullable
    public String getChangeRequestId() {
        return changeRequestId;
    }

    public void setChangeRequestId(@Nullable String changeRequestId) {
        this.changeRequestId = changeRequestId;
    }

    public List<String> getFilesChanged() {
        return filesChanged;
    }

    public void setFilesChanged(List<String> filesChanged) {
        this.filesChanged = ImmutableList.copyOf(filesChanged);
    }

    public CommitResult getResult() {
        return result;
    }

    public void setResult(CommitResult result) {
        this.result = result;
    }

    @Nullable
    public String getSyncHistoryId() {
        return syncHistoryId;
    }

    public void setSyncHistoryId(@Nullable String syncHistoryId) {
        this.syncHistoryId = syncHistoryId;
    }

    @Nullable
    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(@Nullable String errorMessage) {
        this.errorMessage = errorMessage;
    }
}
