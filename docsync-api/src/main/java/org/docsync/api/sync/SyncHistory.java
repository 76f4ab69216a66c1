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
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.Nullable;

/**
 * Audit record of one sync run. Once {@link #getCompletedAt()} is set the
 * record can no longer be changed.
 */
public class SyncHistory {

    private String id;
    private String configId;
    private SyncOperation operation;
    private SyncDirection direction;
    private String startCommit;
    private String endCommit;
    private SyncStatus status = SyncStatus.SYNCING;
    private int filesProcessed;
    private int pagesCreated;
    private int pagesUpdated;
    private int pagesDeleted;
    private List<String> errors = ImmutableList.of();
    private List<String> conflicts = ImmutableList.of();
    private long startedAt;
    private Long completedAt;
    private Long durationMs;
    private String triggeredBy;
    private Map<String, String> metadata = ImmutableMap.of();

    public SyncHistory() {
    }

    public SyncHistory(SyncHistory other) {
        this.id = other.id;
        this.configId = other.configId;
        this.operation = other.operation;
        this.direction = other.direction;
        this.startCommit = other.startCommit;
        this.endCommit = other.endCommit;
        this.status = other.status;
        this.filesProcessed = other.filesProcessed;
        this.pagesCreated = other.pagesCreated;
        this.pagesUpdated = other.pagesUpdated;
        this.pagesDeleted = other.pagesDeleted;
        this.errors = other.errors;
        this.conflicts = other.conflicts;
        this.startedAt = other.startedAt;
        this.completedAt = other.completedAt;
        this.durationMs = other.durationMs;
        this.triggeredBy = other.triggeredBy;
        this.metadata = other.metadata;
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

    public SyncOperation getOperation() {
        return operation;
    }

    public void setOperation(SyncOperation operation) {
        this.operation = operation;
    }

    public SyncDirection getDirection() {
        return direction;
    }

    public void setDirection(SyncDirection direction) {
        this.direction = direction;
    }

    @Nullable
    public String getStartCommit() {
        return startCommit;
    }

    public void setStartCommit(@Nullable String startCommit) {
        this.startCommit = startCommit;
    }

    @Nullable
    public String getEndCommit() {
        return endCommit;
    }

    public void setEndCommit(@Nullable String endCommit) {
        this.endCommit = endCommit;
    }

    public SyncStatus getStatus() {
        return status;
    }

    public void setStatus(SyncStatus status) {
        this.status = status;
    }

    public int getFilesProcessed() {
        return filesProcessed;
    }

    public void setFilesProcessed(int filesProcessed) {
        this.filesProcessed = filesProcessed;
    }

    public int getPagesCreated() {
        return pagesCreated;
    }

    public void setPagesCreated(int pagesCreated) {
        this.pagesCreated = pagesCreated;
    }

    public int getPagesUpdated() {
        return pagesUpdated;
    }

    public void setPagesUpdated(int pagesUpdated) {
        this.pagesUpdated = pagesUpdated;
    }

    public int getPagesDeleted() {
        return pagesDeleted;
    }

    public void setPagesDeleted(int pagesDeleted) {
        this.pagesDeleted = pagesDeleted;
    }

    public List<String> getErrors() {
        return errors;
    }

    public void setErrors(List<String> errors) {
        this.errors = ImmutableList.copyOf(errors);
    }

    /**
     * Paths of the pages left in conflict by this run.
     */
    public List<String> getConflicts() {
        return conflicts;
    }

    public void setConflicts(List<String> conflicts) {
        this.conflicts = ImmutableList.copyOf(conflicts);
    }

    public long getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(long startedAt) {
        this.startedAt = startedAt;
    }

    @Nullable
    public Long getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(@Nullable Long completedAt) {
        this.completedAt = completedAt;
    }

    public boolean isCompleted() {
        return completedAt != null;
    }

    @Nullable
    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(@Nullable Long durationMs) {
        this.durationMs = durationMs;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }

    public void setTriggeredBy(String triggeredBy) {
        this.triggeredBy = triggeredBy;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, String> metadata) {
        this.metadata = ImmutableMap.copyOf(metadata);
    }
}
