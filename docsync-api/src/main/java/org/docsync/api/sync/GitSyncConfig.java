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
 * Binding of a space to a repository. A space has at most one binding.
 */
public class GitSyncConfig {

    public static final String DEFAULT_BRANCH = "main";
    public static final String DEFAULT_ROOT_PATH = "./docs";
    public static final List<String> DEFAULT_INCLUDE_PATTERNS = ImmutableList.of("**/*.md", "**/*.mdx");
    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = ImmutableList.of("node_modules/**", ".git/**");
    public static final String DEFAULT_COMMIT_MESSAGE_TEMPLATE = "docs: {summary} [docsync]";

    private String id;
    private String spaceId;
    private String repositoryUrl;
    private String defaultBranch = DEFAULT_BRANCH;
    private String rootPath = DEFAULT_ROOT_PATH;
    private List<String> includePatterns = DEFAULT_INCLUDE_PATTERNS;
    private List<String> excludePatterns = DEFAULT_EXCLUDE_PATTERNS;
    private String commitMessageTemplate = DEFAULT_COMMIT_MESSAGE_TEMPLATE;
    private SyncStatus syncStatus = SyncStatus.IDLE;
    private String activeSyncId;
    private Long syncStartedAt;
    private String lastSyncCommit;
    private Long lastSyncAt;
    private String lastError;
    private String webhookId;
    private String webhookSecret;
    private boolean webhookActive;
    private boolean autoSync = true;
    private long createdAt;
    private String createdBy;

    public GitSyncConfig() {
    }

    public GitSyncConfig(GitSyncConfig other) {
        this.id = other.id;
        this.spaceId = other.spaceId;
        this.repositoryUrl = other.repositoryUrl;
        this.defaultBranch = other.defaultBranch;
        this.rootPath = other.rootPath;
        this.includePatterns = other.includePatterns;
        this.excludePatterns = other.excludePatterns;
        this.commitMessageTemplate = other.commitMessageTemplate;
        this.syncStatus = other.syncStatus;
        this.activeSyncId = other.activeSyncId;
        this.syncStartedAt = other.syncStartedAt;
        this.lastSyncCommit = other.lastSyncCommit;
        this.lastSyncAt = other.lastSyncAt;
        this.lastError = other.lastError;
        this.webhookId = other.webhookId;
        this.webhookSecret = other.webhookSecret;
        this.webhookActive = other.webhookActive;
        this.autoSync = other.autoSync;
        this.createdAt = other.createdAt;
        this.createdBy = other.createdBy;
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

    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    public void setRepositoryUrl(String repositoryUrl) {
        this.repositoryUrl = repositoryUrl;
    }

    public String getDefaultBranch() {
        return defaultBranch;
    }

    public void setDefaultBranch(String defaultBranch) {
        this.defaultBranch = defaultBranch;
    }

    public String getRootPath() {
        return rootPath;
    }

    public void setRootPath(String rootPath) {
        this.rootPath = rootPath;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public void setIncludePatterns(List<String> includePatterns) {
        this.includePatterns = ImmutableList.copyOf(includePatterns);
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public void setExcludePatterns(List<String> excludePatterns) {
        this.excludePatterns = ImmutableList.copyOf(excludePatterns);
    }

    public String getCommitMessageTemplate() {
        return commitMessageTemplate;
    }

    public void setCommitMessageTemplate(String commitMessageTemplate) {
        this.commitMessageTemplate = commitMessageTemplate;
    }

    public SyncStatus getSyncStatus() {
        return syncStatus;
    }

    public void setSyncStatus(SyncStatus syncStatus) {
        this.syncStatus = syncStatus;
    }

    /**
     * Id of the sync history row of the run holding the sync mutex.
     */
    @Nullable
    public String getActiveSyncId() {
        return activeSyncId;
    }

    public void setActiveSyncId(@Nullable String activeSyncId) {
        this.activeSyncId = activeSyncId;
    }

    @Nullable
    public Long getSyncStartedAt() {
        return syncStartedAt;
    }

    public void setSyncStartedAt(@Nullable Long syncStartedAt) {
        this.syncStartedAt = syncStartedAt;
    }

    @Nullable
    public String getLastSyncCommit() {
        return lastSyncCommit;
    }

    public void setLastSyncCommit(@Nullable String lastSyncCommit) {
        this.lastSyncCommit = lastSyncCommit;
    }

    @Nullable
    public Long getLastSyncAt() {
        return lastSyncAt;
    }

    public void setLastSyncAt(@Nullable Long lastSyncAt) {
        this.lastSyncAt = lastSyncAt;
    }

    @Nullable
    public String getLastError() {
        return lastError;
    }

    public void setLastError(@Nullable String lastError) {
        this.lastError = lastError;
    }

    @Nullable
    public String getWebhookId() {
        return webhookId;
    }

    public void setWebhookId(@Nullable String webhookId) {
        this.webhookId = webhookId;
    }

    @Nullable
    public String getWebhookSecret() {
        return webhookSecret;
    }

    public void setWebhookSecret(@Nullable String webhookSecret) {
        this.webhookSecret = webhookSecret;
    }

    public boolean isWebhookActive() {
        return webhookActive;
    }

    public void setWebhookActive(boolean webhookActive) {
        this.webhookActive = webhookActive;
    }

    public boolean isAutoSync() {
        return autoSync;
    }

    public void setAutoSync(boolean autoSync) {
        this.autoSync = autoSync;
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
