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

package org.docsync.plugins.memory;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.Lists.newArrayList;
import static org.docsync.api.ContentException.CONFLICT;
import static org.docsync.api.ContentException.NOT_FOUND;
import static org.docsync.api.ContentException.VALIDATION;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;
import org.docsync.api.ContentException;
import org.docsync.api.PageManager;
import org.docsync.api.content.Block;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageVersion;
import org.docsync.api.review.ChangeRequest;
import org.docsync.api.review.ChangeRequestChange;
import org.docsync.api.review.ChangeRequestComment;
import org.docsync.api.review.Review;
import org.docsync.api.review.ReviewPolicy;
import org.docsync.api.sync.GitBranch;
import org.docsync.api.sync.GitCommitRecord;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.api.sync.SyncHistory;
import org.docsync.commons.PathUtils;
import org.docsync.spi.store.ContentStore;
import org.docsync.spi.store.StoreOperation;
import org.docsync.spi.store.StoreSession;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Basic in-memory content store implementation. Useful for testing.
 * <p>
 * Writes are serialized. Each write works on a private copy of the current
 * state which replaces the current state only if the operation completes.
 * Readers always see the last completed write.
 */
public class MemoryContentStore implements ContentStore {

    private final AtomicReference<State> state = new AtomicReference<State>(new State());

    @Override
    public <T> T read(@NotNull StoreOperation<T> operation) throws ContentException {
        return operation.apply(new Session(state.get(), false));
    }

    @Override
    public synchronized <T> T write(@NotNull StoreOperation<T> operation) throws ContentException {
        State copy = new State(state.get());
        T result = operation.apply(new Session(copy, true));
        state.set(copy);
        return result;
    }

    @Override
    public String toString() {
        return "MemoryContentStore";
    }

    //------------------------------------------------------------< State >---

    private static final class State {

        final Map<String, Page> pages;
        final SetMultimap<String, String> children;
        final Map<String, String> paths;
        final Map<String, List<Block>> blocks;
        final Map<String, Block> blockIndex;
        final Map<String, List<PageVersion>> versions;
        final Map<String, GitSyncConfig> configs;
        final Map<String, String> configBySpace;
        final Map<String, GitCommitRecord> commits;
        final Map<String, GitBranch> branches;
        final Map<String, SyncHistory> histories;
        final Map<String, ChangeRequest> changeRequests;
        final Map<String, ChangeRequestChange> changes;
        final Map<String, Review> reviews;
        final Map<String, ChangeRequestComment> comments;
        final Map<String, ReviewPolicy> policies;

        State() {
            pages = new LinkedHashMap<String, Page>();
            children = HashMultimap.create();
            paths = new LinkedHashMap<String, String>();
            blocks = new LinkedHashMap<String, List<Block>>();
            blockIndex = new LinkedHashMap<String, Block>();
            versions = new LinkedHashMap<String, List<PageVersion>>();
            configs = new LinkedHashMap<String, GitSyncConfig>();
            configBySpace = new LinkedHashMap<String, String>();
            commits = new LinkedHashMap<String, GitCommitRecord>();
            branches = new LinkedHashMap<String, GitBranch>();
            histories = new LinkedHashMap<String, SyncHistory>();
            changeRequests = new LinkedHashMap<String, ChangeRequest>();
            changes = new LinkedHashMap<String, ChangeRequestChange>();
            reviews = new LinkedHashMap<String, Review>();
            comments = new LinkedHashMap<String, ChangeRequestComment>();
            policies = new LinkedHashMap<String, ReviewPolicy>();
        }

        /**
         * Shallow copy. Stored entities are never modified in place, so they
         * can be shared between states.
         */
        State(State other) {
            pages = new LinkedHashMap<String, Page>(other.pages);
            children = HashMultimap.create(other.children);
            paths = new LinkedHashMap<String, String>(other.paths);
            blocks = new LinkedHashMap<String, List<Block>>(other.blocks);
            blockIndex = new LinkedHashMap<String, Block>(other.blockIndex);
            versions = new LinkedHashMap<String, List<PageVersion>>(other.versions);
            configs = new LinkedHashMap<String, GitSyncConfig>(other.configs);
            configBySpace = new LinkedHashMap<String, String>(other.configBySpace);
            commits = new LinkedHashMap<String, GitCommitRecord>(other.commits);
            branches = new LinkedHashMap<String, GitBranch>(other.branches);
            histories = new LinkedHashMap<String, SyncHistory>(other.histories);
            changeRequests = new LinkedHashMap<String, ChangeRequest>(other.changeRequests);
            changes = new LinkedHashMap<String, ChangeRequestChange>(other.changes);
            reviews = new LinkedHashMap<String, Review>(other.reviews);
            comments = new LinkedHashMap<String, ChangeRequestComment>(other.comments);
            policies = new LinkedHashMap<String, ReviewPolicy>(other.policies);
        }
    }

    private static String childKey(String spaceId, @Nullable String parentId) {
        return spaceId + '|' + (parentId == null ? "" : parentId);
    }

    private static String pathKey(Page page) {
        return page.getSpaceId() + '|' + page.getPath();
    }

    private static String commitKey(String configId, String sha) {
        return configId + '|' + sha;
    }

    private static String reviewKey(String changeRequestId, String reviewerId) {
        return changeRequestId + '|' + reviewerId;
    }

    //----------------------------------------------------------< Session >---

    private static final class Session implements StoreSession {

        private static final Comparator<Page> BY_POSITION = new Comparator<Page>() {
            @Override
            public int compare(Page a, Page b) {
                int c = Integer.compare(a.getPosition(), b.getPosition());
                return c != 0 ? c : a.getPath().compareTo(b.getPath());
            }
        };

        private final State state;

        private final boolean writable;

        Session(State state, boolean writable) {
            this.state = state;
            this.writable = writable;
        }

        private void checkWritable() {
            checkState(writable, "Read-only session");
        }

        @NotNull
        @Override
        public String newId() {
            return UUID.randomUUID().toString();
        }

        //------------------------------------------------------< pages >---

        @Nullable
        @Override
        public Page getPage(@NotNull String pageId) {
            Page page = state.pages.get(pageId);
            return page == null ? null : new Page(page);
        }

        @Nullable
        @Override
        public Page getPageByPath(@NotNull String spaceId, @NotNull String path) {
            String id = state.paths.get(spaceId + '|' + path);
            return id == null ? null : getPage(id);
        }

        @NotNull
        @Override
        public List<Page> getChildren(@NotNull String spaceId, @Nullable String parentId) {
            List<Page> result = newArrayList();
            for (String id : state.children.get(childKey(spaceId, parentId))) {
                Page page = state.pages.get(id);
                if (!page.isDeleted()) {
                    result.add(new Page(page));
                }
            }
            Collections.sort(result, BY_POSITION);
            return result;
        }

        @NotNull
        @Override
        public List<Page> getPages(@NotNull String spaceId) {
            List<Page> result = newArrayList();
            for (Page page : state.pages.values()) {
                if (page.getSpaceId().equals(spaceId)) {
                    result.add(new Page(page));
                }
            }
            Collections.sort(result, new Comparator<Page>() {
                @Override
                public int compare(Page a, Page b) {
                    return a.getPath().compareTo(b.getPath());
                }
            });
            return result;
        }

        @Override
        public void putPage(@NotNull Page page) throws ContentException {
            checkWritable();
            checkNotNull(page.getId());
            checkNotNull(page.getSpaceId());
            Page previous = state.pages.get(page.getId());
            if (previous != null && !previous.getSpaceId().equals(page.getSpaceId())) {
                throw new ContentException(VALIDATION, 1,
                        "Page " + page.getId() + " can not change its space");
            }
            if (!page.isDeleted()) {
                checkHierarchy(page);
            }

            if (previous != null && !previous.isDeleted()) {
                state.paths.remove(pathKey(previous));
            }
            if (!page.isDeleted()) {
                String existing = state.paths.get(pathKey(page));
                if (existing != null && !existing.equals(page.getId())) {
                    throw new ContentException(CONFLICT, 1,
                            "Path " + page.getPath() + " already exists in space " + page.getSpaceId());
                }
                state.paths.put(pathKey(page), page.getId());
            }
            if (previous != null) {
                state.children.remove(childKey(previous.getSpaceId(), previous.getParentId()), previous.getId());
            }
            state.children.put(childKey(page.getSpaceId(), page.getParentId()), page.getId());
            state.pages.put(page.getId(), new Page(page));
        }

        @Override
        public void removePage(@NotNull String pageId) throws ContentException {
            checkWritable();
            Page page = state.pages.get(pageId);
            if (page == null) {
                throw new ContentException(NOT_FOUND, 2, "Page " + pageId + " not found");
            }
            if (!state.children.get(childKey(page.getSpaceId(), pageId)).isEmpty()) {
                throw new ContentException(CONFLICT, 9, "Page " + page.getPath() + " still has child pages");
            }
            if (pageId.equals(state.paths.get(pathKey(page)))) {
                state.paths.remove(pathKey(page));
            }
            state.children.remove(childKey(page.getSpaceId(), page.getParentId()), pageId);
            List<Block> blocks = state.blocks.remove(pageId);
            if (blocks != null) {
                for (Block block : blocks) {
                    state.blockIndex.remove(block.getId());
                }
            }
            state.versions.remove(pageId);
            state.pages.remove(pageId);
        }

        private void checkHierarchy(Page page) throws ContentException {
            if (page.getSlug() == null || page.getPath() == null) {
                throw new ContentException(VALIDATION, 2, "Page " + page.getId() + " has no slug or path");
            }
            String parentId = page.getParentId();
            if (parentId == null) {
                if (page.getDepth() != 0) {
                    throw new ContentException(VALIDATION, 3, "Root page " + page.getPath() + " must have depth 0");
                }
                if (!page.getPath().equals(PathUtils.concat(PathUtils.ROOT_PATH, page.getSlug()))) {
                    throw new ContentException(VALIDATION, 4, "Invalid path " + page.getPath()
                            + " for slug " + page.getSlug());
                }
                return;
            }
            Page parent = state.pages.get(parentId);
            if (parent == null || parent.isDeleted() || !parent.getSpaceId().equals(page.getSpaceId())) {
                throw new ContentException(NOT_FOUND, 1, "Parent page " + parentId + " not found");
            }
            // bounded ancestor walk from the parent, looking for the page itself
            Page ancestor = parent;
            for (int i = 0; ancestor != null; i++) {
                if (ancestor.getId().equals(page.getId())) {
                    throw new ContentException(CONFLICT, 2,
                            "Page " + page.getId() + " can not be its own ancestor");
                }
                if (i > PageManager.MAX_NESTING_DEPTH) {
                    throw new ContentException(VALIDATION, 5, "Hierarchy of " + page.getPath() + " is too deep");
                }
                ancestor = ancestor.getParentId() == null ? null : state.pages.get(ancestor.getParentId());
            }
            if (page.getDepth() != parent.getDepth() + 1) {
                throw new ContentException(VALIDATION, 6, "Depth of " + page.getPath() + " must be "
                        + (parent.getDepth() + 1));
            }
            if (page.getDepth() > PageManager.MAX_NESTING_DEPTH) {
                throw new ContentException(VALIDATION, 7, "Maximum nesting depth "
                        + PageManager.MAX_NESTING_DEPTH + " exceeded by " + page.getPath());
            }
            if (!page.getPath().equals(PathUtils.concat(parent.getPath(), page.getSlug()))) {
                throw new ContentException(VALIDATION, 4, "Invalid path " + page.getPath()
                        + " below " + parent.getPath());
            }
        }

        //-----------------------------------------------------< blocks >---

        @NotNull
        @Override
        public List<Block> getBlocks(@NotNull String pageId) {
            List<Block> result = newArrayList();
            List<Block> stored = state.blocks.get(pageId);
            if (stored != null) {
                for (Block block : stored) {
                    result.add(new Block(block));
                }
            }
            return result;
        }

        @Nullable
        @Override
        public Block getBlock(@NotNull String blockId) {
            Block block = state.blockIndex.get(blockId);
            return block == null ? null : new Block(block);
        }

        @Override
        public void setBlocks(@NotNull String pageId, @NotNull List<Block> blocks) throws ContentException {
            checkWritable();
            if (!state.pages.containsKey(pageId)) {
                throw new ContentException(NOT_FOUND, 2, "Page " + pageId + " not found");
            }
            Map<String, Block> added = new LinkedHashMap<String, Block>();
            for (Block block : blocks) {
                checkNotNull(block.getId());
                if (!pageId.equals(block.getPageId())) {
                    throw new ContentException(VALIDATION, 8, "Block " + block.getId()
                            + " does not belong to page " + pageId);
                }
                if (block.getParentId() != null && !added.containsKey(block.getParentId())) {
                    throw new ContentException(VALIDATION, 9, "Parent block " + block.getParentId()
                            + " of block " + block.getId() + " must precede it");
                }
                Block other = state.blockIndex.get(block.getId());
                if (added.containsKey(block.getId()) || (other != null && !other.getPageId().equals(pageId))) {
                    throw new ContentException(CONFLICT, 3, "Duplicate block id " + block.getId());
                }
                added.put(block.getId(), new Block(block));
            }
            List<Block> previous = state.blocks.get(pageId);
            if (previous != null) {
                for (Block block : previous) {
                    state.blockIndex.remove(block.getId());
                }
            }
            state.blockIndex.putAll(added);
            state.blocks.put(pageId, Collections.unmodifiableList(newArrayList(added.values())));
        }

        //---------------------------------------------------< versions >---

        @NotNull
        @Override
        public List<PageVersion> getVersions(@NotNull String pageId) {
            List<PageVersion> result = newArrayList();
            List<PageVersion> stored = state.versions.get(pageId);
            if (stored != null) {
                for (PageVersion version : stored) {
                    result.add(new PageVersion(version));
                }
            }
            return result;
        }

        @Nullable
        @Override
        public PageVersion getVersion(@NotNull String pageId, int versionNumber) {
            List<PageVersion> stored = state.versions.get(pageId);
            if (stored == null || versionNumber < 1 || versionNumber > stored.size()) {
                return null;
            }
            return new PageVersion(stored.get(versionNumber - 1));
        }

        @Override
        public void addVersion(@NotNull PageVersion version) throws ContentException {
            checkWritable();
            checkNotNull(version.getContent());
            String pageId = version.getPageId();
            if (!state.pages.containsKey(pageId)) {
                throw new ContentException(NOT_FOUND, 2, "Page " + pageId + " not found");
            }
            List<PageVersion> stored = state.versions.get(pageId);
            int expected = stored == null ? 1 : stored.size() + 1;
            if (version.getVersionNumber() != expected) {
                throw new ContentException(CONFLICT, 4, "Version " + version.getVersionNumber()
                        + " of page " + pageId + " is out of sequence, expected " + expected);
            }
            List<PageVersion> updated = newArrayList();
            if (stored != null) {
                updated.addAll(stored);
            }
            updated.add(new PageVersion(version));
            state.versions.put(pageId, Collections.unmodifiableList(updated));
        }

        //-------------------------------------------------------< sync >---

        @Nullable
        @Override
        public GitSyncConfig getSyncConfig(@NotNull String configId) {
            GitSyncConfig config = state.configs.get(configId);
            return config == null ? null : new GitSyncConfig(config);
        }

        @Nullable
        @Override
        public GitSyncConfig getSyncConfigForSpace(@NotNull String spaceId) {
            String id = state.configBySpace.get(spaceId);
            return id == null ? null : getSyncConfig(id);
        }

        @NotNull
        @Override
        public List<GitSyncConfig> getSyncConfigs() {
            List<GitSyncConfig> result = newArrayList();
            for (GitSyncConfig config : state.configs.values()) {
                result.add(new GitSyncConfig(config));
            }
            return result;
        }

        @Override
        public void putSyncConfig(@NotNull GitSyncConfig config) throws ContentException {
            checkWritable();
            checkNotNull(config.getId());
            checkNotNull(config.getSpaceId());
            String existing = state.configBySpace.get(config.getSpaceId());
            if (existing != null && !existing.equals(config.getId())) {
                throw new ContentException(CONFLICT, 5, "Space " + config.getSpaceId()
                        + " is already bound to a repository");
            }
            GitSyncConfig previous = state.configs.get(config.getId());
            if (previous != null && !previous.getSpaceId().equals(config.getSpaceId())) {
                throw new ContentException(VALIDATION, 10, "Sync config " + config.getId()
                        + " can not change its space");
            }
            state.configBySpace.put(config.getSpaceId(), config.getId());
            state.configs.put(config.getId(), new GitSyncConfig(config));
        }

        @Nullable
        @Override
        public GitCommitRecord getCommit(@NotNull String configId, @NotNull String sha) {
            GitCommitRecord commit = state.commits.get(commitKey(configId, sha));
            return commit == null ? null : new GitCommitRecord(commit);
        }

        @NotNull
        @Override
        public List<GitCommitRecord> getCommits(@NotNull String configId) {
            List<GitCommitRecord> result = newArrayList();
            for (GitCommitRecord commit : state.commits.values()) {
                if (commit.getConfigId().equals(configId)) {
                    result.add(new GitCommitRecord(commit));
                }
            }
            return result;
        }

        @Override
        public void putCommit(@NotNull GitCommitRecord commit) throws ContentException {
            checkWritable();
            checkNotNull(commit.getId());
            checkNotNull(commit.getSha());
            if (!state.configs.containsKey(commit.getConfigId())) {
                throw new ContentException(NOT_FOUND, 3, "Sync config " + commit.getConfigId() + " not found");
            }
            String key = commitKey(commit.getConfigId(), commit.getSha());
            GitCommitRecord existing = state.commits.get(key);
            if (existing != null && !existing.getId().equals(commit.getId())) {
                throw new ContentException(CONFLICT, 6, "Commit " + commit.getSha()
                        + " is already recorded for sync config " + commit.getConfigId());
            }
            state.commits.put(key, new GitCommitRecord(commit));
        }

        @NotNull
        @Override
        public List<GitBranch> getBranches(@NotNull String configId) {
            List<GitBranch> result = newArrayList();
            for (GitBranch branch : state.branches.values()) {
                if (branch.getConfigId().equals(configId)) {
                    result.add(new GitBranch(branch));
                }
            }
            return result;
        }

        @Nullable
        @Override
        public GitBranch getBranch(@NotNull String configId, @NotNull String name) {
            for (GitBranch branch : state.branches.values()) {
                if (branch.getConfigId().equals(configId) && branch.getName().equals(name)) {
                    return new GitBranch(branch);
                }
            }
            return null;
        }

        @Override
        public void putBranch(@NotNull GitBranch branch) throws ContentException {
            checkWritable();
            checkNotNull(branch.getId());
            checkNotNull(branch.getName());
            if (!state.configs.containsKey(branch.getConfigId())) {
                throw new ContentException(NOT_FOUND, 3, "Sync config " + branch.getConfigId() + " not found");
            }
            GitBranch sameName = getBranch(branch.getConfigId(), branch.getName());
            if (sameName != null && !sameName.getId().equals(branch.getId())) {
                throw new ContentException(CONFLICT, 7, "Branch " + branch.getName() + " already exists");
            }
            GitBranch stored = new GitBranch(branch);
            GitBranch previous = state.branches.get(branch.getId());
            List<GitBranch> siblings = getBranches(branch.getConfigId());
            if (siblings.isEmpty() || (siblings.size() == 1 && previous != null)) {
                stored.setDefaultBranch(true);
            } else if (stored.isDefaultBranch()) {
                for (GitBranch other : siblings) {
                    if (other.isDefaultBranch() && !other.getId().equals(stored.getId())) {
                        other.setDefaultBranch(false);
                        state.branches.put(other.getId(), other);
                    }
                }
            } else if (previous != null && previous.isDefaultBranch()) {
                throw new ContentException(VALIDATION, 11, "Branch " + branch.getName()
                        + " is the default branch; make another branch the default instead");
            }
            state.branches.put(stored.getId(), stored);
        }

        @Nullable
        @Override
        public SyncHistory getSyncHistory(@NotNull String historyId) {
            SyncHistory history = state.histories.get(historyId);
            return history == null ? null : new SyncHistory(history);
        }

        @NotNull
        @Override
        public List<SyncHistory> getSyncHistories(@NotNull String configId) {
            List<SyncHistory> result = newArrayList();
            for (SyncHistory history : state.histories.values()) {
                if (history.getConfigId().equals(configId)) {
                    result.add(new SyncHistory(history));
                }
            }
            // insertion order is start order
            Collections.reverse(result);
            return result;
        }

        @Override
        public void putSyncHistory(@NotNull SyncHistory history) throws ContentException {
            checkWritable();
            checkNotNull(history.getId());
            if (!state.configs.containsKey(history.getConfigId())) {
                throw new ContentException(NOT_FOUND, 3, "Sync config " + history.getConfigId() + " not found");
            }
            SyncHistory previous = state.histories.get(history.getId());
            if (previous != null && previous.isCompleted()) {
                throw new ContentException(CONFLICT, 8, "Sync history " + history.getId() + " is completed");
            }
            state.histories.put(history.getId(), new SyncHistory(history));
        }

        //----------------------------------------------------< reviews >---

        @Nullable
        @Override
        public ChangeRequest getChangeRequest(@NotNull String changeRequestId) {
            ChangeRequest cr = state.changeRequests.get(changeRequestId);
            return cr == null ? null : new ChangeRequest(cr);
        }

        @NotNull
        @Override
        public List<ChangeRequest> getChangeRequests(@NotNull String spaceId) {
            List<ChangeRequest> result = newArrayList();
            for (ChangeRequest cr : state.changeRequests.values()) {
                if (cr.getSpaceId().equals(spaceId)) {
                    result.add(new ChangeRequest(cr));
                }
            }
            return result;
        }

        @Override
        public void putChangeRequest(@NotNull ChangeRequest changeRequest) {
            checkWritable();
            checkNotNull(changeRequest.getId());
            state.changeRequests.put(changeRequest.getId(), new ChangeRequest(changeRequest));
        }

        @Nullable
        @Override
        public ChangeRequestChange getChange(@NotNull String changeId) {
            ChangeRequestChange change = state.changes.get(changeId);
            return change == null ? null : new ChangeRequestChange(change);
        }

        @NotNull
        @Override
        public List<ChangeRequestChange> getChanges(@NotNull String changeRequestId) {
            List<ChangeRequestChange> result = newArrayList();
            for (ChangeRequestChange change : state.changes.values()) {
                if (change.getChangeRequestId().equals(changeRequestId)) {
                    result.add(new ChangeRequestChange(change));
                }
            }
            return result;
        }

        @Override
        public void putChange(@NotNull ChangeRequestChange change) throws ContentException {
            checkWritable();
            checkNotNull(change.getId());
            if (!state.changeRequests.containsKey(change.getChangeRequestId())) {
                throw new ContentException(NOT_FOUND, 4, "Change request " + change.getChangeRequestId()
                        + " not found");
            }
            state.changes.put(change.getId(), new ChangeRequestChange(change));
        }

        @Override
        public void removeChange(@NotNull String changeId) {
            checkWritable();
            state.changes.remove(changeId);
        }

        @Nullable
        @Override
        public Review getReview(@NotNull String changeRequestId, @NotNull String reviewerId) {
            Review review = state.reviews.get(reviewKey(changeRequestId, reviewerId));
            return review == null ? null : new Review(review);
        }

        @NotNull
        @Override
        public List<Review> getReviews(@NotNull String changeRequestId) {
            List<Review> result = newArrayList();
            for (Review review : state.reviews.values()) {
                if (review.getChangeRequestId().equals(changeRequestId)) {
                    result.add(new Review(review));
                }
            }
            return result;
        }

        @Override
        public void putReview(@NotNull Review review) throws ContentException {
            checkWritable();
            if (!state.changeRequests.containsKey(review.getChangeRequestId())) {
                throw new ContentException(NOT_FOUND, 4, "Change request " + review.getChangeRequestId()
                        + " not found");
            }
            String key = reviewKey(review.getChangeRequestId(), review.getReviewerId());
            Review stored = new Review(review);
            Review previous = state.reviews.get(key);
            if (previous != null) {
                stored.setId(previous.getId());
            }
            checkNotNull(stored.getId());
            state.reviews.put(key, stored);
        }

        @Nullable
        @Override
        public ChangeRequestComment getComment(@NotNull String commentId) {
            ChangeRequestComment comment = state.comments.get(commentId);
            return comment == null ? null : new ChangeRequestComment(comment);
        }

        @NotNull
        @Override
        public List<ChangeRequestComment> getComments(@NotNull String changeRequestId) {
            List<ChangeRequestComment> result = newArrayList();
            for (ChangeRequestComment comment : state.comments.values()) {
                if (comment.getChangeRequestId().equals(changeRequestId)) {
                    result.add(new ChangeRequestComment(comment));
                }
            }
            return result;
        }

        @Override
        public void putComment(@NotNull ChangeRequestComment comment) throws ContentException {
            checkWritable();
            checkNotNull(comment.getId());
            if (!state.changeRequests.containsKey(comment.getChangeRequestId())) {
                throw new ContentException(NOT_FOUND, 4, "Change request " + comment.getChangeRequestId()
                        + " not found");
            }
            state.comments.put(comment.getId(), new ChangeRequestComment(comment));
        }

        @Nullable
        @Override
        public ReviewPolicy getReviewPolicy(@NotNull String spaceId) {
            return state.policies.get(spaceId);
        }

        @Override
        public void putReviewPolicy(@NotNull ReviewPolicy policy) {
            checkWritable();
            state.policies.put(policy.getSpaceId(), policy);
        }
    }
}
