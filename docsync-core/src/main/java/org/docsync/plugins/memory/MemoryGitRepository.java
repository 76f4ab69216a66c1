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
import static com.google.common.collect.Lists.newArrayList;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import org.docsync.spi.git.CommitFile;
import org.docsync.spi.git.FileChange;
import org.docsync.spi.git.GitRepository;
import org.docsync.spi.git.GitRepositoryException;
import org.docsync.spi.git.GitRepositoryException.Reason;
import org.docsync.spi.git.RemoteCommit;
import org.docsync.stats.Clock;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory repository. Every commit keeps a full snapshot of the file tree,
 * so files can be read at any commit. Failures can be injected with
 * {@link #failNext(int, Reason)}. Useful for testing.
 */
public class MemoryGitRepository implements GitRepository {

    private static final class Commit {

        final RemoteCommit info;

        final ImmutableSortedMap<String, String> tree;

        Commit(RemoteCommit info, ImmutableSortedMap<String, String> tree) {
            this.info = info;
            this.tree = tree;
        }
    }

    private final Clock clock;

    private final Map<String, List<Commit>> branches = new LinkedHashMap<String, List<Commit>>();

    private final Map<String, Commit> commits = new LinkedHashMap<String, Commit>();

    private final Map<String, String> webhooks = new LinkedHashMap<String, String>();

    private final Deque<Reason> failures = new ArrayDeque<Reason>();

    private int calls;

    public MemoryGitRepository() {
        this(Clock.SIMPLE);
    }

    public MemoryGitRepository(@NotNull Clock clock) {
        this.clock = checkNotNull(clock);
    }

    /**
     * Commits files to a branch, creating the branch if needed. A {@code null}
     * value deletes the file.
     *
     * @return the sha of the new commit
     */
    @NotNull
    public synchronized String commit(@NotNull String branch, @NotNull Map<String, String> files,
                                      @NotNull String message) {
        List<CommitFile> list = newArrayList();
        for (Map.Entry<String, String> e : files.entrySet()) {
            list.add(e.getValue() == null
                    ? CommitFile.delete(e.getKey())
                    : CommitFile.write(e.getKey(), e.getValue()));
        }
        return doCommit(branch, list, message, "test");
    }

    /**
     * Makes the next {@code count} calls fail with the given reason.
     */
    public synchronized void failNext(int count, @NotNull Reason reason) {
        for (int i = 0; i < count; i++) {
            failures.add(reason);
        }
    }

    /**
     * Number of calls made through the {@link GitRepository} interface.
     */
    public synchronized int getCallCount() {
        return calls;
    }

    @Nullable
    public synchronized String getHead(@NotNull String branch) {
        List<Commit> history = branches.get(branch);
        return history == null || history.isEmpty() ? null : history.get(history.size() - 1).info.getSha();
    }

    /**
     * Files at the head of a branch.
     */
    @NotNull
    public synchronized SortedMap<String, String> getFiles(@NotNull String branch) {
        List<Commit> history = branches.get(branch);
        if (history == null || history.isEmpty()) {
            return ImmutableSortedMap.of();
        }
        return history.get(history.size() - 1).tree;
    }

    @NotNull
    public synchronized Map<String, String> getWebhooks() {
        return Collections.unmodifiableMap(new LinkedHashMap<String, String>(webhooks));
    }

    //----------------------------------------------------< GitRepository >---

    @NotNull
    @Override
    public synchronized List<RemoteCommit> fetchCommits(@NotNull String branch, @Nullable String sinceSha)
            throws GitRepositoryException {
        enter();
        List<Commit> history = branches.get(branch);
        if (history == null) {
            throw new GitRepositoryException(Reason.NOT_FOUND, "Unknown branch " + branch);
        }
        int start = 0;
        if (sinceSha != null) {
            start = -1;
            for (int i = 0; i < history.size(); i++) {
                if (history.get(i).info.getSha().equals(sinceSha)) {
                    start = i + 1;
                    break;
                }
            }
            if (start < 0) {
                throw new GitRepositoryException(Reason.NOT_FOUND,
                        "Commit " + sinceSha + " is not on branch " + branch);
            }
        }
        ImmutableList.Builder<RemoteCommit> result = ImmutableList.builder();
        for (Commit commit : history.subList(start, history.size())) {
            result.add(commit.info);
        }
        return result.build();
    }

    @Nullable
    @Override
    public synchronized String getFileContents(@NotNull String path, @NotNull String ref)
            throws GitRepositoryException {
        enter();
        Commit commit = commits.get(ref);
        if (commit == null) {
            List<Commit> history = branches.get(ref);
            if (history == null) {
                throw new GitRepositoryException(Reason.NOT_FOUND, "Unknown ref " + ref);
            }
            if (history.isEmpty()) {
                return null;
            }
            commit = history.get(history.size() - 1);
        }
        return commit.tree.get(path);
    }

    @NotNull
    @Override
    public synchronized String createCommit(@NotNull String branch, @Nullable String expectedHead,
                                            @NotNull List<CommitFile> files, @NotNull String message,
                                            @NotNull String author) throws GitRepositoryException {
        enter();
        String head = getHead(branch);
        if (expectedHead != null && !expectedHead.equals(head)) {
            throw new GitRepositoryException(Reason.REJECTED,
                    "Branch " + branch + " is at " + head + ", expected " + expectedHead);
        }
        if (files.isEmpty()) {
            throw new GitRepositoryException(Reason.REJECTED, "Empty commit");
        }
        return doCommit(branch, files, message, author);
    }

    @NotNull
    @Override
    public synchronized String registerWebhook(@NotNull String url, @NotNull String secret)
            throws GitRepositoryException {
        enter();
        String id = "hook-" + (webhooks.size() + 1);
        webhooks.put(id, url);
        return id;
    }

    //------------------------------------------------------------< internal >---

    private void enter() throws GitRepositoryException {
        calls++;
        Reason failure = failures.poll();
        if (failure != null) {
            throw new GitRepositoryException(failure, "Injected failure: " + failure);
        }
    }

    private String doCommit(String branch, List<CommitFile> files, String message, String author) {
        List<Commit> history = branches.get(branch);
        if (history == null) {
            history = newArrayList();
            branches.put(branch, history);
        }
        Commit parent = history.isEmpty() ? null : history.get(history.size() - 1);
        SortedMap<String, String> tree = new TreeMap<String, String>();
        if (parent != null) {
            tree.putAll(parent.tree);
        }
        List<FileChange> changes = newArrayList();
        for (CommitFile file : files) {
            boolean existed = tree.containsKey(file.getPath());
            if (file.isDeletion()) {
                if (existed) {
                    tree.remove(file.getPath());
                    changes.add(new FileChange(file.getPath(), FileChange.Kind.DELETED));
                }
            } else {
                tree.put(file.getPath(), file.getContent());
                changes.add(new FileChange(file.getPath(),
                        existed ? FileChange.Kind.MODIFIED : FileChange.Kind.ADDED));
            }
        }
        String parentSha = parent == null ? null : parent.info.getSha();
        Hasher hasher = Hashing.sha1().newHasher()
                .putString(branch, StandardCharsets.UTF_8)
                .putString(String.valueOf(parentSha), StandardCharsets.UTF_8)
                .putString(message, StandardCharsets.UTF_8)
                .putInt(commits.size());
        for (Map.Entry<String, String> e : tree.entrySet()) {
            hasher.putString(e.getKey(), StandardCharsets.UTF_8).putString(e.getValue(), StandardCharsets.UTF_8);
        }
        String sha = hasher.hash().toString();
        RemoteCommit info = new RemoteCommit(sha, parentSha, message, author, clock.getTime(), changes);
        Commit commit = new Commit(info, ImmutableSortedMap.copyOfSorted(tree));
        history.add(commit);
        commits.put(sha, commit);
        return sha;
    }

    @Override
    public String toString() {
        return "MemoryGitRepository" + branches.keySet();
    }
}
