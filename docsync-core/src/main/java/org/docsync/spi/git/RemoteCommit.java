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

package org.docsync.spi.git;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A commit as reported by the repository.
 */
public final class RemoteCommit {

    private final String sha;

    private final String parentSha;

    private final String message;

    private final String author;

    private final long timestamp;

    private final ImmutableList<FileChange> changes;

    public RemoteCommit(@NotNull String sha, @Nullable String parentSha, @NotNull String message,
                        @NotNull String author, long timestamp, @NotNull List<FileChange> changes) {
        this.sha = sha;
        this.parentSha = parentSha;
        this.message = message;
        this.author = author;
        this.timestamp = timestamp;
        this.changes = ImmutableList.copyOf(changes);
    }

    @NotNull
    public String getSha() {
        return sha;
    }

    @Nullable
    public String getParentSha() {
        return parentSha;
    }

    @NotNull
    public String getMessage() {
        return message;
    }

    @NotNull
    public String getAuthor() {
        return author;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @NotNull
    public ImmutableList<FileChange> getChanges() {
        return changes;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sha", sha)
                .add("message", message)
                .add("changes", changes)
                .toString();
    }
}
