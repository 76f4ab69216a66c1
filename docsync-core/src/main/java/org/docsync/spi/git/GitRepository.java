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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The external version control repository a space is bound to. The engine
 * does not assume any particular hosting service.
 */
public interface GitRepository {

    /**
     * Returns the commits of a branch after {@code sinceSha}, oldest first.
     *
     * @param sinceSha the last known commit, or {@code null} for the whole
     *                 history of the branch
     * @throws GitRepositoryException NOT_FOUND if the branch or {@code sinceSha}
     *         is unknown
     */
    @NotNull
    List<RemoteCommit> fetchCommits(@NotNull String branch, @Nullable String sinceSha)
            throws GitRepositoryException;

    /**
     * Returns the content of a file at a commit or branch, or {@code null} if
     * the file does not exist there.
     */
    @Nullable
    String getFileContents(@NotNull String path, @NotNull String ref) throws GitRepositoryException;

    /**
     * Creates a commit on a branch.
     *
     * @param expectedHead the head the branch must have, {@code null} to skip
     *                     the check
     * @return the sha of the new commit
     * @throws GitRepositoryException REJECTED if the branch head moved or the
     *         commit is refused
     */
    @NotNull
    String createCommit(@NotNull String branch, @Nullable String expectedHead, @NotNull List<CommitFile> files,
                        @NotNull String message, @NotNull String author) throws GitRepositoryException;

    /**
     * Registers a push notification hook.
     *
     * @return the id of the hook
     */
    @NotNull
    String registerWebhook(@NotNull String url, @NotNull String secret) throws GitRepositoryException;
}
