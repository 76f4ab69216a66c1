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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A file to write with a new commit. A {@code null} content deletes the file.
 */
public final class CommitFile {

    private final String path;

    private final String content;

    private CommitFile(String path, String content) {
        this.path = checkNotNull(path);
        this.content = content;
    }

    public static CommitFile write(@NotNull String path, @NotNull String content) {
        return new CommitFile(path, checkNotNull(content));
    }

    public static CommitFile delete(@NotNull String path) {
        return new CommitFile(path, null);
    }

    @NotNull
    public String getPath() {
        return path;
    }

    @Nullable
    public String getContent() {
        return content;
    }

    public boolean isDeletion() {
        return content == null;
    }

    @Override
    public String toString() {
        return (isDeletion() ? "delete " : "write ") + path;
    }
}
