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

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * A file touched by a commit.
 */
public final class FileChange {

    public enum Kind {
        ADDED,
        MODIFIED,
        DELETED
    }

    private final String path;

    private final Kind kind;

    public FileChange(@NotNull String path, @NotNull Kind kind) {
        this.path = checkNotNull(path);
        this.kind = checkNotNull(kind);
    }

    @NotNull
    public String getPath() {
        return path;
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof FileChange)) {
            return false;
        }
        FileChange that = (FileChange) other;
        return path.equals(that.path) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, kind);
    }

    @Override
    public String toString() {
        return kind + " " + path;
    }
}
