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

package org.docsync.api.review;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import org.docsync.api.content.ContentBlock;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A block level difference between two versions of a page. The location is
 * the slash separated index path of the block, e.g. {@code 2/0} for the first
 * child of the third top level block, in the old tree for removals and in
 * the new tree otherwise.
 */
public final class BlockDiff {

    public enum Kind {
        ADDED,
        REMOVED,
        MODIFIED
    }

    private final Kind kind;

    private final String location;

    private final ContentBlock before;

    private final ContentBlock after;

    public BlockDiff(@NotNull Kind kind, @NotNull String location,
                     @Nullable ContentBlock before, @Nullable ContentBlock after) {
        this.kind = kind;
        this.location = location;
        this.before = before;
        this.after = after;
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    @NotNull
    public String getLocation() {
        return location;
    }

    @Nullable
    public ContentBlock getBefore() {
        return before;
    }

    @Nullable
    public ContentBlock getAfter() {
        return after;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof BlockDiff)) {
            return false;
        }
        BlockDiff that = (BlockDiff) other;
        return kind == that.kind && location.equals(that.location)
                && Objects.equals(before, that.before) && Objects.equals(after, that.after);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, location, before, after);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("kind", kind)
                .add("location", location)
                .toString();
    }
}
