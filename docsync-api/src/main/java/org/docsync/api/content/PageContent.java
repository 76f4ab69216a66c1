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

package org.docsync.api.content;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

/**
 * Immutable snapshot of a page: its title and its ordered tree of blocks.
 * This is the unit of versioning, diffing, three-way comparison and the
 * file mapping.
 */
public final class PageContent {

    private final String title;

    private final ImmutableList<ContentBlock> blocks;

    public PageContent(@NotNull String title, @NotNull List<ContentBlock> blocks) {
        this.title = checkNotNull(title);
        this.blocks = ImmutableList.copyOf(blocks);
    }

    public static PageContent of(@NotNull String title, ContentBlock... blocks) {
        return new PageContent(title, Arrays.asList(blocks));
    }

    @NotNull
    public String getTitle() {
        return title;
    }

    @NotNull
    public ImmutableList<ContentBlock> getBlocks() {
        return blocks;
    }

    public PageContent withTitle(@NotNull String title) {
        return new PageContent(title, blocks);
    }

    /**
     * Number of blocks in the tree, nested blocks included.
     */
    public int getBlockCount() {
        return count(blocks);
    }

    private static int count(List<ContentBlock> blocks) {
        int n = 0;
        for (ContentBlock block : blocks) {
            n += 1 + count(block.getChildren());
        }
        return n;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PageContent)) {
            return false;
        }
        PageContent that = (PageContent) other;
        return title.equals(that.title) && blocks.equals(that.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, blocks);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("title", title)
                .add("blocks", blocks)
                .toString();
    }
}
